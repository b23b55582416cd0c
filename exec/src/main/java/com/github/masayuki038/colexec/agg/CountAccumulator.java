package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.ColumnType;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.FieldVector;

import java.util.Arrays;

/**
 * COUNT and COUNT_ROWS.
 */
class CountAccumulator extends GroupedAccumulator {

  private final boolean countRows;
  private long[] counts = new long[0];

  CountAccumulator(AggregateCall call, int inputColumn, boolean countRows) {
    super(call, inputColumn, ColumnType.BIGINT);
    this.countRows = countRows;
  }

  @Override
  public void accumulate(Batch batch, int[] groups, int length) {
    if (countRows) {
      for (int i = 0; i < length; i++) {
        counts[groups[i]]++;
      }
      return;
    }
    FieldVector vector = batch.column(inputColumn);
    for (int i = 0; i < length; i++) {
      if (!vector.isNull(batch.rowIndex(i))) {
        counts[groups[i]]++;
      }
    }
  }

  @Override
  public void output(int group, FieldVector vector, int row) {
    ((BigIntVector) vector).setSafe(row, counts[group]);
  }

  @Override
  protected void grow(int newCapacity) {
    counts = Arrays.copyOf(counts, newCapacity);
  }

  @Override
  protected void move(int from, int to) {
    counts[to] = counts[from];
  }

  @Override
  protected void clear(int group) {
    counts[group] = 0;
  }
}
