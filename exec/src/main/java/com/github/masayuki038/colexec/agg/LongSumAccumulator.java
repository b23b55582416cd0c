package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.ColumnType;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.FieldVector;

import java.util.Arrays;

/**
 * SUM and SUM_INT over integer input, as a 64-bit integer.
 */
class LongSumAccumulator extends GroupedAccumulator {

  private long[] sums = new long[0];
  private boolean[] seen = new boolean[0];

  LongSumAccumulator(AggregateCall call, int inputColumn) {
    super(call, inputColumn, ColumnType.BIGINT);
  }

  @Override
  public void accumulate(Batch batch, int[] groups, int length) {
    BaseIntVector vector = (BaseIntVector) batch.column(inputColumn);
    for (int i = 0; i < length; i++) {
      int row = batch.rowIndex(i);
      if (vector.isNull(row)) {
        continue;
      }
      int group = groups[i];
      try {
        sums[group] = Math.addExact(sums[group], vector.getValueAsLong(row));
      } catch (ArithmeticException e) {
        throw new AggregationOverflowException(call + ": integer out of range");
      }
      seen[group] = true;
    }
  }

  @Override
  public void output(int group, FieldVector vector, int row) {
    if (seen[group]) {
      ((BigIntVector) vector).setSafe(row, sums[group]);
    } else {
      ((BigIntVector) vector).setNull(row);
    }
  }

  @Override
  protected void grow(int newCapacity) {
    sums = Arrays.copyOf(sums, newCapacity);
    seen = Arrays.copyOf(seen, newCapacity);
  }

  @Override
  protected void move(int from, int to) {
    sums[to] = sums[from];
    seen[to] = seen[from];
  }

  @Override
  protected void clear(int group) {
    sums[group] = 0;
    seen[group] = false;
  }
}
