package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.ColumnType;
import org.apache.arrow.vector.FieldVector;

import java.util.Arrays;

/**
 * Keeps the first non-null value seen by each group.
 */
class AnyNotNullAccumulator extends GroupedAccumulator {

  private Object[] values = new Object[0];

  AnyNotNullAccumulator(AggregateCall call, int inputColumn, ColumnType outputType) {
    super(call, inputColumn, outputType);
  }

  @Override
  public void accumulate(Batch batch, int[] groups, int length) {
    FieldVector vector = batch.column(inputColumn);
    ColumnType type = batch.columnType(inputColumn);
    for (int i = 0; i < length; i++) {
      int group = groups[i];
      if (values[group] == null) {
        values[group] = type.get(vector, batch.rowIndex(i));
      }
    }
  }

  @Override
  public void output(int group, FieldVector vector, int row) {
    outputType.set(vector, row, values[group]);
  }

  @Override
  protected void grow(int newCapacity) {
    values = Arrays.copyOf(values, newCapacity);
  }

  @Override
  protected void move(int from, int to) {
    values[to] = values[from];
  }

  @Override
  protected void clear(int group) {
    values[group] = null;
  }
}
