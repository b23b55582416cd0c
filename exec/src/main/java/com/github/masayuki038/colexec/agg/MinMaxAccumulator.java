package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.ColumnType;
import org.apache.arrow.vector.FieldVector;

import java.util.Arrays;

/**
 * MIN and MAX under the column type's total order. On ties the first value seen stays.
 */
class MinMaxAccumulator extends GroupedAccumulator {

  private final ColumnType type;
  private final boolean max;
  private Object[] values = new Object[0];

  MinMaxAccumulator(AggregateCall call, int inputColumn, ColumnType type, boolean max) {
    super(call, inputColumn, type);
    this.type = type;
    this.max = max;
  }

  @Override
  public void accumulate(Batch batch, int[] groups, int length) {
    FieldVector vector = batch.column(inputColumn);
    for (int i = 0; i < length; i++) {
      int row = batch.rowIndex(i);
      if (vector.isNull(row)) {
        continue;
      }
      int group = groups[i];
      Object value = type.get(vector, row);
      Object current = values[group];
      if (current == null) {
        values[group] = value;
      } else {
        int c = type.compare(value, current);
        if (max ? c > 0 : c < 0) {
          values[group] = value;
        }
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
