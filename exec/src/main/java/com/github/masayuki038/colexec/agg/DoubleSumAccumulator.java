package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.ColumnType;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;

import java.util.Arrays;

/**
 * SUM and AVG over DOUBLE input. AVG divides the sum by the count once, at output.
 */
class DoubleSumAccumulator extends GroupedAccumulator {

  private final boolean average;
  private double[] sums = new double[0];
  private long[] counts = new long[0];

  DoubleSumAccumulator(AggregateCall call, int inputColumn, boolean average) {
    super(call, inputColumn, ColumnType.DOUBLE);
    this.average = average;
  }

  @Override
  public void accumulate(Batch batch, int[] groups, int length) {
    Float8Vector vector = (Float8Vector) batch.column(inputColumn);
    for (int i = 0; i < length; i++) {
      int row = batch.rowIndex(i);
      if (vector.isNull(row)) {
        continue;
      }
      int group = groups[i];
      double value = vector.get(row);
      double sum = sums[group] + value;
      if (Double.isInfinite(sum) && !Double.isInfinite(value) && !Double.isInfinite(sums[group])) {
        throw new AggregationOverflowException(call + ": float out of range");
      }
      sums[group] = sum;
      counts[group]++;
    }
  }

  @Override
  public void output(int group, FieldVector vector, int row) {
    Float8Vector out = (Float8Vector) vector;
    if (counts[group] == 0) {
      out.setNull(row);
    } else if (average) {
      out.setSafe(row, sums[group] / counts[group]);
    } else {
      out.setSafe(row, sums[group]);
    }
  }

  @Override
  protected void grow(int newCapacity) {
    sums = Arrays.copyOf(sums, newCapacity);
    counts = Arrays.copyOf(counts, newCapacity);
  }

  @Override
  protected void move(int from, int to) {
    sums[to] = sums[from];
    counts[to] = counts[from];
  }

  @Override
  protected void clear(int group) {
    sums[group] = 0;
    counts[group] = 0;
  }
}
