package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.ColumnType;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.Decimal256Vector;
import org.apache.arrow.vector.FieldVector;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Arrays;

/**
 * SUM and AVG in the decimal domain. The running sum is exact; AVG divides once at output.
 */
class DecimalSumAccumulator extends GroupedAccumulator {

  /** Significant digits of an average. */
  static final MathContext AVG_CONTEXT = new MathContext(20, RoundingMode.HALF_EVEN);

  private final ColumnType inputType;
  private final boolean average;
  private BigDecimal[] sums = new BigDecimal[0];
  private long[] counts = new long[0];

  DecimalSumAccumulator(AggregateCall call, int inputColumn, ColumnType inputType, boolean average) {
    super(call, inputColumn, ColumnType.DECIMAL);
    this.inputType = inputType;
    this.average = average;
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
      BigDecimal value = read(vector, row);
      sums[group] = sums[group] == null ? value : sums[group].add(value);
      counts[group]++;
    }
  }

  private BigDecimal read(FieldVector vector, int row) {
    if (inputType == ColumnType.DECIMAL) {
      return ((Decimal256Vector) vector).getObject(row);
    }
    return BigDecimal.valueOf(((BaseIntVector) vector).getValueAsLong(row));
  }

  @Override
  public void output(int group, FieldVector vector, int row) {
    BigDecimal sum = sums[group];
    if (sum == null) {
      outputType.set(vector, row, null);
    } else if (average) {
      outputType.set(vector, row, checkRange(sum.divide(BigDecimal.valueOf(counts[group]), AVG_CONTEXT)));
    } else {
      outputType.set(vector, row, checkRange(sum));
    }
  }

  private BigDecimal checkRange(BigDecimal result) {
    BigDecimal stored = result.setScale(ColumnType.DECIMAL_SCALE, RoundingMode.HALF_EVEN);
    if (stored.precision() > ColumnType.DECIMAL_PRECISION) {
      throw new ResultOutOfRangeException(call + ": " + result.toPlainString()
        + " exceeds DECIMAL(" + ColumnType.DECIMAL_PRECISION + ", " + ColumnType.DECIMAL_SCALE + ")");
    }
    return stored;
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
    sums[group] = null;
    counts[group] = 0;
  }
}
