package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.ColumnType;
import com.google.common.base.Preconditions;
import org.apache.arrow.vector.FieldVector;

/**
 * Running state of one aggregate call for many groups at once.
 *
 * <p>Groups are addressed by an integer handle. State for a handle lives in a slot of the
 * accumulator's arrays; the aggregator owns the handle space and tells the accumulator how many
 * slots it needs. An accumulator keeps no reference to a batch beyond the call that passed it.
 */
public abstract class GroupedAccumulator {

  protected final AggregateCall call;
  /** Input column, or -1 for calls without arguments. */
  protected final int inputColumn;
  protected final ColumnType outputType;

  private int capacity;

  protected GroupedAccumulator(AggregateCall call, int inputColumn, ColumnType outputType) {
    this.call = call;
    this.inputColumn = inputColumn;
    this.outputType = outputType;
  }

  public ColumnType getOutputType() {
    return outputType;
  }

  /**
   * Makes slots {@code [0, groupCount)} addressable. New slots start empty.
   */
  public final void ensureCapacity(int groupCount) {
    if (groupCount > capacity) {
      int newCapacity = Math.max(groupCount, Math.max(16, capacity * 2));
      grow(newCapacity);
      capacity = newCapacity;
    }
  }

  /**
   * Folds the first {@code length} logical rows of {@code batch} into their groups;
   * {@code groups[i]} is the handle of logical row {@code i}.
   */
  public abstract void accumulate(Batch batch, int[] groups, int length);

  /**
   * Writes the final result of a group.
   */
  public abstract void output(int group, FieldVector vector, int row);

  /**
   * Moves the groups {@code [from, from + count)} down to {@code [0, count)} and empties every
   * other slot below {@code used}.
   */
  public final void compact(int from, int count, int used) {
    Preconditions.checkArgument(from + count <= used, "compact past used slots");
    for (int i = 0; i < count; i++) {
      move(from + i, i);
    }
    for (int i = count; i < used; i++) {
      clear(i);
    }
  }

  /**
   * Discards all state.
   */
  public void reset() {
    capacity = 0;
    grow(0);
  }

  /**
   * Reallocates slot arrays to {@code newCapacity}, keeping existing slots.
   */
  protected abstract void grow(int newCapacity);

  protected abstract void move(int from, int to);

  protected abstract void clear(int group);

  /**
   * Creates the accumulator for a validated call.
   */
  static GroupedAccumulator create(AggregateCall call, ColumnType inputType, ColumnType outputType) {
    int column = call.getArgList().isEmpty() ? -1 : call.getArgList().get(0);
    switch (call.getFunction()) {
    case ANY_NOT_NULL:
      return new AnyNotNullAccumulator(call, column, outputType);
    case COUNT_ROWS:
      return new CountAccumulator(call, -1, true);
    case COUNT:
      return new CountAccumulator(call, column, false);
    case SUM:
    case SUM_INT:
      switch (outputType) {
      case BIGINT:
        return new LongSumAccumulator(call, column);
      case DOUBLE:
        return new DoubleSumAccumulator(call, column, false);
      default:
        return new DecimalSumAccumulator(call, column, inputType, false);
      }
    case AVG:
      if (outputType == ColumnType.DOUBLE) {
        return new DoubleSumAccumulator(call, column, true);
      }
      return new DecimalSumAccumulator(call, column, inputType, true);
    case MIN:
      return new MinMaxAccumulator(call, column, inputType, false);
    case MAX:
      return new MinMaxAccumulator(call, column, inputType, true);
    default:
      throw new AssertionError("unknown function " + call.getFunction());
    }
  }
}
