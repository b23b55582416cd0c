package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.operator.Operator;
import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.BatchSchema;
import com.github.masayuki038.colexec.vector.ColumnType;
import com.google.common.base.Preconditions;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;

import java.util.List;

/**
 * Shared plumbing of the aggregators: validation, group key access, output batch.
 */
public abstract class AbstractAggregator implements Operator {

  protected final Operator input;
  protected final AggregatorSpec spec;
  protected final int[] groupColumns;
  protected final ColumnType[] groupTypes;
  protected final GroupedAccumulator[] accumulators;
  /** Initial size of {@link #groups}; input batches may be longer. */
  protected final int inputBatchSize;
  protected final int outputBatchSize;

  private final BufferAllocator allocator;

  /** Group handle of each logical row of the batch being accumulated. */
  protected int[] groups;

  protected Batch output;
  protected boolean initialized;

  protected AbstractAggregator(Operator input, List<ColumnType> columnTypes,
                               List<AggregateCall> calls, int[] groupColumns,
                               int inputBatchSize, int outputBatchSize,
                               BufferAllocator allocator) throws InvalidAggregationException {
    if (!input.schema().types().equals(columnTypes)) {
      throw new InvalidAggregationException("column types " + columnTypes
        + " do not match input " + input.schema().types());
    }
    if (inputBatchSize < 1 || outputBatchSize < 1) {
      throw new InvalidAggregationException("batch sizes must be positive: input="
        + inputBatchSize + ", output=" + outputBatchSize);
    }
    this.input = input;
    this.spec = AggregatorSpec.of(input.schema(), calls, groupColumns);
    this.groupColumns = spec.getGroupColumns();
    this.groupTypes = new ColumnType[this.groupColumns.length];
    for (int i = 0; i < this.groupColumns.length; i++) {
      groupTypes[i] = input.schema().type(this.groupColumns[i]);
    }
    this.accumulators = spec.newAccumulators();
    this.inputBatchSize = inputBatchSize;
    this.outputBatchSize = outputBatchSize;
    this.allocator = allocator;
    this.groups = new int[inputBatchSize];
  }

  @Override
  public BatchSchema schema() {
    return spec.getOutputSchema();
  }

  public AggregatorSpec getSpec() {
    return spec;
  }

  public int getInputBatchSize() {
    return inputBatchSize;
  }

  public int getOutputBatchSize() {
    return outputBatchSize;
  }

  @Override
  public void init() {
    Preconditions.checkState(!initialized, "already initialized");
    input.init();
    if (output == null) {
      output = spec.getOutputSchema().newBatch(allocator, outputBatchSize);
    }
    initialized = true;
  }

  @Override
  public void reset() {
    input.reset();
    for (GroupedAccumulator accumulator : accumulators) {
      accumulator.reset();
    }
    initialized = false;
  }

  @Override
  public void close() {
    if (output != null) {
      output.close();
      output = null;
    }
    input.close();
  }

  protected void ensureRowCapacity(int length) {
    if (groups.length < length) {
      groups = new int[length];
    }
  }

  /**
   * Copies the group key of a physical row out of the batch.
   */
  protected Object[] readKey(Batch batch, int row) {
    Object[] key = new Object[groupColumns.length];
    for (int k = 0; k < groupColumns.length; k++) {
      key[k] = groupTypes[k].get(batch.column(groupColumns[k]), row);
    }
    return key;
  }

  /**
   * Compares the group key of a physical row with a stored key, value by value.
   */
  protected boolean keyEquals(Batch batch, int row, Object[] key) {
    for (int k = 0; k < groupColumns.length; k++) {
      Object value = groupTypes[k].get(batch.column(groupColumns[k]), row);
      if (!groupTypes[k].keyEquals(value, key[k])) {
        return false;
      }
    }
    return true;
  }

  /**
   * Writes one output row: the key, then every call's result for {@code group}.
   */
  protected void writeRow(int row, Object[] key, int group) {
    for (int k = 0; k < key.length; k++) {
      output.set(k, row, key[k]);
    }
    for (int i = 0; i < accumulators.length; i++) {
      FieldVector vector = output.column(groupColumns.length + i);
      accumulators[i].output(group, vector, row);
    }
  }

  protected void accumulate(Batch batch, int length, int groupCount) {
    for (GroupedAccumulator accumulator : accumulators) {
      accumulator.ensureCapacity(groupCount);
      accumulator.accumulate(batch, groups, length);
    }
  }
}
