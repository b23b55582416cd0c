package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.config.ExecConfig;
import com.github.masayuki038.colexec.operator.Operator;
import com.github.masayuki038.colexec.vector.ColumnType;
import com.google.common.collect.ImmutableList;
import org.apache.arrow.memory.BufferAllocator;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for building aggregators.
 *
 * <pre>{@code
 * Operator agg = Aggregators.builder(source, allocator)
 *     .columnTypes(ColumnType.BIGINT, ColumnType.DECIMAL)
 *     .groupBy(0)
 *     .aggregate(AggregateFunction.SUM, 1)
 *     .aggregate(AggregateFunction.COUNT_ROWS)
 *     .buildOrdered();
 * }</pre>
 *
 * Batch sizes and the bucket count default to {@link ExecConfig#get()}. The output batch size
 * bounds every emitted batch; the input batch size is a sizing hint, since the input operator
 * chooses its own batch length.
 */
public final class Aggregators {

  private Aggregators() {}

  public static Builder builder(Operator input, BufferAllocator allocator) {
    return new Builder(input, allocator);
  }

  public static OrderedAggregator ordered(Operator input, List<ColumnType> columnTypes,
                                          List<AggregateCall> calls, int[] groupColumns,
                                          BufferAllocator allocator)
      throws InvalidAggregationException {
    return builder(input, allocator).columnTypes(columnTypes).aggregates(calls)
      .groupBy(groupColumns).buildOrdered();
  }

  public static HashAggregator hash(Operator input, List<ColumnType> columnTypes,
                                    List<AggregateCall> calls, int[] groupColumns,
                                    BufferAllocator allocator)
      throws InvalidAggregationException {
    return builder(input, allocator).columnTypes(columnTypes).aggregates(calls)
      .groupBy(groupColumns).buildHash();
  }

  /**
   * Collects construction parameters. Column types default to the input's schema.
   */
  public static class Builder {
    private final Operator input;
    private final BufferAllocator allocator;
    private final List<AggregateCall> calls = new ArrayList<>();
    private List<ColumnType> columnTypes;
    private int[] groupColumns = new int[0];
    private int inputBatchSize;
    private int outputBatchSize;
    private int bucketCount;

    Builder(Operator input, BufferAllocator allocator) {
      this.input = input;
      this.allocator = allocator;
      ExecConfig config = ExecConfig.get();
      this.inputBatchSize = config.getBatchSize();
      this.outputBatchSize = config.getBatchSize();
      this.bucketCount = config.getHashBuckets();
    }

    public Builder columnTypes(List<ColumnType> columnTypes) {
      this.columnTypes = ImmutableList.copyOf(columnTypes);
      return this;
    }

    public Builder columnTypes(ColumnType... columnTypes) {
      return columnTypes(ImmutableList.copyOf(columnTypes));
    }

    public Builder groupBy(int... groupColumns) {
      this.groupColumns = groupColumns.clone();
      return this;
    }

    public Builder aggregate(AggregateFunction function, int... args) {
      calls.add(AggregateCall.of(function, args));
      return this;
    }

    public Builder aggregates(List<AggregateCall> calls) {
      this.calls.addAll(calls);
      return this;
    }

    /**
     * Expected logical length of an input batch. It only sizes per-row scratch space up front;
     * the input operator decides the real batch length and longer batches are still accepted.
     */
    public Builder inputBatchSize(int inputBatchSize) {
      this.inputBatchSize = inputBatchSize;
      return this;
    }

    public Builder outputBatchSize(int outputBatchSize) {
      this.outputBatchSize = outputBatchSize;
      return this;
    }

    public Builder bucketCount(int bucketCount) {
      this.bucketCount = bucketCount;
      return this;
    }

    private List<ColumnType> resolveColumnTypes() {
      return columnTypes != null ? columnTypes : input.schema().types();
    }

    public OrderedAggregator buildOrdered() throws InvalidAggregationException {
      return new OrderedAggregator(input, resolveColumnTypes(), calls, groupColumns,
        inputBatchSize, outputBatchSize, allocator);
    }

    public HashAggregator buildHash() throws InvalidAggregationException {
      return new HashAggregator(input, resolveColumnTypes(), calls, groupColumns,
        inputBatchSize, outputBatchSize, bucketCount, allocator);
    }
  }
}
