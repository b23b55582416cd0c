package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.operator.Operator;
import com.github.masayuki038.colexec.vector.ColumnType;
import org.apache.arrow.memory.BufferAllocator;

import java.util.List;

/**
 * Lets a test build either aggregator from the same parameters.
 */
enum AggregatorKind {

  HASH {
    @Override
    AbstractAggregator create(Operator input, List<ColumnType> columnTypes,
                              List<AggregateCall> calls, int[] groupColumns,
                              int inputBatchSize, int outputBatchSize,
                              BufferAllocator allocator) throws InvalidAggregationException {
      return Aggregators.builder(input, allocator)
        .columnTypes(columnTypes)
        .aggregates(calls)
        .groupBy(groupColumns)
        .inputBatchSize(inputBatchSize)
        .outputBatchSize(outputBatchSize)
        .buildHash();
    }
  },

  ORDERED {
    @Override
    AbstractAggregator create(Operator input, List<ColumnType> columnTypes,
                              List<AggregateCall> calls, int[] groupColumns,
                              int inputBatchSize, int outputBatchSize,
                              BufferAllocator allocator) throws InvalidAggregationException {
      return Aggregators.builder(input, allocator)
        .columnTypes(columnTypes)
        .aggregates(calls)
        .groupBy(groupColumns)
        .inputBatchSize(inputBatchSize)
        .outputBatchSize(outputBatchSize)
        .buildOrdered();
    }
  };

  abstract AbstractAggregator create(Operator input, List<ColumnType> columnTypes,
                                     List<AggregateCall> calls, int[] groupColumns,
                                     int inputBatchSize, int outputBatchSize,
                                     BufferAllocator allocator) throws InvalidAggregationException;
}
