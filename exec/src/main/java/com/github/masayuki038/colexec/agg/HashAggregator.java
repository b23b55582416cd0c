package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.operator.Operator;
import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.ColumnType;
import com.google.common.base.Preconditions;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Aggregator with no ordering assumption on its input.
 *
 * <p>The whole input is consumed on the first {@link #next()}. Each distinct key gets a group
 * handle, assigned in discovery order; a fixed array of buckets maps a key hash to a chain of
 * handles, and a probe compares full key values, so keys sharing a bucket never share a handle.
 * Groups are then emitted in handle order. Memory grows with the number of distinct keys.
 */
public class HashAggregator extends AbstractAggregator {

  private static final Logger logger = LoggerFactory.getLogger(HashAggregator.class);

  private static final int NO_GROUP = -1;

  enum State {
    /** Consuming input into the table. */
    BUILDING,
    /** Input exhausted, nothing emitted yet. */
    DRAINED,
    /** Emitting groups in handle order. */
    EMITTING,
    /** The zero-length batch has been returned. */
    DONE
  }

  /** First handle of each bucket's chain. */
  private final int[] buckets;
  /** Next handle in the chain, per handle. */
  private int[] chain = new int[0];
  /** Key per handle. */
  private final List<Object[]> keys = new ArrayList<>();

  private State state = State.BUILDING;
  private int emitted;

  public HashAggregator(Operator input, List<ColumnType> columnTypes,
                        List<AggregateCall> calls, int[] groupColumns,
                        int inputBatchSize, int outputBatchSize, int bucketCount,
                        BufferAllocator allocator) throws InvalidAggregationException {
    super(input, columnTypes, calls, groupColumns, inputBatchSize, outputBatchSize, allocator);
    if (bucketCount < 1) {
      throw new InvalidAggregationException("bucket count must be positive: " + bucketCount);
    }
    this.buckets = new int[bucketCount];
    Arrays.fill(buckets, NO_GROUP);
  }

  @Override
  public void init() {
    super.init();
    logger.debug("init: groupColumns={}, calls={}, buckets={}, outputBatchSize={}",
      groupColumns.length, spec.getCalls(), buckets.length, outputBatchSize);
  }

  @Override
  public Batch next() {
    Preconditions.checkState(initialized, "not initialized");
    Preconditions.checkState(state != State.DONE, "end of stream already returned");

    if (state == State.BUILDING) {
      for (Batch batch = input.next(); batch.length() != 0; batch = input.next()) {
        build(batch);
      }
      state = State.DRAINED;
      logger.debug("drained: {} groups", keys.size());
    }
    if (state == State.DRAINED) {
      emitted = 0;
      state = State.EMITTING;
    }

    output.reset();
    int n = Math.min(outputBatchSize, keys.size() - emitted);
    if (n == 0) {
      state = State.DONE;
      return output;
    }
    for (int i = 0; i < n; i++) {
      int group = emitted + i;
      writeRow(i, keys.get(group), group);
    }
    output.setLength(n);
    emitted += n;
    return output;
  }

  private void build(Batch batch) {
    int length = batch.length();
    ensureRowCapacity(length);
    for (int i = 0; i < length; i++) {
      groups[i] = findOrInsert(batch, batch.rowIndex(i));
    }
    accumulate(batch, length, keys.size());
  }

  private int findOrInsert(Batch batch, int row) {
    int bucket = bucket(hash(batch, row));
    int last = NO_GROUP;
    for (int group = buckets[bucket]; group != NO_GROUP; group = chain[group]) {
      if (keyEquals(batch, row, keys.get(group))) {
        return group;
      }
      last = group;
    }
    int group = keys.size();
    keys.add(readKey(batch, row));
    if (chain.length <= group) {
      chain = Arrays.copyOf(chain, Math.max(16, chain.length * 2));
    }
    chain[group] = NO_GROUP;
    if (last == NO_GROUP) {
      buckets[bucket] = group;
    } else {
      chain[last] = group;
    }
    return group;
  }

  private int hash(Batch batch, int row) {
    int hash = 1;
    for (int k = 0; k < groupColumns.length; k++) {
      hash = 31 * hash + groupTypes[k].hash(groupTypes[k].get(batch.column(groupColumns[k]), row));
    }
    return hash;
  }

  int bucket(int hash) {
    return Math.floorMod(hash, buckets.length);
  }

  public int getBucketCount() {
    return buckets.length;
  }

  int getGroupCount() {
    return keys.size();
  }

  State getState() {
    return state;
  }

  @Override
  public void reset() {
    super.reset();
    Arrays.fill(buckets, NO_GROUP);
    chain = new int[0];
    keys.clear();
    emitted = 0;
    state = State.BUILDING;
    logger.debug("reset");
  }
}
