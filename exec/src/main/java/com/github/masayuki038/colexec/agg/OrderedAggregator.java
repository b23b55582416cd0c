package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.operator.Operator;
import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.ColumnType;
import com.google.common.base.Preconditions;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Streaming aggregator for input sorted on the group columns.
 *
 * <p>A group ends where the key changes. Completed groups wait in slots
 * {@code [0, groupCount - 1)} until there are enough of them to fill an output batch; the last
 * slot holds the open group, which carries over input and output batch boundaries. At end of
 * input the open group completes and whatever is pending is flushed as a final short batch.
 */
public class OrderedAggregator extends AbstractAggregator {

  private static final Logger logger = LoggerFactory.getLogger(OrderedAggregator.class);

  enum State {
    /** Pulling input into the open group and the pending completed groups. */
    ACCUMULATING,
    /** A full batch of completed groups is ready, or input is exhausted. */
    EMITTING,
    /** The zero-length batch has been returned. */
    DONE
  }

  /** Keys of the slots in use, the open group last. */
  private final List<Object[]> keys = new ArrayList<>();

  private State state = State.ACCUMULATING;
  private boolean inputDone;

  public OrderedAggregator(Operator input, List<ColumnType> columnTypes,
                           List<AggregateCall> calls, int[] groupColumns,
                           int inputBatchSize, int outputBatchSize,
                           BufferAllocator allocator) throws InvalidAggregationException {
    super(input, columnTypes, calls, groupColumns, inputBatchSize, outputBatchSize, allocator);
  }

  @Override
  public void init() {
    super.init();
    logger.debug("init: groupColumns={}, calls={}, outputBatchSize={}",
      groupColumns.length, spec.getCalls(), outputBatchSize);
  }

  @Override
  public Batch next() {
    Preconditions.checkState(initialized, "not initialized");
    Preconditions.checkState(state != State.DONE, "end of stream already returned");

    while (state == State.ACCUMULATING) {
      if (completedGroups() >= outputBatchSize) {
        state = State.EMITTING;
        break;
      }
      Batch batch = input.next();
      if (batch.length() == 0) {
        inputDone = true;
        state = State.EMITTING;
        break;
      }
      consume(batch);
    }

    output.reset();
    int n = Math.min(outputBatchSize, completedGroups());
    if (n == 0) {
      state = State.DONE;
      return output;
    }
    for (int i = 0; i < n; i++) {
      writeRow(i, keys.get(i), i);
    }
    output.setLength(n);

    int used = keys.size();
    for (GroupedAccumulator accumulator : accumulators) {
      accumulator.compact(n, used - n, used);
    }
    keys.subList(0, n).clear();

    if (!inputDone) {
      state = State.ACCUMULATING;
    }
    return output;
  }

  private void consume(Batch batch) {
    int length = batch.length();
    ensureRowCapacity(length);
    for (int i = 0; i < length; i++) {
      int row = batch.rowIndex(i);
      if (keys.isEmpty() || !keyEquals(batch, row, keys.get(keys.size() - 1))) {
        keys.add(readKey(batch, row));
      }
      groups[i] = keys.size() - 1;
    }
    accumulate(batch, length, keys.size());
  }

  /**
   * Groups that can no longer receive rows.
   */
  private int completedGroups() {
    return inputDone ? keys.size() : Math.max(0, keys.size() - 1);
  }

  State getState() {
    return state;
  }

  @Override
  public void reset() {
    super.reset();
    keys.clear();
    inputDone = false;
    state = State.ACCUMULATING;
    logger.debug("reset");
  }
}
