package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.operator.RowSource;
import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.BatchSchema;
import com.github.masayuki038.colexec.vector.ColumnType;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static com.github.masayuki038.colexec.agg.AggregateFunction.SUM;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Batch boundaries of the ordered aggregator
 */
public class OrderedAggregatorTest {

  private BufferAllocator allocator;

  @Before
  public void setUp() {
    allocator = new RootAllocator(Long.MAX_VALUE);
  }

  @After
  public void tearDown() {
    allocator.close();
  }

  private OrderedAggregator sum(long[][] values, int batchSize, int outputBatchSize)
      throws InvalidAggregationException {
    List<Object[]> rows = new ArrayList<>();
    for (long[] v : values) {
      rows.add(new Object[]{v[0], v[1]});
    }
    BatchSchema schema = BatchSchema.of(ColumnType.BIGINT, ColumnType.BIGINT);
    return Aggregators.builder(RowSource.of(schema, rows, batchSize, allocator), allocator)
      .groupBy(0)
      .aggregate(SUM, 1)
      .inputBatchSize(batchSize)
      .outputBatchSize(outputBatchSize)
      .buildOrdered();
  }

  @Test
  public void oneGroupPerOutputBatch() throws Exception {
    long[][] input = {{0, 1}, {0, 1}, {1, 2}, {2, 3}, {2, 3}, {3, 4}, {3, 4}, {4, 5}, {5, 6},
      {6, 7}, {7, 8}};
    try (OrderedAggregator agg = sum(input, 4, 1)) {
      agg.init();
      long[] expected = {2, 2, 6, 8, 5, 6, 7, 8};
      for (int group = 0; group < expected.length; group++) {
        Batch batch = agg.next();
        assertThat(batch.length(), is(1));
        assertThat(batch.get(0, 0), is((Object) (long) group));
        assertThat(batch.get(1, 0), is((Object) expected[group]));
      }
      assertThat(agg.next().length(), is(0));
      assertThat(agg.getState(), is(OrderedAggregator.State.DONE));
    }
  }

  @Test
  public void groupSpanningInputBatchEdge() throws Exception {
    try (OrderedAggregator agg = sum(new long[][]{{0, 1}, {0, 2}}, 1, 1024)) {
      agg.init();
      Batch batch = agg.next();
      assertThat(batch.length(), is(1));
      assertThat(batch.get(1, 0), is((Object) 3L));
      assertThat(agg.next().length(), is(0));
    }
  }

  @Test
  public void severalGroupsInOneOutputBatch() throws Exception {
    long[][] input = {{0, 1}, {1, 1}, {1, 1}, {2, 1}, {3, 1}, {3, 1}, {3, 1}};
    try (OrderedAggregator agg = sum(input, 7, 3)) {
      agg.init();
      Batch first = agg.next();
      assertThat(first.length(), is(3));
      assertThat(first.get(1, 0), is((Object) 1L));
      assertThat(first.get(1, 1), is((Object) 2L));
      assertThat(first.get(1, 2), is((Object) 1L));
      // the last group only completes at end of input
      Batch last = agg.next();
      assertThat(last.length(), is(1));
      assertThat(last.get(0, 0), is((Object) 3L));
      assertThat(last.get(1, 0), is((Object) 3L));
      assertThat(agg.next().length(), is(0));
    }
  }

  @Test
  public void outputBufferIsReused() throws Exception {
    try (OrderedAggregator agg = sum(new long[][]{{0, 1}, {1, 2}, {2, 3}}, 1, 1)) {
      agg.init();
      Batch first = agg.next();
      Batch second = agg.next();
      assertThat(first == second, is(true));
      assertThat(second.get(0, 0), is((Object) 1L));
    }
  }

  @Test(expected = IllegalStateException.class)
  public void nextAfterEndOfStream() throws Exception {
    try (OrderedAggregator agg = sum(new long[][]{{0, 1}}, 1, 1)) {
      agg.init();
      agg.next();
      assertThat(agg.next().length(), is(0));
      agg.next();
    }
  }
}
