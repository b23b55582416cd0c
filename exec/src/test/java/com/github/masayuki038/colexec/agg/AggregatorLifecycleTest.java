package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.operator.BatchEnumerator;
import com.github.masayuki038.colexec.operator.RowSource;
import com.github.masayuki038.colexec.operator.SelectionFilter;
import com.github.masayuki038.colexec.vector.BatchSchema;
import com.github.masayuki038.colexec.vector.ColumnType;
import com.google.common.collect.ImmutableList;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.github.masayuki038.colexec.agg.AggregateFunction.COUNT_ROWS;
import static com.github.masayuki038.colexec.agg.AggregateFunction.SUM;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.Assert.assertThrows;

/**
 * init/next/reset contract, accumulation errors and selection-aware input, for both aggregators
 */
public class AggregatorLifecycleTest {

  private static final BatchSchema SCHEMA = BatchSchema.of(ColumnType.BIGINT, ColumnType.BIGINT);

  private BufferAllocator allocator;

  @Before
  public void setUp() {
    allocator = new RootAllocator(Long.MAX_VALUE);
  }

  @After
  public void tearDown() {
    allocator.close();
  }

  private AbstractAggregator create(AggregatorKind kind, List<Object[]> rows, int batchSize)
      throws InvalidAggregationException {
    return kind.create(RowSource.of(SCHEMA, rows, batchSize, allocator), SCHEMA.types(),
      ImmutableList.of(AggregateCall.of(SUM, 1)), new int[]{0}, batchSize, batchSize, allocator);
  }

  private static List<Object[]> rows(long... pairs) {
    List<Object[]> rows = new ArrayList<>();
    for (int i = 0; i < pairs.length; i += 2) {
      rows.add(new Object[]{pairs[i], pairs[i + 1]});
    }
    return rows;
  }

  @Test
  public void initTwiceFails() throws Exception {
    for (AggregatorKind kind : AggregatorKind.values()) {
      try (AbstractAggregator agg = create(kind, rows(0, 1), 2)) {
        agg.init();
        assertThrows(IllegalStateException.class, agg::init);
      }
    }
  }

  @Test
  public void nextBeforeInitFails() throws Exception {
    for (AggregatorKind kind : AggregatorKind.values()) {
      try (AbstractAggregator agg = create(kind, rows(0, 1), 2)) {
        assertThrows(IllegalStateException.class, agg::next);
      }
    }
  }

  @Test
  public void resetAllowsReuse() throws Exception {
    for (AggregatorKind kind : AggregatorKind.values()) {
      try (AbstractAggregator agg = create(kind, rows(0, 1, 0, 2, 1, 5), 2)) {
        for (int run = 0; run < 3; run++) {
          agg.init();
          assertThat(kind + " run " + run, AggregatorTestCase.drain(agg, 2), containsInAnyOrder(
            Arrays.<Object>asList(0L, 3L),
            Arrays.<Object>asList(1L, 5L)));
          agg.reset();
        }
      }
    }
  }

  @Test
  public void resetMidStream() throws Exception {
    for (AggregatorKind kind : AggregatorKind.values()) {
      try (AbstractAggregator agg = create(kind, rows(0, 1, 1, 2, 2, 3), 1)) {
        agg.init();
        assertThat(agg.next().length(), is(1));
        agg.reset();
        agg.init();
        assertThat(AggregatorTestCase.drain(agg, 1).size(), is(3));
      }
    }
  }

  @Test
  public void integerOverflowIsReported() throws Exception {
    for (AggregatorKind kind : AggregatorKind.values()) {
      try (AbstractAggregator agg = create(kind, rows(0, Long.MAX_VALUE, 0, 1), 1)) {
        agg.init();
        AggregationOverflowException e = assertThrows(AggregationOverflowException.class, agg::next);
        assertThat(e.getMessage(), containsString("SUM[1]"));
      }
    }
  }

  @Test
  public void floatOverflowIsReported() throws Exception {
    BatchSchema schema = BatchSchema.of(ColumnType.BIGINT, ColumnType.DOUBLE);
    List<Object[]> input = ImmutableList.of(
      new Object[]{0L, Double.MAX_VALUE},
      new Object[]{0L, Double.MAX_VALUE});
    for (AggregatorKind kind : AggregatorKind.values()) {
      try (AbstractAggregator agg = kind.create(RowSource.of(schema, input, 4, allocator),
          schema.types(), ImmutableList.of(AggregateCall.of(SUM, 1)), new int[]{0}, 4, 4,
          allocator)) {
        agg.init();
        assertThrows(AggregationOverflowException.class, agg::next);
      }
    }
  }

  @Test
  public void decimalResultTooWideIsReported() throws Exception {
    BatchSchema schema = BatchSchema.of(ColumnType.BIGINT, ColumnType.DECIMAL);
    List<Object[]> input = ImmutableList.of(
      new Object[]{0L, new BigDecimal("5E+56")},
      new Object[]{0L, new BigDecimal("5E+56")});
    for (AggregatorKind kind : AggregatorKind.values()) {
      try (AbstractAggregator agg = kind.create(RowSource.of(schema, input, 4, allocator),
          schema.types(), ImmutableList.of(AggregateCall.of(SUM, 1)), new int[]{0}, 4, 4,
          allocator)) {
        agg.init();
        ResultOutOfRangeException e = assertThrows(ResultOutOfRangeException.class, agg::next);
        assertThat(e.getMessage(), containsString("SUM[1]"));
      }
    }
  }

  @Test
  public void decimalSumMayExceedStorageWhileAccumulating() throws Exception {
    BatchSchema schema = BatchSchema.of(ColumnType.BIGINT, ColumnType.DECIMAL);
    List<Object[]> input = ImmutableList.of(
      new Object[]{0L, new BigDecimal("5E+56")},
      new Object[]{0L, new BigDecimal("5E+56")},
      new Object[]{0L, new BigDecimal("-5E+56")});
    for (AggregatorKind kind : AggregatorKind.values()) {
      try (AbstractAggregator agg = kind.create(RowSource.of(schema, input, 1, allocator),
          schema.types(), ImmutableList.of(AggregateCall.of(SUM, 1)), new int[]{0}, 1, 1,
          allocator)) {
        agg.init();
        assertThat(kind.name(), AggregatorTestCase.drain(agg, 1),
          is(Arrays.<List<Object>>asList(Arrays.<Object>asList(0L, new BigDecimal("5E+56")))));
      }
    }
  }

  @Test
  public void inputBatchSizeIsOnlyAHint() throws Exception {
    List<Object[]> input = rows(0, 1, 0, 2, 1, 3, 2, 4, 2, 5);
    for (AggregatorKind kind : AggregatorKind.values()) {
      try (AbstractAggregator agg = kind.create(RowSource.of(SCHEMA, input, 5, allocator),
          SCHEMA.types(), ImmutableList.of(AggregateCall.of(SUM, 1)), new int[]{0}, 1, 2,
          allocator)) {
        assertThat(agg.getInputBatchSize(), is(1));
        agg.init();
        assertThat(kind.name(), AggregatorTestCase.drain(agg, 2), containsInAnyOrder(
          Arrays.<Object>asList(0L, 3L),
          Arrays.<Object>asList(1L, 3L),
          Arrays.<Object>asList(2L, 9L)));
      }
    }
  }

  @Test
  public void columnTypesMustMatchInput() {
    assertThrows(InvalidAggregationException.class, () ->
      AggregatorKind.HASH.create(RowSource.of(SCHEMA, rows(), 1, allocator),
        ImmutableList.of(ColumnType.BIGINT, ColumnType.DOUBLE),
        ImmutableList.of(AggregateCall.of(SUM, 1)), new int[]{0}, 1, 1, allocator));
  }

  @Test
  public void honorsInputSelection() throws Exception {
    List<Object[]> input = rows(0, 1, 0, 100, 0, 2, 1, 100, 1, 3, 2, 100);
    for (AggregatorKind kind : AggregatorKind.values()) {
      for (int batchSize : new int[]{1, 2, 5}) {
        SelectionFilter filter = new SelectionFilter(
          RowSource.of(SCHEMA, input, batchSize, allocator),
          row -> (Long) row[1] < 100);
        try (AbstractAggregator agg = kind.create(filter, SCHEMA.types(),
            ImmutableList.of(AggregateCall.of(SUM, 1), AggregateCall.of(COUNT_ROWS)),
            new int[]{0}, batchSize, batchSize, allocator)) {
          agg.init();
          assertThat(kind + " batch " + batchSize, AggregatorTestCase.drain(agg, batchSize),
            containsInAnyOrder(
              Arrays.<Object>asList(0L, 3L, 2L),
              Arrays.<Object>asList(1L, 3L, 1L)));
        }
      }
    }
  }

  @Test
  public void enumeratesRows() throws Exception {
    try (BatchEnumerator rows = new BatchEnumerator(
        create(AggregatorKind.ORDERED, rows(0, 1, 0, 1, 1, 2, 2, 3), 2))) {
      List<List<Object>> result = new ArrayList<>();
      while (rows.moveNext()) {
        result.add(Arrays.asList(rows.current()));
      }
      assertThat(result, is(ImmutableList.of(
        Arrays.<Object>asList(0L, 2L),
        Arrays.<Object>asList(1L, 2L),
        Arrays.<Object>asList(2L, 3L))));
    }
  }
}
