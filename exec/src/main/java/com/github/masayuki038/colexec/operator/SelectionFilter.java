package com.github.masayuki038.colexec.operator;

import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.BatchSchema;
import com.google.common.base.Preconditions;
import org.apache.calcite.linq4j.function.Predicate1;

/**
 * Filter that narrows its input by selection, never copying column data.
 *
 * <p>Batches in which no row survives are skipped, since a zero-length batch means end of stream.
 */
public class SelectionFilter implements Operator {

  private final Operator input;
  private final Predicate1<Object[]> predicate;

  private int[] selected = new int[0];

  public SelectionFilter(Operator input, Predicate1<Object[]> predicate) {
    this.input = input;
    this.predicate = predicate;
  }

  @Override
  public BatchSchema schema() {
    return input.schema();
  }

  @Override
  public void init() {
    input.init();
  }

  @Override
  public Batch next() {
    while (true) {
      Batch batch = input.next();
      int length = batch.length();
      if (length == 0) {
        return batch;
      }
      if (selected.length < length) {
        selected = new int[batch.capacity()];
      }
      Object[] row = new Object[batch.columnCount()];
      int count = 0;
      for (int i = 0; i < length; i++) {
        for (int col = 0; col < row.length; col++) {
          row[col] = batch.get(col, i);
        }
        if (predicate.apply(row)) {
          // intersect with the incoming selection
          selected[count++] = batch.rowIndex(i);
        }
      }
      if (count > 0) {
        batch.select(selected, count);
        return batch;
      }
    }
  }

  @Override
  public void reset() {
    input.reset();
  }

  @Override
  public void close() {
    input.close();
  }
}
