package com.github.masayuki038.colexec.operator;

import com.github.masayuki038.colexec.vector.Batch;
import org.apache.calcite.linq4j.Enumerator;

import java.util.NoSuchElementException;

/**
 * Enumerator over the rows of an operator's output, honoring selection
 */
public class BatchEnumerator implements Enumerator<Object[]> {

  private final Operator operator;

  private Batch batch;
  private int rowIndex = -1;
  private boolean done;
  private boolean started;

  public BatchEnumerator(Operator operator) {
    this.operator = operator;
  }

  @Override
  public Object[] current() {
    if (batch == null || rowIndex < 0 || rowIndex >= batch.length()) {
      throw new NoSuchElementException();
    }
    Object[] current = new Object[batch.columnCount()];
    for (int i = 0; i < current.length; i++) {
      current[i] = batch.get(i, rowIndex);
    }
    return current;
  }

  @Override
  public boolean moveNext() {
    if (done) {
      return false;
    }
    if (!started) {
      operator.init();
      started = true;
    }
    if (batch != null && rowIndex < batch.length() - 1) {
      rowIndex++;
      return true;
    }
    batch = operator.next();
    if (batch.length() == 0) {
      done = true;
      return false;
    }
    rowIndex = 0;
    return true;
  }

  @Override
  public void reset() {
    operator.reset();
    batch = null;
    rowIndex = -1;
    done = false;
    started = false;
  }

  @Override
  public void close() {
    operator.close();
  }
}
