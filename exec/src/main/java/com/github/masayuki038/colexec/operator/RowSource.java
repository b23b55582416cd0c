package com.github.masayuki038.colexec.operator;

import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.BatchSchema;
import com.google.common.base.Preconditions;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.linq4j.Linq4j;

import java.util.List;

/**
 * Source operator that chunks rows of an {@link Enumerator} into batches
 */
public class RowSource implements Operator {

  private final BatchSchema schema;
  private final Enumerator<Object[]> rows;
  private final BufferAllocator allocator;
  private final int batchSize;

  private Batch batch;
  private boolean initialized;
  private boolean exhausted;

  public RowSource(BatchSchema schema, Enumerator<Object[]> rows, int batchSize,
                   BufferAllocator allocator) {
    Preconditions.checkArgument(batchSize > 0, "batch size must be positive: %s", batchSize);
    this.schema = schema;
    this.rows = rows;
    this.batchSize = batchSize;
    this.allocator = allocator;
  }

  public static RowSource of(BatchSchema schema, List<Object[]> rows, int batchSize,
                             BufferAllocator allocator) {
    return new RowSource(schema, Linq4j.enumerator(rows), batchSize, allocator);
  }

  @Override
  public BatchSchema schema() {
    return schema;
  }

  @Override
  public void init() {
    Preconditions.checkState(!initialized, "already initialized");
    if (batch == null) {
      batch = schema.newBatch(allocator, batchSize);
    }
    initialized = true;
  }

  @Override
  public Batch next() {
    Preconditions.checkState(initialized, "not initialized");
    batch.reset();
    if (exhausted) {
      return batch;
    }
    int n = 0;
    while (n < batchSize && rows.moveNext()) {
      Object[] row = rows.current();
      Preconditions.checkArgument(row.length == schema.size(),
        "row has %s values, schema has %s columns", row.length, schema.size());
      for (int col = 0; col < row.length; col++) {
        batch.set(col, n, row[col]);
      }
      n++;
    }
    if (n < batchSize) {
      exhausted = true;
    }
    batch.setLength(n);
    return batch;
  }

  @Override
  public void reset() {
    rows.reset();
    exhausted = false;
    initialized = false;
  }

  @Override
  public void close() {
    if (batch != null) {
      batch.close();
      batch = null;
    }
    rows.close();
  }
}
