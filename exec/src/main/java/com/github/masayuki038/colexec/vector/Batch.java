package com.github.masayuki038.colexec.vector;

import com.google.common.base.Preconditions;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * A fixed-capacity set of rows stored column by column in Arrow vectors.
 *
 * <p>When a selection is in use, the selection vector is the definitive list of physical row
 * indices in presentation order, and {@link #length()} is its size. Every reader goes through
 * {@link #rowIndex(int)} to resolve a logical row.
 */
public class Batch implements AutoCloseable {

  private final VectorSchemaRoot root;
  private final BatchSchema schema;
  private final UInt4Vector selectionVector;
  private final int capacity;
  private boolean selectionInUse;

  Batch(VectorSchemaRoot root, BatchSchema schema, BufferAllocator allocator, int capacity) {
    this.root = root;
    this.schema = schema;
    this.capacity = capacity;
    this.selectionVector = new UInt4Vector("selectionVector", allocator);
    this.selectionVector.allocateNew(capacity);
  }

  public BatchSchema schema() {
    return schema;
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Logical row count. Zero signals end of stream to a consumer.
   */
  public int length() {
    return selectionInUse ? selectionVector.getValueCount() : root.getRowCount();
  }

  /**
   * Physical row count, regardless of selection.
   */
  public int physicalLength() {
    return root.getRowCount();
  }

  public int columnCount() {
    return schema.size();
  }

  public FieldVector column(int i) {
    return root.getVector(i);
  }

  public ColumnType columnType(int i) {
    return schema.type(i);
  }

  public boolean hasSelection() {
    return selectionInUse;
  }

  /**
   * Maps a logical row to its physical index.
   */
  public int rowIndex(int logicalRow) {
    return selectionInUse ? selectionVector.get(logicalRow) : logicalRow;
  }

  /**
   * Reads the value at a logical row.
   */
  public Object get(int column, int logicalRow) {
    return schema.type(column).get(root.getVector(column), rowIndex(logicalRow));
  }

  /**
   * Writes the value at a physical row. Callers publish the rows with {@link #setLength(int)}.
   */
  public void set(int column, int physicalRow, Object value) {
    schema.type(column).set(root.getVector(column), physicalRow, value);
  }

  /**
   * Sets the physical row count and drops any selection.
   */
  public void setLength(int rowCount) {
    Preconditions.checkArgument(rowCount <= capacity,
      "row count %s exceeds capacity %s", rowCount, capacity);
    root.setRowCount(rowCount);
    clearSelection();
  }

  /**
   * Restricts the visible rows to the first {@code count} entries of {@code physicalRows}.
   */
  public void select(int[] physicalRows, int count) {
    for (int i = 0; i < count; i++) {
      Preconditions.checkElementIndex(physicalRows[i], root.getRowCount(), "selected row");
      selectionVector.setSafe(i, physicalRows[i]);
    }
    selectionVector.setValueCount(count);
    selectionInUse = true;
  }

  public void clearSelection() {
    selectionVector.setValueCount(0);
    selectionInUse = false;
  }

  /**
   * Zeroes every column and the selection so the buffers can be refilled.
   */
  public void reset() {
    for (FieldVector vector : root.getFieldVectors()) {
      vector.reset();
    }
    root.setRowCount(0);
    clearSelection();
  }

  public VectorSchemaRoot getVectorSchemaRoot() {
    return root;
  }

  @Override
  public void close() {
    selectionVector.close();
    root.close();
  }

  @Override
  public String toString() {
    return "Batch{length=" + length() + ", capacity=" + capacity
      + ", selection=" + selectionInUse + ", schema=" + schema + "}";
  }
}
