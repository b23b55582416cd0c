package com.github.masayuki038.colexec.vector;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered column types of a batch
 */
public class BatchSchema {

  private final ImmutableList<String> names;
  private final ImmutableList<ColumnType> types;

  public BatchSchema(List<String> names, List<ColumnType> types) {
    Preconditions.checkArgument(names.size() == types.size(),
      "%s names for %s columns", names.size(), types.size());
    this.names = ImmutableList.copyOf(names);
    this.types = ImmutableList.copyOf(types);
  }

  public static BatchSchema of(List<ColumnType> types) {
    List<String> names = new ArrayList<>(types.size());
    for (int i = 0; i < types.size(); i++) {
      names.add("$f" + i);
    }
    return new BatchSchema(names, types);
  }

  public static BatchSchema of(ColumnType... types) {
    return of(ImmutableList.copyOf(types));
  }

  public static BatchSchema fromArrow(Schema schema) {
    List<String> names = new ArrayList<>();
    List<ColumnType> types = new ArrayList<>();
    for (Field field : schema.getFields()) {
      names.add(field.getName());
      types.add(ColumnType.of(field.getType()));
    }
    return new BatchSchema(names, types);
  }

  public int size() {
    return types.size();
  }

  public ColumnType type(int i) {
    return types.get(i);
  }

  public String name(int i) {
    return names.get(i);
  }

  public ImmutableList<ColumnType> types() {
    return types;
  }

  public Schema toArrowSchema() {
    List<Field> fields = new ArrayList<>(types.size());
    for (int i = 0; i < types.size(); i++) {
      fields.add(types.get(i).field(names.get(i)));
    }
    return new Schema(fields);
  }

  /**
   * Allocates an empty batch able to hold {@code capacity} rows without reallocation.
   */
  public Batch newBatch(BufferAllocator allocator, int capacity) {
    Preconditions.checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    List<FieldVector> vectors = new ArrayList<>(types.size());
    List<Field> fields = new ArrayList<>(types.size());
    for (int i = 0; i < types.size(); i++) {
      FieldVector vector = types.get(i).newVector(names.get(i), allocator);
      vector.setInitialCapacity(capacity);
      vector.allocateNew();
      vectors.add(vector);
      fields.add(vector.getField());
    }
    VectorSchemaRoot root = new VectorSchemaRoot(fields, vectors, 0);
    return new Batch(root, this, allocator, capacity);
  }

  @Override
  public String toString() {
    return "BatchSchema" + types;
  }
}
