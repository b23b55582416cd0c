package com.github.masayuki038.colexec.vector;

import com.google.common.primitives.UnsignedBytes;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.Decimal256Vector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Type tag of a column, bound to the Arrow vector that stores it.
 *
 * <p>Values cross this boundary as boxed Java objects: {@link Boolean}, {@link Integer},
 * {@link Long}, {@link Double}, {@link BigDecimal}, {@link String} and {@code byte[]}.
 * A null value is represented by {@code null} and its backing slot is never read.
 */
public enum ColumnType {

  BOOLEAN(ArrowType.Bool.INSTANCE) {
    @Override
    protected Object read(FieldVector vector, int row) {
      return ((BitVector) vector).get(row) != 0;
    }

    @Override
    protected void write(FieldVector vector, int row, Object value) {
      ((BitVector) vector).setSafe(row, ((Boolean) value) ? 1 : 0);
    }

    @Override
    protected void writeNull(FieldVector vector, int row) {
      ((BitVector) vector).setNull(row);
    }

    @Override
    protected int compareNonNull(Object a, Object b) {
      return Boolean.compare((Boolean) a, (Boolean) b);
    }
  },

  INT(new ArrowType.Int(32, true)) {
    @Override
    protected Object read(FieldVector vector, int row) {
      return ((IntVector) vector).get(row);
    }

    @Override
    protected void write(FieldVector vector, int row, Object value) {
      ((IntVector) vector).setSafe(row, ((Number) value).intValue());
    }

    @Override
    protected void writeNull(FieldVector vector, int row) {
      ((IntVector) vector).setNull(row);
    }

    @Override
    protected int compareNonNull(Object a, Object b) {
      return Integer.compare((Integer) a, (Integer) b);
    }
  },

  BIGINT(new ArrowType.Int(64, true)) {
    @Override
    protected Object read(FieldVector vector, int row) {
      return ((BigIntVector) vector).get(row);
    }

    @Override
    protected void write(FieldVector vector, int row, Object value) {
      ((BigIntVector) vector).setSafe(row, ((Number) value).longValue());
    }

    @Override
    protected void writeNull(FieldVector vector, int row) {
      ((BigIntVector) vector).setNull(row);
    }

    @Override
    protected int compareNonNull(Object a, Object b) {
      return Long.compare((Long) a, (Long) b);
    }
  },

  DOUBLE(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE)) {
    @Override
    protected Object read(FieldVector vector, int row) {
      return ((Float8Vector) vector).get(row);
    }

    @Override
    protected void write(FieldVector vector, int row, Object value) {
      ((Float8Vector) vector).setSafe(row, ((Number) value).doubleValue());
    }

    @Override
    protected void writeNull(FieldVector vector, int row) {
      ((Float8Vector) vector).setNull(row);
    }

    @Override
    protected int compareNonNull(Object a, Object b) {
      return Double.compare(normalize((Double) a), normalize((Double) b));
    }

    @Override
    protected int hashNonNull(Object value) {
      return Double.hashCode(normalize((Double) value));
    }
  },

  DECIMAL(new ArrowType.Decimal(ColumnType.DECIMAL_PRECISION, ColumnType.DECIMAL_SCALE, 256)) {
    @Override
    protected Object read(FieldVector vector, int row) {
      return ((Decimal256Vector) vector).getObject(row);
    }

    @Override
    protected void write(FieldVector vector, int row, Object value) {
      BigDecimal decimal = value instanceof BigDecimal
          ? (BigDecimal) value
          : new BigDecimal(value.toString());
      ((Decimal256Vector) vector).setSafe(row, decimal.setScale(DECIMAL_SCALE, RoundingMode.HALF_EVEN));
    }

    @Override
    protected void writeNull(FieldVector vector, int row) {
      ((Decimal256Vector) vector).setNull(row);
    }

    @Override
    protected int compareNonNull(Object a, Object b) {
      return ((BigDecimal) a).compareTo((BigDecimal) b);
    }

    @Override
    protected int hashNonNull(Object value) {
      // 1.10 and 1.1 must land in the same bucket
      return ((BigDecimal) value).stripTrailingZeros().hashCode();
    }
  },

  VARCHAR(ArrowType.Utf8.INSTANCE) {
    @Override
    protected Object read(FieldVector vector, int row) {
      return new String(((VarCharVector) vector).get(row), StandardCharsets.UTF_8);
    }

    @Override
    protected void write(FieldVector vector, int row, Object value) {
      ((VarCharVector) vector).setSafe(row, value.toString().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    protected void writeNull(FieldVector vector, int row) {
      ((VarCharVector) vector).setNull(row);
    }

    @Override
    protected int compareNonNull(Object a, Object b) {
      return compareCodePoints((String) a, (String) b);
    }
  },

  VARBINARY(ArrowType.Binary.INSTANCE) {
    @Override
    protected Object read(FieldVector vector, int row) {
      return ((VarBinaryVector) vector).get(row);
    }

    @Override
    protected void write(FieldVector vector, int row, Object value) {
      ((VarBinaryVector) vector).setSafe(row, (byte[]) value);
    }

    @Override
    protected void writeNull(FieldVector vector, int row) {
      ((VarBinaryVector) vector).setNull(row);
    }

    @Override
    protected int compareNonNull(Object a, Object b) {
      return UnsignedBytes.lexicographicalComparator().compare((byte[]) a, (byte[]) b);
    }

    @Override
    protected int hashNonNull(Object value) {
      return Arrays.hashCode((byte[]) value);
    }
  };

  public static final int DECIMAL_PRECISION = 76;
  public static final int DECIMAL_SCALE = 19;

  private static final int NULL_HASH = 0x9e3779b9;

  private final ArrowType arrowType;

  ColumnType(ArrowType arrowType) {
    this.arrowType = arrowType;
  }

  public ArrowType getArrowType() {
    return arrowType;
  }

  public Field field(String name) {
    return Field.nullable(name, arrowType);
  }

  public FieldVector newVector(String name, BufferAllocator allocator) {
    return field(name).createVector(allocator);
  }

  public boolean isNumeric() {
    return this == INT || this == BIGINT || this == DOUBLE || this == DECIMAL;
  }

  public boolean isIntegral() {
    return this == INT || this == BIGINT;
  }

  /**
   * Reads the value at a physical row, or {@code null} when the row is null.
   */
  public Object get(FieldVector vector, int row) {
    if (vector.isNull(row)) {
      return null;
    }
    return read(vector, row);
  }

  /**
   * Writes a value (or a null when {@code value} is null) at a physical row, growing the vector
   * as needed.
   */
  public void set(FieldVector vector, int row, Object value) {
    if (value == null) {
      writeNull(vector, row);
    } else {
      write(vector, row, value);
    }
  }

  /**
   * Total order over the values of this type. Nulls sort first.
   */
  public int compare(Object a, Object b) {
    if (a == null || b == null) {
      return a == null ? (b == null ? 0 : -1) : 1;
    }
    return compareNonNull(a, b);
  }

  /**
   * Grouping equality: two nulls are equal, a null never equals a value.
   */
  public boolean keyEquals(Object a, Object b) {
    return compare(a, b) == 0;
  }

  /**
   * Hash consistent with {@link #keyEquals(Object, Object)}.
   */
  public int hash(Object value) {
    return value == null ? NULL_HASH : hashNonNull(value);
  }

  protected abstract Object read(FieldVector vector, int row);

  protected abstract void write(FieldVector vector, int row, Object value);

  protected abstract void writeNull(FieldVector vector, int row);

  protected abstract int compareNonNull(Object a, Object b);

  protected int hashNonNull(Object value) {
    return value.hashCode();
  }

  /**
   * Resolves the type tag of an Arrow type.
   *
   * @throws IllegalArgumentException if the Arrow type has no column type
   */
  public static ColumnType of(ArrowType arrowType) {
    for (ColumnType type : values()) {
      if (type.arrowType.equals(arrowType)) {
        return type;
      }
    }
    if (arrowType instanceof ArrowType.Decimal) {
      return DECIMAL;
    }
    throw new IllegalArgumentException("Unsupported arrow type: " + arrowType);
  }

  /**
   * Orders strings by code point, which matches the order of their UTF-8 bytes.
   * {@link String#compareTo} compares UTF-16 units and puts supplementary characters
   * below U+E000..U+FFFF.
   */
  static int compareCodePoints(String a, String b) {
    int i = 0;
    while (i < a.length() && i < b.length()) {
      int ca = a.codePointAt(i);
      int cb = b.codePointAt(i);
      if (ca != cb) {
        return Integer.compare(ca, cb);
      }
      i += Character.charCount(ca);
    }
    return Integer.compare(a.length(), b.length());
  }

  private static double normalize(double d) {
    // -0.0 and 0.0 group together
    return d == 0.0d ? 0.0d : d;
  }
}
