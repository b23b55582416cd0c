package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.vector.ColumnType;

/**
 * Supported aggregate functions and their typing rules.
 */
public enum AggregateFunction {

  /** First non-null value of the group. */
  ANY_NOT_NULL(1) {
    @Override
    ColumnType outputType(ColumnType input) {
      return input;
    }
  },

  /** Number of rows, nulls included. */
  COUNT_ROWS(0) {
    @Override
    ColumnType outputType(ColumnType input) {
      return ColumnType.BIGINT;
    }
  },

  /** Number of non-null values. */
  COUNT(1) {
    @Override
    ColumnType outputType(ColumnType input) {
      return ColumnType.BIGINT;
    }
  },

  SUM(1) {
    @Override
    ColumnType outputType(ColumnType input) {
      if (input.isIntegral()) {
        return ColumnType.BIGINT;
      }
      return input.isNumeric() ? input : null;
    }
  },

  /** Sum restricted to integer input, accumulated as a 64-bit integer. */
  SUM_INT(1) {
    @Override
    ColumnType outputType(ColumnType input) {
      return input.isIntegral() ? ColumnType.BIGINT : null;
    }
  },

  AVG(1) {
    @Override
    ColumnType outputType(ColumnType input) {
      if (input == ColumnType.DOUBLE) {
        return ColumnType.DOUBLE;
      }
      return input.isNumeric() ? ColumnType.DECIMAL : null;
    }
  },

  MIN(1) {
    @Override
    ColumnType outputType(ColumnType input) {
      return input;
    }
  },

  MAX(1) {
    @Override
    ColumnType outputType(ColumnType input) {
      return input;
    }
  };

  private final int arity;

  AggregateFunction(int arity) {
    this.arity = arity;
  }

  public int getArity() {
    return arity;
  }

  /**
   * Result type for an input type, or {@code null} if the function does not accept it.
   * Zero-arity functions receive {@code null}.
   */
  abstract ColumnType outputType(ColumnType input);
}
