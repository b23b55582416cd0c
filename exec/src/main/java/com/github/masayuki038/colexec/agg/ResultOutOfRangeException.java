package com.github.masayuki038.colexec.agg;

/**
 * An exact result is too wide for the column that stores it.
 *
 * <p>Decimal sums are accumulated without bound and only checked when they are written to a
 * {@code DECIMAL(76, 19)} output column.
 */
public class ResultOutOfRangeException extends ArithmeticException {

  public ResultOutOfRangeException(String message) {
    super(message);
  }
}
