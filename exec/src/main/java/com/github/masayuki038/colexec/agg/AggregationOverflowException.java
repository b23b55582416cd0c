package com.github.masayuki038.colexec.agg;

/**
 * Fixed-width accumulation left the range of its type.
 */
public class AggregationOverflowException extends ArithmeticException {

  public AggregationOverflowException(String message) {
    super(message);
  }
}
