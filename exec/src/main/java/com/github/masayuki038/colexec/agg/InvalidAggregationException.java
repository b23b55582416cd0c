package com.github.masayuki038.colexec.agg;

/**
 * Thrown when an aggregator cannot be built from the supplied columns and calls
 */
public class InvalidAggregationException extends Exception {

  public InvalidAggregationException(String message) {
    super(message);
  }
}
