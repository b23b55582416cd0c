package com.github.masayuki038.colexec.agg;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import java.util.Objects;

/**
 * An aggregate function applied to a list of input columns
 */
public final class AggregateCall {

  private final AggregateFunction function;
  private final ImmutableList<Integer> args;

  private AggregateCall(AggregateFunction function, ImmutableList<Integer> args) {
    this.function = Objects.requireNonNull(function, "function");
    this.args = args;
  }

  public static AggregateCall of(AggregateFunction function, int... args) {
    return new AggregateCall(function, ImmutableList.copyOf(Ints.asList(args)));
  }

  public AggregateFunction getFunction() {
    return function;
  }

  public ImmutableList<Integer> getArgList() {
    return args;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AggregateCall)) {
      return false;
    }
    AggregateCall that = (AggregateCall) o;
    return function == that.function && args.equals(that.args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(function, args);
  }

  @Override
  public String toString() {
    return function + args.toString();
  }
}
