package com.github.masayuki038.colexec.agg;

import com.github.masayuki038.colexec.vector.BatchSchema;
import com.github.masayuki038.colexec.vector.ColumnType;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Validated shape of an aggregation: input columns, group columns, aggregate calls, and the
 * resulting output schema (group columns in order, then one column per call).
 */
public final class AggregatorSpec {

  private final BatchSchema inputSchema;
  private final int[] groupColumns;
  private final ImmutableList<AggregateCall> calls;
  private final ImmutableList<ColumnType> callInputTypes;
  private final BatchSchema outputSchema;

  private AggregatorSpec(BatchSchema inputSchema, int[] groupColumns,
                         ImmutableList<AggregateCall> calls,
                         ImmutableList<ColumnType> callInputTypes, BatchSchema outputSchema) {
    this.inputSchema = inputSchema;
    this.groupColumns = groupColumns;
    this.calls = calls;
    this.callInputTypes = callInputTypes;
    this.outputSchema = outputSchema;
  }

  /**
   * Checks column indexes, call arity and function/type combinations.
   *
   * @throws InvalidAggregationException describing the first problem found
   */
  public static AggregatorSpec of(BatchSchema inputSchema, List<AggregateCall> calls,
                                  int[] groupColumns) throws InvalidAggregationException {
    List<String> names = new ArrayList<>();
    List<ColumnType> types = new ArrayList<>();
    for (int col : groupColumns) {
      checkColumn(inputSchema, col, "group column");
      names.add(inputSchema.name(col));
      types.add(inputSchema.type(col));
    }
    ImmutableList.Builder<ColumnType> inputTypes = ImmutableList.builder();
    for (int i = 0; i < calls.size(); i++) {
      AggregateCall call = calls.get(i);
      AggregateFunction function = call.getFunction();
      if (call.getArgList().size() != function.getArity()) {
        throw new InvalidAggregationException(function + " takes " + function.getArity()
          + " argument(s), got " + call.getArgList());
      }
      ColumnType inputType = null;
      if (function.getArity() > 0) {
        int col = call.getArgList().get(0);
        checkColumn(inputSchema, col, "argument of " + call);
        inputType = inputSchema.type(col);
      }
      ColumnType outputType = function.outputType(inputType);
      if (outputType == null) {
        throw new InvalidAggregationException(function + " does not support " + inputType);
      }
      inputTypes.add(inputType == null ? ColumnType.BIGINT : inputType);
      names.add("$a" + i);
      types.add(outputType);
    }
    return new AggregatorSpec(inputSchema, groupColumns.clone(), ImmutableList.copyOf(calls),
      inputTypes.build(), new BatchSchema(names, types));
  }

  private static void checkColumn(BatchSchema schema, int col, String what)
      throws InvalidAggregationException {
    if (col < 0 || col >= schema.size()) {
      throw new InvalidAggregationException(what + " " + col + " out of range [0, "
        + schema.size() + ")");
    }
  }

  public BatchSchema getInputSchema() {
    return inputSchema;
  }

  public BatchSchema getOutputSchema() {
    return outputSchema;
  }

  public int[] getGroupColumns() {
    return groupColumns.clone();
  }

  public ImmutableList<AggregateCall> getCalls() {
    return calls;
  }

  GroupedAccumulator[] newAccumulators() {
    GroupedAccumulator[] accumulators = new GroupedAccumulator[calls.size()];
    for (int i = 0; i < accumulators.length; i++) {
      accumulators[i] = GroupedAccumulator.create(calls.get(i), callInputTypes.get(i),
        outputSchema.type(groupColumns.length + i));
    }
    return accumulators;
  }
}
