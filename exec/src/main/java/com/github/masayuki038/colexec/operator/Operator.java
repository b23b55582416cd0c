package com.github.masayuki038.colexec.operator;

import com.github.masayuki038.colexec.vector.Batch;
import com.github.masayuki038.colexec.vector.BatchSchema;

/**
 * Pull-based operator producing batches.
 *
 * <p>A single thread drives an operator tree by calling {@link #next()} on the root. The batch
 * returned by {@code next()} belongs to the caller only until the following call, which may
 * overwrite the same buffers; callers that need the rows longer must copy them.
 */
public interface Operator extends AutoCloseable {

  /**
   * Output schema. Available before {@link #init()}.
   */
  BatchSchema schema();

  /**
   * One-time setup. Calling it twice is an error.
   */
  void init();

  /**
   * Pulls the next batch. A zero-length batch signals end of stream; callers stop pulling after
   * the first one.
   */
  Batch next();

  /**
   * Returns the operator, and everything upstream of it, to its state before {@link #init()}.
   */
  void reset();

  /**
   * Releases buffers. The operator is unusable afterwards.
   */
  @Override
  void close();
}
