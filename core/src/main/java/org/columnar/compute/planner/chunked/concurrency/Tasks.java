/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked.concurrency;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import org.columnar.compute.exception.ComputeEngineException;

/** Failure handling shared by the concurrency strategies. */
final class Tasks {

  private Tasks() {}

  static <T> T call(Callable<T> task) {
    try {
      return task.call();
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new ComputeEngineException("Chunk task failed", e);
    }
  }

  /** Rethrows the failure of a task as it was raised, unwrapping executor wrappers. */
  static RuntimeException rethrow(Throwable failure) {
    while (failure instanceof CompletionException && failure.getCause() != null) {
      failure = failure.getCause();
    }
    if (failure instanceof RuntimeException) {
      throw (RuntimeException) failure;
    }
    if (failure instanceof Error) {
      throw (Error) failure;
    }
    throw new ComputeEngineException("Chunk task failed", failure);
  }
}
