/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked.concurrency;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs the per-chunk tasks of a query. Implementations decide how many tasks run at once and in
 * which order results are returned. The first failing task aborts the whole run: its {@link
 * RuntimeException} is rethrown unchanged, and checked exceptions are wrapped in a {@code
 * ComputeEngineException}.
 */
public interface ConcurrencyStrategy {

  /**
   * Runs all tasks and returns their results.
   *
   * @param tasks the tasks, in partition order
   * @return one result per task
   */
  <T> List<T> invokeAll(List<Callable<T>> tasks);
}
