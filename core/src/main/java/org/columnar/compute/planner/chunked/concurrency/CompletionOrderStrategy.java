/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked.concurrency;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.columnar.compute.exception.ComputeEngineException;

/**
 * Submits every task to an executor and returns the results in the order the tasks finish. Callers
 * must restore any order they depend on.
 */
public class CompletionOrderStrategy implements ConcurrencyStrategy {

  private final ExecutorService executor;

  public CompletionOrderStrategy(ExecutorService executor) {
    this.executor = executor;
  }

  @Override
  public <T> List<T> invokeAll(List<Callable<T>> tasks) {
    CompletionService<T> completionService = new ExecutorCompletionService<>(executor);
    List<Future<T>> futures = new ArrayList<>(tasks.size());
    for (Callable<T> task : tasks) {
      futures.add(completionService.submit(task));
    }
    List<T> results = new ArrayList<>(tasks.size());
    try {
      for (int i = 0; i < tasks.size(); i++) {
        results.add(completionService.take().get());
      }
      return results;
    } catch (ExecutionException e) {
      cancelAll(futures);
      throw Tasks.rethrow(e.getCause());
    } catch (InterruptedException e) {
      cancelAll(futures);
      Thread.currentThread().interrupt();
      throw new ComputeEngineException("Interrupted while waiting for chunk tasks", e);
    }
  }

  private static <T> void cancelAll(List<Future<T>> futures) {
    for (Future<T> future : futures) {
      future.cancel(true);
    }
  }

  @Override
  public String toString() {
    return "completion-order";
  }
}
