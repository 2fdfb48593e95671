/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked.concurrency;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import lombok.extern.log4j.Log4j2;

/**
 * Submits every task to an executor and gathers the results in submission order. The first
 * failure cancels the tasks that have not started yet.
 */
@Log4j2
public class ParallelStrategy implements ConcurrencyStrategy {

  private final ExecutorService executor;

  public ParallelStrategy(ExecutorService executor) {
    this.executor = executor;
  }

  @Override
  public <T> List<T> invokeAll(List<Callable<T>> tasks) {
    List<CompletableFuture<T>> futures = new ArrayList<>(tasks.size());
    CompletableFuture<Void> firstFailure = new CompletableFuture<>();
    for (Callable<T> task : tasks) {
      CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> Tasks.call(task), executor);
      future.whenComplete(
          (result, failure) -> {
            if (failure != null) {
              firstFailure.completeExceptionally(failure);
            }
          });
      futures.add(future);
    }

    // Wait for all tasks, or stop at the first failure
    CompletableFuture<Void> all =
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
    try {
      CompletableFuture.anyOf(all, firstFailure).join();
    } catch (CompletionException e) {
      int cancelled = 0;
      for (CompletableFuture<T> future : futures) {
        if (future.cancel(false)) {
          cancelled++;
        }
      }
      log.debug("Cancelled {} of {} chunk tasks after a failure", cancelled, futures.size());
      throw Tasks.rethrow(e.getCause());
    }

    List<T> results = new ArrayList<>(futures.size());
    for (CompletableFuture<T> future : futures) {
      results.add(future.join());
    }
    return results;
  }

  @Override
  public String toString() {
    return "parallel";
  }
}
