/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked.concurrency;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/** Runs tasks one after another on the calling thread. At most one chunk is in memory at a time. */
public class SequentialStrategy implements ConcurrencyStrategy {

  @Override
  public <T> List<T> invokeAll(List<Callable<T>> tasks) {
    List<T> results = new ArrayList<>(tasks.size());
    for (Callable<T> task : tasks) {
      results.add(Tasks.call(task));
    }
    return results;
  }

  @Override
  public String toString() {
    return "sequential";
  }
}
