/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import lombok.extern.log4j.Log4j2;
import org.columnar.compute.data.model.Values;
import org.columnar.compute.expression.evaluator.ExpressionEvaluator;
import org.columnar.compute.planner.chunked.concurrency.ConcurrencyStrategy;
import org.columnar.compute.planner.chunked.partition.Partition;
import org.columnar.compute.planner.chunked.partition.PartitionPlan;
import org.columnar.compute.storage.DataSource;

/**
 * Evaluates the chunk part of a split expression on every partition of a source. Each partition
 * is loaded, evaluated and its result materialized inside its own task; results come back sorted
 * by partition sequence whatever order the tasks finished in.
 */
@Log4j2
public class ChunkExecutor {

  private final ExpressionEvaluator evaluator;

  public ChunkExecutor(ExpressionEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  /**
   * Runs the chunk expression on every partition of the plan.
   *
   * @return one result per partition, in partition order
   */
  public List<ChunkResult> execute(
      SplitExpression split,
      DataSource source,
      PartitionPlan plan,
      ConcurrencyStrategy concurrencyStrategy) {
    List<Callable<ChunkResult>> tasks = new ArrayList<>(plan.size());
    for (Partition partition : plan) {
      tasks.add(() -> evaluate(split, source, partition));
    }
    log.debug("Running {} chunk task(s) with {} strategy", tasks.size(), concurrencyStrategy);

    List<ChunkResult> results;
    try {
      results = new ArrayList<>(concurrencyStrategy.invokeAll(tasks));
    } catch (RuntimeException e) {
      log.error("Chunked execution of {} failed", split.getChunkExpression(), e);
      throw e;
    }
    results.sort(Comparator.comparingInt(ChunkResult::getSequence));
    return results;
  }

  private ChunkResult evaluate(SplitExpression split, DataSource source, Partition partition) {
    Object chunk = source.slice(partition.getStart(), partition.getStop());
    Object value =
        evaluator.evaluate(split.getChunkExpression(), Map.of(split.getChunkSymbol(), chunk));
    if (value instanceof Iterator) {
      value =
          Values.materialize(value, split.getChunkExpression().getShape().getElementType());
    }
    log.trace("Evaluated {}", partition);
    return new ChunkResult(partition.getSequence(), value);
  }
}
