/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.executor;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.columnar.compute.data.model.Values;
import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.exception.UnsupportedExecutionException;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.Symbol;
import org.columnar.compute.expression.evaluator.ExpressionEvaluator;
import org.columnar.compute.planner.chunked.ChunkExecutor;
import org.columnar.compute.planner.chunked.ChunkResult;
import org.columnar.compute.planner.chunked.ExecutionOptions;
import org.columnar.compute.planner.chunked.ExecutionStrategy;
import org.columnar.compute.planner.chunked.ExpressionSplitter;
import org.columnar.compute.planner.chunked.LeanProjection;
import org.columnar.compute.planner.chunked.ResultMerger;
import org.columnar.compute.planner.chunked.SplitExpression;
import org.columnar.compute.planner.chunked.StrategyResolver;
import org.columnar.compute.planner.chunked.partition.PartitionPlan;
import org.columnar.compute.planner.chunked.partition.PartitionPlanner;
import org.columnar.compute.storage.Capability;
import org.columnar.compute.storage.DataSource;

/**
 * Executes an expression over a possibly larger-than-memory data source. The expression must have
 * exactly one leaf symbol, which is bound to the source. Columns of a table the expression never
 * reads are pruned first. Depending on the resolved {@link ExecutionStrategy} the source is then
 * streamed, loaded whole, or processed partition by partition and the partial results aggregated.
 * An expression with no chunked form falls back to the next strategy the source supports.
 *
 * <p>Collection results are returned materialized: a {@code Block} for primitive elements, a
 * {@code Page} for records.
 */
@Log4j2
@RequiredArgsConstructor
public class ChunkedExecutionEngine {

  private final StrategyResolver strategyResolver;
  private final ExpressionEvaluator evaluator;
  private final ExpressionSplitter splitter;
  private final PartitionPlanner partitionPlanner;
  private final ChunkExecutor chunkExecutor;
  private final ResultMerger resultMerger;

  /**
   * Executes the expression.
   *
   * @throws org.columnar.compute.exception.UnsupportedExecutionException if no strategy applies
   */
  public Object execute(Expression expression, DataSource source, ExecutionOptions options) {
    Symbol leaf = StrategyResolver.singleLeaf(expression);
    Optional<List<String>> fields = LeanProjection.requiredFields(expression, leaf);
    if (fields.isPresent() && source.supports(Capability.PROJECT)) {
      Symbol narrowed = LeanProjection.narrow(leaf, fields.get());
      log.debug("Reading columns {} of {}", fields.get(), source);
      return execute(
          LeanProjection.rebind(expression, leaf, narrowed),
          narrowed,
          source.project(fields.get()),
          options);
    }
    return execute(LeanProjection.apply(expression, leaf), leaf, source, options);
  }

  private Object execute(
      Expression expression, Symbol leaf, DataSource source, ExecutionOptions options) {
    List<ExecutionStrategy> strategies = strategyResolver.candidates(expression, source, options);
    for (int i = 0; i < strategies.size(); i++) {
      ExecutionStrategy strategy = strategies.get(i);
      log.info("Executing {} over {} with {} strategy", expression, source, strategy);
      switch (strategy) {
        case STREAM:
          return materialize(
              evaluator.evaluate(expression, Map.of(leaf, source)), expression.getShape());
        case DIRECT:
          Object whole = source.slice(0, source.length());
          return materialize(
              evaluator.evaluate(expression, Map.of(leaf, whole)), expression.getShape());
        default:
          SplitExpression split;
          try {
            split = splitter.split(leaf, expression, chunkSymbol(leaf, options));
          } catch (UnsupportedExecutionException e) {
            if (i == strategies.size() - 1) {
              throw e;
            }
            log.info("No chunked form, trying {}: {}", strategies.get(i + 1), e.getMessage());
            continue;
          }
          return materialize(executeChunked(split, source, options), expression.getShape());
      }
    }
    throw new IllegalStateException("No strategy attempted for " + expression);
  }

  private Object executeChunked(
      SplitExpression split, DataSource source, ExecutionOptions options) {
    PartitionPlan plan = partitionPlanner.plan(source.length(), options.getChunkSize());
    log.info("Processing {} in {} partition(s) of {}", source, plan.size(), options.getChunkSize());

    List<ChunkResult> results =
        chunkExecutor.execute(split, source, plan, options.getConcurrencyStrategy());
    Object intermediate = resultMerger.merge(results, split.getAggregateSymbol().getShape());
    return evaluator.evaluate(
        split.getAggregateExpression(), Map.of(split.getAggregateSymbol(), intermediate));
  }

  private static Symbol chunkSymbol(Symbol leaf, ExecutionOptions options) {
    return new Symbol(
        leaf.getName() + "_chunk",
        DataShape.fixed(options.getChunkSize(), leaf.getShape().getElementType()));
  }

  private static Object materialize(Object result, DataShape shape) {
    if (shape.isCollection() && (result instanceof Iterator || result instanceof List)) {
      return Values.materialize(result, shape.getElementType());
    }
    return result;
  }
}
