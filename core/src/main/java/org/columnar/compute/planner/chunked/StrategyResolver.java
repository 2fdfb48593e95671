/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.columnar.compute.exception.UnsupportedExecutionException;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.OperationKind;
import org.columnar.compute.expression.Symbol;
import org.columnar.compute.storage.DataSource;

/**
 * Chooses how to execute an expression over a data source from a single dispatch table keyed on
 * the operation category and whether the source fits in memory. Each entry lists strategies in
 * order of preference; the first one the source has the capability for wins.
 */
@Log4j2
public class StrategyResolver {

  private static final Map<Key, List<ExecutionStrategy>> DISPATCH =
      ImmutableMap.<Key, List<ExecutionStrategy>>builder()
          .put(
              new Key(OperationCategory.CHEAP_HEAD, true),
              List.of(ExecutionStrategy.STREAM, ExecutionStrategy.DIRECT))
          .put(
              new Key(OperationCategory.CHEAP_HEAD, false),
              List.of(ExecutionStrategy.STREAM, ExecutionStrategy.CHUNKED))
          .put(
              new Key(OperationCategory.CHEAP, true),
              List.of(ExecutionStrategy.DIRECT, ExecutionStrategy.STREAM))
          .put(
              new Key(OperationCategory.CHEAP, false),
              List.of(ExecutionStrategy.STREAM, ExecutionStrategy.CHUNKED))
          .put(
              new Key(OperationCategory.REDUCTION, true),
              List.of(
                  ExecutionStrategy.DIRECT, ExecutionStrategy.CHUNKED, ExecutionStrategy.STREAM))
          .put(
              new Key(OperationCategory.REDUCTION, false),
              List.of(ExecutionStrategy.CHUNKED, ExecutionStrategy.STREAM))
          .build();

  private final MemoryPolicy memoryPolicy;

  public StrategyResolver(MemoryPolicy memoryPolicy) {
    this.memoryPolicy = memoryPolicy;
  }

  /**
   * Resolves the preferred strategy for an expression over a source.
   *
   * @throws UnsupportedExecutionException if the expression has no single leaf, relabels columns,
   *     or the source lacks the capabilities of every candidate strategy
   */
  public ExecutionStrategy resolve(
      Expression expression, DataSource source, ExecutionOptions options) {
    return candidates(expression, source, options).get(0);
  }

  /**
   * Returns every strategy the source has the capabilities for, most preferred first. Callers
   * move on to the next candidate when one turns out not to apply to the expression.
   *
   * @throws UnsupportedExecutionException if the expression has no single leaf, relabels columns,
   *     or the source lacks the capabilities of every candidate strategy
   */
  public List<ExecutionStrategy> candidates(
      Expression expression, DataSource source, ExecutionOptions options) {
    Symbol leaf = singleLeaf(expression);
    if (contains(expression, OperationKind.LABEL)) {
      throw new UnsupportedExecutionException(
          "Relabeling is not supported on a chunked data source: " + expression);
    }
    OperationCategory category = OperationClassifier.categorize(expression, leaf);
    long byteSize = source.byteSize();
    boolean fits =
        memoryPolicy.fitsInMemory(byteSize) && byteSize <= options.getCheapThresholdBytes();
    ImmutableList.Builder<ExecutionStrategy> usable = ImmutableList.builder();
    for (ExecutionStrategy strategy : DISPATCH.get(new Key(category, fits))) {
      if (source.supports(strategy.getRequiredCapability())) {
        usable.add(strategy);
      }
    }
    List<ExecutionStrategy> strategies = usable.build();
    if (strategies.isEmpty()) {
      throw new UnsupportedExecutionException(
          String.format(
              "No execution strategy for %s expression over a source with capabilities %s",
              category, source.capabilities()));
    }
    log.debug(
        "Resolved {} for {} expression over {} bytes (fits={})",
        strategies,
        category,
        byteSize,
        fits);
    return strategies;
  }

  /**
   * Returns the only leaf symbol of the expression.
   *
   * @throws UnsupportedExecutionException if there are none or several
   */
  public static Symbol singleLeaf(Expression expression) {
    List<Symbol> leaves = expression.leaves();
    if (leaves.size() != 1) {
      throw new UnsupportedExecutionException(
          String.format("Expected exactly one data source leaf but found %s", leaves));
    }
    return leaves.get(0);
  }

  private static boolean contains(Expression expression, OperationKind kind) {
    if (expression.getKind() == kind) {
      return true;
    }
    for (Expression child : expression.getChildren()) {
      if (contains(child, kind)) {
        return true;
      }
    }
    return false;
  }

  @EqualsAndHashCode
  @RequiredArgsConstructor
  private static class Key {
    private final OperationCategory category;
    private final boolean fits;
  }
}
