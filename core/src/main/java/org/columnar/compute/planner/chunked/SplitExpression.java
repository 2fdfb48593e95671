/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.Symbol;

/**
 * An expression rewritten for chunked execution: {@code chunkExpression} runs on each partition
 * bound to {@code chunkSymbol}; {@code aggregateExpression} runs once on the merged chunk results
 * bound to {@code aggregateSymbol}.
 */
@Getter
@RequiredArgsConstructor
public class SplitExpression {

  private final Symbol chunkSymbol;
  private final Expression chunkExpression;
  private final Symbol aggregateSymbol;
  private final Expression aggregateExpression;

  @Override
  public String toString() {
    return "chunk: "
        + chunkSymbol
        + " -> "
        + chunkExpression
        + ", aggregate: "
        + aggregateSymbol
        + " -> "
        + aggregateExpression;
  }
}
