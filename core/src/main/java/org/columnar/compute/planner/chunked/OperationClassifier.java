/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

import java.util.EnumSet;
import java.util.Set;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.OperationKind;
import org.columnar.compute.expression.Symbol;

/** Tags expression nodes by how they can be executed over a large source. */
public final class OperationClassifier {

  private static final Set<OperationKind> CHEAP =
      EnumSet.of(
          OperationKind.SYMBOL,
          OperationKind.LITERAL,
          OperationKind.FIELD,
          OperationKind.PROJECTION,
          OperationKind.SELECTION,
          OperationKind.HEAD,
          OperationKind.ELEMWISE,
          OperationKind.ARITHMETIC,
          OperationKind.DISTINCT);

  private static final Set<OperationKind> ELEMENTWISE =
      EnumSet.of(
          OperationKind.SYMBOL,
          OperationKind.LITERAL,
          OperationKind.FIELD,
          OperationKind.PROJECTION,
          OperationKind.SELECTION,
          OperationKind.ELEMWISE,
          OperationKind.ARITHMETIC);

  private static final Set<OperationKind> REDUCTIONS =
      EnumSet.of(
          OperationKind.COUNT,
          OperationKind.SUM,
          OperationKind.MIN,
          OperationKind.MAX,
          OperationKind.MEAN,
          OperationKind.VAR,
          OperationKind.STD,
          OperationKind.NUNIQUE,
          OperationKind.GROUP_BY,
          OperationKind.MOMENTS,
          OperationKind.COMBINE_MOMENTS);

  private OperationClassifier() {}

  public static boolean isCheap(Expression node) {
    return CHEAP.contains(node.getKind());
  }

  /** Returns true for nodes that work on each element independently of the others. */
  public static boolean isElementwise(Expression node) {
    return ELEMENTWISE.contains(node.getKind());
  }

  public static boolean isReductionLike(Expression node) {
    return REDUCTIONS.contains(node.getKind());
  }

  /** Returns true if every node on every path from {@code expression} down to the leaf is cheap. */
  public static boolean isCheapPath(Expression expression, Symbol leaf) {
    if (!expression.dependsOn(leaf)) {
      return true;
    }
    if (!isCheap(expression)) {
      return false;
    }
    for (Expression child : expression.getChildren()) {
      if (!isCheapPath(child, leaf)) {
        return false;
      }
    }
    return true;
  }

  public static OperationCategory categorize(Expression expression, Symbol leaf) {
    if (!isCheapPath(expression, leaf)) {
      return OperationCategory.REDUCTION;
    }
    return expression.getKind() == OperationKind.HEAD
        ? OperationCategory.CHEAP_HEAD
        : OperationCategory.CHEAP;
  }
}
