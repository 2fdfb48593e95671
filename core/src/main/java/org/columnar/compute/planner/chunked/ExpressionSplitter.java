/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.exception.UnsupportedExecutionException;
import org.columnar.compute.expression.Distinct;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.GroupBy;
import org.columnar.compute.expression.Head;
import org.columnar.compute.expression.OperationKind;
import org.columnar.compute.expression.Slice;
import org.columnar.compute.expression.Symbol;
import org.columnar.compute.expression.reduction.CombineMoments;
import org.columnar.compute.expression.reduction.Count;
import org.columnar.compute.expression.reduction.Moments;
import org.columnar.compute.expression.reduction.NUnique;
import org.columnar.compute.expression.reduction.Reduction;
import org.columnar.compute.expression.reduction.StdDev;
import org.columnar.compute.expression.reduction.Sum;
import org.columnar.compute.expression.reduction.Variance;

/**
 * Rewrites an expression over a large source into a chunk-local part and an aggregate part, such
 * that evaluating the chunk part on every partition, concatenating the results in partition order
 * and evaluating the aggregate part on the concatenation gives the same result as evaluating the
 * original expression on the whole source.
 *
 * <p>The split point is the operation nearest the leaf that is not elementwise. Everything below
 * it moves into the chunk part. The split point itself becomes a chunk-local partial plus an
 * aggregate over the partials, and everything above it is rebuilt on top of the aggregate.
 */
@Log4j2
public class ExpressionSplitter {

  /**
   * Splits an expression.
   *
   * @param leaf the symbol bound to the whole source
   * @param expression the expression to split
   * @param chunkSymbol the symbol the chunk part reads each partition from
   * @return the chunk and aggregate parts
   * @throws UnsupportedExecutionException if the expression has several split points or its split
   *     point cannot be decomposed
   */
  public SplitExpression split(Symbol leaf, Expression expression, Symbol chunkSymbol) {
    List<Expression> splitPoints = splitPoints(expression, leaf);
    if (splitPoints.size() > 1) {
      throw new UnsupportedExecutionException(
          String.format(
              "Cannot split %s: %d independent reductions of the source",
              expression, splitPoints.size()));
    }
    if (splitPoints.isEmpty()) {
      Expression chunk = replace(expression, leaf, chunkSymbol);
      Symbol aggregate = aggregateSymbol(leaf, chunk);
      return new SplitExpression(chunkSymbol, chunk, aggregate, aggregate);
    }

    Expression splitPoint = splitPoints.get(0);
    Expression input = replace(splitPoint.getChildren().get(0), leaf, chunkSymbol);
    Expression chunk = chunkPart(splitPoint, input);
    Symbol aggregate = aggregateSymbol(leaf, chunk);
    Expression combined = aggregatePart(splitPoint, aggregate);
    Expression rebuilt = replace(expression, splitPoint, combined);
    if (rebuilt.dependsOn(leaf)) {
      throw new UnsupportedExecutionException(
          String.format(
              "Cannot split %s: the source is read both inside and outside %s",
              expression, splitPoint));
    }
    SplitExpression split = new SplitExpression(chunkSymbol, chunk, aggregate, rebuilt);
    log.debug("Split {} into {}", expression, split);
    return split;
  }

  private static Expression chunkPart(Expression splitPoint, Expression input) {
    switch (splitPoint.getKind()) {
      case COUNT:
      case SUM:
      case MIN:
      case MAX:
        return ((Reduction) splitPoint).copy(input, true);
      case MEAN:
      case VAR:
      case STD:
        return new Moments(input, true);
      case NUNIQUE:
      case DISTINCT:
        return new Distinct(input);
      case HEAD:
        return new Head(input, ((Head) splitPoint).getN());
      case SLICE:
        return input;
      case GROUP_BY:
        GroupBy groupBy = (GroupBy) splitPoint;
        checkDecomposable(groupBy);
        return new GroupBy(input, groupBy.getKey(), groupBy.getAggregates());
      default:
        throw new UnsupportedExecutionException(
            "Cannot execute " + splitPoint.getKind() + " chunk by chunk: " + splitPoint);
    }
  }

  private static Expression aggregatePart(Expression splitPoint, Symbol partials) {
    switch (splitPoint.getKind()) {
      case COUNT:
        return new Sum(partials, ((Count) splitPoint).isKeepDims());
      case SUM:
      case MIN:
      case MAX:
        return ((Reduction) splitPoint).copy(partials, ((Reduction) splitPoint).isKeepDims());
      case MEAN:
        return new CombineMoments(
            partials,
            CombineMoments.Statistic.MEAN,
            false,
            ((Reduction) splitPoint).isKeepDims());
      case VAR:
        Variance variance = (Variance) splitPoint;
        return new CombineMoments(
            partials,
            CombineMoments.Statistic.VARIANCE,
            variance.isUnbiased(),
            variance.isKeepDims());
      case STD:
        StdDev std = (StdDev) splitPoint;
        return new CombineMoments(
            partials, CombineMoments.Statistic.STD, std.isUnbiased(), std.isKeepDims());
      case NUNIQUE:
        return new NUnique(partials, ((NUnique) splitPoint).isKeepDims());
      case DISTINCT:
        return new Distinct(partials);
      case HEAD:
        return new Head(partials, ((Head) splitPoint).getN());
      case SLICE:
        Slice slice = (Slice) splitPoint;
        return new Slice(partials, slice.getStart(), slice.getStop());
      case GROUP_BY:
        return mergeGroups((GroupBy) splitPoint, partials);
      default:
        throw new UnsupportedExecutionException(
            "Cannot execute " + splitPoint.getKind() + " chunk by chunk: " + splitPoint);
    }
  }

  /** Regroups per-chunk group partials: counts are summed, the rest reapplied. */
  private static GroupBy mergeGroups(GroupBy groupBy, Symbol partials) {
    List<GroupBy.Aggregate> merged = new ArrayList<>();
    for (GroupBy.Aggregate aggregate : groupBy.getAggregates()) {
      OperationKind function =
          aggregate.getFunction() == OperationKind.COUNT
              ? OperationKind.SUM
              : aggregate.getFunction();
      merged.add(GroupBy.Aggregate.of(aggregate.getName(), function, aggregate.getName()));
    }
    return new GroupBy(partials, groupBy.getKey(), merged);
  }

  private static void checkDecomposable(GroupBy groupBy) {
    for (GroupBy.Aggregate aggregate : groupBy.getAggregates()) {
      switch (aggregate.getFunction()) {
        case COUNT:
        case SUM:
        case MIN:
        case MAX:
          break;
        default:
          throw new UnsupportedExecutionException(
              "Cannot execute group aggregate " + aggregate + " chunk by chunk");
      }
    }
  }

  /** The merged chunk results: a collection of whatever each chunk produces. */
  private static Symbol aggregateSymbol(Symbol leaf, Expression chunk) {
    return new Symbol(
        leaf.getName() + "_partials", DataShape.var(chunk.getShape().getElementType()));
  }

  /**
   * Returns the non-elementwise nodes nearest the leaf on every path down to it. Nodes that do not
   * depend on the leaf are ignored.
   */
  private static List<Expression> splitPoints(Expression expression, Symbol leaf) {
    Set<Expression> found = Collections.newSetFromMap(new IdentityHashMap<>());
    List<Expression> ordered = new ArrayList<>();
    collectSplitPoints(expression, leaf, found, ordered);
    return ordered;
  }

  private static boolean collectSplitPoints(
      Expression node, Symbol leaf, Set<Expression> found, List<Expression> ordered) {
    if (!node.dependsOn(leaf)) {
      return false;
    }
    boolean below = false;
    for (Expression child : node.getChildren()) {
      below |= collectSplitPoints(child, leaf, found, ordered);
    }
    if (!below && !OperationClassifier.isElementwise(node)) {
      if (found.add(node)) {
        ordered.add(node);
      }
      return true;
    }
    return below;
  }

  /** Rebuilds the tree with every occurrence (by identity) of {@code target} replaced. */
  static Expression replace(Expression node, Expression target, Expression replacement) {
    if (node == target) {
      return replacement;
    }
    List<Expression> children = node.getChildren();
    if (children.isEmpty()) {
      return node;
    }
    List<Expression> rewritten = new ArrayList<>(children.size());
    boolean changed = false;
    for (Expression child : children) {
      Expression newChild = replace(child, target, replacement);
      changed |= newChild != child;
      rewritten.add(newChild);
    }
    return changed ? node.withChildren(rewritten) : node;
  }
}
