/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import org.columnar.compute.expression.reduction.CombineMoments;
import org.columnar.compute.expression.reduction.Count;
import org.columnar.compute.expression.reduction.Max;
import org.columnar.compute.expression.reduction.Mean;
import org.columnar.compute.expression.reduction.Min;
import org.columnar.compute.expression.reduction.Moments;
import org.columnar.compute.expression.reduction.NUnique;
import org.columnar.compute.expression.reduction.StdDev;
import org.columnar.compute.expression.reduction.Sum;
import org.columnar.compute.expression.reduction.Variance;

/**
 * Abstract visitor over expression trees. Every node type delegates to {@link #visitNode} unless
 * overridden.
 *
 * @param <R> return type of visit methods
 * @param <C> context type passed down the tree
 */
public abstract class ExpressionVisitor<R, C> {

  public R visitNode(Expression node, C context) {
    return null;
  }

  public R visitSymbol(Symbol symbol, C context) {
    return visitNode(symbol, context);
  }

  public R visitLiteral(Literal literal, C context) {
    return visitNode(literal, context);
  }

  public R visitField(Field field, C context) {
    return visitNode(field, context);
  }

  public R visitProjection(Projection projection, C context) {
    return visitNode(projection, context);
  }

  public R visitSelection(Selection selection, C context) {
    return visitNode(selection, context);
  }

  public R visitHead(Head head, C context) {
    return visitNode(head, context);
  }

  public R visitSlice(Slice slice, C context) {
    return visitNode(slice, context);
  }

  public R visitElementwiseMap(ElementwiseMap map, C context) {
    return visitNode(map, context);
  }

  public R visitArithmetic(Arithmetic arithmetic, C context) {
    return visitNode(arithmetic, context);
  }

  public R visitDistinct(Distinct distinct, C context) {
    return visitNode(distinct, context);
  }

  public R visitLabel(Label label, C context) {
    return visitNode(label, context);
  }

  public R visitGroupBy(GroupBy groupBy, C context) {
    return visitNode(groupBy, context);
  }

  public R visitCount(Count count, C context) {
    return visitNode(count, context);
  }

  public R visitSum(Sum sum, C context) {
    return visitNode(sum, context);
  }

  public R visitMin(Min min, C context) {
    return visitNode(min, context);
  }

  public R visitMax(Max max, C context) {
    return visitNode(max, context);
  }

  public R visitMean(Mean mean, C context) {
    return visitNode(mean, context);
  }

  public R visitVariance(Variance variance, C context) {
    return visitNode(variance, context);
  }

  public R visitStdDev(StdDev std, C context) {
    return visitNode(std, context);
  }

  public R visitNUnique(NUnique nunique, C context) {
    return visitNode(nunique, context);
  }

  public R visitMoments(Moments moments, C context) {
    return visitNode(moments, context);
  }

  public R visitCombineMoments(CombineMoments combine, C context) {
    return visitNode(combine, context);
  }
}
