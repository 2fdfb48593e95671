/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.reduction;

import com.google.common.base.Preconditions;
import lombok.Getter;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.ElementType;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.ExpressionVisitor;
import org.columnar.compute.expression.OperationKind;

/**
 * Combines a table of {@link Moments} rows, one per part of a dataset, into the mean, variance or
 * standard deviation of the whole dataset.
 */
public class CombineMoments extends Reduction {

  /** The statistic computed from the combined moments. */
  public enum Statistic {
    MEAN,
    VARIANCE,
    STD
  }

  @Getter private final Statistic statistic;
  @Getter private final boolean unbiased;

  public CombineMoments(
      Expression child, Statistic statistic, boolean unbiased, boolean keepDims) {
    super(child, keepDims);
    Preconditions.checkArgument(
        Moments.TYPE.equals(child.getShape().getElementType()),
        "combine moments requires %s rows, got %s",
        Moments.TYPE,
        child.getShape());
    this.statistic = statistic;
    this.unbiased = unbiased;
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.COMBINE_MOMENTS;
  }

  @Override
  public ElementType resultType() {
    return DataType.DOUBLE;
  }

  @Override
  public Reduction copy(Expression child, boolean keepDims) {
    return new CombineMoments(child, statistic, unbiased, keepDims);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitCombineMoments(this, context);
  }

  @Override
  public String toString() {
    return statistic.name().toLowerCase() + "_of_moments(" + getChild() + ")";
  }
}
