/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.reduction;

import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.ElementType;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.ExpressionVisitor;
import org.columnar.compute.expression.OperationKind;

/** Sum of a numeric collection; integer sums stay integers. The sum of nothing is zero. */
public class Sum extends Reduction {

  public Sum(Expression child, boolean keepDims) {
    super(child, keepDims);
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.SUM;
  }

  @Override
  public ElementType resultType() {
    return getChild().getShape().getElementType() == DataType.DOUBLE
        ? DataType.DOUBLE
        : DataType.LONG;
  }

  @Override
  public Reduction copy(Expression child, boolean keepDims) {
    return new Sum(child, keepDims);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitSum(this, context);
  }
}
