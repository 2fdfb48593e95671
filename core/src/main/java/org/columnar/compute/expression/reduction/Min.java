/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.reduction;

import org.columnar.compute.data.type.ElementType;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.ExpressionVisitor;
import org.columnar.compute.expression.OperationKind;

/** Smallest element of a collection by natural order. */
public class Min extends Reduction {

  public Min(Expression child, boolean keepDims) {
    super(child, keepDims);
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.MIN;
  }

  @Override
  public ElementType resultType() {
    return getChild().getShape().getElementType();
  }

  @Override
  public Reduction copy(Expression child, boolean keepDims) {
    return new Min(child, keepDims);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitMin(this, context);
  }
}
