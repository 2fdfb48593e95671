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

/** Arithmetic mean: sum divided by count. Undefined for an empty collection. */
public class Mean extends Reduction {

  public Mean(Expression child, boolean keepDims) {
    super(child, keepDims);
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.MEAN;
  }

  @Override
  public ElementType resultType() {
    return DataType.DOUBLE;
  }

  @Override
  public Reduction copy(Expression child, boolean keepDims) {
    return new Mean(child, keepDims);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitMean(this, context);
  }
}
