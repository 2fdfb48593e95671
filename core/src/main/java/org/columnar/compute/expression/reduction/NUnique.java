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

/** Exact number of distinct elements of a collection. */
public class NUnique extends Reduction {

  public NUnique(Expression child, boolean keepDims) {
    super(child, keepDims);
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.NUNIQUE;
  }

  @Override
  public ElementType resultType() {
    return DataType.LONG;
  }

  @Override
  public Reduction copy(Expression child, boolean keepDims) {
    return new NUnique(child, keepDims);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitNUnique(this, context);
  }
}
