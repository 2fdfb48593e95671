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

/** Number of non-null elements of a collection, or rows of a table. */
public class Count extends Reduction {

  public Count(Expression child, boolean keepDims) {
    super(child, keepDims);
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.COUNT;
  }

  @Override
  public ElementType resultType() {
    return DataType.LONG;
  }

  @Override
  public Reduction copy(Expression child, boolean keepDims) {
    return new Count(child, keepDims);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitCount(this, context);
  }
}
