/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.reduction;

import lombok.Getter;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.ElementType;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.ExpressionVisitor;
import org.columnar.compute.expression.OperationKind;

/** Standard deviation, the square root of {@link Variance}. */
public class StdDev extends Reduction {

  @Getter private final boolean unbiased;

  public StdDev(Expression child, boolean unbiased, boolean keepDims) {
    super(child, keepDims);
    this.unbiased = unbiased;
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.STD;
  }

  @Override
  public ElementType resultType() {
    return DataType.DOUBLE;
  }

  @Override
  public Reduction copy(Expression child, boolean keepDims) {
    return new StdDev(child, unbiased, keepDims);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitStdDev(this, context);
  }
}
