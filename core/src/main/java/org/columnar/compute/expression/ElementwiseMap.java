/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import com.google.common.base.Preconditions;
import lombok.Getter;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.DataShape;

/** Applies a {@link MathFunction} to every element of a numeric collection, or to a scalar. */
public class ElementwiseMap extends UnaryExpression {

  @Getter private final MathFunction function;
  private final DataShape shape;

  public ElementwiseMap(Expression child, MathFunction function) {
    super(child);
    Preconditions.checkArgument(
        child.getShape().getElementType() instanceof DataType,
        "%s requires a primitive input, got %s",
        function,
        child.getShape());
    this.function = function;
    this.shape =
        child
            .getShape()
            .withElementType(function.resultType((DataType) child.getShape().getElementType()));
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.ELEMWISE;
  }

  @Override
  public DataShape getShape() {
    return shape;
  }

  @Override
  public UnaryExpression withChild(Expression newChild) {
    return new ElementwiseMap(newChild, function);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitElementwiseMap(this, context);
  }

  @Override
  public String toString() {
    return function.name().toLowerCase() + "(" + getChild() + ")";
  }
}
