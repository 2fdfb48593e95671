/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import java.util.List;
import lombok.Getter;
import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.data.type.DataType;

/** Scalar constant. Literals are not leaves: they never need a binding. */
public class Literal extends Expression {

  @Getter private final Object value;
  private final DataShape shape;

  public Literal(Object value) {
    this.value = value;
    this.shape = DataShape.scalar(DataType.of(value));
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.LITERAL;
  }

  @Override
  public List<Expression> getChildren() {
    return List.of();
  }

  @Override
  public DataShape getShape() {
    return shape;
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    return this;
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitLiteral(this, context);
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
