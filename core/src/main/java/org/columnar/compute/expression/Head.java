/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import com.google.common.base.Preconditions;
import lombok.Getter;
import org.columnar.compute.data.type.DataShape;

/** The first {@code n} elements of a collection. */
public class Head extends UnaryExpression {

  @Getter private final long n;

  public Head(Expression child, long n) {
    super(child);
    Preconditions.checkArgument(n >= 0, "head size must be non-negative: %s", n);
    this.n = n;
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.HEAD;
  }

  @Override
  public DataShape getShape() {
    DataShape input = getChild().getShape();
    if (input.hasKnownLength()) {
      return DataShape.fixed(Math.min(n, input.getLength()), input.getElementType());
    }
    return DataShape.var(input.getElementType());
  }

  @Override
  public UnaryExpression withChild(Expression newChild) {
    return new Head(newChild, n);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitHead(this, context);
  }

  @Override
  public String toString() {
    return "head(" + getChild() + ", " + n + ")";
  }
}
