/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import org.columnar.compute.data.type.DataShape;

/** Unique elements of a collection, in order of first appearance. */
public class Distinct extends UnaryExpression {

  public Distinct(Expression child) {
    super(child);
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.DISTINCT;
  }

  @Override
  public DataShape getShape() {
    return DataShape.var(getChild().getShape().getElementType());
  }

  @Override
  public UnaryExpression withChild(Expression newChild) {
    return new Distinct(newChild);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitDistinct(this, context);
  }

  @Override
  public String toString() {
    return "distinct(" + getChild() + ")";
  }
}
