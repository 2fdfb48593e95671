/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import java.util.Objects;
import lombok.Getter;
import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.expression.predicate.Predicate;

/** Keeps the elements of a collection that satisfy a predicate, preserving order. */
public class Selection extends UnaryExpression {

  @Getter private final Predicate predicate;

  public Selection(Expression child, Predicate predicate) {
    super(child);
    this.predicate = Objects.requireNonNull(predicate, "predicate");
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.SELECTION;
  }

  @Override
  public DataShape getShape() {
    return DataShape.var(getChild().getShape().getElementType());
  }

  @Override
  public UnaryExpression withChild(Expression newChild) {
    return new Selection(newChild, predicate);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitSelection(this, context);
  }

  @Override
  public String toString() {
    return getChild() + "[" + predicate + "]";
  }
}
