/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import java.util.List;
import lombok.Getter;
import org.columnar.compute.data.type.DataShape;

/**
 * Named placeholder for the data a tree runs against. Symbols are compared by identity: two symbols
 * with the same name and shape are still distinct bindings.
 */
public class Symbol extends Expression {

  @Getter private final String name;
  private final DataShape shape;

  public Symbol(String name, DataShape shape) {
    this.name = name;
    this.shape = shape;
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.SYMBOL;
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
    return visitor.visitSymbol(this, context);
  }

  @Override
  public String toString() {
    return name;
  }
}
