/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import com.google.common.base.Preconditions;
import lombok.Getter;
import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.data.type.RecordType;

/** Selects one named column of a table, or one field of a record. */
public class Field extends UnaryExpression {

  @Getter private final String name;
  private final DataShape shape;

  public Field(Expression child, String name) {
    super(child);
    Preconditions.checkArgument(
        child.getShape().getElementType().isRecord(),
        "field [%s] requires a record input, got %s",
        name,
        child.getShape());
    RecordType record = (RecordType) child.getShape().getElementType();
    this.name = name;
    this.shape = child.getShape().withElementType(record.typeOf(name));
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.FIELD;
  }

  @Override
  public DataShape getShape() {
    return shape;
  }

  @Override
  public UnaryExpression withChild(Expression newChild) {
    return new Field(newChild, name);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitField(this, context);
  }

  @Override
  public String toString() {
    return getChild() + "." + name;
  }
}
