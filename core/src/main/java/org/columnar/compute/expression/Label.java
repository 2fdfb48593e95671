/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import com.google.common.base.Preconditions;
import lombok.Getter;
import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.ElementType;
import org.columnar.compute.data.type.RecordType;

/** Names a single-column result: a primitive collection becomes a one-column table. */
public class Label extends UnaryExpression {

  @Getter private final String label;
  private final DataShape shape;

  public Label(Expression child, String label) {
    super(child);
    ElementType input = child.getShape().getElementType();
    Preconditions.checkArgument(
        !input.isRecord() || ((RecordType) input).size() == 1,
        "label requires a single column, got %s",
        input);
    DataType type =
        input.isRecord() ? ((RecordType) input).getTypes().get(0) : (DataType) input;
    this.label = label;
    this.shape = child.getShape().withElementType(RecordType.of(label, type));
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.LABEL;
  }

  @Override
  public DataShape getShape() {
    return shape;
  }

  @Override
  public UnaryExpression withChild(Expression newChild) {
    return new Label(newChild, label);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitLabel(this, context);
  }

  @Override
  public String toString() {
    return getChild() + ".label('" + label + "')";
  }
}
