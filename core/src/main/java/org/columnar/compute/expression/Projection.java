/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.data.type.RecordType;

/** Keeps a subset of the columns of a table, in the given order. */
public class Projection extends UnaryExpression {

  @Getter private final List<String> fields;
  private final DataShape shape;

  public Projection(Expression child, List<String> fields) {
    super(child);
    Preconditions.checkArgument(
        child.getShape().getElementType().isRecord(),
        "projection requires a record input, got %s",
        child.getShape());
    RecordType record = (RecordType) child.getShape().getElementType();
    this.fields = ImmutableList.copyOf(fields);
    this.shape = child.getShape().withElementType(record.project(this.fields));
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.PROJECTION;
  }

  @Override
  public DataShape getShape() {
    return shape;
  }

  @Override
  public UnaryExpression withChild(Expression newChild) {
    return new Projection(newChild, fields);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitProjection(this, context);
  }

  @Override
  public String toString() {
    return getChild() + "[" + String.join(", ", fields) + "]";
  }
}
