/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import com.google.common.base.Preconditions;
import lombok.Getter;
import org.columnar.compute.data.type.DataShape;

/** The elements at positions {@code [start, stop)} of a collection, clamped to its length. */
public class Slice extends UnaryExpression {

  @Getter private final long start;
  @Getter private final long stop;

  public Slice(Expression child, long start, long stop) {
    super(child);
    Preconditions.checkArgument(
        start >= 0 && stop >= start, "invalid slice [%s, %s)", start, stop);
    this.start = start;
    this.stop = stop;
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.SLICE;
  }

  @Override
  public DataShape getShape() {
    DataShape input = getChild().getShape();
    if (input.hasKnownLength()) {
      long length = input.getLength();
      return DataShape.fixed(
          Math.max(0, Math.min(stop, length) - Math.min(start, length)), input.getElementType());
    }
    return DataShape.var(input.getElementType());
  }

  @Override
  public UnaryExpression withChild(Expression newChild) {
    return new Slice(newChild, start, stop);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitSlice(this, context);
  }

  @Override
  public String toString() {
    return getChild() + "[" + start + ":" + stop + "]";
  }
}
