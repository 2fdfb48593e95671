/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.reduction;

import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.data.type.ElementType;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.UnaryExpression;

/**
 * Reduces a collection to a single value. With {@code keepDims} the value is kept embedded in a
 * one-element collection instead of returned as a bare scalar.
 */
public abstract class Reduction extends UnaryExpression {

  private final boolean keepDims;

  protected Reduction(Expression child, boolean keepDims) {
    super(child);
    this.keepDims = keepDims;
  }

  public boolean isKeepDims() {
    return keepDims;
  }

  /** Returns the element type of the reduced value. */
  public abstract ElementType resultType();

  /** Returns a copy of this reduction with a different child and presentation shape. */
  public abstract Reduction copy(Expression child, boolean keepDims);

  @Override
  public DataShape getShape() {
    return keepDims ? DataShape.fixed(1, resultType()) : DataShape.scalar(resultType());
  }

  @Override
  public UnaryExpression withChild(Expression newChild) {
    return copy(newChild, keepDims);
  }

  @Override
  public String toString() {
    return getKind().name().toLowerCase()
        + "("
        + getChild()
        + (keepDims ? ", keepdims" : "")
        + ")";
  }
}
