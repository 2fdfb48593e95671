/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.Objects;
import lombok.Getter;

/** Expression node with exactly one child. */
public abstract class UnaryExpression extends Expression {

  @Getter private final Expression child;

  protected UnaryExpression(Expression child) {
    this.child = Objects.requireNonNull(child, "child");
  }

  /** Returns a copy of this node over a different child. */
  public abstract UnaryExpression withChild(Expression newChild);

  @Override
  public List<Expression> getChildren() {
    return List.of(child);
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    Preconditions.checkArgument(children.size() == 1, "%s takes one child", getKind());
    return withChild(children.get(0));
  }
}
