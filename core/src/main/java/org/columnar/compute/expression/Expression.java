/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.columnar.compute.data.type.DataShape;

/**
 * Immutable node of an expression tree. Every node declares the shape of its result, its children
 * and its {@link OperationKind}. The leaves of a tree are {@link Symbol}s, bound to data at
 * evaluation time.
 */
public abstract class Expression {

  /** Returns the tag of the operation this node performs. */
  public abstract OperationKind getKind();

  /** Returns the child expressions in evaluation order. */
  public abstract List<Expression> getChildren();

  /** Returns the declared shape of this node's result. */
  public abstract DataShape getShape();

  /**
   * Returns a copy of this node with the given children, in the order of {@link #getChildren()}.
   */
  public abstract Expression withChildren(List<Expression> children);

  public abstract <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);

  /** Returns the distinct symbols at the leaves of this tree, in depth-first order. */
  public List<Symbol> leaves() {
    Set<Symbol> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    List<Symbol> leaves = new ArrayList<>();
    collectLeaves(this, seen, leaves);
    return leaves;
  }

  private static void collectLeaves(Expression node, Set<Symbol> seen, List<Symbol> leaves) {
    if (node instanceof Symbol) {
      if (seen.add((Symbol) node)) {
        leaves.add((Symbol) node);
      }
      return;
    }
    for (Expression child : node.getChildren()) {
      collectLeaves(child, seen, leaves);
    }
  }

  /** Returns true if the symbol is a leaf of this tree. */
  public boolean dependsOn(Symbol symbol) {
    if (this == symbol) {
      return true;
    }
    for (Expression child : getChildren()) {
      if (child.dependsOn(symbol)) {
        return true;
      }
    }
    return false;
  }
}
