/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.predicate;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Negation. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Not implements Predicate {

  private final Predicate operand;

  @Override
  public boolean test(Object element) {
    return !operand.test(element);
  }

  @Override
  public <R, E extends Exception> R accept(PredicateVisitor<R, E> visitor) throws E {
    return visitor.visitNot(this);
  }

  @Override
  public String toString() {
    return "~" + operand;
  }
}
