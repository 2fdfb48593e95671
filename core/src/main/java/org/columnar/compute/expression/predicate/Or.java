/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.predicate;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Either operand holds. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Or implements Predicate {

  private final Predicate left;
  private final Predicate right;

  @Override
  public boolean test(Object element) {
    return left.test(element) || right.test(element);
  }

  @Override
  public <R, E extends Exception> R accept(PredicateVisitor<R, E> visitor) throws E {
    return visitor.visitOr(this);
  }

  @Override
  public String toString() {
    return "(" + left + " || " + right + ")";
  }
}
