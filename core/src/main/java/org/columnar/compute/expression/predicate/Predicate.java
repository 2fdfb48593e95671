/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.predicate;

/**
 * Boolean condition over the elements of a collection. An element is either a bare value or a
 * {@link org.columnar.compute.data.model.Row} of a table.
 */
public interface Predicate {

  /** Returns true if the element satisfies the condition. */
  boolean test(Object element);

  <R, E extends Exception> R accept(PredicateVisitor<R, E> visitor) throws E;
}
