/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.evaluator;

/** A predicate compiled to operate on a whole {@code Block} or {@code Page} at once. */
@FunctionalInterface
public interface VectorizedPredicate {

  /** Returns a mask with one entry per position of the batch, set where the predicate holds. */
  boolean[] evaluate(Object batch);
}
