/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.predicate;

import org.columnar.compute.data.model.Row;
import org.columnar.compute.exception.ExpressionEvaluationException;

/** Reads the operand of a predicate from an element. */
final class ElementAccess {

  private ElementAccess() {}

  /** Returns the named column of a row, or the element itself when {@code column} is null. */
  static Object read(Object element, String column) {
    if (column == null) {
      return element;
    }
    if (!(element instanceof Row)) {
      throw new ExpressionEvaluationException(
          "Predicate on column [" + column + "] applied to non-record element " + element);
    }
    return ((Row) element).get(column);
  }

  static String describe(String column) {
    return column == null ? "_" : column;
  }
}
