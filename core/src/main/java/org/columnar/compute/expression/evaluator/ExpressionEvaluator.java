/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.evaluator;

import java.util.Map;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.Symbol;

/** Evaluates an expression tree against values bound to its leaf symbols. */
public interface ExpressionEvaluator {

  /**
   * Evaluates the expression.
   *
   * @param expression expression to evaluate
   * @param bindings value of every leaf symbol; a collection is a {@code Block}, {@code Page},
   *     {@code List} or lazy {@code Iterator}. A bound {@code DataSource} is iterated afresh by
   *     every reference to its symbol.
   * @return a scalar, a {@code Row}, or a collection value; a lazy input may yield a lazy output
   */
  Object evaluate(Expression expression, Map<Symbol, Object> bindings);
}
