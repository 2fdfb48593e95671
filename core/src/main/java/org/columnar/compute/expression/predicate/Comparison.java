/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.predicate;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.columnar.compute.data.model.Values;

/**
 * Compares a column of each record, or each bare element when {@code column} is null, against a
 * literal. Missing values never match.
 */
@Getter
@EqualsAndHashCode
public class Comparison implements Predicate {

  private final String column;
  private final ComparisonOperator operator;
  private final Object literal;

  public Comparison(String column, ComparisonOperator operator, Object literal) {
    this.column = column;
    this.operator = operator;
    this.literal = literal;
  }

  @Override
  public boolean test(Object element) {
    Object value = ElementAccess.read(element, column);
    if (value == null || literal == null) {
      return false;
    }
    return operator.holds(Values.compare(value, literal));
  }

  @Override
  public <R, E extends Exception> R accept(PredicateVisitor<R, E> visitor) throws E {
    return visitor.visitComparison(this);
  }

  @Override
  public String toString() {
    return ElementAccess.describe(column) + " " + operator.getSymbol() + " " + literal;
  }
}
