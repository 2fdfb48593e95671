/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.predicate;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Binary comparison operators. */
@RequiredArgsConstructor
public enum ComparisonOperator {
  EQ("=="),
  NE("!="),
  LT("<"),
  LTE("<="),
  GT(">"),
  GTE(">=");

  @Getter private final String symbol;

  /** Returns true if {@code left op right} holds for an ordering result of {@code compare}. */
  public boolean holds(int compare) {
    switch (this) {
      case EQ:
        return compare == 0;
      case NE:
        return compare != 0;
      case LT:
        return compare < 0;
      case LTE:
        return compare <= 0;
      case GT:
        return compare > 0;
      case GTE:
        return compare >= 0;
      default:
        throw new IllegalStateException("unknown operator " + this);
    }
  }

  public boolean isOrdering() {
    return this != EQ && this != NE;
  }
}
