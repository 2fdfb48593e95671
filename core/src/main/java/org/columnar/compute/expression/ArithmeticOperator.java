/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.exception.NumericDomainException;

/** Binary arithmetic operators. */
@RequiredArgsConstructor
public enum ArithmeticOperator {
  ADD("+"),
  SUBTRACT("-"),
  MULTIPLY("*"),
  DIVIDE("/");

  @Getter private final String symbol;

  /** Returns the result type of the operator over the operand types. */
  public DataType resultType(DataType left, DataType right) {
    DataType widened = DataType.widen(left, right);
    return this == DIVIDE ? DataType.DOUBLE : widened;
  }

  /**
   * Applies the operator.
   *
   * @throws NumericDomainException on division by zero
   */
  public Object apply(Number left, Number right, DataType resultType) {
    if (resultType == DataType.LONG) {
      long l = left.longValue();
      long r = right.longValue();
      switch (this) {
        case ADD:
          return l + r;
        case SUBTRACT:
          return l - r;
        case MULTIPLY:
          return l * r;
        default:
          throw new IllegalStateException("integer division is computed in floating point");
      }
    }
    double l = left.doubleValue();
    double r = right.doubleValue();
    switch (this) {
      case ADD:
        return l + r;
      case SUBTRACT:
        return l - r;
      case MULTIPLY:
        return l * r;
      default:
        if (r == 0.0) {
          throw new NumericDomainException("division by zero");
        }
        return l / r;
    }
  }
}
