/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import org.columnar.compute.data.type.DataType;

/** Unary numeric functions applied element by element. */
public enum MathFunction {
  ABS(true) {
    @Override
    public double apply(double value) {
      return Math.abs(value);
    }

    @Override
    public long apply(long value) {
      return Math.abs(value);
    }
  },
  NEGATE(true) {
    @Override
    public double apply(double value) {
      return -value;
    }

    @Override
    public long apply(long value) {
      return -value;
    }
  },
  SQUARE(true) {
    @Override
    public double apply(double value) {
      return value * value;
    }

    @Override
    public long apply(long value) {
      return value * value;
    }
  },
  SQRT(false) {
    @Override
    public double apply(double value) {
      return Math.sqrt(value);
    }
  },
  LOG(false) {
    @Override
    public double apply(double value) {
      return Math.log(value);
    }
  },
  EXP(false) {
    @Override
    public double apply(double value) {
      return Math.exp(value);
    }
  };

  private final boolean preservesIntegers;

  MathFunction(boolean preservesIntegers) {
    this.preservesIntegers = preservesIntegers;
  }

  public abstract double apply(double value);

  /** Integer variant; only functions that map integers to integers override it. */
  public long apply(long value) {
    throw new UnsupportedOperationException(name() + " does not produce integers");
  }

  /** Returns the type of the function's result for an input type. */
  public DataType resultType(DataType input) {
    if (!input.isNumeric()) {
      throw new IllegalArgumentException(name() + " requires a numeric input, got " + input);
    }
    return input == DataType.LONG && preservesIntegers ? DataType.LONG : DataType.DOUBLE;
  }

  /** Applies the function to a boxed number, producing a value of {@link #resultType}. */
  public Object applyTo(Number value, DataType inputType) {
    if (resultType(inputType) == DataType.LONG) {
      return apply(value.longValue());
    }
    return apply(value.doubleValue());
  }
}
