/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.type;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Primitive element types supported by blocks and expressions. */
@RequiredArgsConstructor
public enum DataType implements ElementType {
  BOOLEAN(1),
  LONG(Long.BYTES),
  DOUBLE(Double.BYTES),
  /** Variable width; the byte width is an estimate used for sizing. */
  STRING(16);

  @Getter private final int byteWidth;

  @Override
  public String typeName() {
    return name().toLowerCase();
  }

  public boolean isNumeric() {
    return this == LONG || this == DOUBLE;
  }

  /**
   * Returns the type arithmetic between the two types produces.
   *
   * @throws IllegalArgumentException if either type is not numeric
   */
  public static DataType widen(DataType left, DataType right) {
    if (!left.isNumeric() || !right.isNumeric()) {
      throw new IllegalArgumentException(
          "arithmetic requires numeric operands, got " + left + " and " + right);
    }
    return left == LONG && right == LONG ? LONG : DOUBLE;
  }

  /** Infers the type of a scalar Java value. */
  public static DataType of(Object value) {
    if (value instanceof Long || value instanceof Integer || value instanceof Short) {
      return LONG;
    }
    if (value instanceof Number) {
      return DOUBLE;
    }
    if (value instanceof Boolean) {
      return BOOLEAN;
    }
    if (value instanceof String) {
      return STRING;
    }
    throw new IllegalArgumentException(
        "Unsupported scalar " + (value == null ? "null" : value.getClass().getName()));
  }
}
