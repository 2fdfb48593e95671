/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.type;

import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Declared shape of an expression result: either a scalar of some element type or a
 * one-dimensional collection of elements, optionally with a known length.
 */
@Getter
@EqualsAndHashCode
public class DataShape {

  private final boolean collection;

  /** Known number of elements, or null when the length is variable. Always null for scalars. */
  private final Long length;

  private final ElementType elementType;

  private DataShape(boolean collection, Long length, ElementType elementType) {
    this.collection = collection;
    this.length = length;
    this.elementType = Objects.requireNonNull(elementType, "elementType");
  }

  public static DataShape scalar(ElementType elementType) {
    return new DataShape(false, null, elementType);
  }

  public static DataShape fixed(long length, ElementType elementType) {
    return new DataShape(true, length, elementType);
  }

  public static DataShape var(ElementType elementType) {
    return new DataShape(true, null, elementType);
  }

  /** Returns a collection shape of the same kind but a different element type. */
  public DataShape withElementType(ElementType type) {
    return new DataShape(collection, length, type);
  }

  public boolean isScalar() {
    return !collection;
  }

  public boolean hasKnownLength() {
    return length != null;
  }

  @Override
  public String toString() {
    if (!collection) {
      return elementType.typeName();
    }
    return (length == null ? "var" : length.toString()) + " * " + elementType.typeName();
  }
}
