/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import java.util.Iterator;
import java.util.List;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.ElementType;
import org.columnar.compute.data.type.RecordType;
import org.columnar.compute.exception.ExpressionEvaluationException;

/**
 * Conversions between the materialized ({@link Block}, {@link Page}, {@link List}) and lazy
 * ({@link Iterator}) forms of collection values.
 */
public final class Values {

  private Values() {}

  /** Returns true if the value is a collection in any of its forms. */
  public static boolean isCollection(Object value) {
    return value instanceof Block
        || value instanceof Page
        || value instanceof Iterator
        || value instanceof Iterable;
  }

  /**
   * Returns a lazy iterator over the elements of a collection value. Tables iterate as {@link
   * Row}s.
   *
   * @throws ExpressionEvaluationException if the value is not a collection
   */
  @SuppressWarnings("unchecked")
  public static Iterator<Object> iterator(Object value) {
    if (value instanceof Block) {
      return Blocks.iterator((Block) value);
    }
    if (value instanceof Page) {
      return Pages.iterator((Page) value);
    }
    if (value instanceof Iterator) {
      return (Iterator<Object>) value;
    }
    if (value instanceof Iterable) {
      return ((Iterable<Object>) value).iterator();
    }
    throw new ExpressionEvaluationException("Expected a collection but got " + describe(value));
  }

  /**
   * Materializes a collection value into a {@link Block} (primitive elements) or a {@link Page}
   * (record elements). Already materialized values are returned unchanged.
   */
  public static Object materialize(Object value, ElementType elementType) {
    if (value instanceof Block || value instanceof Page) {
      return value;
    }
    Iterator<Object> elements = iterator(value);
    if (elementType.isRecord()) {
      return Pages.fromRows((RecordType) elementType, elements);
    }
    BlockBuilder builder = new BlockBuilder((DataType) elementType);
    while (elements.hasNext()) {
      builder.append(elements.next());
    }
    return builder.build();
  }

  /** Returns an empty materialized collection of the element type. */
  public static Object empty(ElementType elementType) {
    if (elementType.isRecord()) {
      return Page.empty((RecordType) elementType);
    }
    return Blocks.empty((DataType) elementType);
  }

  /**
   * Orders two non-null values of compatible types. Integers compare exactly, mixed numbers as
   * doubles.
   *
   * @throws ExpressionEvaluationException if the values are not comparable
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static int compare(Object left, Object right) {
    if (left instanceof Number && right instanceof Number) {
      if (isIntegral(left) && isIntegral(right)) {
        return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
      }
      return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
    }
    if (left.getClass() == right.getClass() && left instanceof Comparable) {
      return ((Comparable) left).compareTo(right);
    }
    throw new ExpressionEvaluationException(
        String.format(
            "Cannot compare %s with %s",
            left.getClass().getSimpleName(), right.getClass().getSimpleName()));
  }

  /** Returns true for boxed integer values. */
  public static boolean isIntegral(Object value) {
    return value instanceof Long || value instanceof Integer;
  }

  /** Returns a short description of the value's runtime form, for error messages. */
  public static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
