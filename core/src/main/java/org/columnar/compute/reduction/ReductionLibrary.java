/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.reduction;

import java.util.HashSet;
import java.util.Iterator;
import java.util.Optional;
import java.util.Set;
import org.columnar.compute.data.model.Block;
import org.columnar.compute.data.model.Page;
import org.columnar.compute.data.model.Values;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.exception.ExpressionEvaluationException;
import org.columnar.compute.exception.NumericDomainException;

/**
 * Reductions over collection values in any of their forms ({@link Block}, {@link Page}, {@link
 * java.util.List} or a lazy {@link Iterator}). Each reduction makes a single pass, so lazy inputs
 * are consumed exactly once. Missing values are skipped.
 */
public final class ReductionLibrary {

  /** Number of elements summarized at a time when computing moments. */
  public static final int MOMENTS_CHUNK_SIZE = 1 << 15;

  private ReductionLibrary() {}

  /** Returns the number of non-missing elements, or the number of rows of a table. */
  public static long count(Object values) {
    if (values instanceof Page) {
      return ((Page) values).getPositionCount();
    }
    if (values instanceof Block) {
      Block block = (Block) values;
      long count = 0;
      for (int i = 0; i < block.getPositionCount(); i++) {
        if (!block.isNull(i)) {
          count++;
        }
      }
      return count;
    }
    long count = 0;
    for (Iterator<Object> it = Values.iterator(values); it.hasNext(); ) {
      if (it.next() != null) {
        count++;
      }
    }
    return count;
  }

  /**
   * Returns the sum as a {@code Long} for integer input and a {@code Double} otherwise. The sum of
   * no elements is zero.
   *
   * @param type declared element type, used when the values carry no runtime type
   */
  public static Number sum(Object values, DataType type) {
    if (values instanceof Block) {
      Block block = (Block) values;
      checkNumeric(block.getType());
      if (block.getType() == DataType.LONG) {
        long sum = 0;
        for (int i = 0; i < block.getPositionCount(); i++) {
          sum += ((Number) block.getValue(i)).longValue();
        }
        return sum;
      }
      double sum = 0.0;
      for (int i = 0; i < block.getPositionCount(); i++) {
        sum += block.getDouble(i);
      }
      return sum;
    }
    checkNumeric(type);
    long longSum = 0;
    double doubleSum = 0.0;
    boolean integral = type == DataType.LONG;
    for (Iterator<Object> it = Values.iterator(values); it.hasNext(); ) {
      Object value = it.next();
      if (value == null) {
        continue;
      }
      Number number = asNumber(value);
      if (integral && Values.isIntegral(number)) {
        longSum += number.longValue();
      } else {
        if (integral) {
          doubleSum = longSum;
          integral = false;
        }
        doubleSum += number.doubleValue();
      }
    }
    if (type == DataType.LONG && integral) {
      return longSum;
    }
    return doubleSum;
  }

  /**
   * Returns {@code sum / count}.
   *
   * @throws NumericDomainException if there are no elements
   */
  public static double mean(Object values, DataType type) {
    if (values instanceof Iterator) {
      return moments(values).mean();
    }
    long count = count(values);
    if (count == 0) {
      throw new NumericDomainException("mean of an empty dataset is undefined");
    }
    return sum(values, type).doubleValue() / count;
  }

  /**
   * Summarizes the values {@value #MOMENTS_CHUNK_SIZE} elements at a time and merges the partial
   * moments.
   */
  public static RunningMoments moments(Object values) {
    RunningMoments moments = new RunningMoments();
    double[] buffer = new double[MOMENTS_CHUNK_SIZE];
    int length = 0;
    if (values instanceof Block) {
      Block block = (Block) values;
      checkNumeric(block.getType());
      for (int i = 0; i < block.getPositionCount(); i++) {
        buffer[length++] = block.getDouble(i);
        if (length == buffer.length) {
          moments.merge(RunningMoments.of(buffer, length));
          length = 0;
        }
      }
    } else {
      for (Iterator<Object> it = Values.iterator(values); it.hasNext(); ) {
        Object value = it.next();
        if (value == null) {
          continue;
        }
        buffer[length++] = asNumber(value).doubleValue();
        if (length == buffer.length) {
          moments.merge(RunningMoments.of(buffer, length));
          length = 0;
        }
      }
    }
    return moments.merge(RunningMoments.of(buffer, length));
  }

  public static double variance(Object values, boolean unbiased) {
    return moments(values).variance(unbiased);
  }

  public static double std(Object values, boolean unbiased) {
    return moments(values).std(unbiased);
  }

  /** Returns the exact number of distinct non-missing elements. */
  public static long nunique(Object values) {
    Set<Object> seen = new HashSet<>();
    for (Iterator<Object> it = Values.iterator(values); it.hasNext(); ) {
      Object value = it.next();
      if (value != null) {
        seen.add(value);
      }
    }
    return seen.size();
  }

  /** Returns the smallest element, or empty if there are none. */
  public static Optional<Object> min(Object values) {
    return extremum(values, -1);
  }

  /** Returns the largest element, or empty if there are none. */
  public static Optional<Object> max(Object values) {
    return extremum(values, 1);
  }

  private static Optional<Object> extremum(Object values, int direction) {
    Object best = null;
    for (Iterator<Object> it = Values.iterator(values); it.hasNext(); ) {
      Object value = it.next();
      if (value != null && (best == null || Values.compare(value, best) * direction > 0)) {
        best = value;
      }
    }
    return Optional.ofNullable(best);
  }

  private static void checkNumeric(DataType type) {
    if (!type.isNumeric()) {
      throw new ExpressionEvaluationException(
          "Expected numeric values but got " + type.typeName());
    }
  }

  private static Number asNumber(Object value) {
    if (!(value instanceof Number)) {
      throw new ExpressionEvaluationException(
          "Expected a number but got " + Values.describe(value));
    }
    return (Number) value;
  }
}
