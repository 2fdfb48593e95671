/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.reduction;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.columnar.compute.exception.NumericDomainException;

/**
 * Count, sum and sum of squared deviations from the mean ({@code m2}) of a set of numbers.
 * Moments of disjoint sets merge exactly with the pairwise update of Chan, Golub and LeVeque, so
 * a large dataset can be summarized part by part without the cancellation of the textbook {@code
 * E[x^2] - E[x]^2} formula.
 */
@Getter
@ToString
@EqualsAndHashCode
public class RunningMoments {

  private long count;
  private double sum;
  private double m2;

  public RunningMoments() {
    this(0, 0.0, 0.0);
  }

  public RunningMoments(long count, double sum, double m2) {
    this.count = count;
    this.sum = sum;
    this.m2 = m2;
  }

  /** Computes the moments of the first {@code length} values with two passes over them. */
  public static RunningMoments of(double[] values, int length) {
    if (length == 0) {
      return new RunningMoments();
    }
    double sum = 0.0;
    for (int i = 0; i < length; i++) {
      sum += values[i];
    }
    double mean = sum / length;
    double m2 = 0.0;
    for (int i = 0; i < length; i++) {
      double deviation = values[i] - mean;
      m2 += deviation * deviation;
    }
    return new RunningMoments(length, sum, m2);
  }

  /**
   * Folds the moments of a disjoint set into this one.
   *
   * @return this
   */
  public RunningMoments merge(RunningMoments other) {
    if (other.count == 0) {
      return this;
    }
    if (count == 0) {
      count = other.count;
      sum = other.sum;
      m2 = other.m2;
      return this;
    }
    double delta = other.sum / other.count - sum / count;
    long total = count + other.count;
    m2 = m2 + other.m2 + delta * delta * ((double) count * other.count / total);
    sum += other.sum;
    count = total;
    return this;
  }

  public double mean() {
    if (count == 0) {
      throw new NumericDomainException("mean of an empty dataset is undefined");
    }
    return sum / count;
  }

  /**
   * Returns the variance, dividing {@code m2} by {@code count - 1} when unbiased and by {@code
   * count} otherwise.
   *
   * @throws NumericDomainException if the divisor is not positive
   */
  public double variance(boolean unbiased) {
    long divisor = count - (unbiased ? 1 : 0);
    if (divisor <= 0) {
      throw new NumericDomainException(
          String.format(
              "variance of %d element(s) with ddof %d is undefined", count, unbiased ? 1 : 0));
    }
    return m2 / divisor;
  }

  /** Returns the standard deviation. A variance made slightly negative by rounding yields 0. */
  public double std(boolean unbiased) {
    return Math.sqrt(Math.max(0.0, variance(unbiased)));
  }
}
