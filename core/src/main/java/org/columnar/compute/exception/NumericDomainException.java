/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.exception;

/** A numeric computation is undefined for its input, e.g. the mean of an empty dataset. */
public class NumericDomainException extends ComputeEngineException {

  public NumericDomainException(String message) {
    super(message);
  }
}
