/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.exception;

/**
 * A predicate cannot be compiled into a vectorized mask. Always handled by falling back to
 * element-by-element evaluation.
 */
public class PredicateCompilationException extends Exception {

  public PredicateCompilationException(String message) {
    super(message);
  }
}
