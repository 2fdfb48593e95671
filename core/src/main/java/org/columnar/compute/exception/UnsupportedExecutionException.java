/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.exception;

/**
 * The expression and data source combination has no known execution strategy. Distinct from a
 * runtime failure: the caller may retry the query on another backend.
 */
public class UnsupportedExecutionException extends ComputeEngineException {

  public UnsupportedExecutionException(String message) {
    super(message);
  }
}
