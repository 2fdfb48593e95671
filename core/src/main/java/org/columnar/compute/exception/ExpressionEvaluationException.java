/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.exception;

/** An expression cannot be evaluated against the value bound to it. */
public class ExpressionEvaluationException extends ComputeEngineException {

  public ExpressionEvaluationException(String message) {
    super(message);
  }
}
