/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.exception;

/** Base class of all compute engine exceptions. */
public class ComputeEngineException extends RuntimeException {

  public ComputeEngineException(String message) {
    super(message);
  }

  public ComputeEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
