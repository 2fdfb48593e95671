/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.monitor;

/**
 * Reports how much memory the engine may still use. Readings are advisory and taken fresh on
 * every call.
 */
public abstract class MemoryMonitor {

  /**
   * Available memory.
   *
   * @return bytes currently available for new allocations.
   */
  public abstract long availableMemory();
}
