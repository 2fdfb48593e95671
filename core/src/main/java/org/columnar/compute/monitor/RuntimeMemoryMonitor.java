/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.monitor;

import lombok.extern.log4j.Log4j2;

/** {@link MemoryMonitor} reading the headroom of the JVM heap. */
@Log4j2
public class RuntimeMemoryMonitor extends MemoryMonitor {

  private final Runtime runtime;

  public RuntimeMemoryMonitor() {
    this(Runtime.getRuntime());
  }

  RuntimeMemoryMonitor(Runtime runtime) {
    this.runtime = runtime;
  }

  /** Maximum heap minus the heap in use. */
  @Override
  public long availableMemory() {
    long used = runtime.totalMemory() - runtime.freeMemory();
    long available = runtime.maxMemory() - used;
    log.trace("Heap used {} bytes, available {} bytes", used, available);
    return available;
  }
}
