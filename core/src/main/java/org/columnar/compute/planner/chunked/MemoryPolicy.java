/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

import com.google.common.base.Preconditions;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.columnar.compute.monitor.MemoryMonitor;

/**
 * Decides whether a dataset comfortably fits in memory: its size must stay below a fixed fraction
 * ({@code 1 / divisor}) of the memory available right now.
 */
@Log4j2
public class MemoryPolicy {

  public static final long DEFAULT_DIVISOR = 4;

  private final MemoryMonitor memoryMonitor;
  @Getter private final long divisor;

  public MemoryPolicy(MemoryMonitor memoryMonitor) {
    this(memoryMonitor, DEFAULT_DIVISOR);
  }

  public MemoryPolicy(MemoryMonitor memoryMonitor, long divisor) {
    Preconditions.checkArgument(divisor >= 1, "memory divisor must be at least 1, got %s", divisor);
    this.memoryMonitor = memoryMonitor;
    this.divisor = divisor;
  }

  /** Returns true if {@code byteSize < availableMemory / divisor}, read afresh on each call. */
  public boolean fitsInMemory(long byteSize) {
    long budget = memoryMonitor.availableMemory() / divisor;
    boolean fits = byteSize < budget;
    log.debug("{} bytes against a budget of {} bytes: fits={}", byteSize, budget, fits);
    return fits;
  }
}
