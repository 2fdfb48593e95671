/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.monitor;

import lombok.RequiredArgsConstructor;

/** {@link MemoryMonitor} that always reports the same amount. */
@RequiredArgsConstructor
public class FixedMemoryMonitor extends MemoryMonitor {

  private final long availableBytes;

  @Override
  public long availableMemory() {
    return availableBytes;
  }
}
