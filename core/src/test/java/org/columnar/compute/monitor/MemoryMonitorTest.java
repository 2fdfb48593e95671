/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class MemoryMonitorTest {

  @Test
  void should_report_heap_headroom() {
    Runtime runtime = Runtime.getRuntime();
    long available = new RuntimeMemoryMonitor().availableMemory();

    assertTrue(available > 0);
    assertTrue(available <= runtime.maxMemory());
  }

  @Test
  void should_report_fixed_amount() {
    MemoryMonitor monitor = new FixedMemoryMonitor(4096);

    assertEquals(4096, monitor.availableMemory());
    assertEquals(4096, monitor.availableMemory());
  }
}
