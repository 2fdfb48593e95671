/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.columnar.compute.storage.Capability;

/** Ways of running an expression over a data source. */
@RequiredArgsConstructor
public enum ExecutionStrategy {
  /** One lazy sequential pass over the source. */
  STREAM(Capability.ITERATE),
  /** Load the whole source into memory and evaluate once. */
  DIRECT(Capability.SLICE),
  /** Evaluate a chunk-local expression per partition and aggregate the merged results. */
  CHUNKED(Capability.SLICE);

  /** The source capability this strategy needs. */
  @Getter private final Capability requiredCapability;
}
