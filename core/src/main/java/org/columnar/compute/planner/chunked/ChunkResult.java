/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** The materialized output of the chunk expression on one partition. */
@Getter
@ToString
@RequiredArgsConstructor
public class ChunkResult {

  /** Sequence of the partition the value was computed from. */
  private final int sequence;

  private final Object value;
}
