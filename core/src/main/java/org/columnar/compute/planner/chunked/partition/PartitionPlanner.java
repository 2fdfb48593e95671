/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked.partition;

import com.google.common.base.Preconditions;

/** Cuts a data source of known length into fixed-size partitions. */
public class PartitionPlanner {

  /**
   * Plans the partitions of a source.
   *
   * @param sourceLength number of elements, at least 0
   * @param chunkSize elements per partition, at least 1
   * @return the plan; empty when the source is empty
   * @throws IllegalArgumentException on a negative length or a chunk size below 1
   */
  public PartitionPlan plan(long sourceLength, long chunkSize) {
    Preconditions.checkArgument(sourceLength >= 0, "negative source length %s", sourceLength);
    Preconditions.checkArgument(chunkSize >= 1, "chunk size must be at least 1, got %s", chunkSize);
    return new PartitionPlan(sourceLength, chunkSize);
  }
}
