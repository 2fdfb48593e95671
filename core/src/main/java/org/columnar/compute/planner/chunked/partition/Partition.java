/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked.partition;

import lombok.EqualsAndHashCode;

/**
 * A unit of work on the chunked path: the half-open index range {@code [start, stop)} of a data
 * source, together with its position in the plan that produced it.
 */
@EqualsAndHashCode
public class Partition {

  private final int sequence;
  private final long start;
  private final long stop;

  public Partition(int sequence, long start, long stop) {
    this.sequence = sequence;
    this.start = start;
    this.stop = stop;
  }

  /** Returns the 0-based position of this partition in source order. */
  public int getSequence() {
    return sequence;
  }

  /** Returns the first index, inclusive. */
  public long getStart() {
    return start;
  }

  /** Returns the last index, exclusive. */
  public long getStop() {
    return stop;
  }

  public long length() {
    return stop - start;
  }

  @Override
  public String toString() {
    return "Partition{" + "seq=" + sequence + ", range=[" + start + ", " + stop + ")}";
  }
}
