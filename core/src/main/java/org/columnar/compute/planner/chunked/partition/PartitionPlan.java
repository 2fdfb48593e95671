/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked.partition;

import com.google.common.collect.AbstractIterator;
import java.util.Iterator;
import lombok.Getter;

/**
 * The partitions covering {@code [0, length)} in order, each {@code chunkSize} long except
 * possibly the last. Partitions are derived on the fly, and every call to {@link #iterator()}
 * starts over from the first one.
 */
public class PartitionPlan implements Iterable<Partition> {

  @Getter private final long sourceLength;
  @Getter private final long chunkSize;

  PartitionPlan(long sourceLength, long chunkSize) {
    this.sourceLength = sourceLength;
    this.chunkSize = chunkSize;
  }

  /** Returns the number of partitions, {@code ceil(sourceLength / chunkSize)}. */
  public int size() {
    return (int) (sourceLength / chunkSize + (sourceLength % chunkSize == 0 ? 0 : 1));
  }

  @Override
  public Iterator<Partition> iterator() {
    return new AbstractIterator<>() {
      private int sequence;

      @Override
      protected Partition computeNext() {
        long start = sequence * chunkSize;
        if (start >= sourceLength) {
          return endOfData();
        }
        long stop = sourceLength - start <= chunkSize ? sourceLength : start + chunkSize;
        return new Partition(sequence++, start, stop);
      }
    };
  }

  @Override
  public String toString() {
    return "PartitionPlan{" + "length=" + sourceLength + ", chunkSize=" + chunkSize + '}';
  }
}
