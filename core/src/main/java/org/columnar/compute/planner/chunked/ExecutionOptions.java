/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.columnar.compute.common.setting.Settings;
import org.columnar.compute.planner.chunked.concurrency.ConcurrencyStrategy;
import org.columnar.compute.planner.chunked.concurrency.SequentialStrategy;

/** Per-query execution parameters. */
@Getter
@ToString
public class ExecutionOptions {

  public static final long DEFAULT_CHUNK_SIZE = 1L << 20;

  /** Elements per partition on the chunked path. */
  private final long chunkSize;

  /** Datasets larger than this are never executed directly, even if they fit in memory. */
  private final long cheapThresholdBytes;

  private final ConcurrencyStrategy concurrencyStrategy;

  @Builder
  private ExecutionOptions(
      Long chunkSize, Long cheapThresholdBytes, ConcurrencyStrategy concurrencyStrategy) {
    this.chunkSize = chunkSize == null ? DEFAULT_CHUNK_SIZE : chunkSize;
    this.cheapThresholdBytes = cheapThresholdBytes == null ? Long.MAX_VALUE : cheapThresholdBytes;
    this.concurrencyStrategy =
        concurrencyStrategy == null ? new SequentialStrategy() : concurrencyStrategy;
    Preconditions.checkArgument(
        this.chunkSize >= 1, "chunk size must be at least 1, got %s", this.chunkSize);
  }

  public static ExecutionOptions defaults() {
    return builder().build();
  }

  /** Returns options read from settings, running chunks with the given strategy. */
  public static ExecutionOptions from(Settings settings, ConcurrencyStrategy concurrencyStrategy) {
    return builder()
        .chunkSize(settings.getSettingValue(Settings.Key.CHUNK_SIZE))
        .cheapThresholdBytes(settings.getSettingValue(Settings.Key.DIRECT_THRESHOLD_BYTES))
        .concurrencyStrategy(concurrencyStrategy)
        .build();
  }
}
