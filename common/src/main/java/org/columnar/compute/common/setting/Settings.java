/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Setting access for the compute engine. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Number of elements per partition on the chunked path. */
    CHUNK_SIZE("compute.chunk.size", Long.class, 1L << 20),

    /** Fraction of available memory (as a divisor) a dataset may occupy to be materialized. */
    MEMORY_DIVISOR("compute.memory.divisor", Long.class, 4L),

    /** Upper bound in bytes for direct in-memory execution, independent of available memory. */
    DIRECT_THRESHOLD_BYTES("compute.direct.threshold_bytes", Long.class, Long.MAX_VALUE),

    /** Number of worker threads evaluating chunks. 1 means sequential. */
    CHUNK_PARALLELISM("compute.chunk.parallelism", Integer.class, 1);

    @Getter private final String keyValue;

    @Getter private final Class<?> valueType;

    @Getter private final Object defaultValue;

    private static final Map<String, Key> ALL_KEYS;

    static {
      ImmutableMap.Builder<String, Key> builder = new ImmutableMap.Builder<>();
      for (Key key : Key.values()) {
        builder.put(key.getKeyValue(), key);
      }
      ALL_KEYS = builder.build();
    }

    public static Optional<Key> of(String keyValue) {
      String key = keyValue.toLowerCase();
      return Optional.ofNullable(ALL_KEYS.get(key));
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);
}
