/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.storage;

import java.util.Iterator;
import java.util.List;
import java.util.Set;
import org.columnar.compute.data.type.ElementType;

/**
 * An addressable columnar dataset, possibly larger than memory. Elements are primitive values of a
 * column or {@code Row}s of a table.
 */
public interface DataSource {

  /** Returns the number of elements. */
  long length();

  /** Returns the size of the whole dataset in bytes, as it would occupy memory once loaded. */
  long byteSize();

  ElementType elementType();

  /**
   * Loads the elements in {@code [start, stop)} into memory.
   *
   * @return a {@code Block} for a column or a {@code Page} for a table
   * @throws UnsupportedOperationException if the source lacks {@link Capability#SLICE}
   */
  Object slice(long start, long stop);

  /**
   * Returns a lazy iterator over all elements, reading them as they are consumed.
   *
   * @throws UnsupportedOperationException if the source lacks {@link Capability#ITERATE}
   */
  Iterator<Object> iterator();

  Set<Capability> capabilities();

  /**
   * Returns a view of this table with only the given columns, in the given order.
   *
   * @throws UnsupportedOperationException if the source lacks {@link Capability#PROJECT}
   */
  default DataSource project(List<String> fields) {
    throw new UnsupportedOperationException("source does not support projection");
  }

  default boolean supports(Capability capability) {
    return capabilities().contains(capability);
  }
}
