/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.storage;

/** Access patterns a {@link DataSource} supports. */
public enum Capability {
  /** Random access to a contiguous index range. */
  SLICE,
  /** A single sequential pass over all elements. */
  ITERATE,
  /** Narrowing a table to a subset of its columns without reading the others. */
  PROJECT
}
