/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import org.columnar.compute.data.type.DataType;

/**
 * A dense one-dimensional array of values of a single {@link DataType}. Blocks are the materialized
 * form of array-shaped results and the columns of a {@link Page}. Blocks are immutable.
 */
public interface Block {

  /** Returns the number of values (rows) in this block. */
  int getPositionCount();

  /**
   * Returns the value at the given position.
   *
   * @param position the row index (0-based)
   * @return the boxed value, or null if the position is null
   */
  Object getValue(int position);

  /**
   * Returns true if the value at the given position is null.
   *
   * @param position the row index (0-based)
   * @return true if null
   */
  boolean isNull(int position);

  /** Returns the estimated memory retained by this block in bytes. */
  long getRetainedSizeBytes();

  /**
   * Returns a sub-region of this block.
   *
   * @param positionOffset the starting row index
   * @param length the number of rows in the region
   * @return a new Block representing the sub-region
   */
  Block getRegion(int positionOffset, int length);

  /** Returns the data type of this block's values. */
  DataType getType();

  /**
   * Returns the value at the given position as a double. Only valid for numeric blocks.
   *
   * @param position the row index (0-based)
   */
  default double getDouble(int position) {
    return ((Number) getValue(position)).doubleValue();
  }
}
