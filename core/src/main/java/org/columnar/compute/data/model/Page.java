/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import org.columnar.compute.data.type.RecordType;

/**
 * A batch of records in columnar form: one {@link Block} per field of the page's {@link
 * RecordType}. Pages are the materialized form of table-shaped results.
 */
public interface Page {

  /** Returns the number of rows in this page. */
  int getPositionCount();

  /** Returns the number of columns in this page. */
  int getChannelCount();

  /** Returns the record type describing the page's columns. */
  RecordType getSchema();

  /**
   * Returns the value at the given row and column position.
   *
   * @param position the row index (0-based)
   * @param channel the column index (0-based)
   * @return the value, or null if the cell is null
   */
  Object getValue(int position, int channel);

  /**
   * Returns a sub-region of this page.
   *
   * @param positionOffset the starting row index
   * @param length the number of rows in the region
   * @return a new Page representing the sub-region
   */
  Page getRegion(int positionOffset, int length);

  /**
   * Returns the columnar block for the given channel.
   *
   * @param channel the column index (0-based)
   * @return the block for the channel
   */
  Block getBlock(int channel);

  /** Returns the block of the named column. */
  default Block getBlock(String name) {
    return getBlock(getSchema().indexOf(name));
  }

  /** Returns the row at the given position. */
  default Row getRow(int position) {
    Object[] values = new Object[getChannelCount()];
    for (int channel = 0; channel < values.length; channel++) {
      values[channel] = getValue(position, channel);
    }
    return new Row(getSchema(), values);
  }

  /** Returns the estimated memory retained by this page in bytes. */
  default long getRetainedSizeBytes() {
    long size = 0;
    for (int channel = 0; channel < getChannelCount(); channel++) {
      size += getBlock(channel).getRetainedSizeBytes();
    }
    return size;
  }

  /** Returns an empty page with zero rows and the given columns. */
  static Page empty(RecordType schema) {
    return new PageBuilder(schema).build();
  }
}
