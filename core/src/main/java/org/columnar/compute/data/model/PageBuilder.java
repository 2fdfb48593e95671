/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import java.util.ArrayList;
import java.util.List;
import org.columnar.compute.data.type.RecordType;

/**
 * Builds a {@link Page} row by row. Call {@link #beginRow()}, set values via {@link #setValue(int,
 * Object)}, then {@link #endRow()} to commit. Call {@link #build()} to produce the final Page.
 */
public class PageBuilder {

  private final RecordType schema;
  private List<BlockBuilder> columns;
  private Object[] currentRow;
  private int rowCount;

  public PageBuilder(RecordType schema) {
    this.schema = schema;
    reset();
  }

  /** Starts a new row. Values default to null. */
  public void beginRow() {
    currentRow = new Object[schema.size()];
  }

  /**
   * Sets a value in the current row.
   *
   * @param channel the column index (0-based)
   * @param value the value to set
   */
  public void setValue(int channel, Object value) {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before setValue()");
    }
    if (channel < 0 || channel >= schema.size()) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + schema.size() + ")");
    }
    currentRow[channel] = value;
  }

  /** Commits the current row to the page. */
  public void endRow() {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before endRow()");
    }
    for (int channel = 0; channel < currentRow.length; channel++) {
      columns.get(channel).append(currentRow[channel]);
    }
    rowCount++;
    currentRow = null;
  }

  /** Appends a complete row. The row must have the builder's schema. */
  public void appendRow(Row row) {
    if (!row.getSchema().equals(schema)) {
      throw new IllegalArgumentException("Row schema " + row.getSchema() + " is not " + schema);
    }
    beginRow();
    for (int channel = 0; channel < row.size(); channel++) {
      setValue(channel, row.get(channel));
    }
    endRow();
  }

  /** Returns the number of rows added so far. */
  public int getRowCount() {
    return rowCount;
  }

  /** Returns true if no rows have been added. */
  public boolean isEmpty() {
    return rowCount == 0;
  }

  /** Builds the final Page from all committed rows and resets the builder. */
  public Page build() {
    if (currentRow != null) {
      throw new IllegalStateException("endRow() must be called before build()");
    }
    List<Block> blocks = new ArrayList<>(columns.size());
    for (BlockBuilder column : columns) {
      blocks.add(column.build());
    }
    reset();
    return new ColumnarPage(schema, blocks);
  }

  private void reset() {
    columns = new ArrayList<>(schema.size());
    for (int channel = 0; channel < schema.size(); channel++) {
      columns.add(new BlockBuilder(schema.getTypes().get(channel)));
    }
    rowCount = 0;
  }
}
