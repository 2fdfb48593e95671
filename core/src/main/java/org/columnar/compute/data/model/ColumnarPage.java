/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import org.columnar.compute.data.type.RecordType;

/** {@link Page} holding one {@link Block} per column. */
@EqualsAndHashCode
public class ColumnarPage implements Page {

  private final RecordType schema;
  private final List<Block> blocks;
  private final int positionCount;

  /**
   * Creates a page from pre-built columns.
   *
   * @param schema the column names and types
   * @param blocks one block per column, all of the same length and of the declared types
   */
  public ColumnarPage(RecordType schema, List<Block> blocks) {
    Preconditions.checkArgument(
        schema.size() == blocks.size(), "schema has %s columns, got %s", schema.size(), blocks);
    int count = blocks.isEmpty() ? 0 : blocks.get(0).getPositionCount();
    for (int channel = 0; channel < blocks.size(); channel++) {
      Block block = blocks.get(channel);
      Preconditions.checkArgument(
          block.getPositionCount() == count, "column %s has a different length", channel);
      Preconditions.checkArgument(
          block.getType() == schema.getTypes().get(channel),
          "column %s is %s, declared %s",
          schema.getNames().get(channel),
          block.getType(),
          schema.getTypes().get(channel));
    }
    this.schema = schema;
    this.blocks = ImmutableList.copyOf(blocks);
    this.positionCount = count;
  }

  @Override
  public int getPositionCount() {
    return positionCount;
  }

  @Override
  public int getChannelCount() {
    return blocks.size();
  }

  @Override
  public RecordType getSchema() {
    return schema;
  }

  @Override
  public Object getValue(int position, int channel) {
    if (channel < 0 || channel >= blocks.size()) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + blocks.size() + ")");
    }
    return blocks.get(channel).getValue(position);
  }

  @Override
  public Page getRegion(int positionOffset, int length) {
    List<Block> region = new ArrayList<>(blocks.size());
    for (Block block : blocks) {
      region.add(block.getRegion(positionOffset, length));
    }
    if (blocks.isEmpty()) {
      Blocks.checkRegion(positionOffset, length, positionCount);
    }
    return new ColumnarPage(schema, region);
  }

  @Override
  public Block getBlock(int channel) {
    return blocks.get(channel);
  }

  @Override
  public String toString() {
    return "ColumnarPage{schema=" + schema + ", rows=" + positionCount + '}';
  }
}
