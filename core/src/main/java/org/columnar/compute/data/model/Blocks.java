/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.columnar.compute.data.type.DataType;

/** Factory and utility methods for {@link Block}s. */
public final class Blocks {

  private Blocks() {}

  public static Block ofLongs(long... values) {
    return new LongArrayBlock(values);
  }

  public static Block ofDoubles(double... values) {
    return new DoubleArrayBlock(values);
  }

  public static Block ofBooleans(boolean... values) {
    return new BooleanArrayBlock(values);
  }

  public static Block ofStrings(String... values) {
    return new ObjectArrayBlock(DataType.STRING, values.clone());
  }

  /** Returns a block of the given type with no values. */
  public static Block empty(DataType type) {
    return new BlockBuilder(type, 0).build();
  }

  /** Returns a one-element block holding the value. */
  public static Block singleton(Object value, DataType type) {
    return new BlockBuilder(type, 1).append(value).build();
  }

  /**
   * Concatenates blocks in order. A single block is returned unchanged. Blocks of mixed numeric
   * types are widened to {@link DataType#DOUBLE}.
   *
   * @param blocks the blocks, at least one
   * @return the concatenated block
   */
  public static Block concat(List<Block> blocks) {
    Preconditions.checkArgument(!blocks.isEmpty(), "cannot concatenate zero blocks");
    if (blocks.size() == 1) {
      return blocks.get(0);
    }
    DataType type = blocks.get(0).getType();
    int total = 0;
    for (Block block : blocks) {
      if (block.getType() != type) {
        type = DataType.widen(type, block.getType());
      }
      total += block.getPositionCount();
    }
    BlockBuilder builder = new BlockBuilder(type, total);
    for (Block block : blocks) {
      builder.appendAll(block);
    }
    return builder.build();
  }

  /** Returns the positions of the block for which the mask is set. */
  public static Block filter(Block block, boolean[] mask) {
    Preconditions.checkArgument(
        mask.length == block.getPositionCount(), "mask length does not match block");
    BlockBuilder builder = new BlockBuilder(block.getType(), block.getPositionCount());
    for (int i = 0; i < mask.length; i++) {
      if (mask[i]) {
        builder.append(block.getValue(i));
      }
    }
    return builder.build();
  }

  /** Returns a lazy iterator over the block's values. */
  public static Iterator<Object> iterator(Block block) {
    return new AbstractIterator<>() {
      private int position;

      @Override
      protected Object computeNext() {
        if (position >= block.getPositionCount()) {
          return endOfData();
        }
        return block.getValue(position++);
      }
    };
  }

  /** Copies the block's values into a list. */
  public static List<Object> toList(Block block) {
    List<Object> values = new ArrayList<>(block.getPositionCount());
    for (int i = 0; i < block.getPositionCount(); i++) {
      values.add(block.getValue(i));
    }
    return values;
  }

  static void checkPosition(int position, int positionCount) {
    if (position < 0 || position >= positionCount) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + positionCount + ")");
    }
  }

  static void checkRegion(int positionOffset, int length, int positionCount) {
    if (positionOffset < 0 || length < 0 || positionOffset + length > positionCount) {
      throw new IndexOutOfBoundsException(
          "Region ["
              + positionOffset
              + ", "
              + (positionOffset + length)
              + ") out of range [0, "
              + positionCount
              + ")");
    }
  }
}
