/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import java.util.Arrays;
import org.columnar.compute.data.type.DataType;

/**
 * Builds a {@link Block} of a fixed {@link DataType} by appending values. Numeric values are
 * converted to the block's type; nulls are only accepted by string blocks.
 */
public class BlockBuilder {

  private final DataType type;
  private long[] longs;
  private double[] doubles;
  private boolean[] booleans;
  private Object[] objects;
  private int size;

  public BlockBuilder(DataType type) {
    this(type, 16);
  }

  public BlockBuilder(DataType type, int expectedSize) {
    this.type = type;
    int capacity = Math.max(expectedSize, 1);
    switch (type) {
      case LONG:
        longs = new long[capacity];
        break;
      case DOUBLE:
        doubles = new double[capacity];
        break;
      case BOOLEAN:
        booleans = new boolean[capacity];
        break;
      default:
        objects = new Object[capacity];
    }
  }

  public DataType getType() {
    return type;
  }

  /** Returns the number of values appended so far. */
  public int size() {
    return size;
  }

  /**
   * Appends a value.
   *
   * @param value the value, converted to the block type
   * @return this builder
   */
  public BlockBuilder append(Object value) {
    if (value == null && type != DataType.STRING) {
      throw new IllegalArgumentException("null value in " + type.typeName() + " block");
    }
    ensureCapacity(size + 1);
    switch (type) {
      case LONG:
        longs[size] = ((Number) value).longValue();
        break;
      case DOUBLE:
        doubles[size] = ((Number) value).doubleValue();
        break;
      case BOOLEAN:
        booleans[size] = (Boolean) value;
        break;
      default:
        objects[size] = value;
    }
    size++;
    return this;
  }

  /** Appends every value of a block. */
  public BlockBuilder appendAll(Block block) {
    ensureCapacity(size + block.getPositionCount());
    for (int i = 0; i < block.getPositionCount(); i++) {
      append(block.getValue(i));
    }
    return this;
  }

  /** Builds the block. The builder must not be used afterwards. */
  public Block build() {
    switch (type) {
      case LONG:
        return new LongArrayBlock(Arrays.copyOf(longs, size));
      case DOUBLE:
        return new DoubleArrayBlock(Arrays.copyOf(doubles, size));
      case BOOLEAN:
        return new BooleanArrayBlock(Arrays.copyOf(booleans, size));
      default:
        return new ObjectArrayBlock(type, Arrays.copyOf(objects, size));
    }
  }

  private void ensureCapacity(int required) {
    int capacity = currentCapacity();
    if (required <= capacity) {
      return;
    }
    int grown = Math.max(required, capacity + (capacity >> 1) + 1);
    switch (type) {
      case LONG:
        longs = Arrays.copyOf(longs, grown);
        break;
      case DOUBLE:
        doubles = Arrays.copyOf(doubles, grown);
        break;
      case BOOLEAN:
        booleans = Arrays.copyOf(booleans, grown);
        break;
      default:
        objects = Arrays.copyOf(objects, grown);
    }
  }

  private int currentCapacity() {
    switch (type) {
      case LONG:
        return longs.length;
      case DOUBLE:
        return doubles.length;
      case BOOLEAN:
        return booleans.length;
      default:
        return objects.length;
    }
  }
}
