/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import java.util.Arrays;
import lombok.EqualsAndHashCode;
import org.columnar.compute.data.type.DataType;

/** {@link Block} of 64-bit integers backed by a {@code long[]}. */
@EqualsAndHashCode
public class LongArrayBlock implements Block {

  private final long[] values;

  public LongArrayBlock(long[] values) {
    this.values = values;
  }

  @Override
  public int getPositionCount() {
    return values.length;
  }

  @Override
  public Object getValue(int position) {
    return getLong(position);
  }

  public long getLong(int position) {
    Blocks.checkPosition(position, values.length);
    return values[position];
  }

  @Override
  public double getDouble(int position) {
    return getLong(position);
  }

  @Override
  public boolean isNull(int position) {
    Blocks.checkPosition(position, values.length);
    return false;
  }

  @Override
  public long getRetainedSizeBytes() {
    return (long) values.length * Long.BYTES;
  }

  @Override
  public Block getRegion(int positionOffset, int length) {
    Blocks.checkRegion(positionOffset, length, values.length);
    return new LongArrayBlock(Arrays.copyOfRange(values, positionOffset, positionOffset + length));
  }

  @Override
  public DataType getType() {
    return DataType.LONG;
  }

  @Override
  public String toString() {
    return "LongArrayBlock" + Arrays.toString(values);
  }
}
