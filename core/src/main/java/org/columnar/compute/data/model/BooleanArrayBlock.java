/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import java.util.Arrays;
import lombok.EqualsAndHashCode;
import org.columnar.compute.data.type.DataType;

/** {@link Block} of booleans backed by a {@code boolean[]}. */
@EqualsAndHashCode
public class BooleanArrayBlock implements Block {

  private final boolean[] values;

  public BooleanArrayBlock(boolean[] values) {
    this.values = values;
  }

  @Override
  public int getPositionCount() {
    return values.length;
  }

  @Override
  public Object getValue(int position) {
    return getBoolean(position);
  }

  public boolean getBoolean(int position) {
    Blocks.checkPosition(position, values.length);
    return values[position];
  }

  @Override
  public double getDouble(int position) {
    return getBoolean(position) ? 1.0 : 0.0;
  }

  @Override
  public boolean isNull(int position) {
    Blocks.checkPosition(position, values.length);
    return false;
  }

  @Override
  public long getRetainedSizeBytes() {
    return values.length;
  }

  @Override
  public Block getRegion(int positionOffset, int length) {
    Blocks.checkRegion(positionOffset, length, values.length);
    return new BooleanArrayBlock(
        Arrays.copyOfRange(values, positionOffset, positionOffset + length));
  }

  @Override
  public DataType getType() {
    return DataType.BOOLEAN;
  }

  @Override
  public String toString() {
    return "BooleanArrayBlock" + Arrays.toString(values);
  }
}
