/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import java.util.Arrays;
import lombok.EqualsAndHashCode;
import org.columnar.compute.data.type.DataType;

/** {@link Block} of doubles backed by a {@code double[]}. */
@EqualsAndHashCode
public class DoubleArrayBlock implements Block {

  private final double[] values;

  public DoubleArrayBlock(double[] values) {
    this.values = values;
  }

  @Override
  public int getPositionCount() {
    return values.length;
  }

  @Override
  public Object getValue(int position) {
    return getDouble(position);
  }

  @Override
  public double getDouble(int position) {
    Blocks.checkPosition(position, values.length);
    return values[position];
  }

  @Override
  public boolean isNull(int position) {
    Blocks.checkPosition(position, values.length);
    return false;
  }

  @Override
  public long getRetainedSizeBytes() {
    return (long) values.length * Double.BYTES;
  }

  @Override
  public Block getRegion(int positionOffset, int length) {
    Blocks.checkRegion(positionOffset, length, values.length);
    return new DoubleArrayBlock(
        Arrays.copyOfRange(values, positionOffset, positionOffset + length));
  }

  @Override
  public DataType getType() {
    return DataType.DOUBLE;
  }

  @Override
  public String toString() {
    return "DoubleArrayBlock" + Arrays.toString(values);
  }
}
