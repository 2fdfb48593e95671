/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import java.util.Arrays;
import lombok.EqualsAndHashCode;
import org.columnar.compute.data.type.DataType;

/** {@link Block} of boxed values, used for strings. May contain nulls. */
@EqualsAndHashCode
public class ObjectArrayBlock implements Block {

  private final DataType type;
  private final Object[] values;

  public ObjectArrayBlock(DataType type, Object[] values) {
    this.type = type;
    this.values = values;
  }

  @Override
  public int getPositionCount() {
    return values.length;
  }

  @Override
  public Object getValue(int position) {
    Blocks.checkPosition(position, values.length);
    return values[position];
  }

  @Override
  public boolean isNull(int position) {
    return getValue(position) == null;
  }

  @Override
  public long getRetainedSizeBytes() {
    return (long) values.length * type.getByteWidth();
  }

  @Override
  public Block getRegion(int positionOffset, int length) {
    Blocks.checkRegion(positionOffset, length, values.length);
    return new ObjectArrayBlock(
        type, Arrays.copyOfRange(values, positionOffset, positionOffset + length));
  }

  @Override
  public DataType getType() {
    return type;
  }

  @Override
  public String toString() {
    return "ObjectArrayBlock" + Arrays.toString(values);
  }
}
