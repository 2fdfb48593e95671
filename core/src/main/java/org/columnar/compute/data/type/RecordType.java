/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.type;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Ordered, named fields of a record. Field names are unique. */
@EqualsAndHashCode
public class RecordType implements ElementType {

  @Getter private final List<String> names;
  @Getter private final List<DataType> types;

  public RecordType(List<String> names, List<DataType> types) {
    Preconditions.checkArgument(
        names.size() == types.size(), "names and types must have the same size");
    Preconditions.checkArgument(
        names.stream().distinct().count() == names.size(), "duplicate field name in %s", names);
    this.names = ImmutableList.copyOf(names);
    this.types = ImmutableList.copyOf(types);
  }

  public static RecordType of(String name, DataType type) {
    return new RecordType(List.of(name), List.of(type));
  }

  public int size() {
    return names.size();
  }

  public boolean hasField(String name) {
    return names.contains(name);
  }

  /**
   * Returns the position of the named field.
   *
   * @throws IllegalArgumentException if there is no such field
   */
  public int indexOf(String name) {
    int index = names.indexOf(name);
    if (index < 0) {
      throw new IllegalArgumentException("No field [" + name + "] in " + this);
    }
    return index;
  }

  public DataType typeOf(String name) {
    return types.get(indexOf(name));
  }

  /** Returns a record type with only the given fields, in the given order. */
  public RecordType project(List<String> fields) {
    List<DataType> projected = new ArrayList<>(fields.size());
    for (String field : fields) {
      projected.add(typeOf(field));
    }
    return new RecordType(fields, projected);
  }

  /** Returns a record type with the given field renamed. */
  public RecordType rename(String from, String to) {
    List<String> renamed = new ArrayList<>(names);
    renamed.set(indexOf(from), to);
    return new RecordType(renamed, types);
  }

  /** Returns the estimated width in bytes of one record. */
  public int byteWidth() {
    return types.stream().mapToInt(DataType::getByteWidth).sum();
  }

  @Override
  public boolean isRecord() {
    return true;
  }

  @Override
  public String typeName() {
    return toString();
  }

  @Override
  public String toString() {
    List<String> fields = new ArrayList<>(names.size());
    for (int i = 0; i < names.size(); i++) {
      fields.add(names.get(i) + ": " + types.get(i).typeName());
    }
    return fields.stream().collect(Collectors.joining(", ", "{", "}"));
  }
}
