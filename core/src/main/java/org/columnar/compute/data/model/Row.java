/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.columnar.compute.data.type.RecordType;

/** A single record: one value per field of a {@link RecordType}. Immutable. */
@EqualsAndHashCode
public class Row {

  @Getter private final RecordType schema;
  private final Object[] values;

  public Row(RecordType schema, Object... values) {
    Preconditions.checkArgument(
        values.length == schema.size(),
        "expected %s values for %s, got %s",
        schema.size(),
        schema,
        values.length);
    this.schema = schema;
    this.values = values.clone();
  }

  public int size() {
    return values.length;
  }

  public Object get(int index) {
    return values[index];
  }

  public Object get(String field) {
    return values[schema.indexOf(field)];
  }

  /** Returns a row with only the given fields, in the given order. */
  public Row project(List<String> fields) {
    Object[] projected = new Object[fields.size()];
    for (int i = 0; i < fields.size(); i++) {
      projected[i] = get(fields.get(i));
    }
    return new Row(schema.project(fields), projected);
  }

  public List<Object> toList() {
    return Arrays.asList(values.clone());
  }

  @Override
  public String toString() {
    return "Row" + Arrays.toString(values);
  }
}
