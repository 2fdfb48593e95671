/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.RecordType;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PageBuilderTest {

  private static final RecordType PEOPLE =
      new RecordType(
          List.of("name", "age", "balance"),
          List.of(DataType.STRING, DataType.LONG, DataType.DOUBLE));

  @Test
  void should_build_page_row_by_row() {
    PageBuilder builder = new PageBuilder(PEOPLE);

    builder.beginRow();
    builder.setValue(0, "Alice");
    builder.setValue(1, 30L);
    builder.setValue(2, 1000.0);
    builder.endRow();

    builder.appendRow(new Row(PEOPLE, "Bob", 25L, 2000.0));

    Page page = builder.build();
    assertEquals(2, page.getPositionCount());
    assertEquals(3, page.getChannelCount());
    assertEquals("Alice", page.getValue(0, 0));
    assertEquals(2000.0, page.getValue(1, 2));
    assertEquals(DataType.LONG, page.getBlock("age").getType());
    assertEquals(new Row(PEOPLE, "Bob", 25L, 2000.0), page.getRow(1));
  }

  @Test
  void should_convert_values_to_the_column_type() {
    PageBuilder builder = new PageBuilder(PEOPLE);
    builder.beginRow();
    builder.setValue(0, "Carol");
    builder.setValue(1, 41);
    builder.setValue(2, 7L);
    builder.endRow();

    Page page = builder.build();

    assertEquals(41L, page.getValue(0, 1));
    assertEquals(7.0, page.getValue(0, 2));
  }

  @Test
  void should_track_row_count() {
    PageBuilder builder = new PageBuilder(RecordType.of("id", DataType.LONG));
    assertTrue(builder.isEmpty());
    assertEquals(0, builder.getRowCount());

    builder.beginRow();
    builder.setValue(0, 1L);
    builder.endRow();

    assertEquals(1, builder.getRowCount());
  }

  @Test
  void should_reset_after_build() {
    PageBuilder builder = new PageBuilder(RecordType.of("word", DataType.STRING));
    builder.beginRow();
    builder.setValue(0, "test");
    builder.endRow();

    Page page = builder.build();
    assertEquals(1, page.getPositionCount());

    // Builder should be empty after build
    assertTrue(builder.isEmpty());
    assertEquals(0, builder.getRowCount());
  }

  @Test
  void should_throw_on_set_before_begin() {
    PageBuilder builder = new PageBuilder(PEOPLE);
    assertThrows(IllegalStateException.class, () -> builder.setValue(0, "value"));
  }

  @Test
  void should_throw_on_end_before_begin() {
    PageBuilder builder = new PageBuilder(PEOPLE);
    assertThrows(IllegalStateException.class, () -> builder.endRow());
  }

  @Test
  void should_throw_on_build_with_uncommitted_row() {
    PageBuilder builder = new PageBuilder(PEOPLE);
    builder.beginRow();
    builder.setValue(0, "value");
    assertThrows(IllegalStateException.class, () -> builder.build());
  }

  @Test
  void should_throw_on_invalid_channel() {
    PageBuilder builder = new PageBuilder(PEOPLE);
    builder.beginRow();
    assertThrows(IndexOutOfBoundsException.class, () -> builder.setValue(3, "value"));
    assertThrows(IndexOutOfBoundsException.class, () -> builder.setValue(-1, "value"));
  }

  @Test
  void should_reject_row_of_another_schema() {
    PageBuilder builder = new PageBuilder(PEOPLE);
    Row row = new Row(RecordType.of("id", DataType.LONG), 1L);
    assertThrows(IllegalArgumentException.class, () -> builder.appendRow(row));
  }
}
