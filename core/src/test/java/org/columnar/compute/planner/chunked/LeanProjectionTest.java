/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

import static org.columnar.compute.expression.DSL.aggregate;
import static org.columnar.compute.expression.DSL.and;
import static org.columnar.compute.expression.DSL.collection;
import static org.columnar.compute.expression.DSL.count;
import static org.columnar.compute.expression.DSL.distinct;
import static org.columnar.compute.expression.DSL.eq;
import static org.columnar.compute.expression.DSL.field;
import static org.columnar.compute.expression.DSL.groupBy;
import static org.columnar.compute.expression.DSL.gt;
import static org.columnar.compute.expression.DSL.head;
import static org.columnar.compute.expression.DSL.project;
import static org.columnar.compute.expression.DSL.schema;
import static org.columnar.compute.expression.DSL.select;
import static org.columnar.compute.expression.DSL.slice;
import static org.columnar.compute.expression.DSL.sum;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;
import java.util.Optional;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.RecordType;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.Field;
import org.columnar.compute.expression.OperationKind;
import org.columnar.compute.expression.Projection;
import org.columnar.compute.expression.Symbol;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LeanProjectionTest {

  private static final RecordType ORDERS =
      schema(
          "id", DataType.LONG,
          "region", DataType.STRING,
          "amount", DataType.LONG,
          "note", DataType.STRING);

  private final Symbol t = collection("t", ORDERS);

  @Test
  void should_keep_fields_read_by_field_access() {
    assertEquals(
        Optional.of(List.of("amount")),
        LeanProjection.requiredFields(sum(field(t, "amount")), t));
    assertEquals(
        Optional.of(List.of("amount")),
        LeanProjection.requiredFields(sum(field(slice(head(t, 50), 2, 9), "amount")), t));
  }

  @Test
  void should_keep_filter_columns_in_schema_order() {
    Expression expr = field(select(t, and(eq("region", "north"), gt("amount", 5))), "id");

    assertEquals(
        Optional.of(List.of("id", "region", "amount")),
        LeanProjection.requiredFields(expr, t));
  }

  @Test
  void should_keep_group_key_and_aggregate_columns() {
    Expression expr =
        groupBy(
            t,
            "region",
            aggregate("orders", OperationKind.COUNT, "id"),
            aggregate("revenue", OperationKind.SUM, "amount"));

    assertEquals(
        Optional.of(List.of("id", "region", "amount")), LeanProjection.requiredFields(expr, t));
  }

  @Test
  void should_keep_projected_fields() {
    assertEquals(
        Optional.of(List.of("id", "note")),
        LeanProjection.requiredFields(project(t, "note", "id"), t));
  }

  @Test
  void should_keep_everything_when_whole_records_are_used() {
    assertEquals(Optional.empty(), LeanProjection.requiredFields(count(t), t));
    assertEquals(Optional.empty(), LeanProjection.requiredFields(distinct(t), t));
    assertEquals(Optional.empty(), LeanProjection.requiredFields(head(t, 5), t));
    assertEquals(
        Optional.empty(), LeanProjection.requiredFields(select(t, eq("region", "north")), t));
    assertEquals(
        Optional.empty(),
        LeanProjection.requiredFields(project(t, "id", "region", "amount", "note"), t));
  }

  @Test
  void should_ignore_column_leaves() {
    Symbol x = collection("x", DataType.LONG);

    Expression expr = sum(x);

    assertEquals(Optional.empty(), LeanProjection.requiredFields(expr, x));
    assertSame(expr, LeanProjection.apply(expr, x));
  }

  @Test
  void should_insert_projection_above_leaf() {
    Expression lean = LeanProjection.apply(sum(field(t, "amount")), t);

    Field amount = (Field) lean.getChildren().get(0);
    Projection projection = (Projection) amount.getChild();
    assertEquals(List.of("amount"), projection.getFields());
    assertSame(t, projection.getChild());
    assertEquals(List.of(t), lean.leaves());
  }

  @Test
  void should_rebind_to_narrowed_leaf() {
    Symbol narrowed = LeanProjection.narrow(t, List.of("region", "amount"));
    Expression expr = sum(field(select(t, eq("region", "north")), "amount"));

    Expression rebound = LeanProjection.rebind(expr, t, narrowed);

    assertEquals(
        schema("region", DataType.STRING, "amount", DataType.LONG),
        narrowed.getShape().getElementType());
    assertEquals("t", narrowed.getName());
    assertEquals(List.of(narrowed), rebound.leaves());
    assertEquals(DataType.LONG, rebound.getShape().getElementType());
  }
}
