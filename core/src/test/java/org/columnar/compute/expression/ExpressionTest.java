/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import static org.columnar.compute.expression.DSL.add;
import static org.columnar.compute.expression.DSL.aggregate;
import static org.columnar.compute.expression.DSL.collection;
import static org.columnar.compute.expression.DSL.count;
import static org.columnar.compute.expression.DSL.distinct;
import static org.columnar.compute.expression.DSL.field;
import static org.columnar.compute.expression.DSL.groupBy;
import static org.columnar.compute.expression.DSL.gt;
import static org.columnar.compute.expression.DSL.head;
import static org.columnar.compute.expression.DSL.label;
import static org.columnar.compute.expression.DSL.literal;
import static org.columnar.compute.expression.DSL.map;
import static org.columnar.compute.expression.DSL.mean;
import static org.columnar.compute.expression.DSL.project;
import static org.columnar.compute.expression.DSL.schema;
import static org.columnar.compute.expression.DSL.select;
import static org.columnar.compute.expression.DSL.slice;
import static org.columnar.compute.expression.DSL.sum;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.RecordType;
import org.columnar.compute.expression.reduction.CombineMoments;
import org.columnar.compute.expression.reduction.Moments;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExpressionTest {

  private static final RecordType ACCOUNTS =
      schema("name", DataType.STRING, "amount", DataType.LONG, "rate", DataType.DOUBLE);

  @Test
  void should_derive_shapes_of_collection_operations() {
    Symbol x = collection("x", 10, DataType.LONG);

    assertEquals(DataShape.fixed(3, DataType.LONG), head(x, 3).getShape());
    assertEquals(DataShape.fixed(10, DataType.LONG), head(x, 50).getShape());
    assertEquals(DataShape.fixed(2, DataType.LONG), slice(x, 8, 20).getShape());
    assertEquals(DataShape.fixed(0, DataType.LONG), slice(x, 12, 20).getShape());
    assertEquals(DataShape.var(DataType.LONG), distinct(x).getShape());
    assertEquals(DataShape.var(DataType.LONG), select(x, gt(null, 1)).getShape());
  }

  @Test
  void should_derive_shapes_of_reductions() {
    Symbol x = collection("x", 10, DataType.LONG);
    Symbol y = collection("y", DataType.DOUBLE);

    assertEquals(DataShape.scalar(DataType.LONG), sum(x).getShape());
    assertEquals(DataShape.scalar(DataType.DOUBLE), sum(y).getShape());
    assertEquals(DataShape.scalar(DataType.DOUBLE), mean(x).getShape());
    assertEquals(DataShape.fixed(1, DataType.LONG), count(x).copy(x, true).getShape());
    assertEquals(DataShape.fixed(1, Moments.TYPE), new Moments(x, true).getShape());
  }

  @Test
  void should_widen_arithmetic_and_broadcast_scalars() {
    Symbol x = collection("x", 4, DataType.LONG);

    assertEquals(DataShape.fixed(4, DataType.LONG), add(x, literal(1)).getShape());
    assertEquals(DataShape.fixed(4, DataType.DOUBLE), add(literal(0.5), x).getShape());
    assertEquals(
        DataShape.fixed(4, DataType.DOUBLE), DSL.divide(x, literal(2)).getShape());
    assertEquals(DataShape.scalar(DataType.LONG), add(literal(1), literal(2)).getShape());
  }

  @Test
  void should_derive_record_shapes() {
    Symbol t = collection("t", ACCOUNTS);

    assertEquals(DataShape.var(DataType.LONG), field(t, "amount").getShape());
    assertEquals(
        DataShape.var(schema("rate", DataType.DOUBLE, "name", DataType.STRING)),
        project(t, "rate", "name").getShape());
    assertEquals(
        DataShape.var(RecordType.of("total", DataType.LONG)),
        label(field(t, "amount"), "total").getShape());
    assertEquals(
        DataShape.var(DataType.DOUBLE),
        map(field(t, "amount"), MathFunction.SQRT).getShape());
    assertEquals(
        DataShape.var(DataType.LONG),
        map(field(t, "amount"), MathFunction.ABS).getShape());
  }

  @Test
  void should_describe_group_by_result() {
    Symbol t = collection("t", ACCOUNTS);

    GroupBy grouped =
        groupBy(
            t,
            "name",
            aggregate("n", OperationKind.COUNT, "amount"),
            aggregate("total", OperationKind.SUM, "rate"),
            aggregate("avg", OperationKind.MEAN, "amount"));

    assertEquals(
        DataShape.var(
            schema(
                "name", DataType.STRING,
                "n", DataType.LONG,
                "total", DataType.DOUBLE,
                "avg", DataType.DOUBLE)),
        grouped.getShape());
  }

  @Test
  void should_reject_invalid_trees() {
    Symbol x = collection("x", DataType.LONG);
    Symbol t = collection("t", ACCOUNTS);

    assertThrows(IllegalArgumentException.class, () -> field(x, "amount"));
    assertThrows(IllegalArgumentException.class, () -> field(t, "missing"));
    assertThrows(IllegalArgumentException.class, () -> head(x, -1));
    assertThrows(IllegalArgumentException.class, () -> slice(x, 5, 2));
    assertThrows(IllegalArgumentException.class, () -> add(t, literal(1)));
    assertThrows(IllegalArgumentException.class, () -> map(field(t, "name"), MathFunction.ABS));
    assertThrows(IllegalArgumentException.class, () -> label(t, "all"));
    assertThrows(
        IllegalArgumentException.class,
        () -> groupBy(x, "name", aggregate("n", OperationKind.COUNT, "name")));
    assertThrows(
        IllegalArgumentException.class,
        () -> groupBy(t, "name", aggregate("v", OperationKind.VAR, "amount")));
    assertThrows(IllegalArgumentException.class, () -> groupBy(t, "name"));
    assertThrows(
        IllegalArgumentException.class,
        () -> new CombineMoments(x, CombineMoments.Statistic.MEAN, false, false));
  }

  @Test
  void should_list_distinct_leaves_in_depth_first_order() {
    Symbol x = collection("x", DataType.LONG);
    Symbol y = collection("y", DataType.LONG);

    Expression expr = add(sum(x), add(count(y), sum(x)));

    assertEquals(List.of(x, y), expr.leaves());
    assertTrue(expr.dependsOn(y));
    assertFalse(literal(1).dependsOn(x));
    assertEquals(List.of(), literal(1).leaves());
  }

  @Test
  void should_compare_symbols_by_identity() {
    Symbol first = collection("x", DataType.LONG);
    Symbol second = collection("x", DataType.LONG);

    assertFalse(sum(first).dependsOn(second));
    assertEquals(2, add(sum(first), sum(second)).leaves().size());
  }

  @Test
  void should_rebuild_with_new_children() {
    Symbol x = collection("x", DataType.LONG);
    Symbol y = collection("y", DataType.DOUBLE);

    Expression original = head(map(x, MathFunction.NEGATE), 2);
    Expression rebuilt = original.withChildren(List.of(map(y, MathFunction.NEGATE)));

    assertNotSame(original, rebuilt);
    assertEquals(OperationKind.HEAD, rebuilt.getKind());
    assertEquals(DataShape.var(DataType.DOUBLE), rebuilt.getShape());
    assertTrue(rebuilt.dependsOn(y));
    assertSame(x, x.withChildren(List.of()));
  }

  @Test
  void should_render_readable_text() {
    Symbol x = collection("x", DataType.LONG);

    assertEquals("sum((x + 1))", sum(add(x, literal(1))).toString());
    assertEquals("head(x, 5)", head(x, 5).toString());
    assertEquals("count(x, keepdims)", count(x).copy(x, true).toString());
  }
}
