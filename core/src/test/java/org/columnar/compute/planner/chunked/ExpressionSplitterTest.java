/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

import static org.columnar.compute.expression.DSL.add;
import static org.columnar.compute.expression.DSL.aggregate;
import static org.columnar.compute.expression.DSL.collection;
import static org.columnar.compute.expression.DSL.count;
import static org.columnar.compute.expression.DSL.distinct;
import static org.columnar.compute.expression.DSL.divide;
import static org.columnar.compute.expression.DSL.groupBy;
import static org.columnar.compute.expression.DSL.gt;
import static org.columnar.compute.expression.DSL.head;
import static org.columnar.compute.expression.DSL.literal;
import static org.columnar.compute.expression.DSL.map;
import static org.columnar.compute.expression.DSL.mean;
import static org.columnar.compute.expression.DSL.nunique;
import static org.columnar.compute.expression.DSL.schema;
import static org.columnar.compute.expression.DSL.select;
import static org.columnar.compute.expression.DSL.slice;
import static org.columnar.compute.expression.DSL.std;
import static org.columnar.compute.expression.DSL.sum;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.RecordType;
import org.columnar.compute.exception.UnsupportedExecutionException;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.GroupBy;
import org.columnar.compute.expression.Head;
import org.columnar.compute.expression.MathFunction;
import org.columnar.compute.expression.OperationKind;
import org.columnar.compute.expression.Symbol;
import org.columnar.compute.expression.reduction.CombineMoments;
import org.columnar.compute.expression.reduction.Moments;
import org.columnar.compute.expression.reduction.Reduction;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExpressionSplitterTest {

  private static final RecordType SALES =
      schema("region", DataType.STRING, "amount", DataType.LONG);

  private final ExpressionSplitter splitter = new ExpressionSplitter();

  private final Symbol x = collection("x", 100, DataType.LONG);
  private final Symbol chunk = new Symbol("x_chunk", DataShape.fixed(10, DataType.LONG));

  @Test
  void should_split_sum_into_partial_and_final_sums() {
    SplitExpression split = splitter.split(x, sum(x), chunk);

    Expression chunkPart = split.getChunkExpression();
    assertEquals(OperationKind.SUM, chunkPart.getKind());
    assertTrue(((Reduction) chunkPart).isKeepDims());
    assertSame(chunk, ((Reduction) chunkPart).getChild());
    assertSame(chunk, split.getChunkSymbol());

    Symbol partials = split.getAggregateSymbol();
    assertEquals("x_partials", partials.getName());
    assertEquals(DataShape.var(DataType.LONG), partials.getShape());
    assertEquals(OperationKind.SUM, split.getAggregateExpression().getKind());
    assertFalse(((Reduction) split.getAggregateExpression()).isKeepDims());
    assertEquals(DataShape.scalar(DataType.LONG), split.getAggregateExpression().getShape());
  }

  @Test
  void should_sum_partial_counts() {
    SplitExpression split = splitter.split(x, count(select(x, gt(null, 5))), chunk);

    assertEquals(OperationKind.COUNT, split.getChunkExpression().getKind());
    assertEquals(
        OperationKind.SELECTION, split.getChunkExpression().getChildren().get(0).getKind());
    assertEquals(OperationKind.SUM, split.getAggregateExpression().getKind());
  }

  @Test
  void should_combine_moments_for_mean_and_deviation() {
    SplitExpression meanSplit = splitter.split(x, mean(x), chunk);
    SplitExpression stdSplit = splitter.split(x, std(map(x, MathFunction.SQRT), true), chunk);

    assertInstanceOf(Moments.class, meanSplit.getChunkExpression());
    assertEquals(DataShape.var(Moments.TYPE), meanSplit.getAggregateSymbol().getShape());
    CombineMoments combineMean = (CombineMoments) meanSplit.getAggregateExpression();
    assertEquals(CombineMoments.Statistic.MEAN, combineMean.getStatistic());

    CombineMoments combineStd = (CombineMoments) stdSplit.getAggregateExpression();
    assertEquals(CombineMoments.Statistic.STD, combineStd.getStatistic());
    assertTrue(combineStd.isUnbiased());
    assertEquals(
        OperationKind.ELEMWISE, stdSplit.getChunkExpression().getChildren().get(0).getKind());
  }

  @Test
  void should_count_distinct_values_of_partial_distincts() {
    SplitExpression split = splitter.split(x, nunique(x), chunk);

    assertEquals(OperationKind.DISTINCT, split.getChunkExpression().getKind());
    assertEquals(OperationKind.NUNIQUE, split.getAggregateExpression().getKind());

    SplitExpression distinctSplit = splitter.split(x, distinct(x), chunk);
    assertEquals(OperationKind.DISTINCT, distinctSplit.getAggregateExpression().getKind());
  }

  @Test
  void should_reapply_head_and_slice_after_merge() {
    SplitExpression headSplit = splitter.split(x, head(slice(x, 5, 50), 3), chunk);
    assertSame(chunk, headSplit.getChunkExpression());
    Head head = (Head) headSplit.getAggregateExpression();
    assertEquals(3, head.getN());
    assertEquals(OperationKind.SLICE, head.getChild().getKind());
  }

  @Test
  void should_keep_elementwise_expression_whole() {
    Expression expr = add(map(x, MathFunction.NEGATE), literal(1));

    SplitExpression split = splitter.split(x, expr, chunk);

    assertTrue(split.getChunkExpression().dependsOn(chunk));
    assertFalse(split.getChunkExpression().dependsOn(x));
    assertSame(split.getAggregateSymbol(), split.getAggregateExpression());
  }

  @Test
  void should_apply_scalar_work_after_the_reduction() {
    SplitExpression split = splitter.split(x, divide(sum(x), literal(2)), chunk);

    Expression aggregate = split.getAggregateExpression();
    assertEquals(OperationKind.ARITHMETIC, aggregate.getKind());
    assertTrue(aggregate.dependsOn(split.getAggregateSymbol()));
    assertFalse(aggregate.dependsOn(x));
  }

  @Test
  void should_regroup_partial_groups() {
    Symbol sales = collection("sales", SALES);
    Symbol salesChunk = new Symbol("sales_chunk", DataShape.fixed(10, SALES));
    Expression expr =
        groupBy(
            sales,
            "region",
            aggregate("orders", OperationKind.COUNT, "amount"),
            aggregate("largest", OperationKind.MAX, "amount"));

    SplitExpression split = splitter.split(sales, expr, salesChunk);

    assertEquals(OperationKind.GROUP_BY, split.getChunkExpression().getKind());
    GroupBy merged = (GroupBy) split.getAggregateExpression();
    assertEquals(
        List.of(
            aggregate("orders", OperationKind.SUM, "orders"),
            aggregate("largest", OperationKind.MAX, "largest")),
        merged.getAggregates());
    assertEquals(expr.getShape(), merged.getShape());
  }

  @Test
  void should_reject_group_aggregates_that_do_not_decompose() {
    Symbol sales = collection("sales", SALES);
    Symbol salesChunk = new Symbol("sales_chunk", DataShape.fixed(10, SALES));
    Expression expr = groupBy(sales, "region", aggregate("avg", OperationKind.MEAN, "amount"));

    assertThrows(
        UnsupportedExecutionException.class, () -> splitter.split(sales, expr, salesChunk));
  }

  @Test
  void should_reject_several_independent_reductions() {
    assertThrows(
        UnsupportedExecutionException.class,
        () -> splitter.split(x, divide(sum(x), count(x)), chunk));
  }

  @Test
  void should_reject_source_used_outside_the_reduction() {
    assertThrows(
        UnsupportedExecutionException.class, () -> splitter.split(x, add(x, sum(x)), chunk));
  }

  @Test
  void should_replace_nodes_by_identity() {
    Expression total = sum(x);
    Expression expr = add(total, sum(x));

    Expression replaced = ExpressionSplitter.replace(expr, total, literal(0));

    assertEquals("(0 + sum(x))", replaced.toString());
    assertSame(expr, ExpressionSplitter.replace(expr, chunk, literal(0)));
  }
}
