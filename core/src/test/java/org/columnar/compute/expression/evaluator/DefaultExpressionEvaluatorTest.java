/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.evaluator;

import static org.columnar.compute.expression.DSL.add;
import static org.columnar.compute.expression.DSL.aggregate;
import static org.columnar.compute.expression.DSL.collection;
import static org.columnar.compute.expression.DSL.combineMoments;
import static org.columnar.compute.expression.DSL.compare;
import static org.columnar.compute.expression.DSL.count;
import static org.columnar.compute.expression.DSL.distinct;
import static org.columnar.compute.expression.DSL.divide;
import static org.columnar.compute.expression.DSL.eq;
import static org.columnar.compute.expression.DSL.field;
import static org.columnar.compute.expression.DSL.groupBy;
import static org.columnar.compute.expression.DSL.gt;
import static org.columnar.compute.expression.DSL.head;
import static org.columnar.compute.expression.DSL.label;
import static org.columnar.compute.expression.DSL.like;
import static org.columnar.compute.expression.DSL.literal;
import static org.columnar.compute.expression.DSL.map;
import static org.columnar.compute.expression.DSL.max;
import static org.columnar.compute.expression.DSL.mean;
import static org.columnar.compute.expression.DSL.min;
import static org.columnar.compute.expression.DSL.multiply;
import static org.columnar.compute.expression.DSL.nunique;
import static org.columnar.compute.expression.DSL.or;
import static org.columnar.compute.expression.DSL.project;
import static org.columnar.compute.expression.DSL.schema;
import static org.columnar.compute.expression.DSL.select;
import static org.columnar.compute.expression.DSL.slice;
import static org.columnar.compute.expression.DSL.std;
import static org.columnar.compute.expression.DSL.sum;
import static org.columnar.compute.expression.DSL.var;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.columnar.compute.data.model.Block;
import org.columnar.compute.data.model.Blocks;
import org.columnar.compute.data.model.ColumnarPage;
import org.columnar.compute.data.model.Page;
import org.columnar.compute.data.model.PageBuilder;
import org.columnar.compute.data.model.Row;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.RecordType;
import org.columnar.compute.exception.ExpressionEvaluationException;
import org.columnar.compute.exception.NumericDomainException;
import org.columnar.compute.exception.PredicateCompilationException;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.MathFunction;
import org.columnar.compute.expression.OperationKind;
import org.columnar.compute.expression.Symbol;
import org.columnar.compute.expression.predicate.ComparisonOperator;
import org.columnar.compute.expression.predicate.Predicate;
import org.columnar.compute.expression.reduction.CombineMoments;
import org.columnar.compute.expression.reduction.Moments;
import org.columnar.compute.storage.Capability;
import org.columnar.compute.storage.InMemoryDataSource;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DefaultExpressionEvaluatorTest {

  private static final RecordType STAFF =
      schema("dept", DataType.STRING, "name", DataType.STRING, "salary", DataType.LONG);

  @Mock private PredicateCompiler failingCompiler;

  private final DefaultExpressionEvaluator evaluator = new DefaultExpressionEvaluator();

  private final Symbol x = collection("x", 10, DataType.LONG);
  private final Block oneToTen = Blocks.ofLongs(LongStream.rangeClosed(1, 10).toArray());

  private final Symbol staff = collection("staff", STAFF);
  private final Page staffPage =
      page(
          STAFF,
          new Object[] {"eng", "ann", 120L},
          new Object[] {"ops", "bob", 80L},
          new Object[] {"eng", "cy", 100L},
          new Object[] {"hr", "dee", 70L});

  @Test
  void should_compute_reductions_of_a_block() {
    assertEquals(55L, eval(sum(x)));
    assertEquals(10L, eval(count(x)));
    assertEquals(5.5, eval(mean(x)));
    assertEquals(8.25, (double) eval(var(x)), 1e-12);
    assertEquals(3.0276503540974917, (double) eval(std(x, true)), 1e-12);
    assertEquals(1L, eval(min(x)));
    assertEquals(10L, eval(max(x)));
    assertEquals(10L, eval(nunique(x)));
  }

  @Test
  void should_wrap_reductions_that_keep_dimensions() {
    assertEquals(Blocks.ofLongs(10), eval(count(x).copy(x, true)));
    assertEquals(Blocks.ofDoubles(5.5), eval(mean(x).copy(x, true)));

    Page moments = (Page) eval(new Moments(x, true));
    assertEquals(Moments.TYPE, moments.getSchema());
    assertEquals(new Row(Moments.TYPE, 10L, 55.0, 82.5), moments.getRow(0));
  }

  @Test
  void should_combine_partial_moments() {
    Symbol partials = collection("partials", Moments.TYPE);
    Page rows =
        page(
            Moments.TYPE,
            new Object[] {3L, 6.0, 2.0},
            new Object[] {2L, 9.0, 0.5});

    Expression mean = combineMoments(partials, CombineMoments.Statistic.MEAN, false);
    Expression variance = combineMoments(partials, CombineMoments.Statistic.VARIANCE, false);
    Expression std = combineMoments(partials, CombineMoments.Statistic.STD, true);

    assertEquals(3.0, evaluate(mean, partials, rows));
    assertEquals(2.0, (double) evaluate(variance, partials, rows), 1e-12);
    assertEquals(Math.sqrt(2.5), (double) evaluate(std, partials, rows), 1e-12);
  }

  @Test
  void should_handle_empty_min_and_max() {
    Block empty = Blocks.empty(DataType.LONG);

    assertEquals(empty, evaluate(min(x).copy(x, true), x, empty));
    assertThrows(NumericDomainException.class, () -> evaluate(max(x), x, empty));
    assertThrows(NumericDomainException.class, () -> evaluate(mean(x), x, empty));
    assertEquals(0L, evaluate(sum(x), x, empty));
  }

  @Test
  void should_filter_with_compiled_mask() {
    Object result = evaluate(select(staff, gt("salary", 90)), staff, staffPage);

    assertEquals(
        page(STAFF, new Object[] {"eng", "ann", 120L}, new Object[] {"eng", "cy", 100L}),
        result);
  }

  @Test
  void should_filter_row_by_row_when_predicate_does_not_compile()
      throws PredicateCompilationException {
    when(failingCompiler.compile(any(), any()))
        .thenThrow(new PredicateCompilationException("no vectorized form"));
    DefaultExpressionEvaluator fallback = new DefaultExpressionEvaluator(failingCompiler);
    Expression expr = select(staff, or(eq("dept", "hr"), gt("salary", 110)));

    Object rowByRow = fallback.evaluate(expr, Map.of(staff, staffPage));
    Object vectorized = evaluator.evaluate(expr, Map.of(staff, staffPage));

    assertEquals(vectorized, rowByRow);
    assertEquals(2, ((Page) rowByRow).getPositionCount());
  }

  @Test
  void should_filter_with_like_patterns() {
    Object result = evaluate(field(select(staff, like("name", "?e*")), "name"), staff, staffPage);

    assertEquals(Blocks.ofStrings("dee"), result);
  }

  @Test
  void should_filter_lazy_input_lazily() {
    Symbol values = collection("values", DataType.LONG);
    Predicate odd = compare(ComparisonOperator.NE, 0);

    Object result =
        evaluate(select(values, odd), values, List.of(0L, 1L, 0L, 2L).iterator());

    assertTrue(result instanceof Iterator);
    assertEquals(List.of(1L, 2L), ImmutableList.copyOf((Iterator<?>) result));
  }

  @Test
  void should_read_only_the_head_of_a_stream() {
    Symbol values = collection("values", DataType.LONG);
    CountingIterator source = new CountingIterator(1_000_000);

    Object result = evaluate(head(values, 3), values, source);

    assertEquals(List.of(0L, 1L, 2L), ImmutableList.copyOf((Iterator<?>) result));
    assertEquals(3, source.produced);
  }

  @Test
  void should_slice_blocks_and_pages() {
    assertEquals(Blocks.ofLongs(9, 10), eval(slice(x, 8, 20)));
    assertEquals(Blocks.ofLongs(), eval(slice(x, 15, 20)));
    assertEquals(
        page(STAFF, new Object[] {"ops", "bob", 80L}),
        evaluate(slice(staff, 1, 2), staff, staffPage));
  }

  @Test
  void should_compute_arithmetic_with_broadcast() {
    assertEquals(
        Blocks.ofLongs(3, 5, 7),
        evaluate(add(multiply(x, literal(2)), literal(1)), x, block(1, 2, 3)));
    assertEquals(Blocks.ofDoubles(0.5, 1.0), evaluate(divide(x, literal(2)), x, block(1, 2)));
    assertEquals(Blocks.ofLongs(2, 4), evaluate(add(x, x), x, block(1, 2)));
    assertEquals(7L, eval(add(literal(3), literal(4))));
  }

  @Test
  void should_reject_invalid_arithmetic() {
    Symbol y = collection("y", DataType.LONG);

    assertThrows(
        NumericDomainException.class, () -> evaluate(divide(x, literal(0)), x, block(1)));
    assertThrows(
        ExpressionEvaluationException.class,
        () -> evaluator.evaluate(add(x, y), Map.of(x, block(1, 2), y, block(1))));
  }

  @Test
  void should_apply_elementwise_functions() {
    assertEquals(Blocks.ofLongs(1, 4), evaluate(map(x, MathFunction.ABS), x, block(-1, 4)));
    assertEquals(Blocks.ofDoubles(2.0, 3.0), evaluate(map(x, MathFunction.SQRT), x, block(4, 9)));
  }

  @Test
  void should_keep_first_occurrence_order_for_distinct() {
    assertEquals(Blocks.ofLongs(3, 1, 2), evaluate(distinct(x), x, block(3, 1, 3, 2, 1)));
  }

  @Test
  void should_project_and_label_columns() {
    Object projected = evaluate(project(staff, "salary", "name"), staff, staffPage);
    Object labeled = evaluate(label(field(staff, "salary"), "pay"), staff, staffPage);

    assertEquals(
        schema("salary", DataType.LONG, "name", DataType.STRING), ((Page) projected).getSchema());
    assertEquals(
        new ColumnarPage(
            RecordType.of("pay", DataType.LONG), List.of(Blocks.ofLongs(120, 80, 100, 70))),
        labeled);
  }

  @Test
  void should_group_rows_by_key() {
    Expression grouped =
        groupBy(
            staff,
            "dept",
            aggregate("n", OperationKind.COUNT, "name"),
            aggregate("total", OperationKind.SUM, "salary"),
            aggregate("lowest", OperationKind.MIN, "salary"),
            aggregate("average", OperationKind.MEAN, "salary"),
            aggregate("names", OperationKind.NUNIQUE, "name"));
    RecordType result =
        schema(
            "dept", DataType.STRING,
            "n", DataType.LONG,
            "total", DataType.LONG,
            "lowest", DataType.LONG,
            "average", DataType.DOUBLE,
            "names", DataType.LONG);

    assertEquals(
        page(
            result,
            new Object[] {"eng", 2L, 220L, 100L, 110.0, 2L},
            new Object[] {"ops", 1L, 80L, 80L, 80.0, 1L},
            new Object[] {"hr", 1L, 70L, 70L, 70.0, 1L}),
        evaluate(grouped, staff, staffPage));
  }

  @Test
  void should_reject_group_mean_without_values() {
    Page unpaid =
        page(STAFF, new Object[] {"eng", "ann", 120L}, new Object[] {"ops", "bob", null});
    Expression averaged = groupBy(staff, "dept", aggregate("avg", OperationKind.MEAN, "salary"));
    Expression totals = groupBy(staff, "dept", aggregate("total", OperationKind.SUM, "salary"));

    assertThrows(NumericDomainException.class, () -> evaluate(averaged, staff, unpaid));
    assertEquals(
        page(
            schema("dept", DataType.STRING, "total", DataType.LONG),
            new Object[] {"eng", 120L},
            new Object[] {"ops", 0L}),
        evaluate(totals, staff, unpaid));
  }

  @Test
  void should_iterate_bound_source_afresh_for_every_reference() {
    InMemoryDataSource source =
        InMemoryDataSource.of(oneToTen).withCapabilities(EnumSet.of(Capability.ITERATE));

    assertEquals(
        LongStream.rangeClosed(1, 10).map(i -> i * 2).boxed().collect(Collectors.toList()),
        ImmutableList.copyOf((Iterator<?>) evaluate(add(x, x), x, source)));
    assertEquals(5.5, evaluate(divide(sum(x), count(x)), x, source));
  }

  @Test
  void should_fail_on_unbound_symbol() {
    assertThrows(ExpressionEvaluationException.class, () -> evaluator.evaluate(sum(x), Map.of()));
  }

  private Object eval(Expression expression) {
    return evaluate(expression, x, oneToTen);
  }

  private Object evaluate(Expression expression, Symbol symbol, Object value) {
    return evaluator.evaluate(expression, Map.of(symbol, value));
  }

  private static Block block(long... values) {
    return Blocks.ofLongs(values);
  }

  private static Page page(RecordType schema, Object[]... rows) {
    PageBuilder builder = new PageBuilder(schema);
    for (Object[] row : rows) {
      builder.appendRow(new Row(schema, row));
    }
    return builder.build();
  }

  /** Counts how many elements have been pulled. */
  private static class CountingIterator extends AbstractIterator<Object> {
    private final long size;
    private long produced;

    CountingIterator(long size) {
      this.size = size;
    }

    @Override
    protected Object computeNext() {
      if (produced >= size) {
        return endOfData();
      }
      return produced++;
    }
  }
}
