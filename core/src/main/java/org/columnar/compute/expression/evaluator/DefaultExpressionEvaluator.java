/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.evaluator;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BinaryOperator;
import lombok.extern.log4j.Log4j2;
import org.columnar.compute.data.model.Block;
import org.columnar.compute.data.model.BlockBuilder;
import org.columnar.compute.data.model.Blocks;
import org.columnar.compute.data.model.ColumnarPage;
import org.columnar.compute.data.model.Page;
import org.columnar.compute.data.model.PageBuilder;
import org.columnar.compute.data.model.Pages;
import org.columnar.compute.data.model.Row;
import org.columnar.compute.data.model.Values;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.ElementType;
import org.columnar.compute.data.type.RecordType;
import org.columnar.compute.exception.ExpressionEvaluationException;
import org.columnar.compute.exception.NumericDomainException;
import org.columnar.compute.exception.PredicateCompilationException;
import org.columnar.compute.expression.Arithmetic;
import org.columnar.compute.expression.ArithmeticOperator;
import org.columnar.compute.expression.Distinct;
import org.columnar.compute.expression.ElementwiseMap;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.ExpressionVisitor;
import org.columnar.compute.expression.Field;
import org.columnar.compute.expression.GroupBy;
import org.columnar.compute.expression.Head;
import org.columnar.compute.expression.Label;
import org.columnar.compute.expression.Literal;
import org.columnar.compute.expression.MathFunction;
import org.columnar.compute.expression.Projection;
import org.columnar.compute.expression.Selection;
import org.columnar.compute.expression.Slice;
import org.columnar.compute.expression.Symbol;
import org.columnar.compute.expression.reduction.CombineMoments;
import org.columnar.compute.expression.reduction.Count;
import org.columnar.compute.expression.reduction.Max;
import org.columnar.compute.expression.reduction.Mean;
import org.columnar.compute.expression.reduction.Min;
import org.columnar.compute.expression.reduction.Moments;
import org.columnar.compute.expression.reduction.NUnique;
import org.columnar.compute.expression.reduction.Reduction;
import org.columnar.compute.expression.reduction.StdDev;
import org.columnar.compute.expression.reduction.Sum;
import org.columnar.compute.expression.reduction.Variance;
import org.columnar.compute.reduction.ReductionLibrary;
import org.columnar.compute.reduction.RunningMoments;
import org.columnar.compute.storage.DataSource;

/**
 * Evaluates expressions over materialized and lazy values. Materialized inputs ({@link Block},
 * {@link Page}) produce materialized outputs, so filters can use compiled masks. Lazy inputs
 * ({@link Iterator}, {@link List}) stream through row-local operations, so a head over a lazy
 * source reads only the elements it returns.
 */
@Log4j2
public class DefaultExpressionEvaluator implements ExpressionEvaluator {

  private final PredicateCompiler predicateCompiler;

  public DefaultExpressionEvaluator() {
    this(new PredicateCompiler());
  }

  public DefaultExpressionEvaluator(PredicateCompiler predicateCompiler) {
    this.predicateCompiler = predicateCompiler;
  }

  @Override
  public Object evaluate(Expression expression, Map<Symbol, Object> bindings) {
    return expression.accept(new Evaluator(), bindings);
  }

  private class Evaluator extends ExpressionVisitor<Object, Map<Symbol, Object>> {

    private Object eval(Expression node, Map<Symbol, Object> bindings) {
      return node.accept(this, bindings);
    }

    @Override
    public Object visitNode(Expression node, Map<Symbol, Object> bindings) {
      throw new ExpressionEvaluationException("Unsupported expression " + node);
    }

    @Override
    public Object visitSymbol(Symbol symbol, Map<Symbol, Object> bindings) {
      if (!bindings.containsKey(symbol)) {
        throw new ExpressionEvaluationException("Unbound symbol [" + symbol.getName() + "]");
      }
      Object value = bindings.get(symbol);
      if (value instanceof DataSource) {
        return ((DataSource) value).iterator();
      }
      return value;
    }

    @Override
    public Object visitLiteral(Literal literal, Map<Symbol, Object> bindings) {
      return literal.getValue();
    }

    @Override
    public Object visitField(Field field, Map<Symbol, Object> bindings) {
      Object input = eval(field.getChild(), bindings);
      String name = field.getName();
      if (input instanceof Page) {
        return ((Page) input).getBlock(name);
      }
      if (input instanceof Row) {
        return ((Row) input).get(name);
      }
      return Iterators.transform(records(input, field), row -> row.get(name));
    }

    @Override
    public Object visitProjection(Projection projection, Map<Symbol, Object> bindings) {
      Object input = eval(projection.getChild(), bindings);
      List<String> fields = projection.getFields();
      if (input instanceof Page) {
        return Pages.project((Page) input, fields);
      }
      if (input instanceof Row) {
        return ((Row) input).project(fields);
      }
      return Iterators.transform(records(input, projection), row -> row.project(fields));
    }

    @Override
    public Object visitSelection(Selection selection, Map<Symbol, Object> bindings) {
      Object input = eval(selection.getChild(), bindings);
      ElementType elementType = selection.getChild().getShape().getElementType();
      if (input instanceof Block || input instanceof Page) {
        try {
          boolean[] mask =
              predicateCompiler.compile(selection.getPredicate(), elementType).evaluate(input);
          return input instanceof Block
              ? Blocks.filter((Block) input, mask)
              : Pages.filter((Page) input, mask);
        } catch (PredicateCompilationException e) {
          log.debug("Evaluating {} row by row: {}", selection.getPredicate(), e.getMessage());
        }
        return Values.materialize(
            Iterators.filter(Values.iterator(input), selection.getPredicate()::test),
            elementType(input, elementType));
      }
      return Iterators.filter(Values.iterator(input), selection.getPredicate()::test);
    }

    @Override
    public Object visitHead(Head head, Map<Symbol, Object> bindings) {
      return slice(eval(head.getChild(), bindings), 0, head.getN());
    }

    @Override
    public Object visitSlice(Slice slice, Map<Symbol, Object> bindings) {
      return slice(eval(slice.getChild(), bindings), slice.getStart(), slice.getStop());
    }

    @Override
    public Object visitElementwiseMap(ElementwiseMap map, Map<Symbol, Object> bindings) {
      Object input = eval(map.getChild(), bindings);
      MathFunction function = map.getFunction();
      if (input instanceof Block) {
        Block block = (Block) input;
        DataType inputType = block.getType();
        BlockBuilder builder =
            new BlockBuilder(function.resultType(inputType), block.getPositionCount());
        for (int i = 0; i < block.getPositionCount(); i++) {
          builder.append(function.applyTo((Number) block.getValue(i), inputType));
        }
        return builder.build();
      }
      DataType inputType = (DataType) map.getChild().getShape().getElementType();
      if (!Values.isCollection(input)) {
        return function.applyTo(number(input), inputType);
      }
      return Iterators.transform(
          Values.iterator(input), value -> function.applyTo(number(value), inputType));
    }

    @Override
    public Object visitArithmetic(Arithmetic arithmetic, Map<Symbol, Object> bindings) {
      Object left = eval(arithmetic.getLeft(), bindings);
      Object right = eval(arithmetic.getRight(), bindings);
      DataType type = (DataType) arithmetic.getShape().getElementType();
      if (!Values.isCollection(left) && !Values.isCollection(right)) {
        return arithmetic.getOperator().apply(number(left), number(right), type);
      }
      ArithmeticOperator operator = arithmetic.getOperator();
      Iterator<Object> result;
      if (!Values.isCollection(right)) {
        Number scalar = number(right);
        result =
            Iterators.transform(
                Values.iterator(left), value -> operator.apply(number(value), scalar, type));
      } else if (!Values.isCollection(left)) {
        Number scalar = number(left);
        result =
            Iterators.transform(
                Values.iterator(right), value -> operator.apply(scalar, number(value), type));
      } else {
        result =
            new ZipIterator(
                Values.iterator(left),
                Values.iterator(right),
                (l, r) -> operator.apply(number(l), number(r), type));
      }
      if (left instanceof Block || right instanceof Block) {
        return Values.materialize(result, type);
      }
      return result;
    }

    @Override
    public Object visitDistinct(Distinct distinct, Map<Symbol, Object> bindings) {
      Object input = eval(distinct.getChild(), bindings);
      Set<Object> seen = new LinkedHashSet<>();
      Iterators.addAll(seen, Values.iterator(input));
      return Values.materialize(
          seen.iterator(),
          elementType(input, distinct.getShape().getElementType()));
    }

    @Override
    public Object visitLabel(Label label, Map<Symbol, Object> bindings) {
      Object input = eval(label.getChild(), bindings);
      RecordType schema = (RecordType) label.getShape().getElementType();
      if (input instanceof Block) {
        Block block = (Block) input;
        return new ColumnarPage(
            RecordType.of(label.getLabel(), block.getType()), List.of(block));
      }
      if (input instanceof Page) {
        Page page = (Page) input;
        return new ColumnarPage(
            page.getSchema().rename(page.getSchema().getNames().get(0), label.getLabel()),
            List.of(page.getBlock(0)));
      }
      if (!Values.isCollection(input)) {
        return new Row(schema, input);
      }
      return Iterators.transform(
          Values.iterator(input),
          value -> new Row(schema, value instanceof Row ? ((Row) value).get(0) : value));
    }

    @Override
    public Object visitGroupBy(GroupBy groupBy, Map<Symbol, Object> bindings) {
      Object input = eval(groupBy.getChild(), bindings);
      Map<Object, List<GroupAccumulator>> groups = new LinkedHashMap<>();
      for (Iterator<Row> rows = records(input, groupBy); rows.hasNext(); ) {
        Row row = rows.next();
        List<GroupAccumulator> accumulators =
            groups.computeIfAbsent(row.get(groupBy.getKey()), key -> newAccumulators(groupBy));
        for (GroupAccumulator accumulator : accumulators) {
          accumulator.add(row);
        }
      }
      RecordType schema = (RecordType) groupBy.getShape().getElementType();
      PageBuilder builder = new PageBuilder(schema);
      for (Map.Entry<Object, List<GroupAccumulator>> group : groups.entrySet()) {
        builder.beginRow();
        builder.setValue(0, group.getKey());
        for (int i = 0; i < group.getValue().size(); i++) {
          builder.setValue(i + 1, group.getValue().get(i).result(schema.getTypes().get(i + 1)));
        }
        builder.endRow();
      }
      return builder.build();
    }

    @Override
    public Object visitCount(Count count, Map<Symbol, Object> bindings) {
      return wrap(count, ReductionLibrary.count(eval(count.getChild(), bindings)));
    }

    @Override
    public Object visitSum(Sum sum, Map<Symbol, Object> bindings) {
      Number result = ReductionLibrary.sum(eval(sum.getChild(), bindings), primitive(sum));
      if (sum.resultType() == DataType.LONG) {
        return wrap(sum, result.longValue());
      }
      return wrap(sum, result.doubleValue());
    }

    @Override
    public Object visitMin(Min min, Map<Symbol, Object> bindings) {
      return extremum(min, ReductionLibrary.min(eval(min.getChild(), bindings)));
    }

    @Override
    public Object visitMax(Max max, Map<Symbol, Object> bindings) {
      return extremum(max, ReductionLibrary.max(eval(max.getChild(), bindings)));
    }

    @Override
    public Object visitMean(Mean mean, Map<Symbol, Object> bindings) {
      return wrap(mean, ReductionLibrary.mean(eval(mean.getChild(), bindings), primitive(mean)));
    }

    @Override
    public Object visitVariance(Variance variance, Map<Symbol, Object> bindings) {
      Object input = eval(variance.getChild(), bindings);
      return wrap(variance, ReductionLibrary.variance(input, variance.isUnbiased()));
    }

    @Override
    public Object visitStdDev(StdDev std, Map<Symbol, Object> bindings) {
      return wrap(std, ReductionLibrary.std(eval(std.getChild(), bindings), std.isUnbiased()));
    }

    @Override
    public Object visitNUnique(NUnique nunique, Map<Symbol, Object> bindings) {
      return wrap(nunique, ReductionLibrary.nunique(eval(nunique.getChild(), bindings)));
    }

    @Override
    public Object visitMoments(Moments moments, Map<Symbol, Object> bindings) {
      RunningMoments result = ReductionLibrary.moments(eval(moments.getChild(), bindings));
      return wrap(
          moments, new Row(Moments.TYPE, result.getCount(), result.getSum(), result.getM2()));
    }

    @Override
    public Object visitCombineMoments(CombineMoments combine, Map<Symbol, Object> bindings) {
      RunningMoments total = new RunningMoments();
      for (Iterator<Row> rows = records(eval(combine.getChild(), bindings), combine);
          rows.hasNext(); ) {
        Row row = rows.next();
        total.merge(
            new RunningMoments(
                ((Number) row.get(Moments.COUNT)).longValue(),
                ((Number) row.get(Moments.SUM)).doubleValue(),
                ((Number) row.get(Moments.M2)).doubleValue()));
      }
      switch (combine.getStatistic()) {
        case MEAN:
          return wrap(combine, total.mean());
        case VARIANCE:
          return wrap(combine, total.variance(combine.isUnbiased()));
        default:
          return wrap(combine, total.std(combine.isUnbiased()));
      }
    }

    private Object extremum(Reduction reduction, Optional<Object> result) {
      if (result.isPresent()) {
        return wrap(reduction, result.get());
      }
      if (reduction.isKeepDims()) {
        return Values.empty(reduction.resultType());
      }
      throw new NumericDomainException(
          reduction.getKind().name().toLowerCase() + " of an empty dataset is undefined");
    }
  }

  /** Embeds a reduced value in a one-element collection when the reduction keeps dimensions. */
  private static Object wrap(Reduction reduction, Object value) {
    if (!reduction.isKeepDims()) {
      return value;
    }
    ElementType type = reduction.resultType();
    if (type.isRecord()) {
      PageBuilder builder = new PageBuilder((RecordType) type);
      builder.appendRow((Row) value);
      return builder.build();
    }
    return Blocks.singleton(value, (DataType) type);
  }

  private static DataType primitive(Reduction reduction) {
    ElementType type = reduction.getChild().getShape().getElementType();
    if (type.isRecord()) {
      throw new ExpressionEvaluationException(
          reduction.getKind().name().toLowerCase() + " requires primitive values, got " + type);
    }
    return (DataType) type;
  }

  private static Object slice(Object input, long start, long stop) {
    if (input instanceof Block) {
      Block block = (Block) input;
      int from = (int) Math.min(start, block.getPositionCount());
      int to = (int) Math.min(stop, block.getPositionCount());
      return block.getRegion(from, to - from);
    }
    if (input instanceof Page) {
      Page page = (Page) input;
      int from = (int) Math.min(start, page.getPositionCount());
      int to = (int) Math.min(stop, page.getPositionCount());
      return page.getRegion(from, to - from);
    }
    Iterator<Object> elements = Values.iterator(input);
    Iterators.advance(elements, saturatedInt(start));
    return Iterators.limit(elements, saturatedInt(stop - start));
  }

  private static int saturatedInt(long value) {
    return (int) Math.min(value, Integer.MAX_VALUE);
  }

  /** Returns the runtime element type of a materialized value, or the declared one otherwise. */
  private static ElementType elementType(Object value, ElementType declared) {
    if (value instanceof Block) {
      return ((Block) value).getType();
    }
    if (value instanceof Page) {
      return ((Page) value).getSchema();
    }
    return declared;
  }

  private static Iterator<Row> records(Object input, Expression node) {
    if (!Values.isCollection(input)) {
      throw new ExpressionEvaluationException(
          String.format("%s requires records, got %s", node, Values.describe(input)));
    }
    return Iterators.transform(
        Values.iterator(input),
        element -> {
          if (!(element instanceof Row)) {
            throw new ExpressionEvaluationException(
                String.format("%s requires records, got %s", node, Values.describe(element)));
          }
          return (Row) element;
        });
  }

  private static Number number(Object value) {
    if (!(value instanceof Number)) {
      throw new ExpressionEvaluationException(
          "Expected a number but got " + Values.describe(value));
    }
    return (Number) value;
  }

  private static List<GroupAccumulator> newAccumulators(GroupBy groupBy) {
    List<GroupAccumulator> accumulators = new ArrayList<>(groupBy.getAggregates().size());
    for (GroupBy.Aggregate aggregate : groupBy.getAggregates()) {
      accumulators.add(new GroupAccumulator(aggregate));
    }
    return accumulators;
  }

  /** Pairs up two element streams of equal length. */
  private static class ZipIterator extends AbstractIterator<Object> {

    private final Iterator<Object> left;
    private final Iterator<Object> right;
    private final BinaryOperator<Object> combiner;

    ZipIterator(Iterator<Object> left, Iterator<Object> right, BinaryOperator<Object> combiner) {
      this.left = left;
      this.right = right;
      this.combiner = combiner;
    }

    @Override
    protected Object computeNext() {
      boolean hasLeft = left.hasNext();
      boolean hasRight = right.hasNext();
      if (hasLeft && hasRight) {
        return combiner.apply(left.next(), right.next());
      }
      if (hasLeft || hasRight) {
        throw new ExpressionEvaluationException("Operands of arithmetic differ in length");
      }
      return endOfData();
    }
  }

  /** Running state of one aggregate within one group. */
  private static class GroupAccumulator {

    private final GroupBy.Aggregate aggregate;
    private final Set<Object> distinct = new HashSet<>();
    private long count;
    private long longSum;
    private double doubleSum;
    private boolean integral = true;
    private Object best;

    GroupAccumulator(GroupBy.Aggregate aggregate) {
      this.aggregate = aggregate;
    }

    void add(Row row) {
      Object value = row.get(aggregate.getColumn());
      if (value == null) {
        return;
      }
      count++;
      switch (aggregate.getFunction()) {
        case SUM:
        case MEAN:
          Number n = number(value);
          if (integral && Values.isIntegral(n)) {
            longSum += n.longValue();
          } else {
            if (integral) {
              doubleSum = longSum;
              integral = false;
            }
            doubleSum += n.doubleValue();
          }
          break;
        case MIN:
          best = best == null || Values.compare(value, best) < 0 ? value : best;
          break;
        case MAX:
          best = best == null || Values.compare(value, best) > 0 ? value : best;
          break;
        case NUNIQUE:
          distinct.add(value);
          break;
        default:
          break;
      }
    }

    Object result(DataType type) {
      switch (aggregate.getFunction()) {
        case COUNT:
          return count;
        case SUM:
          return type == DataType.LONG ? (Object) longSum : (Object) sum();
        case MEAN:
          if (count == 0) {
            throw new NumericDomainException(
                "mean of [" + aggregate.getColumn() + "] is undefined for a group without values");
          }
          return sum() / count;
        case NUNIQUE:
          return (long) distinct.size();
        default:
          return best;
      }
    }

    private double sum() {
      return integral ? longSum : doubleSum;
    }
  }
}
