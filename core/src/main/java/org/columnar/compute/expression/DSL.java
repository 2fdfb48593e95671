/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import java.util.Arrays;
import java.util.List;
import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.ElementType;
import org.columnar.compute.data.type.RecordType;
import org.columnar.compute.expression.GroupBy.Aggregate;
import org.columnar.compute.expression.predicate.And;
import org.columnar.compute.expression.predicate.Comparison;
import org.columnar.compute.expression.predicate.ComparisonOperator;
import org.columnar.compute.expression.predicate.Like;
import org.columnar.compute.expression.predicate.Not;
import org.columnar.compute.expression.predicate.Or;
import org.columnar.compute.expression.predicate.Predicate;
import org.columnar.compute.expression.reduction.CombineMoments;
import org.columnar.compute.expression.reduction.Count;
import org.columnar.compute.expression.reduction.Max;
import org.columnar.compute.expression.reduction.Mean;
import org.columnar.compute.expression.reduction.Min;
import org.columnar.compute.expression.reduction.Moments;
import org.columnar.compute.expression.reduction.NUnique;
import org.columnar.compute.expression.reduction.StdDev;
import org.columnar.compute.expression.reduction.Sum;
import org.columnar.compute.expression.reduction.Variance;

/** Static factory methods for building expression and predicate trees. */
public final class DSL {

  private DSL() {}

  public static Symbol symbol(String name, DataShape shape) {
    return new Symbol(name, shape);
  }

  /** A collection of unknown length. */
  public static Symbol collection(String name, ElementType elementType) {
    return new Symbol(name, DataShape.var(elementType));
  }

  /** A collection of known length. */
  public static Symbol collection(String name, long length, ElementType elementType) {
    return new Symbol(name, DataShape.fixed(length, elementType));
  }

  public static RecordType schema(Object... namesAndTypes) {
    String[] names = new String[namesAndTypes.length / 2];
    DataType[] types = new DataType[namesAndTypes.length / 2];
    for (int i = 0; i < names.length; i++) {
      names[i] = (String) namesAndTypes[2 * i];
      types[i] = (DataType) namesAndTypes[2 * i + 1];
    }
    return new RecordType(Arrays.asList(names), Arrays.asList(types));
  }

  public static Literal literal(Object value) {
    return new Literal(value);
  }

  public static Field field(Expression child, String name) {
    return new Field(child, name);
  }

  public static Projection project(Expression child, String... fields) {
    return new Projection(child, Arrays.asList(fields));
  }

  public static Selection select(Expression child, Predicate predicate) {
    return new Selection(child, predicate);
  }

  public static Head head(Expression child, long n) {
    return new Head(child, n);
  }

  public static Slice slice(Expression child, long start, long stop) {
    return new Slice(child, start, stop);
  }

  public static ElementwiseMap map(Expression child, MathFunction function) {
    return new ElementwiseMap(child, function);
  }

  public static Arithmetic add(Expression left, Expression right) {
    return new Arithmetic(ArithmeticOperator.ADD, left, right);
  }

  public static Arithmetic subtract(Expression left, Expression right) {
    return new Arithmetic(ArithmeticOperator.SUBTRACT, left, right);
  }

  public static Arithmetic multiply(Expression left, Expression right) {
    return new Arithmetic(ArithmeticOperator.MULTIPLY, left, right);
  }

  public static Arithmetic divide(Expression left, Expression right) {
    return new Arithmetic(ArithmeticOperator.DIVIDE, left, right);
  }

  public static Distinct distinct(Expression child) {
    return new Distinct(child);
  }

  public static Label label(Expression child, String label) {
    return new Label(child, label);
  }

  public static GroupBy groupBy(Expression child, String key, Aggregate... aggregates) {
    return new GroupBy(child, key, List.of(aggregates));
  }

  public static Aggregate aggregate(String name, OperationKind function, String column) {
    return Aggregate.of(name, function, column);
  }

  public static Count count(Expression child) {
    return new Count(child, false);
  }

  public static Sum sum(Expression child) {
    return new Sum(child, false);
  }

  public static Min min(Expression child) {
    return new Min(child, false);
  }

  public static Max max(Expression child) {
    return new Max(child, false);
  }

  public static Mean mean(Expression child) {
    return new Mean(child, false);
  }

  /** Population variance. */
  public static Variance var(Expression child) {
    return new Variance(child, false, false);
  }

  public static Variance var(Expression child, boolean unbiased) {
    return new Variance(child, unbiased, false);
  }

  /** Population standard deviation. */
  public static StdDev std(Expression child) {
    return new StdDev(child, false, false);
  }

  public static StdDev std(Expression child, boolean unbiased) {
    return new StdDev(child, unbiased, false);
  }

  public static NUnique nunique(Expression child) {
    return new NUnique(child, false);
  }

  public static Moments moments(Expression child) {
    return new Moments(child, false);
  }

  public static CombineMoments combineMoments(
      Expression child, CombineMoments.Statistic statistic, boolean unbiased) {
    return new CombineMoments(child, statistic, unbiased, false);
  }

  /** Comparison against each bare element of a primitive collection. */
  public static Predicate compare(ComparisonOperator operator, Object literal) {
    return new Comparison(null, operator, literal);
  }

  public static Predicate compare(String column, ComparisonOperator operator, Object literal) {
    return new Comparison(column, operator, literal);
  }

  public static Predicate gt(String column, Object literal) {
    return compare(column, ComparisonOperator.GT, literal);
  }

  public static Predicate gte(String column, Object literal) {
    return compare(column, ComparisonOperator.GTE, literal);
  }

  public static Predicate lt(String column, Object literal) {
    return compare(column, ComparisonOperator.LT, literal);
  }

  public static Predicate lte(String column, Object literal) {
    return compare(column, ComparisonOperator.LTE, literal);
  }

  public static Predicate eq(String column, Object literal) {
    return compare(column, ComparisonOperator.EQ, literal);
  }

  public static Predicate ne(String column, Object literal) {
    return compare(column, ComparisonOperator.NE, literal);
  }

  public static Predicate like(String column, String glob) {
    return new Like(column, glob);
  }

  public static Predicate and(Predicate left, Predicate right) {
    return new And(left, right);
  }

  public static Predicate or(Predicate left, Predicate right) {
    return new Or(left, right);
  }

  public static Predicate not(Predicate operand) {
    return new Not(operand);
  }
}
