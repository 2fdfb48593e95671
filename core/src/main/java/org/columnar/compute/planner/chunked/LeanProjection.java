/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.columnar.compute.data.type.ElementType;
import org.columnar.compute.data.type.RecordType;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.Field;
import org.columnar.compute.expression.GroupBy;
import org.columnar.compute.expression.Projection;
import org.columnar.compute.expression.Selection;
import org.columnar.compute.expression.Symbol;
import org.columnar.compute.expression.predicate.And;
import org.columnar.compute.expression.predicate.Comparison;
import org.columnar.compute.expression.predicate.Like;
import org.columnar.compute.expression.predicate.Not;
import org.columnar.compute.expression.predicate.Or;
import org.columnar.compute.expression.predicate.Predicate;
import org.columnar.compute.expression.predicate.PredicateVisitor;

/**
 * Prunes the columns of a table leaf that an expression never reads. Field access, projection,
 * group-by and filters name the columns they read; any other use of a table (returning it,
 * counting its rows, taking its distinct records) reads every column.
 */
public final class LeanProjection {

  private LeanProjection() {}

  /**
   * Returns the fields of a table leaf the expression reads, in schema order.
   *
   * @return empty if the leaf is not a table or every field is read
   */
  public static Optional<List<String>> requiredFields(Expression expression, Symbol leaf) {
    ElementType type = leaf.getShape().getElementType();
    if (!type.isRecord()) {
      return Optional.empty();
    }
    Set<String> read = new HashSet<>();
    if (!collect(expression, null, leaf, read)) {
      return Optional.empty();
    }
    RecordType schema = (RecordType) type;
    ImmutableList.Builder<String> fields = ImmutableList.builder();
    for (String name : schema.getNames()) {
      if (read.contains(name)) {
        fields.add(name);
      }
    }
    List<String> required = fields.build();
    if (required.isEmpty() || required.size() == schema.size()) {
      return Optional.empty();
    }
    return Optional.of(required);
  }

  /** Returns the expression reading the leaf through a projection of the required fields only. */
  public static Expression apply(Expression expression, Symbol leaf) {
    Optional<List<String>> fields = requiredFields(expression, leaf);
    if (fields.isEmpty()) {
      return expression;
    }
    return ExpressionSplitter.replace(expression, leaf, new Projection(leaf, fields.get()));
  }

  /** Returns a symbol like {@code leaf} whose records carry only the given fields. */
  public static Symbol narrow(Symbol leaf, List<String> fields) {
    RecordType schema = (RecordType) leaf.getShape().getElementType();
    return new Symbol(leaf.getName(), leaf.getShape().withElementType(schema.project(fields)));
  }

  /** Returns the expression with every reference to {@code leaf} replaced by {@code narrowed}. */
  public static Expression rebind(Expression expression, Symbol leaf, Symbol narrowed) {
    return ExpressionSplitter.replace(expression, leaf, narrowed);
  }

  /**
   * Adds the leaf fields read below {@code node} to {@code read}, given the fields its parent
   * reads from it ({@code null} for all of them).
   *
   * @return false once the leaf is read whole
   */
  private static boolean collect(
      Expression node, Set<String> demand, Symbol leaf, Set<String> read) {
    if (node == leaf) {
      if (demand == null) {
        return false;
      }
      read.addAll(demand);
      return true;
    }
    switch (node.getKind()) {
      case FIELD:
        return collect(child(node), Set.of(((Field) node).getName()), leaf, read);
      case PROJECTION:
        Set<String> fields = ImmutableSet.copyOf(((Projection) node).getFields());
        return collect(child(node), fields, leaf, read);
      case SELECTION:
        return collect(child(node), withPredicateColumns((Selection) node, demand), leaf, read);
      case HEAD:
      case SLICE:
        return collect(child(node), demand, leaf, read);
      case GROUP_BY:
        GroupBy groupBy = (GroupBy) node;
        Set<String> columns = new HashSet<>();
        columns.add(groupBy.getKey());
        for (GroupBy.Aggregate aggregate : groupBy.getAggregates()) {
          columns.add(aggregate.getColumn());
        }
        return collect(child(node), columns, leaf, read);
      default:
        for (Expression child : node.getChildren()) {
          if (!collect(child, null, leaf, read)) {
            return false;
          }
        }
        return true;
    }
  }

  private static Set<String> withPredicateColumns(Selection selection, Set<String> demand) {
    if (demand == null) {
      return null;
    }
    Set<String> columns = new HashSet<>(demand);
    return selection.getPredicate().accept(new ColumnCollector(columns)) ? columns : null;
  }

  private static Expression child(Expression node) {
    return node.getChildren().get(0);
  }

  /** Adds the columns a predicate reads; false if it reads whole elements. */
  private static class ColumnCollector implements PredicateVisitor<Boolean, RuntimeException> {

    private final Set<String> columns;

    ColumnCollector(Set<String> columns) {
      this.columns = columns;
    }

    @Override
    public Boolean visitComparison(Comparison comparison) {
      return add(comparison.getColumn());
    }

    @Override
    public Boolean visitLike(Like like) {
      return add(like.getColumn());
    }

    @Override
    public Boolean visitAnd(And and) {
      return both(and.getLeft(), and.getRight());
    }

    @Override
    public Boolean visitOr(Or or) {
      return both(or.getLeft(), or.getRight());
    }

    @Override
    public Boolean visitNot(Not not) {
      return not.getOperand().accept(this);
    }

    private boolean both(Predicate left, Predicate right) {
      return left.accept(this) && right.accept(this);
    }

    private boolean add(String column) {
      if (column == null) {
        return false;
      }
      columns.add(column);
      return true;
    }
  }
}
