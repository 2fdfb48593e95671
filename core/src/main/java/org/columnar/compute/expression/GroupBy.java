/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.RecordType;

/**
 * Groups the rows of a table by one key column and computes named aggregates per group. The result
 * is a table with the key column followed by one column per aggregate, one row per key in order
 * of first appearance.
 */
public class GroupBy extends UnaryExpression {

  /** Aggregate functions a group can compute. */
  public static final Set<OperationKind> FUNCTIONS =
      EnumSet.of(
          OperationKind.COUNT,
          OperationKind.SUM,
          OperationKind.MIN,
          OperationKind.MAX,
          OperationKind.MEAN,
          OperationKind.NUNIQUE);

  @Getter private final String key;
  @Getter private final List<Aggregate> aggregates;
  private final DataShape shape;

  public GroupBy(Expression child, String key, List<Aggregate> aggregates) {
    super(child);
    Preconditions.checkArgument(
        child.getShape().getElementType().isRecord(),
        "group by requires a table input, got %s",
        child.getShape());
    Preconditions.checkArgument(!aggregates.isEmpty(), "group by needs at least one aggregate");
    RecordType input = (RecordType) child.getShape().getElementType();
    List<String> names = new ArrayList<>();
    List<DataType> types = new ArrayList<>();
    names.add(key);
    types.add(input.typeOf(key));
    for (Aggregate aggregate : aggregates) {
      Preconditions.checkArgument(
          FUNCTIONS.contains(aggregate.getFunction()),
          "unsupported group aggregate %s",
          aggregate.getFunction());
      names.add(aggregate.getName());
      types.add(aggregate.resultType(input.typeOf(aggregate.getColumn())));
    }
    this.key = key;
    this.aggregates = ImmutableList.copyOf(aggregates);
    this.shape = DataShape.var(new RecordType(names, types));
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.GROUP_BY;
  }

  @Override
  public DataShape getShape() {
    return shape;
  }

  @Override
  public UnaryExpression withChild(Expression newChild) {
    return new GroupBy(newChild, key, aggregates);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitGroupBy(this, context);
  }

  @Override
  public String toString() {
    return "by(" + getChild() + "." + key + ", " + aggregates + ")";
  }

  /** One named aggregate of a {@link GroupBy}: {@code name = function(column)}. */
  @Getter
  @EqualsAndHashCode
  @RequiredArgsConstructor
  public static class Aggregate {
    private final String name;
    private final OperationKind function;
    private final String column;

    public static Aggregate of(String name, OperationKind function, String column) {
      return new Aggregate(name, function, column);
    }

    /** Returns the type of the aggregate for an input column type. */
    public DataType resultType(DataType input) {
      switch (function) {
        case COUNT:
        case NUNIQUE:
          return DataType.LONG;
        case MEAN:
          return DataType.DOUBLE;
        case SUM:
          return input == DataType.DOUBLE ? DataType.DOUBLE : DataType.LONG;
        default:
          return input;
      }
    }

    @Override
    public String toString() {
      return name + "=" + function.name().toLowerCase() + "(" + column + ")";
    }
  }
}
