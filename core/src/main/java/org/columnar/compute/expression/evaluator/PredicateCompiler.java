/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.evaluator;

import org.columnar.compute.data.model.Block;
import org.columnar.compute.data.model.Page;
import org.columnar.compute.data.model.Values;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.ElementType;
import org.columnar.compute.data.type.RecordType;
import org.columnar.compute.exception.PredicateCompilationException;
import org.columnar.compute.expression.predicate.And;
import org.columnar.compute.expression.predicate.Comparison;
import org.columnar.compute.expression.predicate.ComparisonOperator;
import org.columnar.compute.expression.predicate.Like;
import org.columnar.compute.expression.predicate.Not;
import org.columnar.compute.expression.predicate.Or;
import org.columnar.compute.expression.predicate.Predicate;
import org.columnar.compute.expression.predicate.PredicateVisitor;

/**
 * Compiles predicates into column-at-a-time masks. Comparisons of numeric or boolean columns with
 * a literal, string equality, and conjunctions, disjunctions and negations of those compile.
 * Pattern matching and ordered string comparisons do not.
 */
public class PredicateCompiler {

  /**
   * Compiles the predicate for batches whose elements have the given type.
   *
   * @throws PredicateCompilationException if the predicate has no vectorized form
   */
  public VectorizedPredicate compile(Predicate predicate, ElementType elementType)
      throws PredicateCompilationException {
    return predicate.accept(new Compiler(elementType));
  }

  private static int positionCount(Object batch) {
    return batch instanceof Page
        ? ((Page) batch).getPositionCount()
        : ((Block) batch).getPositionCount();
  }

  private static class Compiler
      implements PredicateVisitor<VectorizedPredicate, PredicateCompilationException> {

    private final ElementType elementType;

    Compiler(ElementType elementType) {
      this.elementType = elementType;
    }

    @Override
    public VectorizedPredicate visitComparison(Comparison comparison)
        throws PredicateCompilationException {
      String column = comparison.getColumn();
      DataType type = columnType(column);
      ComparisonOperator operator = comparison.getOperator();
      Object literal = comparison.getLiteral();
      if (literal == null) {
        return batch -> new boolean[positionCount(batch)];
      }
      if (type.isNumeric() && literal instanceof Number) {
        return batch -> compareNumbers(columnOf(batch, column), operator, (Number) literal);
      }
      if (type == DataType.BOOLEAN && literal instanceof Boolean) {
        boolean expected = (Boolean) literal;
        return batch -> {
          Block block = columnOf(batch, column);
          boolean[] mask = new boolean[block.getPositionCount()];
          for (int i = 0; i < mask.length; i++) {
            mask[i] = operator.holds(Boolean.compare((Boolean) block.getValue(i), expected));
          }
          return mask;
        };
      }
      if (type == DataType.STRING && literal instanceof String && !operator.isOrdering()) {
        boolean equal = operator == ComparisonOperator.EQ;
        return batch -> {
          Block block = columnOf(batch, column);
          boolean[] mask = new boolean[block.getPositionCount()];
          for (int i = 0; i < mask.length; i++) {
            mask[i] = !block.isNull(i) && literal.equals(block.getValue(i)) == equal;
          }
          return mask;
        };
      }
      throw new PredicateCompilationException(
          String.format("No vectorized form for %s over %s", comparison, type.typeName()));
    }

    @Override
    public VectorizedPredicate visitLike(Like like) throws PredicateCompilationException {
      throw new PredicateCompilationException("No vectorized form for " + like);
    }

    @Override
    public VectorizedPredicate visitAnd(And and) throws PredicateCompilationException {
      VectorizedPredicate left = and.getLeft().accept(this);
      VectorizedPredicate right = and.getRight().accept(this);
      return batch -> {
        boolean[] mask = left.evaluate(batch);
        boolean[] other = right.evaluate(batch);
        for (int i = 0; i < mask.length; i++) {
          mask[i] &= other[i];
        }
        return mask;
      };
    }

    @Override
    public VectorizedPredicate visitOr(Or or) throws PredicateCompilationException {
      VectorizedPredicate left = or.getLeft().accept(this);
      VectorizedPredicate right = or.getRight().accept(this);
      return batch -> {
        boolean[] mask = left.evaluate(batch);
        boolean[] other = right.evaluate(batch);
        for (int i = 0; i < mask.length; i++) {
          mask[i] |= other[i];
        }
        return mask;
      };
    }

    @Override
    public VectorizedPredicate visitNot(Not not) throws PredicateCompilationException {
      VectorizedPredicate operand = not.getOperand().accept(this);
      return batch -> {
        boolean[] mask = operand.evaluate(batch);
        for (int i = 0; i < mask.length; i++) {
          mask[i] = !mask[i];
        }
        return mask;
      };
    }

    private DataType columnType(String column) throws PredicateCompilationException {
      if (column == null) {
        if (elementType.isRecord()) {
          throw new PredicateCompilationException("Bare comparison against records");
        }
        return (DataType) elementType;
      }
      if (!elementType.isRecord() || !((RecordType) elementType).hasField(column)) {
        throw new PredicateCompilationException(
            "No column [" + column + "] in " + elementType.typeName());
      }
      return ((RecordType) elementType).typeOf(column);
    }
  }

  private static Block columnOf(Object batch, String column) {
    return column == null ? (Block) batch : ((Page) batch).getBlock(column);
  }

  private static boolean[] compareNumbers(
      Block block, ComparisonOperator operator, Number literal) {
    boolean[] mask = new boolean[block.getPositionCount()];
    if (block.getType() == DataType.LONG && Values.isIntegral(literal)) {
      long expected = literal.longValue();
      for (int i = 0; i < mask.length; i++) {
        mask[i] = operator.holds(Long.compare(((Number) block.getValue(i)).longValue(), expected));
      }
      return mask;
    }
    double expected = literal.doubleValue();
    for (int i = 0; i < mask.length; i++) {
      mask[i] = operator.holds(Double.compare(block.getDouble(i), expected));
    }
    return mask;
  }
}
