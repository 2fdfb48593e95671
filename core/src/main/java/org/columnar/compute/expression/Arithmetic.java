/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.Getter;
import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.data.type.DataType;

/**
 * Binary arithmetic between two operands, each a scalar or a numeric collection. Collections
 * combine element by element and must have the same length; a scalar broadcasts over a collection.
 */
public class Arithmetic extends Expression {

  @Getter private final ArithmeticOperator operator;
  @Getter private final Expression left;
  @Getter private final Expression right;
  private final DataShape shape;

  public Arithmetic(ArithmeticOperator operator, Expression left, Expression right) {
    Preconditions.checkArgument(
        left.getShape().getElementType() instanceof DataType
            && right.getShape().getElementType() instanceof DataType,
        "arithmetic requires primitive operands, got %s and %s",
        left.getShape(),
        right.getShape());
    this.operator = operator;
    this.left = left;
    this.right = right;
    DataType type =
        operator.resultType(
            (DataType) left.getShape().getElementType(),
            (DataType) right.getShape().getElementType());
    if (left.getShape().isCollection()) {
      this.shape = left.getShape().withElementType(type);
    } else if (right.getShape().isCollection()) {
      this.shape = right.getShape().withElementType(type);
    } else {
      this.shape = DataShape.scalar(type);
    }
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.ARITHMETIC;
  }

  @Override
  public List<Expression> getChildren() {
    return List.of(left, right);
  }

  @Override
  public DataShape getShape() {
    return shape;
  }

  @Override
  public Expression withChildren(List<Expression> children) {
    Preconditions.checkArgument(children.size() == 2, "arithmetic takes two children");
    return new Arithmetic(operator, children.get(0), children.get(1));
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitArithmetic(this, context);
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator.getSymbol() + " " + right + ")";
  }
}
