/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.reduction;

import java.util.List;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.ElementType;
import org.columnar.compute.data.type.RecordType;
import org.columnar.compute.expression.Expression;
import org.columnar.compute.expression.ExpressionVisitor;
import org.columnar.compute.expression.OperationKind;

/**
 * Partial statistics of a numeric collection as one record: element count, sum, and sum of squared
 * deviations from the mean ({@code m2}). Moments of disjoint parts combine exactly through {@link
 * CombineMoments}.
 */
public class Moments extends Reduction {

  public static final String COUNT = "count";
  public static final String SUM = "sum";
  public static final String M2 = "m2";

  public static final RecordType TYPE =
      new RecordType(
          List.of(COUNT, SUM, M2), List.of(DataType.LONG, DataType.DOUBLE, DataType.DOUBLE));

  public Moments(Expression child, boolean keepDims) {
    super(child, keepDims);
  }

  @Override
  public OperationKind getKind() {
    return OperationKind.MOMENTS;
  }

  @Override
  public ElementType resultType() {
    return TYPE;
  }

  @Override
  public Reduction copy(Expression child, boolean keepDims) {
    return new Moments(child, keepDims);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitMoments(this, context);
  }
}
