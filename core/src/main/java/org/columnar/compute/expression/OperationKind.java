/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression;

/** Tag identifying the operation an {@link Expression} node performs. */
public enum OperationKind {
  SYMBOL,
  LITERAL,
  FIELD,
  PROJECTION,
  SELECTION,
  HEAD,
  SLICE,
  ELEMWISE,
  ARITHMETIC,
  DISTINCT,
  LABEL,
  GROUP_BY,
  COUNT,
  SUM,
  MIN,
  MAX,
  MEAN,
  VAR,
  STD,
  NUNIQUE,
  MOMENTS,
  COMBINE_MOMENTS
}
