/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

/** How an expression relates to its data source, for choosing an execution strategy. */
public enum OperationCategory {
  /** Only cheap operations between the root and the source, with a head at the root. */
  CHEAP_HEAD,
  /** Only cheap operations between the root and the source. */
  CHEAP,
  /** At least one operation that needs to see the whole source. */
  REDUCTION
}
