/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.type;

/**
 * Type of a single element of a dataset: either a primitive {@link DataType} or a {@link
 * RecordType} for tabular data.
 */
public interface ElementType {

  /** Returns a printable name of the type. */
  String typeName();

  /** Returns true if elements of this type are records with named fields. */
  default boolean isRecord() {
    return false;
  }
}
