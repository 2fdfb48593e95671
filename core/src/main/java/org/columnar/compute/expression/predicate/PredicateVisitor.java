/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.predicate;

/**
 * Visitor over predicate trees.
 *
 * @param <R> return type of visit methods
 * @param <E> checked exception a visit may raise
 */
public interface PredicateVisitor<R, E extends Exception> {

  R visitComparison(Comparison comparison) throws E;

  R visitLike(Like like) throws E;

  R visitAnd(And and) throws E;

  R visitOr(Or or) throws E;

  R visitNot(Not not) throws E;
}
