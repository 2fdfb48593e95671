/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.reduction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.LongStream;
import org.columnar.compute.data.model.Block;
import org.columnar.compute.data.model.Blocks;
import org.columnar.compute.data.model.Page;
import org.columnar.compute.data.model.PageBuilder;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.RecordType;
import org.columnar.compute.exception.ExpressionEvaluationException;
import org.columnar.compute.exception.NumericDomainException;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ReductionLibraryTest {

  private static final Block ONE_TO_TEN = Blocks.ofLongs(LongStream.rangeClosed(1, 10).toArray());

  @Test
  void should_compute_basic_reductions() {
    assertEquals(55L, ReductionLibrary.sum(ONE_TO_TEN, DataType.LONG));
    assertEquals(10L, ReductionLibrary.count(ONE_TO_TEN));
    assertEquals(5.5, ReductionLibrary.mean(ONE_TO_TEN, DataType.LONG));
    assertEquals(8.25, ReductionLibrary.variance(ONE_TO_TEN, false), 1e-12);
    assertEquals(82.5 / 9, ReductionLibrary.variance(ONE_TO_TEN, true), 1e-12);
    assertEquals(3.0276503540974917, ReductionLibrary.std(ONE_TO_TEN, true), 1e-12);
    assertEquals(Optional.of(1L), ReductionLibrary.min(ONE_TO_TEN));
    assertEquals(Optional.of(10L), ReductionLibrary.max(ONE_TO_TEN));
  }

  @Test
  void should_reduce_iterators_and_lists() {
    assertEquals(6L, ReductionLibrary.sum(List.of(1L, 2L, 3L).iterator(), DataType.LONG));
    assertEquals(2.0, ReductionLibrary.mean(List.of(1L, 2L, 3L).iterator(), DataType.LONG));
    assertEquals(3.5, ReductionLibrary.sum(Arrays.asList(1L, null, 2.5), DataType.DOUBLE));
    assertEquals(2L, ReductionLibrary.count(Arrays.asList("a", null, "b")));
  }

  @Test
  void should_sum_doubles_as_double() {
    assertEquals(4.0, ReductionLibrary.sum(Blocks.ofDoubles(1.5, 2.5), DataType.DOUBLE));
    assertEquals(0L, ReductionLibrary.sum(Blocks.empty(DataType.LONG), DataType.LONG));
  }

  @Test
  void should_count_rows_of_tables() {
    PageBuilder builder = new PageBuilder(RecordType.of("id", DataType.LONG));
    for (long i = 0; i < 4; i++) {
      builder.beginRow();
      builder.setValue(0, i);
      builder.endRow();
    }
    Page page = builder.build();

    assertEquals(4L, ReductionLibrary.count(page));
  }

  @Test
  void should_count_distinct_values_exactly() {
    assertEquals(3L, ReductionLibrary.nunique(Blocks.ofLongs(1, 1, 2, 2, 3)));
    assertEquals(2L, ReductionLibrary.nunique(Arrays.asList("x", null, "y", "x")));
    assertEquals(0L, ReductionLibrary.nunique(Blocks.empty(DataType.STRING)));
  }

  @Test
  void should_merge_moments_across_internal_chunks() {
    int length = ReductionLibrary.MOMENTS_CHUNK_SIZE * 2 + 8;
    double[] values = new double[length];
    for (int i = 0; i < length; i++) {
      values[i] = i % 2 == 0 ? 1.0 : 3.0;
    }

    RunningMoments moments = ReductionLibrary.moments(Blocks.ofDoubles(values));

    assertEquals(length, moments.getCount());
    assertEquals(2.0, moments.mean(), 1e-9);
    assertEquals(1.0, moments.variance(false), 1e-9);
  }

  @Test
  void should_keep_variance_of_large_constant_values_at_zero() {
    double[] values = new double[100_000];
    Arrays.fill(values, 1e12);

    assertEquals(0.0, ReductionLibrary.variance(Blocks.ofDoubles(values), false));
  }

  @Test
  void should_order_strings_for_min_and_max() {
    Block words = Blocks.ofStrings("pear", "apple", "quince");

    assertEquals(Optional.of("apple"), ReductionLibrary.min(words));
    assertEquals(Optional.of("quince"), ReductionLibrary.max(words));
    assertTrue(ReductionLibrary.min(Blocks.empty(DataType.LONG)).isEmpty());
  }

  @Test
  void should_reject_undefined_or_invalid_input() {
    Block empty = Blocks.empty(DataType.DOUBLE);

    assertThrows(NumericDomainException.class, () -> ReductionLibrary.mean(empty, DataType.DOUBLE));
    assertThrows(NumericDomainException.class, () -> ReductionLibrary.variance(empty, false));
    assertThrows(
        ExpressionEvaluationException.class,
        () -> ReductionLibrary.sum(Blocks.ofStrings("a"), DataType.STRING));
    assertThrows(
        ExpressionEvaluationException.class,
        () -> ReductionLibrary.moments(List.of("a").iterator()));
  }
}
