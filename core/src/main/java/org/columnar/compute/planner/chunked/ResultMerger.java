/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.planner.chunked;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.columnar.compute.data.model.Block;
import org.columnar.compute.data.model.Blocks;
import org.columnar.compute.data.model.Page;
import org.columnar.compute.data.model.Pages;
import org.columnar.compute.data.model.Values;
import org.columnar.compute.data.type.DataShape;
import org.columnar.compute.exception.ComputeEngineException;

/**
 * Concatenates chunk results in partition order. The form of the first result decides how: blocks
 * concatenate into one block, pages into one page, sequences flatten into a list, and bare values
 * collect into a list.
 */
public class ResultMerger {

  /**
   * Merges chunk results, which must already be in partition order.
   *
   * @param results chunk results
   * @param shape shape of the merged value, used when there are no results
   * @return the merged value; a single result is returned as is
   */
  public Object merge(List<ChunkResult> results, DataShape shape) {
    if (results.isEmpty()) {
      return Values.empty(shape.getElementType());
    }
    Object first = results.get(0).getValue();
    if (results.size() == 1 && Values.isCollection(first) && !(first instanceof Iterator)) {
      return first;
    }
    if (first instanceof Block) {
      List<Block> blocks = new ArrayList<>(results.size());
      for (ChunkResult result : results) {
        blocks.add(cast(result, Block.class));
      }
      return Blocks.concat(blocks);
    }
    if (first instanceof Page) {
      List<Page> pages = new ArrayList<>(results.size());
      for (ChunkResult result : results) {
        pages.add(cast(result, Page.class));
      }
      return Pages.concat(pages);
    }
    List<Object> merged = new ArrayList<>();
    for (ChunkResult result : results) {
      Object value = result.getValue();
      if (Values.isCollection(value)) {
        Values.iterator(value).forEachRemaining(merged::add);
      } else {
        merged.add(value);
      }
    }
    return merged;
  }

  private static <T> T cast(ChunkResult result, Class<T> type) {
    if (!type.isInstance(result.getValue())) {
      throw new ComputeEngineException(
          String.format(
              "Cannot merge %s from chunk %d with %s results",
              Values.describe(result.getValue()), result.getSequence(), type.getSimpleName()));
    }
    return type.cast(result.getValue());
  }
}
