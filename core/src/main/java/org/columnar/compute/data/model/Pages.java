/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.data.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.columnar.compute.data.type.RecordType;

/** Utility methods for {@link Page}s. */
public final class Pages {

  private Pages() {}

  /**
   * Concatenates the rows of pages in order. A single page is returned unchanged.
   *
   * @param pages the pages, at least one, all with the same schema
   * @return the concatenated page
   */
  public static Page concat(List<Page> pages) {
    Preconditions.checkArgument(!pages.isEmpty(), "cannot concatenate zero pages");
    if (pages.size() == 1) {
      return pages.get(0);
    }
    RecordType schema = pages.get(0).getSchema();
    List<Block> columns = new ArrayList<>(schema.size());
    for (int channel = 0; channel < schema.size(); channel++) {
      List<Block> parts = new ArrayList<>(pages.size());
      for (Page page : pages) {
        Preconditions.checkArgument(
            page.getSchema().equals(schema),
            "cannot concatenate %s with %s",
            schema,
            page.getSchema());
        parts.add(page.getBlock(channel));
      }
      columns.add(Blocks.concat(parts));
    }
    return new ColumnarPage(schema, columns);
  }

  /** Returns the rows of the page for which the mask is set. */
  public static Page filter(Page page, boolean[] mask) {
    List<Block> columns = new ArrayList<>(page.getChannelCount());
    for (int channel = 0; channel < page.getChannelCount(); channel++) {
      columns.add(Blocks.filter(page.getBlock(channel), mask));
    }
    return new ColumnarPage(page.getSchema(), columns);
  }

  /** Returns a page with only the given columns. */
  public static Page project(Page page, List<String> fields) {
    List<Block> columns = new ArrayList<>(fields.size());
    for (String field : fields) {
      columns.add(page.getBlock(field));
    }
    return new ColumnarPage(page.getSchema().project(fields), columns);
  }

  /** Returns a lazy iterator over the page's rows. */
  public static Iterator<Object> iterator(Page page) {
    return new AbstractIterator<>() {
      private int position;

      @Override
      protected Object computeNext() {
        if (position >= page.getPositionCount()) {
          return endOfData();
        }
        return page.getRow(position++);
      }
    };
  }

  /** Builds a page from rows with the given schema. */
  public static Page fromRows(RecordType schema, Iterator<?> rows) {
    PageBuilder builder = new PageBuilder(schema);
    while (rows.hasNext()) {
      builder.appendRow((Row) rows.next());
    }
    return builder.build();
  }
}
