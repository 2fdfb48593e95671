/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.storage;

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import org.columnar.compute.data.model.Block;
import org.columnar.compute.data.model.Page;
import org.columnar.compute.data.model.Pages;
import org.columnar.compute.data.model.Values;
import org.columnar.compute.data.type.ElementType;

/** Data source over a {@link Block} or {@link Page} already held in memory. */
public class InMemoryDataSource implements DataSource {

  private final Object data;
  private final Set<Capability> capabilities;

  private InMemoryDataSource(Object data, Set<Capability> capabilities) {
    this.data = data;
    this.capabilities = Sets.immutableEnumSet(capabilities);
  }

  public static InMemoryDataSource of(Block block) {
    return new InMemoryDataSource(block, EnumSet.of(Capability.SLICE, Capability.ITERATE));
  }

  public static InMemoryDataSource of(Page page) {
    return new InMemoryDataSource(page, EnumSet.allOf(Capability.class));
  }

  /** Returns a view of this source restricted to the given access patterns. */
  public InMemoryDataSource withCapabilities(Set<Capability> restricted) {
    return new InMemoryDataSource(data, restricted);
  }

  @Override
  public long length() {
    return data instanceof Block
        ? ((Block) data).getPositionCount()
        : ((Page) data).getPositionCount();
  }

  @Override
  public long byteSize() {
    return data instanceof Block
        ? ((Block) data).getRetainedSizeBytes()
        : ((Page) data).getRetainedSizeBytes();
  }

  @Override
  public ElementType elementType() {
    return data instanceof Block ? ((Block) data).getType() : ((Page) data).getSchema();
  }

  @Override
  public Object slice(long start, long stop) {
    if (!supports(Capability.SLICE)) {
      throw new UnsupportedOperationException("source does not support slicing");
    }
    Preconditions.checkPositionIndexes((int) start, (int) stop, (int) length());
    int length = (int) (stop - start);
    return data instanceof Block
        ? ((Block) data).getRegion((int) start, length)
        : ((Page) data).getRegion((int) start, length);
  }

  @Override
  public Iterator<Object> iterator() {
    if (!supports(Capability.ITERATE)) {
      throw new UnsupportedOperationException("source does not support iteration");
    }
    return Values.iterator(data);
  }

  @Override
  public Set<Capability> capabilities() {
    return capabilities;
  }

  @Override
  public InMemoryDataSource project(List<String> fields) {
    if (!supports(Capability.PROJECT) || !(data instanceof Page)) {
      throw new UnsupportedOperationException("source does not support projection");
    }
    return new InMemoryDataSource(Pages.project((Page) data, fields), capabilities);
  }

  @Override
  public String toString() {
    return "InMemoryDataSource{" + Values.describe(data) + ", length=" + length() + '}';
  }
}
