/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.storage;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.DoubleBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.columnar.compute.data.model.Block;
import org.columnar.compute.data.model.DoubleArrayBlock;
import org.columnar.compute.data.type.DataType;
import org.columnar.compute.data.type.ElementType;
import org.columnar.compute.exception.ComputeEngineException;

/**
 * A column of doubles stored in a file as consecutive 8-byte little-endian values. Slices and
 * iteration windows are memory-mapped on demand, so the file is never loaded onto the heap as a
 * whole.
 */
@Log4j2
public class MappedDoubleColumnSource implements DataSource, Closeable {

  /** Elements mapped at a time while iterating. */
  static final int ITERATION_WINDOW = 1 << 16;

  /** Most elements a single mapping can cover, since a mapped region is at most 2 GiB. */
  static final int MAX_MAP_WINDOW = Integer.MAX_VALUE / Double.BYTES;

  private final Path path;
  private final FileChannel channel;
  private final long length;
  private final int mapWindow;

  private MappedDoubleColumnSource(Path path, FileChannel channel, long length, int mapWindow) {
    this.path = path;
    this.channel = channel;
    this.length = length;
    this.mapWindow = mapWindow;
  }

  /**
   * Opens a column file for reading.
   *
   * @throws IOException if the file cannot be opened
   * @throws IllegalArgumentException if the file size is not a multiple of 8 bytes
   */
  public static MappedDoubleColumnSource open(Path path) throws IOException {
    return open(path, MAX_MAP_WINDOW);
  }

  static MappedDoubleColumnSource open(Path path, int mapWindow) throws IOException {
    Preconditions.checkArgument(
        mapWindow >= 1 && mapWindow <= MAX_MAP_WINDOW, "invalid map window %s", mapWindow);
    FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
    long size = channel.size();
    if (size % Double.BYTES != 0) {
      channel.close();
      throw new IllegalArgumentException(
          String.format("%s has %d bytes, not a whole number of doubles", path, size));
    }
    log.debug("Opened {} with {} elements", path, size / Double.BYTES);
    return new MappedDoubleColumnSource(path, channel, size / Double.BYTES, mapWindow);
  }

  @Override
  public long length() {
    return length;
  }

  @Override
  public long byteSize() {
    return length * Double.BYTES;
  }

  @Override
  public ElementType elementType() {
    return DataType.DOUBLE;
  }

  @Override
  public Block slice(long start, long stop) {
    Preconditions.checkArgument(
        start >= 0 && start <= stop && stop <= length,
        "slice [%s, %s) out of range [0, %s)",
        start,
        stop,
        length);
    Preconditions.checkArgument(
        stop - start <= Integer.MAX_VALUE,
        "slice [%s, %s) exceeds the largest block of %s elements",
        start,
        stop,
        Integer.MAX_VALUE);
    return new DoubleArrayBlock(read(start, (int) (stop - start)));
  }

  @Override
  public Iterator<Object> iterator() {
    return new AbstractIterator<>() {
      private long windowStart;
      private double[] window = new double[0];
      private int position;

      @Override
      protected Object computeNext() {
        if (position == window.length) {
          if (windowStart >= length) {
            return endOfData();
          }
          int size = (int) Math.min(ITERATION_WINDOW, length - windowStart);
          window = read(windowStart, size);
          windowStart += size;
          position = 0;
        }
        return window[position++];
      }
    };
  }

  @Override
  public Set<Capability> capabilities() {
    return EnumSet.of(Capability.SLICE, Capability.ITERATE);
  }

  private double[] read(long start, int count) {
    double[] values = new double[count];
    try {
      int offset = 0;
      while (offset < count) {
        int size = Math.min(mapWindow, count - offset);
        DoubleBuffer buffer =
            channel
                .map(
                    FileChannel.MapMode.READ_ONLY,
                    (start + offset) * Double.BYTES,
                    (long) size * Double.BYTES)
                .order(ByteOrder.LITTLE_ENDIAN)
                .asDoubleBuffer();
        buffer.get(values, offset, size);
        offset += size;
      }
      return values;
    } catch (IOException e) {
      throw new ComputeEngineException("Failed to read " + path, e);
    }
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }

  @Override
  public String toString() {
    return "MappedDoubleColumnSource{" + path + ", length=" + length + '}';
  }
}
