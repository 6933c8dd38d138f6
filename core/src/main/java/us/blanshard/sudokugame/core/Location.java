/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.sudokugame.core;

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.Sets;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * A cell position on a Sudoku grid.  There are exactly 81 instances, so
 * locations may be compared by identity.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Location implements Comparable<Location> {

  /** The number of distinct locations. */
  public static final int COUNT = 81;

  public final Row row;
  public final Column column;
  public final Block block;

  /** The 20 locations sharing a row, column or block with this one, not counting this one. */
  public final List<Location> peers;

  /** A number in the range [0, COUNT), row-major. */
  public final int index;

  /** Returns the location at the given row and column numbers, each in 1..9. */
  public static Location of(int rowNumber, int columnNumber) {
    checkElementIndex(rowNumber - 1, 9, "row number - 1");
    checkElementIndex(columnNumber - 1, 9, "column number - 1");
    return of((rowNumber - 1) * 9 + columnNumber - 1);
  }

  /** Returns the location at the given row and column indices, each in 0..8. */
  public static Location ofIndices(int rowIndex, int columnIndex) {
    checkElementIndex(rowIndex, 9, "row index");
    checkElementIndex(columnIndex, 9, "column index");
    return of(rowIndex * 9 + columnIndex);
  }

  public static Location of(int index) {
    return instances[index];
  }

  /** All locations, in row-major order. */
  public static final List<Location> ALL;

  public Unit unit(Unit.Type type) {
    switch (type) {
      case ROW: return row;
      case COLUMN: return column;
      default: return block;
    }
  }

  @Override public int compareTo(Location that) {
    return this.index - that.index;
  }

  @Override public String toString() {
    return String.format("(%d, %d)", row.index, column.index);
  }

  static Iterator<Location> iterator(byte[] indices) {
    return new Iter(indices);
  }

  private static class Iter implements Iterator<Location> {
    private final byte[] indices;
    private int next;
    private Iter(byte[] indices) {
      this.indices = indices;
    }
    @Override public boolean hasNext() {
      return next < indices.length;
    }
    @Override public Location next() {
      return of(indices[next++]);
    }
  }

  private Location(int index) {
    this.index = index;
    this.row = Row.ofIndex(index / 9);
    this.column = Column.ofIndex(index % 9);
    this.block = Block.ofIndex(index / 27 * 3 + index % 9 / 3);
    this.peersArray = new Location[20];  // Filled in later, see static block below.
    this.peers = Collections.unmodifiableList(Arrays.asList(peersArray));
  }

  private final Location[] peersArray;
  private static final Location[] instances;
  static {
    instances = new Location[COUNT];
    for (int i = 0; i < COUNT; ++i) {
      instances[i] = new Location(i);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
    for (Location loc : instances) {
      Set<Location> peers = Sets.newLinkedHashSet();
      peers.addAll(loc.row);
      peers.addAll(loc.column);
      peers.addAll(loc.block);
      peers.remove(loc);
      peers.toArray(loc.peersArray);
    }
  }
}
