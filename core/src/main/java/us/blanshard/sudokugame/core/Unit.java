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

import com.google.common.collect.ImmutableList;

import java.util.AbstractCollection;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * A row, column, or block of a Sudoku grid: a set of 9 locations that must all
 * contain different numerals in a valid Sudoku.
 *
 * @author Luke Blanshard
 */
@Immutable
public abstract class Unit extends AbstractCollection<Location>
    implements Collection<Location> {

  public static final int COUNT = 3 * 9;  // 9 each of rows, columns, and blocks.

  public enum Type {
    ROW, COLUMN, BLOCK
  }

  /** Returns a list of all the units: rows, then columns, then blocks. */
  public static List<Unit> allUnits() {
    return AllUnits.INSTANCE.list;
  }

  /** Returns the numerals that are not set in this unit in the given grid. */
  public final NumSet getMissing(Grid grid) {
    int bits = NumSet.ALL_BITS;
    for (Location loc : this) {
      Numeral num = grid.get(loc);
      if (num != null) bits &= ~num.bit;
    }
    return NumSet.ofBits(bits);
  }

  /**
   * Tells whether every numeral appears exactly once in this unit in the given
   * grid.
   */
  public final boolean isComplete(Grid grid) {
    int bits = 0;
    for (Location loc : this) {
      Numeral num = grid.get(loc);
      if (num == null || (bits & num.bit) != 0) return false;
      bits |= num.bit;
    }
    return true;
  }

  public abstract Type getType();

  public boolean contains(Location loc) {
    return loc.unit(getType()) == this;
  }

  @Override public final int size() {
    return 9;
  }

  @Override public final boolean contains(Object o) {
    if (o instanceof Location) {
      return contains((Location) o);
    }
    return false;
  }

  @Override public final Iterator<Location> iterator() {
    return Location.iterator(locations);
  }

  protected final byte[] locations = new byte[9];

  private static enum AllUnits {
    INSTANCE;
    private final List<Unit> list;
    private AllUnits() {
      this.list = ImmutableList.<Unit>builder()
          .addAll(Row.ALL)
          .addAll(Column.ALL)
          .addAll(Block.ALL)
          .build();
    }
  }
}
