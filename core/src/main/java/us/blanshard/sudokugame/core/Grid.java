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

import static us.blanshard.sudokugame.core.Numeral.numeral;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.AbstractMap;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An immutable Sudoku grid: each location may have a numeral set, the class is
 * a Map from Location to Numeral covering only the filled locations.  The
 * nested Builder class is a mutable version of the grid.  It accepts any
 * numeral at any location: it does not enforce the constraints of the game.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Grid extends AbstractMap<Location, Numeral> implements Map<Location, Numeral> {

  private final byte[] squares;

  private Grid(byte[] squares) {
    this.squares = squares;
  }

  public static final Grid BLANK = new Grid(new byte[Location.COUNT]);

  /** Returns a new Builder. */
  public static Builder builder() {
    return new Builder(BLANK);
  }

  /** Returns a mutable version of this grid. */
  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Tells whether every unit holds each numeral exactly once. */
  public boolean isSolved() {
    if (size() < Location.COUNT) return false;
    for (Unit unit : Unit.allUnits()) {
      if (!unit.isComplete(this)) return false;
    }
    return true;
  }

  /**
   * Returns locations that have duplicate values for some unit.
   */
  public Set<Location> getBrokenLocations() {
    Set<Location> answer = Sets.newTreeSet();
    for (Unit unit : Unit.allUnits()) {
      for (Location loc : unit) {
        Numeral num = get(loc);
        if (num == null) continue;
        for (Location other : unit) {
          if (other != loc && get(other) == num) {
            answer.add(loc);
            break;
          }
        }
      }
    }
    return answer;
  }

  /**
   * Returns the numerals missing from the given location's row, column and
   * block.  For an empty location these are the numerals that may go there
   * without breaking the rules.
   */
  public NumSet getCandidates(Location loc) {
    return loc.row.getMissing(this)
        .and(loc.column.getMissing(this))
        .and(loc.block.getMissing(this));
  }

  /**
   * A mutable grid.  Snapshots taken with {@link #build} are shared until the
   * next modification.
   */
  @NotThreadSafe
  public static final class Builder {
    private Grid grid;
    private boolean built;

    private Builder(Grid grid) {
      this.grid = grid;
      this.built = true;
    }

    private Grid grid() {
      if (built) {
        this.grid = new Grid(this.grid.squares.clone());
        this.built = false;
      }
      return this.grid;
    }

    /** Returns an immutable snapshot of this grid. */
    public Grid build() {
      built = true;
      return grid;
    }

    /** Resets this builder to match the given grid. */
    public Builder reset(Grid grid) {
      this.grid = grid;
      built = true;
      return this;
    }

    /** Tells whether the grid has a numeral at the given location. */
    public boolean containsKey(Location loc) {
      return grid.containsKey(loc);
    }

    /** Returns the numeral mapped to the given location, or null. */
    @Nullable public Numeral get(Location loc) {
      return grid.get(loc);
    }

    /** Sets the numeral for the given location. */
    public Builder put(Location loc, Numeral num) {
      grid().squares[loc.index] = (byte) num.number;
      return this;
    }

    /** Erases the given location. */
    public Builder remove(Location loc) {
      grid().squares[loc.index] = 0;
      return this;
    }

    /** Returns the number of squares filled in. */
    public int size() {
      return grid.size();
    }

    /** Returns the first empty location in row-major order, or null if full. */
    @Nullable public Location firstEmpty() {
      for (int i = 0; i < Location.COUNT; ++i) {
        if (grid.squares[i] == 0) return Location.of(i);
      }
      return null;
    }

    /** See {@link Grid#getCandidates}. */
    public NumSet getCandidates(Location loc) {
      return grid.getCandidates(loc);
    }
  }

  @Override public boolean containsKey(Object key) {
    if (key instanceof Location) {
      return containsKey((Location) key);
    }
    return false;
  }

  public boolean containsKey(Location loc) {
    return squares[loc.index] > 0;
  }

  @Override public Set<Entry<Location, Numeral>> entrySet() {
    ImmutableSet.Builder<Entry<Location, Numeral>> builder = ImmutableSet.builder();
    for (int i = 0; i < Location.COUNT; ++i) {
      if (squares[i] > 0)
        builder.add(Maps.immutableEntry(Location.of(i), Numeral.of(squares[i])));
    }
    return builder.build();
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Grid)) return super.equals(object);
    Grid that = (Grid) object;
    return Arrays.equals(this.squares, that.squares);
  }

  @Override public Numeral get(Object key) {
    return key instanceof Location ? get((Location) key) : null;
  }

  @Nullable public Numeral get(Location loc) {
    return numeral(squares[loc.index]);
  }

  @Override public int hashCode() {
    // Must match Map's contract.
    return super.hashCode();
  }

  @Override public int size() {
    int answer = 0;
    for (byte square : squares) {
      if (square > 0) ++answer;
    }
    return answer;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Row row : Row.ALL) {
      for (Location loc : row) {
        if (containsKey(loc)) sb.append(' ').append(get(loc).number);
        else sb.append(" .");
        if (loc.column.index == 2 || loc.column.index == 5)
          sb.append(" |");
      }
      sb.append('\n');
      if (row.index == 2 || row.index == 5)
        sb.append("-------+-------+-------\n");
    }
    return sb.toString();
  }

  /**
   * Generates a string of 81 characters with dots for unset locations and
   * digits for set ones.
   */
  public String toFlatString() {
    StringBuilder sb = new StringBuilder();
    for (byte square : squares)
      sb.append(square == 0 ? '.' : (char) ('0' + square));
    return sb.toString();
  }

  /**
   * Ignores all characters except digits and periods, requires there to be 81
   * total.
   */
  public static Grid fromString(String s) {
    Builder builder = builder();
    int index = 0;
    for (char c : s.toCharArray()) {
      if (c >= '1' && c <= '9') {
        if (index < Location.COUNT) builder.put(Location.of(index), Numeral.of(c - '0'));
        ++index;
      } else if (c == '0' || c == '.') {
        ++index;
      }
    }
    if (index != Location.COUNT) {
      throw new IllegalArgumentException(
          String.format("Grid.fromString requires 81 locations, got %d in %s", index, s));
    }
    return builder.build();
  }
}
