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
package us.blanshard.sudokugame.gen;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.sudokugame.core.Grid;
import us.blanshard.sudokugame.core.Location;
import us.blanshard.sudokugame.core.Numeral;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Map;

import javax.annotation.concurrent.Immutable;

/**
 * A starting grid together with the solution it was carved from.  The fixed
 * locations are the starting grid's filled cells; the player may not change
 * them.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Puzzle {

  private final Grid start;
  private final Grid solution;
  private final ImmutableSortedSet<Location> fixed;

  /**
   * Creates a puzzle.  The solution must be solved, and every filled cell of
   * the start grid must agree with it.
   */
  public Puzzle(Grid start, Grid solution) {
    this.start = checkNotNull(start);
    this.solution = checkNotNull(solution);
    checkArgument(solution.isSolved(), "Solution is not a solved grid:\n%s", solution);
    for (Map.Entry<Location, Numeral> entry : start.entrySet()) {
      checkArgument(solution.get(entry.getKey()) == entry.getValue(),
          "Start grid disagrees with solution at %s", entry.getKey());
    }
    this.fixed = ImmutableSortedSet.copyOf(start.keySet());
  }

  /** The grid the player starts from. */
  public Grid getStart() {
    return start;
  }

  public Grid getSolution() {
    return solution;
  }

  /** The locations filled in the starting grid. */
  public ImmutableSortedSet<Location> getFixed() {
    return fixed;
  }

  public boolean isFixed(Location loc) {
    return start.containsKey(loc);
  }

  /** The number of empty cells in the starting grid. */
  public int getBlanks() {
    return Location.COUNT - fixed.size();
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Puzzle)) return false;
    Puzzle that = (Puzzle) o;
    return this.start.equals(that.start) && this.solution.equals(that.solution);
  }

  @Override public int hashCode() {
    return 31 * start.hashCode() + solution.hashCode();
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("start", start.toFlatString())
        .add("solution", solution.toFlatString())
        .toString();
  }
}
