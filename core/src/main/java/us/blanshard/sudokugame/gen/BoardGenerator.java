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

import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Generates solved Sudoku grids and carves puzzles out of them.
 *
 * <p> Solved grids come from a randomized depth-first search that fills the
 * cells in row-major order, trying each cell's remaining candidates in a
 * random order.  Puzzles are made by blanking randomly chosen cells of a
 * solved grid; the result is not checked for having a unique solution, since
 * the game only ever compares the player's entries with the grid it was
 * carved from.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class BoardGenerator {
  private static final Logger logger = Logger.getLogger(BoardGenerator.class.getName());

  private final Random random;

  /** Creates a generator drawing from the given source of randomness. */
  public BoardGenerator(Random random) {
    this.random = checkNotNull(random);
  }

  /** Creates a completely solved grid. */
  public Grid generateCompleteBoard() {
    Grid.Builder builder = Grid.builder();
    Search search = new Search(builder);
    if (!search.fill())
      throw new AssertionError("Backtracking failed on a blank grid");
    if (logger.isLoggable(Level.FINE))
      logger.fine("Generated solution after " + search.backtracks + " backtracks");
    return builder.build();
  }

  /** Generates a new solution and carves a puzzle of the given difficulty from it. */
  public Puzzle newPuzzle(Difficulty difficulty) {
    return createPuzzle(generateCompleteBoard(), difficulty);
  }

  /** Carves a puzzle of the given difficulty out of the given solved grid. */
  public Puzzle createPuzzle(Grid solution, Difficulty difficulty) {
    return createPuzzle(solution, difficulty.getBlanks());
  }

  /**
   * Carves a puzzle out of the given solved grid by blanking exactly
   * {@code targetBlanks} distinct cells, chosen uniformly at random.
   *
   * @throws InvalidConfigurationException if targetBlanks is not in 0..81
   * @throws IllegalArgumentException if the solution is not solved
   */
  public Puzzle createPuzzle(Grid solution, int targetBlanks) {
    if (targetBlanks < 0 || targetBlanks > Location.COUNT)
      throw new InvalidConfigurationException(targetBlanks);
    checkArgument(solution.isSolved(), "Not a solved grid:\n%s", solution);

    Grid.Builder builder = solution.toBuilder();
    List<Location> locs = randomLocations(random);
    for (Location loc : locs.subList(0, targetBlanks))
      builder.remove(loc);
    return new Puzzle(builder.build(), solution);
  }

  /** Returns all locations in random order. */
  static List<Location> randomLocations(Random random) {
    List<Location> locs = Lists.newArrayList(Location.ALL);
    Collections.shuffle(locs, random);
    return locs;
  }

  /** One run of the backtracking search, filling a single builder. */
  private class Search {
    private final Grid.Builder builder;
    int backtracks;

    Search(Grid.Builder builder) {
      this.builder = builder;
    }

    /**
     * Fills the first empty location and, recursively, all the ones after it.
     * Returns false, leaving the builder as it found it, if that can't be done.
     */
    boolean fill() {
      Location loc = builder.firstEmpty();
      if (loc == null) return true;

      List<Numeral> candidates = Lists.newArrayList(builder.getCandidates(loc));
      Collections.shuffle(candidates, random);
      for (Numeral num : candidates) {
        builder.put(loc, num);
        if (fill()) return true;
        builder.remove(loc);
        ++backtracks;
      }
      return false;
    }
  }
}
