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
package us.blanshard.sudokugame.game;

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.sudokugame.core.Grid;
import us.blanshard.sudokugame.core.Location;
import us.blanshard.sudokugame.core.Numeral;
import us.blanshard.sudokugame.gen.BoardGenerator;
import us.blanshard.sudokugame.gen.Difficulty;
import us.blanshard.sudokugame.gen.Puzzle;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableListMultimap;

import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * One game of Sudoku: the puzzle being played, the player's board, and the
 * hints used so far.  A session starts in progress and ends, for good, when
 * {@link #finishGame} is called; a new game needs a new session.  Not thread
 * safe.
 *
 * <p> The board accepts any numeral in any non-clue cell.  Whether a numeral
 * breaks the rules is reported by {@link #isValidMove}, and whether it is
 * right by {@link #checkCell}, but neither stops the move.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class GameSession {
  private static final Logger logger = Logger.getLogger(GameSession.class.getName());

  private final Puzzle puzzle;
  private final Difficulty difficulty;
  private final Stopwatch stopwatch;
  private final Grid.Builder board;
  private int hintsUsed;
  private boolean finished;

  public GameSession(Puzzle puzzle, Difficulty difficulty) {
    this(puzzle, difficulty, Ticker.systemTicker());
  }

  GameSession(Puzzle puzzle, Difficulty difficulty, Ticker ticker) {
    this.puzzle = checkNotNull(puzzle);
    this.difficulty = checkNotNull(difficulty);
    this.stopwatch = Stopwatch.createStarted(ticker);
    this.board = puzzle.getStart().toBuilder();
  }

  /** Generates a puzzle of the given difficulty and starts a game on it. */
  public static GameSession newSession(Difficulty difficulty, BoardGenerator generator) {
    return new GameSession(generator.newPuzzle(difficulty), difficulty);
  }

  public Puzzle getPuzzle() {
    return puzzle;
  }

  public Difficulty getDifficulty() {
    return difficulty;
  }

  /** Returns a snapshot of the player's board. */
  public Grid getBoard() {
    return board.build();
  }

  /** Returns the numeral at the given location, or null if it's empty. */
  @Nullable public Numeral getValue(Location loc) {
    return board.get(loc);
  }

  /** Tells whether the given location is one of the puzzle's clues. */
  public boolean isFixed(Location loc) {
    return puzzle.isFixed(loc);
  }

  public int getHintsUsed() {
    return hintsUsed;
  }

  public boolean isFinished() {
    return finished;
  }

  /** Returns the whole seconds since this game started or was last reset. */
  public long elapsedSeconds() {
    return stopwatch.elapsed(TimeUnit.SECONDS);
  }

  /**
   * Puts the given numeral in the given location, or clears it if the numeral
   * is null.  Does not check the numeral against the rules or the solution.
   */
  public void setValue(Location loc, @Nullable Numeral num)
      throws CellLockedException, InvalidStateException {
    checkInProgress("set a value");
    checkModifiable(loc);
    if (num == null) board.remove(loc);
    else board.put(loc, num);
  }

  /**
   * Tells whether the given numeral could go in the given location without
   * repeating a numeral already in the location's row, column or block.
   */
  public boolean isValidMove(Location loc, Numeral num) {
    checkNotNull(num);
    for (Location peer : loc.peers) {
      if (board.get(peer) == num) return false;
    }
    return true;
  }

  /**
   * Reveals the solution's numeral for the given location, and counts the
   * hint against the score.  The board is left alone.
   */
  public Numeral useHelp(Location loc) throws CellLockedException, InvalidStateException {
    checkInProgress("use a hint");
    checkModifiable(loc);
    ++hintsUsed;
    return puzzle.getSolution().get(loc);
  }

  /** Classifies the given location against the solution. */
  public CellState checkCell(Location loc) {
    if (isFixed(loc)) return CellState.FIXED;
    Numeral num = board.get(loc);
    if (num == null) return CellState.EMPTY;
    return num == puzzle.getSolution().get(loc) ? CellState.CORRECT : CellState.INCORRECT;
  }

  /** Classifies every location, in row-major order within each state. */
  public ImmutableListMultimap<CellState, Location> checkAllCells() {
    ImmutableListMultimap.Builder<CellState, Location> builder = ImmutableListMultimap.builder();
    for (Location loc : Location.ALL)
      builder.put(checkCell(loc), loc);
    return builder.build();
  }

  /** Does every location on the board have a numeral in it? */
  public boolean isComplete() {
    return board.size() == Location.COUNT;
  }

  /** Does the board match the solution exactly? */
  public boolean isCorrect() {
    return board.build().equals(puzzle.getSolution());
  }

  /**
   * Puts the board back to the puzzle's starting grid, forgets the hints used
   * and restarts the clock.
   */
  public void reset() throws InvalidStateException {
    checkInProgress("reset");
    board.reset(puzzle.getStart());
    hintsUsed = 0;
    stopwatch.reset().start();
  }

  /**
   * Ends the game, timing it by this session's clock against the difficulty's
   * time limit.
   */
  public Score finishGame() throws InvalidStateException {
    return finishGame(elapsedSeconds(), difficulty.getTimeLimitSeconds());
  }

  /** Ends the game and scores it. */
  public Score finishGame(long elapsedSeconds, long timeLimitSeconds)
      throws InvalidStateException {
    checkInProgress("finish");
    finished = true;
    stopwatch.stop();

    int errors = 0, empties = 0;
    for (Location loc : Location.ALL) {
      switch (checkCell(loc)) {
        case INCORRECT: ++errors; break;
        case EMPTY: ++empties; break;
        default: break;
      }
    }
    Score score = Score.compute(
        elapsedSeconds, timeLimitSeconds, errors, empties, hintsUsed, isCorrect());
    logger.info("Finished " + difficulty + " game: " + score);
    return score;
  }

  private void checkInProgress(String action) throws InvalidStateException {
    if (finished)
      throw new InvalidStateException("Can't " + action + ": the game has finished");
  }

  private void checkModifiable(Location loc) throws CellLockedException {
    if (isFixed(loc))
      throw new CellLockedException(loc);
  }
}
