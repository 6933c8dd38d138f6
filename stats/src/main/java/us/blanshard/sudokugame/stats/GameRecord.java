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
package us.blanshard.sudokugame.stats;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.sudokugame.core.Grid;
import us.blanshard.sudokugame.game.GameSession;
import us.blanshard.sudokugame.game.Score;
import us.blanshard.sudokugame.gen.Difficulty;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * Everything worth keeping about a finished game.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class GameRecord {
  private final Difficulty difficulty;
  private final Grid puzzle;
  private final Grid solution;
  private final Grid board;
  private final Score score;
  private final long finishedAtMillis;

  public GameRecord(Difficulty difficulty, Grid puzzle, Grid solution, Grid board, Score score,
                    long finishedAtMillis) {
    this.difficulty = checkNotNull(difficulty);
    this.puzzle = checkNotNull(puzzle);
    this.solution = checkNotNull(solution);
    this.board = checkNotNull(board);
    this.score = checkNotNull(score);
    this.finishedAtMillis = finishedAtMillis;
  }

  /** Captures the given finished session, stamped with the current time. */
  public static GameRecord of(GameSession session, Score score) {
    return of(session, score, System.currentTimeMillis());
  }

  /** Captures the given finished session. */
  public static GameRecord of(GameSession session, Score score, long finishedAtMillis) {
    checkArgument(session.isFinished(), "Game is still in progress");
    return new GameRecord(
        session.getDifficulty(),
        session.getPuzzle().getStart(),
        session.getPuzzle().getSolution(),
        session.getBoard(),
        score,
        finishedAtMillis);
  }

  public Difficulty getDifficulty() {
    return difficulty;
  }

  public Grid getPuzzle() {
    return puzzle;
  }

  public Grid getSolution() {
    return solution;
  }

  /** The player's board when the game finished. */
  public Grid getBoard() {
    return board;
  }

  public Score getScore() {
    return score;
  }

  /** When the game finished, in milliseconds since the epoch. */
  public long getFinishedAtMillis() {
    return finishedAtMillis;
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof GameRecord)) return false;
    GameRecord that = (GameRecord) o;
    return this.difficulty == that.difficulty
        && this.puzzle.equals(that.puzzle)
        && this.solution.equals(that.solution)
        && this.board.equals(that.board)
        && this.score.equals(that.score)
        && this.finishedAtMillis == that.finishedAtMillis;
  }

  @Override public int hashCode() {
    return Objects.hashCode(difficulty, puzzle, solution, board, score, finishedAtMillis);
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("difficulty", difficulty)
        .add("score", score)
        .add("finishedAtMillis", finishedAtMillis)
        .toString();
  }
}
