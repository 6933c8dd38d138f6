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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * The outcome of a finished game: the final score and what went into it.
 *
 * <p> The score starts at {@link #BASE}, gains a point for every five whole
 * seconds left before the time limit, and loses 5 points per wrong cell, 10
 * per hint and 3 per cell left empty.  It is not clamped, so a bad enough
 * game scores below zero.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Score {
  public static final int BASE = 1000;
  public static final int SECONDS_PER_BONUS_POINT = 5;
  public static final int POINTS_PER_ERROR = 5;
  public static final int POINTS_PER_HINT = 10;
  public static final int POINTS_PER_EMPTY = 3;

  private final long score;
  private final long timeBonus;
  private final int errors;
  private final int empties;
  private final int hintsUsed;
  private final long elapsedSeconds;
  private final long timeLimitSeconds;
  private final boolean correct;

  private Score(long elapsedSeconds, long timeLimitSeconds, int errors, int empties,
                int hintsUsed, boolean correct) {
    this.elapsedSeconds = elapsedSeconds;
    this.timeLimitSeconds = timeLimitSeconds;
    this.errors = errors;
    this.empties = empties;
    this.hintsUsed = hintsUsed;
    this.correct = correct;
    this.timeBonus = Math.max(0, timeLimitSeconds - elapsedSeconds) / SECONDS_PER_BONUS_POINT;
    this.score = BASE + timeBonus
        - (long) errors * POINTS_PER_ERROR
        - (long) hintsUsed * POINTS_PER_HINT
        - (long) empties * POINTS_PER_EMPTY;
  }

  /**
   * Scores a game.
   *
   * @param elapsedSeconds how long the game took
   * @param timeLimitSeconds the time after which no bonus is given
   * @param errors the number of non-clue cells holding the wrong numeral
   * @param empties the number of non-clue cells left empty
   * @param hintsUsed the number of hints the player asked for
   * @param correct whether the board matched the solution exactly
   */
  public static Score compute(long elapsedSeconds, long timeLimitSeconds, int errors,
                              int empties, int hintsUsed, boolean correct) {
    return new Score(elapsedSeconds, timeLimitSeconds, errors, empties, hintsUsed, correct);
  }

  public long getScore() {
    return score;
  }

  /** Points earned for finishing early. */
  public long getTimeBonus() {
    return timeBonus;
  }

  public int getErrors() {
    return errors;
  }

  public int getEmpties() {
    return empties;
  }

  public int getHintsUsed() {
    return hintsUsed;
  }

  public long getElapsedSeconds() {
    return elapsedSeconds;
  }

  public long getTimeLimitSeconds() {
    return timeLimitSeconds;
  }

  /** Whether the finished board equalled the solution. */
  public boolean isCorrect() {
    return correct;
  }

  public long getErrorPenalty() {
    return (long) errors * POINTS_PER_ERROR;
  }

  public long getHintPenalty() {
    return (long) hintsUsed * POINTS_PER_HINT;
  }

  public long getEmptyPenalty() {
    return (long) empties * POINTS_PER_EMPTY;
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Score)) return false;
    Score that = (Score) o;
    return this.elapsedSeconds == that.elapsedSeconds
        && this.timeLimitSeconds == that.timeLimitSeconds
        && this.errors == that.errors
        && this.empties == that.empties
        && this.hintsUsed == that.hintsUsed
        && this.correct == that.correct;
  }

  @Override public int hashCode() {
    return Objects.hashCode(
        elapsedSeconds, timeLimitSeconds, errors, empties, hintsUsed, correct);
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("score", score)
        .add("timeBonus", timeBonus)
        .add("errors", errors)
        .add("empties", empties)
        .add("hintsUsed", hintsUsed)
        .add("elapsedSeconds", elapsedSeconds)
        .add("correct", correct)
        .toString();
  }
}
