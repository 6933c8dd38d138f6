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

/**
 * The difficulty tiers a puzzle can be generated at.  Each tier fixes how many
 * cells are blanked out of the solution and how long the player has before
 * the time bonus runs out.
 *
 * @author Luke Blanshard
 */
public enum Difficulty {
  EASY(35, 1800),
  MEDIUM(45, 2400),
  HARD(55, 3000);

  private final int blanks;
  private final int timeLimitSeconds;

  private Difficulty(int blanks, int timeLimitSeconds) {
    this.blanks = blanks;
    this.timeLimitSeconds = timeLimitSeconds;
  }

  /** The number of empty cells in a puzzle of this difficulty. */
  public int getBlanks() {
    return blanks;
  }

  /** The time limit used for scoring, in seconds. */
  public int getTimeLimitSeconds() {
    return timeLimitSeconds;
  }
}
