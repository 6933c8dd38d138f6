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

/**
 * How a single cell of a game in progress compares with the solution.  Every
 * location is in exactly one of these states.
 *
 * @author Luke Blanshard
 */
public enum CellState {
  /** One of the puzzle's clues; the player can't change it. */
  FIXED,
  /** Not a clue, and the player hasn't filled it in. */
  EMPTY,
  /** Filled in by the player with the solution's numeral. */
  CORRECT,
  /** Filled in by the player with some other numeral. */
  INCORRECT;
}
