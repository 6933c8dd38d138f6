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

import static org.junit.Assert.assertEquals;

import us.blanshard.sudokugame.core.Grid;
import us.blanshard.sudokugame.core.Location;
import us.blanshard.sudokugame.core.Numeral;

import org.junit.Test;

public class PuzzleTest {
  private static final Grid SOLUTION = Grid.fromString(
      "534678912672195348198342567859761423426853791713924856961537284287419635345286179");

  @Test public void fixedLocationsAreTheClues() {
    Grid start = SOLUTION.toBuilder()
        .remove(Location.of(0))
        .remove(Location.of(40))
        .build();
    Puzzle puzzle = new Puzzle(start, SOLUTION);
    assertEquals(2, puzzle.getBlanks());
    assertEquals(79, puzzle.getFixed().size());
    assertEquals(false, puzzle.isFixed(Location.of(40)));
    assertEquals(true, puzzle.isFixed(Location.of(41)));
    assertEquals(puzzle, new Puzzle(start, SOLUTION));
  }

  @Test(expected = IllegalArgumentException.class) public void startMustAgree() {
    Grid start = Grid.builder().put(Location.of(0), Numeral.of(1)).build();
    new Puzzle(start, SOLUTION);
  }

  @Test(expected = IllegalArgumentException.class) public void solutionMustBeSolved() {
    new Puzzle(Grid.BLANK, SOLUTION.toBuilder().remove(Location.of(3)).build());
  }
}
