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

import static java.util.concurrent.TimeUnit.SECONDS;

import us.blanshard.sudokugame.core.Grid;
import us.blanshard.sudokugame.core.Location;
import us.blanshard.sudokugame.core.Numeral;
import us.blanshard.sudokugame.gen.BoardGenerator;
import us.blanshard.sudokugame.gen.Difficulty;
import us.blanshard.sudokugame.gen.Puzzle;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;

import java.util.Random;

public class Fixtures {
  private static final long SEED = 123;

  static final Grid solution = Grid.fromString(
      "534678912672195348198342567859761423426853791713924856961537284287419635345286179");

  // A ticker that only moves when told to.
  static class ManualTicker extends Ticker {
    private long nanos;
    @Override public long read() { return nanos; }
    void advanceSeconds(long seconds) { nanos += SECONDS.toNanos(seconds); }
  }

  static Puzzle makePuzzle(Difficulty difficulty) {
    return new BoardGenerator(new Random(SEED)).createPuzzle(solution, difficulty);
  }

  static GameSession makeSession(Difficulty difficulty) {
    return makeSession(difficulty, new ManualTicker());
  }

  static GameSession makeSession(Difficulty difficulty, Ticker ticker) {
    return new GameSession(makePuzzle(difficulty), difficulty, ticker);
  }

  /** The session's non-clue locations, in row-major order. */
  static ImmutableList<Location> openLocations(GameSession session) {
    ImmutableList.Builder<Location> builder = ImmutableList.builder();
    for (Location loc : Location.ALL)
      if (!session.isFixed(loc)) builder.add(loc);
    return builder.build();
  }

  /** The first fixed location. */
  static Location fixedLocation(GameSession session) {
    return session.getPuzzle().getFixed().first();
  }

  /** A numeral that is wrong for the given location. */
  static Numeral wrongNumeral(Location loc) {
    return Numeral.of(solution.get(loc).number % 9 + 1);
  }
}
