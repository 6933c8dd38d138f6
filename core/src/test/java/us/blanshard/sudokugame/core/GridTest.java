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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import com.google.common.collect.ImmutableSet;

import org.junit.Test;

public class GridTest {
  static final String SOLVED =
      "534678912" +
      "672195348" +
      "198342567" +
      "859761423" +
      "426853791" +
      "713924856" +
      "961537284" +
      "287419635" +
      "345286179";

  @Test public void build() {
    Grid.Builder builder = Grid.builder()
        .put(Location.of(34), Numeral.of(6));
    Grid g1 = builder.build();
    builder.put(Location.of(77), Numeral.of(1));
    Grid g2 = builder.build();
    builder.remove(Location.of(77));
    Grid g3 = builder.build();
    assertEquals(g1, g3);
    assertEquals(false, g1.equals(g2));
    assertEquals(1, g1.size());
    assertEquals(2, g2.size());
    assertSame(Numeral.of(1), g2.get(Location.of(77)));
    assertNull(g1.get(Location.of(77)));
  }

  @Test public void builderDoesNotDisturbSource() {
    Grid solved = Grid.fromString(SOLVED);
    Grid.Builder builder = solved.toBuilder();
    builder.remove(Location.of(0));
    assertEquals(81, solved.size());
    assertEquals(80, builder.size());
    assertSame(Location.of(0), builder.firstEmpty());
    builder.reset(solved);
    assertNull(builder.firstEmpty());
  }

  @Test public void flatStrings() {
    Grid solved = Grid.fromString(SOLVED);
    assertEquals(SOLVED, solved.toFlatString());
    Grid blank = Grid.fromString(Grid.BLANK.toFlatString());
    assertEquals(Grid.BLANK, blank);
    assertEquals(0, blank.size());
  }

  @Test(expected = IllegalArgumentException.class) public void fromStringTooShort() {
    Grid.fromString("123");
  }

  @Test(expected = IllegalArgumentException.class) public void fromStringTooLong() {
    Grid.fromString(SOLVED + "1");
  }

  @Test public void solved() {
    Grid solved = Grid.fromString(SOLVED);
    assertEquals(true, solved.isSolved());
    assertEquals(0, solved.getBrokenLocations().size());

    Grid.Builder builder = solved.toBuilder();
    builder.remove(Location.of(40));
    assertEquals(false, builder.build().isSolved());

    // Swapping two cells of a row keeps the row intact but breaks two columns.
    Grid swapped = solved.toBuilder()
        .put(Location.of(0), solved.get(Location.of(1)))
        .put(Location.of(1), solved.get(Location.of(0)))
        .build();
    assertEquals(false, swapped.isSolved());
  }

  @Test public void brokenLocations() {
    Grid grid = Grid.builder()
        .put(Location.ofIndices(0, 0), Numeral.of(7))
        .put(Location.ofIndices(0, 8), Numeral.of(7))
        .put(Location.ofIndices(4, 4), Numeral.of(7))
        .build();
    assertEquals(ImmutableSet.of(Location.ofIndices(0, 0), Location.ofIndices(0, 8)),
                 grid.getBrokenLocations());
  }

  @Test public void candidates() {
    Grid grid = Grid.builder()
        .put(Location.ofIndices(0, 1), Numeral.of(1))  // same row
        .put(Location.ofIndices(5, 0), Numeral.of(2))  // same column
        .put(Location.ofIndices(2, 2), Numeral.of(3))  // same block
        .put(Location.ofIndices(8, 8), Numeral.of(4))  // unrelated
        .build();
    NumSet candidates = grid.getCandidates(Location.ofIndices(0, 0));
    assertEquals(ImmutableSet.of(Numeral.of(4), Numeral.of(5), Numeral.of(6),
                                 Numeral.of(7), Numeral.of(8), Numeral.of(9)),
                 candidates);
    assertEquals(true, candidates.contains(Numeral.of(4)));
    assertEquals(false, candidates.contains(Numeral.of(1)));
  }

  @Test public void mapView() {
    Grid grid = Grid.builder()
        .put(Location.of(3), Numeral.of(9))
        .put(Location.of(80), Numeral.of(5))
        .build();
    assertEquals(ImmutableSet.of(Location.of(3), Location.of(80)), grid.keySet());
    assertEquals(true, grid.containsKey(Location.of(80)));
    assertEquals(false, grid.containsKey("80"));
    assertEquals(grid.hashCode(), grid.toBuilder().build().hashCode());
  }
}
