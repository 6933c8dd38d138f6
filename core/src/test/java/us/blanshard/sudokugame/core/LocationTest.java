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
import static org.junit.Assert.assertSame;

import com.google.common.collect.Sets;

import org.junit.Test;

import java.util.Set;

public class LocationTest {

  @Test public void coordinates() {
    for (int r = 0; r < 9; ++r) {
      for (int c = 0; c < 9; ++c) {
        Location loc = Location.ofIndices(r, c);
        assertEquals(r * 9 + c, loc.index);
        assertSame(Row.ofIndex(r), loc.row);
        assertSame(Column.ofIndex(c), loc.column);
        assertSame(Block.ofIndices(r / 3, c / 3), loc.block);
        assertSame(loc, Location.of(r + 1, c + 1));
      }
    }
  }

  @Test public void peers() {
    for (Location loc : Location.ALL) {
      Set<Location> peers = Sets.newHashSet(loc.peers);
      assertEquals(20, peers.size());
      assertEquals(false, peers.contains(loc));
      for (Location peer : peers) {
        assertEquals(true, peer.row == loc.row || peer.column == loc.column
                     || peer.block == loc.block);
      }
    }
  }

  @Test public void units() {
    assertEquals(Unit.COUNT, Unit.allUnits().size());
    for (Unit unit : Unit.allUnits()) {
      assertEquals(9, Sets.newHashSet(unit).size());
      for (Location loc : unit) {
        assertSame(unit, loc.unit(unit.getType()));
        assertEquals(true, unit.contains(loc));
      }
    }
  }

  @Test(expected = IndexOutOfBoundsException.class) public void badRow() {
    Location.ofIndices(9, 0);
  }

  @Test(expected = IndexOutOfBoundsException.class) public void badColumn() {
    Location.ofIndices(0, -1);
  }

  @Test public void numbers() {
    assertSame(Location.of(0), Location.of(1, 1));
    assertSame(Location.of(80), Location.of(9, 9));
    assertSame(Location.ofIndices(2, 6), Location.of(3, 7));
  }

  @Test(expected = IndexOutOfBoundsException.class) public void rowNumberZero() {
    Location.of(0, 5);
  }

  @Test(expected = IndexOutOfBoundsException.class) public void columnNumberTen() {
    Location.of(5, 10);
  }

  @Test public void string() {
    assertEquals("(4, 7)", Location.ofIndices(4, 7).toString());
  }
}
