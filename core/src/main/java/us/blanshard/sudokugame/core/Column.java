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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * One column of a Sudoku grid, indexed from 0 to 8 left to right.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Column extends Unit {

  /** The column index, in the range 0..8. */
  public final int index;

  public static Column ofIndex(int index) {
    return instances[index];
  }

  /** All the columns. */
  public static final List<Column> ALL;

  @Override public boolean contains(Location loc) {
    return loc.index % 9 == index;
  }

  @Override public Type getType() {
    return Type.COLUMN;
  }

  @Override public String toString() {
    return "C" + index;
  }

  private Column(int index) {
    this.index = index;
    for (int i = 0; i < 9; ++i) {
      this.locations[i] = (byte) (i * 9 + index);
    }
  }

  private static final Column[] instances;
  static {
    instances = new Column[9];
    for (int i = 0; i < 9; ++i) {
      instances[i] = new Column(i);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
  }
}
