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
 * One 3x3 block of a Sudoku grid, indexed from 0 to 8 left to right, top to
 * bottom.  The block holding row r and column c is {@code (r / 3, c / 3)}.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Block extends Unit {

  /** The block index, in the range 0..8. */
  public final int index;

  public static Block ofIndex(int index) {
    return instances[index];
  }

  /** Returns the block at the given block coordinates, each in 0..2. */
  public static Block ofIndices(int blockRow, int blockColumn) {
    return instances[blockRow * 3 + blockColumn];
  }

  /** The block's row among blocks, in 0..2. */
  public int blockRow() {
    return index / 3;
  }

  /** The block's column among blocks, in 0..2. */
  public int blockColumn() {
    return index % 3;
  }

  /** All the blocks. */
  public static final List<Block> ALL;

  @Override public Type getType() {
    return Type.BLOCK;
  }

  @Override public String toString() {
    return "B" + index;
  }

  private Block(int index) {
    this.index = index;
    int ul = index / 3 * 27 + index % 3 * 3;
    System.arraycopy(new byte[] {
      (byte) (ul + 0),  (byte) (ul + 1),  (byte) (ul + 2),
      (byte) (ul + 9),  (byte) (ul + 10), (byte) (ul + 11),
      (byte) (ul + 18), (byte) (ul + 19), (byte) (ul + 20),
    }, 0, this.locations, 0, 9);
  }

  private static final Block[] instances;
  static {
    instances = new Block[9];
    for (int i = 0; i < 9; ++i) {
      instances[i] = new Block(i);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
  }
}
