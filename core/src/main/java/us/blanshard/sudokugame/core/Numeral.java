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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A digit from one to nine: the contents of a filled Sudoku cell.  An empty
 * cell has no numeral, represented by null.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Numeral implements Comparable<Numeral> {
  /** The number of Numerals. */
  public static final int COUNT = 9;

  /** The number, in the range 1..9. */
  public final int number;

  /** The bit corresponding to the number, 1 &lt;&lt; (number - 1). */
  public final short bit;

  /**
   * Returns the numeral for the given number.
   *
   * @throws IllegalArgumentException if the number is not in 1..9
   */
  public static Numeral of(int number) {
    if (number < 1 || number > COUNT)
      throw new IllegalArgumentException("Not a Sudoku numeral: " + number);
    return instances[number - 1];
  }

  /** Converts 0 to null, 1-9 to the corresponding numeral. */
  @Nullable public static Numeral numeral(int number) {
    return number == 0 ? null : of(number);
  }

  /** All the numerals, in increasing order. */
  public static final List<Numeral> ALL;

  @Override public int compareTo(Numeral that) {
    return this.number - that.number;
  }

  @Override public String toString() {
    return Integer.toString(number);
  }

  @Override public boolean equals(Object o) {
    return this == o;
  }

  @Override public int hashCode() {
    return number;  // Relied upon by NumSet
  }

  private Numeral(int number) {
    this.number = number;
    this.bit = (short) (1 << (number - 1));
  }

  private static final Numeral[] instances;
  static {
    instances = new Numeral[COUNT];
    for (int i = 0; i < COUNT; ++i) {
      instances[i] = new Numeral(i + 1);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
  }
}
