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

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable set of Numerals, used to keep track of the digits that may
 * still go in a given cell.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class NumSet extends AbstractSet<Numeral> implements Set<Numeral> {

  /** The bits of the full set. */
  static final int ALL_BITS = (1 << Numeral.COUNT) - 1;

  /** The numerals in this set expressed as a bit set. */
  public final short bits;

  private final byte[] nums;

  private NumSet(short bits) {
    this.bits = bits;
    this.nums = new byte[Integer.bitCount(bits)];
    int count = 0;
    for (int number = 1; number <= Numeral.COUNT; ++number) {
      if ((bits & (1 << (number - 1))) != 0)
        nums[count++] = (byte) number;
    }
  }

  /** Returns the set corresponding to the given bit set. */
  public static NumSet ofBits(int bits) {
    return instances[bits & ALL_BITS];
  }

  /** Returns the intersection of this set and another one. */
  public NumSet and(NumSet that) {
    return instances[this.bits & that.bits];
  }

  public boolean contains(Numeral num) {
    return (bits & num.bit) != 0;
  }

  @Override public boolean contains(Object o) {
    if (o instanceof Numeral) {
      return contains((Numeral) o);
    }
    return false;
  }

  @Override public Iterator<Numeral> iterator() {
    return new Iter();
  }

  @Override public int size() {
    return nums.length;
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o instanceof NumSet) return bits == ((NumSet) o).bits;
    return super.equals(o);
  }

  @Override public int hashCode() {
    // Must match Set's contract.
    int answer = 0;
    for (byte num : nums) answer += num;
    return answer;
  }

  private class Iter implements Iterator<Numeral> {
    private int nextIndex;

    @Override public boolean hasNext() {
      return nextIndex < nums.length;
    }

    @Override public Numeral next() {
      if (!hasNext()) throw new NoSuchElementException();
      return Numeral.of(nums[nextIndex++]);
    }
  }

  private static final NumSet[] instances;
  static {
    instances = new NumSet[ALL_BITS + 1];
    for (short i = 0; i < instances.length; ++i) {
      instances[i] = new NumSet(i);
    }
  }
}
