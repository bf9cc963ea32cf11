/*
 * Copyright 2018 University of California, Riverside
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package cn.edu.pku.asic.h3columnar.common.utils;

import java.util.Arrays;
import java.util.Collection;

/**
 * Stores an expandable array of long integers. Kernels whose output size is not known up front
 * (children, disks, polygon covers) collect their raw cell values here, one instance per chunk.
 * @author Ahmed Eldawy
 *
 */
public class LongArray {
  /**Stores all elements*/
  protected long[] array;
  /**Number of entries occupied in array*/
  protected int size;

  public LongArray() {
    this.array = new long[16];
  }

  public void add(long x) {
    append(x);
  }

  public void append(long x) {
    expand(1);
    array[size++] = x;
  }

  public void append(long[] xs, int offset, int count) {
    expand(count);
    System.arraycopy(xs, offset, array, size, count);
    this.size += count;
  }

  public void append(LongArray another) {
    append(another.array, 0, another.size);
  }

  /**
   * Appends all the values of the given collection, e.g., a list returned by the H3 library.
   * @param values the values to append
   */
  public void appendAll(Collection<Long> values) {
    expand(values.size());
    for (long value : values)
      array[size++] = value;
  }

  /**
   * Ensures that the array can accept the additional entries
   * @param additionalSize number of additional elements that wish to be added to the array
   */
  protected void expand(int additionalSize) {
    if (size + additionalSize > array.length) {
      int newCapacity = MathUtil.nextPowerOfTwo(size + additionalSize);
      this.array = Arrays.copyOf(array, newCapacity);
    }
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /**
   * Converts this LongArray into a native Java array that with a length equal to {@link #size()}.
   * @return a new array with elements
   */
  public long[] toArray() {
    return Arrays.copyOf(array, size);
  }

  public long get(int index) {
    return array[index];
  }

  /**
   * Removes and returns the last element in the array
   * @return the last value in the array
   */
  public long pop() {
    return array[--size];
  }

  public void clear() {
    size = 0;
  }

  /**
   * Sorts the values ascending and removes duplicates in place.
   */
  public void sortUnique() {
    Arrays.sort(array, 0, size);
    if (size < 2)
      return;
    int newSize = 1;
    for (int $i = 1; $i < size; $i++) {
      if (array[$i] != array[newSize - 1])
        array[newSize++] = array[$i];
    }
    size = newSize;
  }
}
