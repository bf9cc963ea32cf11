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
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Stores an expandable array of integers. Used for R-tree node children, offset tables and result lists.
 * @author Ahmed Eldawy
 *
 */
public class IntArray implements Iterable<Integer> {
  /**Stores all elements*/
  protected int[] array;
  /**Number of entries occupied in array*/
  protected int size;

  public IntArray() {
    this.array = new int[16];
  }

  public void add(int x) {
    append(x);
  }

  public void append(int x) {
    expand(1);
    array[size++] = x;
  }

  public void append(int[] xs, int offset, int count) {
    expand(count);
    System.arraycopy(xs, offset, array, size, count);
    this.size += count;
  }

  public void append(IntArray another, int offset, int count) {
    append(another.array, offset, count);
  }

  /**
   * Ensures that the array can accept the additional entries
   * @param additionalSize the number of entries that wish to be added to the list
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
   * Converts this IntArray into a native Java array that with a length equal
   * to {@link #size()}.
   * @return a new array that is identical to this list
   */
  public int[] toArray() {
    return Arrays.copyOf(array, size);
  }

  public void sort() {
    Arrays.sort(array, 0, size);
  }

  public int get(int index) {
    return array[index];
  }

  /**
   * Removes and returns the last element in the array
   * @return the last element in the array after removing it.
   */
  public int pop() {
    return array[--size];
  }

  /**
   * Returns the last element in the array without removing it.
   * @return the last element in the array
   */
  public int peek() {
    return array[size-1];
  }

  public boolean remove(int value) {
    for (int i = 0; i < size; i++) {
      if (array[i] == value) {
        System.arraycopy(array, i + 1, array, i, size - (i + 1));
        size--;
        return true;
      }
    }
    return false;
  }

  @Override
  public IntArray clone() {
    IntArray newIntArray = new IntArray();
    newIntArray.size = this.size;
    newIntArray.array = this.array.clone();
    return newIntArray;
  }

  /**
   * Remove all elements in the array.
   */
  public void clear() {
    size = 0;
  }

  /**
   * Shrinks the array to contain the given number of elements only
   * @param newSize the new size of this array
   */
  public void resize(int newSize) {
    if (newSize > this.size)
      throw new IllegalArgumentException("The new size cannot be greater than the current size");
    this.size = newSize;
  }

  @Override
  public Iterator<Integer> iterator() {
    return new IntIterator();
  }

  class IntIterator implements Iterator<Integer> {
    int i = -1;

    @Override
    public boolean hasNext() {
      return i < size() - 1;
    }

    @Override
    public Integer next() {
      if (!hasNext())
        throw new NoSuchElementException();
      return array[++i];
    }
  }
}
