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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * An array of bits which is stored efficiently in memory. Bits are packed least-significant-bit first into
 * 64-bit words. Written out in little-endian byte order, the words form exactly the validity bitmap of the
 * Arrow columnar format, which is how this class is used for null tracking in cell arrays.
 * <p>
 * Writers that work in parallel must own disjoint ranges of whole words, i.e., ranges that start at a
 * multiple of {@link #BitsPerEntry}.
 * @author Ahmed Eldawy
 *
 */
public class BitArray {

  /**Number of bits per entry*/
  public static final int BitsPerEntry = 64;

  /**Condensed representation of all data*/
  protected long[] entries;

  /**Total number of bits stores in this array*/
  protected long size;

  /**
   * Initializes a bit array with the given capacity in bits.
   * @param size Total number of bits in the array. All initialized to false.
   */
  public BitArray(long size) {
    this.size = size;
    entries = new long[(int) ((size + BitsPerEntry - 1) / BitsPerEntry)];
  }

  /**
   * Copy constructor
   * @param copy another bit array
   */
  public BitArray(BitArray copy) {
    this.entries = Arrays.copyOf(copy.entries, copy.entries.length);
    this.size = copy.size;
  }

  /**
   * Creates a bit array with all bits set to the given value
   * @param size number of bits
   * @param value the value of all the bits
   * @return a new bit array
   */
  public static BitArray filled(long size, boolean value) {
    BitArray bits = new BitArray(size);
    if (value)
      bits.setRange(0, size, true);
    return bits;
  }

  /**
   * Sets the bit at position <code>i</code>
   * @param i the indexing of the bit (0-based)
   * @param b the value of the bit to set (true/false)
   */
  public void set(long i, boolean b) {
    int entry = (int) (i / BitsPerEntry);
    int offset = (int) (i % BitsPerEntry);
    if (b) {
      entries[entry] |= (1L << offset);
    } else {
      entries[entry] &= ~(1L << offset);
    }
  }

  /**
   * Returns the boolean at position <code>i</code>
   * @param i the position of the bit to retrieve (0-based)
   * @return the current value of the bit (true/false)
   */
  public boolean get(long i) {
    int entry = (int) (i / BitsPerEntry);
    int offset = (int) (i % BitsPerEntry);
    return (entries[entry] & (1L << offset)) != 0;
  }

  /**
   * Count number of set bits in the bit array.
   * @return the number of bits that are set to 1 in the entire bit array
   */
  public long countOnes() {
    long totalCount = 0;
    for (long i : entries)
      totalCount += Long.bitCount(i);
    return totalCount;
  }

  /**
   * The size of the bit array in terms of number of bits
   * @return the size of the array
   */
  public long size() {
    return size;
  }

  /**
   * Resize the array to have at least the given new size without losing the current data
   * @param newSize the newSize of the array in terms of number of bits.
   */
  public void resize(long newSize) {
    if (newSize > size) {
      int newArraySize = (int) ((newSize + BitsPerEntry - 1) / BitsPerEntry);
      if (newArraySize > entries.length)
        entries = Arrays.copyOf(entries, newArraySize);
    }
    size = newSize;
  }

  /**
   * Sets the given range to the same value
   * @param start the first offset of set (inclusive)
   * @param end the end of the range (exclusive)
   * @param value the value to set in the given range
   */
  public void setRange(long start, long end, boolean value) {
    // Bit-by-bit up to the first word boundary
    while (start < end && start % BitsPerEntry != 0)
      set(start++, value);
    // Whole words
    while (end - start >= BitsPerEntry) {
      entries[(int) (start / BitsPerEntry)] = value ? 0xffffffffffffffffL : 0;
      start += BitsPerEntry;
    }
    while (start < end)
      set(start++, value);
  }

  /**
   * Copies a range of bits from another array into this array.
   * @param destinationOffset the first bit to modify in this bit array
   * @param other the bit array to read from
   * @param sourceOffset the first bit to read from the other bit array
   * @param width the number of bits to copy
   */
  public void copyFrom(long destinationOffset, BitArray other, long sourceOffset, long width) {
    // TODO copy whole words when both offsets are word-aligned
    for (long $i = 0; $i < width; $i++)
      this.set(destinationOffset + $i, other.get(sourceOffset + $i));
  }

  /**
   * Serializes the bits into the Arrow validity bitmap layout, i.e., {@code ceil(size / 8)} bytes with the
   * bit of position {@code i} stored at bit {@code i % 8} of byte {@code i / 8}.
   * @return a little-endian byte buffer positioned at zero
   */
  public ByteBuffer toBitmap() {
    int numBytes = (int) ((size + 7) / 8);
    ByteBuffer bitmap = ByteBuffer.allocate(numBytes).order(ByteOrder.LITTLE_ENDIAN);
    int iEntry = 0;
    while (bitmap.remaining() >= 8)
      bitmap.putLong(entries[iEntry++]);
    if (bitmap.hasRemaining()) {
      long lastEntry = entries[iEntry];
      while (bitmap.hasRemaining()) {
        bitmap.put((byte) (lastEntry & 0xff));
        lastEntry >>>= 8;
      }
    }
    bitmap.flip();
    return bitmap;
  }

  /**
   * Reads a bit array from an Arrow-style validity bitmap.
   * @param bitmap the bitmap bytes starting at the current position of the buffer. The buffer is not modified.
   * @param size the number of bits to read
   * @return the parsed bit array
   */
  public static BitArray fromBitmap(ByteBuffer bitmap, long size) {
    BitArray bits = new BitArray(size);
    int base = bitmap.position();
    int numBytes = (int) ((size + 7) / 8);
    for (int $i = 0; $i < numBytes; $i++) {
      long b = bitmap.get(base + $i) & 0xffL;
      bits.entries[$i / 8] |= b << (($i % 8) * 8);
    }
    // Clear the padding bits of the last word
    int tail = (int) (size % BitsPerEntry);
    if (tail != 0)
      bits.entries[bits.entries.length - 1] &= (1L << tail) - 1;
    return bits;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof BitArray))
      return false;
    BitArray other = (BitArray) o;
    if (other.size != this.size)
      return false;
    for (long $i = 0; $i < size; $i++) {
      if (get($i) != other.get($i))
        return false;
    }
    return true;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(size) * 31 + (int) countOnes();
  }
}
