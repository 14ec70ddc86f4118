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
package edu.ucr.cs.bdlab.colortiles.util;

import java.io.Serializable;
import java.util.Arrays;

/**
 * A fixed-size array of bits stored compactly in an array of longs.
 * Bit #0 is the most significant bit of the first entry.
 * @author Ahmed Eldawy
 */
public class BitArray implements Serializable {
  /**Number of bits in one entry*/
  private static final int BitsPerEntry = 64;

  /**The entries that hold the bits*/
  protected long[] entries;

  /**Total number of bits stored in this array*/
  protected long size;

  /**Default constructor needed for deserialization*/
  public BitArray() {
  }

  /**
   * Initializes a bit array with the given capacity in bits. All bits are initially cleared.
   * @param size total number of bits in the array
   */
  public BitArray(long size) {
    this.size = size;
    this.entries = new long[(int) ((size + BitsPerEntry - 1) / BitsPerEntry)];
  }

  /**
   * Sets the bit at position <code>i</code>
   * @param i the index of the bit to set
   * @param b the new value of the bit
   */
  public void set(long i, boolean b) {
    int entry = (int) (i / BitsPerEntry);
    int offset = (int) (i % BitsPerEntry);
    if (b) {
      entries[entry] |= (1L << (BitsPerEntry - 1 - offset));
    } else {
      entries[entry] &= ~(1L << (BitsPerEntry - 1 - offset));
    }
  }

  /**
   * Returns the boolean at position <code>i</code>
   * @param i the index of the bit to retrieve
   * @return the value of the bit
   */
  public boolean get(long i) {
    int entry = (int) (i / BitsPerEntry);
    int offset = (int) (i % BitsPerEntry);
    return (entries[entry] & (1L << (BitsPerEntry - 1 - offset))) != 0;
  }

  /**
   * Counts the number of bits that are set in the array
   * @return the total number of ones in the array
   */
  public long countOnes() {
    long count = 0;
    for (long entry : entries)
      count += Long.bitCount(entry);
    return count;
  }

  /**
   * Computes the bitwise AND of this array with another array of the same size and stores the result in this array.
   * @param other the other array to combine with
   * @return this array after modification
   */
  public BitArray inplaceAnd(BitArray other) {
    if (other.size != this.size)
      throw new IllegalArgumentException(String.format("Cannot AND bit arrays of sizes %d and %d", size, other.size));
    for (int i = 0; i < entries.length; i++)
      entries[i] &= other.entries[i];
    return this;
  }

  /**
   * Total number of bits in this array
   * @return the size of the array in bits
   */
  public long size() {
    return size;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof BitArray))
      return false;
    BitArray that = (BitArray) obj;
    return this.size == that.size && Arrays.equals(this.entries, that.entries);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(size) * 31 + Arrays.hashCode(entries);
  }
}
