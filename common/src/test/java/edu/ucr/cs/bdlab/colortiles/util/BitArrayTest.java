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

import junit.framework.TestCase;

import java.util.Random;

public class BitArrayTest extends TestCase {

  public void testSetAndGet() {
    Random r = new Random(0);
    for (int i = 0; i < 100; i++) {
      int size = r.nextInt(200) + 5;
      BitArray b = new BitArray(size);
      int pos1 = r.nextInt(size);
      int pos2 = r.nextInt(size);
      b.set(pos1, true);
      b.set(pos2, true);
      assertTrue(b.get(pos1));
      assertTrue(b.get(pos2));
      b.set(pos1, false);
      assertFalse(b.get(pos1));
      assertEquals(pos1 == pos2 ? 0 : 1, b.countOnes());
    }
  }

  public void testLastBitOfEntry() {
    BitArray b = new BitArray(128);
    b.set(63, true);
    b.set(64, true);
    assertTrue(b.get(63));
    assertTrue(b.get(64));
    assertFalse(b.get(62));
    assertFalse(b.get(65));
    assertEquals(2, b.countOnes());
  }

  public void testInplaceAnd() {
    BitArray b1 = new BitArray(70);
    BitArray b2 = new BitArray(70);
    b1.set(3, true);
    b1.set(69, true);
    b2.set(69, true);
    b2.set(10, true);
    b1.inplaceAnd(b2);
    assertEquals(1, b1.countOnes());
    assertTrue(b1.get(69));
  }

  public void testInplaceAndWithDifferentSizes() {
    try {
      new BitArray(10).inplaceAnd(new BitArray(11));
      fail("Expected an exception");
    } catch (IllegalArgumentException e) {
      // Expected
    }
  }

  public void testEquals() {
    BitArray b1 = new BitArray(20);
    BitArray b2 = new BitArray(20);
    b1.set(5, true);
    assertFalse(b1.equals(b2));
    b2.set(5, true);
    assertEquals(b1, b2);
    assertEquals(b1.hashCode(), b2.hashCode());
  }
}
