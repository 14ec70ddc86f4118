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
package edu.ucr.cs.bdlab.colortiles.davinci;

import junit.framework.TestCase;

public class ZoomRangeTest extends TestCase {

  public void testParse() throws InvalidZoomRangeException {
    assertEquals(new ZoomRange(0, 5), ZoomRange.parse("6"));
    assertEquals(new ZoomRange(3, 7), ZoomRange.parse("3..7"));
    assertEquals(new ZoomRange(2, 4), ZoomRange.parse(" 2-4 "));
    assertEquals(new ZoomRange(4, 4), ZoomRange.parse("4..4"));
    assertEquals(3, ZoomRange.parse("2..4").getNumLevels());
    assertEquals("2..4", ZoomRange.parse("2-4").toString());
  }

  public void testInvalidRanges() {
    String[] invalid = {"0", "-3", "5..2", "abc", "1..x", "0..31", ""};
    for (String value : invalid) {
      try {
        ZoomRange.parse(value);
        fail("Expected an exception for '" + value + "'");
      } catch (InvalidZoomRangeException e) {
        assertEquals(TilePyramidBuilder.StageName, e.getStage());
      }
    }
  }

  public void testConstructorValidates() {
    try {
      new ZoomRange(-1, 3);
      fail("Expected an exception");
    } catch (InvalidZoomRangeException e) {
      // Expected
    }
  }
}
