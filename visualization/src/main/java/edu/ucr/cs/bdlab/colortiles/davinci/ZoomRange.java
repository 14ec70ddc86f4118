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

/**
 * A range (min..max) of zoom levels inclusive of both.
 */
public class ZoomRange {
  /**The deepest level whose tile indexes fit in an int*/
  public static final int MaxSupportedZoom = 30;

  public final int min, max;

  /**
   * Creates a range of zoom levels
   * @param min the top (coarsest) level
   * @param max the bottom (finest) level
   * @throws InvalidZoomRangeException if the levels are negative, too deep, or min &gt; max
   */
  public ZoomRange(int min, int max) throws InvalidZoomRangeException {
    if (min < 0)
      throw new InvalidZoomRangeException(String.format("Minimum zoom level %d is negative", min));
    if (min > max)
      throw new InvalidZoomRangeException(String.format("Minimum zoom level %d is greater than maximum %d", min, max));
    if (max > MaxSupportedZoom)
      throw new InvalidZoomRangeException(String.format("Maximum zoom level %d exceeds the supported maximum %d",
          max, MaxSupportedZoom));
    this.min = min;
    this.max = max;
  }

  /**
   * Parses a range of zoom levels which is encoded as either numLevels or minLevel..maxLevel.
   * If the string value is a single number (n), the returned range is 0..n-1. If the value is two numbers
   * separated by two dots or a dash, e.g., a..b or a-b, the two values are returned.
   * @param value the text to parse
   * @return the parsed range
   * @throws InvalidZoomRangeException if the text is malformed or describes an invalid range
   */
  public static ZoomRange parse(String value) throws InvalidZoomRangeException {
    String str = value.trim();
    try {
      int i = str.indexOf("..");
      int separatorLength = 2;
      if (i == -1) {
        i = str.indexOf('-', 1);
        separatorLength = 1;
      }
      if (i == -1) {
        int numLevels = Integer.parseInt(str);
        if (numLevels <= 0)
          throw new InvalidZoomRangeException(String.format("Number of levels %d must be positive", numLevels));
        return new ZoomRange(0, numLevels - 1);
      }
      int min = Integer.parseInt(str.substring(0, i).trim());
      int max = Integer.parseInt(str.substring(i + separatorLength).trim());
      return new ZoomRange(min, max);
    } catch (NumberFormatException e) {
      throw new InvalidZoomRangeException(String.format("Invalid zoom levels '%s'", value), e);
    }
  }

  public int getNumLevels() {
    return max - min + 1;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ZoomRange))
      return false;
    ZoomRange that = (ZoomRange) obj;
    return this.min == that.min && this.max == that.max;
  }

  @Override
  public int hashCode() {
    return min * 31 + max;
  }

  @Override
  public String toString() {
    return String.format("%d..%d", min, max);
  }
}
