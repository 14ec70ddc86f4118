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
package edu.ucr.cs.bdlab.colortiles.raptor;

import java.util.Objects;

/**
 * One entry in the GeoKey directory of a GeoTIFF file.
 * The value is stored in the entry itself when the TIFF tag location is zero. Otherwise, the value is found in the
 * TIFF tag with the given location starting at the given offset.
 */
public final class GeoKeyEntry implements Comparable<GeoKeyEntry> {
  private final int keyID;
  private final int tiffTagLocation;
  private final int count;
  private final int valueOffset;

  public GeoKeyEntry(int keyID, int tagLoc, int count, int offset) {
    ensureNotNegative("ID", keyID);
    ensureNotNegative("LOCATION", tagLoc);
    ensureNotNegative("COUNT", count);
    ensureNotNegative("VALUE_OFFSET", offset);
    this.keyID = keyID;
    this.tiffTagLocation = tagLoc;
    this.count = count;
    this.valueOffset = offset;
  }

  private static void ensureNotNegative(String argument, int value) {
    if (value < 0)
      throw new IllegalArgumentException(String.format("Argument %s must not be negative but was %d", argument, value));
  }

  public int getKeyID() {
    return this.keyID;
  }

  public int getTiffTagLocation() {
    return this.tiffTagLocation;
  }

  public int getCount() {
    return this.count;
  }

  public int getValueOffset() {
    return this.valueOffset;
  }

  public int[] getValues() {
    return new int[]{this.keyID, this.tiffTagLocation, this.count, this.valueOffset};
  }

  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof GeoKeyEntry))
      return false;
    GeoKeyEntry that = (GeoKeyEntry) obj;
    return this.keyID == that.keyID && this.count == that.count && this.valueOffset == that.valueOffset &&
        this.tiffTagLocation == that.tiffTagLocation;
  }

  public int hashCode() {
    return Objects.hash(keyID, count, valueOffset, tiffTagLocation);
  }

  public String toString() {
    return String.format("GeoKeyEntry (%s) ID: %d, COUNT: %d, LOCATION: %d, VALUE_OFFSET: %d",
        tiffTagLocation == 0 ? "VALUE" : "OFFSET", keyID, count, tiffTagLocation, valueOffset);
  }

  public int compareTo(GeoKeyEntry o) {
    return Integer.compare(this.keyID, o.keyID);
  }
}
