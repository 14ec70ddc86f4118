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

/**
 * The size of a pixel in model units as stored in the ModelPixelScale tag of a GeoTIFF file.
 */
public final class PixelScale {
  private final double scaleX;
  private final double scaleY;
  private final double scaleZ;

  public PixelScale(double scaleX, double scaleY, double scaleZ) {
    this.scaleX = scaleX;
    this.scaleY = scaleY;
    this.scaleZ = scaleZ;
  }

  public double getScaleX() {
    return this.scaleX;
  }

  public double getScaleY() {
    return this.scaleY;
  }

  public double getScaleZ() {
    return this.scaleZ;
  }

  public double[] getValues() {
    return new double[]{this.scaleX, this.scaleY, this.scaleZ};
  }

  /**
   * Whether the two horizontal components are usable
   * @return {@code true} if both x and y scales are finite and non-zero
   */
  public boolean isSet() {
    return isComponentSet(this.scaleX) && isComponentSet(this.scaleY);
  }

  private static boolean isComponentSet(double scale) {
    return Double.isFinite(scale) && Math.abs(scale) > 1.0E-12;
  }

  public boolean equals(Object that) {
    if (that == this)
      return true;
    if (!(that instanceof PixelScale))
      return false;
    PixelScale thatO = (PixelScale) that;
    return Double.compare(this.scaleX, thatO.scaleX) == 0 && Double.compare(this.scaleY, thatO.scaleY) == 0 &&
        Double.compare(this.scaleZ, thatO.scaleZ) == 0;
  }

  public int hashCode() {
    int hash = Double.hashCode(this.scaleX);
    hash = hash * 31 + Double.hashCode(this.scaleY);
    hash = hash * 31 + Double.hashCode(this.scaleZ);
    return hash;
  }

  public String toString() {
    return String.format("[%s,%s,%s]", scaleX, scaleY, scaleZ);
  }
}
