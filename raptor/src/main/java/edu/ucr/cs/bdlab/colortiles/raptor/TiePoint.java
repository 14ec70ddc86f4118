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

import java.util.Arrays;

/**
 * A tie point that associates a point in raster space (i, j, k) with a point in model space (x, y, z).
 */
public final class TiePoint {
  private final double[] values = new double[6];

  public TiePoint(double i, double j, double k, double x, double y, double z) {
    this.values[0] = i;
    this.values[1] = j;
    this.values[2] = k;
    this.values[3] = x;
    this.values[4] = y;
    this.values[5] = z;
  }

  public double getValueAt(int index) {
    if (index < 0 || index > 5)
      throw new IllegalArgumentException("Provided index should be between 0 and 5");
    return this.values[index];
  }

  public double getI() {
    return values[0];
  }

  public double getJ() {
    return values[1];
  }

  public double getX() {
    return values[3];
  }

  public double getY() {
    return values[4];
  }

  public double[] getData() {
    return this.values.clone();
  }

  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof TiePoint))
      return false;
    return Arrays.equals(this.values, ((TiePoint) obj).values);
  }

  public int hashCode() {
    return Arrays.hashCode(this.values);
  }

  public String toString() {
    return String.format("[%s,%s,%s] -> [%s,%s,%s]", values[0], values[1], values[2], values[3], values[4], values[5]);
  }
}
