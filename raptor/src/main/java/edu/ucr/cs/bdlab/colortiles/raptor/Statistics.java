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
 * Simple statistics computed over the valid cells of a raster. It contains the following values per band:
 * <ul>
 *   <li>Sum: The sum of all valid values</li>
 *   <li>Count: The number of valid cells</li>
 *   <li>Min: The minimum valid value</li>
 *   <li>Max: The maximum valid value</li>
 * </ul>
 * Cells that are not finite or equal to the no-data value of their band are skipped.
 */
public class Statistics {
  /**The summation of all values represented by this object*/
  public double[] sum;

  /**The number of elements represented by this object*/
  public long[] count;

  /**The maximum value represented by this object*/
  public double[] max;

  /**The minimum value represented by this object*/
  public double[] min;

  @Override
  public String toString() {
    if (sum == null || sum.length == 0)
      return "Empty statistics";
    return String.format("{sum: %f, count: %d, max: %f, min: %f}", sum[0], count[0], max[0], min[0]);
  }

  public void setNumBands(int n) {
    this.sum = new double[n];
    this.min = new double[n];
    this.max = new double[n];
    this.count = new long[n];
    for (int i = 0; i < n; i++) {
      this.min[i] = Double.POSITIVE_INFINITY;
      this.max[i] = Double.NEGATIVE_INFINITY;
    }
  }

  /**
   * Collects the valid values of all bands in the given range of rows.
   * @param raster the raster to collect from
   * @param row1 the first row (inclusive)
   * @param row2 the last row (exclusive)
   * @return this object
   */
  public Statistics collect(GridRaster raster, int row1, int row2) {
    if (getNumBands() != raster.getNumBands())
      setNumBands(raster.getNumBands());
    int width = raster.getWidth();
    for (int b = 0; b < raster.getNumBands(); b++) {
      double[] values = raster.getBand(b);
      for (int i = row1 * width; i < row2 * width; i++) {
        double value = values[i];
        if (!raster.isValidValue(b, value))
          continue;
        if (value < min[b])
          min[b] = value;
        if (value > max[b])
          max[b] = value;
        sum[b] += value;
        count[b]++;
      }
    }
    return this;
  }

  public Statistics collect(GridRaster raster) {
    return collect(raster, 0, raster.getHeight());
  }

  public Statistics accumulate(Statistics s) {
    if (getNumBands() == 0)
      setNumBands(s.getNumBands());
    for (int i = 0; i < sum.length; i++) {
      this.sum[i] += s.sum[i];
      this.count[i] += s.count[i];
      if (s.max[i] > this.max[i])
        this.max[i] = s.max[i];
      if (s.min[i] < this.min[i])
        this.min[i] = s.min[i];
    }
    return this;
  }

  public int getNumBands() {
    return sum == null? 0 : sum.length;
  }

  /**
   * Whether the given band has at least one valid cell
   * @param band the index of the band
   * @return {@code true} if min and max are defined for this band
   */
  public boolean hasData(int band) {
    return count[band] > 0;
  }
}
