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
 * A single-band raster of integer values produced by the {@link ValueNormalizer}. Valid cells hold values in
 * the range [lo, hi]; cells without data hold {@link ValueNormalizer#NoDataSentinel}.
 */
public class NormalizedRaster {
  private final RasterMetadata metadata;

  /**The normalized values in row-major order*/
  private final int[] values;

  /**The range of valid values (inclusive)*/
  private final int lo, hi;

  NormalizedRaster(RasterMetadata metadata, int[] values, int lo, int hi) {
    this.metadata = metadata;
    this.values = values;
    this.lo = lo;
    this.hi = hi;
  }

  public RasterMetadata getMetadata() {
    return metadata;
  }

  public int getWidth() {
    return metadata.getWidth();
  }

  public int getHeight() {
    return metadata.getHeight();
  }

  public int getValue(int col, int row) {
    return values[row * metadata.getWidth() + col];
  }

  public int getLo() {
    return lo;
  }

  public int getHi() {
    return hi;
  }

  /**
   * Direct access to the values. The returned array must not be modified.
   * @return the values in row-major order
   */
  int[] getValues() {
    return values;
  }
}
