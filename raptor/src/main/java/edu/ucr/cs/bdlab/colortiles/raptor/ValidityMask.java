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

import edu.ucr.cs.bdlab.colortiles.util.BitArray;

/**
 * A raster-shaped grid of bits, one per pixel, aligned with the raster it was derived from.
 * A set bit means that the pixel carries real data.
 */
public class ValidityMask {
  private final int width;

  private final int height;

  private final BitArray bits;

  /**
   * Creates a mask where all the pixels are initially invalid
   * @param width the width of the mask in pixels
   * @param height the height of the mask in pixels
   */
  public ValidityMask(int width, int height) {
    this.width = width;
    this.height = height;
    this.bits = new BitArray((long) width * height);
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public boolean isValid(int col, int row) {
    return bits.get((long) row * width + col);
  }

  public void setValid(int col, int row, boolean valid) {
    bits.set((long) row * width + col, valid);
  }

  /**
   * Keeps only the pixels that are valid in both this mask and the other one.
   * @param other a mask of the same size
   */
  void and(ValidityMask other) {
    if (other.width != width || other.height != height)
      throw new IllegalArgumentException(String.format("Mask size mismatch %dx%d vs %dx%d",
          width, height, other.width, other.height));
    bits.inplaceAnd(other.bits);
  }

  public long countValid() {
    return bits.countOnes();
  }
}
