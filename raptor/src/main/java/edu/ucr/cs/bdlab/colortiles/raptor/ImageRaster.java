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

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;

/**
 * A georeferenced RGBA raster. Pixels are stored in a {@link BufferedImage} of type
 * {@link BufferedImage#TYPE_INT_ARGB} so they can be written directly by ImageIO.
 */
public class ImageRaster {
  /**A fully transparent black pixel*/
  public static final int Transparent = 0;

  private final RasterMetadata metadata;

  private final BufferedImage image;

  /**
   * Creates a fully transparent raster with the given grid
   * @param metadata the grid and georeferencing of the raster
   */
  public ImageRaster(RasterMetadata metadata) {
    this(metadata, new BufferedImage(metadata.getWidth(), metadata.getHeight(), BufferedImage.TYPE_INT_ARGB));
  }

  public ImageRaster(RasterMetadata metadata, BufferedImage image) {
    if (image.getType() != BufferedImage.TYPE_INT_ARGB)
      throw new IllegalArgumentException("Only ARGB images are supported but found type " + image.getType());
    if (image.getWidth() != metadata.getWidth() || image.getHeight() != metadata.getHeight())
      throw new IllegalArgumentException(String.format("Image of size %dx%d does not match the grid %dx%d",
          image.getWidth(), image.getHeight(), metadata.getWidth(), metadata.getHeight()));
    this.metadata = metadata;
    this.image = image;
  }

  public RasterMetadata getMetadata() {
    return metadata;
  }

  public BufferedImage getImage() {
    return image;
  }

  public int getWidth() {
    return metadata.getWidth();
  }

  public int getHeight() {
    return metadata.getHeight();
  }

  public int getARGB(int col, int row) {
    return getPixels()[row * getWidth() + col];
  }

  public void setARGB(int col, int row, int argb) {
    getPixels()[row * getWidth() + col] = argb;
  }

  public static int alpha(int argb) {
    return argb >>> 24;
  }

  /**
   * The backing pixel array in row-major order. Changes to the array are reflected in the image.
   * @return the ARGB pixels
   */
  public int[] getPixels() {
    return ((DataBufferInt) image.getRaster().getDataBuffer()).getData();
  }

  /**
   * Overwrites the alpha channel with the given mask: 255 where the mask is valid and 0 elsewhere.
   * The color channels are kept unchanged.
   * @param mask a mask with the same dimensions as this raster
   */
  public void replaceAlpha(ValidityMask mask) {
    if (mask.getWidth() != getWidth() || mask.getHeight() != getHeight())
      throw new IllegalArgumentException(String.format("Mask of size %dx%d does not match raster of size %dx%d",
          mask.getWidth(), mask.getHeight(), getWidth(), getHeight()));
    int[] pixels = getPixels();
    int width = getWidth();
    for (int row = 0; row < getHeight(); row++) {
      for (int col = 0; col < width; col++) {
        int i = row * width + col;
        int rgb = pixels[i] & 0xffffff;
        pixels[i] = mask.isValid(col, row) ? (0xff000000 | rgb) : rgb;
      }
    }
  }

  /**
   * Number of pixels with a non-zero alpha
   * @return the count of opaque pixels
   */
  public long countOpaque() {
    long count = 0;
    for (int pixel : getPixels())
      if (alpha(pixel) != 0)
        count++;
    return count;
  }
}
