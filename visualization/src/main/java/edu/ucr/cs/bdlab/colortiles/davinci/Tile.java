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

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;

/**
 * A square image tile at a position in the pyramid. Pixels are stored as packed ARGB integers.
 */
public class Tile {
  private final int z, x, y;

  private final BufferedImage image;

  public Tile(int z, int x, int y, int tileSize) {
    this(z, x, y, new BufferedImage(tileSize, tileSize, BufferedImage.TYPE_INT_ARGB));
  }

  public Tile(int z, int x, int y, BufferedImage image) {
    if (image.getType() != BufferedImage.TYPE_INT_ARGB)
      throw new IllegalArgumentException("Tiles must be ARGB images");
    if (image.getWidth() != image.getHeight())
      throw new IllegalArgumentException(String.format("Tile image %dx%d is not square",
          image.getWidth(), image.getHeight()));
    this.z = z;
    this.x = x;
    this.y = y;
    this.image = image;
  }

  public int getZ() {
    return z;
  }

  public int getX() {
    return x;
  }

  public int getY() {
    return y;
  }

  public long getTileID() {
    return TileIndex.encode(z, x, y);
  }

  public int getTileSize() {
    return image.getWidth();
  }

  public BufferedImage getImage() {
    return image;
  }

  public int[] getPixels() {
    return ((DataBufferInt) image.getRaster().getDataBuffer()).getData();
  }

  public int getARGB(int i, int j) {
    return getPixels()[j * getTileSize() + i];
  }

  /**
   * Whether all the pixels of this tile are fully transparent
   * @return {@code true} if no pixel has a non-zero alpha
   */
  public boolean isEmpty() {
    for (int pixel : getPixels())
      if ((pixel >>> 24) != 0)
        return false;
    return true;
  }

  @Override
  public String toString() {
    return String.format("Tile (%d,%d,%d)", z, x, y);
  }
}
