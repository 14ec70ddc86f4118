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

import edu.ucr.cs.bdlab.colortiles.raptor.WebMercator;
import org.locationtech.jts.geom.Envelope;

/**
 * The position of a tile in a web mercator pyramid. Level zero has a single tile that covers the world and each
 * level splits every tile into four. Rows are counted from the north edge as in the XYZ scheme of web maps.
 *
 * A tile can also be identified by a single long ID (see {@link #encode(int, int, int)}). IDs of a lower level
 * always sort before the IDs of a higher level.
 */
public class TileIndex {
  /**Level, column and row of the tile*/
  public int z, x, y;

  public TileIndex() {}

  public TileIndex(int z, int x, int y) {
    if (z < 0 || z > ZoomRange.MaxSupportedZoom || x < 0 || y < 0 || x >= (1L << z) || y >= (1L << z))
      throw new IllegalArgumentException(String.format("Invalid tile index (%d,%d,%d)", z, x, y));
    this.z = z;
    this.x = x;
    this.y = y;
  }

  /**
   * Encodes a tile position into one long. The level is stored as the position of the highest set bit and the
   * column and row take z bits each below it.
   * @param z the zoom level
   * @param x the column in the range [0, 2^z)
   * @param y the row in the range [0, 2^z)
   * @return the ID of the tile
   */
  public static long encode(int z, int x, int y) {
    assert x >= 0 && x < (1L << z);
    assert y >= 0 && y < (1L << z);
    return (1L << (2 * z)) | ((long) x << z) | y;
  }

  /**
   * Decodes an ID produced by {@link #encode(int, int, int)}
   * @param tileID the encoded tile
   * @param tileIndex an object to reuse or {@code null} to create a new one
   * @return the decoded tile position
   */
  public static TileIndex decode(long tileID, TileIndex tileIndex) {
    if (tileIndex == null)
      tileIndex = new TileIndex();
    int z = (63 - Long.numberOfLeadingZeros(tileID)) / 2;
    long lowBits = (1L << z) - 1;
    tileIndex.z = z;
    tileIndex.x = (int) ((tileID >>> z) & lowBits);
    tileIndex.y = (int) (tileID & lowBits);
    return tileIndex;
  }

  /**The ID of the tile one level up that contains the given tile*/
  public static long parentOf(long tileID) {
    TileIndex index = decode(tileID, null);
    index.toParent();
    return encode(index.z, index.x, index.y);
  }

  /**
   * The ID of one of the four children of a tile
   * @param tileID the parent tile
   * @param dx 0 for the western child or 1 for the eastern one
   * @param dy 0 for the northern child or 1 for the southern one
   * @return the ID of the child tile
   */
  public static long childOf(long tileID, int dx, int dy) {
    TileIndex index = decode(tileID, null);
    return encode(index.z + 1, 2 * index.x + dx, 2 * index.y + dy);
  }

  /**
   * Computes the extent of a tile in web mercator meters
   * @param z the zoom level of the tile
   * @param x the column of the tile
   * @param y the row of the tile counted from the top
   * @param mbr the envelope to fill in
   * @return the given envelope after it is filled
   */
  public static Envelope getMercatorMBR(int z, int x, int y, Envelope mbr) {
    double tileExtent = 2 * WebMercator.HalfWorld / (1L << z);
    double x1 = -WebMercator.HalfWorld + x * tileExtent;
    double y2 = WebMercator.HalfWorld - y * tileExtent;
    mbr.init(x1, x1 + tileExtent, y2 - tileExtent, y2);
    return mbr;
  }

  public void toParent() {
    if (z == 0)
      throw new IllegalStateException("The top tile has no parent");
    x >>>= 1;
    y >>>= 1;
    z--;
  }

  /**Switches the row between top-down (XYZ) and bottom-up (TMS) numbering*/
  public void flipRow() {
    y = (int) ((1L << z) - 1 - y);
  }

  @Override
  public String toString() {
    return String.format("Tile %d/%d/%d", z, x, y);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(encode(z, x, y));
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TileIndex))
      return false;
    TileIndex that = (TileIndex) obj;
    return z == that.z && x == that.x && y == that.y;
  }
}
