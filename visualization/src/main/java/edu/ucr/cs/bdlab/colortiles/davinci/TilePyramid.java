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

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * All the tiles of a pyramid grouped by zoom level. Tiles that were not generated, i.e., outside the raster or
 * fully transparent, are absent.
 */
public class TilePyramid {
  private final ZoomRange zoomRange;

  private final int tileSize;

  /**Tiles of each level keyed by their encoded tile ID*/
  private final Map<Integer, Map<Long, Tile>> levels = new TreeMap<>();

  public TilePyramid(ZoomRange zoomRange, int tileSize) {
    this.zoomRange = zoomRange;
    this.tileSize = tileSize;
    for (int z = zoomRange.min; z <= zoomRange.max; z++)
      levels.put(z, new TreeMap<>());
  }

  public ZoomRange getZoomRange() {
    return zoomRange;
  }

  public int getTileSize() {
    return tileSize;
  }

  void addTile(Tile tile) {
    Map<Long, Tile> level = levels.get(tile.getZ());
    if (level == null)
      throw new IllegalArgumentException(String.format("Level %d is outside the pyramid %s", tile.getZ(), zoomRange));
    level.put(tile.getTileID(), tile);
  }

  /**
   * Returns the tile at the given position
   * @param z the zoom level
   * @param x the column of the tile
   * @param y the row of the tile counted from the top
   * @return the tile or {@code null} if it was not generated
   */
  public Tile getTile(int z, int x, int y) {
    Map<Long, Tile> level = levels.get(z);
    return level == null ? null : level.get(TileIndex.encode(z, x, y));
  }

  public Tile getTile(long tileID) {
    TileIndex index = TileIndex.decode(tileID, null);
    return getTile(index.z, index.x, index.y);
  }

  /**
   * All the tiles of a level ordered by their encoded ID
   * @param z the zoom level
   * @return an unmodifiable collection of tiles
   */
  public Collection<Tile> getTiles(int z) {
    Map<Long, Tile> level = levels.get(z);
    return level == null ? Collections.emptyList() : Collections.unmodifiableCollection(level.values());
  }

  /**
   * The encoded IDs of the tiles at one level
   * @param z the zoom level
   * @return a sorted set of encoded tile IDs
   */
  public SortedSet<Long> getTileIDs(int z) {
    Map<Long, Tile> level = levels.get(z);
    return level == null ? new TreeSet<>() : new TreeSet<>(level.keySet());
  }

  public int getNumTiles(int z) {
    Map<Long, Tile> level = levels.get(z);
    return level == null ? 0 : level.size();
  }

  public int getNumTiles() {
    int count = 0;
    for (Map<Long, Tile> level : levels.values())
      count += level.size();
    return count;
  }

  @Override
  public String toString() {
    StringBuilder str = new StringBuilder("TilePyramid(").append(zoomRange).append(") {");
    for (Map.Entry<Integer, Map<Long, Tile>> level : levels.entrySet())
      str.append(' ').append(level.getKey()).append(':').append(level.getValue().size());
    return str.append(" }").toString();
  }
}
