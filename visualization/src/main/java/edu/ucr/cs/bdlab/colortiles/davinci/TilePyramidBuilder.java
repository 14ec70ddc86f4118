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

import edu.ucr.cs.bdlab.colortiles.raptor.ImageRaster;
import edu.ucr.cs.bdlab.colortiles.raptor.PointTransforms;
import edu.ucr.cs.bdlab.colortiles.raptor.RasterMetadata;
import edu.ucr.cs.bdlab.colortiles.raptor.WebMercator;
import edu.ucr.cs.bdlab.colortiles.util.OperationParam;
import edu.ucr.cs.bdlab.colortiles.util.ParallelUtil;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.locationtech.jts.geom.Envelope;

import java.awt.geom.Point2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

/**
 * Partitions a web mercator raster into a quad-tree of square tiles. The deepest level is sampled directly from the
 * raster and every coarser level is computed only from the tiles of the level below it. Levels are built one at a
 * time and all the tiles of a level are complete before the next level starts.
 */
public class TilePyramidBuilder {
  private static final Log LOG = LogFactory.getLog(TilePyramidBuilder.class);

  /**The name of this stage in error messages*/
  public static final String StageName = "tile";

  @OperationParam(
      description = "The width and height of each tile in pixels (power of two)",
      defaultValue = "256"
  )
  public static final String TileSize = "tileSize";

  @OperationParam(
      description = "The coarsest zoom level to generate",
      defaultValue = "0"
  )
  public static final String ZoomMin = "zoomMin";

  @OperationParam(
      description = "The finest zoom level to generate",
      defaultValue = "3"
  )
  public static final String ZoomMax = "zoomMax";

  @OperationParam(
      description = "The zoom levels to generate as 'min..max', 'min-max', or a number of levels n for 0..n-1. " +
          "Overrides zoomMin and zoomMax"
  )
  public static final String Levels = "levels";

  @OperationParam(
      description = "How coarser levels are computed from finer ones {average, nearest}",
      defaultValue = "average"
  )
  public static final String ResamplingRule = "resamplingRule";

  @OperationParam(
      description = "Do not generate tiles in which all pixels are transparent",
      defaultValue = "true"
  )
  public static final String SkipEmptyTiles = "skipEmptyTiles";

  /**Supported range of tile sizes*/
  private static final int MinTileSize = 2, MaxTileSize = 8192;

  private final ZoomRange zoomRange;

  private final int tileSize;

  private final OverviewResampling resampling;

  private final boolean skipEmptyTiles;

  public TilePyramidBuilder(ZoomRange zoomRange, int tileSize, OverviewResampling resampling,
                            boolean skipEmptyTiles) throws InvalidZoomRangeException {
    if (tileSize < MinTileSize || tileSize > MaxTileSize || Integer.bitCount(tileSize) != 1)
      throw new InvalidZoomRangeException(String.format("Tile size %d must be a power of two in [%d, %d]",
          tileSize, MinTileSize, MaxTileSize));
    this.zoomRange = zoomRange;
    this.tileSize = tileSize;
    this.resampling = resampling;
    this.skipEmptyTiles = skipEmptyTiles;
  }

  public ZoomRange getZoomRange() {
    return zoomRange;
  }

  public int getTileSize() {
    return tileSize;
  }

  /**
   * The pixel size of the deepest level. A mercator raster with this resolution whose corner lies on a multiple of
   * it is copied into the base tiles without resampling.
   * @return the resolution in meters per pixel
   */
  public double getBaseResolution() {
    return WebMercator.resolution(zoomRange.max, tileSize);
  }

  /**
   * Builds all levels of the pyramid
   * @param mercator a raster in web mercator
   * @param executor the executor to generate the tiles of each level or {@code null} to run sequentially
   * @return the pyramid that contains all generated tiles
   * @throws IOException if the calling thread is interrupted while waiting for a level
   */
  public TilePyramid build(ImageRaster mercator, ExecutorService executor) throws IOException {
    String crs = mercator.getMetadata().getCRS();
    if (!PointTransforms.isWebMercator(crs))
      throw new IllegalArgumentException("Tiles can only be built from a web mercator raster but found " + crs);
    TilePyramid pyramid = new TilePyramid(zoomRange, tileSize);
    LOG.info(String.format("Building pyramid %s of %dx%d tiles from %s", zoomRange, tileSize, tileSize,
        mercator.getMetadata()));
    buildBaseLevel(mercator, pyramid, executor);
    for (int z = zoomRange.max - 1; z >= zoomRange.min; z--)
      buildOverviewLevel(z, pyramid, executor);
    LOG.info("Built " + pyramid);
    return pyramid;
  }

  private void buildBaseLevel(ImageRaster mercator, TilePyramid pyramid, ExecutorService executor)
      throws IOException {
    final int z = zoomRange.max;
    long gridSize = 1L << z;
    double tileExtent = 2 * WebMercator.HalfWorld / gridSize;
    Envelope extent = mercator.getMetadata().getEnvelope();
    int x1 = clamp((long) Math.floor((extent.getMinX() + WebMercator.HalfWorld) / tileExtent), gridSize);
    int x2 = clamp((long) Math.ceil((extent.getMaxX() + WebMercator.HalfWorld) / tileExtent) - 1, gridSize);
    int y1 = clamp((long) Math.floor((WebMercator.HalfWorld - extent.getMaxY()) / tileExtent), gridSize);
    int y2 = clamp((long) Math.ceil((WebMercator.HalfWorld - extent.getMinY()) / tileExtent) - 1, gridSize);
    LOG.info(String.format("Level %d covers tile columns [%d, %d] and rows [%d, %d]", z, x1, x2, y1, y2));
    List<Callable<Tile>> tasks = new ArrayList<>();
    for (int x = x1; x <= x2; x++) {
      for (int y = y1; y <= y2; y++) {
        final int tx = x, ty = y;
        tasks.add(() -> sampleTile(mercator, z, tx, ty));
      }
    }
    addTiles(pyramid, ParallelUtil.invokeAll(executor, tasks));
  }

  private static int clamp(long i, long gridSize) {
    return (int) Math.max(0, Math.min(gridSize - 1, i));
  }

  /**
   * Fills a base tile with the raster pixels that contain the centers of the tile pixels
   * @param mercator the source raster
   * @param z the zoom level of the tile
   * @param x the column of the tile
   * @param y the row of the tile counted from the top
   * @return the tile
   */
  Tile sampleTile(ImageRaster mercator, int z, int x, int y) {
    Tile tile = new Tile(z, x, y, tileSize);
    int[] dst = tile.getPixels();
    int[] src = mercator.getPixels();
    RasterMetadata grid = mercator.getMetadata();
    double resolution = WebMercator.resolution(z, tileSize);
    Envelope tileMBR = TileIndex.getMercatorMBR(z, x, y, new Envelope());
    Point2D.Double point = new Point2D.Double();
    for (int j = 0; j < tileSize; j++) {
      double my = tileMBR.getMaxY() - (j + 0.5) * resolution;
      for (int i = 0; i < tileSize; i++) {
        double mx = tileMBR.getMinX() + (i + 0.5) * resolution;
        grid.modelToGrid(mx, my, point);
        int col = (int) Math.floor(point.x);
        int row = (int) Math.floor(point.y);
        if (col >= 0 && row >= 0 && col < grid.getWidth() && row < grid.getHeight())
          dst[j * tileSize + i] = src[row * grid.getWidth() + col];
      }
    }
    return tile;
  }

  private void buildOverviewLevel(int z, TilePyramid pyramid, ExecutorService executor) throws IOException {
    SortedSet<Long> parents = new TreeSet<>();
    for (long childID : pyramid.getTileIDs(z + 1))
      parents.add(TileIndex.parentOf(childID));
    List<Callable<Tile>> tasks = new ArrayList<>();
    for (long parentID : parents) {
      final TileIndex parent = TileIndex.decode(parentID, null);
      tasks.add(() -> downsample(parent.z, parent.x, parent.y,
          pyramid.getTile(TileIndex.childOf(parentID, 0, 0)),
          pyramid.getTile(TileIndex.childOf(parentID, 1, 0)),
          pyramid.getTile(TileIndex.childOf(parentID, 0, 1)),
          pyramid.getTile(TileIndex.childOf(parentID, 1, 1))));
    }
    addTiles(pyramid, ParallelUtil.invokeAll(executor, tasks));
  }

  /**
   * Computes a parent tile from its four children. A missing child is treated as fully transparent.
   * @param z the level of the parent
   * @param x the column of the parent
   * @param y the row of the parent
   * @param topLeft the child at (2x, 2y)
   * @param topRight the child at (2x+1, 2y)
   * @param bottomLeft the child at (2x, 2y+1)
   * @param bottomRight the child at (2x+1, 2y+1)
   * @return the parent tile
   */
  Tile downsample(int z, int x, int y, Tile topLeft, Tile topRight, Tile bottomLeft, Tile bottomRight) {
    Tile parent = new Tile(z, x, y, tileSize);
    Tile[] children = {topLeft, topRight, bottomLeft, bottomRight};
    int half = tileSize / 2;
    int[] dst = parent.getPixels();
    for (int q = 0; q < 4; q++) {
      Tile child = children[q];
      if (child == null)
        continue;
      int[] src = child.getPixels();
      int offsetX = (q % 2) * half;
      int offsetY = (q / 2) * half;
      for (int j = 0; j < half; j++) {
        for (int i = 0; i < half; i++) {
          int base = (2 * j) * tileSize + 2 * i;
          int pixel;
          if (resampling == OverviewResampling.NEAREST)
            pixel = src[base];
          else
            pixel = average(src[base], src[base + 1], src[base + tileSize], src[base + tileSize + 1]);
          dst[(offsetY + j) * tileSize + offsetX + i] = pixel;
        }
      }
    }
    return parent;
  }

  /**
   * Averages the colors of the given pixels weighted by their alpha. The alpha of the result is the maximum alpha.
   */
  static int average(int p1, int p2, int p3, int p4) {
    int[] pixels = {p1, p2, p3, p4};
    long r = 0, g = 0, b = 0, totalAlpha = 0;
    int maxAlpha = 0;
    for (int pixel : pixels) {
      int a = pixel >>> 24;
      if (a == 0)
        continue;
      r += (long) a * ((pixel >> 16) & 0xff);
      g += (long) a * ((pixel >> 8) & 0xff);
      b += (long) a * (pixel & 0xff);
      totalAlpha += a;
      maxAlpha = Math.max(maxAlpha, a);
    }
    if (totalAlpha == 0)
      return 0;
    int ar = (int) ((r + totalAlpha / 2) / totalAlpha);
    int ag = (int) ((g + totalAlpha / 2) / totalAlpha);
    int ab = (int) ((b + totalAlpha / 2) / totalAlpha);
    return (maxAlpha << 24) | (ar << 16) | (ag << 8) | ab;
  }

  private void addTiles(TilePyramid pyramid, List<Tile> tiles) {
    int skipped = 0;
    for (Tile tile : tiles) {
      if (skipEmptyTiles && tile.isEmpty()) {
        skipped++;
        continue;
      }
      pyramid.addTile(tile);
      LOG.debug("Generated " + tile);
    }
    if (skipped > 0)
      LOG.debug(String.format("Skipped %d empty tile(s)", skipped));
  }
}
