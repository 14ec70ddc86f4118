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
import edu.ucr.cs.bdlab.colortiles.raptor.RasterMetadata;
import edu.ucr.cs.bdlab.colortiles.raptor.WebMercator;
import junit.framework.TestCase;

import java.io.IOException;
import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class TilePyramidBuilderTest extends TestCase {

  /**Creates a raster that covers the whole world exactly at the resolution of the given level*/
  private static ImageRaster worldRaster(int z, int tileSize, long seed) {
    int size = tileSize << z;
    double resolution = WebMercator.resolution(z, tileSize);
    RasterMetadata metadata = RasterMetadata.northUp(size, size, -WebMercator.HalfWorld, WebMercator.HalfWorld,
        resolution, resolution, WebMercator.CRS);
    ImageRaster raster = new ImageRaster(metadata);
    Random random = new Random(seed);
    int[] pixels = raster.getPixels();
    for (int i = 0; i < pixels.length; i++)
      pixels[i] = 0xff000000 | random.nextInt(0x1000000);
    return raster;
  }

  public void testBaseTilesAreExactCopies() throws Exception {
    ImageRaster raster = worldRaster(2, 8, 0);
    TilePyramidBuilder builder = new TilePyramidBuilder(new ZoomRange(2, 2), 8, OverviewResampling.AVERAGE, true);
    TilePyramid pyramid = builder.build(raster, null);
    assertEquals(16, pyramid.getNumTiles(2));
    for (int x = 0; x < 4; x++) {
      for (int y = 0; y < 4; y++) {
        Tile tile = pyramid.getTile(2, x, y);
        assertNotNull(tile);
        for (int j = 0; j < 8; j++)
          for (int i = 0; i < 8; i++)
            assertEquals(raster.getARGB(x * 8 + i, y * 8 + j), tile.getARGB(i, j));
      }
    }
  }

  public void testParentsAverageTheirChildren() throws Exception {
    ImageRaster raster = worldRaster(1, 4, 1);
    TilePyramidBuilder builder = new TilePyramidBuilder(new ZoomRange(0, 1), 4, OverviewResampling.AVERAGE, true);
    TilePyramid pyramid = builder.build(raster, null);
    Tile parent = pyramid.getTile(0, 0, 0);
    for (int j = 0; j < 4; j++) {
      for (int i = 0; i < 4; i++) {
        Tile child = pyramid.getTile(1, i / 2, j / 2);
        int ci = (i % 2) * 2, cj = (j % 2) * 2;
        int expected = TilePyramidBuilder.average(child.getARGB(ci, cj), child.getARGB(ci + 1, cj),
            child.getARGB(ci, cj + 1), child.getARGB(ci + 1, cj + 1));
        assertEquals(expected, parent.getARGB(i, j));
      }
    }
  }

  public void testNearestOverviews() throws Exception {
    ImageRaster raster = worldRaster(1, 4, 2);
    TilePyramidBuilder builder = new TilePyramidBuilder(new ZoomRange(0, 1), 4, OverviewResampling.NEAREST, true);
    TilePyramid pyramid = builder.build(raster, null);
    Tile parent = pyramid.getTile(0, 0, 0);
    for (int j = 0; j < 4; j++)
      for (int i = 0; i < 4; i++)
        assertEquals(raster.getARGB(2 * i, 2 * j), parent.getARGB(i, j));
  }

  public void testAverageWeightsByAlpha() {
    assertEquals(0xff0000ff, TilePyramidBuilder.average(0xff0000ff, 0, 0, 0));
    assertEquals(0, TilePyramidBuilder.average(0, 0x00ffffff, 0, 0));
    assertEquals(0xff000080, TilePyramidBuilder.average(0xff000000, 0xff0000ff, 0xff000000, 0xff0000ff));
  }

  public void testParallelIsDeterministic() throws Exception {
    ImageRaster raster = worldRaster(3, 16, 3);
    TilePyramidBuilder builder = new TilePyramidBuilder(new ZoomRange(0, 3), 16, OverviewResampling.AVERAGE, true);
    TilePyramid sequential = builder.build(raster, null);
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      TilePyramid parallel = builder.build(raster, executor);
      assertEquals(sequential.getNumTiles(), parallel.getNumTiles());
      for (int z = 0; z <= 3; z++) {
        assertEquals(sequential.getTileIDs(z), parallel.getTileIDs(z));
        for (Tile tile : sequential.getTiles(z)) {
          Tile other = parallel.getTile(z, tile.getX(), tile.getY());
          assertTrue(Arrays.equals(tile.getPixels(), other.getPixels()));
        }
      }
    } finally {
      executor.shutdownNow();
    }
  }

  public void testSparsePyramid() throws Exception {
    int tileSize = 4;
    double resolution = WebMercator.resolution(2, tileSize);
    // A small raster that lies inside tile (2, 2, 1)
    RasterMetadata metadata = RasterMetadata.northUp(2, 2, resolution, WebMercator.HalfWorld / 2 - resolution,
        resolution, resolution, WebMercator.CRS);
    ImageRaster raster = new ImageRaster(metadata);
    Arrays.fill(raster.getPixels(), 0xff123456);
    TilePyramidBuilder builder = new TilePyramidBuilder(new ZoomRange(0, 2), tileSize,
        OverviewResampling.AVERAGE, true);
    TilePyramid pyramid = builder.build(raster, null);
    assertEquals(1, pyramid.getNumTiles(2));
    assertEquals(1, pyramid.getNumTiles(1));
    assertEquals(1, pyramid.getNumTiles(0));
    assertNotNull(pyramid.getTile(2, 2, 1));
    assertNotNull(pyramid.getTile(1, 1, 0));
    assertNotNull(pyramid.getTile(0, 0, 0));
    Tile base = pyramid.getTile(2, 2, 1);
    assertEquals(0xff123456, base.getARGB(1, 2));
    assertEquals(0, base.getARGB(0, 0));
  }

  public void testEmptyTiles() throws Exception {
    double resolution = WebMercator.resolution(1, 4);
    RasterMetadata metadata = RasterMetadata.northUp(8, 8, -WebMercator.HalfWorld, WebMercator.HalfWorld,
        resolution, resolution, WebMercator.CRS);
    ImageRaster transparent = new ImageRaster(metadata);
    TilePyramid skipped = new TilePyramidBuilder(new ZoomRange(0, 1), 4, OverviewResampling.AVERAGE, true)
        .build(transparent, null);
    assertEquals(0, skipped.getNumTiles());
    TilePyramid kept = new TilePyramidBuilder(new ZoomRange(0, 1), 4, OverviewResampling.AVERAGE, false)
        .build(transparent, null);
    assertEquals(5, kept.getNumTiles());
  }

  public void testMissingChildrenAreTransparent() throws Exception {
    TilePyramidBuilder builder = new TilePyramidBuilder(new ZoomRange(0, 1), 4, OverviewResampling.AVERAGE, true);
    Tile child = new Tile(1, 0, 0, 4);
    Arrays.fill(child.getPixels(), 0xffabcdef);
    Tile parent = builder.downsample(0, 0, 0, child, null, null, null);
    assertEquals(0xffabcdef, parent.getARGB(0, 0));
    assertEquals(0xffabcdef, parent.getARGB(1, 1));
    assertEquals(0, parent.getARGB(2, 0));
    assertEquals(0, parent.getARGB(3, 3));
  }

  public void testInvalidTileSize() throws InvalidZoomRangeException {
    int[] invalid = {0, 1, 100, 16384};
    for (int tileSize : invalid) {
      try {
        new TilePyramidBuilder(new ZoomRange(0, 1), tileSize, OverviewResampling.AVERAGE, true);
        fail("Expected an exception for tile size " + tileSize);
      } catch (InvalidZoomRangeException e) {
        assertEquals(TilePyramidBuilder.StageName, e.getStage());
      }
    }
  }

  public void testRejectsNonMercatorRaster() throws InvalidZoomRangeException, IOException {
    ImageRaster geographic = new ImageRaster(RasterMetadata.northUp(2, 2, 0, 2, 1, 1, "EPSG:4326"));
    try {
      new TilePyramidBuilder(new ZoomRange(0, 1), 4, OverviewResampling.AVERAGE, true).build(geographic, null);
      fail("Expected an exception");
    } catch (IllegalArgumentException e) {
      // Expected
    }
  }
}
