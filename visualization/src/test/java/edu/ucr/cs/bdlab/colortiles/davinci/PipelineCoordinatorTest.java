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

import edu.ucr.cs.bdlab.colortiles.common.ColorTilesException;
import edu.ucr.cs.bdlab.colortiles.common.ColorTilesOptions;
import edu.ucr.cs.bdlab.colortiles.common.InputException;
import edu.ucr.cs.bdlab.colortiles.raptor.GridRaster;
import edu.ucr.cs.bdlab.colortiles.raptor.ImageRaster;
import edu.ucr.cs.bdlab.colortiles.raptor.InvalidRangeException;
import edu.ucr.cs.bdlab.colortiles.raptor.RasterMetadata;
import edu.ucr.cs.bdlab.colortiles.raptor.RasterWarper;
import edu.ucr.cs.bdlab.colortiles.raptor.ReprojectionException;
import edu.ucr.cs.bdlab.colortiles.raptor.Reprojector;
import edu.ucr.cs.bdlab.colortiles.raptor.Resampling;
import edu.ucr.cs.bdlab.colortiles.raptor.ValueNormalizer;
import edu.ucr.cs.bdlab.test.ColorTilesTest;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import java.util.Arrays;

public class PipelineCoordinatorTest extends ColorTilesTest {

  /**A warper that never finishes unless interrupted*/
  static class StuckWarper implements RasterWarper {
    @Override
    public ImageRaster warp(ImageRaster source, RasterMetadata target, Resampling resampling)
        throws ReprojectionException {
      try {
        Thread.sleep(60000);
      } catch (InterruptedException e) {
        throw new ReprojectionException("Warp interrupted", e);
      }
      throw new ReprojectionException("Warp did not finish");
    }
  }

  private ColorTilesOptions scenarioOptions() {
    return new ColorTilesOptions()
        .set(ValueNormalizer.ClampMin, 0)
        .set(ValueNormalizer.ClampMax, 100)
        .set(TilePyramidBuilder.ZoomMin, 0)
        .set(TilePyramidBuilder.ZoomMax, 1)
        .set(TilePyramidBuilder.TileSize, 16)
        .set(PipelineCoordinator.Parallelism, 2);
  }

  public void testEndToEnd() throws Exception {
    FileSystem fs = getLocalFS();
    Path input = new Path(scratchPath(), "values.tif");
    Path colormap = new Path(scratchPath(), "colors.txt");
    Path output = new Path(scratchPath(), "tiles");
    SampleRasters.writeHalves(fs, input);
    SampleRasters.writeBlueToRed(fs, colormap);
    ColorTilesOptions opts = scenarioOptions()
        .set(TilePyramidWriter.Viewer, true)
        .set(PipelineCoordinator.KeepMercatorRaster, true);
    TilePyramid pyramid;
    try (PipelineCoordinator coordinator = new PipelineCoordinator(opts)) {
      pyramid = coordinator.run(input, colormap, output);
    }
    assertEquals(1, pyramid.getNumTiles(0));
    assertEquals(4, pyramid.getNumTiles(1));
    assertTrue(fs.exists(new Path(output, "0/0/0.png")));
    assertTrue(fs.exists(new Path(output, "1/1/1.png")));
    assertTrue(fs.exists(new Path(output, TilePyramidWriter.PropertiesFileName)));
    assertTrue(fs.exists(new Path(output, TilePyramidWriter.ViewerFileName)));
    assertTrue(fs.exists(new Path(output, PipelineCoordinator.MercatorFileName)));
    assertFalse(fs.exists(new Path(output, TileOutputCommitter.TempDirName)));

    // The no-data cell is transparent
    int noData = SampleRasters.readPixel(fs, output, 1, 16, -150, 60);
    assertEquals(0, noData >>> 24);
    // A value above the clamp range looks exactly like the top of the range
    int atMax = SampleRasters.readPixel(fs, output, 1, 16, -110, 20);
    int aboveMax = SampleRasters.readPixel(fs, output, 1, 16, 70, 20);
    assertEquals(0xffff0000, atMax);
    assertEquals(atMax, aboveMax);
  }

  public void testRunsAreDeterministic() throws Exception {
    FileSystem fs = getLocalFS();
    Path input = new Path(scratchPath(), "values.tif");
    Path colormap = new Path(scratchPath(), "colors.txt");
    SampleRasters.writeHalves(fs, input);
    SampleRasters.writeBlueToRed(fs, colormap);
    TilePyramid first, second;
    try (PipelineCoordinator coordinator = new PipelineCoordinator(scenarioOptions())) {
      first = coordinator.run(input, colormap, new Path(scratchPath(), "out1"));
    }
    try (PipelineCoordinator coordinator = new PipelineCoordinator(
        scenarioOptions().set(PipelineCoordinator.Parallelism, 1))) {
      second = coordinator.run(input, colormap, new Path(scratchPath(), "out2"));
    }
    for (int z = 0; z <= 1; z++) {
      assertEquals(first.getTileIDs(z), second.getTileIDs(z));
      for (Tile tile : first.getTiles(z))
        assertTrue(Arrays.equals(tile.getPixels(), second.getTile(z, tile.getX(), tile.getY()).getPixels()));
    }
  }

  public void testReprojectionTimeout() throws Exception {
    FileSystem fs = getLocalFS();
    Path input = new Path(scratchPath(), "values.tif");
    Path colormap = new Path(scratchPath(), "colors.txt");
    Path output = new Path(scratchPath(), "tiles");
    SampleRasters.writeHalves(fs, input);
    SampleRasters.writeBlueToRed(fs, colormap);
    ColorTilesOptions opts = scenarioOptions().set(PipelineCoordinator.Timeout, 1);
    long t1 = System.currentTimeMillis();
    try (PipelineCoordinator coordinator = new PipelineCoordinator(opts,
        new Reprojector(new StuckWarper(), Resampling.NEAREST))) {
      coordinator.run(input, colormap, output);
      fail("Expected an exception");
    } catch (PipelineTimeoutException e) {
      assertEquals(Reprojector.StageName, e.getStage());
      assertEquals(ColorTilesException.Kind.PROCESSING, e.getKind());
      assertEquals(1, e.getTimeoutSeconds());
    }
    assertTrue("Timeout was not enforced", System.currentTimeMillis() - t1 < 30000);
    assertFalse(fs.exists(output));
  }

  public void testNormalizerFromStatistics() throws Exception {
    RasterMetadata metadata = RasterMetadata.northUp(3, 1, 0, 1, 1, 1, "EPSG:4326");
    GridRaster raster = GridRaster.singleBand(metadata, new double[] {-5, 12, 30}, -5);
    try (PipelineCoordinator coordinator = new PipelineCoordinator(new ColorTilesOptions())) {
      ValueNormalizer normalizer = coordinator.createNormalizer(raster);
      assertEquals(12.0, normalizer.getClampMin());
      assertEquals(30.0, normalizer.getClampMax());
    }
    try (PipelineCoordinator coordinator = new PipelineCoordinator(
        new ColorTilesOptions().set(ValueNormalizer.ClampMax, 100))) {
      ValueNormalizer normalizer = coordinator.createNormalizer(raster);
      assertEquals(12.0, normalizer.getClampMin());
      assertEquals(100.0, normalizer.getClampMax());
    }
  }

  public void testConstantRasterGetsAUsableRange() throws Exception {
    RasterMetadata metadata = RasterMetadata.northUp(2, 1, 0, 1, 1, 1, "EPSG:4326");
    GridRaster raster = GridRaster.singleBand(metadata, new double[] {5, 5}, Double.NaN);
    try (PipelineCoordinator coordinator = new PipelineCoordinator(new ColorTilesOptions())) {
      ValueNormalizer normalizer = coordinator.createNormalizer(raster);
      assertTrue(normalizer.getClampMax() > normalizer.getClampMin());
      assertEquals(5.0, normalizer.getClampMax());
    }
  }

  public void testInvalidRangesAreRejectedUpFront() throws Exception {
    ColorTilesOptions[] invalid = {
        new ColorTilesOptions().set(ValueNormalizer.ClampMin, 10).set(ValueNormalizer.ClampMax, 10),
        new ColorTilesOptions().set(ValueNormalizer.OutMin, 0),
        new ColorTilesOptions().set(ValueNormalizer.OutMin, 200).set(ValueNormalizer.OutMax, 100),
        new ColorTilesOptions().set(ValueNormalizer.Band, -1),
    };
    for (ColorTilesOptions opts : invalid) {
      try (PipelineCoordinator coordinator = new PipelineCoordinator(opts)) {
        fail("Expected an exception but created " + coordinator + " for " + opts.toMap());
      } catch (InvalidRangeException e) {
        assertEquals(ValueNormalizer.StageName, e.getStage());
        assertEquals(ColorTilesException.Kind.CONFIGURATION, e.getKind());
      }
    }
  }

  public void testRuntimeErrorIsReportedWithItsStage() throws Exception {
    FileSystem fs = getLocalFS();
    Path input = new Path(scratchPath(), "values.tif");
    Path colormap = new Path(scratchPath(), "colors.txt");
    Path output = new Path(scratchPath(), "tiles");
    SampleRasters.writeHalves(fs, input);
    SampleRasters.writeBlueToRed(fs, colormap);
    RasterWarper brokenWarper = (source, target, resampling) -> {
      throw new IllegalArgumentException("Raster sizes do not match");
    };
    try (PipelineCoordinator coordinator = new PipelineCoordinator(scenarioOptions(),
        new Reprojector(brokenWarper, Resampling.NEAREST))) {
      coordinator.run(input, colormap, output);
      fail("Expected an exception");
    } catch (StageFailedException e) {
      assertEquals(Reprojector.StageName, e.getStage());
      assertEquals(ColorTilesException.Kind.PROCESSING, e.getKind());
      assertTrue(e.getCause() instanceof IllegalArgumentException);
      assertEquals("Raster sizes do not match", e.getMessage());
    }
    assertFalse(fs.exists(output));
  }

  public void testInvalidZoomLevelsAreRejectedUpFront() throws Exception {
    ColorTilesOptions opts = new ColorTilesOptions()
        .set(TilePyramidBuilder.ZoomMin, 5)
        .set(TilePyramidBuilder.ZoomMax, 2);
    try (PipelineCoordinator coordinator = new PipelineCoordinator(opts)) {
      fail("Expected an exception but created " + coordinator);
    } catch (InvalidZoomRangeException e) {
      assertEquals(TilePyramidBuilder.StageName, e.getStage());
      assertEquals(ColorTilesException.Kind.CONFIGURATION, e.getKind());
    }
  }

  public void testMissingInput() throws Exception {
    Path colormap = new Path(scratchPath(), "colors.txt");
    SampleRasters.writeBlueToRed(getLocalFS(), colormap);
    Path output = new Path(scratchPath(), "tiles");
    try (PipelineCoordinator coordinator = new PipelineCoordinator(scenarioOptions())) {
      coordinator.run(new Path(scratchPath(), "missing.tif"), colormap, output);
      fail("Expected an exception");
    } catch (InputException e) {
      assertEquals("read", e.getStage());
    }
    assertFalse(getLocalFS().exists(output));
  }
}
