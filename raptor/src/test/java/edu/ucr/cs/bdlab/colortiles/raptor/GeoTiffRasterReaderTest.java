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

import edu.ucr.cs.bdlab.colortiles.common.ColorTilesException;
import edu.ucr.cs.bdlab.colortiles.common.InputException;
import edu.ucr.cs.bdlab.test.ColorTilesTest;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import javax.imageio.ImageIO;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

public class GeoTiffRasterReaderTest extends ColorTilesTest {

  public void testFloatRasterRoundTrip() throws IOException, InputException {
    FileSystem fs = getLocalFS();
    Path path = new Path(scratchPath(), "dem.tif");
    RasterMetadata metadata = RasterMetadata.northUp(4, 3, -2000, 5000, 500, 250, "EPSG:3857");
    double[] values = {1.5, 2, 3, -9999, 100, 200, 300, 400, -1, 0, 1, 2};
    new GeoTiffRasterWriter().write(GridRaster.singleBand(metadata, values, -9999), fs, path);

    GridRaster raster = RasterHelper.readRaster(fs, path);
    assertEquals(1, raster.getNumBands());
    assertEquals(CellType.FLOAT32, raster.getCellType(0));
    assertEquals(-9999.0, raster.getNoData(0));
    assertEquals("EPSG:3857", raster.getMetadata().getCRS());
    assertTrue(raster.getMetadata().toString(), raster.getMetadata().isSameGrid(metadata));
    for (int row = 0; row < 3; row++)
      for (int col = 0; col < 4; col++)
        assertEquals(values[row * 4 + col], raster.getValue(0, col, row), 1E-6);
  }

  public void testNoDataThatFloatCellsCannotHoldExactly() throws IOException, ColorTilesException {
    FileSystem fs = getLocalFS();
    Path path = new Path(scratchPath(), "fraction.tif");
    RasterMetadata metadata = RasterMetadata.northUp(2, 1, 0, 10, 1, 1, "EPSG:4326");
    new GeoTiffRasterWriter().write(GridRaster.singleBand(metadata, new double[] {-99.9, 5}, -99.9), fs, path);

    GridRaster raster = RasterHelper.readRaster(fs, path);
    assertEquals(raster.getValue(0, 0, 0), raster.getNoData(0));
    ValidityMask mask = new ValidityMaskBuilder().build(raster);
    assertFalse(mask.isValid(0, 0));
    assertTrue(mask.isValid(1, 0));
    NormalizedRaster normalized = new ValueNormalizer(0, 10).normalize(raster, 0, null);
    assertEquals(ValueNormalizer.NoDataSentinel, normalized.getValue(0, 0));
    assertEquals(128, normalized.getValue(1, 0));
  }

  public void testGeographicRasterWithoutNoData() throws IOException, InputException {
    FileSystem fs = getLocalFS();
    Path path = new Path(scratchPath(), "grid.tiff");
    RasterMetadata metadata = RasterMetadata.northUp(2, 2, -120, 40, 0.25, 0.25, "EPSG:4326");
    new GeoTiffRasterWriter().write(GridRaster.singleBand(metadata, new double[] {1, 2, 3, 4}, Double.NaN), fs, path);
    GridRaster raster = RasterHelper.readRaster(fs, path);
    assertEquals("EPSG:4326", raster.getMetadata().getCRS());
    assertFalse(raster.hasNoData(0));
    assertEquals(4.0, raster.getValue(0, 1, 1), 1E-9);
  }

  public void testColorizedRasterRoundTrip() throws IOException, InputException {
    FileSystem fs = getLocalFS();
    Path path = new Path(scratchPath(), "rgba.tif");
    AffineTransform rotated = new AffineTransform(10, 2, -2, -10, 1000, 2000);
    ImageRaster image = new ImageRaster(new RasterMetadata(3, 2, rotated, "EPSG:32611"));
    image.setARGB(0, 0, 0xff102030);
    image.setARGB(2, 1, 0x80405060);
    new GeoTiffRasterWriter().write(image, fs, path);

    GridRaster raster = RasterHelper.readRaster(fs, path);
    assertEquals(4, raster.getNumBands());
    assertEquals(CellType.BYTE, raster.getCellType(0));
    assertEquals("EPSG:32611", raster.getMetadata().getCRS());
    assertTrue(raster.getMetadata().isSameGrid(image.getMetadata()));
  }

  public void testFileWithoutGeoreferencing() throws IOException {
    File file = new File(scratchDir(), "plain.tif");
    assertTrue(ImageIO.write(new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_GRAY), "tiff", file));
    try {
      RasterHelper.readRaster(getLocalFS(), new Path(file.getPath()));
      fail("Expected an exception");
    } catch (InputException e) {
      assertEquals(GeoTiffRasterReader.StageName, e.getStage());
      assertTrue(e.getMessage(), e.getMessage().contains("georeferencing"));
    }
  }

  public void testMissingFile() throws IOException {
    Path path = new Path(scratchPath(), "missing.tif");
    try {
      RasterHelper.readRaster(getLocalFS(), path);
      fail("Expected an exception");
    } catch (InputException e) {
      assertEquals(path.toString(), e.getPath());
      assertEquals(ColorTilesException.Kind.PROCESSING, e.getKind());
    }
  }

  public void testUnrecognizedExtension() throws IOException {
    try {
      RasterHelper.readRaster(getLocalFS(), new Path(scratchPath(), "data.csv"));
      fail("Expected an exception");
    } catch (InputException e) {
      assertTrue(e.getMessage().contains("Unrecognized extension"));
    }
  }
}
