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

import junit.framework.TestCase;

import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class ColorizerTest extends TestCase {

  private static ColorRamp blueToRed() throws RampParseException {
    return new ColorRamp(Arrays.asList(
        new ColorBreakpoint(1, 0, 0, 255),
        new ColorBreakpoint(255, 255, 0, 0)));
  }

  public void testColorizeAndMask() throws Exception {
    RasterMetadata metadata = RasterMetadata.northUp(4, 1, 0, 1, 1, 1, "EPSG:4326");
    double[] values = {0, 100, -9999, 200};
    GridRaster raster = GridRaster.singleBand(metadata, values, -9999);
    ValueNormalizer normalizer = new ValueNormalizer(0, 100);
    NormalizedRaster normalized = normalizer.normalize(raster, 0, null);
    ImageRaster image = new Colorizer(blueToRed()).colorize(normalized, null);
    // The sentinel is outside the ramp domain
    assertEquals(ImageRaster.Transparent, image.getARGB(2, 0));
    image.replaceAlpha(new ValidityMaskBuilder().build(raster));
    assertEquals(0xff0000ff, image.getARGB(0, 0));
    assertEquals(0xffff0000, image.getARGB(1, 0));
    assertEquals(0, ImageRaster.alpha(image.getARGB(2, 0)));
    // Clamped values look exactly like the upper bound
    assertEquals(image.getARGB(1, 0), image.getARGB(3, 0));
    assertEquals(3, image.countOpaque());
  }

  public void testMaskOverridesRampAlpha() throws Exception {
    RasterMetadata metadata = RasterMetadata.northUp(2, 1, 0, 1, 1, 1, "EPSG:4326");
    GridRaster raster = GridRaster.singleBand(metadata, new double[] {5, 5}, Double.NaN);
    ColorRamp translucent = new ColorRamp(Arrays.asList(new ColorBreakpoint(1, 10, 20, 30, 0)));
    NormalizedRaster normalized = new ValueNormalizer(0, 10).normalize(raster, 0, null);
    ImageRaster image = new Colorizer(translucent).colorize(normalized, null);
    image.replaceAlpha(new ValidityMaskBuilder().build(raster));
    assertEquals(0xff0a141e, image.getARGB(0, 0));
  }

  public void testParallelMatchesSequential() throws Exception {
    RasterMetadata metadata = RasterMetadata.northUp(50, 300, 0, 300, 1, 1, "EPSG:4326");
    double[] values = new double[50 * 300];
    for (int i = 0; i < values.length; i++)
      values[i] = Math.sin(i * 0.01) * 100;
    GridRaster raster = GridRaster.singleBand(metadata, values, Double.NaN);
    ValueNormalizer normalizer = new ValueNormalizer(-100, 100);
    Colorizer colorizer = new Colorizer(blueToRed());
    ImageRaster sequential = colorizer.colorize(normalizer.normalize(raster, 0, null), null);
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      ImageRaster parallel = colorizer.colorize(normalizer.normalize(raster, 0, executor), executor);
      assertTrue(Arrays.equals(sequential.getPixels(), parallel.getPixels()));
    } finally {
      executor.shutdownNow();
    }
  }
}
