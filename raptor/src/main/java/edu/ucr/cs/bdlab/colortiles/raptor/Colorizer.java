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

import edu.ucr.cs.bdlab.colortiles.util.ParallelUtil;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.io.IOException;
import java.util.concurrent.ExecutorService;

/**
 * Converts a normalized raster into an RGBA image using a color ramp. The ramp is evaluated once for every
 * value in [lo, hi] and the resulting lookup table is applied to all pixels. The no-data sentinel always becomes
 * transparent black.
 */
public class Colorizer {
  private static final Log LOG = LogFactory.getLog(Colorizer.class);

  private static final int RowsPerBlock = 64;

  private final ColorRamp ramp;

  public Colorizer(ColorRamp ramp) {
    this.ramp = ramp;
  }

  public ImageRaster colorize(NormalizedRaster normalized, ExecutorService executor) throws IOException {
    final int lo = normalized.getLo();
    final int hi = normalized.getHi();
    final int[] lut = new int[hi - lo + 1];
    for (int v = lo; v <= hi; v++)
      lut[v - lo] = ramp.resolve(v);
    LOG.info(String.format("Colorizing %dx%d raster with %s", normalized.getWidth(), normalized.getHeight(), ramp));
    ImageRaster image = new ImageRaster(normalized.getMetadata());
    final int[] pixels = image.getPixels();
    final int[] values = normalized.getValues();
    final int width = normalized.getWidth();
    ParallelUtil.forEachRowBlock(executor, normalized.getHeight(), RowsPerBlock, (row1, row2) -> {
      for (int i = row1 * width; i < row2 * width; i++) {
        int v = values[i];
        pixels[i] = v < lo || v > hi ? ImageRaster.Transparent : lut[v - lo];
      }
    });
    return image;
  }
}
