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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Derives the validity mask of a raster from its original (unclamped) values. A pixel is valid iff the value
 * of every band at that pixel is finite and differs from the no-data value declared for that band.
 * The mask never looks at clamped or normalized values so that out-of-range values are not mistaken for no-data.
 */
public class ValidityMaskBuilder {
  private static final Log LOG = LogFactory.getLog(ValidityMaskBuilder.class);

  /**
   * Builds the validity mask of the given raster
   * @param raster the original source raster
   * @return a mask with the same size as the raster
   */
  public ValidityMask build(GridRaster raster) {
    int width = raster.getWidth();
    int height = raster.getHeight();
    ValidityMask mask = bandMask(raster, 0);
    for (int b = 1; b < raster.getNumBands(); b++)
      mask.and(bandMask(raster, b));
    if (LOG.isDebugEnabled())
      LOG.debug(String.format("Validity mask has %d valid pixels out of %d in %d band(s)",
          mask.countValid(), (long) width * height, raster.getNumBands()));
    return mask;
  }

  private static ValidityMask bandMask(GridRaster raster, int band) {
    int width = raster.getWidth();
    int height = raster.getHeight();
    double[] values = raster.getBand(band);
    ValidityMask mask = new ValidityMask(width, height);
    for (int row = 0; row < height; row++) {
      int offset = row * width;
      for (int col = 0; col < width; col++) {
        if (raster.isValidValue(band, values[offset + col]))
          mask.setValid(col, row, true);
      }
    }
    return mask;
  }
}
