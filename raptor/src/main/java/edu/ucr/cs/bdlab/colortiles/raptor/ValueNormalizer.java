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

import edu.ucr.cs.bdlab.colortiles.util.OperationParam;
import edu.ucr.cs.bdlab.colortiles.util.ParallelUtil;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.io.IOException;
import java.util.concurrent.ExecutorService;

/**
 * Maps raw cell values to a bounded integer range. A finite value v is clamped to [vmin, vmax] and mapped
 * linearly to round(lo + (v - vmin) / (vmax - vmin) * (hi - lo)). Non-finite values and values equal to the
 * no-data value of the band map to {@link #NoDataSentinel}, which never falls in [lo, hi].
 */
public class ValueNormalizer {
  private static final Log LOG = LogFactory.getLog(ValueNormalizer.class);

  /**The name of this stage in error messages*/
  public static final String StageName = "normalize";

  /**The output value of cells that carry no data*/
  public static final int NoDataSentinel = 0;

  @OperationParam(
      description = "The lower bound of the displayed value range. Defaults to the minimum valid value in the band"
  )
  public static final String ClampMin = "clampMin";

  @OperationParam(
      description = "The upper bound of the displayed value range. Defaults to the maximum valid value in the band"
  )
  public static final String ClampMax = "clampMax";

  @OperationParam(
      description = "The lowest normalized value",
      defaultValue = "1"
  )
  public static final String OutMin = "outMin";

  @OperationParam(
      description = "The highest normalized value",
      defaultValue = "255"
  )
  public static final String OutMax = "outMax";

  @OperationParam(
      description = "The index of the band to colorize (0-based)",
      defaultValue = "0"
  )
  public static final String Band = "band";

  /**Number of rows processed by one parallel task*/
  private static final int RowsPerBlock = 64;

  private final double vmin, vmax;

  private final int lo, hi;

  /**
   * Creates a normalizer that maps [vmin, vmax] to the default range [1, 255]
   * @param vmin the lower clamp bound
   * @param vmax the upper clamp bound
   * @throws InvalidRangeException if vmax &le; vmin or any of them is not finite
   */
  public ValueNormalizer(double vmin, double vmax) throws InvalidRangeException {
    this(vmin, vmax, 1, 255);
  }

  public ValueNormalizer(double vmin, double vmax, int lo, int hi) throws InvalidRangeException {
    if (!Double.isFinite(vmin) || !Double.isFinite(vmax))
      throw new InvalidRangeException(String.format("Clamp range [%s, %s] must be finite", vmin, vmax));
    if (vmax <= vmin)
      throw new InvalidRangeException(String.format("Clamp maximum %s must be greater than clamp minimum %s",
          vmax, vmin));
    checkOutputRange(lo, hi);
    this.vmin = vmin;
    this.vmax = vmax;
    this.lo = lo;
    this.hi = hi;
  }

  public double getClampMin() {
    return vmin;
  }

  public double getClampMax() {
    return vmax;
  }

  public int getLo() {
    return lo;
  }

  public int getHi() {
    return hi;
  }

  /**
   * Checks that [lo, hi] is a usable output range
   * @param lo the lowest normalized value
   * @param hi the highest normalized value
   * @throws InvalidRangeException if the range is empty or contains {@link #NoDataSentinel}
   */
  public static void checkOutputRange(int lo, int hi) throws InvalidRangeException {
    if (hi <= lo)
      throw new InvalidRangeException(String.format("Output range [%d, %d] is empty", lo, hi));
    if (lo <= NoDataSentinel && NoDataSentinel <= hi)
      throw new InvalidRangeException(String.format("Output range [%d, %d] contains the no-data sentinel %d",
          lo, hi, NoDataSentinel));
  }

  /**
   * Normalizes a single value
   * @param v the raw value
   * @param noData the no-data value of the band or NaN if none
   * @return the normalized value in [lo, hi] or the sentinel if v carries no data
   */
  public int normalize(double v, double noData) {
    if (!Double.isFinite(v) || v == noData)
      return NoDataSentinel;
    double clamped = Math.max(vmin, Math.min(vmax, v));
    return (int) Math.round(lo + (clamped - vmin) / (vmax - vmin) * (hi - lo));
  }

  /**
   * Normalizes one band of the given raster into a new raster. Rows are processed in parallel blocks
   * if an executor is given.
   * @param raster the source raster
   * @param band the index of the band to normalize
   * @param executor the executor to run the row blocks on or {@code null} to run in the calling thread
   * @return a new single-band raster with the same grid as the source
   * @throws InvalidRangeException if the band index is out of range
   * @throws IOException if interrupted while waiting for the parallel blocks
   */
  public NormalizedRaster normalize(GridRaster raster, int band, ExecutorService executor)
      throws InvalidRangeException, IOException {
    if (band < 0 || band >= raster.getNumBands())
      throw new InvalidRangeException(String.format("Band #%d does not exist in a raster with %d band(s)",
          band, raster.getNumBands()));
    LOG.info(String.format("Normalizing band #%d from [%s, %s] to [%d, %d]", band, vmin, vmax, lo, hi));
    final int width = raster.getWidth();
    final double[] values = raster.getBand(band);
    final double noData = raster.getNoData(band);
    final int[] normalized = new int[values.length];
    ParallelUtil.forEachRowBlock(executor, raster.getHeight(), RowsPerBlock, (row1, row2) -> {
      for (int i = row1 * width; i < row2 * width; i++)
        normalized[i] = normalize(values[i], noData);
    });
    return new NormalizedRaster(raster.getMetadata(), normalized, lo, hi);
  }
}
