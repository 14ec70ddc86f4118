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
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.locationtech.jts.geom.Envelope;

import java.awt.geom.Point2D;

/**
 * Clips an RGBA raster to the latitudes that web mercator can represent and reprojects it to web mercator.
 * The alpha channel is carried through both steps by the {@link RasterWarper}.
 */
public class Reprojector {
  private static final Log LOG = LogFactory.getLog(Reprojector.class);

  /**The name of this stage in error messages*/
  public static final String StageName = "reproject";

  @OperationParam(
      description = "The resampling used when warping the colorized raster {nearest, bilinear}",
      defaultValue = "nearest"
  )
  public static final String WarpResampling = "warpResampling";

  /**Tolerance in degrees when comparing pixel centers to the safe bounds*/
  private static final double Epsilon = 1E-9;

  /**Number of intervals along each axis of the grid of points used to estimate a target extent*/
  private static final int SampleIntervals = 20;

  /**Largest number of pixels allowed in a target grid*/
  private static final long MaxPixels = Integer.MAX_VALUE - 8;

  private final RasterWarper warper;

  private final Resampling resampling;

  public Reprojector() {
    this(new InverseMappingWarper(), Resampling.NEAREST);
  }

  public Reprojector(RasterWarper warper, Resampling resampling) {
    this.warper = warper;
    this.resampling = resampling;
  }

  /**
   * Clips the given raster to the mercator-safe bounds in geographic coordinates.
   * A north-up WGS84 raster is cropped to the rows and columns whose centers lie within the bounds, inclusive.
   * A raster in any other system is first warped to WGS84 over the safe bounds.
   * @param raster the colorized raster
   * @return a raster in EPSG:4326 that lies within the safe bounds
   * @throws ReprojectionException if the raster has no coordinate system or does not overlap the safe bounds
   */
  public ImageRaster clipToSafeBounds(ImageRaster raster) throws ReprojectionException {
    RasterMetadata metadata = raster.getMetadata();
    if (metadata.getCRS() == null)
      throw new ReprojectionException("Source raster has no coordinate reference system");
    Envelope safe = WebMercator.safeBounds();
    if (PointTransforms.isWGS84(metadata.getCRS()) && metadata.isNorthUp()) {
      Point2D.Double center = new Point2D.Double();
      int col1 = -1, col2 = -1;
      for (int col = 0; col < metadata.getWidth(); col++) {
        metadata.gridToModel(col + 0.5, 0.5, center);
        if (center.x >= safe.getMinX() - Epsilon && center.x <= safe.getMaxX() + Epsilon) {
          if (col1 == -1)
            col1 = col;
          col2 = col;
        }
      }
      int row1 = -1, row2 = -1;
      for (int row = 0; row < metadata.getHeight(); row++) {
        metadata.gridToModel(0.5, row + 0.5, center);
        if (center.y >= safe.getMinY() - Epsilon && center.y <= safe.getMaxY() + Epsilon) {
          if (row1 == -1)
            row1 = row;
          row2 = row;
        }
      }
      if (col1 == -1 || row1 == -1)
        throw new ReprojectionException(String.format("Raster with extent %s does not overlap the bounds %s",
            metadata.getEnvelope(), safe));
      int width = col2 - col1 + 1;
      int height = row2 - row1 + 1;
      if (width == metadata.getWidth() && height == metadata.getHeight())
        return raster;
      LOG.info(String.format("Clipping raster to columns [%d, %d] and rows [%d, %d]", col1, col2, row1, row2));
      ImageRaster clipped = new ImageRaster(metadata.window(col1, row1, width, height));
      int[] src = raster.getPixels();
      int[] dst = clipped.getPixels();
      for (int row = 0; row < height; row++)
        System.arraycopy(src, (row1 + row) * metadata.getWidth() + col1, dst, row * width, width);
      return clipped;
    }
    RasterMetadata geographic = suggestGrid(metadata, WebMercator.GeographicCRS, safe, Double.NaN, false);
    LOG.info(String.format("Warping raster from %s to %s", metadata.getCRS(), geographic));
    return warper.warp(raster, geographic, resampling);
  }

  /**
   * Reprojects a raster in geographic coordinates to web mercator.
   * @param geographic a raster in EPSG:4326 within the mercator-safe bounds
   * @param resolution the target pixel size in meters or NaN to estimate it from the source
   * @param alignToResolution whether to snap the target extent to multiples of the resolution
   * @return the reprojected raster
   * @throws ReprojectionException if the target grid cannot be computed
   */
  public ImageRaster toMercator(ImageRaster geographic, double resolution, boolean alignToResolution)
      throws ReprojectionException {
    RasterMetadata mercator = suggestGrid(geographic.getMetadata(), WebMercator.CRS, WebMercator.worldBounds(),
        resolution, alignToResolution);
    LOG.info(String.format("Reprojecting raster to %s", mercator));
    return warper.warp(geographic, mercator, resampling);
  }

  /**
   * Clips the raster to the safe bounds and then reprojects it to web mercator
   * @param raster the colorized and masked raster
   * @param resolution the target pixel size in meters or NaN to estimate it from the source
   * @param alignToResolution whether to snap the target extent to multiples of the resolution
   * @return the raster in web mercator
   * @throws ReprojectionException if any of the two steps fails
   */
  public ImageRaster reproject(ImageRaster raster, double resolution, boolean alignToResolution)
      throws ReprojectionException {
    return toMercator(clipToSafeBounds(raster), resolution, alignToResolution);
  }

  /**
   * Computes a north-up target grid that covers the source raster after transformation.
   * The extent is estimated by transforming a regular grid of points over the source raster.
   * @param source the grid of the source raster
   * @param targetCRS the target coordinate reference system
   * @param clip an optional extent in target coordinates to intersect the result with
   * @param resolution the pixel size in target units or NaN to keep the same number of pixels on the diagonal
   * @param alignToResolution snap the extent to integer multiples of the resolution
   * @return the target grid
   * @throws ReprojectionException if the target grid is empty or the systems are not defined
   */
  public static RasterMetadata suggestGrid(RasterMetadata source, String targetCRS, Envelope clip,
                                           double resolution, boolean alignToResolution)
      throws ReprojectionException {
    PointTransform transform = PointTransforms.create(source.getCRS(), targetCRS);
    Envelope extent = new Envelope();
    Point2D.Double point = new Point2D.Double();
    for (int i = 0; i <= SampleIntervals; i++) {
      for (int j = 0; j <= SampleIntervals; j++) {
        source.gridToModel((double) i * source.getWidth() / SampleIntervals,
            (double) j * source.getHeight() / SampleIntervals, point);
        transform.transform(point.x, point.y, point);
        if (Double.isFinite(point.x) && Double.isFinite(point.y))
          extent.expandToInclude(point.x, point.y);
      }
    }
    if (clip != null)
      extent = extent.intersection(clip);
    if (extent.isNull() || extent.getWidth() <= 0 || extent.getHeight() <= 0)
      throw new ReprojectionException(String.format("Raster %s has an empty extent in %s", source, targetCRS));
    if (Double.isNaN(resolution)) {
      double sourceDiagonal = Math.hypot(source.getWidth(), source.getHeight());
      resolution = Math.hypot(extent.getWidth(), extent.getHeight()) / sourceDiagonal;
    }
    if (!(resolution > 0) || Double.isInfinite(resolution))
      throw new ReprojectionException("Invalid target resolution " + resolution);
    double x1 = extent.getMinX(), y1 = extent.getMinY(), x2 = extent.getMaxX(), y2 = extent.getMaxY();
    long width, height;
    if (alignToResolution) {
      long i1 = (long) Math.floor(x1 / resolution + Epsilon);
      long i2 = (long) Math.ceil(x2 / resolution - Epsilon);
      long j1 = (long) Math.floor(y1 / resolution + Epsilon);
      long j2 = (long) Math.ceil(y2 / resolution - Epsilon);
      x1 = i1 * resolution;
      y2 = j2 * resolution;
      width = i2 - i1;
      height = j2 - j1;
    } else {
      width = (long) Math.ceil((x2 - x1) / resolution - Epsilon);
      height = (long) Math.ceil((y2 - y1) / resolution - Epsilon);
    }
    width = Math.max(1, width);
    height = Math.max(1, height);
    if (width * height > MaxPixels)
      throw new ReprojectionException(String.format("Target grid of %dx%d pixels is too large", width, height));
    return RasterMetadata.northUp((int) width, (int) height, x1, y2, resolution, resolution, targetCRS);
  }
}
