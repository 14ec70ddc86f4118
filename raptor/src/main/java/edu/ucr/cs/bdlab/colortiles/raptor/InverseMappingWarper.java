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

import java.awt.geom.Point2D;

/**
 * A warper that maps the center of each target pixel back to the source grid and samples the source there.
 * Each target pixel is computed independently so the validity of a pixel never leaks into its neighbors.
 * The warp checks for thread interruption once per row so that a timed-out warp can be cancelled.
 */
public class InverseMappingWarper implements RasterWarper {
  private static final Log LOG = LogFactory.getLog(InverseMappingWarper.class);

  @Override
  public ImageRaster warp(ImageRaster source, RasterMetadata target, Resampling resampling)
      throws ReprojectionException {
    PointTransform targetToSource = PointTransforms.create(target.getCRS(), source.getMetadata().getCRS());
    LOG.debug(String.format("Warping %s into %s using %s", source.getMetadata(), target, resampling));
    ImageRaster result = new ImageRaster(target);
    int[] srcPixels = source.getPixels();
    int[] dstPixels = result.getPixels();
    int srcWidth = source.getWidth();
    int srcHeight = source.getHeight();
    RasterMetadata srcGrid = source.getMetadata();
    Point2D.Double point = new Point2D.Double();
    for (int row = 0; row < target.getHeight(); row++) {
      if (Thread.currentThread().isInterrupted())
        throw new ReprojectionException(String.format("Reprojection interrupted at row %d of %d",
            row, target.getHeight()));
      for (int col = 0; col < target.getWidth(); col++) {
        target.gridToModel(col + 0.5, row + 0.5, point);
        targetToSource.transform(point.x, point.y, point);
        if (Double.isNaN(point.x) || Double.isNaN(point.y))
          continue;
        srcGrid.modelToGrid(point.x, point.y, point);
        int argb;
        if (resampling == Resampling.BILINEAR)
          argb = sampleBilinear(srcPixels, srcWidth, srcHeight, point.x, point.y);
        else
          argb = sampleNearest(srcPixels, srcWidth, srcHeight, point.x, point.y);
        dstPixels[row * target.getWidth() + col] = argb;
      }
    }
    return result;
  }

  static int sampleNearest(int[] pixels, int width, int height, double gx, double gy) {
    int col = (int) Math.floor(gx);
    int row = (int) Math.floor(gy);
    if (col < 0 || row < 0 || col >= width || row >= height)
      return ImageRaster.Transparent;
    return pixels[row * width + col];
  }

  static int sampleBilinear(int[] pixels, int width, int height, double gx, double gy) {
    int nearest = sampleNearest(pixels, width, height, gx, gy);
    if (ImageRaster.alpha(nearest) == 0)
      return nearest;
    // Pixel centers are at half-integer grid coordinates
    double fx = gx - 0.5;
    double fy = gy - 0.5;
    int col0 = (int) Math.floor(fx);
    int row0 = (int) Math.floor(fy);
    double tx = fx - col0;
    double ty = fy - row0;
    double r = 0, g = 0, b = 0, totalWeight = 0;
    for (int dy = 0; dy <= 1; dy++) {
      for (int dx = 0; dx <= 1; dx++) {
        int col = col0 + dx;
        int row = row0 + dy;
        if (col < 0 || row < 0 || col >= width || row >= height)
          continue;
        int pixel = pixels[row * width + col];
        if (ImageRaster.alpha(pixel) == 0)
          continue;
        double weight = (dx == 0 ? 1 - tx : tx) * (dy == 0 ? 1 - ty : ty);
        r += weight * ((pixel >> 16) & 0xff);
        g += weight * ((pixel >> 8) & 0xff);
        b += weight * (pixel & 0xff);
        totalWeight += weight;
      }
    }
    if (totalWeight == 0)
      return nearest;
    int ir = (int) Math.round(r / totalWeight);
    int ig = (int) Math.round(g / totalWeight);
    int ib = (int) Math.round(b / totalWeight);
    return (nearest & 0xff000000) | (ir << 16) | (ig << 8) | ib;
  }
}
