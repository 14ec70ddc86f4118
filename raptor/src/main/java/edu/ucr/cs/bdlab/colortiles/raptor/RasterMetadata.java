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

import org.locationtech.jts.geom.Envelope;

import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.geom.Point2D;

/**
 * Describes the grid of a raster: its size in pixels, the affine transformation from grid (pixel) space to
 * model (world) space, and the identifier of the coordinate reference system of the model space.
 * Pixel (col, row) covers the grid square [col, col+1) x [row, row+1); its center is at (col+0.5, row+0.5).
 */
public class RasterMetadata {
  /**Width of the raster in pixels*/
  private final int width;

  /**Height of the raster in pixels*/
  private final int height;

  /**Transforms a point from grid space to model space*/
  private final AffineTransform g2m;

  /**Transforms a point from model space to grid space*/
  private final AffineTransform m2g;

  /**The identifier of the coordinate reference system, e.g., EPSG:4326, or null if unknown*/
  private final String crs;

  public RasterMetadata(int width, int height, AffineTransform g2m, String crs) {
    if (width <= 0 || height <= 0)
      throw new IllegalArgumentException(String.format("Invalid raster size %dx%d", width, height));
    this.width = width;
    this.height = height;
    this.g2m = new AffineTransform(g2m);
    try {
      this.m2g = g2m.createInverse();
    } catch (NoninvertibleTransformException e) {
      throw new IllegalArgumentException("Grid to model transformation is not invertible " + g2m, e);
    }
    this.crs = crs;
  }

  /**
   * Creates the metadata of a north-up raster with the given top-left corner and pixel size.
   * @param width the width of the raster in pixels
   * @param height the height of the raster in pixels
   * @param x1 the model x-coordinate of the left edge
   * @param y2 the model y-coordinate of the top edge
   * @param pixelWidth the width of each pixel in model units
   * @param pixelHeight the height of each pixel in model units (positive)
   * @param crs the identifier of the coordinate reference system
   * @return the created metadata
   */
  public static RasterMetadata northUp(int width, int height, double x1, double y2,
                                       double pixelWidth, double pixelHeight, String crs) {
    return new RasterMetadata(width, height, new AffineTransform(pixelWidth, 0, 0, -pixelHeight, x1, y2), crs);
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public String getCRS() {
    return crs;
  }

  /**
   * Returns a copy of the grid to model transformation
   * @return a new transform object
   */
  public AffineTransform getGridToModel() {
    return new AffineTransform(g2m);
  }

  /**
   * Whether the grid is aligned with the model axes, i.e., no rotation or shear, and rows go from north to south.
   * @return {@code true} if the raster is north-up
   */
  public boolean isNorthUp() {
    return g2m.getShearX() == 0 && g2m.getShearY() == 0 && g2m.getScaleX() > 0 && g2m.getScaleY() < 0;
  }

  public double getPixelWidth() {
    return Math.hypot(g2m.getScaleX(), g2m.getShearY());
  }

  public double getPixelHeight() {
    return Math.hypot(g2m.getShearX(), g2m.getScaleY());
  }

  /**
   * Converts a point from grid space to model space
   * @param gx the x-coordinate in the grid, i.e., fractional column
   * @param gy the y-coordinate in the grid, i.e., fractional row
   * @param out (output) the model coordinates
   */
  public void gridToModel(double gx, double gy, Point2D.Double out) {
    out.x = g2m.getScaleX() * gx + g2m.getShearX() * gy + g2m.getTranslateX();
    out.y = g2m.getShearY() * gx + g2m.getScaleY() * gy + g2m.getTranslateY();
  }

  /**
   * Converts a point from model space to grid space
   * @param mx the x-coordinate in the model space
   * @param my the y-coordinate in the model space
   * @param out (output) the fractional column and row in the grid
   */
  public void modelToGrid(double mx, double my, Point2D.Double out) {
    out.x = m2g.getScaleX() * mx + m2g.getShearX() * my + m2g.getTranslateX();
    out.y = m2g.getShearY() * mx + m2g.getScaleY() * my + m2g.getTranslateY();
  }

  /**
   * The minimum bounding rectangle of the raster in model space
   * @return a new envelope that covers all pixels
   */
  public Envelope getEnvelope() {
    Envelope envelope = new Envelope();
    Point2D.Double corner = new Point2D.Double();
    for (int i = 0; i < 4; i++) {
      gridToModel((i & 1) * width, (i >> 1) * height, corner);
      envelope.expandToInclude(corner.x, corner.y);
    }
    return envelope;
  }

  /**
   * Returns the metadata of a window of this raster. The returned metadata shares the same model space.
   * @param col1 the first column of the window
   * @param row1 the first row of the window
   * @param windowWidth the width of the window in pixels
   * @param windowHeight the height of the window in pixels
   * @return the metadata of the window
   */
  public RasterMetadata window(int col1, int row1, int windowWidth, int windowHeight) {
    AffineTransform t = new AffineTransform(g2m);
    t.translate(col1, row1);
    return new RasterMetadata(windowWidth, windowHeight, t, crs);
  }

  /**
   * Whether the given metadata describes exactly the same grid as this one.
   * @param other the other metadata
   * @return {@code true} if both rasters have the same size and grid to model transformation
   */
  public boolean isSameGrid(RasterMetadata other) {
    return this.width == other.width && this.height == other.height && this.g2m.equals(other.g2m);
  }

  @Override
  public String toString() {
    return String.format("%dx%d pixels, CRS %s, extent %s", width, height, crs, getEnvelope());
  }
}
