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

/**
 * An in-memory raster of measurements with one or more bands. All bands share the grid described by the
 * {@link RasterMetadata}. Cell values are stored as doubles in row-major order regardless of the cell type
 * in the source file. Each band can declare a no-data value; {@link Double#NaN} means no value is declared.
 */
public class GridRaster {
  private final RasterMetadata metadata;

  /**The values of all bands. bands[b][row * width + col]*/
  private final double[][] bands;

  /**The cell type of each band in the source*/
  private final CellType[] cellTypes;

  /**The declared no-data value of each band or NaN if not declared*/
  private final double[] noData;

  /**
   * Creates a raster that takes ownership of the given arrays.
   * @param metadata the grid of the raster
   * @param bands the values of all the bands, each of size width x height
   * @param cellTypes the cell type of each band
   * @param noData the no-data value of each band or NaN if none
   */
  public GridRaster(RasterMetadata metadata, double[][] bands, CellType[] cellTypes, double[] noData) {
    if (bands.length == 0)
      throw new IllegalArgumentException("A raster must have at least one band");
    if (cellTypes.length != bands.length || noData.length != bands.length)
      throw new IllegalArgumentException("Number of cell types and no-data values must match the number of bands");
    int numPixels = metadata.getWidth() * metadata.getHeight();
    for (double[] band : bands) {
      if (band.length != numPixels)
        throw new IllegalArgumentException(String.format("Band size %d does not match the raster size %dx%d",
            band.length, metadata.getWidth(), metadata.getHeight()));
    }
    this.metadata = metadata;
    this.bands = bands;
    this.cellTypes = cellTypes;
    this.noData = noData;
  }

  /**
   * Creates a single-band floating-point raster
   * @param metadata the grid of the raster
   * @param values the values in row-major order
   * @param noData the no-data value or NaN if none
   * @return the created raster
   */
  public static GridRaster singleBand(RasterMetadata metadata, double[] values, double noData) {
    return new GridRaster(metadata, new double[][] {values}, new CellType[] {CellType.FLOAT64}, new double[] {noData});
  }

  public RasterMetadata getMetadata() {
    return metadata;
  }

  public int getWidth() {
    return metadata.getWidth();
  }

  public int getHeight() {
    return metadata.getHeight();
  }

  public int getNumBands() {
    return bands.length;
  }

  public CellType getCellType(int band) {
    return cellTypes[band];
  }

  /**
   * Returns the declared no-data value of the given band
   * @param band the band index
   * @return the no-data value or NaN if no value is declared
   */
  public double getNoData(int band) {
    return noData[band];
  }

  public boolean hasNoData(int band) {
    return !Double.isNaN(noData[band]);
  }

  public double getValue(int band, int col, int row) {
    return bands[band][row * metadata.getWidth() + col];
  }

  /**
   * Direct access to the values of one band. The returned array must not be modified.
   * @param band the band index
   * @return the values of the band in row-major order
   */
  double[] getBand(int band) {
    return bands[band];
  }

  /**
   * Whether the given value of the given band is a real measurement, i.e., finite and not the no-data value
   * @param band the band index
   * @param value the value to test
   * @return {@code true} if the value is valid
   */
  public boolean isValidValue(int band, double value) {
    return Double.isFinite(value) && value != noData[band];
  }
}
