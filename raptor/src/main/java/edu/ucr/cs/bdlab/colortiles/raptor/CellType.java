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

import java.awt.image.DataBuffer;

/**
 * The type of the cells in one band of a raster as stored in the input file.
 */
public enum CellType {
  BYTE, UINT16, INT16, INT32, FLOAT32, FLOAT64;

  /**
   * Maps a Java2D data buffer type to a cell type
   * @param dataBufferType one of the {@code DataBuffer.TYPE_*} constants
   * @return the corresponding cell type
   * @throws IllegalArgumentException if the type is not supported
   */
  public static CellType fromDataBufferType(int dataBufferType) {
    switch (dataBufferType) {
      case DataBuffer.TYPE_BYTE: return BYTE;
      case DataBuffer.TYPE_USHORT: return UINT16;
      case DataBuffer.TYPE_SHORT: return INT16;
      case DataBuffer.TYPE_INT: return INT32;
      case DataBuffer.TYPE_FLOAT: return FLOAT32;
      case DataBuffer.TYPE_DOUBLE: return FLOAT64;
      default: throw new IllegalArgumentException("Unsupported data buffer type " + dataBufferType);
    }
  }

  /**
   * Converts a no-data value to the precision of this cell type so it compares equal to the stored cells.
   * A value that integer cells cannot hold is dropped.
   * @param noData the declared no-data value or NaN if none
   * @return the value as it appears in cells of this type or NaN if no cell can have it
   */
  public double toCellValue(double noData) {
    if (Double.isNaN(noData))
      return Double.NaN;
    switch (this) {
      case FLOAT64: return noData;
      case FLOAT32: return (double) (float) noData;
      default:
        double rounded = Math.rint(noData);
        return rounded >= minValue() && rounded <= maxValue() ? rounded : Double.NaN;
    }
  }

  private double minValue() {
    switch (this) {
      case INT16: return Short.MIN_VALUE;
      case INT32: return Integer.MIN_VALUE;
      default: return 0;
    }
  }

  private double maxValue() {
    switch (this) {
      case BYTE: return 255;
      case UINT16: return 65535;
      case INT16: return Short.MAX_VALUE;
      default: return Integer.MAX_VALUE;
    }
  }

  public boolean isFloatingPoint() {
    return this == FLOAT32 || this == FLOAT64;
  }
}
