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
 * Resamples an RGBA raster into a target grid that may use another coordinate reference system.
 */
public interface RasterWarper {
  /**
   * Computes every pixel of the target grid from the source raster. Target pixels that fall outside the source
   * raster or map to transparent source pixels are transparent.
   * @param source the source raster
   * @param target the grid of the result
   * @param resampling how the source pixels are sampled
   * @return a new raster with the target grid
   * @throws ReprojectionException if the coordinate systems are not defined or cannot be transformed
   */
  ImageRaster warp(ImageRaster source, RasterMetadata target, Resampling resampling) throws ReprojectionException;
}
