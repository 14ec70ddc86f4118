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

import java.awt.geom.Point2D;

/**
 * Transforms points from one coordinate reference system to another. Implementations are not required to be
 * thread-safe.
 */
public interface PointTransform {
  /**
   * Transforms a single point
   * @param x the x-coordinate (longitude for geographic systems) in the source system
   * @param y the y-coordinate (latitude for geographic systems) in the source system
   * @param out (output) the transformed point, set to NaN if the point has no image in the target system
   */
  void transform(double x, double y, Point2D.Double out);
}
