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

/**
 * Constants and formulas of the spherical (web) mercator projection, EPSG:3857.
 */
public final class WebMercator {
  private WebMercator() {}

  /**The radius of the sphere in meters*/
  public static final double Radius = 6378137.0;

  /**Half the width of the world in projected meters, i.e., the x-coordinate of longitude 180*/
  public static final double HalfWorld = Math.PI * Radius;

  /**The largest latitude (degrees) kept before projecting to mercator*/
  public static final double SafeLatitude = 85.05112878;

  /**The identifier of the mercator projection*/
  public static final String CRS = "EPSG:3857";

  /**The identifier of the geographic WGS84 coordinate system*/
  public static final String GeographicCRS = "EPSG:4326";

  /**
   * The geographic bounds that can be safely projected
   * @return a new envelope in degrees
   */
  public static Envelope safeBounds() {
    return new Envelope(-180, 180, -SafeLatitude, SafeLatitude);
  }

  /**
   * The square that covers the whole world in projected coordinates
   * @return a new envelope in meters
   */
  public static Envelope worldBounds() {
    return new Envelope(-HalfWorld, HalfWorld, -HalfWorld, HalfWorld);
  }

  /**
   * The size of one pixel in meters at the given zoom level
   * @param zoom the zoom level where level 0 covers the world in one tile
   * @param tileSize the width of one tile in pixels
   * @return the resolution in meters per pixel
   */
  public static double resolution(int zoom, int tileSize) {
    return 2 * HalfWorld / ((double) tileSize * (1L << zoom));
  }

  public static double lonToX(double lon) {
    return Math.toRadians(lon) * Radius;
  }

  /**
   * Projects a latitude to the y-coordinate
   * @param lat latitude in degrees
   * @return the projected y-coordinate or NaN for the poles and beyond
   */
  public static double latToY(double lat) {
    if (!(Math.abs(lat) < 90))
      return Double.NaN;
    return Math.log(Math.tan(Math.PI / 4 + Math.toRadians(lat) / 2)) * Radius;
  }

  public static double xToLon(double x) {
    return Math.toDegrees(x / Radius);
  }

  public static double yToLat(double y) {
    return Math.toDegrees(2 * Math.atan(Math.exp(y / Radius)) - Math.PI / 2);
  }
}
