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

import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;
import org.locationtech.proj4j.ProjectionException;

import java.awt.geom.Point2D;
import java.util.Locale;

/**
 * Creates {@link PointTransform}s between coordinate reference systems identified by names such as "EPSG:4326".
 * Transformations between WGS84 and web mercator are computed with closed-form formulas. Any other pair is
 * handled by proj4j.
 */
public final class PointTransforms {
  private PointTransforms() {}

  private static final CRSFactory crsFactory = new CRSFactory();

  private static final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();

  /**
   * Normalizes the name of well-known systems so that aliases compare equal
   * @param crs the name of the coordinate reference system
   * @return the canonical name
   */
  public static String canonicalName(String crs) {
    String name = crs.trim().toUpperCase(Locale.ROOT);
    switch (name) {
      case "CRS:84":
      case "WGS84":
      case "EPSG:4326":
        return WebMercator.GeographicCRS;
      case "EPSG:3857":
      case "EPSG:3785":
      case "EPSG:900913":
      case "EPSG:102100":
      case "EPSG:102113":
        return WebMercator.CRS;
      default:
        return name;
    }
  }

  public static boolean isWGS84(String crs) {
    return crs != null && canonicalName(crs).equals(WebMercator.GeographicCRS);
  }

  public static boolean isWebMercator(String crs) {
    return crs != null && canonicalName(crs).equals(WebMercator.CRS);
  }

  /**
   * Creates a transformation between the given systems
   * @param sourceCRS the name of the source system
   * @param targetCRS the name of the target system
   * @return a new transformation
   * @throws ReprojectionException if any of the systems is undefined or unknown
   */
  public static PointTransform create(String sourceCRS, String targetCRS) throws ReprojectionException {
    if (sourceCRS == null)
      throw new ReprojectionException("Source raster has no coordinate reference system");
    if (targetCRS == null)
      throw new ReprojectionException("Target coordinate reference system is not defined");
    String source = canonicalName(sourceCRS);
    String target = canonicalName(targetCRS);
    if (source.equals(target))
      return (x, y, out) -> out.setLocation(x, y);
    if (source.equals(WebMercator.GeographicCRS) && target.equals(WebMercator.CRS)) {
      return (x, y, out) -> {
        double my = WebMercator.latToY(y);
        if (Double.isNaN(my))
          out.setLocation(Double.NaN, Double.NaN);
        else
          out.setLocation(WebMercator.lonToX(x), my);
      };
    }
    if (source.equals(WebMercator.CRS) && target.equals(WebMercator.GeographicCRS))
      return (x, y, out) -> out.setLocation(WebMercator.xToLon(x), WebMercator.yToLat(y));
    return new Proj4jTransform(decode(source), decode(target));
  }

  private static CoordinateReferenceSystem decode(String name) throws ReprojectionException {
    try {
      return crsFactory.createFromName(name);
    } catch (RuntimeException e) {
      throw new ReprojectionException(String.format("Unknown coordinate reference system '%s'", name), e);
    }
  }

  /**A transformation delegated to proj4j*/
  static class Proj4jTransform implements PointTransform {
    private final CoordinateTransform transform;
    private final ProjCoordinate src = new ProjCoordinate();
    private final ProjCoordinate dst = new ProjCoordinate();

    Proj4jTransform(CoordinateReferenceSystem source, CoordinateReferenceSystem target)
        throws ReprojectionException {
      try {
        this.transform = transformFactory.createTransform(source, target);
      } catch (RuntimeException e) {
        throw new ReprojectionException(String.format("Cannot transform from %s to %s",
            source.getName(), target.getName()), e);
      }
    }

    @Override
    public void transform(double x, double y, Point2D.Double out) {
      src.x = x;
      src.y = y;
      try {
        transform.transform(src, dst);
        out.setLocation(dst.x, dst.y);
      } catch (ProjectionException e) {
        // Outside the domain of the projection
        out.setLocation(Double.NaN, Double.NaN);
      }
    }
  }
}
