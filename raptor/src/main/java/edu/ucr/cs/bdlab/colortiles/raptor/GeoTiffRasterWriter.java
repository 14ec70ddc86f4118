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
import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes rasters as GeoTIFF files. A colorized {@link ImageRaster} is written with four 8-bit bands and a
 * single-band {@link GridRaster} with one 32-bit floating-point band. North-up rasters are georeferenced
 * with a tie point and a pixel scale, other rasters with a model transformation. The coordinate reference system is
 * stored as an EPSG code in the GeoKey directory.
 */
public class GeoTiffRasterWriter {
  private static final Log LOG = LogFactory.getLog(GeoTiffRasterWriter.class);

  private static final String Compression = "Deflate";

  /**
   * Writes a colorized raster as a four-band 8-bit GeoTIFF
   * @param raster the raster to write
   * @param fs the file system to write to
   * @param path the path of the output file
   * @throws IOException if the file cannot be written
   */
  public void write(ImageRaster raster, FileSystem fs, Path path) throws IOException {
    writeImage(toABGR(raster), raster.getMetadata(), Double.NaN, fs, path);
    LOG.info(String.format("Wrote GeoTIFF '%s' %s", path, raster.getMetadata()));
  }

  /**
   * Writes a single-band raster as a 32-bit floating-point GeoTIFF. The no-data value of the band, if any,
   * is stored in the GDAL no-data tag.
   * @param raster the raster to write
   * @param fs the file system to write to
   * @param path the path of the output file
   * @throws IOException if the file cannot be written
   */
  public void write(GridRaster raster, FileSystem fs, Path path) throws IOException {
    if (raster.getNumBands() != 1)
      throw new IllegalArgumentException("Only single-band rasters can be written but found "
          + raster.getNumBands() + " bands");
    ComponentColorModel colorModel = new ComponentColorModel(ColorSpace.getInstance(ColorSpace.CS_GRAY),
        false, false, Transparency.OPAQUE, DataBuffer.TYPE_FLOAT);
    WritableRaster samples = colorModel.createCompatibleWritableRaster(raster.getWidth(), raster.getHeight());
    samples.setSamples(0, 0, raster.getWidth(), raster.getHeight(), 0, raster.getBand(0));
    BufferedImage image = new BufferedImage(colorModel, samples, false, null);
    writeImage(image, raster.getMetadata(), raster.getNoData(0), fs, path);
    LOG.info(String.format("Wrote GeoTIFF '%s' %s", path, raster.getMetadata()));
  }

  private static void writeImage(BufferedImage image, RasterMetadata metadata, double noData,
                                 FileSystem fs, Path path) throws IOException {
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("tiff");
    if (!writers.hasNext())
      throw new IOException("No TIFF encoder is available");
    ImageWriter writer = writers.next();
    try (FSDataOutputStream out = fs.create(path, true);
         ImageOutputStream ios = new MemoryCacheImageOutputStream(out)) {
      writer.setOutput(ios);
      ImageWriteParam param = writer.getDefaultWriteParam();
      param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
      param.setCompressionType(Compression);
      IIOMetadata defaultMetadata = writer.getDefaultImageMetadata(new ImageTypeSpecifier(image), param);
      TIFFDirectory directory = TIFFDirectory.createFromMetadata(defaultMetadata);
      addGeoTiffFields(directory, metadata);
      if (!Double.isNaN(noData)) {
        TIFFTag noDataTag = new TIFFTag("GDALNoData", GeoTiffMetadata.TIFFTAG_NODATA, 1 << TIFFTag.TIFF_ASCII);
        directory.addTIFFField(new TIFFField(noDataTag, TIFFTag.TIFF_ASCII, 1,
            new String[] {formatNoData(noData)}));
      }
      writer.write(null, new IIOImage(image, null, directory.getAsMetadata()), param);
    } finally {
      writer.dispose();
    }
  }

  private static String formatNoData(double noData) {
    return noData == Math.rint(noData) && Math.abs(noData) < 1E15 ? Long.toString((long) noData)
        : Double.toString(noData);
  }

  /**Copies the packed ARGB pixels into an image with interleaved bytes which is written as 4 samples per pixel*/
  private static BufferedImage toABGR(ImageRaster raster) {
    BufferedImage image = new BufferedImage(raster.getWidth(), raster.getHeight(), BufferedImage.TYPE_4BYTE_ABGR);
    image.setRGB(0, 0, raster.getWidth(), raster.getHeight(), raster.getPixels(), 0, raster.getWidth());
    return image;
  }

  static void addGeoTiffFields(TIFFDirectory directory, RasterMetadata metadata) {
    GeoTIFFTagSet tags = GeoTIFFTagSet.getInstance();
    AffineTransform g2m = metadata.getGridToModel();
    if (metadata.isNorthUp()) {
      double[] scale = {g2m.getScaleX(), -g2m.getScaleY(), 0};
      double[] tiePoint = {0, 0, 0, g2m.getTranslateX(), g2m.getTranslateY(), 0};
      directory.addTIFFField(new TIFFField(tags.getTag(GeoTiffMetadata.TAG_MODEL_PIXEL_SCALE),
          TIFFTag.TIFF_DOUBLE, scale.length, scale));
      directory.addTIFFField(new TIFFField(tags.getTag(GeoTiffMetadata.TAG_MODEL_TIE_POINT),
          TIFFTag.TIFF_DOUBLE, tiePoint.length, tiePoint));
    } else {
      double[] matrix = {
          g2m.getScaleX(), g2m.getShearX(), 0, g2m.getTranslateX(),
          g2m.getShearY(), g2m.getScaleY(), 0, g2m.getTranslateY(),
          0, 0, 0, 0,
          0, 0, 0, 1
      };
      directory.addTIFFField(new TIFFField(tags.getTag(GeoTiffMetadata.TAG_MODEL_TRANSFORMATION),
          TIFFTag.TIFF_DOUBLE, matrix.length, matrix));
    }
    char[] geoKeys = encodeGeoKeys(metadata.getCRS());
    directory.addTIFFField(new TIFFField(tags.getTag(GeoTiffMetadata.TAG_GEO_KEY_DIRECTORY),
        TIFFTag.TIFF_SHORT, geoKeys.length, geoKeys));
  }

  /**
   * Encodes the GeoKey directory for the given coordinate reference system
   * @param crs the identifier of the coordinate system or null if unknown
   * @return the values of the GeoKeyDirectoryTag
   */
  static char[] encodeGeoKeys(String crs) {
    Map<Integer, Integer> keys = new TreeMap<>();
    keys.put(GeoTiffMetadata.KEY_GT_RASTER_TYPE, GeoTiffMetadata.RASTER_PIXEL_IS_AREA);
    int epsg = epsgCode(crs);
    if (epsg > 0) {
      if (PointTransforms.isWGS84(crs) || isGeographicCode(epsg)) {
        keys.put(GeoTiffMetadata.KEY_GT_MODEL_TYPE, GeoTiffMetadata.MODEL_TYPE_GEOGRAPHIC);
        keys.put(GeoTiffMetadata.KEY_GEOGRAPHIC_TYPE, epsg);
      } else {
        keys.put(GeoTiffMetadata.KEY_GT_MODEL_TYPE, GeoTiffMetadata.MODEL_TYPE_PROJECTED);
        keys.put(GeoTiffMetadata.KEY_PROJECTED_CS_TYPE, epsg);
      }
    }
    char[] values = new char[4 + 4 * keys.size()];
    // Version 1.1.0
    values[0] = 1;
    values[1] = 1;
    values[2] = 0;
    values[3] = (char) keys.size();
    int i = 4;
    for (Map.Entry<Integer, Integer> key : keys.entrySet()) {
      values[i++] = (char) key.getKey().intValue();
      values[i++] = 0;
      values[i++] = 1;
      values[i++] = (char) key.getValue().intValue();
    }
    return values;
  }

  /**
   * Extracts the numeric code of an EPSG identifier
   * @param crs an identifier such as "EPSG:3857"
   * @return the code or -1 if the identifier is not an EPSG code
   */
  static int epsgCode(String crs) {
    if (crs == null)
      return -1;
    String name = PointTransforms.canonicalName(crs);
    if (!name.startsWith("EPSG:"))
      return -1;
    try {
      int code = Integer.parseInt(name.substring(5));
      return code > 0 && code < 65535 ? code : -1;
    } catch (NumberFormatException e) {
      LOG.warn(String.format("Cannot encode coordinate reference system '%s' in the GeoTIFF keys", crs));
      return -1;
    }
  }

  /**Geographic 2D systems in the EPSG registry occupy the range [4000, 5000)*/
  private static boolean isGeographicCode(int epsg) {
    return epsg >= 4000 && epsg < 5000;
  }
}
