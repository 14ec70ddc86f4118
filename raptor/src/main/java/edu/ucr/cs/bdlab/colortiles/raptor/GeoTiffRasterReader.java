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

import edu.ucr.cs.bdlab.colortiles.common.InputException;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.fs.FSDataInputStream;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFImageReadParam;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.MemoryCacheImageInputStream;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;

/**
 * Reads the first image of a GeoTIFF file into a {@link GridRaster}. All bands are read as double values.
 * The GDAL no-data tag, if present, applies to all bands.
 */
public class GeoTiffRasterReader {
  private static final Log LOG = LogFactory.getLog(GeoTiffRasterReader.class);

  /**The name of this stage in error messages*/
  public static final String StageName = "read";

  /**
   * Reads the raster at the given path
   * @param fs the file system that contains the file
   * @param path the path of the GeoTIFF file
   * @return the raster with all its bands
   * @throws InputException if the file does not exist, cannot be decoded, or has no usable georeferencing
   */
  public GridRaster read(FileSystem fs, Path path) throws InputException {
    ImageReader reader = createTiffReader(path);
    try (FSDataInputStream in = fs.open(path); ImageInputStream iis = new MemoryCacheImageInputStream(in)) {
      reader.setInput(iis);
      TIFFImageReadParam param = new TIFFImageReadParam();
      // The GDAL no-data tag is not part of any tag set known to ImageIO
      param.setReadUnknownTags(true);
      BufferedImage image = reader.read(0, param);
      GeoTiffMetadata geoTiff = new GeoTiffMetadata(TIFFDirectory.createFromMetadata(reader.getImageMetadata(0)));
      RasterMetadata metadata = new RasterMetadata(image.getWidth(), image.getHeight(),
          geoTiff.getGridToModel(), geoTiff.getCRS());
      Raster raster = image.getRaster();
      int numBands = raster.getNumBands();
      CellType cellType = CellType.fromDataBufferType(raster.getDataBuffer().getDataType());
      double[][] bands = new double[numBands][];
      CellType[] cellTypes = new CellType[numBands];
      double[] noData = new double[numBands];
      Arrays.fill(cellTypes, cellType);
      double declaredNoData = geoTiff.getNoData();
      // Cells are widened to double so the no-data value must be rounded the same way to match them
      Arrays.fill(noData, cellType.toCellValue(declaredNoData));
      if (!Double.isNaN(declaredNoData) && Double.isNaN(noData[0]))
        LOG.warn(String.format("No-data value %s cannot be stored in %s cells of '%s', ignoring it",
            declaredNoData, cellType, path));
      for (int b = 0; b < numBands; b++)
        bands[b] = raster.getSamples(raster.getMinX(), raster.getMinY(), image.getWidth(), image.getHeight(), b,
            (double[]) null);
      LOG.info(String.format("Read raster '%s' with %d band(s) of type %s, no-data %s, %s",
          path, numBands, cellType, noData[0], metadata));
      return new GridRaster(metadata, bands, cellTypes, noData);
    } catch (FileNotFoundException e) {
      throw new InputException(StageName, path.toString(), "raster file not found", e);
    } catch (GeoTiffException e) {
      LOG.debug("Invalid GeoTIFF tags in " + path, e);
      throw new InputException(StageName, path.toString(), e.getShortMessage(), e);
    } catch (IOException e) {
      throw new InputException(StageName, path.toString(), "cannot read raster: " + e.getMessage(), e);
    } catch (IllegalArgumentException e) {
      throw new InputException(StageName, path.toString(), "unsupported raster layout: " + e.getMessage(), e);
    } finally {
      reader.dispose();
    }
  }

  private static ImageReader createTiffReader(Path path) throws InputException {
    Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("tiff");
    if (!readers.hasNext())
      throw new InputException(StageName, path.toString(), "no TIFF decoder is available");
    return readers.next();
  }
}
