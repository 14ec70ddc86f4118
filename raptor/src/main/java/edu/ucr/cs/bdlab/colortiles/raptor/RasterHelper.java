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
import edu.ucr.cs.bdlab.colortiles.util.IOUtil;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import java.util.Locale;

public class RasterHelper {

  /**
   * Reads a raster file choosing the reader by the extension of the file
   * @param rasterFS the file system that contains the file
   * @param rasterFile the path of the raster file
   * @return the raster with all its bands
   * @throws InputException if the format is not recognized or the file cannot be read
   */
  public static GridRaster readRaster(FileSystem rasterFS, Path rasterFile) throws InputException {
    String extension = IOUtil.getExtension(rasterFile.getName());
    switch (extension == null ? "" : extension.toLowerCase(Locale.ROOT)) {
      case ".tif":
      case ".tiff":
      case ".geotiff":
        return new GeoTiffRasterReader().read(rasterFS, rasterFile);
      default:
        throw new InputException(GeoTiffRasterReader.StageName, rasterFile.toString(),
            String.format("Unrecognized extension '%s'", extension));
    }
  }
}
