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
package edu.ucr.cs.bdlab.colortiles.davinci;

import edu.ucr.cs.bdlab.colortiles.common.ColorTilesOptions;
import edu.ucr.cs.bdlab.colortiles.util.OperationParam;
import edu.ucr.cs.bdlab.colortiles.util.ParallelUtil;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.Text;
import org.apache.hadoop.util.LineReader;

import java.awt.image.BufferedImage;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

/**
 * Writes the tiles of a pyramid in the {z}/{x}/{y}.ext layout along with the files that describe the pyramid.
 */
public class TilePyramidWriter {
  private static final Log LOG = LogFactory.getLog(TilePyramidWriter.class);

  /**The name of this stage in error messages*/
  public static final String StageName = "write";

  @OperationParam(
      description = "The image format of the tiles {png, jpg}",
      defaultValue = "png"
  )
  public static final String OutputFormat = "outputFormat";

  @OperationParam(
      description = "Number tile rows from the bottom (TMS) instead of the top (XYZ)",
      defaultValue = "false"
  )
  public static final String TMS = "tms";

  @OperationParam(
      description = "Write an HTML page that displays the tiles",
      defaultValue = "false"
  )
  public static final String Viewer = "viewer";

  /**The name of the file that stores the options used to generate the tiles*/
  public static final String PropertiesFileName = "_visualization.properties";

  /**The name of the HTML page that displays the tiles*/
  public static final String ViewerFileName = "index.html";

  /**Number of times a tile write is attempted before giving up*/
  private static final int MaxAttempts = 2;

  private final ImageOutputFormat format;

  private final boolean tms;

  public TilePyramidWriter(ImageOutputFormat format, boolean tms) {
    this.format = format;
    this.tms = tms;
  }

  public ImageOutputFormat getFormat() {
    return format;
  }

  /**
   * The path of a tile under the given directory
   * @param dir the root directory of the pyramid
   * @param z the zoom level of the tile
   * @param x the column of the tile
   * @param y the row of the tile counted from the top
   * @return the path of the tile image
   */
  public Path getTilePath(Path dir, int z, int x, int y) {
    TileIndex index = new TileIndex(z, x, y);
    if (tms)
      index.flipRow();
    return new Path(new Path(new Path(dir, Integer.toString(index.z)), Integer.toString(index.x)),
        index.y + format.getExtension());
  }

  /**
   * Writes all tiles of the pyramid
   * @param pyramid the pyramid to write
   * @param fs the file system to write to
   * @param dir the root directory of the pyramid
   * @param executor the executor that writes the tiles or {@code null} to write them sequentially
   * @return the number of tiles written
   * @throws IOException if any tile cannot be written after retrying
   */
  public int writeTiles(TilePyramid pyramid, FileSystem fs, Path dir, ExecutorService executor) throws IOException {
    ZoomRange zoomRange = pyramid.getZoomRange();
    LOG.info(String.format("Writing %d tiles as %s to '%s'", pyramid.getNumTiles(), format, dir));
    List<Callable<Void>> tasks = new ArrayList<>();
    for (int z = zoomRange.min; z <= zoomRange.max; z++) {
      for (Tile tile : pyramid.getTiles(z)) {
        tasks.add(() -> {
          writeTile(tile, fs, dir);
          return null;
        });
      }
    }
    ParallelUtil.invokeAll(executor, tasks);
    return tasks.size();
  }

  /**
   * Writes a single tile. A failed write is retried once.
   * @param tile the tile to write
   * @param fs the file system to write to
   * @param dir the root directory of the pyramid
   * @throws IOException if the second attempt fails
   */
  void writeTile(Tile tile, FileSystem fs, Path dir) throws IOException {
    Path tilePath = getTilePath(dir, tile.getZ(), tile.getX(), tile.getY());
    for (int attempt = 1; ; attempt++) {
      try {
        writeImage(tile.getImage(), fs, tilePath);
        LOG.debug(String.format("Wrote %s to '%s'", tile, tilePath));
        return;
      } catch (IOException e) {
        if (attempt >= MaxAttempts)
          throw new IOException(String.format("Cannot write %s to '%s'", tile, tilePath), e);
        LOG.warn(String.format("Failed to write %s to '%s', retrying", tile, tilePath), e);
      }
    }
  }

  protected void writeImage(BufferedImage image, FileSystem fs, Path path) throws IOException {
    try (FSDataOutputStream out = fs.create(path, true)) {
      format.write(image, out);
    }
  }

  /**
   * Writes some additional files that help visualizing the pyramid, i.e., the options used to generate it and,
   * optionally, an HTML page that displays it using OpenLayers.
   * @param fs the file system that contains the pyramid
   * @param dir the root directory of the pyramid
   * @param pyramid the pyramid that was written
   * @param opts the user options that need to be stored
   * @param viewer whether to write the HTML page
   * @throws IOException if an error happens while writing the files
   */
  public void writeAddOnFiles(FileSystem fs, Path dir, TilePyramid pyramid, ColorTilesOptions opts, boolean viewer)
      throws IOException {
    opts.storeToTextFile(fs, new Path(dir, PropertiesFileName));
    if (!viewer)
      return;
    String templateFile = "/zoom_view.html";
    InputStream templateIn = TilePyramidWriter.class.getResourceAsStream(templateFile);
    if (templateIn == null)
      throw new FileNotFoundException("Template not found " + templateFile);
    ZoomRange zoomRange = pyramid.getZoomRange();
    LineReader templateFileReader = new LineReader(templateIn);
    PrintStream htmlOut = new PrintStream(fs.create(new Path(dir, ViewerFileName)), false, StandardCharsets.UTF_8.name());
    try {
      Text line = new Text();
      while (templateFileReader.readLine(line) > 0) {
        String lineStr = line.toString();
        lineStr = lineStr.replace("#{TILE_SIZE}", Integer.toString(pyramid.getTileSize()));
        lineStr = lineStr.replace("#{MAX_ZOOM}", Integer.toString(zoomRange.max));
        lineStr = lineStr.replace("#{MIN_ZOOM}", Integer.toString(zoomRange.min));
        lineStr = lineStr.replace("#{TILE_URL}", (tms ? "{z}/{x}/{-y}" : "{z}/{x}/{y}") + format.getExtension());
        htmlOut.println(lineStr);
      }
    } finally {
      templateFileReader.close();
      htmlOut.close();
    }
  }
}
