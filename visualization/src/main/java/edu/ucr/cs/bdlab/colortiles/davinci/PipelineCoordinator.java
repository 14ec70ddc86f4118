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

import edu.ucr.cs.bdlab.colortiles.common.ColorTilesException;
import edu.ucr.cs.bdlab.colortiles.common.ColorTilesOptions;
import edu.ucr.cs.bdlab.colortiles.raptor.ColorMapReader;
import edu.ucr.cs.bdlab.colortiles.raptor.ColorRamp;
import edu.ucr.cs.bdlab.colortiles.raptor.Colorizer;
import edu.ucr.cs.bdlab.colortiles.raptor.GeoTiffRasterReader;
import edu.ucr.cs.bdlab.colortiles.raptor.GeoTiffRasterWriter;
import edu.ucr.cs.bdlab.colortiles.raptor.GridRaster;
import edu.ucr.cs.bdlab.colortiles.raptor.ImageRaster;
import edu.ucr.cs.bdlab.colortiles.raptor.InverseMappingWarper;
import edu.ucr.cs.bdlab.colortiles.raptor.InvalidRangeException;
import edu.ucr.cs.bdlab.colortiles.raptor.NormalizedRaster;
import edu.ucr.cs.bdlab.colortiles.raptor.RasterHelper;
import edu.ucr.cs.bdlab.colortiles.raptor.ReprojectionException;
import edu.ucr.cs.bdlab.colortiles.raptor.Reprojector;
import edu.ucr.cs.bdlab.colortiles.raptor.Resampling;
import edu.ucr.cs.bdlab.colortiles.raptor.Statistics;
import edu.ucr.cs.bdlab.colortiles.raptor.ValidityMask;
import edu.ucr.cs.bdlab.colortiles.raptor.ValidityMaskBuilder;
import edu.ucr.cs.bdlab.colortiles.raptor.ValueNormalizer;
import edu.ucr.cs.bdlab.colortiles.util.OperationParam;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs all the stages that turn a raster file into a tile pyramid: read, normalize, colorize, mask, reproject, tile,
 * and write. Every stage fails with a typed error which is logged once here with the name of the stage and then
 * passed to the caller unchanged.
 */
public class PipelineCoordinator implements Closeable {
  private static final Log LOG = LogFactory.getLog(PipelineCoordinator.class);

  @OperationParam(
      description = "Number of threads used to process pixels and tiles. Defaults to the number of processors"
  )
  public static final String Parallelism = "parallelism";

  @OperationParam(
      description = "The maximum time in seconds allowed for reprojection (0 for no limit)",
      defaultValue = "600"
  )
  public static final String Timeout = "timeout";

  @OperationParam(
      description = "Keep the reprojected RGBA raster as mercator.tif in the output directory",
      defaultValue = "false"
  )
  public static final String KeepMercatorRaster = "keepMercatorRaster";

  @OperationParam(
      description = "Snap the reprojected raster to the pixel grid of the deepest zoom level",
      defaultValue = "true"
  )
  public static final String AlignToTileGrid = "alignToTileGrid";

  /**The name of the reprojected raster in the output directory*/
  public static final String MercatorFileName = "mercator.tif";

  private final ColorTilesOptions opts;

  private final Configuration hadoopConf;

  private final int band;

  private final int outMin, outMax;

  private final ColorRamp.Selection colorSelection;

  private final Reprojector reprojector;

  private final TilePyramidBuilder builder;

  private final TilePyramidWriter writer;

  private final long timeoutSeconds;

  private final boolean keepMercatorRaster;

  private final boolean alignToTileGrid;

  private final boolean viewer;

  /**Runs the pixel and tile tasks or null to run them in the calling thread*/
  private final ExecutorService executor;

  public PipelineCoordinator(ColorTilesOptions opts) throws InvalidZoomRangeException, InvalidRangeException {
    this(opts, new Reprojector(new InverseMappingWarper(),
        opts.getEnum(Reprojector.WarpResampling, Resampling.NEAREST)));
  }

  /**
   * Creates a coordinator and validates all its options
   * @param opts the user options
   * @param reprojector the reprojector used to move the colorized raster to web mercator
   * @throws InvalidZoomRangeException if the zoom levels or the tile size are invalid
   * @throws InvalidRangeException if the band, the clamp range or the output range are invalid
   * @throws IllegalArgumentException if any other option has a malformed value
   */
  public PipelineCoordinator(ColorTilesOptions opts, Reprojector reprojector)
      throws InvalidZoomRangeException, InvalidRangeException {
    this.opts = opts;
    this.hadoopConf = opts.loadIntoHadoopConf(new Configuration());
    this.reprojector = reprojector;
    ZoomRange zoomRange = opts.contains(TilePyramidBuilder.Levels) ?
        ZoomRange.parse(opts.getString(TilePyramidBuilder.Levels)) :
        new ZoomRange(opts.getInt(TilePyramidBuilder.ZoomMin, 0), opts.getInt(TilePyramidBuilder.ZoomMax, 3));
    this.builder = new TilePyramidBuilder(zoomRange, opts.getInt(TilePyramidBuilder.TileSize, 256),
        opts.getEnum(TilePyramidBuilder.ResamplingRule, OverviewResampling.AVERAGE),
        opts.getBoolean(TilePyramidBuilder.SkipEmptyTiles, true));
    this.writer = new TilePyramidWriter(opts.getEnum(TilePyramidWriter.OutputFormat, ImageOutputFormat.PNG),
        opts.getBoolean(TilePyramidWriter.TMS, false));
    this.band = opts.getInt(ValueNormalizer.Band, 0);
    this.outMin = opts.getInt(ValueNormalizer.OutMin, 1);
    this.outMax = opts.getInt(ValueNormalizer.OutMax, 255);
    if (band < 0)
      throw new InvalidRangeException("Band index must not be negative but was " + band);
    ValueNormalizer.checkOutputRange(outMin, outMax);
    // A fully configured clamp range is checked before any data is read
    if (opts.contains(ValueNormalizer.ClampMin) && opts.contains(ValueNormalizer.ClampMax))
      new ValueNormalizer(opts.getDouble(ValueNormalizer.ClampMin, 0), opts.getDouble(ValueNormalizer.ClampMax, 0),
          outMin, outMax);
    this.colorSelection = opts.getEnum(ColorRamp.ColorSelection, ColorRamp.Selection.NEAREST);
    this.timeoutSeconds = opts.getInt(Timeout, 600);
    if (timeoutSeconds < 0)
      throw new IllegalArgumentException("Timeout must not be negative but was " + timeoutSeconds);
    this.keepMercatorRaster = opts.getBoolean(KeepMercatorRaster, false);
    this.alignToTileGrid = opts.getBoolean(AlignToTileGrid, true);
    this.viewer = opts.getBoolean(TilePyramidWriter.Viewer, false);
    int parallelism = opts.getInt(Parallelism, Runtime.getRuntime().availableProcessors());
    if (parallelism < 1)
      throw new IllegalArgumentException("Parallelism must be positive but was " + parallelism);
    this.executor = parallelism == 1 ? null : Executors.newFixedThreadPool(parallelism, daemonThreads("tiler"));
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  public TilePyramidBuilder getBuilder() {
    return builder;
  }

  /**
   * Runs the whole pipeline
   * @param input the path of the input raster
   * @param colormap the path of the colormap file
   * @param output the output directory
   * @return the generated pyramid
   * @throws ColorTilesException if any of the stages fails. Unexpected runtime errors are reported as a
   *   {@link StageFailedException} of the stage that raised them.
   * @throws IOException if the output cannot be written
   */
  public TilePyramid run(Path input, Path colormap, Path output) throws ColorTilesException, IOException {
    String stage = GeoTiffRasterReader.StageName;
    try {
      LOG.info(String.format("Tiling '%s' with colormap '%s' into '%s' at levels %s",
          input, colormap, output, builder.getZoomRange()));
      GridRaster raster = RasterHelper.readRaster(input.getFileSystem(hadoopConf), input);
      stage = ValueNormalizer.StageName;
      ValueNormalizer normalizer = createNormalizer(raster);
      stage = ColorRamp.StageName;
      ColorRamp ramp = new ColorMapReader(normalizer.getLo(), normalizer.getHi(), colorSelection)
          .read(colormap.getFileSystem(hadoopConf), colormap);
      ImageRaster colorized = colorize(raster, normalizer, ramp);
      stage = Reprojector.StageName;
      ImageRaster mercator = reproject(colorized);
      stage = TilePyramidBuilder.StageName;
      TilePyramid pyramid = builder.build(mercator, executor);
      stage = TilePyramidWriter.StageName;
      write(pyramid, mercator, output);
      return pyramid;
    } catch (ColorTilesException e) {
      LOG.error(String.format("Stage '%s' failed: %s", e.getStage(), e.getMessage()));
      throw e;
    } catch (IOException e) {
      LOG.error(String.format("Stage '%s' failed", stage), e);
      throw e;
    } catch (RuntimeException e) {
      LOG.error(String.format("Stage '%s' failed", stage), e);
      throw new StageFailedException(stage, e);
    }
  }

  /**
   * Creates the normalizer of the configured band. Clamp bounds that are not configured are taken from the
   * minimum and maximum valid values of the band.
   * @param raster the source raster
   * @return the normalizer
   * @throws InvalidRangeException if the band does not exist or the clamp range is invalid
   */
  public ValueNormalizer createNormalizer(GridRaster raster) throws InvalidRangeException {
    if (band < 0 || band >= raster.getNumBands())
      throw new InvalidRangeException(String.format("Band #%d does not exist in a raster with %d band(s)",
          band, raster.getNumBands()));
    boolean hasMin = opts.contains(ValueNormalizer.ClampMin);
    boolean hasMax = opts.contains(ValueNormalizer.ClampMax);
    double vmin = opts.getDouble(ValueNormalizer.ClampMin, Double.NaN);
    double vmax = opts.getDouble(ValueNormalizer.ClampMax, Double.NaN);
    if (!hasMin || !hasMax) {
      Statistics stats = new Statistics().collect(raster);
      if (!stats.hasData(band))
        throw new InvalidRangeException(String.format(
            "Band #%d has no valid cells to derive the clamp range from. Set %s and %s explicitly",
            band, ValueNormalizer.ClampMin, ValueNormalizer.ClampMax));
      if (!hasMin)
        vmin = stats.min[band];
      if (!hasMax)
        vmax = stats.max[band];
      if (vmax <= vmin && !(hasMin && hasMax)) {
        LOG.warn(String.format("Band #%d has a single value %s, widening the clamp range", band, vmin));
        if (hasMin)
          vmax = vmin + 1;
        else
          vmin = vmax - 1;
      }
      LOG.info(String.format("Clamp range [%s, %s] with statistics %s", vmin, vmax, stats));
    }
    return new ValueNormalizer(vmin, vmax, outMin, outMax);
  }

  /**
   * Normalizes and colorizes the configured band and sets the alpha channel from the validity of the source cells
   * @param raster the source raster
   * @param normalizer the normalizer of the band
   * @param ramp the color ramp
   * @return the colorized raster with a binary alpha channel
   * @throws InvalidRangeException if the band does not exist
   * @throws IOException if interrupted while waiting for the parallel tasks
   */
  public ImageRaster colorize(GridRaster raster, ValueNormalizer normalizer, ColorRamp ramp)
      throws InvalidRangeException, IOException {
    NormalizedRaster normalized = normalizer.normalize(raster, band, executor);
    ImageRaster image = new Colorizer(ramp).colorize(normalized, executor);
    ValidityMask mask = new ValidityMaskBuilder().build(raster);
    image.replaceAlpha(mask);
    return image;
  }

  /**
   * Reprojects the colorized raster to web mercator within the configured time bound
   * @param colorized the colorized raster
   * @return the raster in web mercator
   * @throws ReprojectionException if the reprojection fails
   * @throws PipelineTimeoutException if the reprojection takes longer than the timeout
   * @throws IOException if the calling thread is interrupted
   */
  public ImageRaster reproject(ImageRaster colorized)
      throws ReprojectionException, PipelineTimeoutException, IOException {
    double resolution = alignToTileGrid ? builder.getBaseResolution() : Double.NaN;
    ExecutorService reprojectionThread = Executors.newSingleThreadExecutor(daemonThreads("reproject"));
    try {
      Future<ImageRaster> future =
          reprojectionThread.submit(() -> reprojector.reproject(colorized, resolution, alignToTileGrid));
      try {
        return timeoutSeconds > 0 ? future.get(timeoutSeconds, TimeUnit.SECONDS) : future.get();
      } catch (TimeoutException e) {
        future.cancel(true);
        throw new PipelineTimeoutException(Reprojector.StageName, timeoutSeconds, e);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof ReprojectionException)
          throw (ReprojectionException) cause;
        if (cause instanceof RuntimeException)
          throw (RuntimeException) cause;
        if (cause instanceof Error)
          throw (Error) cause;
        throw new ReprojectionException("Reprojection failed", cause);
      } catch (InterruptedException e) {
        future.cancel(true);
        Thread.currentThread().interrupt();
        InterruptedIOException iioe = new InterruptedIOException("Interrupted while reprojecting");
        iioe.initCause(e);
        throw iioe;
      }
    } finally {
      reprojectionThread.shutdownNow();
    }
  }

  /**
   * Writes the tiles and the side files into a temporary directory and commits them to the output directory.
   * On failure the temporary directory is deleted and the output directory is left as it was.
   * @param pyramid the pyramid to write
   * @param mercator the reprojected raster, written only if configured to keep it
   * @param output the output directory
   * @throws IOException if any file cannot be written
   */
  public void write(TilePyramid pyramid, ImageRaster mercator, Path output) throws IOException {
    FileSystem outFS = output.getFileSystem(hadoopConf);
    TileOutputCommitter committer = new TileOutputCommitter(outFS, output);
    committer.setupJob();
    try {
      Path workPath = committer.getWorkPath();
      writer.writeTiles(pyramid, outFS, workPath, executor);
      if (keepMercatorRaster)
        new GeoTiffRasterWriter().write(mercator, outFS, new Path(workPath, MercatorFileName));
      writer.writeAddOnFiles(outFS, workPath, pyramid, opts, viewer);
      committer.commitJob();
    } catch (IOException | RuntimeException e) {
      try {
        committer.abortJob();
      } catch (IOException abortError) {
        e.addSuppressed(abortError);
      }
      throw e;
    }
  }

  @Override
  public void close() throws IOException {
    if (executor == null)
      return;
    executor.shutdown();
    try {
      if (!executor.awaitTermination(1, TimeUnit.MINUTES))
        executor.shutdownNow();
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
      InterruptedIOException iioe = new InterruptedIOException("Interrupted while stopping worker threads");
      iioe.initCause(e);
      throw iioe;
    }
  }
}
