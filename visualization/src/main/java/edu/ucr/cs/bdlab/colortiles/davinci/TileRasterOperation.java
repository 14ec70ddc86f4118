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
import edu.ucr.cs.bdlab.colortiles.raptor.ColorRamp;
import edu.ucr.cs.bdlab.colortiles.raptor.Reprojector;
import edu.ucr.cs.bdlab.colortiles.raptor.ValueNormalizer;
import edu.ucr.cs.bdlab.colortiles.util.OperationHelper;
import edu.ucr.cs.bdlab.colortiles.util.OperationMetadata;
import edu.ucr.cs.bdlab.colortiles.util.OperationParam;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point that turns a single-band raster into a colorized tile pyramid.
 * Exits with 0 on success, 1 if processing failed and 2 if the configuration is invalid.
 */
@OperationMetadata(
    shortName = "colortiles",
    description = "Colorizes a raster with a color ramp and writes it as a web mercator tile pyramid",
    arguments = {"input raster", "colormap", "output directory"},
    inheritParams = {PipelineCoordinator.class, TilePyramidBuilder.class, TilePyramidWriter.class,
        ValueNormalizer.class, ColorRamp.class, Reprojector.class}
)
public class TileRasterOperation {
  private static final Log LOG = LogFactory.getLog(TileRasterOperation.class);

  @OperationParam(
      description = "A text file with one key=value option per line. Options on the command line take precedence"
  )
  public static final String ConfFile = "conf";

  public static final int ExitSuccess = 0;

  public static final int ExitProcessingError = 1;

  public static final int ExitConfigurationError = 2;

  private final PrintStream err;

  public TileRasterOperation() {
    this(System.err);
  }

  public TileRasterOperation(PrintStream err) {
    this.err = err;
  }

  /**
   * Runs the operation and returns the exit code instead of exiting
   * @param args the command line arguments
   * @return the exit code
   */
  public int run(String[] args) {
    ColorTilesOptions opts = new ColorTilesOptions();
    List<String> positional = opts.parseArguments(args);
    if (positional.size() != 3) {
      err.printf("Expected 3 arguments but found %d\n", positional.size());
      OperationHelper.printUsage(TileRasterOperation.class, err);
      return ExitConfigurationError;
    }
    Path input = new Path(positional.get(0));
    Path colormap = new Path(positional.get(1));
    Path output = new Path(positional.get(2));
    try {
      if (opts.contains(ConfFile)) {
        Path confPath = new Path(opts.getString(ConfFile));
        ColorTilesOptions fileOpts = new ColorTilesOptions()
            .loadFromTextFile(confPath.getFileSystem(new Configuration()), confPath);
        // Command line options override the file
        for (Map.Entry<String, String> entry : opts.toMap().entrySet())
          fileOpts.set(entry.getKey(), entry.getValue());
        opts = fileOpts;
      }
    } catch (IOException e) {
      err.printf("Cannot read the configuration file '%s': %s\n", opts.getString(ConfFile), e.getMessage());
      return ExitConfigurationError;
    }
    PipelineCoordinator coordinator;
    try {
      coordinator = new PipelineCoordinator(opts);
    } catch (ColorTilesException e) {
      return reportFailure(input, e);
    } catch (IllegalArgumentException e) {
      err.printf("Invalid option while tiling '%s': %s\n", input, e.getMessage());
      return ExitConfigurationError;
    }
    long t1 = System.nanoTime();
    try (PipelineCoordinator c = coordinator) {
      TilePyramid pyramid = c.run(input, colormap, output);
      long t2 = System.nanoTime();
      LOG.info(String.format("Wrote %d tiles to '%s' in %f seconds", pyramid.getNumTiles(), output, (t2 - t1) * 1E-9));
      return ExitSuccess;
    } catch (ColorTilesException e) {
      return reportFailure(input, e);
    } catch (IOException e) {
      err.printf("Failed to tile '%s': %s\n", input, e.getMessage());
      return ExitProcessingError;
    }
  }

  private int reportFailure(Path input, ColorTilesException e) {
    err.printf("Failed to tile '%s' at stage '%s': %s\n", input, e.getStage(), e.getMessage());
    return e.getKind() == ColorTilesException.Kind.CONFIGURATION ? ExitConfigurationError : ExitProcessingError;
  }

  public static void main(String[] args) {
    System.exit(new TileRasterOperation().run(args));
  }
}
