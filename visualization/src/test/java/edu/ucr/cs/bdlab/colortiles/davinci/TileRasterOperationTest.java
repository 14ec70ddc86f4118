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

import edu.ucr.cs.bdlab.test.ColorTilesTest;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

public class TileRasterOperationTest extends ColorTilesTest {

  private ByteArrayOutputStream errBytes;
  private Path input, colormap, output;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    errBytes = new ByteArrayOutputStream();
    FileSystem fs = getLocalFS();
    input = new Path(scratchPath(), "values.tif");
    colormap = new Path(scratchPath(), "colors.txt");
    output = new Path(scratchPath(), "tiles");
    SampleRasters.writeHalves(fs, input);
    SampleRasters.writeBlueToRed(fs, colormap);
  }

  private int runOperation(String... args) {
    PrintStream err = new PrintStream(errBytes, true);
    return new TileRasterOperation(err).run(args);
  }

  private String errorOutput() {
    return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
  }

  public void testSuccess() throws IOException {
    int exitCode = runOperation(input.toString(), colormap.toString(), output.toString(),
        "zoomMax:1", "tileSize:16", "clampMin:0", "clampMax:100", "-viewer");
    assertEquals(errorOutput(), TileRasterOperation.ExitSuccess, exitCode);
    assertTrue(getLocalFS().exists(new Path(output, "1/0/0.png")));
    assertTrue(getLocalFS().exists(new Path(output, TilePyramidWriter.ViewerFileName)));
  }

  public void testOptionsFromConfigurationFile() throws IOException {
    Path conf = new Path(scratchPath(), "tiling.conf");
    SampleRasters.writeText(getLocalFS(), conf, "# tiling\nzoomMax=2\ntileSize=16\noutputFormat=jpg\n");
    int exitCode = runOperation(input.toString(), colormap.toString(), output.toString(),
        "conf:" + conf, "zoomMax:1");
    assertEquals(errorOutput(), TileRasterOperation.ExitSuccess, exitCode);
    assertTrue(getLocalFS().exists(new Path(output, "1/0/0.jpg")));
    assertFalse(getLocalFS().exists(new Path(output, "2")));
  }

  public void testMissingInputIsAProcessingError() throws IOException {
    Path missing = new Path(scratchPath(), "missing.tif");
    int exitCode = runOperation(missing.toString(), colormap.toString(), output.toString());
    assertEquals(TileRasterOperation.ExitProcessingError, exitCode);
    String message = errorOutput();
    assertTrue(message, message.contains("'read'"));
    assertTrue(message, message.contains("missing.tif"));
  }

  public void testInvalidZoomRange() throws IOException {
    int exitCode = runOperation(input.toString(), colormap.toString(), output.toString(),
        "zoomMin:5", "zoomMax:2");
    assertEquals(TileRasterOperation.ExitConfigurationError, exitCode);
    assertTrue(errorOutput(), errorOutput().contains("'" + TilePyramidBuilder.StageName + "'"));
    assertFalse(getLocalFS().exists(output));
  }

  public void testMalformedColormap() throws IOException {
    Path badColormap = new Path(scratchPath(), "bad.txt");
    SampleRasters.writeText(getLocalFS(), badColormap, "1 0 0 255\n128 red 0 0\n");
    int exitCode = runOperation(input.toString(), badColormap.toString(), output.toString());
    assertEquals(TileRasterOperation.ExitConfigurationError, exitCode);
    assertTrue(errorOutput(), errorOutput().contains("line 2"));
  }

  public void testWrongNumberOfArguments() {
    int exitCode = runOperation(input.toString(), colormap.toString());
    assertEquals(TileRasterOperation.ExitConfigurationError, exitCode);
    String message = errorOutput();
    assertTrue(message, message.contains("Expected 3 arguments but found 2"));
    assertTrue(message, message.contains("Usage:"));
  }

  public void testInvalidOutputRangeFailsBeforeReading() throws IOException {
    int exitCode = runOperation(new Path(scratchPath(), "missing.tif").toString(), colormap.toString(),
        output.toString(), "outMin:0");
    assertEquals(TileRasterOperation.ExitConfigurationError, exitCode);
    assertTrue(errorOutput(), errorOutput().contains("'normalize'"));
    assertFalse(getLocalFS().exists(output));
  }

  public void testNonNumericOption() {
    int exitCode = runOperation(input.toString(), colormap.toString(), output.toString(), "tileSize:abc");
    assertEquals(TileRasterOperation.ExitConfigurationError, exitCode);
  }
}
