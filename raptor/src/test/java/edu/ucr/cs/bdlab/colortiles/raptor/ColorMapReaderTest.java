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
import edu.ucr.cs.bdlab.test.ColorTilesTest;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

public class ColorMapReaderTest extends ColorTilesTest {

  private static ColorRamp parse(String text) throws IOException, RampParseException {
    ColorMapReader reader = new ColorMapReader(1, 255, ColorRamp.Selection.NEAREST);
    return reader.parse(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
  }

  public void testWindowsLineEndings() throws IOException, RampParseException {
    ColorRamp ramp = parse("# exported on windows\r\n1 0 0 255\r\n\r\n255 255 0 0\r\n");
    assertEquals(2, ramp.getNumBreakpoints());
    try {
      parse("1 0 0 255\r\n\r\n2 0 0\r\n");
      fail("Expected an exception");
    } catch (RampParseException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("line 3"));
    }
  }

  public void testParseGdalStyle() throws IOException, RampParseException {
    ColorRamp ramp = parse(
        "# elevation colors\n" +
        "nv 0 0 0 0\n" +
        "1 0 0 255\n" +
        "\n" +
        "128,0,255,0\n" +
        "255:255:0:0:200\n");
    assertEquals(3, ramp.getNumBreakpoints());
    assertEquals(1.0, ramp.getBreakpoint(0).getValue());
    assertEquals(200, ramp.getBreakpoint(2).getAlpha());
    assertEquals(255, ramp.getBreakpoint(1).getAlpha());
  }

  public void testPercentages() throws IOException, RampParseException {
    ColorRamp ramp = parse("0% 0 0 0\n50% 10 10 10\n100% 255 255 255\n");
    assertEquals(1.0, ramp.getBreakpoint(0).getValue(), 1E-9);
    assertEquals(128.0, ramp.getBreakpoint(1).getValue(), 1E-9);
    assertEquals(255.0, ramp.getBreakpoint(2).getValue(), 1E-9);
  }

  public void testErrorsReportLineNumbers() throws IOException {
    String[] badFiles = {
        "1 0 0 0\n2 0 0\n",
        "1 0 0 0\n\nabc 0 0 0\n",
        "1 0 0 0\n2 0 300 0\n",
        "1 0 0 0\n1 5 5 5\n",
        "1 0 0 0\n150% 1 1 1\n",
    };
    int[] expectedLines = {2, 3, 2, 2, 2};
    for (int i = 0; i < badFiles.length; i++) {
      try {
        parse(badFiles[i]);
        fail("Expected an exception for file #" + i);
      } catch (RampParseException e) {
        assertEquals("Wrong line for file #" + i, expectedLines[i], e.getLineNumber());
        assertTrue(e.getMessage(), e.getMessage().startsWith("line " + expectedLines[i] + ": "));
      }
    }
  }

  public void testEmptyFile() throws IOException {
    try {
      parse("# only a comment\nnv 0 0 0 0\n");
      fail("Expected an exception");
    } catch (RampParseException e) {
      assertEquals(ColorRamp.StageName, e.getStage());
    }
  }

  public void testReadFromFile() throws IOException, RampParseException, InputException {
    FileSystem fs = getLocalFS();
    Path path = new Path(scratchPath(), "colors.txt");
    try (PrintStream out = new PrintStream(fs.create(path), false, "UTF-8")) {
      out.println("1 255 0 0");
      out.println("255 0 0 255");
    }
    ColorRamp ramp = new ColorMapReader(1, 255, ColorRamp.Selection.INTERPOLATE).read(fs, path);
    assertEquals(2, ramp.getNumBreakpoints());
    assertEquals(ColorRamp.Selection.INTERPOLATE, ramp.getSelection());
  }

  public void testMissingFile() throws IOException, RampParseException {
    Path path = new Path(scratchPath(), "missing.txt");
    try {
      new ColorMapReader(1, 255, ColorRamp.Selection.NEAREST).read(getLocalFS(), path);
      fail("Expected an exception");
    } catch (InputException e) {
      assertEquals(ColorRamp.StageName, e.getStage());
      assertEquals(path.toString(), e.getPath());
    }
  }
}
