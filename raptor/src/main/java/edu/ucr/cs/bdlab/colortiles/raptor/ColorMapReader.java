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
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.Text;
import org.apache.hadoop.util.LineReader;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads a colormap text file into a {@link ColorRamp}. Each line has the form {@code value R G B [A]} where the
 * tokens are separated by spaces, tabs, commas, or colons. The value can be a number in the normalized range or
 * a percentage {@code p%} of that range. Lines starting with {@code #} and blank lines are skipped.
 * An {@code nv} entry is accepted but ignored since cells without data are always transparent.
 */
public class ColorMapReader {
  private static final Log LOG = LogFactory.getLog(ColorMapReader.class);

  private static final Pattern Separators = Pattern.compile("[\\s,:]+");

  /**The normalized range that percentages refer to*/
  private final int lo, hi;

  private final ColorRamp.Selection selection;

  public ColorMapReader(int lo, int hi, ColorRamp.Selection selection) {
    this.lo = lo;
    this.hi = hi;
    this.selection = selection;
  }

  /**
   * Reads a colormap file
   * @param fs the file system that contains the file
   * @param path the path of the colormap file
   * @return the parsed color ramp
   * @throws InputException if the file does not exist or cannot be read
   * @throws RampParseException if the content of the file is malformed
   */
  public ColorRamp read(FileSystem fs, Path path) throws InputException, RampParseException {
    try (InputStream in = fs.open(path)) {
      ColorRamp ramp = parse(in);
      LOG.info(String.format("Read %d colormap entries from '%s'", ramp.getNumBreakpoints(), path));
      return ramp;
    } catch (FileNotFoundException e) {
      throw new InputException(ColorRamp.StageName, path.toString(), "colormap file not found", e);
    } catch (IOException e) {
      throw new InputException(ColorRamp.StageName, path.toString(), "cannot read colormap file", e);
    }
  }

  /**
   * Parses the colormap text from the given stream
   * @param in the UTF-8 text to parse. It is not closed by this method.
   * @return the parsed color ramp
   * @throws IOException if an error happens while reading
   * @throws RampParseException if the content is malformed or empty
   */
  public ColorRamp parse(InputStream in) throws IOException, RampParseException {
    LineReader lines = new LineReader(in);
    List<ColorBreakpoint> breakpoints = new ArrayList<>();
    Text text = new Text();
    int lineNumber = 0;
    while (lines.readLine(text) > 0) {
      lineNumber++;
      String line = text.toString().trim();
      if (line.isEmpty() || line.startsWith("#"))
        continue;
      String[] tokens = Separators.split(line);
      if (tokens[0].toLowerCase(Locale.ROOT).equals("nv")) {
        LOG.debug(String.format("Ignoring no-data entry at line %d", lineNumber));
        continue;
      }
      if (tokens.length != 4 && tokens.length != 5)
        throw new RampParseException(lineNumber,
            String.format("expected 'value R G B [A]' but found %d token(s) in '%s'", tokens.length, line));
      double value = parseValue(lineNumber, tokens[0]);
      int r = parseComponent(lineNumber, tokens[1]);
      int g = parseComponent(lineNumber, tokens[2]);
      int b = parseComponent(lineNumber, tokens[3]);
      int a = tokens.length == 5 ? parseComponent(lineNumber, tokens[4]) : 255;
      for (ColorBreakpoint existing : breakpoints)
        if (existing.getValue() == value)
          throw new RampParseException(lineNumber, "duplicate entry for value " + value);
      breakpoints.add(new ColorBreakpoint(value, r, g, b, a));
    }
    if (breakpoints.isEmpty())
      throw new RampParseException("Colormap has no entries");
    return new ColorRamp(breakpoints, selection);
  }

  private double parseValue(int lineNumber, String token) throws RampParseException {
    try {
      if (token.endsWith("%")) {
        double percent = Double.parseDouble(token.substring(0, token.length() - 1));
        if (percent < 0 || percent > 100)
          throw new RampParseException(lineNumber, "percentage out of range " + token);
        return lo + percent / 100.0 * (hi - lo);
      }
      double value = Double.parseDouble(token);
      if (!Double.isFinite(value))
        throw new RampParseException(lineNumber, "value must be finite but found " + token);
      return value;
    } catch (NumberFormatException e) {
      throw new RampParseException(lineNumber, "invalid value '" + token + "'");
    }
  }

  private static int parseComponent(int lineNumber, String token) throws RampParseException {
    int c;
    try {
      c = Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new RampParseException(lineNumber, "invalid color component '" + token + "'");
    }
    if (c < 0 || c > 255)
      throw new RampParseException(lineNumber, "color component out of range [0, 255] " + c);
    return c;
  }
}
