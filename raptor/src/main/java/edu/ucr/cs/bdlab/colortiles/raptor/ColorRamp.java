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

import edu.ucr.cs.bdlab.colortiles.util.OperationParam;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An immutable table of breakpoints sorted by value that resolves a normalized value to a color.
 * Instances can be shared by several threads.
 */
public class ColorRamp {
  /**The name of this stage in error messages*/
  public static final String StageName = "colormap";

  @OperationParam(
      description = "How a value is matched to the colormap entries {nearest, interpolate, exact}",
      defaultValue = "nearest"
  )
  public static final String ColorSelection = "colorSelection";

  /**How a value that falls between two breakpoints gets its color*/
  public enum Selection {
    /**The color of the closest breakpoint, ties go to the lower one*/
    NEAREST,
    /**Linear interpolation of the two surrounding breakpoints*/
    INTERPOLATE,
    /**Only values that match a breakpoint exactly get a color, others are transparent*/
    EXACT
  }

  private final double[] values;

  private final int[] colors;

  private final Selection selection;

  /**
   * Creates a ramp from the given breakpoints. The breakpoints are sorted by value.
   * @param breakpoints the entries of the ramp
   * @param selection how values are matched to breakpoints
   * @throws RampParseException if the list is empty or two breakpoints have the same value
   */
  public ColorRamp(List<ColorBreakpoint> breakpoints, Selection selection) throws RampParseException {
    if (breakpoints == null || breakpoints.isEmpty())
      throw new RampParseException("Color ramp has no entries");
    List<ColorBreakpoint> sorted = new ArrayList<>(breakpoints);
    Collections.sort(sorted);
    this.values = new double[sorted.size()];
    this.colors = new int[sorted.size()];
    for (int i = 0; i < sorted.size(); i++) {
      values[i] = sorted.get(i).getValue();
      colors[i] = sorted.get(i).getARGB();
      if (i > 0 && values[i] == values[i - 1])
        throw new RampParseException("Duplicate color ramp entry for value " + values[i]);
    }
    this.selection = selection;
  }

  public ColorRamp(List<ColorBreakpoint> breakpoints) throws RampParseException {
    this(breakpoints, Selection.NEAREST);
  }

  public Selection getSelection() {
    return selection;
  }

  public int getNumBreakpoints() {
    return values.length;
  }

  public ColorBreakpoint getBreakpoint(int i) {
    int c = colors[i];
    return new ColorBreakpoint(values[i], (c >> 16) & 0xff, (c >> 8) & 0xff, c & 0xff, c >>> 24);
  }

  /**
   * Returns the color of the given normalized value as a packed ARGB integer
   * @param value the normalized value
   * @return the color of the value
   */
  public int resolve(double value) {
    switch (selection) {
      case EXACT: {
        int i = Arrays.binarySearch(values, value);
        return i >= 0 ? colors[i] : ImageRaster.Transparent;
      }
      case INTERPOLATE: {
        int upper = upperIndex(value);
        if (upper == 0)
          return colors[0];
        if (upper == values.length)
          return colors[values.length - 1];
        int lower = upper - 1;
        double t = (value - values[lower]) / (values[upper] - values[lower]);
        return interpolate(colors[lower], colors[upper], t);
      }
      case NEAREST:
      default: {
        int upper = upperIndex(value);
        if (upper == 0)
          return colors[0];
        if (upper == values.length)
          return colors[values.length - 1];
        int lower = upper - 1;
        return value - values[lower] <= values[upper] - value ? colors[lower] : colors[upper];
      }
    }
  }

  /**
   * Index of the first breakpoint with a value greater than or equal to the given value
   * @param value the value to search for
   * @return an index in the range [0, n]
   */
  private int upperIndex(double value) {
    int lo = 0, hi = values.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (values[mid] < value)
        lo = mid + 1;
      else
        hi = mid;
    }
    return lo;
  }

  private static int interpolate(int c1, int c2, double t) {
    int result = 0;
    for (int shift = 0; shift < 32; shift += 8) {
      int a = (c1 >>> shift) & 0xff;
      int b = (c2 >>> shift) & 0xff;
      int c = (int) Math.round(a + (b - a) * t);
      result |= c << shift;
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder str = new StringBuilder("ColorRamp(").append(selection);
    for (int i = 0; i < values.length; i++)
      str.append(", ").append(getBreakpoint(i));
    return str.append(')').toString();
  }
}
