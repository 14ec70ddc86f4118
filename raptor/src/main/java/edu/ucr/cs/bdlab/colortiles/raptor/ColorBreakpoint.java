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

/**
 * One entry of a color ramp: a value and the color assigned to it.
 */
public class ColorBreakpoint implements Comparable<ColorBreakpoint> {
  private final double value;

  /**The color as a packed ARGB integer*/
  private final int argb;

  public ColorBreakpoint(double value, int r, int g, int b) {
    this(value, r, g, b, 255);
  }

  public ColorBreakpoint(double value, int r, int g, int b, int a) {
    checkComponent("red", r);
    checkComponent("green", g);
    checkComponent("blue", b);
    checkComponent("alpha", a);
    if (!Double.isFinite(value))
      throw new IllegalArgumentException("Breakpoint value must be finite but found " + value);
    this.value = value;
    this.argb = (a << 24) | (r << 16) | (g << 8) | b;
  }

  private static void checkComponent(String name, int c) {
    if (c < 0 || c > 255)
      throw new IllegalArgumentException(String.format("Invalid %s component %d", name, c));
  }

  public double getValue() {
    return value;
  }

  public int getARGB() {
    return argb;
  }

  public int getRed() {
    return (argb >> 16) & 0xff;
  }

  public int getGreen() {
    return (argb >> 8) & 0xff;
  }

  public int getBlue() {
    return argb & 0xff;
  }

  public int getAlpha() {
    return argb >>> 24;
  }

  @Override
  public int compareTo(ColorBreakpoint o) {
    return Double.compare(this.value, o.value);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ColorBreakpoint))
      return false;
    ColorBreakpoint that = (ColorBreakpoint) obj;
    return this.value == that.value && this.argb == that.argb;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(value) * 31 + argb;
  }

  @Override
  public String toString() {
    return String.format("%s -> (%d, %d, %d, %d)", value, getRed(), getGreen(), getBlue(), getAlpha());
  }
}
