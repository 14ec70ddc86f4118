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

import edu.ucr.cs.bdlab.colortiles.common.ColorTilesException;

/**
 * Thrown when a colormap is malformed or empty.
 */
public class RampParseException extends ColorTilesException {
  private static final long serialVersionUID = -4123360071885503346L;

  /**The line number (1-based) that caused the error or zero if not related to a specific line*/
  private final int lineNumber;

  public RampParseException(String message) {
    this(0, message);
  }

  public RampParseException(int lineNumber, String message) {
    super(ColorRamp.StageName, lineNumber > 0 ? String.format("line %d: %s", lineNumber, message) : message);
    this.lineNumber = lineNumber;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  @Override
  public Kind getKind() {
    return Kind.CONFIGURATION;
  }
}
