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
package edu.ucr.cs.bdlab.colortiles.common;

/**
 * Thrown when an input file (raster or colormap) is missing, unreadable, or has a layout that cannot be processed.
 */
public class InputException extends ColorTilesException {
  private static final long serialVersionUID = 5871262395150447206L;

  /**The path of the offending input*/
  private final String path;

  public InputException(String stage, String path, String message) {
    super(stage, String.format("%s: %s", path, message));
    this.path = path;
  }

  public InputException(String stage, String path, String message, Throwable cause) {
    super(stage, String.format("%s: %s", path, message), cause);
    this.path = path;
  }

  public String getPath() {
    return path;
  }

  @Override
  public Kind getKind() {
    return Kind.PROCESSING;
  }
}
