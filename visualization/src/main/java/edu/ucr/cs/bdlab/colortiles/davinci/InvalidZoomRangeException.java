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

/**
 * Thrown when the requested zoom levels or tile size cannot produce a valid pyramid.
 */
public class InvalidZoomRangeException extends ColorTilesException {
  private static final long serialVersionUID = 6431278054880297315L;

  public InvalidZoomRangeException(String message) {
    super(TilePyramidBuilder.StageName, message);
  }

  public InvalidZoomRangeException(String message, Throwable cause) {
    super(TilePyramidBuilder.StageName, message, cause);
  }

  @Override
  public Kind getKind() {
    return Kind.CONFIGURATION;
  }
}
