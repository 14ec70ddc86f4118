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
 * Thrown when a raster cannot be clipped or reprojected, e.g., an unknown coordinate reference system or a raster
 * that does not overlap the target extent.
 */
public class ReprojectionException extends ColorTilesException {
  private static final long serialVersionUID = -1683514590120474011L;

  public ReprojectionException(String message) {
    super(Reprojector.StageName, message);
  }

  public ReprojectionException(String message, Throwable cause) {
    super(Reprojector.StageName, message, cause);
  }

  @Override
  public Kind getKind() {
    return Kind.PROCESSING;
  }
}
