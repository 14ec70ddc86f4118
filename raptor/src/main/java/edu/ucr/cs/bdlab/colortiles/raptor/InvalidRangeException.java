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
 * Thrown when the clamp range or the output range of the value normalization is malformed.
 */
public class InvalidRangeException extends ColorTilesException {
  private static final long serialVersionUID = 2287404937311295460L;

  public InvalidRangeException(String message) {
    super(ValueNormalizer.StageName, message);
  }

  @Override
  public Kind getKind() {
    return Kind.CONFIGURATION;
  }
}
