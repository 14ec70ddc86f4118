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
 * Thrown when a blocking geometric operation does not finish within the configured time bound.
 */
public class PipelineTimeoutException extends ColorTilesException {
  private static final long serialVersionUID = -7312283520985817102L;

  /**The bound that was exceeded in seconds*/
  private final long timeoutSeconds;

  public PipelineTimeoutException(String stage, long timeoutSeconds, Throwable cause) {
    super(stage, String.format("Operation did not finish within %d second(s)", timeoutSeconds), cause);
    this.timeoutSeconds = timeoutSeconds;
  }

  public long getTimeoutSeconds() {
    return timeoutSeconds;
  }

  @Override
  public Kind getKind() {
    return Kind.PROCESSING;
  }
}
