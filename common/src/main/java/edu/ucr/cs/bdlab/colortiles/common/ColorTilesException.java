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
 * The root of all the errors that abort a tiling run. Each error records the stage that raised it
 * and whether it was caused by a bad configuration or by a failure while processing the data.
 */
public abstract class ColorTilesException extends Exception {
  private static final long serialVersionUID = -3340137146236470175L;

  /**Distinguishes errors in the user configuration from errors that happen while processing*/
  public enum Kind {CONFIGURATION, PROCESSING}

  /**The name of the stage that raised the error*/
  private final String stage;

  protected ColorTilesException(String stage, String message) {
    super(message);
    this.stage = stage;
  }

  protected ColorTilesException(String stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  public String getStage() {
    return stage;
  }

  public abstract Kind getKind();
}
