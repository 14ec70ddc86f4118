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
 * Reports an unexpected runtime error raised while a stage was processing the data.
 */
public class StageFailedException extends ColorTilesException {
  private static final long serialVersionUID = 4519872336015273901L;

  public StageFailedException(String stage, RuntimeException cause) {
    super(stage, String.valueOf(cause.getMessage()), cause);
  }

  @Override
  public Kind getKind() {
    return Kind.PROCESSING;
  }
}
