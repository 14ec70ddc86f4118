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
 * How a target pixel gets its value from the source pixels around its location.
 */
public enum Resampling {
  /**The source pixel that contains the location*/
  NEAREST,
  /**
   * A bilinear blend of the valid pixels among the four closest ones. The alpha is taken from the nearest pixel so
   * that the validity mask is not blurred.
   */
  BILINEAR
}
