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

/**
 * How the four children of a tile are reduced into the parent tile.
 */
public enum OverviewResampling {
  /**
   * Each parent pixel is the alpha-weighted average color of the 2x2 child pixels it covers. It is opaque if any of
   * them is opaque.
   */
  AVERAGE,
  /**Each parent pixel copies the top-left pixel of the 2x2 child pixels it covers*/
  NEAREST
}
