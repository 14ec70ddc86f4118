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
package edu.ucr.cs.bdlab.colortiles.util;

public class IOUtil {

  /**
   * Returns the extension of the given file name
   * @param filename the name of the file to get its extension
   * @return the extension of the file including the dot or null of the file name does not have a dot.
   */
  public static String getExtension(String filename) {
    int i = filename.lastIndexOf('.');
    return i == -1 ? null : filename.substring(i);
  }
}
