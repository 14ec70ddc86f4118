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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import java.io.IOException;

/**
 * Makes the output of a run visible only when all of it is written. All files are first written to a temporary
 * directory inside the output directory. A commit moves them into the output directory and an abort deletes them
 * and leaves the output directory as it was.
 */
public class TileOutputCommitter {
  private static final Log LOG = LogFactory.getLog(TileOutputCommitter.class);

  /**The name of the temporary directory under the output path*/
  public static final String TempDirName = "_temporary";

  private final FileSystem fs;

  private final Path outPath;

  private final Path workPath;

  public TileOutputCommitter(FileSystem fs, Path outPath) {
    this.fs = fs;
    this.outPath = outPath;
    this.workPath = new Path(outPath, TempDirName);
  }

  /**
   * The directory that all files must be written to before the commit
   * @return the temporary work directory
   */
  public Path getWorkPath() {
    return workPath;
  }

  public Path getOutputPath() {
    return outPath;
  }

  /**
   * Creates an empty work directory removing leftovers from a previous failed run
   * @throws IOException if the directory cannot be created
   */
  public void setupJob() throws IOException {
    if (fs.exists(outPath) && !fs.getFileStatus(outPath).isDirectory())
      throw new IOException(String.format("Output path '%s' exists and is not a directory", outPath));
    if (fs.exists(workPath)) {
      LOG.warn(String.format("Deleting leftover temporary directory '%s'", workPath));
      fs.delete(workPath, true);
    }
    if (!fs.mkdirs(workPath))
      throw new IOException(String.format("Cannot create temporary directory '%s'", workPath));
  }

  /**
   * Moves every entry of the work directory into the output directory replacing existing entries with the same
   * name, then deletes the work directory.
   * @throws IOException if any of the entries cannot be moved
   */
  public void commitJob() throws IOException {
    for (FileStatus entry : fs.listStatus(workPath)) {
      Path target = new Path(outPath, entry.getPath().getName());
      if (fs.exists(target) && !fs.delete(target, true))
        throw new IOException(String.format("Cannot replace existing output '%s'", target));
      if (!fs.rename(entry.getPath(), target))
        throw new IOException(String.format("Cannot move '%s' to '%s'", entry.getPath(), target));
    }
    fs.delete(workPath, true);
    LOG.info(String.format("Committed output to '%s'", outPath));
  }

  /**
   * Deletes the work directory and everything written to it
   * @throws IOException if the directory cannot be deleted
   */
  public void abortJob() throws IOException {
    if (fs.exists(workPath) && !fs.delete(workPath, true))
      throw new IOException(String.format("Cannot delete temporary directory '%s'", workPath));
    LOG.info(String.format("Discarded temporary output in '%s'", workPath));
  }
}
