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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * User options of a tiling run. The options are stored as string key-value pairs in a Hadoop
 * {@link Configuration} that does not load any default resources, so only the options that the user
 * explicitly set are stored.
 */
public class ColorTilesOptions {
  private static final Log LOG = LogFactory.getLog(ColorTilesOptions.class);

  /**The underlying key-value store*/
  private final Configuration conf;

  public ColorTilesOptions() {
    this.conf = new Configuration(false);
  }

  /**
   * Creates options that are initialized from the given configuration.
   * @param conf the configuration to copy
   */
  public ColorTilesOptions(Configuration conf) {
    this.conf = new Configuration(conf);
  }

  public ColorTilesOptions set(String key, String value) {
    conf.set(key, value);
    return this;
  }

  public ColorTilesOptions set(String key, int value) {
    conf.setInt(key, value);
    return this;
  }

  public ColorTilesOptions set(String key, double value) {
    conf.setDouble(key, value);
    return this;
  }

  public ColorTilesOptions set(String key, boolean value) {
    conf.setBoolean(key, value);
    return this;
  }

  public boolean contains(String key) {
    return conf.get(key) != null;
  }

  public String getString(String key) {
    return conf.get(key);
  }

  public String getString(String key, String defaultValue) {
    return conf.get(key, defaultValue);
  }

  public int getInt(String key, int defaultValue) {
    return conf.getInt(key, defaultValue);
  }

  public double getDouble(String key, double defaultValue) {
    return conf.getDouble(key, defaultValue);
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    return conf.getBoolean(key, defaultValue);
  }

  /**
   * Returns the value of an enumerated option. The value is matched case-insensitively against the enum constants.
   * @param key the name of the option
   * @param defaultValue the value to return if the option is not set
   * @param <E> the type of the enumeration
   * @return the parsed enum value
   * @throws IllegalArgumentException if the value does not match any of the constants
   */
  public <E extends Enum<E>> E getEnum(String key, E defaultValue) {
    String value = conf.get(key);
    if (value == null)
      return defaultValue;
    return Enum.valueOf(defaultValue.getDeclaringClass(), value.trim().toUpperCase(Locale.ROOT));
  }

  /**
   * Copies all the options into the given Hadoop configuration, e.g., to configure a file system.
   * @param hadoopConf the configuration to load into
   * @return the same configuration that was passed
   */
  public Configuration loadIntoHadoopConf(Configuration hadoopConf) {
    for (Map.Entry<String, String> entry : conf)
      hadoopConf.set(entry.getKey(), entry.getValue());
    return hadoopConf;
  }

  /**
   * Parses the command line arguments. An argument of the form {@code key:value} sets an option,
   * {@code -key} sets a boolean option to true and {@code -no-key} sets it to false.
   * All other arguments are returned as positional arguments in their original order.
   * @param args the command line arguments
   * @return the list of positional arguments
   */
  public List<String> parseArguments(String[] args) {
    List<String> positional = new ArrayList<>();
    for (String arg : args) {
      int colon = arg.indexOf(':');
      if (arg.startsWith("-no-") && arg.length() > 4) {
        set(arg.substring(4), false);
      } else if (arg.startsWith("-") && arg.length() > 1) {
        set(arg.substring(1), true);
      } else if (colon > 0 && !isWindowsDrive(arg, colon)) {
        set(arg.substring(0, colon), arg.substring(colon + 1));
      } else {
        positional.add(arg);
      }
    }
    return positional;
  }

  private static boolean isWindowsDrive(String arg, int colon) {
    return colon == 1 && arg.length() > 2 && (arg.charAt(2) == '\\' || arg.charAt(2) == '/');
  }

  /**
   * Loads options from a text file that contains one {@code key=value} pair per line.
   * Options that are already set are overwritten by the file. Lines starting with '#' are ignored.
   * @param fs the file system that contains the file
   * @param path the path of the file
   * @return this object to allow chaining
   * @throws IOException if the file cannot be read
   */
  public ColorTilesOptions loadFromTextFile(FileSystem fs, Path path) throws IOException {
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(fs.open(path), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        line = line.trim();
        if (line.isEmpty() || line.startsWith("#"))
          continue;
        int separator = line.indexOf('=');
        if (separator == -1) {
          LOG.warn(String.format("Skipping malformed line '%s' in '%s'", line, path));
          continue;
        }
        set(line.substring(0, separator).trim(), line.substring(separator + 1).trim());
      }
    }
    return this;
  }

  /**
   * Writes all the options to a text file in the format read by {@link #loadFromTextFile(FileSystem, Path)}.
   * @param fs the file system to write to
   * @param path the path of the file to write
   * @throws IOException if the file cannot be written
   */
  public void storeToTextFile(FileSystem fs, Path path) throws IOException {
    try (PrintStream out = new PrintStream(fs.create(path, true), false, StandardCharsets.UTF_8.name())) {
      for (Map.Entry<String, String> entry : toMap().entrySet())
        out.printf("%s=%s\n", entry.getKey(), entry.getValue());
    }
  }

  /**
   * Returns all the options sorted by key
   * @return a sorted map of all options
   */
  public Map<String, String> toMap() {
    Map<String, String> map = new TreeMap<>();
    for (Map.Entry<String, String> entry : conf)
      map.put(entry.getKey(), entry.getValue());
    return map;
  }

  @Override
  public String toString() {
    return toMap().toString();
  }
}
