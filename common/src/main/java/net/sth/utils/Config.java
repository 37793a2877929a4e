// This file is part of STH.
// Copyright (C) 2024  The STH Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.sth.utils;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

/**
 * STH Configuration Class
 * <p>
 * Handles the user configurable variables of the query core. On
 * initialization default values are configured for all variables, then a
 * properties file may be loaded on top of them, either from a given path or
 * by searching the default locations.
 * <p>
 * The get&lt;type&gt; number helpers throw NumberFormatExceptions if the
 * requested property is null or unparseable.
 * <p>
 * Components should never change a shared instance. Use the
 * {@link #Config(Config)} constructor to work on a local copy.
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** The upper bound for lastN and hLimit. */
  public static final String MAX_PAGE_SIZE_KEY = "sth.query.max_page_size";

  /** Whether or not empty rollup points are dropped. */
  public static final String FILTER_OUT_EMPTY_KEY = "sth.query.filter_out_empty";

  /** Whether or not the memory store completes on a worker pool. */
  public static final String MEMORY_STORE_THREADPOOL_KEY =
      "sth.store.memory.threadpool.enable";

  /** The name of the file searched for in the default locations. */
  public static final String DEFAULT_FILE = "sth.conf";

  /** The properties configured to their defaults or modified by users. */
  protected final Properties properties = new Properties();

  /** Tracks the location of the file that was actually loaded. */
  private String config_location;

  /**
   * Constructor that initializes default configuration values. May attempt to
   * search for a config file if configured.
   * @param auto_load_config When set to true, attempts to search for a config
   * file in the default locations
   * @throws IOException Thrown if unable to read or parse one of the default
   * config files
   */
  public Config(final boolean auto_load_config) throws IOException {
    if (auto_load_config) {
      loadConfig();
    }
    setDefaults();
  }

  /**
   * Constructor that initializes default values and attempts to load the given
   * properties file.
   * @param file Path to the file to load
   * @throws FileNotFoundException Thrown if the file wasn't found
   * @throws IOException Thrown if unable to read or parse the file
   */
  public Config(final String file) throws FileNotFoundException, IOException {
    loadConfig(file);
    setDefaults();
  }

  /**
   * Copy constructor. Changes to the copy do not affect the parent.
   * @param parent Parent configuration object to load from
   */
  public Config(final Config parent) {
    properties.putAll(parent.properties);
    config_location = parent.config_location;
    setDefaults();
  }

  /**
   * Allows for modifying properties after loading. Meant for command line
   * and unit test overrides.
   * @param property The name of the property to override
   * @param value The value to store
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * @param property The property to load
   * @return The property value as a string, null if not set.
   */
  public final String getString(final String property) {
    return properties.getProperty(property);
  }

  /**
   * @param property The property to load
   * @return A parsed integer
   * @throws NumberFormatException if the property was missing or could not
   * be parsed
   */
  public final int getInt(final String property) {
    return Integer.parseInt(properties.getProperty(property));
  }

  /**
   * @param property The property to load
   * @return A parsed long
   * @throws NumberFormatException if the property was missing or could not
   * be parsed
   */
  public final long getLong(final String property) {
    return Long.parseLong(properties.getProperty(property));
  }

  /**
   * Returns the given property as a boolean. Values are case insensitive and
   * "1", "true" and "yes" are true. Anything else is false.
   * @param property The property to load
   * @return A parsed boolean
   * @throws NullPointerException if the property was not found
   */
  public final boolean getBoolean(final String property) {
    final String value = properties.getProperty(property);
    if (value == null) {
      throw new NullPointerException("No such property: " + property);
    }
    final String val = value.trim().toUpperCase();
    return val.equals("1") || val.equals("TRUE") || val.equals("YES");
  }

  /**
   * @param property The property to search for
   * @return True if the property exists and has a non-empty value.
   */
  public final boolean hasProperty(final String property) {
    return !Strings.isNullOrEmpty(properties.getProperty(property));
  }

  /** @return The maximum number of points a page may hold. */
  public int maxPageSize() {
    return getInt(MAX_PAGE_SIZE_KEY);
  }

  /** @return Whether or not empty rollup points are filtered out. */
  public boolean filterOutEmpty() {
    return getBoolean(FILTER_OUT_EMPTY_KEY);
  }

  /** @return The path of the file loaded, null if defaults were used. */
  public String configLocation() {
    return config_location;
  }

  /** @return A simple string with the configured properties for debugging */
  public final String dumpConfiguration() {
    if (properties.isEmpty()) {
      return "No configuration settings stored";
    }

    final StringBuilder buf = new StringBuilder("STH Configuration:\n")
        .append("File [").append(config_location).append("]\n");
    final Enumeration<?> e = properties.propertyNames();
    while (e.hasMoreElements()) {
      final String key = (String) e.nextElement();
      buf.append("Key [").append(key).append("]  Value [")
         .append(properties.getProperty(key)).append("]\n");
    }
    return buf.toString();
  }

  /**
   * Loads default entries that were not provided by a file or command line.
   */
  protected void setDefaults() {
    final Map<String, String> map = new HashMap<String, String>();
    map.put(MAX_PAGE_SIZE_KEY, "100");
    map.put(FILTER_OUT_EMPTY_KEY, "true");
    map.put(MEMORY_STORE_THREADPOOL_KEY, "false");

    for (final Map.Entry<String, String> entry : map.entrySet()) {
      if (!properties.containsKey(entry.getKey())) {
        properties.put(entry.getKey(), entry.getValue());
      }
    }
  }

  /**
   * Searches a list of locations for a valid sth.conf file. The file must be
   * a standard Java properties file. If none of the locations have one, the
   * defaults or overrides are used.
   * @throws IOException Thrown if there was an issue reading a file
   */
  protected void loadConfig() throws IOException {
    if (!Strings.isNullOrEmpty(config_location)) {
      loadConfig(config_location);
      return;
    }

    final List<String> file_locations = new ArrayList<String>();
    file_locations.add(DEFAULT_FILE);
    file_locations.add("/etc/sth/" + DEFAULT_FILE);
    file_locations.add("/opt/sth/" + DEFAULT_FILE);

    for (final String file : file_locations) {
      try (final InputStream file_stream = new FileInputStream(file)) {
        properties.clear();
        properties.load(file_stream);
      } catch (FileNotFoundException e) {
        // the file may be missing and that's fine
        LOG.debug("Unable to find " + file);
        continue;
      }

      LOG.info("Successfully loaded configuration file: " + file);
      config_location = file;
      return;
    }

    LOG.info("No configuration found, will use defaults");
  }

  /**
   * Attempts to load the configuration from the given location.
   * @param file Path to the file to load
   * @throws IOException Thrown if there was an issue reading the file
   * @throws FileNotFoundException Thrown if the config file was not found
   */
  protected void loadConfig(final String file) throws FileNotFoundException,
      IOException {
    try (final InputStream file_stream = new FileInputStream(file)) {
      properties.clear();
      properties.load(file_stream);
    }
    LOG.info("Successfully loaded configuration file: " + file);
    config_location = file;
  }

}
