/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exm.obli.common;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.io.IOUtils;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimaps;

import exm.obli.common.exceptions.InvalidOptionException;
import exm.obli.common.exceptions.ObliRuntimeError;

/**
 * General obli settings
 *
 * Every key can be overridden with a Java system property of the
 * same name, e.g. -Dobli.secrecy.scoped=false
 * */
public class Settings
{
  /** Secrecy marks made under a let body or branch stay in that scope */
  public static final String SECRECY_SCOPED = "obli.secrecy.scoped";
  /** secret(...) forces secrecy through every node shape */
  public static final String SECRECY_TOTAL_FORCING =
                                          "obli.secrecy.total-forcing";

  public static final String EMIT_HEADER = "obli.emit.header";

  public static final String INPUT_FILENAME = "obli.input_filename";
  public static final String OUTPUT_FILENAME = "obli.output_filename";
  public static final String OBLI_VERSION = "obli.version";

  public static final String LOG_FILE = "obli.log.file";
  public static final String LOG_TRACE = "obli.log.trace";

  private static final String VERSION_RESOURCE = "/obli-version.txt";

  private static final Properties properties;

  /** Additional metadata, reported in generated code header */
  private static final ListMultimap<String, String> metadata =
      Multimaps.synchronizedListMultimap(
          ArrayListMultimap.<String, String>create());

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(SECRECY_SCOPED, "true");
    defaults.setProperty(SECRECY_TOTAL_FORCING, "true");
    defaults.setProperty(EMIT_HEADER, "true");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    defaults.setProperty(OBLI_VERSION, "unknown");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initObliProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
    loadVersionNumber();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set for key so that the default applies again
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static void addMetadata(String key, String val) {
    metadata.put(key, val);
  }

  /**
   * @return metadata values recorded under key, in order of addition
   */
  public static List<String> getMetadata(String key) {
    return Collections.unmodifiableList(metadata.get(key));
  }

  public static List<String> getMetadataKeys() {
    List<String> keys = new ArrayList<String>(metadata.keySet());
    Collections.sort(keys);
    return keys;
  }

  private static void loadVersionNumber() {
    InputStream in = Settings.class.getResourceAsStream(VERSION_RESOURCE);
    if (in == null) {
      throw new ObliRuntimeError("Version resource missing: "
                                 + VERSION_RESOURCE);
    }
    try {
      String version = IOUtils.toString(in, StandardCharsets.UTF_8).trim();
      properties.setProperty(OBLI_VERSION, version);
    } catch (IOException e) {
      throw new ObliRuntimeError("IOException while reading version " +
                                 "resource: " + e.getMessage());
    } finally {
      IOUtils.closeQuietly(in);
    }
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    // Check that boolean values are correct
    getBoolean(SECRECY_SCOPED);
    getBoolean(SECRECY_TOTAL_FORCING);
    getBoolean(EMIT_HEADER);
    getBoolean(LOG_TRACE);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
