/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.realdata;

import com.realdata.exception.ConfigurationException;
import com.realdata.log.LogManager;
import com.realdata.serializer.json.JSONObject;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and, when missing,
 * environment variables with the same name.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  DUMP_CONFIG_AT_STARTUP("realdata.dumpConfigAtStartup", "Dumps the configuration at startup", Boolean.class, false, value -> {
    if ((Boolean) value)
      dumpConfiguration(System.out);
    return value;
  }),

  // STORAGE
  CHUNK_SIZE("realdata.chunkSize",
      "Maximum number of rows per chunk of new writes. Existing chunks keep the size recorded in their metadata until they are replaced",
      Integer.class, 1000, value -> {
    if ((Integer) value < 1)
      throw new ConfigurationException("Setting 'realdata.chunkSize' must be positive, found " + value);
    return value;
  }),

  STORE_COMPRESSION("realdata.storeCompression", "Compression of the stored records between 'lz4' and 'none'", String.class, "lz4"),

  STORE_OPERATION_TIMEOUT("realdata.storeOperationTimeout",
      "Deadline in milliseconds for operations submitted to the async executor. 0 disables the deadline", Long.class, 30_000L),

  ASYNC_WORKER_THREADS("realdata.asyncWorkerThreads",
      "Number of asynchronous worker threads. The default 1 keeps the operations of one store strictly ordered", Integer.class, 1),

  // CACHE
  CACHE_TTL("realdata.cacheTTL", "Time to live in milliseconds of the cached aggregation results", Long.class, 3_600_000L),

  // QUERY
  PAGE_SIZE("realdata.pageSize", "Default number of rows returned by a page", Integer.class, 1000),

  UNIQUE_VALUES_LIMIT("realdata.uniqueValuesLimit", "Default maximum number of distinct values returned for a column", Integer.class, 100),

  FILTERED_DATA_LIMIT("realdata.filteredDataLimit", "Default maximum number of rows returned by a filtered scan", Integer.class, 1000),

  AGGREGATION_MAX_RETRIES("realdata.aggregationMaxRetries",
      "Number of times an aggregation is re-executed when the dataset changed during the scan", Integer.class, 3),
  ;

  public final static String PREFIX = "realdata.";

  private final    String                   key;
  private final    Object                   defValue;
  private final    Class<?>                 type;
  private final    String                   description;
  private final    Function<Object, Object> callback;
  private volatile Object                   value;

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue) {
    this(key, description, type, defValue, null);
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue,
      final Function<Object, Object> callback) {
    this.key = key;
    this.description = description;
    this.type = type;
    this.defValue = defValue;
    this.callback = callback;
  }

  /**
   * Reset all the configurations to the default values.
   */
  public static void resetAll() {
    for (final GlobalConfiguration v : values())
      v.reset();
  }

  public void reset() {
    value = null;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.print(Constants.PRODUCT);
    out.print(" ");
    out.print(Constants.getRawVersion());
    out.println(" configuration:");

    for (final GlobalConfiguration v : values()) {
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(String.valueOf((Object) v.getValue()));
    }
  }

  public static void fromJSON(final String input) {
    if (input == null)
      return;

    final JSONObject cfg = new JSONObject(input).getJSONObject("configuration");
    for (final String k : cfg.keySet()) {
      final GlobalConfiguration cfgEntry = findByKey(PREFIX + k);
      if (cfgEntry != null)
        cfgEntry.setValue(cfg.get(k));
    }
  }

  public static JSONObject toJSON() {
    final JSONObject cfg = new JSONObject();
    for (final GlobalConfiguration k : values())
      cfg.put(k.key.substring(PREFIX.length()), (Object) k.getValue());
    return new JSONObject().put("configuration", cfg);
  }

  /**
   * Finds the setting by key, case insensitive.
   *
   * @return the setting if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String key) {
    for (final GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(key))
        return v;
    }
    return null;
  }

  /**
   * Changes the configuration values in one shot. Keys can be the enum names or the setting keys.
   */
  public static void setConfiguration(final Map<String, Object> config) {
    for (final Map.Entry<String, Object> entry : config.entrySet()) {
      for (final GlobalConfiguration v : values()) {
        if (v.getKey().equals(entry.getKey()) || v.name().equals(entry.getKey())) {
          v.setValue(entry.getValue());
          break;
        }
      }
    }
  }

  private static void readConfiguration() {
    for (final GlobalConfiguration config : values()) {
      String prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null) {
        try {
          config.setValue(prop);
        } catch (final RuntimeException e) {
          LogManager.instance().log(GlobalConfiguration.class, Level.SEVERE, "Invalid value '%s' for setting %s, using default", e, prop,
              config.key);
        }
      }
    }
  }

  @SuppressWarnings("unchecked")
  public <T> T getValue() {
    return (T) (value != null ? value : defValue);
  }

  public int getValueAsInteger() {
    return ((Number) getValue()).intValue();
  }

  public long getValueAsLong() {
    return ((Number) getValue()).longValue();
  }

  public boolean getValueAsBoolean() {
    return (Boolean) getValue();
  }

  public String getValueAsString() {
    return String.valueOf((Object) getValue());
  }

  public boolean isChanged() {
    return value != null;
  }

  /**
   * Converts the value to the type of the setting, runs the setting callback and assigns it.
   *
   * @throws ConfigurationException if the value cannot be converted or is rejected by the setting
   */
  public void setValue(final Object newValue) {
    if (newValue == null) {
      value = null;
      return;
    }
    final Object converted = convert(newValue);
    value = callback != null ? callback.apply(converted) : converted;
  }

  Object convert(final Object newValue) {
    try {
      if (type == Boolean.class)
        return newValue instanceof Boolean ? newValue : Boolean.parseBoolean(newValue.toString());
      else if (type == Integer.class)
        return newValue instanceof Number ? ((Number) newValue).intValue() : Integer.parseInt(newValue.toString().trim());
      else if (type == Long.class)
        return newValue instanceof Number ? ((Number) newValue).longValue() : Long.parseLong(newValue.toString().trim());
      else if (type == String.class)
        return newValue.toString();
      return newValue;
    } catch (final NumberFormatException e) {
      throw new ConfigurationException("Invalid value '" + newValue + "' for setting " + key, e);
    }
  }

  public String getKey() {
    return key;
  }

  public Class<?> getType() {
    return type;
  }

  public Object getDefValue() {
    return defValue;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return key.toLowerCase(Locale.ENGLISH) + "=" + getValue();
  }
}
