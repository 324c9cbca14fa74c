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
package com.regiondb;

import com.regiondb.engine.StorageMode;
import com.regiondb.exception.ConfigurationException;
import com.regiondb.log.LogManager;
import com.regiondb.utility.Callable;
import org.json.JSONObject;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and, when a system
 * property is missing, the environment variable with the same name.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  DUMP_CONFIG_AT_STARTUP("regiondb.dumpConfigAtStartup", "Dumps the configuration at startup", Boolean.class, false,
      new Callable<Object, Object>() {
        @Override
        public Object call(final Object value) {
          if (Boolean.parseBoolean(String.valueOf(value)))
            dumpConfiguration(System.out);
          return value;
        }
      }),

  TEST("regiondb.test", "Tells if it is running in test mode", Boolean.class, false),

  // STORAGE
  STORAGE_MODE("regiondb.storageMode", "Backing store of the mark store and the indexes: 'memory' or 'log' (append-only files)",
      StorageMode.class, StorageMode.MEMORY),

  DATABASE_DIRECTORY("regiondb.databaseDirectory", "Directory containing the log files when storageMode is 'log'", String.class,
      "./databases"),

  LOG_SYNC_ON_WRITE("regiondb.logSyncOnWrite", "Forces the log file on disk (fsync) after every append", Boolean.class, false),

  // FINALIZATION
  FINALIZE_WORKER_THREADS("regiondb.finalizeWorkerThreads", "Number of threads finalizing scopes in parallel. 0 (default) = available cores minus 1",
      Integer.class, 0, new Callable<Object, Object>() {
    @Override
    public Object call(final Object value) {
      final int threads = (int) value;
      if (threads < 0)
        throw new ConfigurationException("Invalid number of finalize worker threads: " + threads);
      return value;
    }
  }),

  FINALIZE_DEBUG("regiondb.finalizeDebug", "Prints the partition of every scope after it has been finalized", Boolean.class, false),
  ;

  /**
   * Place holder for the "undefined" value. This is needed because concurrent maps don't support null values.
   */
  private static final String nullValue = "null";

  private final       String                   key;
  private final       Object                   defValue;
  private final       Class<?>                 type;
  private final       Callable<Object, Object> callback;
  private volatile    Object                   value  = nullValue;
  private final       String                   description;
  public final static String                   PREFIX = "regiondb.";

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String iKey, final String iDescription, final Class<?> iType, final Object iDefValue) {
    this(iKey, iDescription, iType, iDefValue, null);
  }

  GlobalConfiguration(final String iKey, final String iDescription, final Class<?> iType, final Object iDefValue,
      final Callable<Object, Object> callback) {
    this.key = iKey;
    this.description = iDescription;
    this.defValue = iDefValue;
    this.type = iType;
    this.callback = callback;
  }

  /**
   * Reset all the configurations to the default values.
   */
  public static void resetAll() {
    for (GlobalConfiguration v : values())
      v.reset();
  }

  /**
   * Reset the configuration to the default value.
   */
  public void reset() {
    value = nullValue;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.print(Constants.PRODUCT.toUpperCase(Locale.ENGLISH));
    out.print(" ");
    out.print(Constants.getRawVersion());
    out.println(" configuration:");

    for (GlobalConfiguration v : values()) {
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(String.valueOf((Object) v.getValue()));
    }
  }

  public static void fromJSON(final String input) {
    if (input == null)
      return;

    final JSONObject json = new JSONObject(input);
    final JSONObject cfg = json.getJSONObject("configuration");
    for (String k : cfg.keySet()) {
      final GlobalConfiguration cfgEntry = findByKey(PREFIX + k);
      if (cfgEntry != null)
        cfgEntry.setValue(cfg.get(k));
    }
  }

  public static String toJSON() {
    final JSONObject json = new JSONObject();

    final JSONObject cfg = new JSONObject();
    json.put("configuration", cfg);

    for (GlobalConfiguration k : values()) {
      final Object v = k.getValue();
      cfg.put(k.key.substring(PREFIX.length()), v instanceof Enum<?> ? ((Enum<?>) v).name() : v != null ? v : JSONObject.NULL);
    }

    return json.toString();
  }

  /**
   * Find the GlobalConfiguration instance by the key. Key is case insensitive.
   *
   * @param iKey Key to find. It's case insensitive.
   *
   * @return GlobalConfiguration instance if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String iKey) {
    for (GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(iKey))
        return v;
    }
    return null;
  }

  /**
   * Changes the configuration values in one shot by passing a Map of values. Keys can be the Java ENUM names or the string
   * representation of configuration values
   */
  public static void setConfiguration(final Map<String, Object> iConfig) {
    for (Map.Entry<String, Object> config : iConfig.entrySet()) {
      for (GlobalConfiguration v : values()) {
        if (v.getKey().equals(config.getKey()) || v.name().equals(config.getKey())) {
          v.setValue(config.getValue());
          break;
        }
      }
    }
  }

  /**
   * Assign configuration values by reading system properties.
   */
  private static void readConfiguration() {
    String prop;

    for (GlobalConfiguration config : values()) {
      prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null)
        config.setValue(prop);
    }
  }

  public <T> T getValue() {
    //noinspection unchecked
    return (T) (value != nullValue && value != null ? value : defValue);
  }

  /**
   * @return {@literal true} if configuration was changed from default value and {@literal false} otherwise.
   */
  public boolean isChanged() {
    return value != nullValue;
  }

  public void setValue(final Object iValue) {
    value = convert(this, iValue);

    if (callback != null && value != nullValue)
      try {
        final Object newValue = callback.call(value);
        if (newValue != value)
          // OVERWRITE IT
          value = newValue;
      } catch (ConfigurationException e) {
        value = nullValue;
        throw e;
      } catch (Exception e) {
        LogManager.instance().log(this, Level.SEVERE, "Error during setting property %s=%s", e, key, value);
      }
  }

  /**
   * Converts a raw value (typically a string coming from system properties or JSON) to the type of the setting.
   */
  static Object convert(final GlobalConfiguration config, final Object iValue) {
    if (iValue == null)
      return nullValue;

    final Class<?> type = config.type;
    try {
      if (type == Boolean.class)
        return iValue instanceof Boolean ? iValue : Boolean.parseBoolean(iValue.toString());
      else if (type == Integer.class)
        return iValue instanceof Integer ? iValue : Integer.parseInt(iValue.toString().trim());
      else if (type == Long.class)
        return iValue instanceof Long ? iValue : Long.parseLong(iValue.toString().trim());
      else if (type == String.class)
        return iValue.toString();
      else if (type.isEnum()) {
        if (type.isInstance(iValue))
          return iValue;

        final String string = iValue.toString();
        for (Object constant : type.getEnumConstants()) {
          final Enum<?> enumConstant = (Enum<?>) constant;
          if (enumConstant.name().equalsIgnoreCase(string))
            return enumConstant;
        }
        throw new ConfigurationException("Invalid value '" + string + "' of `" + config.key + "` option");
      }
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid value '" + iValue + "' of `" + config.key + "` option", e);
    }
    return iValue;
  }

  public boolean getValueAsBoolean() {
    final Object v = getValue();
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).intValue() : Integer.parseInt(v.toString());
  }

  public long getValueAsLong() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).longValue() : Long.parseLong(v.toString());
  }

  /**
   * @return Value of configuration parameter stored as enumeration.
   *
   * @throws ClassCastException if stored value can not be casted to the passed enumeration class.
   */
  public <T extends Enum<T>> T getValueAsEnum(final Class<T> enumType) {
    final Object v = getValue();
    if (v == null)
      return null;

    if (enumType.isAssignableFrom(v.getClass()))
      return enumType.cast(v);
    else if (v instanceof String)
      return Enum.valueOf(enumType, ((String) v).toUpperCase(Locale.ENGLISH));

    throw new ClassCastException("Value " + v + " can not be cast to enumeration " + enumType.getSimpleName());
  }

  public String getKey() {
    return key;
  }

  public Object getDefValue() {
    return defValue;
  }

  public Class<?> getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }
}
