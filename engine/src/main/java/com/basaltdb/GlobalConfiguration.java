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
package com.basaltdb;

import com.basaltdb.database.AutoId;
import com.basaltdb.log.LogManager;
import org.json.JSONObject;

import java.io.PrintStream;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  DUMP_CONFIG_AT_STARTUP("basaltdb.dumpConfigAtStartup", "Dumps the configuration at startup", Boolean.class, false, value -> {
    if (Boolean.TRUE.equals(value))
      dumpConfiguration(System.out);
    return value;
  }),

  // STORAGE
  PAGE_SIZE("basaltdb.pageSize", "Size in bytes of a storage page. Payloads that do not fit in a data page are chained on overflow pages",
      Integer.class, 4096, value -> {
    if (value != null && (int) value < 1024)
      throw new IllegalArgumentException("Page size must be at least 1024 bytes");
    return value;
  }),

  MAX_COLLECTIONS_SIZE("basaltdb.maxCollectionsSize",
      "Maximum size in bytes of the collection directory. Each collection takes its name length plus 8 bytes", Integer.class, 3000),

  // TRANSACTIONS
  TX_LOCK_TIMEOUT("basaltdb.txLockTimeout",
      "Timeout in ms to acquire the header or a collection lock. 0 waits until the lock is released", Long.class, 0L),

  // INDEXES
  MAX_INDEXES("basaltdb.maxIndexes", "Maximum number of indexes per collection, including the primary key index", Integer.class, 16),

  INDEX_NODES_PER_PAGE("basaltdb.indexNodesPerPage", "Maximum number of index nodes stored in one index page", Integer.class, 64),

  // DOCUMENTS
  DEFAULT_AUTO_ID("basaltdb.defaultAutoId", "Identity generated for documents without '_id' when the caller does not specify one",
      AutoId.class, AutoId.OBJECT_ID);

  public static final String PREFIX = "basaltdb.";

  private final String                   key;
  private final Object                   defValue;
  private final Class<?>                 type;
  private final String                   description;
  private final Function<Object, Object> callback;
  private final Object                   nullValue = new Object();
  private volatile Object                value     = nullValue;

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
    this.defValue = defValue;
    this.type = type;
    this.callback = callback;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.print("BASALTDB SETTINGS:");

    String lastSection = "";
    for (final GlobalConfiguration v : values()) {
      final String section = v.key.substring(PREFIX.length(), v.key.indexOf('.', PREFIX.length()) > -1 ?
          v.key.indexOf('.', PREFIX.length()) :
          v.key.length());

      if (!lastSection.equals(section)) {
        out.print("\n- ");
        out.print(section.toUpperCase());
        lastSection = section;
      }
      out.print("\n  + ");
      out.print(v.key);
      out.print(" = ");
      out.print(v.getValue() != null ? v.getValue().toString() : "-");
    }
    out.println();
  }

  public static String toJSON() {
    final JSONObject json = new JSONObject();
    final JSONObject cfg = new JSONObject();
    json.put("configuration", cfg);

    for (final GlobalConfiguration k : values())
      cfg.put(k.key.substring(PREFIX.length()), k.getValue() instanceof Enum<?> e ? e.name() : k.getValue());

    return json.toString();
  }

  /**
   * Find the GlobalConfiguration instance by the key. Key is case insensitive.
   *
   * @return GlobalConfiguration instance if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String key) {
    for (final GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(key))
        return v;
    }
    return null;
  }

  /**
   * Changes the configuration values in one shot by passing a Map of values. Keys can be the Java ENUM names or the string
   * representation of configuration values
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

  /**
   * Assign configuration values by reading system properties and then environment variables.
   */
  private static void readConfiguration() {
    for (final GlobalConfiguration config : values()) {
      String prop = System.getProperty(config.key);
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

  public void reset() {
    value = nullValue;
  }

  public void setValue(final Object newValue) {
    Object converted = convert(newValue);

    if (callback != null)
      try {
        converted = callback.apply(converted);
      } catch (final IllegalArgumentException e) {
        throw e;
      } catch (final Exception e) {
        LogManager.instance().log(this, Level.SEVERE, "Error during setting property %s=%s", e, key, newValue);
      }

    value = converted;
  }

  Object convert(final Object newValue) {
    if (newValue == null)
      return null;

    if (type == Boolean.class)
      return Boolean.parseBoolean(newValue.toString());
    else if (type == Integer.class)
      return Integer.parseInt(newValue.toString());
    else if (type == Long.class)
      return Long.parseLong(newValue.toString());
    else if (type == String.class)
      return newValue.toString();
    else if (type.isEnum()) {
      if (type.isInstance(newValue))
        return newValue;

      if (newValue instanceof String string)
        for (final Object constant : type.getEnumConstants()) {
          if (((Enum<?>) constant).name().equalsIgnoreCase(string))
            return constant;
        }

      throw new IllegalArgumentException("Invalid value of `" + key + "` option: " + newValue);
    }
    return newValue;
  }

  public boolean getValueAsBoolean() {
    final Object v = getValue();
    return v instanceof Boolean b ? b : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger() {
    final Object v = getValue();
    return v instanceof Number n ? n.intValue() : Integer.parseInt(v.toString());
  }

  public long getValueAsLong() {
    final Object v = getValue();
    return v instanceof Number n ? n.longValue() : Long.parseLong(v.toString());
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
