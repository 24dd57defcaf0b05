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

import org.json.JSONObject;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Represents a context configuration where custom setting could be defined for the context only. If not defined, globals will be
 * taken.
 **/
public class ContextConfiguration {
  private final Map<String, Object> config = new ConcurrentHashMap<>();

  /**
   * Empty constructor to create just a proxy for the GlobalConfiguration. No values are set.
   */
  public ContextConfiguration() {
  }

  public ContextConfiguration(final Map<String, Object> initial) {
    this.config.putAll(initial);
  }

  public ContextConfiguration(final ContextConfiguration parent) {
    if (parent != null)
      config.putAll(parent.config);
  }

  public void fromJSON(final String input) {
    if (input == null)
      return;

    final JSONObject json = new JSONObject(input);

    final JSONObject cfg = json.getJSONObject("configuration");
    for (final String k : cfg.keySet()) {
      final GlobalConfiguration cfgEntry = GlobalConfiguration.findByKey(GlobalConfiguration.PREFIX + k);
      if (cfgEntry != null)
        config.put(cfgEntry.getKey(), cfg.get(k));
    }
  }

  public String toJSON() {
    final JSONObject json = new JSONObject();

    final JSONObject cfg = new JSONObject();
    json.put("configuration", cfg);

    for (final Map.Entry<String, Object> entry : config.entrySet()) {
      final String name = entry.getKey().startsWith(GlobalConfiguration.PREFIX) ?
          entry.getKey().substring(GlobalConfiguration.PREFIX.length()) :
          entry.getKey();
      cfg.put(name, entry.getValue() instanceof Enum<?> e ? e.name() : entry.getValue());
    }

    return json.toString();
  }

  public ContextConfiguration setValue(final GlobalConfiguration key, final Object value) {
    if (value == null)
      config.remove(key.getKey());
    else
      config.put(key.getKey(), value);
    return this;
  }

  public ContextConfiguration setValue(final String name, final Object value) {
    if (value == null)
      config.remove(name);
    else
      config.put(name, value);
    return this;
  }

  public Object getValue(final GlobalConfiguration key) {
    if (config.containsKey(key.getKey()))
      return config.get(key.getKey());
    return key.getValue();
  }

  @SuppressWarnings("unchecked")
  public <T> T getValue(final String name, final T defaultValue) {
    if (config.containsKey(name))
      return (T) config.get(name);
    return defaultValue;
  }

  public boolean hasValue(final String name) {
    return config.containsKey(name);
  }

  public <T extends Enum<T>> T getValueAsEnum(final GlobalConfiguration key, final Class<T> enumType) {
    final Object value = getValue(key);
    if (value == null)
      return null;

    if (enumType.isInstance(value))
      return enumType.cast(value);
    else if (value instanceof String string) {
      for (final T constant : enumType.getEnumConstants())
        if (constant.name().equalsIgnoreCase(string))
          return constant;
      throw new IllegalArgumentException("Invalid value of `" + key.getKey() + "` option: " + value);
    }
    throw new ClassCastException("Value " + value + " can not be cast to enumeration " + enumType.getSimpleName());
  }

  public boolean getValueAsBoolean(final GlobalConfiguration key) {
    final Object v = getValue(key);
    if (v == null)
      return false;
    return v instanceof Boolean b ? b : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString(final GlobalConfiguration key) {
    final Object v = getValue(key);
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger(final GlobalConfiguration key) {
    final Object v = getValue(key);
    if (v == null)
      return 0;
    return v instanceof Number n ? n.intValue() : Integer.parseInt(v.toString());
  }

  public long getValueAsLong(final GlobalConfiguration key) {
    final Object v = getValue(key);
    if (v == null)
      return 0;
    return v instanceof Number n ? n.longValue() : Long.parseLong(v.toString());
  }

  public Set<String> getContextKeys() {
    return config.keySet();
  }

  public void merge(final ContextConfiguration other) {
    this.config.putAll(other.config);
  }

  public void reset() {
    config.clear();
  }
}
