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

import org.json.JSONObject;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Represents a context configuration where custom setting could be defined for the context only (typically one
 * {@link RegionDatabase}). If not defined, globals will be taken.
 **/
public class ContextConfiguration {
  private final Map<String, Object> config = new ConcurrentHashMap<>();

  /**
   * Empty constructor to create just a proxy for the GlobalConfiguration. No values are set.
   */
  public ContextConfiguration() {
  }

  /**
   * Initializes the context with custom parameters.
   *
   * @param iConfig Map of parameters of type {@literal Map<String, Object>}.
   */
  public ContextConfiguration(final Map<String, Object> iConfig) {
    this.config.putAll(iConfig);
  }

  public ContextConfiguration(final ContextConfiguration iParent) {
    if (iParent != null)
      config.putAll(iParent.config);
  }

  public void fromJSON(final String input) {
    if (input == null)
      return;

    final JSONObject json = new JSONObject(input);

    final JSONObject cfg = json.getJSONObject("configuration");
    for (String k : cfg.keySet()) {
      final GlobalConfiguration cfgEntry = GlobalConfiguration.findByKey(GlobalConfiguration.PREFIX + k);
      if (cfgEntry != null)
        config.put(cfgEntry.getKey(), cfg.get(k));
    }
  }

  public String toJSON() {
    final JSONObject json = new JSONObject();

    final JSONObject cfg = new JSONObject();
    json.put("configuration", cfg);

    for (Map.Entry<String, Object> entry : config.entrySet()) {
      final Object v = entry.getValue();
      cfg.put(entry.getKey().substring(GlobalConfiguration.PREFIX.length()), v instanceof Enum<?> ? ((Enum<?>) v).name() : v);
    }

    return json.toString();
  }

  public ContextConfiguration setValue(final GlobalConfiguration iConfig, final Object iValue) {
    if (iValue == null)
      config.remove(iConfig.getKey());
    else
      config.put(iConfig.getKey(), GlobalConfiguration.convert(iConfig, iValue));
    return this;
  }

  public Object getValue(final GlobalConfiguration iConfig) {
    final Object v = config.get(iConfig.getKey());
    if (v != null)
      return v;
    return iConfig.getValue();
  }

  public boolean hasValue(final GlobalConfiguration iConfig) {
    return config.containsKey(iConfig.getKey());
  }

  public boolean getValueAsBoolean(final GlobalConfiguration iConfig) {
    final Object v = getValue(iConfig);
    if (v == null)
      return false;
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString(final GlobalConfiguration iConfig) {
    final Object v = getValue(iConfig);
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger(final GlobalConfiguration iConfig) {
    final Object v = getValue(iConfig);
    if (v == null)
      return 0;
    return v instanceof Number ? ((Number) v).intValue() : Integer.parseInt(v.toString());
  }

  public <T extends Enum<T>> T getValueAsEnum(final GlobalConfiguration iConfig, final Class<T> enumType) {
    final Object v = getValue(iConfig);
    if (v == null)
      return null;

    if (enumType.isAssignableFrom(v.getClass()))
      return enumType.cast(v);
    else if (v instanceof String)
      return Enum.valueOf(enumType, ((String) v).toUpperCase(Locale.ENGLISH));

    throw new ClassCastException("Value " + v + " can not be cast to enumeration " + enumType.getSimpleName());
  }

  public Set<String> getContextKeys() {
    return config.keySet();
  }
}
