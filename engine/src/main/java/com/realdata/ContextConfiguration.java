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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Settings of one {@link DatasetStore} instance. Values not set here fall back to {@link GlobalConfiguration}, so tests can run isolated
 * instances with different chunk sizes or TTLs side by side.
 */
public class ContextConfiguration {
  private final Map<String, Object> config = new ConcurrentHashMap<>();

  public ContextConfiguration() {
  }

  public ContextConfiguration(final Map<String, Object> config) {
    for (final Map.Entry<String, Object> entry : config.entrySet())
      setValue(entry.getKey(), entry.getValue());
  }

  public ContextConfiguration(final ContextConfiguration parent) {
    if (parent != null)
      config.putAll(parent.config);
  }

  public ContextConfiguration setValue(final GlobalConfiguration setting, final Object value) {
    if (value == null)
      config.remove(setting.getKey());
    else
      config.put(setting.getKey(), setting.convert(value));
    return this;
  }

  public ContextConfiguration setValue(final String name, final Object value) {
    final GlobalConfiguration setting = GlobalConfiguration.findByKey(name);
    if (setting != null)
      return setValue(setting, value);

    if (value == null)
      config.remove(name);
    else
      config.put(name, value);
    return this;
  }

  public Object getValue(final GlobalConfiguration setting) {
    final Object value = config.get(setting.getKey());
    return value != null ? value : setting.getValue();
  }

  public int getValueAsInteger(final GlobalConfiguration setting) {
    return ((Number) getValue(setting)).intValue();
  }

  public long getValueAsLong(final GlobalConfiguration setting) {
    return ((Number) getValue(setting)).longValue();
  }

  public boolean getValueAsBoolean(final GlobalConfiguration setting) {
    return Boolean.TRUE.equals(getValue(setting));
  }

  public String getValueAsString(final GlobalConfiguration setting) {
    return String.valueOf(getValue(setting));
  }
}
