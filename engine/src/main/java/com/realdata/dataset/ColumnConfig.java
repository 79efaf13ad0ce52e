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
package com.realdata.dataset;

import com.realdata.exception.ConfigurationException;
import com.realdata.serializer.json.JSONObject;

import java.util.Locale;
import java.util.Objects;

/**
 * Declaration of a dataset column: key, type, visibility and an optional display label.
 */
public class ColumnConfig {
  public enum Type {
    STRING("string"), NUMBER("number"), DATE("date"), TAG_ARRAY("tag_array"), SENTIMENT("sentiment"), CHANNEL("channel");

    private final String name;

    Type(final String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    public static Type fromName(final String name) {
      for (final Type type : values())
        if (type.name.equals(name.toLowerCase(Locale.ENGLISH)))
          return type;
      throw new ConfigurationException("Unknown column type '" + name + "'");
    }
  }

  private final String  key;
  private final Type    type;
  private final boolean visible;
  private final String  label;

  public ColumnConfig(final String key, final Type type) {
    this(key, type, true, null);
  }

  public ColumnConfig(final String key, final Type type, final boolean visible, final String label) {
    if (key == null || key.isEmpty())
      throw new ConfigurationException("Column key is empty");
    this.key = key;
    this.type = Objects.requireNonNull(type, "type");
    this.visible = visible;
    this.label = label;
  }

  public String getKey() {
    return key;
  }

  public Type getType() {
    return type;
  }

  public boolean isVisible() {
    return visible;
  }

  public String getLabel() {
    return label;
  }

  public String getDisplayName() {
    return label != null ? label : key;
  }

  public JSONObject toJSON() {
    final JSONObject json = new JSONObject().put("key", key).put("type", type.getName()).put("visible", visible);
    if (label != null)
      json.put("label", label);
    return json;
  }

  public static ColumnConfig fromJSON(final JSONObject json) {
    return new ColumnConfig(json.getString("key"), Type.fromName(json.getString("type")), json.optBoolean("visible", true),
        json.optString("label", null));
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof ColumnConfig))
      return false;
    final ColumnConfig that = (ColumnConfig) o;
    return visible == that.visible && key.equals(that.key) && type == that.type && Objects.equals(label, that.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, type, visible, label);
  }

  @Override
  public String toString() {
    return key + ":" + type.getName();
  }
}
