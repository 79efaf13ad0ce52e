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

import com.realdata.serializer.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ordered mapping column key to {@link Value}. An absent column reads as {@link Value#NULL}.
 */
public final class Row {
  private final LinkedHashMap<String, Value> values;

  public Row() {
    this.values = new LinkedHashMap<>();
  }

  private Row(final LinkedHashMap<String, Value> values) {
    this.values = values;
  }

  /**
   * Creates a row from pairs of column key and value, for example {@code Row.of("region", "EU", "sales", 10)}.
   */
  public static Row of(final Object... keyValues) {
    if (keyValues.length % 2 != 0)
      throw new IllegalArgumentException("Expected pairs of column and value");
    final Row row = new Row();
    for (int i = 0; i < keyValues.length; i += 2)
      row.set((String) keyValues[i], keyValues[i + 1]);
    return row;
  }

  public static Row fromMap(final Map<String, ?> map) {
    final Row row = new Row();
    for (final Map.Entry<String, ?> entry : map.entrySet())
      row.set(entry.getKey(), entry.getValue());
    return row;
  }

  public Value get(final String column) {
    final Value value = column != null ? values.get(column) : null;
    return value != null ? value : Value.NULL;
  }

  public boolean has(final String column) {
    return values.containsKey(column);
  }

  public Row set(final String column, final Object value) {
    if (column == null)
      throw new IllegalArgumentException("Column key is null");
    values.put(column, Value.of(value));
    return this;
  }

  public Set<String> getColumns() {
    return Collections.unmodifiableSet(values.keySet());
  }

  public int size() {
    return values.size();
  }

  public Map<String, Value> toMap() {
    return Collections.unmodifiableMap(values);
  }

  public JSONObject toJSON() {
    final JSONObject json = new JSONObject();
    for (final Map.Entry<String, Value> entry : values.entrySet())
      json.put(entry.getKey(), entry.getValue().toJSON());
    return json;
  }

  public static Row fromJSON(final JSONObject json) {
    final LinkedHashMap<String, Value> values = new LinkedHashMap<>();
    for (final String column : json.keySet())
      values.put(column, Value.fromJSON(json.opt(column)));
    return new Row(values);
  }

  @Override
  public boolean equals(final Object o) {
    return this == o || (o instanceof Row && values.equals(((Row) o).values));
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
