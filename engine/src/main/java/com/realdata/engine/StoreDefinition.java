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
package com.realdata.engine;

import com.realdata.exception.StorageException;
import com.realdata.serializer.json.JSONArray;
import com.realdata.serializer.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declaration of a logical store: its name, the record fields that make the primary key (key path) and the secondary indexes, each one
 * defined by its own list of record fields.
 */
public final class StoreDefinition {
  private final String                    name;
  private final List<String>              keyPath;
  private final Map<String, List<String>> indexes;

  private StoreDefinition(final String name, final List<String> keyPath, final Map<String, List<String>> indexes) {
    this.name = name;
    this.keyPath = Collections.unmodifiableList(keyPath);
    this.indexes = Collections.unmodifiableMap(indexes);
  }

  public static Builder builder(final String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public List<String> getKeyPath() {
    return keyPath;
  }

  public Map<String, List<String>> getIndexes() {
    return indexes;
  }

  public List<String> getIndexNames() {
    return new ArrayList<>(indexes.keySet());
  }

  public boolean hasIndex(final String indexName) {
    return indexes.containsKey(indexName);
  }

  /**
   * Extracts the primary key from the record.
   *
   * @throws StorageException if a field of the key path is missing or not a string or a number
   */
  public CompoundKey extractKey(final JSONObject record) {
    final CompoundKey key = extract(keyPath, record);
    if (key == null)
      throw new StorageException("Record does not contain the key path " + keyPath + " of store '" + name + "'");
    return key;
  }

  /**
   * Extracts the key of the index from the record.
   *
   * @return the index key or null when the record does not carry every indexed field, in which case the record is not indexed
   */
  public CompoundKey extractIndexKey(final String indexName, final JSONObject record) {
    final List<String> fields = indexes.get(indexName);
    if (fields == null)
      throw new StorageException("Index '" + indexName + "' not found in store '" + name + "'");
    return extract(fields, record);
  }

  public JSONObject toJSON() {
    final JSONObject indexesJson = new JSONObject();
    for (final Map.Entry<String, List<String>> entry : indexes.entrySet())
      indexesJson.put(entry.getKey(), entry.getValue());
    return new JSONObject().put("name", name).put("keyPath", keyPath).put("indexes", indexesJson);
  }

  public static StoreDefinition fromJSON(final JSONObject json) {
    final Builder builder = builder(json.getString("name")).keyPath(toStrings(json.getJSONArray("keyPath")));
    final JSONObject indexesJson = json.getJSONObject("indexes");
    for (final String indexName : indexesJson.keySet())
      builder.index(indexName, toStrings(indexesJson.getJSONArray(indexName)));
    return builder.build();
  }

  @Override
  public String toString() {
    return name + keyPath;
  }

  private static CompoundKey extract(final List<String> fields, final JSONObject record) {
    final Object[] components = new Object[fields.size()];
    for (int i = 0; i < components.length; i++) {
      final Object value = record.opt(fields.get(i));
      if (!(value instanceof String) && !(value instanceof Number))
        return null;
      components[i] = value;
    }
    return CompoundKey.of(components);
  }

  private static String[] toStrings(final JSONArray array) {
    final String[] result = new String[array.length()];
    for (int i = 0; i < result.length; i++)
      result[i] = array.getString(i);
    return result;
  }

  public static final class Builder {
    private final String                    name;
    private final List<String>              keyPath = new ArrayList<>();
    private final Map<String, List<String>> indexes = new LinkedHashMap<>();

    private Builder(final String name) {
      this.name = name;
    }

    public Builder keyPath(final String... fields) {
      keyPath.clear();
      keyPath.addAll(List.of(fields));
      return this;
    }

    public Builder index(final String indexName, final String... fields) {
      indexes.put(indexName, List.of(fields));
      return this;
    }

    public StoreDefinition build() {
      if (name == null || name.isEmpty())
        throw new IllegalArgumentException("Store name is empty");
      if (keyPath.isEmpty())
        throw new IllegalArgumentException("Store '" + name + "' has no key path");
      return new StoreDefinition(name, new ArrayList<>(keyPath), new LinkedHashMap<>(indexes));
    }
  }
}
