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
package com.realdata.serializer.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * JSON array.<br>
 * This API is compatible with org.json Java API, but uses Google GSON library under the hood.
 *
 * @author Luca Garulli (l.garulli@arcadedata.com)
 */
public class JSONArray implements Iterable<Object> {
  private final JsonArray array;

  public JSONArray() {
    this.array = new JsonArray();
  }

  public JSONArray(final JsonArray input) {
    array = input;
  }

  public JSONArray(final String input) {
    try {
      array = JsonParser.parseString(input).getAsJsonArray();
    } catch (final Exception e) {
      throw new JSONException("Invalid JSON array format", e);
    }
  }

  public JSONArray(final Collection<?> input) {
    this.array = new JsonArray();
    for (final Object o : input)
      this.array.add(JSONObject.objectToElement(o));
  }

  public List<Object> toList() {
    final List<Object> result = new ArrayList<>(array.size());
    for (final JsonElement e : array) {
      Object value = JSONObject.elementToObject(e);
      if (value instanceof JSONObject)
        value = ((JSONObject) value).toMap();
      else if (value instanceof JSONArray)
        value = ((JSONArray) value).toList();
      result.add(value);
    }
    return result;
  }

  public int length() {
    return array.size();
  }

  public boolean isEmpty() {
    return array.isEmpty();
  }

  public Object get(final int index) {
    return JSONObject.elementToObject(array.get(index));
  }

  public String getString(final int index) {
    return array.get(index).getAsString();
  }

  public JSONObject getJSONObject(final int index) {
    return new JSONObject(array.get(index).getAsJsonObject());
  }

  public JSONArray getJSONArray(final int index) {
    return new JSONArray(array.get(index).getAsJsonArray());
  }

  public JSONArray put(final Object value) {
    array.add(JSONObject.objectToElement(value));
    return this;
  }

  public JsonArray getInternal() {
    return array;
  }

  @Override
  public Iterator<Object> iterator() {
    final Iterator<JsonElement> it = array.iterator();
    return new Iterator<>() {
      @Override
      public boolean hasNext() {
        return it.hasNext();
      }

      @Override
      public Object next() {
        return JSONObject.elementToObject(it.next());
      }
    };
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof JSONArray))
      return false;
    return array.equals(((JSONArray) o).array);
  }

  @Override
  public int hashCode() {
    return array.hashCode();
  }

  @Override
  public String toString() {
    return JSONFactory.INSTANCE.getGson().toJson(array);
  }
}
