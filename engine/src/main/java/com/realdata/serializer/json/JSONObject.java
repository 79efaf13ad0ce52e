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

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.Strictness;
import com.google.gson.internal.LazilyParsedNumber;
import com.google.gson.stream.JsonReader;

import java.io.StringReader;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * JSON object.<br>
 * This API is compatible with org.json Java API, but uses Google GSON library under the hood. Attributes keep their insertion order,
 * which the stored records and the cache keys rely on.
 *
 * @author Luca Garulli (l.garulli@arcadedata.com)
 */
public class JSONObject {
  public static final JsonNull   NULL = JsonNull.INSTANCE;
  private final       JsonObject object;

  public JSONObject() {
    this.object = new JsonObject();
  }

  public JSONObject(final JsonObject input) {
    this.object = input;
  }

  public JSONObject(final String input) {
    if (input != null) {
      try {
        final JsonReader reader = new JsonReader(new StringReader(input));
        reader.setStrictness(Strictness.LENIENT);
        object = JsonParser.parseReader(reader).getAsJsonObject();
      } catch (final Exception e) {
        throw new JSONException("Invalid JSON object format: " + input, e);
      }
    } else
      object = new JsonObject();
  }

  public JSONObject(final Map<String, ?> map) {
    object = new JsonObject();
    if (map != null)
      for (final Map.Entry<String, ?> entry : map.entrySet())
        put(entry.getKey(), entry.getValue());
  }

  public JSONObject copy() {
    return new JSONObject(object.deepCopy());
  }

  public JSONObject put(final String name, final Object value) {
    if (name == null)
      throw new IllegalArgumentException("Property name is null");
    object.add(name, objectToElement(value));
    return this;
  }

  public String getString(final String name) {
    return getElement(name).getAsString();
  }

  public int getInt(final String name) {
    return getElement(name).getAsNumber().intValue();
  }

  public long getLong(final String name) {
    return getElement(name).getAsNumber().longValue();
  }

  public double getDouble(final String name) {
    return getElement(name).getAsDouble();
  }

  public boolean getBoolean(final String name) {
    return getElement(name).getAsBoolean();
  }

  public JSONObject getJSONObject(final String name) {
    return new JSONObject(getElement(name).getAsJsonObject());
  }

  public JSONArray getJSONArray(final String name) {
    return new JSONArray(getElement(name).getAsJsonArray());
  }

  public Object get(final String name) {
    return elementToObject(getElement(name));
  }

  public Object opt(final String name) {
    return name == null ? null : elementToObject(object.get(name));
  }

  public String optString(final String name, final String defaultValue) {
    final Object value = opt(name);
    return value == null ? defaultValue : value.toString();
  }

  public long optLong(final String name, final long defaultValue) {
    final Object value = opt(name);
    return value instanceof Number ? ((Number) value).longValue() : defaultValue;
  }

  public int optInt(final String name, final int defaultValue) {
    final Object value = opt(name);
    return value instanceof Number ? ((Number) value).intValue() : defaultValue;
  }

  public boolean optBoolean(final String name, final boolean defaultValue) {
    final Object value = opt(name);
    return value instanceof Boolean ? (Boolean) value : defaultValue;
  }

  public JSONArray optJSONArray(final String name) {
    final JsonElement element = object.get(name);
    return element != null && element.isJsonArray() ? new JSONArray(element.getAsJsonArray()) : null;
  }

  public JSONObject optJSONObject(final String name) {
    final JsonElement element = object.get(name);
    return element != null && element.isJsonObject() ? new JSONObject(element.getAsJsonObject()) : null;
  }

  public boolean has(final String name) {
    return object.has(name);
  }

  public boolean isNull(final String name) {
    return !object.has(name) || object.get(name).isJsonNull();
  }

  public Object remove(final String name) {
    final JsonElement oldElement = object.remove(name);
    return oldElement != null ? elementToObject(oldElement) : null;
  }

  public Set<String> keySet() {
    return object.keySet();
  }

  public int length() {
    return object.size();
  }

  public boolean isEmpty() {
    return object.size() == 0;
  }

  public Map<String, Object> toMap() {
    final Map<String, Object> result = new LinkedHashMap<>(object.size());
    for (final Map.Entry<String, JsonElement> entry : object.entrySet()) {
      Object value = elementToObject(entry.getValue());
      if (value instanceof JSONObject)
        value = ((JSONObject) value).toMap();
      else if (value instanceof JSONArray)
        value = ((JSONArray) value).toList();
      result.put(entry.getKey(), value);
    }
    return result;
  }

  /**
   * Serializes the object with all the attribute names sorted at every nesting level. Two objects holding the same attributes produce
   * the same string regardless of the order the attributes were put.
   */
  public String toCanonicalString() {
    return JSONFactory.INSTANCE.getGson().toJson(sortKeys(object));
  }

  public JsonObject getInternal() {
    return object;
  }

  public String toString(final int indent) {
    return JSONFactory.INSTANCE.getGsonPrettyPrint().toJson(object);
  }

  @Override
  public String toString() {
    return JSONFactory.INSTANCE.getGson().toJson(object);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof JSONObject))
      return false;
    return object.equals(((JSONObject) o).object);
  }

  @Override
  public int hashCode() {
    return object.hashCode();
  }

  private static JsonElement sortKeys(final JsonElement element) {
    if (element.isJsonObject()) {
      final TreeMap<String, JsonElement> sorted = new TreeMap<>(element.getAsJsonObject().asMap());
      final JsonObject result = new JsonObject();
      for (final Map.Entry<String, JsonElement> entry : sorted.entrySet())
        result.add(entry.getKey(), sortKeys(entry.getValue()));
      return result;
    } else if (element.isJsonArray()) {
      final com.google.gson.JsonArray result = new com.google.gson.JsonArray();
      for (final JsonElement item : element.getAsJsonArray())
        result.add(sortKeys(item));
      return result;
    }
    return element;
  }

  protected static Object elementToObject(final JsonElement element) {
    if (element == null || element.isJsonNull())
      return null;
    else if (element.isJsonPrimitive()) {
      final JsonPrimitive primitive = element.getAsJsonPrimitive();
      if (primitive.isNumber()) {
        final Number value = primitive.getAsNumber();
        if (!(value instanceof LazilyParsedNumber))
          return value;

        final String strValue = primitive.getAsString();
        if (strValue.contains(".") || strValue.contains("e") || strValue.contains("E") || strValue.contains("N") || strValue.contains("I"))
          return primitive.getAsDouble();

        try {
          final long longVal = primitive.getAsLong();
          if (longVal >= Integer.MIN_VALUE && longVal <= Integer.MAX_VALUE)
            return (int) longVal;
          return longVal;
        } catch (final NumberFormatException e) {
          return primitive.getAsDouble();
        }
      } else if (primitive.isString())
        return primitive.getAsString();
      else if (primitive.isBoolean())
        return primitive.getAsBoolean();

    } else if (element.isJsonObject())
      return new JSONObject(element.getAsJsonObject());
    else if (element.isJsonArray())
      return new JSONArray(element.getAsJsonArray());

    throw new IllegalArgumentException("Element " + element + " not supported");
  }

  @SuppressWarnings("unchecked")
  protected static JsonElement objectToElement(final Object value) {
    if (value == null)
      return NULL;
    else if (value instanceof JsonElement)
      return (JsonElement) value;
    else if (value instanceof String)
      return new JsonPrimitive((String) value);
    else if (value instanceof Number)
      return new JsonPrimitive((Number) value);
    else if (value instanceof Boolean)
      return new JsonPrimitive((Boolean) value);
    else if (value instanceof Character)
      return new JsonPrimitive((Character) value);
    else if (value instanceof JSONObject)
      return ((JSONObject) value).getInternal();
    else if (value instanceof JSONArray)
      return ((JSONArray) value).getInternal();
    else if (value instanceof Collection)
      return new JSONArray((Collection<?>) value).getInternal();
    else if (value instanceof Map)
      return new JSONObject((Map<String, ?>) value).getInternal();
    else if (value instanceof Enum<?>)
      return new JsonPrimitive(((Enum<?>) value).name());
    return new JsonPrimitive(value.toString());
  }

  private JsonElement getElement(final String name) {
    if (name == null)
      throw new JSONException("Null key");

    final JsonElement value = object.get(name);
    if (value == null)
      throw new JSONException("JSONObject[" + name + "] not found");

    return value;
  }
}
