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
package com.realdata.query;

import com.realdata.serializer.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered result of an aggregation: group key to value or, for stacked aggregations, group key to (stack key to value). Groups keep
 * the order they were added with, which for engine results is the descending order of their totals.
 */
public final class AggregationResult {
  private final boolean                                      stacked;
  private final Map<String, Double>                          values = new LinkedHashMap<>();
  private final Map<String, LinkedHashMap<String, Double>> stacks = new LinkedHashMap<>();

  public AggregationResult(final boolean stacked) {
    this.stacked = stacked;
  }

  public void putValue(final String group, final double value) {
    if (stacked)
      throw new IllegalStateException("Cannot set a scalar value on a stacked result");
    values.put(group, value);
  }

  public void putStack(final String group, final Map<String, Double> stack) {
    if (!stacked)
      throw new IllegalStateException("Cannot set a stack on a scalar result");
    stacks.put(group, new LinkedHashMap<>(stack));
  }

  public boolean isStacked() {
    return stacked;
  }

  public int size() {
    return stacked ? stacks.size() : values.size();
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public List<String> getGroups() {
    return new ArrayList<>(stacked ? stacks.keySet() : values.keySet());
  }

  public boolean contains(final String group) {
    return stacked ? stacks.containsKey(group) : values.containsKey(group);
  }

  /**
   * Returns the value of the group, or the total of its stack for stacked results. 0 if the group is not present.
   */
  public double getValue(final String group) {
    return getTotal(group);
  }

  /**
   * @return the stack of the group, empty if the result is not stacked or the group is not present
   */
  public Map<String, Double> getStack(final String group) {
    final Map<String, Double> stack = stacks.get(group);
    return stack != null ? Collections.unmodifiableMap(stack) : Collections.emptyMap();
  }

  public double getTotal(final String group) {
    if (!stacked) {
      final Double value = values.get(group);
      return value != null ? value : 0;
    }
    double total = 0;
    for (final double v : getStack(group).values())
      total += v;
    return total;
  }

  public double getGrandTotal() {
    double total = 0;
    for (final String group : getGroups())
      total += getTotal(group);
    return total;
  }

  /**
   * Returns the result as nested maps, in group order.
   */
  public Map<String, Object> toMap() {
    final Map<String, Object> map = new LinkedHashMap<>();
    if (stacked)
      for (final Map.Entry<String, LinkedHashMap<String, Double>> entry : stacks.entrySet())
        map.put(entry.getKey(), Collections.unmodifiableMap(entry.getValue()));
    else
      map.putAll(values);
    return Collections.unmodifiableMap(map);
  }

  public JSONObject toJSON() {
    return new JSONObject().put("stacked", stacked).put("groups", new JSONObject(toMap()));
  }

  public static AggregationResult fromJSON(final JSONObject json) {
    final boolean stacked = json.getBoolean("stacked");
    final AggregationResult result = new AggregationResult(stacked);
    final JSONObject groups = json.getJSONObject("groups");
    for (final String group : groups.keySet()) {
      if (stacked) {
        final JSONObject stackJson = groups.getJSONObject(group);
        final LinkedHashMap<String, Double> stack = new LinkedHashMap<>();
        for (final String stackKey : stackJson.keySet())
          stack.put(stackKey, stackJson.getDouble(stackKey));
        result.stacks.put(group, stack);
      } else
        result.values.put(group, groups.getDouble(group));
    }
    return result;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof AggregationResult))
      return false;
    final AggregationResult that = (AggregationResult) o;
    // ORDER MATTERS
    return stacked == that.stacked && new ArrayList<>(toMap().entrySet()).equals(new ArrayList<>(that.toMap().entrySet()));
  }

  @Override
  public int hashCode() {
    return Objects.hash(stacked, toMap());
  }

  @Override
  public String toString() {
    return toMap().toString();
  }
}
