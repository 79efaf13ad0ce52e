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

import com.realdata.serializer.json.JSONArray;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable key made of one or more components, compared component by component. Numbers sort before strings, a shorter key sorts before
 * any longer key it is a prefix of. Integral numbers are normalized to {@link Long} so that {@code 1} and {@code 1.0} are the same key.
 */
public final class CompoundKey implements Comparable<CompoundKey> {
  private final Object[] components;
  private final int      hashCode;

  private CompoundKey(final Object[] components) {
    this.components = components;
    this.hashCode = Arrays.hashCode(components);
  }

  public static CompoundKey of(final Object... components) {
    if (components == null || components.length == 0)
      throw new IllegalArgumentException("A key needs at least one component");

    final Object[] normalized = new Object[components.length];
    for (int i = 0; i < components.length; i++)
      normalized[i] = normalize(components[i]);
    return new CompoundKey(normalized);
  }

  public static CompoundKey fromJSON(final JSONArray array) {
    final Object[] components = new Object[array.length()];
    for (int i = 0; i < components.length; i++)
      components[i] = array.get(i);
    return of(components);
  }

  public int size() {
    return components.length;
  }

  public Object get(final int index) {
    return components[index];
  }

  public String getString(final int index) {
    return (String) components[index];
  }

  public long getLong(final int index) {
    return ((Number) components[index]).longValue();
  }

  /**
   * Returns a new key with the additional components at the end.
   */
  public CompoundKey append(final Object... more) {
    final Object[] all = Arrays.copyOf(components, components.length + more.length);
    for (int i = 0; i < more.length; i++)
      all[components.length + i] = normalize(more[i]);
    return new CompoundKey(all);
  }

  public boolean startsWith(final CompoundKey prefix) {
    if (prefix.components.length > components.length)
      return false;
    for (int i = 0; i < prefix.components.length; i++)
      if (compareComponents(components[i], prefix.components[i]) != 0)
        return false;
    return true;
  }

  public List<Object> toList() {
    return new ArrayList<>(Arrays.asList(components));
  }

  public JSONArray toJSON() {
    return new JSONArray(Arrays.asList(components));
  }

  @Override
  public int compareTo(final CompoundKey other) {
    final int common = Math.min(components.length, other.components.length);
    for (int i = 0; i < common; i++) {
      final int cmp = compareComponents(components[i], other.components[i]);
      if (cmp != 0)
        return cmp;
    }
    return Integer.compare(components.length, other.components.length);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof CompoundKey))
      return false;
    return Arrays.equals(components, ((CompoundKey) o).components);
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public String toString() {
    return Arrays.toString(components);
  }

  private static int compareComponents(final Object a, final Object b) {
    final boolean aNumber = a instanceof Number;
    final boolean bNumber = b instanceof Number;
    if (aNumber && bNumber) {
      if (a instanceof Long && b instanceof Long)
        return Long.compare((Long) a, (Long) b);
      return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
    }
    if (aNumber)
      return -1;
    if (bNumber)
      return 1;
    return ((String) a).compareTo((String) b);
  }

  private static Object normalize(final Object component) {
    if (component instanceof String)
      return component;
    if (component instanceof Integer || component instanceof Long || component instanceof Short || component instanceof Byte)
      return ((Number) component).longValue();
    if (component instanceof Number) {
      final double d = ((Number) component).doubleValue();
      if (Double.isNaN(d))
        throw new IllegalArgumentException("NaN is not a valid key component");
      if (d == Math.rint(d) && Math.abs(d) < 9.007199254740992E15)
        return (long) d;
      return d;
    }
    throw new IllegalArgumentException("Key component '" + component + "' must be a string or a number");
  }
}
