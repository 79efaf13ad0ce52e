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

/**
 * Range of keys scanned by a {@link StoreCursor}. A range is either bounded (lower and/or upper key, each open or closed) or a prefix
 * range matching every key that starts with the given components.
 */
public final class KeyRange {
  private static final KeyRange ALL = new KeyRange(null, false, null, false, false);

  private final CompoundKey lower;
  private final boolean     lowerOpen;
  private final CompoundKey upper;
  private final boolean     upperOpen;
  private final boolean     prefix;

  private KeyRange(final CompoundKey lower, final boolean lowerOpen, final CompoundKey upper, final boolean upperOpen,
      final boolean prefix) {
    this.lower = lower;
    this.lowerOpen = lowerOpen;
    this.upper = upper;
    this.upperOpen = upperOpen;
    this.prefix = prefix;
  }

  public static KeyRange all() {
    return ALL;
  }

  public static KeyRange only(final CompoundKey key) {
    return new KeyRange(key, false, key, false, false);
  }

  public static KeyRange only(final Object... components) {
    return only(CompoundKey.of(components));
  }

  public static KeyRange prefix(final CompoundKey prefix) {
    return new KeyRange(prefix, false, null, false, true);
  }

  public static KeyRange prefix(final Object... components) {
    return prefix(CompoundKey.of(components));
  }

  public static KeyRange lowerBound(final CompoundKey lower, final boolean open) {
    return new KeyRange(lower, open, null, false, false);
  }

  public static KeyRange upperBound(final CompoundKey upper, final boolean open) {
    return new KeyRange(null, false, upper, open, false);
  }

  public static KeyRange bound(final CompoundKey lower, final CompoundKey upper, final boolean lowerOpen, final boolean upperOpen) {
    return new KeyRange(lower, lowerOpen, upper, upperOpen, false);
  }

  public CompoundKey getLower() {
    return lower;
  }

  public boolean isLowerOpen() {
    return lowerOpen;
  }

  public boolean includes(final CompoundKey key) {
    if (prefix)
      return key.startsWith(lower);

    if (lower != null) {
      final int cmp = key.compareTo(lower);
      if (cmp < 0 || (cmp == 0 && lowerOpen))
        return false;
    }
    return !isPast(key);
  }

  /**
   * Tells if the key sorts after every key of the range, so an ordered scan can stop.
   */
  public boolean isPast(final CompoundKey key) {
    if (prefix)
      return key.compareTo(lower) > 0 && !key.startsWith(lower);

    if (upper == null)
      return false;
    final int cmp = key.compareTo(upper);
    return cmp > 0 || (cmp == 0 && upperOpen);
  }

  @Override
  public String toString() {
    if (prefix)
      return "prefix" + lower;
    return (lowerOpen ? "(" : "[") + (lower != null ? lower : "-inf") + ".." + (upper != null ? upper : "+inf") + (upperOpen ? ")" : "]");
  }
}
