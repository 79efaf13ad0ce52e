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

import com.realdata.exception.QueryException;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shapes an {@link AggregationResult} for presentation: top-N with an "Others" bucket and normalization to shares. Both return a new
 * result and keep the group order of the input.
 */
public final class ResultPostProcessor {
  public static final String OTHERS_GROUP = "Others";

  private ResultPostProcessor() {
  }

  /**
   * Keeps the first {@code n} groups and merges the remaining ones into {@value #OTHERS_GROUP}, appended last. For stacked results the
   * Others stack has every stack key of the result, each summed over the merged groups. The grand total does not change. Unstacked
   * overflow summing to 0 adds no Others group.
   */
  public static AggregationResult collapseTopN(final AggregationResult input, final int n) {
    if (n < 1)
      throw new QueryException("Top N must be greater than 0, found " + n);

    final List<String> groups = input.getGroups();
    final AggregationResult result = new AggregationResult(input.isStacked());
    if (groups.size() <= n) {
      copy(input, result, groups);
      return result;
    }

    final List<String> kept = groups.subList(0, n);
    final List<String> overflow = groups.subList(n, groups.size());

    if (!input.isStacked()) {
      double others = 0;
      for (final String group : overflow)
        others += input.getValue(group);

      for (final String group : kept)
        result.putValue(group, input.getValue(group) + (group.equals(OTHERS_GROUP) ? others : 0));
      if (others != 0 && !kept.contains(OTHERS_GROUP))
        result.putValue(OTHERS_GROUP, others);
      return result;
    }

    final Set<String> stackKeys = new LinkedHashSet<>();
    for (final String group : groups)
      stackKeys.addAll(input.getStack(group).keySet());

    final Map<String, Double> others = new LinkedHashMap<>();
    for (final String stackKey : stackKeys) {
      double sum = 0;
      for (final String group : overflow)
        sum += input.getStack(group).getOrDefault(stackKey, 0D);
      others.put(stackKey, sum);
    }

    for (final String group : kept) {
      if (group.equals(OTHERS_GROUP)) {
        final Map<String, Double> merged = new LinkedHashMap<>(input.getStack(group));
        others.forEach((k, v) -> merged.merge(k, v, Double::sum));
        result.putStack(group, merged);
      } else
        result.putStack(group, input.getStack(group));
    }
    if (!kept.contains(OTHERS_GROUP))
      result.putStack(OTHERS_GROUP, others);
    return result;
  }

  /**
   * Converts the values to shares between 0 and 1. Stacked results are normalized per group (every stack sums to 1), unstacked results
   * over the grand total. A zero total gives zeros.
   */
  public static AggregationResult normalizeToPercent(final AggregationResult input) {
    final AggregationResult result = new AggregationResult(input.isStacked());
    if (input.isStacked()) {
      for (final String group : input.getGroups()) {
        final double total = input.getTotal(group);
        final Map<String, Double> normalized = new LinkedHashMap<>();
        for (final Map.Entry<String, Double> entry : input.getStack(group).entrySet())
          normalized.put(entry.getKey(), total == 0 ? 0 : entry.getValue() / total);
        result.putStack(group, normalized);
      }
    } else {
      final double total = input.getGrandTotal();
      for (final String group : input.getGroups())
        result.putValue(group, total == 0 ? 0 : input.getValue(group) / total);
    }
    return result;
  }

  private static void copy(final AggregationResult from, final AggregationResult to, final List<String> groups) {
    for (final String group : groups)
      if (from.isStacked())
        to.putStack(group, from.getStack(group));
      else
        to.putValue(group, from.getValue(group));
  }
}
