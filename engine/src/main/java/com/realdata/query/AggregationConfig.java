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
import com.realdata.serializer.json.JSONArray;
import com.realdata.serializer.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Parameters of an aggregation: group rows by {@code dimension}, optionally split every group by {@code stackBy}, apply the measure and
 * keep the first {@code limit} groups by descending total. Instances are immutable, build them with {@link #builder(String)}.
 * <p>
 * Example:
 * <pre>
 * AggregationConfig.builder("region").measure(MeasureKind.SUM, "sales").stackBy("channel").limit(10)
 *     .filter("year", "2024").build();
 * </pre>
 */
public final class AggregationConfig {
  private final String               dimension;
  private final MeasureKind          measure;
  private final String               measureColumn;
  private final String               stackBy;
  private final int                  limit;
  private final List<EqualityFilter> filters;

  private AggregationConfig(final Builder builder) {
    this.dimension = builder.dimension;
    this.measure = builder.measure;
    this.measureColumn = builder.measureColumn;
    this.stackBy = builder.stackBy;
    this.limit = builder.limit;
    this.filters = Collections.unmodifiableList(new ArrayList<>(builder.filters));
  }

  public static Builder builder(final String dimension) {
    return new Builder(dimension);
  }

  public String getDimension() {
    return dimension;
  }

  public MeasureKind getMeasure() {
    return measure;
  }

  public String getMeasureColumn() {
    return measureColumn;
  }

  public String getStackBy() {
    return stackBy;
  }

  public boolean isStacked() {
    return stackBy != null;
  }

  /**
   * @return the maximum number of groups, 0 for no limit
   */
  public int getLimit() {
    return limit;
  }

  public List<EqualityFilter> getFilters() {
    return filters;
  }

  /**
   * Returns the configuration as JSON, with the filters sorted so that equivalent configurations produce equal objects.
   */
  public JSONObject toJSON() {
    final List<EqualityFilter> sorted = new ArrayList<>(filters);
    sorted.sort(Comparator.comparing(EqualityFilter::column).thenComparing(EqualityFilter::value));
    final JSONArray filtersJson = new JSONArray();
    for (final EqualityFilter filter : sorted)
      filtersJson.put(filter.toJSON());

    return new JSONObject().put("dimension", dimension).put("measure", measure.getName()).put("measureCol", measureColumn)
        .put("stackBy", stackBy).put("limit", limit).put("filters", filtersJson);
  }

  /**
   * Canonical text of the configuration: equal for configurations that differ only in the order of the filters, different otherwise.
   */
  public String toCanonicalString() {
    return toJSON().toCanonicalString();
  }

  @Override
  public boolean equals(final Object o) {
    return this == o || (o instanceof AggregationConfig && toCanonicalString().equals(((AggregationConfig) o).toCanonicalString()));
  }

  @Override
  public int hashCode() {
    return toCanonicalString().hashCode();
  }

  @Override
  public String toString() {
    return toCanonicalString();
  }

  public static final class Builder {
    private final String               dimension;
    private       MeasureKind          measure = MeasureKind.COUNT;
    private       String               measureColumn;
    private       String               stackBy;
    private       int                  limit;
    private final List<EqualityFilter> filters = new ArrayList<>();

    private Builder(final String dimension) {
      this.dimension = dimension;
    }

    public Builder count() {
      this.measure = MeasureKind.COUNT;
      this.measureColumn = null;
      return this;
    }

    public Builder measure(final MeasureKind measure, final String measureColumn) {
      this.measure = measure;
      this.measureColumn = measureColumn;
      return this;
    }

    public Builder sum(final String measureColumn) {
      return measure(MeasureKind.SUM, measureColumn);
    }

    public Builder avg(final String measureColumn) {
      return measure(MeasureKind.AVG, measureColumn);
    }

    public Builder stackBy(final String stackBy) {
      this.stackBy = stackBy;
      return this;
    }

    public Builder limit(final int limit) {
      this.limit = Math.max(0, limit);
      return this;
    }

    public Builder filter(final String column, final String value) {
      filters.add(EqualityFilter.of(column, value));
      return this;
    }

    public Builder filters(final List<EqualityFilter> filters) {
      if (filters != null)
        this.filters.addAll(filters);
      return this;
    }

    /**
     * @throws QueryException if the dimension is empty or a sum/avg measure has no measure column
     */
    public AggregationConfig build() {
      if (dimension == null || dimension.isEmpty())
        throw new QueryException("Aggregation dimension is empty");
      if (measure == null)
        throw new QueryException("Aggregation measure is null");
      if (measure.requiresColumn() && (measureColumn == null || measureColumn.isEmpty()))
        throw new QueryException("Measure '" + measure.getName() + "' requires a measure column");
      if (stackBy != null && stackBy.isEmpty())
        stackBy = null;
      if (measure == MeasureKind.COUNT)
        measureColumn = null;
      return new AggregationConfig(this);
    }
  }
}
