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

import com.realdata.dataset.Row;
import com.realdata.dataset.Value;
import com.realdata.exception.QueryException;
import com.realdata.serializer.json.JSONObject;

import java.util.List;
import java.util.Locale;

/**
 * Equality condition on a column, compared case-insensitively on the text form of the value. A row where the column is absent or null
 * never matches. Several filters are combined with AND.
 *
 * @param column column key
 * @param value  expected text
 */
public record EqualityFilter(String column, String value) {
  public EqualityFilter {
    if (column == null || column.isEmpty())
      throw new QueryException("Filter column is empty");
    if (value == null)
      throw new QueryException("Filter value on column '" + column + "' is null");
  }

  public static EqualityFilter of(final String column, final String value) {
    return new EqualityFilter(column, value);
  }

  public boolean matches(final Row row) {
    final Value cell = row.get(column);
    if (cell.isNull())
      return false;
    return cell.asText().toLowerCase(Locale.ROOT).equals(value.toLowerCase(Locale.ROOT));
  }

  /**
   * @return true if the row matches every filter, always true with no filters
   */
  public static boolean matchesAll(final Row row, final List<EqualityFilter> filters) {
    if (filters == null)
      return true;
    for (final EqualityFilter filter : filters)
      if (!filter.matches(row))
        return false;
    return true;
  }

  public JSONObject toJSON() {
    return new JSONObject().put("column", column).put("value", value);
  }

  @Override
  public String toString() {
    return column + "=" + value;
  }
}
