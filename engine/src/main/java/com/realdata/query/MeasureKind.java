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

import java.util.Locale;

/**
 * Aggregate function applied to the rows of a group.
 */
public enum MeasureKind {
  /** Number of rows, no measure column needed */
  COUNT,
  /** Sum of the numeric values of the measure column */
  SUM,
  /** Average of the numeric values of the measure column */
  AVG;

  public String getName() {
    return name().toLowerCase(Locale.ENGLISH);
  }

  public boolean requiresColumn() {
    return this != COUNT;
  }

  public static MeasureKind fromName(final String name) {
    if (name != null)
      for (final MeasureKind kind : values())
        if (kind.name().equalsIgnoreCase(name))
          return kind;
    throw new QueryException("Unknown measure '" + name + "', supported are count, sum and avg");
  }
}
