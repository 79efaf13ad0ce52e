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
package com.realdata.dataset;

import com.realdata.exception.ConfigurationException;

/**
 * Addresses the rows of a dataset: the primary rows when {@code sourceId} is null, otherwise the rows of one of its data sources.
 */
public record DatasetScope(String datasetId, String sourceId) {
  public DatasetScope {
    if (datasetId == null || datasetId.isEmpty())
      throw new ConfigurationException("Dataset id is empty");
    if (sourceId != null && sourceId.isEmpty())
      throw new ConfigurationException("Data source id is empty");
  }

  public static DatasetScope of(final String datasetId) {
    return new DatasetScope(datasetId, null);
  }

  public static DatasetScope of(final String datasetId, final String sourceId) {
    return new DatasetScope(datasetId, sourceId);
  }

  public boolean isSource() {
    return sourceId != null;
  }

  @Override
  public String toString() {
    return sourceId != null ? datasetId + "/" + sourceId : datasetId;
  }
}
