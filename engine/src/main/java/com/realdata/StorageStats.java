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
package com.realdata;

import com.realdata.serializer.json.JSONObject;

/**
 * Storage footprint summary.
 *
 * @param projectCount number of datasets
 * @param totalRows    sum of the row counts of the datasets, data sources excluded
 * @param totalChunks  sum of the chunk counts of the datasets, data sources excluded
 * @param cacheSize    number of cache entries, expired ones included until evicted
 */
public record StorageStats(long projectCount, long totalRows, long totalChunks, long cacheSize) {
  public JSONObject toJSON() {
    return new JSONObject().put("projectCount", projectCount).put("totalRows", totalRows).put("totalChunks", totalChunks)
        .put("cacheSize", cacheSize);
  }
}
