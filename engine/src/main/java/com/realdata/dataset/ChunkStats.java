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

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of the chunk operations.
 */
public class ChunkStats {
  public final AtomicLong chunkReads   = new AtomicLong();
  public final AtomicLong chunkWrites  = new AtomicLong();
  public final AtomicLong chunkDeletes = new AtomicLong();
  public final AtomicLong batchInserts = new AtomicLong();
  public final AtomicLong appends      = new AtomicLong();
  public final AtomicLong failedWrites = new AtomicLong();

  public Map<String, Object> toMap() {
    final Map<String, Object> map = new HashMap<>();
    map.put("chunkReads", chunkReads.get());
    map.put("chunkWrites", chunkWrites.get());
    map.put("chunkDeletes", chunkDeletes.get());
    map.put("batchInserts", batchInserts.get());
    map.put("appends", appends.get());
    map.put("failedWrites", failedWrites.get());
    return map;
  }

  public void reset() {
    chunkReads.set(0);
    chunkWrites.set(0);
    chunkDeletes.set(0);
    batchInserts.set(0);
    appends.set(0);
    failedWrites.set(0);
  }
}
