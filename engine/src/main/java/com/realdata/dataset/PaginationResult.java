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

import java.util.List;

/**
 * One page of rows.
 *
 * @param rows     rows of the page, at most {@code pageSize}
 * @param total    total rows of the dataset
 * @param page     zero based page number
 * @param pageSize requested page size
 * @param hasMore  true if rows exist after this page
 */
public record PaginationResult(List<Row> rows, long total, int page, int pageSize, boolean hasMore) {
  public static PaginationResult empty(final int page, final int pageSize) {
    return new PaginationResult(List.of(), 0, page, pageSize, false);
  }
}
