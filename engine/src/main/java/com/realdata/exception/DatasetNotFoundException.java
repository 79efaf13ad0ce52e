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
package com.realdata.exception;

/**
 * Thrown when an operation references a dataset whose metadata does not exist. Recoverable: callers should treat it as "no data".
 */
public class DatasetNotFoundException extends RealDataException {
  private final String datasetId;

  public DatasetNotFoundException(final String datasetId) {
    super(ErrorCode.DATASET_NOT_FOUND, "Dataset '" + datasetId + "' not found");
    this.datasetId = datasetId;
    addContext("datasetId", datasetId);
  }

  public String getDatasetId() {
    return datasetId;
  }
}
