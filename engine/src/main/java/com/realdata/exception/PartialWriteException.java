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
 * Thrown when a batch insert or append aborts before every chunk was written. The dataset metadata is left unmodified, so the whole
 * operation can be retried.
 */
public class PartialWriteException extends RealDataException {
  private final int failedChunkIndex;

  public PartialWriteException(final String datasetId, final int failedChunkIndex, final int totalChunks, final Throwable cause) {
    super(ErrorCode.PARTIAL_WRITE_FAILURE,
        "Write of chunk " + failedChunkIndex + " of dataset '" + datasetId + "' failed (" + totalChunks + " chunks in operation)", cause);
    this.failedChunkIndex = failedChunkIndex;
    addContext("datasetId", datasetId);
    addContext("failedChunkIndex", failedChunkIndex);
    addContext("totalChunks", totalChunks);
  }

  public int getFailedChunkIndex() {
    return failedChunkIndex;
  }
}
