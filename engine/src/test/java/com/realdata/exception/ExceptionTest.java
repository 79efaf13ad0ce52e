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

import com.realdata.serializer.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionTest {
  @Test
  void errorCodesBelongToTheirCategory() {
    assertThat(ErrorCode.DATASET_NOT_FOUND.getCategory()).isEqualTo(ErrorCategory.DATABASE);
    assertThat(ErrorCode.INVALID_QUERY.getCategory()).isEqualTo(ErrorCategory.QUERY);
    assertThat(ErrorCode.STORE_UNAVAILABLE.getCategory()).isEqualTo(ErrorCategory.STORAGE);
    assertThat(ErrorCode.PARTIAL_WRITE_FAILURE.getCategory()).isEqualTo(ErrorCategory.STORAGE);
    assertThat(ErrorCode.UNKNOWN_ERROR.getCategory()).isEqualTo(ErrorCategory.INTERNAL);
  }

  @Test
  void codesAreUniqueAndResolvable() {
    for (final ErrorCode code : ErrorCode.values())
      assertThat(ErrorCode.fromCode(code.getCode())).isEqualTo(code);
    assertThat(ErrorCode.fromCode(-1)).isEqualTo(ErrorCode.UNKNOWN_ERROR);
  }

  @Test
  void partialWriteCarriesTheFailedChunk() {
    final PartialWriteException e = new PartialWriteException("sales", 2, 5, new IOException("disk full"));

    assertThat(e.getFailedChunkIndex()).isEqualTo(2);
    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PARTIAL_WRITE_FAILURE);
    assertThat(e.getContext()).containsEntry("datasetId", "sales").containsEntry("totalChunks", 5);
    assertThat(e.getCause()).hasMessage("disk full");

    final JSONObject json = e.toJSON();
    assertThat(json.getInt("errorCode")).isEqualTo(5102);
    assertThat(json.getString("category")).isEqualTo("Storage");
    assertThat(json.getJSONObject("context").getInt("failedChunkIndex")).isEqualTo(2);
    assertThat(json.getString("cause")).isEqualTo("disk full");
  }

  @Test
  void datasetNotFoundNamesTheDataset() {
    final DatasetNotFoundException e = new DatasetNotFoundException("sales");

    assertThat(e.getDatasetId()).isEqualTo("sales");
    assertThat(e).isInstanceOf(RealDataException.class).hasMessageContaining("sales");
    assertThat(e.toString()).isEqualTo("DatasetNotFoundException [Database-1001]: Dataset 'sales' not found");
  }

  @Test
  void nullErrorCodeFallsBackToUnknown() {
    assertThat(new RealDataException(null, "x").getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_ERROR);
  }
}
