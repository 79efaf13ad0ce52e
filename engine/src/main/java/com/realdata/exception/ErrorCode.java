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

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes. Codes are organized in categories based on the first digit:
 * <ul>
 *   <li>1xxx - Dataset errors (lifecycle, metadata, configuration)</li>
 *   <li>3xxx - Query errors (aggregation parameters)</li>
 *   <li>5xxx - Storage errors (substrate availability, I/O, serialization, deadlines)</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see RealDataException
 */
public enum ErrorCode {
  // ========== Dataset Errors (1xxx) ==========
  /** Metadata missing for the requested dataset id */
  DATASET_NOT_FOUND(1001, "Dataset not found"),

  /** Invalid setting or operation argument */
  CONFIGURATION_ERROR(1008, "Configuration error"),

  // ========== Query Errors (3xxx) ==========
  /** Aggregation parameters are invalid */
  INVALID_QUERY(3001, "Invalid query"),

  // ========== Storage Errors (5xxx) ==========
  /** File system I/O operation failed */
  IO_ERROR(5001, "I/O error"),

  /** Stored record cannot be encoded or decoded */
  SERIALIZATION_ERROR(5004, "Serialization error"),

  /** The persistence substrate cannot be opened */
  STORE_UNAVAILABLE(5101, "Store unavailable"),

  /** A multi-chunk write aborted before completion, metadata left untouched */
  PARTIAL_WRITE_FAILURE(5102, "Partial write failure"),

  /** A store operation did not complete within its deadline */
  STORE_TIMEOUT(5103, "Store operation timeout"),

  // ========== Internal Errors (99xxx) ==========
  INTERNAL_ERROR(99001, "Internal error"),

  UNKNOWN_ERROR(99999, "Unknown error");

  private static final Map<Integer, ErrorCode> BY_CODE = Stream.of(values())
      .collect(Collectors.toMap(ErrorCode::getCode, Function.identity()));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  public int getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  public ErrorCategory getCategory() {
    if (code >= 99000)
      return ErrorCategory.INTERNAL;
    if (code >= 5000)
      return ErrorCategory.STORAGE;
    if (code >= 3000)
      return ErrorCategory.QUERY;
    return ErrorCategory.DATABASE;
  }

  /**
   * Returns the error code with the given numeric value, or {@link #UNKNOWN_ERROR}.
   */
  public static ErrorCode fromCode(final int code) {
    return BY_CODE.getOrDefault(code, UNKNOWN_ERROR);
  }
}
