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
package com.basaltdb.exception;

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes for BasaltDB exceptions.
 * Error codes are organized in categories based on the first digit(s):
 * <ul>
 *   <li>1xxx - Database errors (arguments, configuration)</li>
 *   <li>2xxx - Transaction errors (locking, lifecycle)</li>
 *   <li>5xxx - Storage errors (pages, data blocks, serialization)</li>
 *   <li>7xxx - Schema errors (collections, identity values)</li>
 *   <li>8xxx - Index errors (structure, constraints)</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see BasaltDBException
 */
public enum ErrorCode {
  // ========== Database Errors (1xxx) ==========
  /** Caller passed an invalid argument */
  INVALID_ARGUMENT(1001, "Invalid argument"),

  /** Configuration setting cannot be applied */
  CONFIGURATION_ERROR(1002, "Configuration error"),

  // ========== Transaction Errors (2xxx) ==========
  /** Transaction used outside its active lifetime */
  TRANSACTION_ERROR(2001, "Transaction error"),

  /** Lock released by a requester that does not own it */
  LOCK_ERROR(2002, "Lock error"),

  // ========== Storage Errors (5xxx) ==========
  /** Page not found or of an unexpected kind */
  PAGE_NOT_FOUND(5001, "Page not found"),

  /** Data block not found in its page */
  DATA_BLOCK_NOT_FOUND(5002, "Data block not found"),

  /** Binary serialization/deserialization failed */
  SERIALIZATION_ERROR(5003, "Serialization error"),

  // ========== Schema Errors (7xxx) ==========
  /** Name does not match the identifier pattern */
  INVALID_FORMAT(7001, "Invalid format"),

  /** Directory of collections is full */
  COLLECTION_LIMIT_EXCEEDED(7002, "Collection limit exceeded"),

  /** A collection with the same name already exists */
  COLLECTION_ALREADY_EXISTS(7003, "Collection already exists"),

  /** Value cannot be used as document identity */
  INVALID_DATA_TYPE(7004, "Invalid data type"),

  // ========== Index Errors (8xxx) ==========
  /** Index structure is inconsistent */
  INDEX_ERROR(8001, "Index error"),

  /** Unique constraint violation */
  DUPLICATE_KEY(8002, "Duplicate key violation"),

  /** No free index slot in the collection */
  INDEX_LIMIT_EXCEEDED(8003, "Index limit exceeded"),

  // ========== General Errors (99xxx) ==========
  /** Unexpected internal error (should not normally occur) */
  INTERNAL_ERROR(99999, "Internal error");

  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

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

  /**
   * Returns the error category based on the error code range.
   */
  public String getCategory() {
    return switch (code / 1000) {
      case 1 -> "Database";
      case 2 -> "Transaction";
      case 5 -> "Storage";
      case 7 -> "Schema";
      case 8 -> "Index";
      case 99 -> "Internal";
      default -> "Unknown";
    };
  }

  /**
   * Finds an ErrorCode by its numeric code, or INTERNAL_ERROR if not found.
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}
