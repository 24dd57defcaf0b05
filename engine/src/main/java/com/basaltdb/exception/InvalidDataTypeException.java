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

/**
 * Thrown when a field value cannot be stored, for example a null or boundary value used as document identity.
 */
public class InvalidDataTypeException extends BasaltDBException {
  private final String field;
  private final Object value;

  public InvalidDataTypeException(final String field, final Object value) {
    super(ErrorCode.INVALID_DATA_TYPE, "Invalid data type on field '" + field + "': " + value);
    this.field = field;
    this.value = value;
    addContext("field", field);
    addContext("value", value);
  }

  public String getField() {
    return field;
  }

  public Object getValue() {
    return value;
  }
}
