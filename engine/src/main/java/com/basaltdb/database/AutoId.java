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
package com.basaltdb.database;

/**
 * Policy used to generate the identity of documents inserted without an `_id` field.
 */
public enum AutoId {
  /** 12-byte globally unique value */
  OBJECT_ID,
  /** 128-bit random value */
  GUID,
  /** Current timestamp */
  DATE_TIME,
  /** Collection sequence as int */
  INT32,
  /** Collection sequence as long */
  INT64;

  public boolean isSequential() {
    return this == INT32 || this == INT64;
  }
}
