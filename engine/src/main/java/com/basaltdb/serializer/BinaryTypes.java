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
package com.basaltdb.serializer;

/**
 * Type markers written before each value by {@link DocumentSerializer}.
 */
public final class BinaryTypes {
  public static final byte TYPE_NULL     = 0;
  public static final byte TYPE_BOOLEAN  = 1;
  public static final byte TYPE_INT      = 2;
  public static final byte TYPE_LONG     = 3;
  public static final byte TYPE_SHORT    = 4;
  public static final byte TYPE_BYTE     = 5;
  public static final byte TYPE_DOUBLE   = 6;
  public static final byte TYPE_FLOAT    = 7;
  public static final byte TYPE_DECIMAL  = 8;
  public static final byte TYPE_STRING   = 9;
  public static final byte TYPE_BINARY   = 10;
  public static final byte TYPE_DATE     = 11;
  public static final byte TYPE_UUID     = 12;
  public static final byte TYPE_OBJECTID = 13;
  public static final byte TYPE_DOCUMENT = 14;
  public static final byte TYPE_LIST     = 15;

  private BinaryTypes() {
  }
}
