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

import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Total order across every value a document can hold. Values of different types sort by type first:
 * MIN, null, numbers, strings, documents, lists, binaries, ObjectIds, UUIDs, booleans, dates, MAX.
 */
public class DocumentComparator implements Comparator<Object> {
  public static final DocumentComparator INSTANCE = new DocumentComparator();

  private static final int TYPE_MIN      = 0;
  private static final int TYPE_NULL     = 1;
  private static final int TYPE_NUMBER   = 2;
  private static final int TYPE_STRING   = 3;
  private static final int TYPE_DOCUMENT = 4;
  private static final int TYPE_LIST     = 5;
  private static final int TYPE_BINARY   = 6;
  private static final int TYPE_OBJECTID = 7;
  private static final int TYPE_UUID     = 8;
  private static final int TYPE_BOOLEAN  = 9;
  private static final int TYPE_DATE     = 10;
  private static final int TYPE_MAX      = 11;

  @Override
  public int compare(final Object a, final Object b) {
    if (a == b)
      return 0;

    final int typeA = typeOf(a);
    final int typeB = typeOf(b);
    if (typeA != typeB)
      return Integer.compare(typeA, typeB);

    return switch (typeA) {
      case TYPE_MIN, TYPE_NULL, TYPE_MAX -> 0;
      case TYPE_NUMBER -> compareNumbers((Number) a, (Number) b);
      case TYPE_STRING -> ((String) a).compareTo((String) b);
      case TYPE_DOCUMENT -> compareDocuments((Document) a, (Document) b);
      case TYPE_LIST -> compareLists((List<?>) a, (List<?>) b);
      case TYPE_BINARY -> Arrays.compareUnsigned((byte[]) a, (byte[]) b);
      case TYPE_OBJECTID -> ((ObjectId) a).compareTo((ObjectId) b);
      case TYPE_UUID -> ((UUID) a).compareTo((UUID) b);
      case TYPE_BOOLEAN -> Boolean.compare((Boolean) a, (Boolean) b);
      case TYPE_DATE -> ((Date) a).compareTo((Date) b);
      default -> throw new IllegalArgumentException("Cannot compare values of type " + a.getClass().getName());
    };
  }

  public static boolean equals(final Object a, final Object b) {
    return INSTANCE.compare(a, b) == 0;
  }

  /**
   * Returns true if the value is a type this comparator (and the document serializer) can handle.
   */
  public static boolean isSupported(final Object value) {
    try {
      typeOf(value);
      return true;
    } catch (final IllegalArgumentException e) {
      return false;
    }
  }

  private static int typeOf(final Object value) {
    if (value == null)
      return TYPE_NULL;
    if (value == Bound.MIN)
      return TYPE_MIN;
    if (value == Bound.MAX)
      return TYPE_MAX;
    if (value instanceof Number)
      return TYPE_NUMBER;
    if (value instanceof String)
      return TYPE_STRING;
    if (value instanceof Document)
      return TYPE_DOCUMENT;
    if (value instanceof List)
      return TYPE_LIST;
    if (value instanceof byte[])
      return TYPE_BINARY;
    if (value instanceof ObjectId)
      return TYPE_OBJECTID;
    if (value instanceof UUID)
      return TYPE_UUID;
    if (value instanceof Boolean)
      return TYPE_BOOLEAN;
    if (value instanceof Date)
      return TYPE_DATE;
    throw new IllegalArgumentException("Unsupported value type " + value.getClass().getName());
  }

  private static boolean isIntegral(final Number n) {
    return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
  }

  private static int compareNumbers(final Number a, final Number b) {
    if (isIntegral(a) && isIntegral(b))
      return Long.compare(a.longValue(), b.longValue());
    if (a instanceof BigDecimal || b instanceof BigDecimal)
      return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
    return Double.compare(a.doubleValue(), b.doubleValue());
  }

  private int compareDocuments(final Document a, final Document b) {
    final Iterator<Map.Entry<String, Object>> itA = a.toMap().entrySet().iterator();
    final Iterator<Map.Entry<String, Object>> itB = b.toMap().entrySet().iterator();

    while (itA.hasNext() && itB.hasNext()) {
      final Map.Entry<String, Object> entryA = itA.next();
      final Map.Entry<String, Object> entryB = itB.next();

      int cmp = entryA.getKey().compareTo(entryB.getKey());
      if (cmp != 0)
        return cmp;

      cmp = compare(entryA.getValue(), entryB.getValue());
      if (cmp != 0)
        return cmp;
    }
    return Integer.compare(a.size(), b.size());
  }

  private int compareLists(final List<?> a, final List<?> b) {
    final int common = Math.min(a.size(), b.size());
    for (int i = 0; i < common; i++) {
      final int cmp = compare(a.get(i), b.get(i));
      if (cmp != 0)
        return cmp;
    }
    return Integer.compare(a.size(), b.size());
  }
}
