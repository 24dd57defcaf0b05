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
package com.basaltdb.index;

import com.basaltdb.database.Document;
import com.basaltdb.database.DocumentComparator;
import com.basaltdb.exception.InvalidFormatException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Path expression that extracts index keys from a document. Supported syntax:
 * <ul>
 *   <li><code>$</code> the whole document</li>
 *   <li><code>$.name</code>, <code>$.address.city</code> a field, nested documents separated by dots</li>
 *   <li><code>$.tags[*]</code> every element of a list, one key per element</li>
 * </ul>
 * A missing or null field produces a single null key. An expression with <code>[*]</code> produces no key when nothing matches.
 */
public class KeyExpression {
  private static final Map<String, KeyExpression> CACHE = new ConcurrentHashMap<>();

  private final String       source;
  private final List<String> segments;
  private final boolean      multiValue;

  // MARKER SEGMENT FOR [*]
  private static final String ALL_ITEMS = "[*]";

  private KeyExpression(final String source, final List<String> segments) {
    this.source = source;
    this.segments = segments;
    this.multiValue = segments.contains(ALL_ITEMS);
  }

  /**
   * Returns the parsed expression, reusing a cached instance if the same source was already parsed.
   *
   * @throws InvalidFormatException if the expression is not valid
   */
  public static KeyExpression parse(final String source) {
    if (source == null)
      throw new IllegalArgumentException("Expression is null");
    return CACHE.computeIfAbsent(source.trim(), KeyExpression::compile);
  }

  public String getSource() {
    return source;
  }

  /**
   * Evaluates the expression against the document.
   *
   * @param distinct if true, equal keys are returned only once
   */
  public List<Object> execute(final Document document, final boolean distinct) {
    List<Object> values = new ArrayList<>(1);
    values.add(document);

    for (final String segment : segments) {
      final List<Object> next = new ArrayList<>(values.size());
      if (ALL_ITEMS.equals(segment)) {
        for (final Object value : values)
          if (value instanceof List<?> list)
            next.addAll(list);
      } else {
        for (final Object value : values)
          if (value instanceof Document d && d.has(segment))
            next.add(d.get(segment));
      }
      values = next;
    }

    if (values.isEmpty() && !multiValue)
      values.add(null);

    if (!distinct || values.size() < 2)
      return values;

    final List<Object> unique = new ArrayList<>(values.size());
    for (final Object value : values) {
      boolean found = false;
      for (final Object u : unique)
        if (DocumentComparator.equals(u, value)) {
          found = true;
          break;
        }
      if (!found)
        unique.add(value);
    }
    return unique;
  }

  @Override
  public String toString() {
    return source;
  }

  private static KeyExpression compile(final String source) {
    if (source.isEmpty() || source.charAt(0) != '$')
      throw new InvalidFormatException(source);

    final List<String> segments = new ArrayList<>();
    int pos = 1;
    while (pos < source.length()) {
      final char c = source.charAt(pos);
      if (c == '.') {
        int end = pos + 1;
        while (end < source.length() && isFieldChar(source.charAt(end)))
          ++end;
        if (end == pos + 1)
          throw new InvalidFormatException(source);
        segments.add(source.substring(pos + 1, end));
        pos = end;
      } else if (source.startsWith(ALL_ITEMS, pos)) {
        if (segments.isEmpty())
          throw new InvalidFormatException(source);
        segments.add(ALL_ITEMS);
        pos += ALL_ITEMS.length();
      } else
        throw new InvalidFormatException(source);
    }
    return new KeyExpression(source, Collections.unmodifiableList(segments));
  }

  private static boolean isFieldChar(final char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '$';
  }
}
