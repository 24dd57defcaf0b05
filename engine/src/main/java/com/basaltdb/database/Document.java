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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Schemaless document made of ordered fields. The `_id` field holds the identity of the document once stored. Supported values are
 * null, numbers, strings, booleans, {@link java.util.Date}, {@link java.util.UUID}, {@link org.bson.types.ObjectId}, byte arrays,
 * lists and embedded documents.
 * <br>
 * NOTE: This class is not thread safe.
 */
public class Document {
  public static final String ID_PROPERTY = "_id";

  private final Map<String, Object> fields;

  public Document() {
    this.fields = new LinkedHashMap<>();
  }

  public Document(final Map<String, ?> map) {
    this.fields = new LinkedHashMap<>(map.size());
    for (final Map.Entry<String, ?> entry : map.entrySet())
      set(entry.getKey(), entry.getValue());
  }

  public Document set(final String name, final Object value) {
    if (name == null)
      throw new IllegalArgumentException("Property name is null");
    fields.put(name, convert(value));
    return this;
  }

  public Document set(final Object... nameValuePairs) {
    if (nameValuePairs.length % 2 != 0)
      throw new IllegalArgumentException("Properties must be passed as pairs of name and value");
    for (int i = 0; i < nameValuePairs.length; i += 2)
      set((String) nameValuePairs[i], nameValuePairs[i + 1]);
    return this;
  }

  public Object get(final String name) {
    return fields.get(name);
  }

  public boolean has(final String name) {
    return fields.containsKey(name);
  }

  public Object remove(final String name) {
    return fields.remove(name);
  }

  public Object getIdentity() {
    return fields.get(ID_PROPERTY);
  }

  public boolean hasIdentity() {
    return fields.containsKey(ID_PROPERTY);
  }

  public Document setIdentity(final Object id) {
    fields.put(ID_PROPERTY, id);
    return this;
  }

  public Set<String> getPropertyNames() {
    return Collections.unmodifiableSet(fields.keySet());
  }

  public int size() {
    return fields.size();
  }

  public Map<String, Object> toMap() {
    return Collections.unmodifiableMap(fields);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Document other))
      return false;
    return DocumentComparator.INSTANCE.compare(this, other) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(fields.keySet().toArray());
  }

  @Override
  public String toString() {
    return fields.toString();
  }

  private static Object convert(final Object value) {
    if (value instanceof Map<?, ?> map) {
      final Document embedded = new Document();
      for (final Map.Entry<?, ?> entry : map.entrySet())
        embedded.set(String.valueOf(entry.getKey()), entry.getValue());
      return embedded;
    } else if (value instanceof Object[] array)
      return convert(Arrays.asList(array));
    else if (value instanceof List<?> list && !list.isEmpty()) {
      final List<Object> converted = new ArrayList<>(list.size());
      for (final Object item : list)
        converted.add(convert(item));
      return converted;
    }
    return value;
  }
}
