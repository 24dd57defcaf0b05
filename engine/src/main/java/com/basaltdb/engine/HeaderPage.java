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
package com.basaltdb.engine;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * First page of the storage. Maps collection names to the id of their {@link CollectionPage}. Names are compared ignoring case.
 */
public class HeaderPage extends BasePage {
  public static final int HEADER_PAGE_ID = 0;

  /** Bytes taken by each directory entry besides the name: 4 for the name length, 4 for the page id. */
  public static final int ENTRY_OVERHEAD = 8;

  private final TreeMap<String, Integer> collections = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

  public HeaderPage() {
    super(HEADER_PAGE_ID);
  }

  @Override
  public PAGE_TYPE getPageType() {
    return PAGE_TYPE.HEADER;
  }

  public Integer getCollectionPageId(final String name) {
    return collections.get(name);
  }

  public boolean containsCollection(final String name) {
    return collections.containsKey(name);
  }

  public void putCollection(final String name, final int pageId) {
    collections.put(name, pageId);
  }

  public Integer removeCollection(final String name) {
    return collections.remove(name);
  }

  public Map<String, Integer> getCollections() {
    return Collections.unmodifiableMap(collections);
  }

  /**
   * Serialized size of the directory: the sum of name length plus {@link #ENTRY_OVERHEAD} for each collection.
   */
  public int getCollectionsSize() {
    int total = 0;
    for (final String name : collections.keySet())
      total += name.length() + ENTRY_OVERHEAD;
    return total;
  }

  @Override
  public HeaderPage copy() {
    final HeaderPage copy = new HeaderPage();
    copy.collections.putAll(collections);
    return copy;
  }
}
