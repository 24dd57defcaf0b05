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

import com.basaltdb.index.IndexDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Descriptor of a collection: name, sequence used for sequential identities, document count and the indexes, one per slot. Slot 0
 * always holds the primary key index on `_id`.
 */
public class CollectionPage extends BasePage {
  public static final Pattern NAME_PATTERN = Pattern.compile("^[\\w-]{1,60}$");
  public static final int     PK_SLOT      = 0;

  private       String            name;
  private       long              sequence        = 0L;
  private       long              documentCount   = 0L;
  private       int               freeDataPageId  = NO_PAGE;
  private final IndexDescriptor[] indexes;

  public CollectionPage(final int pageId, final int maxIndexes) {
    super(pageId);
    if (maxIndexes < 1)
      throw new IllegalArgumentException("Collection must allow at least the primary key index");
    this.indexes = new IndexDescriptor[maxIndexes];
  }

  @Override
  public PAGE_TYPE getPageType() {
    return PAGE_TYPE.COLLECTION;
  }

  public static boolean isValidName(final String name) {
    return name != null && NAME_PATTERN.matcher(name).matches();
  }

  public String getName() {
    return name;
  }

  public void setName(final String name) {
    this.name = name;
  }

  public long getSequence() {
    return sequence;
  }

  public void setSequence(final long sequence) {
    this.sequence = sequence;
  }

  public long getDocumentCount() {
    return documentCount;
  }

  public void setDocumentCount(final long documentCount) {
    this.documentCount = documentCount;
  }

  public int getFreeDataPageId() {
    return freeDataPageId;
  }

  public void setFreeDataPageId(final int freeDataPageId) {
    this.freeDataPageId = freeDataPageId;
  }

  public IndexDescriptor getPK() {
    return indexes[PK_SLOT];
  }

  public IndexDescriptor getIndex(final int slot) {
    return indexes[slot];
  }

  public IndexDescriptor getIndex(final String indexName) {
    for (final IndexDescriptor index : indexes)
      if (index != null && index.getName() != null && index.getName().equalsIgnoreCase(indexName))
        return index;
    return null;
  }

  /**
   * Returns the indexes ordered by slot.
   *
   * @param includePK true to include the primary key index in slot 0
   */
  public List<IndexDescriptor> getIndexes(final boolean includePK) {
    final List<IndexDescriptor> result = new ArrayList<>(indexes.length);
    for (int slot = includePK ? PK_SLOT : PK_SLOT + 1; slot < indexes.length; slot++)
      if (indexes[slot] != null)
        result.add(indexes[slot]);
    return result;
  }

  public int getMaxIndexes() {
    return indexes.length;
  }

  /**
   * Returns the first free slot, or -1 if every slot is taken.
   */
  public int getFreeIndexSlot() {
    for (int slot = 0; slot < indexes.length; slot++)
      if (indexes[slot] == null)
        return slot;
    return -1;
  }

  public void setIndex(final IndexDescriptor index) {
    indexes[index.getSlot()] = index;
  }

  @Override
  public CollectionPage copy() {
    final CollectionPage copy = new CollectionPage(pageId, indexes.length);
    copy.name = name;
    copy.sequence = sequence;
    copy.documentCount = documentCount;
    copy.freeDataPageId = freeDataPageId;
    for (int i = 0; i < indexes.length; i++)
      copy.indexes[i] = indexes[i] != null ? indexes[i].copy() : null;
    return copy;
  }

  @Override
  public String toString() {
    return "Collection '" + name + "' #" + pageId;
  }
}
