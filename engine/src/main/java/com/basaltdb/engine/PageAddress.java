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

/**
 * Address of an item (data block or index node) inside a page. Immutable.
 */
public final class PageAddress implements Comparable<PageAddress> {
  public static final PageAddress EMPTY = new PageAddress(-1, -1);

  private final int pageId;
  private final int index;

  public PageAddress(final int pageId, final int index) {
    this.pageId = pageId;
    this.index = index;
  }

  public int getPageId() {
    return pageId;
  }

  public int getIndex() {
    return index;
  }

  public boolean isEmpty() {
    return pageId < 0;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof PageAddress other))
      return false;
    return pageId == other.pageId && index == other.index;
  }

  @Override
  public int hashCode() {
    return 31 * pageId + index;
  }

  @Override
  public int compareTo(final PageAddress o) {
    final int cmp = Integer.compare(pageId, o.pageId);
    return cmp != 0 ? cmp : Integer.compare(index, o.index);
  }

  @Override
  public String toString() {
    return "(" + pageId + ":" + index + ")";
  }
}
