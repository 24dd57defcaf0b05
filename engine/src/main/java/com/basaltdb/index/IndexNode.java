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

import com.basaltdb.engine.PageAddress;

/**
 * Entry of an index. Nodes form a doubly linked list ordered by key between the head ({@link com.basaltdb.database.Bound#MIN}) and
 * tail ({@link com.basaltdb.database.Bound#MAX}) sentinels. Secondary nodes point to the same data block as the primary node of
 * their document and keep a reference to it.
 */
public class IndexNode {
  private final PageAddress position;
  private final int         slot;
  private final Object      key;
  private final PageAddress dataBlock;
  private final PageAddress primaryNode;
  private       PageAddress prev = PageAddress.EMPTY;
  private       PageAddress next = PageAddress.EMPTY;

  public IndexNode(final PageAddress position, final int slot, final Object key, final PageAddress dataBlock,
      final PageAddress primaryNode) {
    this.position = position;
    this.slot = slot;
    this.key = key;
    this.dataBlock = dataBlock != null ? dataBlock : PageAddress.EMPTY;
    this.primaryNode = primaryNode != null ? primaryNode : PageAddress.EMPTY;
  }

  public PageAddress getPosition() {
    return position;
  }

  public int getSlot() {
    return slot;
  }

  public Object getKey() {
    return key;
  }

  public PageAddress getDataBlock() {
    return dataBlock;
  }

  public PageAddress getPrimaryNode() {
    return primaryNode;
  }

  public PageAddress getPrev() {
    return prev;
  }

  public void setPrev(final PageAddress prev) {
    this.prev = prev;
  }

  public PageAddress getNext() {
    return next;
  }

  public void setNext(final PageAddress next) {
    this.next = next;
  }

  public IndexNode copy() {
    final IndexNode copy = new IndexNode(position, slot, key, dataBlock, primaryNode);
    copy.prev = prev;
    copy.next = next;
    return copy;
  }

  @Override
  public String toString() {
    return "IndexNode" + position + " key=" + key + " data=" + dataBlock;
  }
}
