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

import com.basaltdb.engine.BasePage;
import com.basaltdb.engine.PageAddress;

/**
 * Definition of an index stored in its collection page: slot, name, key expression, uniqueness and the addresses of the head and
 * tail sentinel nodes.
 */
public class IndexDescriptor {
  private final int         slot;
  private       String      name;
  private       String      expression;
  private       boolean     unique;
  private       PageAddress head            = PageAddress.EMPTY;
  private       PageAddress tail            = PageAddress.EMPTY;
  private       int         freeIndexPageId = BasePage.NO_PAGE;

  public IndexDescriptor(final int slot) {
    this.slot = slot;
  }

  public int getSlot() {
    return slot;
  }

  public boolean isPrimaryKey() {
    return slot == 0;
  }

  public String getName() {
    return name;
  }

  public void setName(final String name) {
    this.name = name;
  }

  public String getExpression() {
    return expression;
  }

  public void setExpression(final String expression) {
    this.expression = expression;
  }

  public boolean isUnique() {
    return unique;
  }

  public void setUnique(final boolean unique) {
    this.unique = unique;
  }

  public PageAddress getHead() {
    return head;
  }

  public void setHead(final PageAddress head) {
    this.head = head;
  }

  public PageAddress getTail() {
    return tail;
  }

  public void setTail(final PageAddress tail) {
    this.tail = tail;
  }

  public int getFreeIndexPageId() {
    return freeIndexPageId;
  }

  public void setFreeIndexPageId(final int freeIndexPageId) {
    this.freeIndexPageId = freeIndexPageId;
  }

  public IndexDescriptor copy() {
    final IndexDescriptor copy = new IndexDescriptor(slot);
    copy.name = name;
    copy.expression = expression;
    copy.unique = unique;
    copy.head = head;
    copy.tail = tail;
    copy.freeIndexPageId = freeIndexPageId;
    return copy;
  }

  @Override
  public String toString() {
    return "Index '" + name + "' (slot=" + slot + " expression=" + expression + " unique=" + unique + ")";
  }
}
