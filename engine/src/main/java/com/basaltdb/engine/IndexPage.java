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

import com.basaltdb.index.IndexNode;

import java.util.TreeMap;

/**
 * Page holding the nodes of one index.
 */
public class IndexPage extends BasePage {
  private final TreeMap<Integer, IndexNode> nodes     = new TreeMap<>();
  private       int                         nextIndex = 0;

  public IndexPage(final int pageId) {
    super(pageId);
  }

  @Override
  public PAGE_TYPE getPageType() {
    return PAGE_TYPE.INDEX;
  }

  public IndexNode getNode(final int index) {
    return nodes.get(index);
  }

  public int getNodeCount() {
    return nodes.size();
  }

  public IndexNode addNode(final int slot, final Object key, final PageAddress dataBlock, final PageAddress primaryNode) {
    final IndexNode node = new IndexNode(new PageAddress(pageId, nextIndex++), slot, key, dataBlock, primaryNode);
    nodes.put(node.getPosition().getIndex(), node);
    return node;
  }

  public IndexNode removeNode(final int index) {
    return nodes.remove(index);
  }

  @Override
  public IndexPage copy() {
    final IndexPage copy = new IndexPage(pageId);
    for (final IndexNode node : nodes.values())
      copy.nodes.put(node.getPosition().getIndex(), node.copy());
    copy.nextIndex = nextIndex;
    return copy;
  }
}
