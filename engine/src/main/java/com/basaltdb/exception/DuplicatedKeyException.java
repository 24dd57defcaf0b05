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
package com.basaltdb.exception;

import com.basaltdb.engine.PageAddress;

public class DuplicatedKeyException extends BasaltDBException {
  private final String      indexName;
  private final Object      key;
  private final PageAddress currentDataBlock;

  public DuplicatedKeyException(final String indexName, final Object key, final PageAddress currentDataBlock) {
    super(ErrorCode.DUPLICATE_KEY, "Duplicated key " + key + " found on index '" + indexName + "' already assigned to data block " + currentDataBlock);
    this.indexName = indexName;
    this.key = key;
    this.currentDataBlock = currentDataBlock;
    addContext("index", indexName);
    addContext("key", key);
  }

  public String getIndexName() {
    return indexName;
  }

  public Object getKey() {
    return key;
  }

  public PageAddress getCurrentDataBlock() {
    return currentDataBlock;
  }
}
