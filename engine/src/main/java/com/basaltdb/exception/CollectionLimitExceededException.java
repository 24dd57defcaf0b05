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

/**
 * Thrown when registering or renaming a collection would make the header directory reach its size limit.
 */
public class CollectionLimitExceededException extends BasaltDBException {
  private final int limit;

  public CollectionLimitExceededException(final String collectionName, final int projectedSize, final int limit) {
    super(ErrorCode.COLLECTION_LIMIT_EXCEEDED,
        "Cannot register collection '" + collectionName + "': collection directory would use " + projectedSize + " bytes, limit is " + limit);
    this.limit = limit;
    addContext("collection", collectionName);
    addContext("projectedSize", projectedSize);
    addContext("limit", limit);
  }

  public int getLimit() {
    return limit;
  }
}
