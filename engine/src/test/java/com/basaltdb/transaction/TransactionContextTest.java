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
package com.basaltdb.transaction;

import com.basaltdb.GlobalConfiguration;
import com.basaltdb.TestHelper;
import com.basaltdb.engine.CollectionPage;
import com.basaltdb.engine.DataPage;
import com.basaltdb.engine.HeaderPage;
import com.basaltdb.exception.StorageException;
import com.basaltdb.exception.TransactionException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionContextTest extends TestHelper {

  @Test
  void commitPublishesDirtyPages() {
    try (final TransactionContext tx = engine.beginTransaction()) {
      tx.getCollectionService().add("users");
      tx.commit();
    }

    assertThat(engine.getCollectionNames()).containsExactly("users");
  }

  @Test
  void rollbackDiscardsChangesAndReleasesPageIds() {
    final int allocatedBefore = engine.getPageManager().getAllocatedPages().size();

    try (final TransactionContext tx = engine.beginTransaction()) {
      tx.getCollectionService().add("users");
      tx.rollback();
    }

    assertThat(engine.getCollectionNames()).isEmpty();
    assertThat(engine.getPageManager().getAllocatedPages()).hasSize(allocatedBefore);
    assertThat(engine.getPageManager().getStats().freePages).isGreaterThan(0);
  }

  @Test
  void closeWithoutCommitRollsBack() {
    final TransactionContext tx = engine.beginTransaction();
    tx.getCollectionService().add("users");
    tx.close();

    assertThat(tx.getStatus()).isEqualTo(TransactionContext.STATUS.ROLLED_BACK);
    assertThat(engine.existsCollection("users")).isFalse();
  }

  @Test
  void changesNotMarkedDirtyAreNotPublished() {
    engine.insert("users", newDocument("name", "Jay"));
    final long sequence = engine.getCollection("users").getSequence();

    try (final TransactionContext tx = engine.beginTransaction()) {
      final CollectionPage collection = tx.getCollectionService().get("users");
      final CollectionPage copy = tx.getPageToModify(collection.getPageId(), CollectionPage.class);
      copy.setSequence(sequence + 100);
      tx.commit();
    }

    assertThat(engine.getCollection("users").getSequence()).isEqualTo(sequence);
  }

  @Test
  void onlyPrivateCopiesCanBeMarkedDirty() {
    try (final TransactionContext tx = engine.beginTransaction()) {
      final HeaderPage committed = tx.getPage(HeaderPage.HEADER_PAGE_ID, HeaderPage.class);
      assertThatThrownBy(() -> tx.setDirty(committed)).isInstanceOf(TransactionException.class);

      final HeaderPage copy = tx.getPageToModify(HeaderPage.HEADER_PAGE_ID, HeaderPage.class);
      assertThat(copy).isNotSameAs(committed);
      assertThat(tx.getPage(HeaderPage.HEADER_PAGE_ID, HeaderPage.class)).isSameAs(copy);
      tx.setDirty(copy);
      assertThat(tx.isDirty(HeaderPage.HEADER_PAGE_ID)).isTrue();
    }
  }

  @Test
  void readOnlyTransactionSeesItsSnapshot() {
    try (final TransactionContext reader = engine.beginReadOnlyTransaction()) {
      engine.insert("users", newDocument("name", "Jay"));

      assertThat(reader.getCollectionService().get("users")).isNull();
      assertThatThrownBy(() -> reader.getPageToModify(HeaderPage.HEADER_PAGE_ID, HeaderPage.class)).isInstanceOf(
          TransactionException.class);
      assertThatThrownBy(reader::lockHeader).isInstanceOf(TransactionException.class);
    }

    assertThat(engine.existsCollection("users")).isTrue();
  }

  @Test
  void deletedPagesAreNotReadable() {
    try (final TransactionContext tx = engine.beginTransaction()) {
      final DataPage page = tx.newPage(DataPage::new);
      tx.deletePage(page.getPageId());

      assertThatThrownBy(() -> tx.getPage(page.getPageId(), DataPage.class)).isInstanceOf(StorageException.class);
      assertThatThrownBy(() -> tx.deletePage(page.getPageId())).isInstanceOf(StorageException.class);
      assertThatThrownBy(() -> tx.deletePage(HeaderPage.HEADER_PAGE_ID)).isInstanceOf(StorageException.class);
      tx.commit();
    }
  }

  @Test
  void wrongPageTypeIsReported() {
    try (final TransactionContext tx = engine.beginTransaction()) {
      assertThatThrownBy(() -> tx.getPage(HeaderPage.HEADER_PAGE_ID, DataPage.class)).isInstanceOf(StorageException.class)
          .hasMessageContaining("HEADER");
    }
  }

  @Test
  void locksAreReleasedAtTheEndOfTheTransaction() {
    final TransactionContext tx = engine.beginTransaction();
    tx.lockHeader();
    tx.writeLock("Users");
    tx.writeLock("USERS");
    assertThat(tx.isLocked(TransactionContext.HEADER_RESOURCE)).isTrue();
    assertThat(tx.isLocked(TransactionContext.COLLECTION_RESOURCE_PREFIX + "users")).isTrue();
    tx.commit();

    try (final TransactionContext other = engine.beginTransaction()) {
      other.lockHeader();
      other.writeLock("users");
      assertThat(other.isLocked(TransactionContext.HEADER_RESOURCE)).isTrue();
    }
  }

  @Test
  void lockTimeoutFailsTheTransaction() throws Exception {
    engine.getConfiguration().setValue(GlobalConfiguration.TX_LOCK_TIMEOUT, 50L);

    final AtomicReference<Throwable> error = new AtomicReference<>();
    try (final TransactionContext owner = engine.beginTransaction()) {
      owner.writeLock("users");

      final Thread other = new Thread(() -> {
        try (final TransactionContext tx = engine.beginTransaction()) {
          tx.writeLock("users");
        } catch (final Throwable e) {
          error.set(e);
        }
      });
      other.start();
      other.join(5_000);
    }

    assertThat(error.get()).isInstanceOf(TransactionException.class).hasMessageContaining("collection:users");
  }

  @Test
  void finishedTransactionCannotBeUsed() {
    final TransactionContext tx = engine.beginTransaction();
    tx.commit();

    assertThat(tx.isActive()).isFalse();
    assertThatThrownBy(tx::commit).isInstanceOf(TransactionException.class);
    assertThatThrownBy(() -> tx.getPage(HeaderPage.HEADER_PAGE_ID, HeaderPage.class)).isInstanceOf(TransactionException.class);
  }
}
