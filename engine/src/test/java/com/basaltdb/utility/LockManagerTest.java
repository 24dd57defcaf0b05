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
package com.basaltdb.utility;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LockManagerTest {

  private LockManager<String, String> lockManager;

  @BeforeEach
  void setUp() {
    lockManager = new LockManager<>();
  }

  @AfterEach
  void tearDown() {
    lockManager.close();
  }

  @Test
  void tryLockAcquiresLock() {
    assertThat(lockManager.tryLock("header", "tx1", 1000)).isEqualTo(LockManager.LOCK_STATUS.YES);
    assertThat(lockManager.isLocked("header")).isTrue();
    assertThat(lockManager.getOwner("header")).isEqualTo("tx1");
  }

  @Test
  void tryLockSameRequesterReturnsAlreadyAcquired() {
    lockManager.tryLock("header", "tx1", 1000);
    assertThat(lockManager.tryLock("header", "tx1", 1000)).isEqualTo(LockManager.LOCK_STATUS.ALREADY_ACQUIRED);
  }

  @Test
  void tryLockTimesOutWhenOwnedByOtherRequester() {
    lockManager.tryLock("collection:users", "tx1", 1000);
    assertThat(lockManager.tryLock("collection:users", "tx2", 50)).isEqualTo(LockManager.LOCK_STATUS.NO);
    assertThat(lockManager.getOwner("collection:users")).isEqualTo("tx1");
  }

  @Test
  void unlockByNonOwnerFails() {
    lockManager.tryLock("header", "tx1", 1000);
    assertThatThrownBy(() -> lockManager.unlock("header", "tx2")).isInstanceOf(LockException.class);
    assertThat(lockManager.isLocked("header")).isTrue();
  }

  @Test
  void waitingRequesterAcquiresAfterUnlock() throws Exception {
    lockManager.tryLock("collection:users", "tx1", 0);

    final CountDownLatch started = new CountDownLatch(1);
    final AtomicReference<LockManager.LOCK_STATUS> result = new AtomicReference<>();
    final Thread waiter = new Thread(() -> {
      started.countDown();
      result.set(lockManager.tryLock("collection:users", "tx2", 0));
    });
    waiter.start();

    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    Thread.sleep(50);
    assertThat(result.get()).isNull();

    lockManager.unlock("collection:users", "tx1");
    waiter.join(5_000);

    assertThat(result.get()).isEqualTo(LockManager.LOCK_STATUS.YES);
    assertThat(lockManager.getOwner("collection:users")).isEqualTo("tx2");
  }
}
