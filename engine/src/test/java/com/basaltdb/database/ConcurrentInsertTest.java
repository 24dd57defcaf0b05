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
package com.basaltdb.database;

import com.basaltdb.TestHelper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrentInsertTest extends TestHelper {
  private static final int CONCURRENT_THREADS = 4;
  private static final int TX_PER_THREAD      = 50;
  private static final int DOCS_PER_TX        = 5;

  @Test
  void concurrentInsertsIntoTheSameNewCollection() throws Exception {
    final AtomicInteger errors = new AtomicInteger();
    final CountDownLatch start = new CountDownLatch(1);

    // SPAWN ALL THE THREADS
    final Thread[] threads = new Thread[CONCURRENT_THREADS];
    for (int i = 0; i < CONCURRENT_THREADS; i++) {
      threads[i] = new Thread(() -> {
        try {
          start.await();
          for (int tx = 0; tx < TX_PER_THREAD; tx++) {
            final List<Document> batch = new ArrayList<>();
            for (int d = 0; d < DOCS_PER_TX; d++)
              batch.add(newDocument("thread", Thread.currentThread().getName(), "tx", tx));
            engine.insert("events", batch, AutoId.INT64);
          }
        } catch (final Throwable e) {
          e.printStackTrace();
          errors.incrementAndGet();
        }
      });
      threads[i].start();
    }
    start.countDown();

    // WAIT FOR ALL THE THREADS
    for (final Thread thread : threads)
      thread.join(TimeUnit.SECONDS.toMillis(60));

    assertThat(errors.get()).isZero();

    final int total = CONCURRENT_THREADS * TX_PER_THREAD * DOCS_PER_TX;
    assertThat(engine.getCollectionNames()).containsExactly("events");
    assertThat(engine.count("events")).isEqualTo(total);

    // SEQUENTIAL IDENTITIES ARE UNIQUE AND WITHOUT GAPS
    final Set<Object> ids = new HashSet<>();
    for (final Document document : engine.findAll("events"))
      ids.add(document.getIdentity());
    assertThat(ids).hasSize(total);
    assertThat(engine.getCollection("events").getSequence()).isEqualTo(total);

    checkCollectionIntegrity("events");
  }

  @Test
  void writersOnDifferentCollectionsDoNotInterfere() throws Exception {
    final AtomicInteger errors = new AtomicInteger();

    final Thread[] threads = new Thread[CONCURRENT_THREADS];
    for (int i = 0; i < CONCURRENT_THREADS; i++) {
      final String collection = "col" + i;
      threads[i] = new Thread(() -> {
        try {
          for (int tx = 0; tx < TX_PER_THREAD; tx++)
            engine.insert(collection, newDocument("tx", tx));
        } catch (final Throwable e) {
          e.printStackTrace();
          errors.incrementAndGet();
        }
      });
      threads[i].start();
    }

    for (final Thread thread : threads)
      thread.join(TimeUnit.SECONDS.toMillis(60));

    assertThat(errors.get()).isZero();
    assertThat(engine.getCollectionNames()).hasSize(CONCURRENT_THREADS);
    for (int i = 0; i < CONCURRENT_THREADS; i++)
      assertThat(engine.count("col" + i)).isEqualTo(TX_PER_THREAD);
  }
}
