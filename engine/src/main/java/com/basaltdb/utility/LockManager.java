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

import com.basaltdb.log.LogManager;

import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

/**
 * Exclusive lock table keyed by resource. A requester that already owns a resource acquires it again without blocking. A timeout of
 * 0 waits until the owner releases the resource.
 */
public class LockManager<RESOURCE, REQUESTER> {
  public enum LOCK_STATUS {NO, YES, ALREADY_ACQUIRED}

  private final ConcurrentHashMap<RESOURCE, ResourceLock> locks = new ConcurrentHashMap<>(256);

  private class ResourceLock {
    final REQUESTER      owner;
    final CountDownLatch released;

    private ResourceLock(final REQUESTER owner) {
      this.owner = owner;
      this.released = new CountDownLatch(1);
    }
  }

  public LOCK_STATUS tryLock(final RESOURCE resource, final REQUESTER requester, final long timeout) {
    if (resource == null)
      throw new IllegalArgumentException("Resource to lock is null");
    if (requester == null)
      throw new IllegalArgumentException("Lock requester is null");

    final ResourceLock lock = new ResourceLock(requester);

    ResourceLock currentLock = locks.putIfAbsent(resource, lock);
    if (currentLock != null) {
      if (currentLock.owner.equals(requester)) {
        LogManager.instance().log(this, Level.FINEST, "Resource '%s' already locked by requester '%s'", resource, requester);
        return LOCK_STATUS.ALREADY_ACQUIRED;
      }

      // WAIT FOR THE CURRENT OWNER, THEN RACE FOR THE RESOURCE AGAIN
      final long startTime = System.currentTimeMillis();
      do {
        try {
          if (timeout > 0) {
            final long remaining = timeout - (System.currentTimeMillis() - startTime);
            if (remaining <= 0 || !currentLock.released.await(remaining, TimeUnit.MILLISECONDS))
              break;
          } else
            currentLock.released.await();

          currentLock = locks.putIfAbsent(resource, lock);

        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        }
      } while (currentLock != null && (timeout == 0 || System.currentTimeMillis() - startTime < timeout));
    }

    return currentLock == null ? LOCK_STATUS.YES : LOCK_STATUS.NO;
  }

  public boolean isLocked(final RESOURCE resource) {
    return locks.containsKey(resource);
  }

  public REQUESTER getOwner(final RESOURCE resource) {
    final ResourceLock lock = locks.get(resource);
    return lock != null ? lock.owner : null;
  }

  public void unlock(final RESOURCE resource, final REQUESTER requester) {
    if (resource == null)
      throw new IllegalArgumentException("Resource to unlock is null");

    final ResourceLock lock = locks.get(resource);
    if (lock == null)
      return;

    if (!lock.owner.equals(requester))
      throw new LockException("Cannot unlock resource '" + resource + "' because owner '" + lock.owner + "' <> requester '" + requester + "'");

    locks.remove(resource, lock);

    // NOTIFY ANY WAITERS
    lock.released.countDown();
  }

  public void close() {
    for (final Iterator<Map.Entry<RESOURCE, ResourceLock>> it = locks.entrySet().iterator(); it.hasNext(); ) {
      final ResourceLock lock = it.next().getValue();
      it.remove();
      lock.released.countDown();
    }
  }
}
