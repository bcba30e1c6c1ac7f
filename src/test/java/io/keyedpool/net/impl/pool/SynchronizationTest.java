/*
 * Copyright (c) 2011-2021 Contributors to the Eclipse Foundation
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
 * which is available at https://www.apache.org/licenses/LICENSE-2.0.
 *
 * SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 */
package io.keyedpool.net.impl.pool;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SynchronizationTest {

  static class Counter {
    int value;
  }

  private void testExclusion(Synchronization<Counter> sync, Counter counter) throws Exception {
    int threads = 4;
    int increments = 10_000;
    CountDownLatch start = new CountDownLatch(1);
    List<Thread> workers = new ArrayList<>();
    for (int i = 0;i < threads;i++) {
      Thread worker = new Thread(() -> {
        try {
          start.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        for (int j = 0;j < increments;j++) {
          sync.execute(state -> {
            state.value++;
            return null;
          });
        }
      });
      worker.start();
      workers.add(worker);
    }
    start.countDown();
    for (Thread worker : workers) {
      worker.join(TimeUnit.SECONDS.toMillis(30));
    }
    sync.execute(state -> {
      assertEquals(threads * increments, state.value);
      return null;
    });
    assertEquals(threads * increments, counter.value);
  }

  @Test
  public void testLockExclusion() throws Exception {
    Counter counter = new Counter();
    testExclusion(new LockSynchronization<>(counter), counter);
  }

  @Test
  public void testNonBlockingExclusion() throws Exception {
    Counter counter = new Counter();
    testExclusion(new NonBlockingSynchronization<>(counter), counter);
  }

  @Test
  public void testLockPostActionRunsAfterUnlock() throws Exception {
    Counter counter = new Counter();
    Synchronization<Counter> sync = new LockSynchronization<>(counter);
    AtomicBoolean other = new AtomicBoolean();
    sync.execute(state -> () -> {
      Thread thread = new Thread(() -> sync.execute(s -> {
        other.set(true);
        return null;
      }));
      thread.start();
      try {
        thread.join(TimeUnit.SECONDS.toMillis(10));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      assertFalse(thread.isAlive());
    });
    assertTrue(other.get());
  }

  @Test
  public void testNonBlockingActionSubmittedFromPostAction() {
    Counter counter = new Counter();
    Synchronization<Counter> sync = new NonBlockingSynchronization<>(counter);
    List<String> events = new ArrayList<>();
    sync.execute(state -> () -> {
      sync.execute(s -> {
        events.add("nested");
        return null;
      });
      events.add("post");
    });
    assertEquals(2, events.size());
    assertEquals("post", events.get(0));
    assertEquals("nested", events.get(1));
  }

  @Test
  public void testActionFailureReleasesSynchronization() {
    for (Synchronization<Counter> sync : List.<Synchronization<Counter>>of(new LockSynchronization<>(new Counter()), new NonBlockingSynchronization<>(new Counter()))) {
      try {
        sync.execute(state -> {
          throw new IllegalStateException();
        });
        fail();
      } catch (IllegalStateException ignore) {
      }
      sync.execute(state -> {
        state.value++;
        return null;
      });
      sync.execute(state -> {
        assertEquals(1, state.value);
        return null;
      });
    }
  }
}
