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

import io.netty.util.internal.PlatformDependent;

import java.util.Queue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes actions without blocking the caller: actions are queued and the thread that wins the CAS drains the
 * queue, including the actions submitted by other threads meanwhile.
 *
 * <p> A post action runs after its action has been applied and before the next queued action. An action submitted
 * from a post action is queued and applied by the draining thread once the post action returns.
 */
public class NonBlockingSynchronization<S> implements Synchronization<S> {

  private final Queue<Action<S>> q = PlatformDependent.newMpscQueue(Integer.MAX_VALUE);
  private final AtomicInteger s = new AtomicInteger();
  private final S state;

  public NonBlockingSynchronization(S state) {
    this.state = state;
  }

  @Override
  public void execute(Action<S> action) {
    q.add(action);
    while (true) {
      if (s.compareAndSet(0, 1)) {
        try {
          Action<S> a;
          while ((a = q.poll()) != null) {
            Runnable post = a.execute(state);
            if (post != null) {
              post.run();
            }
          }
        } finally {
          s.set(0);
        }
        // full barrier above, another thread may have queued an action after our last poll
        if (q.isEmpty()) {
          break;
        }
      } else {
        break;
      }
    }
  }
}
