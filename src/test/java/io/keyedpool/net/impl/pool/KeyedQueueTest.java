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

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class KeyedQueueTest {

  @Test
  public void testPollFirstOfKeyPreservesOrderOfTheRest() {
    KeyedQueue<String, Integer> queue = new KeyedQueue<>();
    queue.addLast("a", 1);
    queue.addLast("b", 2);
    queue.addLast("a", 3);
    queue.addLast("c", 4);
    queue.addLast("b", 5);
    assertEquals(2, (int) queue.pollFirst("b").value);
    assertEquals(1, (int) queue.pollFirst("a").value);
    assertEquals(3, queue.size());
    assertEquals(Arrays.asList(3, 4, 5), queue.clear());
    assertTrue(queue.isEmpty());
  }

  @Test
  public void testPollFirstFollowsInsertionOrder() {
    KeyedQueue<String, Integer> queue = new KeyedQueue<>();
    queue.addLast("a", 1);
    queue.addLast("b", 2);
    queue.addLast("a", 3);
    assertEquals("a", queue.pollFirst().key);
    assertEquals(2, (int) queue.peekFirst().value);
    assertEquals(3, (int) queue.peekFirst("a").value);
    assertEquals(2, (int) queue.pollFirst().value);
    assertEquals(3, (int) queue.pollFirst().value);
    assertNull(queue.pollFirst());
    assertNull(queue.peekFirst("a"));
  }

  @Test
  public void testRemoveMiddleNode() {
    KeyedQueue<String, Integer> queue = new KeyedQueue<>();
    queue.addLast("a", 1);
    KeyedQueue.Node<String, Integer> node = queue.addLast("a", 2);
    queue.addLast("a", 3);
    assertTrue(node.isLinked());
    assertTrue(queue.remove(node));
    assertFalse(node.isLinked());
    assertFalse(queue.remove(node));
    assertEquals(2, queue.size());
    assertEquals(1, (int) queue.pollFirst("a").value);
    assertEquals(3, (int) queue.pollFirst("a").value);
    assertNull(queue.pollFirst("a"));
    assertTrue(queue.isEmpty());
  }

  @Test
  public void testReuseKeyAfterItWasEmptied() {
    KeyedQueue<String, Integer> queue = new KeyedQueue<>();
    KeyedQueue.Node<String, Integer> node = queue.addLast("a", 1);
    assertSame(node, queue.pollFirst("a"));
    queue.addLast("b", 2);
    queue.addLast("a", 3);
    assertEquals(3, (int) queue.peekFirst("a").value);
    assertEquals(2, (int) queue.peekFirst().value);
  }

  @Test
  public void testClearEmpty() {
    KeyedQueue<String, Integer> queue = new KeyedQueue<>();
    assertEquals(Collections.emptyList(), queue.clear());
    assertNull(queue.peekFirst());
  }
}
