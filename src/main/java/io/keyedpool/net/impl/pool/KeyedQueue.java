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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A FIFO queue of values indexed by key.
 *
 * <p> Each entry is linked twice: in the queue of all entries and in the queue of the entries of its key. The
 * oldest entry, the oldest entry of a key and the removal of an entry are constant time operations.
 *
 * <p> This class is not thread safe.
 */
class KeyedQueue<K, V> {

  static final class Node<K, V> {

    final K key;
    final V value;
    private Node<K, V> prev;
    private Node<K, V> next;
    private Node<K, V> keyPrev;
    private Node<K, V> keyNext;
    private boolean linked;

    private Node(K key, V value) {
      this.key = key;
      this.value = value;
    }

    boolean isLinked() {
      return linked;
    }
  }

  private static final class Bucket<K, V> {
    Node<K, V> head;
    Node<K, V> tail;
    int size;
  }

  private final Map<K, Bucket<K, V>> buckets = new HashMap<>();
  private Node<K, V> head;
  private Node<K, V> tail;
  private int size;

  Node<K, V> addLast(K key, V value) {
    Node<K, V> node = new Node<>(key, value);
    if (tail == null) {
      head = node;
    } else {
      tail.next = node;
      node.prev = tail;
    }
    tail = node;
    Bucket<K, V> bucket = buckets.computeIfAbsent(key, k -> new Bucket<>());
    if (bucket.tail == null) {
      bucket.head = node;
    } else {
      bucket.tail.keyNext = node;
      node.keyPrev = bucket.tail;
    }
    bucket.tail = node;
    bucket.size++;
    node.linked = true;
    size++;
    return node;
  }

  Node<K, V> peekFirst() {
    return head;
  }

  Node<K, V> peekFirst(K key) {
    Bucket<K, V> bucket = buckets.get(key);
    return bucket != null ? bucket.head : null;
  }

  Node<K, V> pollFirst() {
    Node<K, V> node = head;
    if (node != null) {
      remove(node);
    }
    return node;
  }

  Node<K, V> pollFirst(K key) {
    Node<K, V> node = peekFirst(key);
    if (node != null) {
      remove(node);
    }
    return node;
  }

  /**
   * Unlink {@code node}, it must belong to this queue.
   *
   * @return {@code false} when the node was already removed
   */
  boolean remove(Node<K, V> node) {
    if (!node.linked) {
      return false;
    }
    if (node.prev == null) {
      head = node.next;
    } else {
      node.prev.next = node.next;
    }
    if (node.next == null) {
      tail = node.prev;
    } else {
      node.next.prev = node.prev;
    }
    Bucket<K, V> bucket = buckets.get(node.key);
    if (node.keyPrev == null) {
      bucket.head = node.keyNext;
    } else {
      node.keyPrev.keyNext = node.keyNext;
    }
    if (node.keyNext == null) {
      bucket.tail = node.keyPrev;
    } else {
      node.keyNext.keyPrev = node.keyPrev;
    }
    if (--bucket.size == 0) {
      buckets.remove(node.key);
    }
    node.prev = node.next = node.keyPrev = node.keyNext = null;
    node.linked = false;
    size--;
    return true;
  }

  /**
   * Remove all the entries.
   *
   * @return the removed values in queue order
   */
  List<V> clear() {
    List<V> values = new ArrayList<>(size);
    Node<K, V> node;
    while ((node = pollFirst()) != null) {
      values.add(node.value);
    }
    return values;
  }

  int size() {
    return size;
  }

  int size(K key) {
    Bucket<K, V> bucket = buckets.get(key);
    return bucket != null ? bucket.size : 0;
  }

  boolean isEmpty() {
    return size == 0;
  }
}
