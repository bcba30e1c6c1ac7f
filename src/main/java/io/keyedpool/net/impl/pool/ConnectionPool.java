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

import io.keyedpool.net.PoolOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * Keyed connection pool.
 *
 * <p> The pool bounds the number of connections open or being opened across all keys. Connections are reused for
 * the key they were built for, idle connections of other keys are evicted to make room for a key that has none.
 *
 * @param <K> the key type
 * @param <C> the connection type
 */
public interface ConnectionPool<K, C extends PooledConnection<K>> {

  static <K, C extends PooledConnection<K>> ConnectionPool<K, C> pool(Vertx vertx, Connector<K, C> connector, int maxOpen) {
    return pool(vertx, connector, new PoolOptions().setMaxOpen(maxOpen));
  }

  static <K, C extends PooledConnection<K>> ConnectionPool<K, C> pool(Vertx vertx, Connector<K, C> connector, PoolOptions options) {
    return new KeyedConnectionPool<>(vertx, connector, options);
  }

  /**
   * Acquire a connection from the pool, using the acquire timeout configured on the pool.
   *
   * @param key the key
   * @return a future completed with the connection on the caller context
   */
  Future<C> acquire(K key);

  /**
   * Acquire a connection from the pool.
   *
   * <p> When no connection is available the request waits until a connection is built or released for this key,
   * or until the timeout fires in which case the future fails with {@link io.keyedpool.net.PoolTimeoutException}.
   * After shutdown the future fails with {@link io.keyedpool.net.PoolClosedException}.
   *
   * @param key the key
   * @param timeout the timeout in milliseconds, {@code 0} to wait forever
   * @return a future completed with the connection on the caller context
   */
  Future<C> acquire(K key, long timeout);

  /**
   * Give back a connection obtained from {@link #acquire}, this must be called exactly once per connection.
   *
   * @param key the key the connection was acquired for
   * @param connection the connection
   * @param keepAlive {@code true} to make the connection available for reuse, {@code false} to close it
   */
  void release(K key, C connection, boolean keepAlive);

  /**
   * Shut down the pool: idle connections are closed, connections still in use are closed when released.
   *
   * @return a future completed when idle connections have been closed
   */
  Future<Void> shutdown();

  /**
   * @return the number of connections open or being opened
   */
  int openCount();

  /**
   * @return the number of idle connections
   */
  int idleCount();

  /**
   * @return the number of waiters
   */
  int waiterCount();

  int maxOpen();

  boolean isClosed();

}
