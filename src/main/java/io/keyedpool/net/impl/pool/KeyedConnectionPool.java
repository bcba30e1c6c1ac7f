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

import io.keyedpool.net.ConnectionPoolTooBusyException;
import io.keyedpool.net.PoolClosedException;
import io.keyedpool.net.PoolOptions;
import io.keyedpool.net.PoolTimeoutException;
import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.impl.logging.Logger;
import io.vertx.core.impl.logging.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public class KeyedConnectionPool<K, C extends PooledConnection<K>> implements ConnectionPool<K, C> {

  private static final Logger log = LoggerFactory.getLogger(KeyedConnectionPool.class);

  static class Waiter<K, C> {

    final Vertx vertx;
    final Context context;
    final K key;
    final long timeout;
    final Promise<C> promise;
    KeyedQueue.Node<K, Waiter<K, C>> node;
    volatile long timerId = -1L;

    Waiter(Vertx vertx, Context context, K key, long timeout) {
      this.vertx = vertx;
      this.context = context;
      this.key = key;
      this.timeout = timeout;
      this.promise = Promise.promise();
    }

    void succeed(C connection) {
      cancelTimer();
      emit(Future.succeededFuture(connection));
    }

    void fail(Throwable cause) {
      cancelTimer();
      emit(Future.failedFuture(cause));
    }

    private void cancelTimer() {
      long id = timerId;
      if (id != -1L) {
        vertx.cancelTimer(id);
      }
    }

    private void emit(AsyncResult<C> result) {
      if (Vertx.currentContext() == context) {
        promise.handle(result);
      } else {
        context.runOnContext(v -> promise.handle(result));
      }
    }
  }

  private final Vertx vertx;
  private final Context context;
  private final Connector<K, C> connector;
  private final int maxOpen;
  private final int maxWaiters;
  private final long acquireTimeout;
  private final boolean failWaitersOnShutdown;
  private final boolean rebuildForStarvingWaiters;
  private final KeyedQueue<K, C> idle = new KeyedQueue<>();
  private final KeyedQueue<K, Waiter<K, C>> waiting = new KeyedQueue<>();
  private final Set<C> leased = Collections.newSetFromMap(new IdentityHashMap<>());
  private final Map<K, Integer> connecting = new HashMap<>();
  private int openCount;
  private boolean closed;
  private final Synchronization<KeyedConnectionPool<K, C>> sync;

  KeyedConnectionPool(Vertx vertx, Connector<K, C> connector, PoolOptions options) {
    this.vertx = Objects.requireNonNull(vertx, "No null vertx accepted");
    this.context = vertx.getOrCreateContext();
    this.connector = Objects.requireNonNull(connector, "No null connector accepted");
    this.maxOpen = options.getMaxOpen();
    this.maxWaiters = options.getMaxWaiters();
    this.acquireTimeout = options.getAcquireTimeout();
    this.failWaitersOnShutdown = options.isFailWaitersOnShutdown();
    this.rebuildForStarvingWaiters = options.isRebuildForStarvingWaiters();
    if (options.isNonBlockingSynchronization()) {
      this.sync = new NonBlockingSynchronization<>(this);
    } else {
      this.sync = new LockSynchronization<>(this);
    }
  }

  private void execute(Synchronization.Action<KeyedConnectionPool<K, C>> action) {
    sync.execute(action);
  }

  private String stats() {
    return "openCount=" + openCount + " idle=" + idle.size() + " waiting=" + waiting.size();
  }

  private void debug(String msg) {
    if (log.isDebugEnabled()) {
      log.debug(msg + ": " + stats());
    }
  }

  private void checkInvariants() {
    if (!closed && (openCount < 0 || openCount > maxOpen)) {
      throw new IllegalStateException("Connection accounting out of bounds, maxOpen=" + maxOpen + " " + stats());
    }
  }

  private static Runnable andThen(Runnable first, Runnable second) {
    if (first == null) {
      return second;
    } else if (second == null) {
      return first;
    } else {
      return () -> {
        first.run();
        second.run();
      };
    }
  }

  /**
   * Reserve a slot and return the build to run, or {@code null} when the pool is full.
   */
  private Runnable createConnection(K key) {
    if (openCount < maxOpen) {
      openCount++;
      connecting.merge(key, 1, Integer::sum);
      debug("Creating connection for " + key);
      return () -> connect(key);
    } else {
      debug("Too many connections open, can't create a connection for " + key);
      return null;
    }
  }

  /**
   * Start a build for a waiter after a slot was released, preferring the waiters of {@code preferred}.
   */
  private Runnable createReplacement(K preferred) {
    if (waiting.isEmpty()) {
      return null;
    }
    K key;
    if (preferred != null && waiting.peekFirst(preferred) != null) {
      key = preferred;
    } else {
      key = waiting.peekFirst().key;
    }
    return createConnection(key);
  }

  private void connected(K key) {
    connecting.computeIfPresent(key, (k, n) -> n > 1 ? n - 1 : null);
  }

  /**
   * @return whether some waiters of {@code key} are not covered by a connection being built
   */
  private boolean isStarving(K key) {
    return waiting.size(key) > connecting.getOrDefault(key, 0);
  }

  private void connect(K key) {
    Future<C> future;
    try {
      future = connector.connect(key);
    } catch (Exception e) {
      future = Future.failedFuture(e);
    }
    future.onComplete(ar -> {
      if (ar.succeeded()) {
        execute(new ConnectSuccess<>(key, ar.result()));
      } else {
        log.error("Error establishing connection to " + key, ar.cause());
        execute(new ConnectFailed<>(key));
      }
    });
  }

  /**
   * Hand an open connection to the first waiter of its key or make it idle. A closed connection releases its slot.
   *
   * <p> With {@link PoolOptions#isRebuildForStarvingWaiters()}, when the head waiter is of another key and has no
   * connection being built for it, a build is started for it, the returned connection is closed to make room when
   * the pool is full.
   */
  private Runnable recycle(K key, C connection) {
    if (connection.isOpen()) {
      KeyedQueue.Node<K, Waiter<K, C>> node = waiting.pollFirst(key);
      if (node != null) {
        Waiter<K, C> waiter = node.value;
        leased.add(connection);
        debug("Fulfilling waiting connection request for " + key);
        return () -> waiter.succeed(connection);
      }
      K head = !rebuildForStarvingWaiters || waiting.isEmpty() ? null : waiting.peekFirst().key;
      if (head != null && isStarving(head) && openCount >= maxOpen) {
        openCount--;
        debug("Evicting returned connection for a waiting request of " + head);
        return andThen(connection::close, createConnection(head));
      }
      idle.addLast(key, connection);
      debug("Returning idle connection to pool");
      if (head != null && isStarving(head)) {
        return createConnection(head);
      }
      return null;
    } else if (!waiting.isEmpty()) {
      openCount--;
      debug("Replacing closed connection");
      return createReplacement(key);
    } else {
      openCount--;
      debug("Connection was closed, but nothing to do. Shrinking pool");
      return null;
    }
  }

  private Runnable dispose(C connection) {
    Runnable post = null;
    if (connection != null && connection.isOpen()) {
      post = connection::close;
    }
    if (closed) {
      return post;
    }
    openCount--;
    debug("Disposing of connection");
    if (!waiting.isEmpty()) {
      debug("Replacing failed connection");
      post = andThen(post, createReplacement(null));
    }
    return post;
  }

  private static class Acquire<K, C extends PooledConnection<K>> implements Synchronization.Action<KeyedConnectionPool<K, C>> {

    private final Waiter<K, C> waiter;

    private Acquire(Waiter<K, C> waiter) {
      this.waiter = waiter;
    }

    @Override
    public Runnable execute(KeyedConnectionPool<K, C> pool) {
      pool.debug("Requesting connection for " + waiter.key);
      if (pool.closed) {
        return () -> waiter.fail(new PoolClosedException());
      }

      // 1. Reuse an idle connection of the same key, dropping the stale ones
      KeyedQueue.Node<K, C> node;
      while ((node = pool.idle.pollFirst(waiter.key)) != null) {
        C connection = node.value;
        if (connection.isOpen()) {
          pool.leased.add(connection);
          pool.debug("Recycling connection");
          return () -> waiter.succeed(connection);
        }
        pool.openCount--;
        pool.debug("Evicting closed connection");
      }

      if (pool.maxWaiters != -1 && pool.waiting.size() >= pool.maxWaiters) {
        return () -> waiter.fail(new ConnectionPoolTooBusyException("Connection pool reached max wait queue size of " + pool.maxWaiters));
      }

      // 2. Evict the eldest idle connection of another key
      Runnable post = null;
      KeyedQueue.Node<K, C> eldest = pool.idle.pollFirst();
      if (eldest != null) {
        C evicted = eldest.value;
        pool.openCount--;
        pool.debug("No connections available for " + waiter.key + ". Evicting idle connection for " + eldest.key);
        post = evicted::close;
      }

      // 3. Wait, building a connection when there is room
      waiter.node = pool.waiting.addLast(waiter.key, waiter);
      // armed in the region, a post action may already serve the waiter
      if (waiter.timeout > 0) {
        pool.scheduleTimeout(waiter);
      }
      post = andThen(post, pool.createConnection(waiter.key));
      pool.checkInvariants();
      return post;
    }
  }

  @Override
  public Future<C> acquire(K key) {
    return acquire(key, acquireTimeout);
  }

  @Override
  public Future<C> acquire(K key, long timeout) {
    Objects.requireNonNull(key, "No null key accepted");
    if (timeout < 0) {
      throw new IllegalArgumentException("Invalid timeout " + timeout);
    }
    Waiter<K, C> waiter = new Waiter<>(vertx, vertx.getOrCreateContext(), key, timeout);
    execute(new Acquire<>(waiter));
    return waiter.promise.future();
  }

  private void scheduleTimeout(Waiter<K, C> waiter) {
    waiter.timerId = vertx.setTimer(waiter.timeout, id -> execute(new Expire<>(waiter)));
  }

  private static class Expire<K, C extends PooledConnection<K>> implements Synchronization.Action<KeyedConnectionPool<K, C>> {

    private final Waiter<K, C> waiter;

    private Expire(Waiter<K, C> waiter) {
      this.waiter = waiter;
    }

    @Override
    public Runnable execute(KeyedConnectionPool<K, C> pool) {
      if (waiter.node != null && pool.waiting.remove(waiter.node)) {
        pool.debug("Connection request for " + waiter.key + " timed out");
        return () -> waiter.fail(new PoolTimeoutException(waiter.key, waiter.timeout));
      }
      return null;
    }
  }

  private static class ConnectSuccess<K, C extends PooledConnection<K>> implements Synchronization.Action<KeyedConnectionPool<K, C>> {

    private final K key;
    private final C connection;

    private ConnectSuccess(K key, C connection) {
      this.key = key;
      this.connection = connection;
    }

    @Override
    public Runnable execute(KeyedConnectionPool<K, C> pool) {
      pool.connected(key);
      if (pool.closed) {
        pool.debug("Closing connection established after pool closure");
        return connection::close;
      }
      pool.debug("Submitting fresh connection to pool");
      Runnable post = pool.recycle(key, connection);
      pool.checkInvariants();
      return post;
    }
  }

  private static class ConnectFailed<K, C extends PooledConnection<K>> implements Synchronization.Action<KeyedConnectionPool<K, C>> {

    private final K key;

    private ConnectFailed(K key) {
      this.key = key;
    }

    @Override
    public Runnable execute(KeyedConnectionPool<K, C> pool) {
      pool.connected(key);
      if (pool.closed) {
        return null;
      }
      pool.debug("Connection to " + key + " failed");
      Runnable post = pool.dispose(null);
      pool.checkInvariants();
      if (post == null) {
        return null;
      }
      // A connector may fail on the calling stack, the replacement build must not run on it
      return () -> pool.context.runOnContext(v -> post.run());
    }
  }

  private static class Release<K, C extends PooledConnection<K>> implements Synchronization.Action<KeyedConnectionPool<K, C>> {

    private final K key;
    private final C connection;
    private final boolean keepAlive;

    private Release(K key, C connection, boolean keepAlive) {
      this.key = key;
      this.connection = connection;
      this.keepAlive = keepAlive;
    }

    @Override
    public Runnable execute(KeyedConnectionPool<K, C> pool) {
      if (!pool.leased.remove(connection)) {
        log.warn("Ignoring release of a connection that is not leased from the pool: " + connection);
        return null;
      }
      Runnable post;
      if (!keepAlive) {
        post = pool.dispose(connection);
      } else if (pool.closed) {
        if (connection.isOpen()) {
          pool.debug("Shutting down connection after pool closure");
          post = connection::close;
        } else {
          post = null;
        }
      } else {
        pool.debug("Reallocating connection");
        post = pool.recycle(key, connection);
      }
      pool.checkInvariants();
      return post;
    }
  }

  @Override
  public void release(K key, C connection, boolean keepAlive) {
    Objects.requireNonNull(key, "No null key accepted");
    Objects.requireNonNull(connection, "No null connection accepted");
    execute(new Release<>(key, connection, keepAlive));
  }

  private static class Shutdown<K, C extends PooledConnection<K>> implements Synchronization.Action<KeyedConnectionPool<K, C>> {

    private final Promise<Void> promise;

    private Shutdown(Promise<Void> promise) {
      this.promise = promise;
    }

    @Override
    public Runnable execute(KeyedConnectionPool<K, C> pool) {
      if (pool.closed) {
        return promise::complete;
      }
      log.info("Shutting down connection pool: " + pool.stats());
      pool.closed = true;
      pool.openCount = 0;
      List<C> idle = pool.idle.clear();
      List<Waiter<K, C>> waiters = pool.failWaitersOnShutdown ? pool.waiting.clear() : Collections.emptyList();
      return () -> {
        idle.forEach(PooledConnection::close);
        waiters.forEach(waiter -> waiter.fail(new PoolClosedException()));
        promise.complete();
      };
    }
  }

  @Override
  public Future<Void> shutdown() {
    Promise<Void> promise = Promise.promise();
    execute(new Shutdown<>(promise));
    return promise.future();
  }

  @Override
  public int openCount() {
    return openCount;
  }

  @Override
  public int idleCount() {
    return idle.size();
  }

  @Override
  public int waiterCount() {
    return waiting.size();
  }

  @Override
  public int maxOpen() {
    return maxOpen;
  }

  @Override
  public boolean isClosed() {
    return closed;
  }
}
