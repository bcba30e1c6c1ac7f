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
package io.keyedpool.net;

import io.vertx.core.json.JsonObject;

/**
 * Options configuring a connection pool.
 */
public class PoolOptions {

  /**
   * The default maximum number of connections open or being opened = 10
   */
  public static final int DEFAULT_MAX_OPEN = 10;

  /**
   * The default maximum number of waiters = -1 (unbounded)
   */
  public static final int DEFAULT_MAX_WAITERS = -1;

  /**
   * The default acquire timeout = 0 ms (wait forever)
   */
  public static final long DEFAULT_ACQUIRE_TIMEOUT = 0L;

  /**
   * Waiters pending when the pool shuts down are failed by default
   */
  public static final boolean DEFAULT_FAIL_WAITERS_ON_SHUTDOWN = true;

  /**
   * A connection returned with no waiter of its key goes idle by default
   */
  public static final boolean DEFAULT_REBUILD_FOR_STARVING_WAITERS = false;

  /**
   * Actions are serialized with a lock by default
   */
  public static final boolean DEFAULT_NON_BLOCKING_SYNCHRONIZATION = false;

  private int maxOpen;
  private int maxWaiters;
  private long acquireTimeout;
  private boolean failWaitersOnShutdown;
  private boolean rebuildForStarvingWaiters;
  private boolean nonBlockingSynchronization;

  /**
   * Default constructor
   */
  public PoolOptions() {
    maxOpen = DEFAULT_MAX_OPEN;
    maxWaiters = DEFAULT_MAX_WAITERS;
    acquireTimeout = DEFAULT_ACQUIRE_TIMEOUT;
    failWaitersOnShutdown = DEFAULT_FAIL_WAITERS_ON_SHUTDOWN;
    rebuildForStarvingWaiters = DEFAULT_REBUILD_FOR_STARVING_WAITERS;
    nonBlockingSynchronization = DEFAULT_NON_BLOCKING_SYNCHRONIZATION;
  }

  /**
   * Copy constructor
   *
   * @param other  the options to copy
   */
  public PoolOptions(PoolOptions other) {
    this.maxOpen = other.maxOpen;
    this.maxWaiters = other.maxWaiters;
    this.acquireTimeout = other.acquireTimeout;
    this.failWaitersOnShutdown = other.failWaitersOnShutdown;
    this.rebuildForStarvingWaiters = other.rebuildForStarvingWaiters;
    this.nonBlockingSynchronization = other.nonBlockingSynchronization;
  }

  /**
   * Constructor to create an options from JSON
   *
   * @param json  the JSON
   */
  public PoolOptions(JsonObject json) {
    this();
    setMaxOpen(json.getInteger("maxOpen", DEFAULT_MAX_OPEN));
    setMaxWaiters(json.getInteger("maxWaiters", DEFAULT_MAX_WAITERS));
    setAcquireTimeout(json.getLong("acquireTimeout", DEFAULT_ACQUIRE_TIMEOUT));
    setFailWaitersOnShutdown(json.getBoolean("failWaitersOnShutdown", DEFAULT_FAIL_WAITERS_ON_SHUTDOWN));
    setRebuildForStarvingWaiters(json.getBoolean("rebuildForStarvingWaiters", DEFAULT_REBUILD_FOR_STARVING_WAITERS));
    setNonBlockingSynchronization(json.getBoolean("nonBlockingSynchronization", DEFAULT_NON_BLOCKING_SYNCHRONIZATION));
  }

  /**
   * Convert to JSON
   *
   * @return the JSON
   */
  public JsonObject toJson() {
    return new JsonObject()
      .put("maxOpen", maxOpen)
      .put("maxWaiters", maxWaiters)
      .put("acquireTimeout", acquireTimeout)
      .put("failWaitersOnShutdown", failWaitersOnShutdown)
      .put("rebuildForStarvingWaiters", rebuildForStarvingWaiters)
      .put("nonBlockingSynchronization", nonBlockingSynchronization);
  }

  /**
   * @return the maximum number of connections open or being opened
   */
  public int getMaxOpen() {
    return maxOpen;
  }

  /**
   * Set the maximum number of connections open or being opened, across all keys.
   *
   * @param maxOpen the maximum, at least 1
   * @return a reference to this, so the API can be used fluently
   */
  public PoolOptions setMaxOpen(int maxOpen) {
    if (maxOpen < 1) {
      throw new IllegalArgumentException("maxOpen must be > 0");
    }
    this.maxOpen = maxOpen;
    return this;
  }

  /**
   * @return the maximum number of waiters, {@code -1} means unbounded
   */
  public int getMaxWaiters() {
    return maxWaiters;
  }

  /**
   * Set the maximum number of acquisitions that can wait for a connection. When the wait list is full a new
   * acquisition fails with {@link ConnectionPoolTooBusyException}.
   *
   * @param maxWaiters the maximum, {@code -1} for unbounded
   * @return a reference to this, so the API can be used fluently
   */
  public PoolOptions setMaxWaiters(int maxWaiters) {
    if (maxWaiters < -1) {
      throw new IllegalArgumentException("maxWaiters must be >= -1");
    }
    this.maxWaiters = maxWaiters;
    return this;
  }

  /**
   * @return the acquire timeout in milliseconds
   */
  public long getAcquireTimeout() {
    return acquireTimeout;
  }

  /**
   * Set the default time an acquisition may wait for a connection before failing with
   * {@link PoolTimeoutException}, {@code 0} waits forever.
   *
   * @param acquireTimeout the timeout in milliseconds
   * @return a reference to this, so the API can be used fluently
   */
  public PoolOptions setAcquireTimeout(long acquireTimeout) {
    if (acquireTimeout < 0) {
      throw new IllegalArgumentException("acquireTimeout must be >= 0");
    }
    this.acquireTimeout = acquireTimeout;
    return this;
  }

  public boolean isFailWaitersOnShutdown() {
    return failWaitersOnShutdown;
  }

  /**
   * Set whether waiters pending at shutdown are failed with {@link PoolClosedException}, otherwise they are left
   * pending.
   *
   * @return a reference to this, so the API can be used fluently
   */
  public PoolOptions setFailWaitersOnShutdown(boolean failWaitersOnShutdown) {
    this.failWaitersOnShutdown = failWaitersOnShutdown;
    return this;
  }

  public boolean isRebuildForStarvingWaiters() {
    return rebuildForStarvingWaiters;
  }

  /**
   * Set whether a connection returned while the head waiter is of another key, with no connection being built for
   * that key, is used to serve it. A build starts for the head waiter's key, the returned connection being closed to
   * make room when the pool is full. Otherwise the returned connection goes idle and the waiter is served by a later
   * acquisition or release.
   *
   * @return a reference to this, so the API can be used fluently
   */
  public PoolOptions setRebuildForStarvingWaiters(boolean rebuildForStarvingWaiters) {
    this.rebuildForStarvingWaiters = rebuildForStarvingWaiters;
    return this;
  }

  public boolean isNonBlockingSynchronization() {
    return nonBlockingSynchronization;
  }

  /**
   * Set whether the pool serializes its actions with a non blocking queue instead of a lock.
   *
   * @return a reference to this, so the API can be used fluently
   */
  public PoolOptions setNonBlockingSynchronization(boolean nonBlockingSynchronization) {
    this.nonBlockingSynchronization = nonBlockingSynchronization;
    return this;
  }
}
