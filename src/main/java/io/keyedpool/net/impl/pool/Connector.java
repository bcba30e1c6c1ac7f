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

import io.vertx.core.Future;

/**
 * Builds the connections of a pool.
 *
 * @param <K> the key type
 * @param <C> the connection type
 */
public interface Connector<K, C> {

  /**
   * Build a connection for {@code key}. This is called outside the pool synchronization.
   *
   * <p> A failed build must not leave resources open, the pool only accounts for the connections it receives.
   *
   * @param key the key
   * @return the future connection
   */
  Future<C> connect(K key);

}
