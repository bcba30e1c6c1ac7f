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

/**
 * A connection managed by a {@link ConnectionPool}.
 *
 * @param <K> the key type
 */
public interface PooledConnection<K> {

  /**
   * @return the key this connection was built for
   */
  K key();

  /**
   * A connection can become closed at any time, e.g when the peer closes it. The pool checks this before handing
   * the connection out again.
   *
   * @return whether the connection is still usable
   */
  boolean isOpen();

  /**
   * Close the connection, calling it on a closed connection has no effect.
   */
  void close();

}
