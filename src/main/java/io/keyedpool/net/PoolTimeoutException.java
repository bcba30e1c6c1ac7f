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

import io.vertx.core.VertxException;

/**
 * Thrown when a connection request stayed in the pool wait list longer than its timeout.
 */
public class PoolTimeoutException extends VertxException {

  private final Object key;
  private final long timeout;

  public PoolTimeoutException(Object key, long timeout) {
    super("Timed out after " + timeout + " ms waiting for a connection to " + key);
    this.key = key;
    this.timeout = timeout;
  }

  public Object key() {
    return key;
  }

  /**
   * @return the timeout in milliseconds
   */
  public long timeout() {
    return timeout;
  }
}
