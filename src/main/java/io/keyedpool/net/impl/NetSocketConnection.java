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
package io.keyedpool.net.impl;

import io.keyedpool.net.RequestKey;
import io.keyedpool.net.impl.pool.PooledConnection;
import io.vertx.core.net.NetSocket;

/**
 * A pooled TCP connection.
 *
 * <p> The connection is no longer open once the socket is closed, whichever side closed it.
 */
public class NetSocketConnection implements PooledConnection<RequestKey> {

  private final RequestKey key;
  private final NetSocket socket;
  private volatile boolean open = true;

  public NetSocketConnection(RequestKey key, NetSocket socket) {
    this.key = key;
    this.socket = socket;
    socket.closeHandler(v -> open = false);
  }

  @Override
  public RequestKey key() {
    return key;
  }

  public NetSocket socket() {
    return socket;
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    if (open) {
      open = false;
      socket.close();
    }
  }

  @Override
  public String toString() {
    return "NetSocketConnection[" + key + ", " + socket.localAddress() + " -> " + socket.remoteAddress() + "]";
  }
}
