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
import io.keyedpool.net.impl.pool.Connector;
import io.vertx.core.CompositeFuture;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.impl.logging.Logger;
import io.vertx.core.impl.logging.LoggerFactory;
import io.vertx.core.net.NetClient;
import io.vertx.core.net.NetClientOptions;

/**
 * Builds TCP connections with a Vert.x {@link NetClient}, secure keys are connected with TLS using the host as
 * server name.
 */
public class NetSocketConnector implements Connector<RequestKey, NetSocketConnection> {

  private static final Logger log = LoggerFactory.getLogger(NetSocketConnector.class);

  private final NetClient client;
  private final NetClient sslClient;

  public NetSocketConnector(Vertx vertx, NetClientOptions options) {
    this.client = vertx.createNetClient(new NetClientOptions(options).setSsl(false));
    this.sslClient = vertx.createNetClient(new NetClientOptions(options).setSsl(true));
  }

  public NetSocketConnector(Vertx vertx) {
    this(vertx, new NetClientOptions());
  }

  @Override
  public Future<NetSocketConnection> connect(RequestKey key) {
    NetClient c = key.isSecure() ? sslClient : client;
    return c
      .connect(key.port(), key.host(), key.host())
      .map(socket -> {
        if (log.isDebugEnabled()) {
          log.debug("Connected to " + key + " from " + socket.localAddress());
        }
        return new NetSocketConnection(key, socket);
      });
  }

  /**
   * Close the underlying clients, connections still open are closed.
   */
  public Future<Void> close() {
    return CompositeFuture.all(client.close(), sslClient.close()).mapEmpty();
  }
}
