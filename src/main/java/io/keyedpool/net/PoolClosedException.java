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
 * Signals an acquisition that cannot be served because the pool has been shut down.
 */
public class PoolClosedException extends VertxException {

  public PoolClosedException() {
    super("Connection pool is closed");
  }
}
