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

/**
 * Runs the pool tests with actions serialized by {@link NonBlockingSynchronization}.
 */
public class NonBlockingConnectionPoolTest extends ConnectionPoolTest {

  @Override
  protected PoolOptions options(int maxOpen) {
    return super.options(maxOpen).setNonBlockingSynchronization(true);
  }
}
