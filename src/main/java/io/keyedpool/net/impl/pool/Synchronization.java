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
 * Serializes the actions applied to a piece of state.
 *
 * <p> An {@link Action} mutates the state and may return a post action. The post action is executed once the
 * action no longer has exclusive access to the state, it is where promises are completed and I/O is started.
 *
 * @param <S> the state type
 */
public interface Synchronization<S> {

  interface Action<S> {

    /**
     * Apply the action to the state.
     *
     * @return the post action or {@code null}
     */
    Runnable execute(S state);
  }

  void execute(Action<S> action);

}
