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

package io.keyedpool.benchmarks;

import io.keyedpool.net.impl.pool.LockSynchronization;
import io.keyedpool.net.impl.pool.NonBlockingSynchronization;
import io.keyedpool.net.impl.pool.Synchronization;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Compares the throughput of the pool synchronizations when two threads submit actions, each action running a post
 * action like a pool hand-off does.
 */
@State(Scope.Benchmark)
@Warmup(iterations = 20, time = 200, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 10, time = 200, timeUnit = MILLISECONDS)
@Threads(2)
public class SynchronizationBenchmark extends BenchmarkBase {

  static class Counter {
    long value;
  }

  private Synchronization<Counter> lock;
  private Synchronization<Counter> nonBlocking;
  private Synchronization.Action<Counter> action;

  @Setup
  public void setup() {
    lock = new LockSynchronization<>(new Counter());
    nonBlocking = new NonBlockingSynchronization<>(new Counter());
    action = state -> {
      state.value++;
      return () -> Blackhole.consumeCPU(10);
    };
  }

  @Benchmark
  public void lock() {
    lock.execute(action);
  }

  @Benchmark
  public void nonBlocking() {
    nonBlocking.execute(action);
  }
}
