/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.events;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.ibm.asyncevents.pump.AsyncDelegatePump;
import com.ibm.asyncevents.util.CancellationTokenSource;
import com.ibm.asyncevents.util.StageSupport;
import com.ibm.asyncevents.util.TestUtil;

public final class AsyncEventBenchmarks {
  private AsyncEventBenchmarks() {}

  @Fork(1)
  @State(Scope.Benchmark)
  @OutputTimeUnit(TimeUnit.NANOSECONDS)
  public static class WaitThenSet {
    AsyncEvent event;
    CancellationTokenSource source;

    @Param({"auto", "manual"})
    String impl;

    @Setup
    public void setupBenchmark() {
      this.event = "auto".equals(this.impl)
          ? new AsyncAutoResetEvent()
          : new AsyncManualResetEvent();
      this.source = new CancellationTokenSource();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @Warmup(iterations = 10, time = 2, timeUnit = TimeUnit.SECONDS)
    @Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
    public Object untimed() {
      final CompletionStage<Boolean> wait = this.event.waitAsync();
      this.event.set();
      reset();
      return TestUtil.join(wait);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @Warmup(iterations = 10, time = 2, timeUnit = TimeUnit.SECONDS)
    @Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
    public Object timedAndCancelable() {
      // registers a timer and a cancellation callback, both disposed by the set
      final CompletionStage<Boolean> wait = this.event.waitAsync(60000, this.source.token());
      this.event.set();
      reset();
      return TestUtil.join(wait);
    }

    private void reset() {
      if (this.event instanceof AsyncManualResetEvent) {
        ((AsyncManualResetEvent) this.event).reset();
      }
    }
  }

  @Fork(1)
  @State(Scope.Benchmark)
  @OutputTimeUnit(TimeUnit.NANOSECONDS)
  public static class PumpSend {
    AsyncDelegatePump pump;

    @Setup
    public void setupBenchmark() {
      this.pump = new AsyncDelegatePump();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @Warmup(iterations = 10, time = 2, timeUnit = TimeUnit.SECONDS)
    @Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
    public Object send() {
      return TestUtil.join(this.pump.send(() -> {
        Blackhole.consumeCPU(20);
        return StageSupport.completedStage(1);
      }));
    }
  }
}
