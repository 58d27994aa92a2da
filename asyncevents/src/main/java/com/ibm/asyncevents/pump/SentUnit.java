/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.pump;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ibm.asyncevents.util.CancellationToken;
import com.ibm.asyncevents.util.CancellationToken.Registration;
import com.ibm.asyncevents.util.Deadlines;
import com.ibm.asyncevents.util.StageSupport;

/**
 * A unit whose outcome is delivered to the sender, and which may expire or be canceled while it
 * waits for its turn.
 *
 * @param <R> the result type of the action
 */
final class SentUnit<R> extends WorkUnit {
  private static final Logger LOG = LoggerFactory.getLogger(SentUnit.class);

  /*
   * The unit is claimed exactly once, by the first of the pump (PENDING -> STARTED), the timer or
   * the cancellation callback (PENDING -> TERMINAL). Only the claimant touches the result. Once
   * started, the deadline and the cancellation token have no further effect.
   */
  private static final int PENDING = 0;
  private static final int STARTED = 1;
  private static final int TERMINAL = 2;

  private final AtomicInteger state = new AtomicInteger(PENDING);
  private final CompletableFuture<R> result = new CompletableFuture<>();
  private final Supplier<? extends CompletionStage<R>> action;
  private final long timeoutMillis;

  private volatile Registration timer = Registration.NONE;
  private volatile Registration cancellation = Registration.NONE;

  SentUnit(final Supplier<? extends CompletionStage<R>> action, final long timeoutMillis,
      final CancellationToken token) {
    this.action = action;
    this.timeoutMillis = timeoutMillis;
    if (token.canBeCanceled()) {
      this.cancellation = token.register(this::cancel);
    }
    if (timeoutMillis != Deadlines.INFINITE_MILLIS) {
      this.timer = Deadlines.schedule(this::expire, timeoutMillis);
    }
    if (this.state.get() != PENDING) {
      // claimed while the registrations were being installed
      dispose();
    }
  }

  CompletionStage<R> result() {
    return this.result;
  }

  @Override
  CompletionStage<?> execute() {
    if (!this.state.compareAndSet(PENDING, STARTED)) {
      LOG.debug("skipping work unit which expired or was canceled before it started");
      return StageSupport.voidStage();
    }
    dispose();

    final CompletionStage<R> stage;
    try {
      stage = this.action.get();
    } catch (final Throwable e) {
      finish(null, e);
      return StageSupport.voidStage();
    }
    if (stage == null) {
      finish(null, null);
      return StageSupport.voidStage();
    }
    return stage.handle((r, ex) -> {
      finish(r, ex);
      return null;
    });
  }

  private void finish(final R value, final Throwable ex) {
    this.state.set(TERMINAL);
    if (ex != null) {
      this.result.completeExceptionally(StageSupport.unwrap(ex));
    } else {
      this.result.complete(value);
    }
  }

  private void expire() {
    if (this.state.compareAndSet(PENDING, TERMINAL)) {
      dispose();
      LOG.debug("work unit expired after {} ms before it started", this.timeoutMillis);
      this.result.completeExceptionally(
          new TimeoutException("work unit did not start within " + this.timeoutMillis + " ms"));
    }
  }

  private void cancel() {
    if (this.state.compareAndSet(PENDING, TERMINAL)) {
      dispose();
      LOG.debug("work unit canceled before it started");
      this.result.completeExceptionally(new CancellationException("work unit canceled"));
    }
  }

  private void dispose() {
    this.timer.close();
    this.cancellation.close();
  }
}
