/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.events;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionStage;

import com.ibm.asyncevents.util.CancellationToken;
import com.ibm.asyncevents.util.Deadlines;

/**
 * An asynchronously awaitable signal.
 *
 * <p>
 * Implementations will specify how many waiters a single {@link #set()} releases and whether the
 * signal persists after waiters observe it; this interface does not define these requirements.
 *
 * <p>
 * Every wait returns a {@link CompletionStage} of {@link Boolean}: {@code true} when the signal
 * was observed, {@code false} when the given timeout elapsed first. A wait whose
 * {@link CancellationToken} is canceled before the signal arrives completes exceptionally with a
 * {@link CancellationException}. A token which is already canceled when the wait is requested
 * fails the call itself, before anything is queued.
 *
 * @see AsyncManualResetEvent
 * @see AsyncAutoResetEvent
 */
public interface AsyncEvent {

  /**
   * Waits for the signal, or until the timeout elapses, or until {@code token} is canceled.
   *
   * <p>
   * A timeout of zero polls the current state without waiting. A timeout of
   * {@link Deadlines#INFINITE_MILLIS} never elapses.
   *
   * @param timeoutMillis a non-negative timeout in milliseconds, or
   *        {@link Deadlines#INFINITE_MILLIS}
   * @param token a cancellation signal to observe while waiting
   * @return a {@link CompletionStage} that completes with {@code true} if the signal was observed,
   *         or {@code false} if the timeout elapsed first
   * @throws IllegalArgumentException if {@code timeoutMillis} is less than -1
   * @throws CancellationException if {@code token} is already canceled
   */
  CompletionStage<Boolean> waitAsync(long timeoutMillis, CancellationToken token);

  /**
   * Sets the signal.
   *
   * @param runInline {@code true} to complete released waiters, and run their dependents, on the
   *        calling thread before this method returns; {@code false} to complete them on a
   *        background executor
   */
  void set(boolean runInline);

  /**
   * Sets the signal, completing released waiters on the calling thread.
   *
   * @see #set(boolean)
   */
  default void set() {
    set(true);
  }

  /**
   * Waits for the signal without a timeout.
   *
   * @return a {@link CompletionStage} that completes with {@code true} when the signal is observed
   */
  default CompletionStage<Boolean> waitAsync() {
    return waitAsync(Deadlines.INFINITE_MILLIS, CancellationToken.none());
  }

  /**
   * Waits for the signal without a timeout, until {@code token} is canceled.
   *
   * @param token a cancellation signal to observe while waiting
   * @return a {@link CompletionStage} that completes with {@code true} when the signal is observed
   * @throws CancellationException if {@code token} is already canceled
   */
  default CompletionStage<Boolean> waitAsync(final CancellationToken token) {
    return waitAsync(Deadlines.INFINITE_MILLIS, token);
  }

  /**
   * Waits for the signal, or until the timeout elapses.
   *
   * @param timeoutMillis a non-negative timeout in milliseconds, or
   *        {@link Deadlines#INFINITE_MILLIS}
   * @return a {@link CompletionStage} that completes with {@code true} if the signal was observed,
   *         or {@code false} if the timeout elapsed first
   * @throws IllegalArgumentException if {@code timeoutMillis} is less than -1
   */
  default CompletionStage<Boolean> waitAsync(final long timeoutMillis) {
    return waitAsync(timeoutMillis, CancellationToken.none());
  }

  /**
   * Waits for the signal, or until the timeout elapses.
   *
   * @param timeout a non-negative timeout, or {@link Deadlines#INFINITE}
   * @return a {@link CompletionStage} that completes with {@code true} if the signal was observed,
   *         or {@code false} if the timeout elapsed first
   * @throws IllegalArgumentException if {@code timeout} is negative and not infinite
   */
  default CompletionStage<Boolean> waitAsync(final Duration timeout) {
    return waitAsync(Deadlines.toMillis(timeout), CancellationToken.none());
  }

  /**
   * Waits for the signal, or until the timeout elapses, or until {@code token} is canceled.
   *
   * @param timeout a non-negative timeout, or {@link Deadlines#INFINITE}
   * @param token a cancellation signal to observe while waiting
   * @return a {@link CompletionStage} that completes with {@code true} if the signal was observed,
   *         or {@code false} if the timeout elapsed first
   * @throws IllegalArgumentException if {@code timeout} is negative and not infinite
   * @throws CancellationException if {@code token} is already canceled
   */
  default CompletionStage<Boolean> waitAsync(final Duration timeout,
      final CancellationToken token) {
    return waitAsync(Deadlines.toMillis(timeout), token);
  }
}
