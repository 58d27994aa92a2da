/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.util;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.ibm.asyncevents.util.CancellationToken.Registration;

/**
 * Races pending operations against timeouts and cancellation, and owns the shared timer used for
 * every deadline in this library.
 *
 * <p>
 * Timeouts are expressed either as milliseconds, where {@link #INFINITE_MILLIS} ({@code -1}) waits
 * forever, or as a {@link Duration}, where {@link #INFINITE} does. Any other negative timeout is
 * rejected with an {@link IllegalArgumentException}.
 *
 * <p>
 * Timers run on a single daemon thread and hand their work off to the
 * {@link ForkJoinPool#commonPool() common pool}, so dependents of a stage resolved by a deadline
 * never run on the timer thread. Disposing a timer removes it from the timer queue immediately.
 */
public final class Deadlines {
  private Deadlines() {}

  /**
   * A timeout in milliseconds which never elapses.
   */
  public static final long INFINITE_MILLIS = -1L;

  /**
   * A timeout which never elapses.
   */
  public static final Duration INFINITE = Duration.ofMillis(INFINITE_MILLIS);

  private static final ScheduledThreadPoolExecutor TIMER;

  static {
    TIMER = new ScheduledThreadPoolExecutor(1, r -> {
      final Thread t = new Thread(r, "asyncevents-timer");
      t.setDaemon(true);
      return t;
    });
    TIMER.setRemoveOnCancelPolicy(true);
  }

  /**
   * Validates a timeout in milliseconds.
   *
   * @param timeoutMillis a non-negative timeout, or {@link #INFINITE_MILLIS}
   * @return {@code timeoutMillis}
   * @throws IllegalArgumentException if {@code timeoutMillis} is less than -1
   */
  public static long checkTimeout(final long timeoutMillis) {
    if (timeoutMillis < INFINITE_MILLIS) {
      throw new IllegalArgumentException(
          String.format("timeout must be non-negative or %d, given %d",
              INFINITE_MILLIS, timeoutMillis));
    }
    return timeoutMillis;
  }

  /**
   * Converts a timeout to milliseconds. A positive timeout shorter than a millisecond is rounded
   * up to one millisecond so that it is not mistaken for a zero timeout; timeouts too long to be
   * represented saturate at {@link Long#MAX_VALUE}.
   *
   * @param timeout a non-negative timeout, or {@link #INFINITE}
   * @return the timeout in milliseconds, or {@link #INFINITE_MILLIS}
   * @throws IllegalArgumentException if {@code timeout} is negative and not {@link #INFINITE}
   */
  public static long toMillis(final Duration timeout) {
    Objects.requireNonNull(timeout);
    if (timeout.equals(INFINITE)) {
      return INFINITE_MILLIS;
    }
    if (timeout.isNegative()) {
      throw new IllegalArgumentException(
          "timeout must be non-negative or Deadlines.INFINITE, given " + timeout);
    }
    final long millis;
    try {
      millis = timeout.toMillis();
    } catch (final ArithmeticException e) {
      return Long.MAX_VALUE;
    }
    return millis == 0 && !timeout.isZero() ? 1 : millis;
  }

  /**
   * Runs {@code task} once after the given delay.
   *
   * @param task the action to run
   * @param delayMillis a non-negative delay in milliseconds
   * @return a registration which cancels the timer when closed
   */
  public static Registration schedule(final Runnable task, final long delayMillis) {
    Objects.requireNonNull(task);
    if (delayMillis < 0) {
      throw new IllegalArgumentException("delay must be non-negative, given " + delayMillis);
    }
    final ScheduledFuture<?> f = TIMER.schedule(
        () -> ForkJoinPool.commonPool().execute(task), delayMillis, TimeUnit.MILLISECONDS);
    return () -> f.cancel(false);
  }

  /**
   * The number of timers scheduled and not yet fired or disposed. Intended for diagnostics; the
   * value may be stale by the time it is returned.
   *
   * @return the count of pending timers
   */
  public static int pendingTimers() {
    return TIMER.getQueue().size();
  }

  /**
   * Races {@code operation} against a timeout and a cancellation token.
   *
   * <p>
   * The returned stage completes
   * <ul>
   * <li>with the outcome of {@code operation} (including its failure) if it completes first,
   * <li>with {@code false} if the timeout elapses first,
   * <li>exceptionally with a {@link CancellationException} if {@code token} is canceled first.
   * </ul>
   * Whichever of the timer and the cancellation registration did not win is disposed as soon as
   * the race resolves, whatever resolved it.
   *
   * <p>
   * If {@code operation} is already complete, or the timeout is infinite and the token cannot be
   * canceled, {@code operation} itself is returned. A zero timeout against an incomplete operation
   * resolves to {@code false} immediately without scheduling a timer.
   *
   * @param operation the pending operation
   * @param timeoutMillis a non-negative timeout in milliseconds, or {@link #INFINITE_MILLIS}
   * @param token the cancellation signal to observe
   * @return a stage holding the winner of the race
   * @throws IllegalArgumentException if {@code timeoutMillis} is less than -1
   */
  public static CompletionStage<Boolean> race(
      final CompletionStage<Boolean> operation,
      final long timeoutMillis,
      final CancellationToken token) {
    Objects.requireNonNull(operation);
    Objects.requireNonNull(token);
    checkTimeout(timeoutMillis);

    if (isDone(operation)
        || (timeoutMillis == INFINITE_MILLIS && !token.canBeCanceled())) {
      return operation;
    }
    if (timeoutMillis == 0) {
      return StageSupport.falseStage();
    }
    if (token.isCancellationRequested()) {
      return StageSupport.exceptionalStage(new CancellationException("wait canceled"));
    }
    return new Race(operation, timeoutMillis, token);
  }

  /**
   * Whether {@code stage} is known to be complete, without converting it. Stages which are not
   * {@link Future}s are treated as pending.
   */
  private static boolean isDone(final CompletionStage<?> stage) {
    return stage instanceof Future && ((Future<?>) stage).isDone();
  }

  private static final class Race extends CompletableFuture<Boolean> {
    private volatile Registration timer = Registration.NONE;
    private volatile Registration cancellation = Registration.NONE;

    Race(final CompletionStage<Boolean> operation, final long timeoutMillis,
        final CancellationToken token) {
      if (timeoutMillis != INFINITE_MILLIS) {
        this.timer = schedule(() -> complete(false), timeoutMillis);
      }
      if (token.canBeCanceled()) {
        this.cancellation =
            token.register(() -> completeExceptionally(new CancellationException("wait canceled")));
      }
      operation.whenComplete((result, ex) -> {
        if (ex != null) {
          completeExceptionally(StageSupport.unwrap(ex));
        } else {
          complete(result);
        }
      });
      // attached last so both registrations are visible, even if the race is already over
      whenComplete((ig, ex) -> {
        this.timer.close();
        this.cancellation.close();
      });
    }
  }
}
