/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.util;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ibm.asyncevents.util.CancellationToken.Registration;

/**
 * Signals a {@link CancellationToken} that it should be canceled.
 *
 * <p>
 * {@link #cancel()} is idempotent. Every callback registered on the token before cancellation runs
 * exactly once, on the thread which requests cancellation; callbacks registered afterwards run
 * immediately on the registering thread. A callback whose registration is closed before
 * cancellation never runs.
 *
 * <pre>
 * {@code
 * CancellationTokenSource source = new CancellationTokenSource();
 * source.cancelAfter(Duration.ofSeconds(5));
 * event.waitAsync(source.token()).thenRun(...);
 * }
 * </pre>
 */
public final class CancellationTokenSource {
  private static final Logger LOG = LoggerFactory.getLogger(CancellationTokenSource.class);

  /*
   * A callback may be claimed either by cancel(), by register() (when it observes that cancellation
   * raced with the registration) or by Registration.close(). Each claimant must remove the callback
   * from the set first, so the set's removal is the single point that decides whether the callback
   * runs.
   */
  private final Set<Callback> callbacks = ConcurrentHashMap.newKeySet();
  private final AtomicReference<Registration> timer = new AtomicReference<>(Registration.NONE);
  private final CancellationToken token = new CancellationToken(this);
  private volatile boolean canceled;

  /**
   * @return the token observed by operations canceled through this source
   */
  public CancellationToken token() {
    return this.token;
  }

  /**
   * @return {@code true} if {@link #cancel()} has been called, directly or by a timer
   */
  public boolean isCancellationRequested() {
    return this.canceled;
  }

  /**
   * Requests cancellation and runs all registered callbacks on the calling thread. Subsequent
   * calls have no effect.
   *
   * <p>
   * A throwing callback does not prevent the remaining callbacks from running. The first failure
   * is rethrown once all callbacks have run, with any later failures attached as
   * {@link Throwable#addSuppressed(Throwable) suppressed} exceptions.
   */
  public void cancel() {
    synchronized (this.callbacks) {
      if (this.canceled) {
        return;
      }
      this.canceled = true;
    }
    this.timer.getAndSet(Registration.NONE).close();

    Throwable failure = null;
    for (final Callback c : this.callbacks) {
      if (this.callbacks.remove(c)) {
        try {
          c.action.run();
        } catch (final Throwable t) {
          LOG.debug("cancellation callback failed", t);
          if (failure == null) {
            failure = t;
          } else {
            failure.addSuppressed(t);
          }
        }
      }
    }

    if (failure instanceof Error) {
      throw (Error) failure;
    } else if (failure != null) {
      throw (RuntimeException) failure;
    }
  }

  /**
   * Schedules a call to {@link #cancel()} after the given delay, replacing any previously
   * scheduled cancellation. An {@link Deadlines#INFINITE infinite} delay unschedules a pending
   * cancellation. Has no effect once cancellation has been requested.
   *
   * @param delay the delay before cancellation
   * @throws IllegalArgumentException if {@code delay} is negative and not infinite
   */
  public void cancelAfter(final Duration delay) {
    cancelAfter(Deadlines.toMillis(delay));
  }

  /**
   * Schedules a call to {@link #cancel()} after the given delay in milliseconds, replacing any
   * previously scheduled cancellation. A delay of {@link Deadlines#INFINITE_MILLIS} unschedules a
   * pending cancellation. Has no effect once cancellation has been requested.
   *
   * @param delayMillis the delay before cancellation in milliseconds
   * @throws IllegalArgumentException if {@code delayMillis} is less than -1
   */
  public void cancelAfter(final long delayMillis) {
    Deadlines.checkTimeout(delayMillis);
    if (this.canceled) {
      return;
    }
    if (delayMillis == 0) {
      cancel();
      return;
    }
    final Registration next = delayMillis == Deadlines.INFINITE_MILLIS
        ? Registration.NONE
        : Deadlines.schedule(this::cancel, delayMillis);
    this.timer.getAndSet(next).close();
    if (this.canceled) {
      // cancel() may have run between the check and the swap, leaving our timer installed
      this.timer.getAndSet(Registration.NONE).close();
    }
  }

  /**
   * The number of callbacks currently registered and not yet run or closed. Intended for
   * diagnostics; the value may be stale by the time it is returned.
   *
   * @return the count of live registrations
   */
  public int registrationCount() {
    return this.callbacks.size();
  }

  Registration register(final Runnable action) {
    if (this.canceled) {
      action.run();
      return Registration.NONE;
    }
    final Callback c = new Callback(action);
    this.callbacks.add(c);
    if (this.canceled && this.callbacks.remove(c)) {
      // cancel() had already passed its sweep when we were added
      action.run();
      return Registration.NONE;
    }
    return c;
  }

  private final class Callback implements Registration {
    private final Runnable action;

    Callback(final Runnable action) {
      this.action = action;
    }

    @Override
    public void close() {
      CancellationTokenSource.this.callbacks.remove(this);
    }
  }
}
