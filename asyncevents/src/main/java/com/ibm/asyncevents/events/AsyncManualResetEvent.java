/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.events;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import com.ibm.asyncevents.util.CancellationToken;
import com.ibm.asyncevents.util.Deadlines;
import com.ibm.asyncevents.util.StageSupport;

/**
 * An {@link AsyncEvent} which, once {@link #set() set}, releases every current and future waiter
 * until it is explicitly {@link #reset() reset}.
 *
 * <pre>
 * {@code
 * AsyncManualResetEvent ready = new AsyncManualResetEvent();
 * ready.waitAsync().thenRun(() -> serve());
 * ...
 * ready.set(); // every waiter runs, and later waits complete immediately
 * }
 * </pre>
 *
 * <p>
 * Every wait gets its own stage. Completing or canceling that stage affects only its holder: the
 * event and the other waiters are unaffected, and the abandoned wait is dropped from the event.
 */
public class AsyncManualResetEvent implements AsyncEvent {
  /*
   * The event state is one Generation per set/reset cycle. A generation holds the pending waiters
   * of that cycle; set() marks it signaled and completes every waiter it removes from the set.
   * A waiter is removed exactly once, either by set() (which completes it) or by the wait itself
   * when it resolves any other way, so abandoned waits are never retained. reset() replaces a
   * signaled generation with a new one by CAS, so concurrent resets install at most one new
   * generation, and a reset racing with set() either precedes it (and the new generation is
   * set) or follows it (and the waiters of the old generation are still released).
   */

  private static final AtomicReferenceFieldUpdater<AsyncManualResetEvent, Generation> UPDATER =
      AtomicReferenceFieldUpdater.newUpdater(
          AsyncManualResetEvent.class, Generation.class, "generation");

  private final Executor backgroundExecutor;
  private volatile Generation generation = new Generation();

  /**
   * Creates an event which is not set.
   */
  public AsyncManualResetEvent() {
    this(false);
  }

  /**
   * Creates an event with the given initial state.
   *
   * @param signaled whether the event is initially set
   */
  public AsyncManualResetEvent(final boolean signaled) {
    this(signaled, ForkJoinPool.commonPool());
  }

  /**
   * Creates an event with the given initial state.
   *
   * @param signaled whether the event is initially set
   * @param backgroundExecutor the executor which completes waiters when the event is set with
   *        {@code runInline == false}
   */
  public AsyncManualResetEvent(final boolean signaled, final Executor backgroundExecutor) {
    this.backgroundExecutor = Objects.requireNonNull(backgroundExecutor);
    if (signaled) {
      this.generation.release();
    }
  }

  @Override
  public CompletionStage<Boolean> waitAsync(final long timeoutMillis,
      final CancellationToken token) {
    Deadlines.checkTimeout(timeoutMillis);
    token.throwIfCancellationRequested();

    final Generation current = this.generation;
    if (current.signaled) {
      return StageSupport.trueStage();
    }
    if (timeoutMillis == 0) {
      return StageSupport.falseStage();
    }

    final CompletableFuture<Boolean> waiter = current.enqueue();
    // whatever resolves the wait, the waiter leaves the generation
    waiter.whenComplete((acquired, ex) -> current.waiters.remove(waiter));
    if (timeoutMillis == Deadlines.INFINITE_MILLIS && !token.canBeCanceled()) {
      return waiter;
    }
    final CompletionStage<Boolean> result = Deadlines.race(waiter, timeoutMillis, token);
    result.whenComplete((acquired, ex) -> current.waiters.remove(waiter));
    return result;
  }

  /**
   * {@inheritDoc}
   *
   * <p>
   * Setting an event which is already set has no effect. With {@code runInline == false} the
   * generation current at the time of the call is released on the background executor, so
   * {@link #isSet()} may briefly report {@code false} after this method returns.
   */
  @Override
  public void set(final boolean runInline) {
    final Generation current = this.generation;
    if (current.signaled) {
      return;
    }
    if (runInline) {
      current.release();
    } else {
      this.backgroundExecutor.execute(current::release);
    }
  }

  /**
   * Returns the event to the unset state, so that subsequent waits block until the next
   * {@link #set()}. Has no effect if the event is not set.
   */
  public void reset() {
    while (true) {
      final Generation current = this.generation;
      if (!current.signaled || UPDATER.compareAndSet(this, current, new Generation())) {
        return;
      }
    }
  }

  /**
   * @return whether the event is currently set
   */
  public boolean isSet() {
    return this.generation.signaled;
  }

  /**
   * The number of waits currently pending on the event. Waits that timed out, were canceled or
   * were completed by their holder are not counted. Intended for diagnostics.
   *
   * @return the number of pending waiters
   */
  public int waiterCount() {
    return this.generation.waiters.size();
  }

  @Override
  public String toString() {
    return "AsyncManualResetEvent [set=" + isSet() + ", waiters=" + waiterCount() + "]";
  }

  private static final class Generation {
    private final Set<CompletableFuture<Boolean>> waiters = ConcurrentHashMap.newKeySet();
    private volatile boolean signaled;

    CompletableFuture<Boolean> enqueue() {
      final CompletableFuture<Boolean> waiter = new CompletableFuture<>();
      this.waiters.add(waiter);
      if (this.signaled && this.waiters.remove(waiter)) {
        // release() had already passed its sweep when we were added
        waiter.complete(true);
      }
      return waiter;
    }

    void release() {
      this.signaled = true;
      for (final CompletableFuture<Boolean> waiter : this.waiters) {
        if (this.waiters.remove(waiter)) {
          waiter.complete(true);
        }
      }
    }
  }
}
