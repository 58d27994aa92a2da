/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.events;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ibm.asyncevents.util.CancellationToken;
import com.ibm.asyncevents.util.Deadlines;
import com.ibm.asyncevents.util.StageSupport;

/**
 * An {@link AsyncEvent} where each {@link #set()} releases exactly one waiter. Waiters are released
 * strictly in the order they started waiting. If nobody is waiting, a single set is remembered and
 * consumed by the next wait; further sets while the event is already signaled have no effect.
 *
 * <p>
 * A waiter whose wait times out or is canceled keeps its place in the queue. When a set eventually
 * reaches that place, the release is passed on by a fresh {@link #set()}, so the signal reaches
 * the next waiter (or is remembered) rather than being lost. The passed-on release joins the back
 * of the signaling order, not the front.
 */
public class AsyncAutoResetEvent implements AsyncEvent {
  private static final Logger LOG = LoggerFactory.getLogger(AsyncAutoResetEvent.class);

  /*
   * signaled and waiters are guarded by the waiters monitor, and are mutually exclusive encodings
   * of pending releases: signaled implies waiters is empty, and a non-empty queue implies not
   * signaled. Waiters are completed outside of the monitor.
   */
  private final ArrayDeque<CompletableFuture<Boolean>> waiters = new ArrayDeque<>();
  private boolean signaled;

  private final Executor backgroundExecutor;

  /**
   * Creates an event which is not signaled.
   */
  public AsyncAutoResetEvent() {
    this(ForkJoinPool.commonPool());
  }

  /**
   * Creates an event which is not signaled.
   *
   * @param backgroundExecutor the executor which completes a released waiter when the event is set
   *        with {@code runInline == false}
   */
  public AsyncAutoResetEvent(final Executor backgroundExecutor) {
    this.backgroundExecutor = Objects.requireNonNull(backgroundExecutor);
  }

  @Override
  public CompletionStage<Boolean> waitAsync(final long timeoutMillis,
      final CancellationToken token) {
    Deadlines.checkTimeout(timeoutMillis);
    token.throwIfCancellationRequested();

    final CompletableFuture<Boolean> waiter;
    synchronized (this.waiters) {
      if (this.signaled) {
        this.signaled = false;
        return StageSupport.trueStage();
      }
      if (timeoutMillis == 0) {
        return StageSupport.falseStage();
      }
      waiter = new CompletableFuture<>();
      this.waiters.add(waiter);
    }

    if (timeoutMillis == Deadlines.INFINITE_MILLIS && !token.canBeCanceled()) {
      return waiter;
    }

    final CompletionStage<Boolean> result = Deadlines.race(waiter, timeoutMillis, token);
    result.whenComplete((acquired, ex) -> {
      if (ex != null || !acquired) {
        // still queued, so whatever release reaches it belongs to someone else
        waiter.thenRun(this::forwardRelease);
      }
    });
    return result;
  }

  /**
   * {@inheritDoc}
   *
   * <p>
   * The waiter to release (or the remembered signal) is chosen before this method returns in
   * either mode; with {@code runInline == false} only the completion of that waiter is deferred to
   * the background executor.
   */
  @Override
  public void set(final boolean runInline) {
    final CompletableFuture<Boolean> toRelease;
    synchronized (this.waiters) {
      toRelease = this.waiters.poll();
      if (toRelease == null) {
        this.signaled = true;
        return;
      }
    }
    if (runInline) {
      release(toRelease);
    } else {
      this.backgroundExecutor.execute(() -> release(toRelease));
    }
  }

  private void release(final CompletableFuture<Boolean> waiter) {
    if (!waiter.complete(true)) {
      // the handle was completed by its holder, it cannot take the signal
      set(true);
    }
  }

  private void forwardRelease() {
    LOG.trace("forwarding release of an abandoned waiter");
    set(true);
  }

  /**
   * The number of waiters currently queued, including abandoned waiters that timed out or were
   * canceled but have not yet been reached by a {@link #set()}. Intended for diagnostics.
   *
   * @return the number of queued waiters
   */
  public int waiterCount() {
    synchronized (this.waiters) {
      return this.waiters.size();
    }
  }

  @Override
  public String toString() {
    synchronized (this.waiters) {
      return "AsyncAutoResetEvent [signaled=" + this.signaled
          + ", waiters=" + this.waiters.size() + "]";
    }
  }
}
