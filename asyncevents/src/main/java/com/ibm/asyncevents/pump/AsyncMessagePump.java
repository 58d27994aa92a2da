/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.pump;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ibm.asyncevents.util.AsyncTrampoline;
import com.ibm.asyncevents.util.StageSupport;

/**
 * An asynchronous message pump: messages may be posted from any number of threads and are passed
 * to a single callback one at a time, in the order they were posted.
 *
 * <p>
 * The callback may be asynchronous. The next message is not passed to the callback until the
 * stage returned for the previous message has completed, so the callback never runs concurrently
 * with itself. Because the first message of a burst is processed on the posting thread, a
 * synchronous callback runs before {@link #post(Object) post} returns when the pump is idle;
 * long-running synchronous callbacks should hand their work to an executor instead.
 *
 * <p>
 * A failure of the callback, or of a {@link #post(CompletionStage) posted stage}, is passed to
 * {@link #handleError(Throwable)} and then suppressed: the pump always continues with the next
 * message.
 *
 * <pre>
 * {@code
 * AsyncMessagePump<Event> pump = new AsyncMessagePump<>(event -> store.append(event));
 * // from any thread
 * pump.post(event);
 * // at shutdown
 * pump.drainAsync().toCompletableFuture().join();
 * }
 * </pre>
 *
 * @param <T> the type of the messages
 */
public class AsyncMessagePump<T> {
  private static final Logger LOG = LoggerFactory.getLogger(AsyncMessagePump.class);

  /*
   * The queue holds every message not yet fully processed; its head is the message in flight and
   * is only removed once its callback has completed. Consequently the poster that makes the queue
   * non-empty is the only one that starts the processing loop, and the loop stops exactly when its
   * removal empties the queue. The drain future is created lazily by drainAsync while the queue is
   * non-empty and completed (outside of the monitor) when the loop stops.
   */
  private final ArrayDeque<Entry<T>> queue = new ArrayDeque<>();
  private CompletableFuture<Void> drain;

  private final Function<? super T, ? extends CompletionStage<?>> callback;
  private final ContextPropagator propagator;
  private volatile boolean suppressContextFlow;

  /**
   * Creates a pump with the given asynchronous callback. A callback returning {@code null} is
   * treated as having completed synchronously.
   *
   * @param callback processes each message, returning a stage which completes when processing is
   *        finished
   */
  public AsyncMessagePump(final Function<? super T, ? extends CompletionStage<?>> callback) {
    this(callback, ContextPropagator.none());
  }

  /**
   * Creates a pump with the given asynchronous callback, carrying each poster's context to the
   * callback invocation for that poster's message.
   *
   * @param callback processes each message, returning a stage which completes when processing is
   *        finished
   * @param propagator captures context at post time and installs it around the callback
   */
  public AsyncMessagePump(final Function<? super T, ? extends CompletionStage<?>> callback,
      final ContextPropagator propagator) {
    this.callback = Objects.requireNonNull(callback);
    this.propagator = Objects.requireNonNull(propagator);
  }

  /**
   * Adapts a synchronous callback for use as a pump callback.
   *
   * <pre>
   * {@code
   * new AsyncMessagePump<String>(AsyncMessagePump.synchronously(System.out::println));
   * }
   * </pre>
   *
   * @param callback processes each message before returning
   * @return a callback whose stage is complete when {@code callback} returns
   */
  public static <T> Function<T, CompletionStage<Void>> synchronously(
      final Consumer<? super T> callback) {
    Objects.requireNonNull(callback);
    return message -> {
      callback.accept(message);
      return StageSupport.voidStage();
    };
  }

  /**
   * Posts a message to the queue.
   *
   * @param message the message to pass to the callback
   */
  public void post(final T message) {
    enqueue(new Entry<>(message, null, capture()));
  }

  /**
   * Posts the eventual result of an asynchronous operation to the queue. The message keeps the
   * position of this call in the posting order regardless of when {@code message} completes; the
   * pump waits for it when it reaches the head of the queue. If {@code message} completes
   * exceptionally the failure is passed to {@link #handleError(Throwable)}.
   *
   * @param message a stage which completes with the message to pass to the callback
   */
  public void post(final CompletionStage<? extends T> message) {
    enqueue(new Entry<>(null, Objects.requireNonNull(message), capture()));
  }

  /**
   * Returns the number of messages waiting in the queue, including the message currently being
   * processed, if any.
   *
   * @return the number of messages not yet fully processed
   */
  public int count() {
    synchronized (this.queue) {
      return this.queue.size();
    }
  }

  /**
   * Returns a stage which completes when the queue next becomes empty. If the queue is already
   * empty the returned stage is already complete. Calls made while the queue stays non-empty
   * return the same stage.
   *
   * @return a {@link CompletionStage} that completes when all messages posted so far, and any
   *         posted before the queue empties, have been processed
   */
  public CompletionStage<Void> drainAsync() {
    synchronized (this.queue) {
      if (this.queue.isEmpty()) {
        return StageSupport.voidStage();
      }
      if (this.drain == null) {
        this.drain = new CompletableFuture<>();
      }
      return this.drain;
    }
  }

  /**
   * Stops (or resumes) capturing the posting thread's context for messages posted afterwards.
   * Messages posted while suppressed are processed in whatever context the processing thread has.
   *
   * @param suppress {@code true} to stop carrying context to the callback
   */
  public void setSuppressContextFlow(final boolean suppress) {
    this.suppressContextFlow = suppress;
  }

  /**
   * @return whether context capture is currently suppressed
   */
  public boolean isSuppressContextFlow() {
    return this.suppressContextFlow;
  }

  /**
   * Handles a failure of the callback, or of a posted stage. The pump waits for the returned stage
   * before processing the next message. Failures of this method, thrown or through the returned
   * stage, are suppressed.
   *
   * <p>
   * The default implementation logs the failure.
   *
   * @param exception the failure, with {@link java.util.concurrent.CompletionException} wrappers
   *        removed
   * @return a stage which completes when the failure has been handled
   */
  protected CompletionStage<Void> handleError(final Throwable exception) {
    LOG.warn("message pump callback failed", exception);
    return StageSupport.voidStage();
  }

  private ContextPropagator.Snapshot capture() {
    return this.suppressContextFlow ? ContextPropagator.Snapshot.EMPTY : this.propagator.capture();
  }

  private void enqueue(final Entry<T> entry) {
    final boolean start;
    synchronized (this.queue) {
      this.queue.add(entry);
      start = this.queue.size() == 1;
      if (start) {
        this.drain = null;
      }
    }
    if (start) {
      AsyncTrampoline.asyncWhile(this::processHead);
    }
  }

  /**
   * Processes the head of the queue, and removes it once processing has finished.
   *
   * @return a stage of whether more messages remain
   */
  private CompletionStage<Boolean> processHead() {
    final Entry<T> head;
    synchronized (this.queue) {
      head = this.queue.peek();
    }

    CompletionStage<?> processing;
    try {
      processing = head.process(this.callback);
    } catch (final Throwable e) {
      processing = StageSupport.exceptionalStage(e);
    }

    final CompletableFuture<Boolean> next = new CompletableFuture<>();
    processing.whenComplete((ig, ex) -> {
      if (ex == null) {
        next.complete(remove(head));
      } else {
        reportError(StageSupport.unwrap(ex))
            .whenComplete((ig2, ex2) -> next.complete(remove(head)));
      }
    });
    return next;
  }

  private CompletionStage<Void> reportError(final Throwable exception) {
    final CompletionStage<Void> handled;
    try {
      handled = handleError(exception);
    } catch (final Throwable e) {
      LOG.debug("message pump error handler failed", e);
      return StageSupport.voidStage();
    }
    if (handled == null) {
      return StageSupport.voidStage();
    }
    return handled.handle((ig, e) -> {
      if (e != null) {
        LOG.debug("message pump error handler failed", StageSupport.unwrap(e));
      }
      return null;
    });
  }

  private boolean remove(final Entry<T> head) {
    final CompletableFuture<Void> completedDrain;
    synchronized (this.queue) {
      final Entry<T> removed = this.queue.remove();
      assert removed == head : "processed message was not at the head of the queue";
      if (!this.queue.isEmpty()) {
        return true;
      }
      completedDrain = this.drain;
      this.drain = null;
    }
    if (completedDrain != null) {
      completedDrain.complete(null);
    }
    return false;
  }

  private static final class Entry<T> {
    private final T value;
    private final CompletionStage<? extends T> pending;
    private final ContextPropagator.Snapshot context;

    Entry(final T value, final CompletionStage<? extends T> pending,
        final ContextPropagator.Snapshot context) {
      this.value = value;
      this.pending = pending;
      this.context = context;
    }

    CompletionStage<?> process(final Function<? super T, ? extends CompletionStage<?>> callback) {
      if (this.pending == null) {
        return invoke(callback, this.value);
      }
      return this.pending.thenCompose(v -> StageSupport.voided(invoke(callback, v)));
    }

    private CompletionStage<?> invoke(
        final Function<? super T, ? extends CompletionStage<?>> callback, final T message) {
      try (ContextPropagator.Scope scope = this.context.enter()) {
        final CompletionStage<?> result = callback.apply(message);
        return result == null ? StageSupport.voidStage() : result;
      }
    }
  }
}
