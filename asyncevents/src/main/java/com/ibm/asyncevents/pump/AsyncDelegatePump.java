/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.pump;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import com.ibm.asyncevents.util.CancellationToken;
import com.ibm.asyncevents.util.Deadlines;

/**
 * An {@link AsyncMessagePump} whose messages are asynchronous actions. Actions run one at a time,
 * each starting only once the stage returned by the previous action has completed, strictly in
 * the order they were posted or sent.
 *
 * <p>
 * {@link #post(Supplier) post} queues an action without tracking it. {@link #send(Supplier) send}
 * queues an action and returns its eventual result; a sent action may carry a timeout and a
 * {@link CancellationToken} which are only observed <i>before</i> the action starts. An action
 * whose deadline elapses, or whose token is canceled, while it waits for its turn is never run:
 * its result fails with a {@link TimeoutException} or {@link CancellationException} and the pump
 * skips it when its turn comes. Once an action has started, its timeout and token no longer
 * have any effect.
 *
 * <pre>
 * {@code
 * AsyncDelegatePump pump = new AsyncDelegatePump();
 * CompletionStage<Integer> first = pump.send(() -> connection.read());
 * CompletionStage<Void> second =
 *     pump.send(() -> connection.write(request), Duration.ofSeconds(1));
 * // second never starts before first completes
 * }
 * </pre>
 *
 * <p>
 * The poster's context is always carried to the action; {@link #setSuppressContextFlow(boolean)}
 * has no effect on this pump.
 */
public class AsyncDelegatePump extends AsyncMessagePump<WorkUnit> {

  /**
   * Creates a pump which carries no context to its actions.
   */
  public AsyncDelegatePump() {
    this(ContextPropagator.none());
  }

  /**
   * Creates a pump which runs each action within the context captured when it was posted.
   *
   * @param propagator captures context at post time and installs it around the action
   */
  public AsyncDelegatePump(final ContextPropagator propagator) {
    super(WorkUnit::execute, propagator);
  }

  /**
   * Has no effect: context always flows from the poster to its action.
   */
  @Override
  public void setSuppressContextFlow(final boolean suppress) {}

  /**
   * Queues an action for execution. A failure of the action, thrown or through its stage, is
   * passed to {@link #handleError(Throwable)}.
   *
   * @param action produces a stage which completes when the action is finished
   */
  public void post(final Supplier<? extends CompletionStage<?>> action) {
    post(new PostedUnit(Objects.requireNonNull(action)));
  }

  /**
   * Queues an action for execution and returns its result.
   *
   * @param action produces a stage which completes with the action's result
   * @return a stage which completes with the outcome of the action's stage
   */
  public <R> CompletionStage<R> send(final Supplier<? extends CompletionStage<R>> action) {
    return send(action, Deadlines.INFINITE_MILLIS, CancellationToken.none());
  }

  /**
   * Queues an action for execution and returns its result. If {@code token} is canceled before the
   * action starts, the action is never run and the result fails with a
   * {@link CancellationException}.
   *
   * @param action produces a stage which completes with the action's result
   * @param token a cancellation signal observed until the action starts
   * @return a stage which completes with the outcome of the action's stage
   * @throws CancellationException if {@code token} is already canceled
   */
  public <R> CompletionStage<R> send(final Supplier<? extends CompletionStage<R>> action,
      final CancellationToken token) {
    return send(action, Deadlines.INFINITE_MILLIS, token);
  }

  /**
   * Queues an action for execution and returns its result. If the action has not started before
   * {@code timeout} elapses, it is never run and the result fails with a {@link TimeoutException}.
   *
   * @param action produces a stage which completes with the action's result
   * @param timeout a positive time to wait for the action to start, or {@link Deadlines#INFINITE}
   * @return a stage which completes with the outcome of the action's stage
   * @throws IllegalArgumentException if {@code timeout} is zero, or negative and not infinite
   */
  public <R> CompletionStage<R> send(final Supplier<? extends CompletionStage<R>> action,
      final Duration timeout) {
    return send(action, Deadlines.toMillis(timeout), CancellationToken.none());
  }

  /**
   * Queues an action for execution and returns its result, observing both a start deadline and a
   * cancellation token until the action starts.
   *
   * @param action produces a stage which completes with the action's result
   * @param timeout a positive time to wait for the action to start, or {@link Deadlines#INFINITE}
   * @param token a cancellation signal observed until the action starts
   * @return a stage which completes with the outcome of the action's stage
   * @throws IllegalArgumentException if {@code timeout} is zero, or negative and not infinite
   * @throws CancellationException if {@code token} is already canceled
   */
  public <R> CompletionStage<R> send(final Supplier<? extends CompletionStage<R>> action,
      final Duration timeout, final CancellationToken token) {
    return send(action, Deadlines.toMillis(timeout), token);
  }

  /**
   * Queues an action for execution and returns its result. If the action has not started before
   * {@code timeoutMillis} elapses, it is never run and the result fails with a
   * {@link TimeoutException}.
   *
   * @param action produces a stage which completes with the action's result
   * @param timeoutMillis a positive time in milliseconds to wait for the action to start, or
   *        {@link Deadlines#INFINITE_MILLIS}
   * @return a stage which completes with the outcome of the action's stage
   * @throws IllegalArgumentException if {@code timeoutMillis} is zero or less than -1
   */
  public <R> CompletionStage<R> send(final Supplier<? extends CompletionStage<R>> action,
      final long timeoutMillis) {
    return send(action, timeoutMillis, CancellationToken.none());
  }

  /**
   * Queues an action for execution and returns its result, observing both a start deadline and a
   * cancellation token until the action starts.
   *
   * <p>
   * The result completes with the outcome of the stage produced by {@code action}: its value, its
   * failure, or its cancellation. A failure of a sent action is delivered only to the returned
   * stage; it is not passed to {@link #handleError(Throwable)}.
   *
   * @param action produces a stage which completes with the action's result
   * @param timeoutMillis a positive time in milliseconds to wait for the action to start, or
   *        {@link Deadlines#INFINITE_MILLIS}
   * @param token a cancellation signal observed until the action starts
   * @return a stage which completes with the outcome of the action's stage
   * @throws IllegalArgumentException if {@code timeoutMillis} is zero or less than -1
   * @throws CancellationException if {@code token} is already canceled
   */
  public <R> CompletionStage<R> send(final Supplier<? extends CompletionStage<R>> action,
      final long timeoutMillis, final CancellationToken token) {
    Objects.requireNonNull(action);
    Objects.requireNonNull(token);
    if (timeoutMillis == 0) {
      throw new IllegalArgumentException("timeout must be greater than zero");
    }
    Deadlines.checkTimeout(timeoutMillis);
    token.throwIfCancellationRequested();

    final SentUnit<R> unit = new SentUnit<>(action, timeoutMillis, token);
    post(unit);
    return unit.result();
  }
}
