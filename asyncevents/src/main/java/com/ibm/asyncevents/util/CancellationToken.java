/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.util;

import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * A cooperative cancellation signal observed by waits and sends.
 *
 * <p>
 * A token is obtained from a {@link CancellationTokenSource}; only the source can request
 * cancellation. Operations that accept a token either check it before doing any work (failing
 * fast with a {@link CancellationException}) or {@link #register(Runnable) register} a callback to
 * abandon the work if cancellation is requested while it is still pending. Cancellation is never
 * preemptive: work that has already started is unaffected.
 *
 * <p>
 * {@link #none()} is a token which can never be canceled. Operations given such a token skip all
 * cancellation bookkeeping.
 *
 * @see CancellationTokenSource
 */
public final class CancellationToken {

  private static final CancellationToken NONE = new CancellationToken(null);

  private final CancellationTokenSource source;

  CancellationToken(final CancellationTokenSource source) {
    this.source = source;
  }

  /**
   * @return a token which is never canceled
   */
  public static CancellationToken none() {
    return NONE;
  }

  /**
   * @return {@code true} if this token may ever be canceled, {@code false} for {@link #none()}
   */
  public boolean canBeCanceled() {
    return this.source != null;
  }

  /**
   * @return {@code true} if cancellation has been requested on the source of this token
   */
  public boolean isCancellationRequested() {
    return this.source != null && this.source.isCancellationRequested();
  }

  /**
   * Throws a {@link CancellationException} if cancellation has been requested.
   *
   * @throws CancellationException if cancellation has been requested
   */
  public void throwIfCancellationRequested() {
    if (isCancellationRequested()) {
      throw new CancellationException("operation canceled");
    }
  }

  /**
   * Registers a callback to run once when cancellation is requested. If cancellation has already
   * been requested, the callback runs immediately on the calling thread before this method
   * returns.
   *
   * <p>
   * The returned registration must be {@link Registration#close() closed} once the callback is no
   * longer relevant, otherwise a long-lived token retains it.
   *
   * @param callback the action to run on cancellation
   * @return a registration which unregisters the callback when closed
   */
  public Registration register(final Runnable callback) {
    Objects.requireNonNull(callback);
    if (this.source == null) {
      return Registration.NONE;
    }
    return this.source.register(callback);
  }

  @Override
  public String toString() {
    if (this.source == null) {
      return "CancellationToken[none]";
    }
    return "CancellationToken[canceled=" + isCancellationRequested() + "]";
  }

  /**
   * A handle to a registered callback or timer which releases it when closed. Closing is
   * idempotent and has no effect once the callback has run.
   */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    /**
     * A registration which holds nothing.
     */
    Registration NONE = () -> {
    };

    @Override
    void close();
  }
}
