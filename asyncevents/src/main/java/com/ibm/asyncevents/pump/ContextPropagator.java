/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.pump;

/**
 * Carries a poster's ambient context (for example thread-local values) to the callback which
 * processes that poster's message.
 *
 * <p>
 * A pump calls {@link #capture()} on the posting thread when a message is posted, keeps the
 * resulting {@link Snapshot} alongside the message, and {@link Snapshot#enter() enters} it on
 * whichever thread invokes the callback for that message, closing the returned {@link Scope} as
 * soon as the callback returns. Only the synchronous part of a callback observes the snapshot.
 *
 * @see ThreadLocalPropagator
 */
@FunctionalInterface
public interface ContextPropagator {

  /**
   * @return the ambient context of the calling thread
   */
  Snapshot capture();

  /**
   * @return a propagator which carries nothing
   */
  static ContextPropagator none() {
    return () -> Snapshot.EMPTY;
  }

  /**
   * A captured context.
   */
  @FunctionalInterface
  interface Snapshot {
    /**
     * A snapshot which changes nothing when entered.
     */
    Snapshot EMPTY = () -> Scope.NOOP;

    /**
     * Installs this context on the calling thread.
     *
     * @return a scope which restores the calling thread's previous context when closed
     */
    Scope enter();
  }

  /**
   * The extent during which a {@link Snapshot} is installed.
   */
  @FunctionalInterface
  interface Scope extends AutoCloseable {
    Scope NOOP = () -> {
    };

    @Override
    void close();
  }
}
