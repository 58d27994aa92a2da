/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.pump;

import java.util.Arrays;
import java.util.List;

/**
 * A {@link ContextPropagator} which carries the values of a fixed set of {@link ThreadLocal
 * ThreadLocals}. A value the poster never set is carried as whatever {@link ThreadLocal#get()}
 * reported at post time (usually {@code null}), so the callback never observes values left behind
 * on the processing thread by another poster.
 */
public final class ThreadLocalPropagator implements ContextPropagator {
  private final List<ThreadLocal<?>> locals;

  private ThreadLocalPropagator(final List<ThreadLocal<?>> locals) {
    this.locals = locals;
  }

  /**
   * @param locals the thread locals to carry from posters to callbacks
   * @return a propagator for {@code locals}
   * @throws NullPointerException if any of {@code locals} is null
   */
  public static ThreadLocalPropagator of(final ThreadLocal<?>... locals) {
    return new ThreadLocalPropagator(List.copyOf(Arrays.asList(locals)));
  }

  @Override
  public Snapshot capture() {
    final Object[] values = read();
    return () -> {
      final Object[] previous = read();
      write(values);
      return () -> write(previous);
    };
  }

  private Object[] read() {
    final Object[] values = new Object[this.locals.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = this.locals.get(i).get();
    }
    return values;
  }

  @SuppressWarnings("unchecked")
  private void write(final Object[] values) {
    for (int i = 0; i < values.length; i++) {
      final ThreadLocal<Object> local = (ThreadLocal<Object>) this.locals.get(i);
      if (values[i] == null) {
        local.remove();
      } else {
        local.set(values[i]);
      }
    }
  }
}
