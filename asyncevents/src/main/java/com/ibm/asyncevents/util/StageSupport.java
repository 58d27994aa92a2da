/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Utility methods for creating and composing {@link CompletionStage CompletionStages}
 */
public class StageSupport {
  private StageSupport() {}

  private static final CompletionStage<Void> VOID = CompletableFuture.completedStage(null);
  private static final CompletionStage<Boolean> TRUE = CompletableFuture.completedStage(true);
  private static final CompletionStage<Boolean> FALSE = CompletableFuture.completedStage(false);

  /**
   * Gets an already completed {@link CompletionStage} of Void. This common static instance can be
   * used as an alternative to {@code StageSupport.<Void>completedStage(null)}
   *
   * <p>
   * Immediately completed null stages are very common. Since they are final and static, we can
   * just reuse a single object and save allocations. The returned stage cannot be completed or
   * obtruded by its observers.
   *
   * @return An immediately completed {@link CompletionStage} of {@code Void}
   */
  public static CompletionStage<Void> voidStage() {
    return VOID;
  }

  /**
   * Gets the shared, already completed stage holding {@code true}.
   *
   * @return an immediately completed {@link CompletionStage} of {@code true}
   */
  public static CompletionStage<Boolean> trueStage() {
    return TRUE;
  }

  /**
   * Gets the shared, already completed stage holding {@code false}.
   *
   * @return an immediately completed {@link CompletionStage} of {@code false}
   */
  public static CompletionStage<Boolean> falseStage() {
    return FALSE;
  }

  /**
   * Creates a {@link CompletionStage} that is already completed with the given value.
   * <p>
   * Non-Async methods on the returned stage will run their dependent actions immediately on the
   * calling thread.
   *
   * @param t the value to be held by the returned stage
   * @return a {@link CompletionStage} that has already been completed with {@code t}
   * @see #exceptionalStage(Throwable)
   */
  public static <T> CompletionStage<T> completedStage(final T t) {
    return CompletableFuture.completedStage(t);
  }

  /**
   * Creates a {@link CompletionStage} that is already completed exceptionally. This is the
   * exceptional analog of {@link #completedStage(Object)}.
   *
   * @param ex the exception that completes the returned stage
   * @return a {@link CompletionStage} that has already been completed exceptionally with {@code ex}
   * @see #completedStage(Object)
   */
  public static <T> CompletionStage<T> exceptionalStage(final Throwable ex) {
    return CompletableFuture.failedStage(ex);
  }

  /**
   * Creates a {@link CompletionStage} that completes when {@code stage} completes but ignores the
   * result.
   *
   * @param stage a non-void {@link CompletionStage}
   * @return a {@link CompletionStage} of type Void which completes when {@code stage} completes
   */
  public static <T> CompletionStage<Void> voided(final CompletionStage<T> stage) {
    return stage.thenApply(ig -> null);
  }

  /**
   * Strips the {@link CompletionException} and {@link ExecutionException} wrappers that dependent
   * stages add around the failure that actually occurred.
   *
   * @param ex an exception observed in a {@link CompletionStage#whenComplete} or
   *        {@link CompletionStage#handle} callback
   * @return the innermost wrapped cause, or {@code ex} itself if it is not a wrapper
   */
  public static Throwable unwrap(final Throwable ex) {
    Throwable t = ex;
    while ((t instanceof CompletionException || t instanceof ExecutionException)
        && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }
}
