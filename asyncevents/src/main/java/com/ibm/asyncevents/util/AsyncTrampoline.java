/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Static methods for asynchronous looping procedures without blowing the stack.
 *
 * <p>
 * A message pump drains its queue by repeatedly producing a stage for the head message and
 * continuing once that stage completes. Written recursively,
 *
 * <pre>
 * {@code
 * CompletionStage<Void> drain() {
 *   return processHead().thenCompose(more -> more ? drain() : StageSupport.voidStage());
 * }
 * }
 * </pre>
 *
 * a long run of messages whose callbacks complete synchronously would nest one stack frame group
 * per message and eventually overflow. The loop here unrolls such synchronous completions: if the
 * next iteration becomes ready on the same thread while a previous iteration is still on its
 * stack, it is handed back to that earlier frame and run in a plain {@code while} loop instead.
 */
public final class AsyncTrampoline {

  private AsyncTrampoline() {}

  private static final class Loop extends CompletableFuture<Void> {
    private final Supplier<? extends CompletionStage<Boolean>> body;

    private Loop(final Supplier<? extends CompletionStage<Boolean>> body) {
      this.body = body;
      unroll(null, null);
    }

    private void unroll(final Thread previousThread, final PassBack previousPassBack) {
      final Thread currentThread = Thread.currentThread();

      // track termination in case body queues its stage and currentThread later completes it,
      // leading to sequential runs from the same thread but different stacks
      if (currentThread.equals(previousThread) && previousPassBack.isRunning) {
        previousPassBack.ready = true;
        return;
      }

      final PassBack currentPassBack = new PassBack();
      do {
        try {
          this.body.get().whenComplete((proceed, ex) -> {
            if (ex != null) {
              completeExceptionally(ex);
            } else if (proceed == null || !proceed) {
              complete(null);
            } else {
              unroll(currentThread, currentPassBack);
            }
          });
        } catch (final Throwable e) {
          completeExceptionally(e);
          return;
        }
      } while (currentPassBack.poll());
      currentPassBack.isRunning = false;
    }

    private static final class PassBack {
      boolean isRunning = true;
      boolean ready = false;

      boolean poll() {
        final boolean r = this.ready;
        this.ready = false;
        return r;
      }
    }
  }

  /**
   * Repeatedly use the function {@code body} to produce a {@link CompletionStage} of a boolean,
   * stopping when then boolean is {@code false}. The asynchronous equivalent of {@code
   * while(body.get());}. Generally, the function must perform some side effect for this method to
   * be useful. If {@code body} throws or produces an exceptional {@link CompletionStage}, an
   * exceptional stage will be returned.
   *
   * <p>
   * The first iteration runs on the calling thread; later iterations run on whichever thread
   * completes the previous iteration's stage.
   *
   * @param body a {@link Supplier} of a {@link CompletionStage} that indicates whether iteration
   *        should continue
   * @return a {@link CompletionStage} that is complete when a stage produced by {@code body} has
   *         returned {@code false}, or with an exception if one was thrown
   */
  public static CompletionStage<Void> asyncWhile(
      final Supplier<? extends CompletionStage<Boolean>> body) {
    return new Loop(body);
  }
}
