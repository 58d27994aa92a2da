/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.pump;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Test;

import com.ibm.asyncevents.util.CancellationToken;
import com.ibm.asyncevents.util.CancellationTokenSource;
import com.ibm.asyncevents.util.Deadlines;
import com.ibm.asyncevents.util.StageSupport;
import com.ibm.asyncevents.util.TestUtil;

public class AsyncDelegatePumpTest {

  @Test
  public void testPostRunsInOrder() throws Exception {
    final StringBuffer sb = new StringBuffer();
    final AsyncDelegatePump pump = new AsyncDelegatePump();
    pump.post(() -> TestUtil.delayed("100", 100).thenAccept(s -> sb.append(s).append(' ')));
    pump.post(() -> {
      sb.append("1 ");
      return StageSupport.voidStage();
    });
    TestUtil.join(pump.drainAsync(), 5, TimeUnit.SECONDS);
    Assert.assertEquals("100 1 ", sb.toString());
  }

  @Test
  public void testSendRunsInOrder() throws Exception {
    final StringBuffer sb = new StringBuffer();
    final AsyncDelegatePump pump = new AsyncDelegatePump();
    final CompletionStage<Void> first =
        pump.send(() -> TestUtil.delayed("100", 100).thenAccept(s -> sb.append(s).append(' ')));
    final CompletionStage<Void> second = pump.send(() -> {
      // the first action's effects are visible before the second starts
      Assert.assertEquals("100 ", sb.toString());
      return TestUtil.delayed("50", 50).thenAccept(s -> sb.append(s).append(' '));
    });
    Assert.assertFalse(TestUtil.isDone(first));
    Assert.assertFalse(TestUtil.isDone(second));

    TestUtil.join(second, 5, TimeUnit.SECONDS);
    Assert.assertTrue(TestUtil.isDone(first));
    Assert.assertEquals("100 50 ", sb.toString());
  }

  @Test
  public void testSendValues() throws Exception {
    final AsyncDelegatePump pump = new AsyncDelegatePump();
    final CompletionStage<Integer> first = pump.send(() -> TestUtil.delayed(100, 100));
    final CompletionStage<String> second = pump.send(() -> TestUtil.delayed("fifty", 50));
    Assert.assertEquals("fifty", TestUtil.join(second, 5, TimeUnit.SECONDS));
    Assert.assertEquals(Integer.valueOf(100), TestUtil.join(first));
  }

  @Test
  public void testSendForwardsCancellation() {
    final AsyncDelegatePump pump = new AsyncDelegatePump();
    final CompletableFuture<Integer> canceled = new CompletableFuture<>();
    canceled.cancel(false);
    TestUtil.joinFailure(pump.send(() -> canceled), CancellationException.class);
    Assert.assertEquals(0, pump.count());
  }

  @Test
  public void testSendForwardsFailureOnlyToSender() {
    final AtomicInteger handled = new AtomicInteger();
    final AsyncDelegatePump pump = new AsyncDelegatePump() {
      @Override
      protected CompletionStage<Void> handleError(final Throwable exception) {
        handled.incrementAndGet();
        return StageSupport.voidStage();
      }
    };
    final CompletionStage<Integer> failed =
        pump.send(() -> StageSupport.exceptionalStage(new IllegalStateException("async")));
    final CompletionStage<Integer> thrown = pump.send(() -> {
      throw new IllegalArgumentException("sync");
    });
    final CompletionStage<Integer> after = pump.send(() -> StageSupport.completedStage(7));

    TestUtil.joinFailure(failed, IllegalStateException.class);
    TestUtil.joinFailure(thrown, IllegalArgumentException.class);
    Assert.assertEquals(Integer.valueOf(7), TestUtil.join(after));
    Assert.assertEquals(0, handled.get());
  }

  @Test
  public void testPostFailureReachesHandler() {
    final List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
    final AsyncDelegatePump pump = new AsyncDelegatePump() {
      @Override
      protected CompletionStage<Void> handleError(final Throwable exception) {
        errors.add(exception);
        return StageSupport.voidStage();
      }
    };
    final AtomicBoolean ranAfter = new AtomicBoolean();
    pump.post(() -> {
      throw new IllegalStateException();
    });
    pump.post(() -> StageSupport.exceptionalStage(new IllegalArgumentException()));
    pump.post(() -> {
      ranAfter.set(true);
      return null;
    });
    Assert.assertTrue(ranAfter.get());
    Assert.assertEquals(2, errors.size());
    Assert.assertTrue(errors.get(0) instanceof IllegalStateException);
    Assert.assertTrue(errors.get(1) instanceof IllegalArgumentException);
  }

  @Test
  public void testNullStageCompletesSend() {
    final AsyncDelegatePump pump = new AsyncDelegatePump();
    final CompletionStage<String> result = pump.send(() -> null);
    Assert.assertNull(TestUtil.join(result));
  }

  @Test
  public void testExpiredBeforeStartNeverRuns() throws Exception {
    final AsyncDelegatePump pump = new AsyncDelegatePump();
    final CompletableFuture<Void> blocker = new CompletableFuture<>();
    pump.post(() -> blocker);

    final AtomicBoolean ran = new AtomicBoolean();
    final CompletionStage<Void> expired = pump.send(() -> {
      ran.set(true);
      return StageSupport.voidStage();
    }, Duration.ofMillis(50));
    TestUtil.joinFailure(expired, TimeoutException.class);

    blocker.complete(null);
    TestUtil.join(pump.drainAsync(), 5, TimeUnit.SECONDS);
    Assert.assertFalse(ran.get());
    Assert.assertEquals(0, pump.count());
  }

  @Test
  public void testCanceledBeforeStartNeverRuns() throws Exception {
    final AsyncDelegatePump pump = new AsyncDelegatePump();
    final CompletableFuture<Void> blocker = new CompletableFuture<>();
    pump.post(() -> blocker);

    final CancellationTokenSource source = new CancellationTokenSource();
    final AtomicBoolean ran = new AtomicBoolean();
    final CompletionStage<Void> canceled = pump.send(() -> {
      ran.set(true);
      return StageSupport.voidStage();
    }, source.token());
    final CompletionStage<String> survivor = pump.send(() -> StageSupport.completedStage("ok"));
    Assert.assertEquals(1, source.registrationCount());

    source.cancel();
    TestUtil.joinFailure(canceled, CancellationException.class);
    Assert.assertEquals(0, source.registrationCount());

    blocker.complete(null);
    Assert.assertEquals("ok", TestUtil.join(survivor, 5, TimeUnit.SECONDS));
    Assert.assertFalse(ran.get());
  }

  @Test
  public void testStartedActionIgnoresCancellation() throws Exception {
    final AsyncDelegatePump pump = new AsyncDelegatePump();
    final CancellationTokenSource source = new CancellationTokenSource();
    final CompletableFuture<Integer> inFlight = new CompletableFuture<>();
    final CompletionStage<Integer> result = pump.send(() -> inFlight, 60000, source.token());
    // the pump was idle, so the action has already started
    Assert.assertEquals(0, source.registrationCount());

    source.cancel();
    Assert.assertFalse(TestUtil.isDone(result));
    inFlight.complete(7);
    Assert.assertEquals(Integer.valueOf(7), TestUtil.join(result, 5, TimeUnit.SECONDS));
  }

  @Test
  public void testStartedActionIgnoresTimeout() throws Exception {
    final AsyncDelegatePump pump = new AsyncDelegatePump();
    final CompletionStage<String> result =
        pump.send(() -> TestUtil.delayed("late", 200), Duration.ofMillis(20));
    Assert.assertEquals("late", TestUtil.join(result, 5, TimeUnit.SECONDS));
  }

  @Test
  public void testStartDisposesTimer() {
    final AsyncDelegatePump pump = new AsyncDelegatePump();
    final int timersBefore = Deadlines.pendingTimers();
    for (int i = 0; i < 1000; i++) {
      TestUtil.join(pump.send(() -> StageSupport.voidStage(), 60000));
    }
    Assert.assertTrue(Deadlines.pendingTimers() <= timersBefore);
  }

  @Test
  public void testZeroTimeoutRejected() {
    final AsyncDelegatePump pump = new AsyncDelegatePump();
    try {
      pump.send(() -> StageSupport.voidStage(), 0);
      Assert.fail("expected IllegalArgumentException");
    } catch (final IllegalArgumentException expected) {
    }
    try {
      pump.send(() -> StageSupport.voidStage(), Duration.ZERO);
      Assert.fail("expected IllegalArgumentException");
    } catch (final IllegalArgumentException expected) {
    }
    try {
      pump.send(() -> StageSupport.voidStage(), -2, CancellationToken.none());
      Assert.fail("expected IllegalArgumentException");
    } catch (final IllegalArgumentException expected) {
    }
    Assert.assertEquals(0, pump.count());
  }

  @Test
  public void testAlreadyCanceledThrows() {
    final AsyncDelegatePump pump = new AsyncDelegatePump();
    final CancellationTokenSource source = new CancellationTokenSource();
    source.cancel();
    final AtomicBoolean ran = new AtomicBoolean();
    try {
      pump.send(() -> {
        ran.set(true);
        return StageSupport.voidStage();
      }, Deadlines.INFINITE, source.token());
      Assert.fail("expected CancellationException");
    } catch (final CancellationException expected) {
    }
    Assert.assertFalse(ran.get());
    Assert.assertEquals(0, pump.count());
  }

  @Test
  public void testContextFlowsToActions() throws Exception {
    final ThreadLocal<String> local = new ThreadLocal<>();
    final AsyncDelegatePump pump = new AsyncDelegatePump(ThreadLocalPropagator.of(local));
    final CompletableFuture<Void> blocker = new CompletableFuture<>();
    pump.post(() -> blocker.thenRunAsync(() -> {}));

    // suppression has no effect on this pump
    pump.setSuppressContextFlow(true);
    Assert.assertFalse(pump.isSuppressContextFlow());

    local.set("sender");
    final CompletionStage<String> seen;
    try {
      seen = pump.send(() -> StageSupport.completedStage(local.get()));
    } finally {
      local.remove();
    }
    blocker.complete(null);
    Assert.assertEquals("sender", TestUtil.join(seen, 5, TimeUnit.SECONDS));
  }
}
