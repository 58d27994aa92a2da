/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.pump;

import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

import com.ibm.asyncevents.util.StageSupport;

/**
 * A fire-and-forget unit: no deadline, no cancellation, and failures go to the pump's error
 * handler.
 */
final class PostedUnit extends WorkUnit {
  private final Supplier<? extends CompletionStage<?>> action;

  PostedUnit(final Supplier<? extends CompletionStage<?>> action) {
    this.action = action;
  }

  @Override
  CompletionStage<?> execute() {
    final CompletionStage<?> stage = this.action.get();
    return stage == null ? StageSupport.voidStage() : stage;
  }
}
