/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.asyncevents.pump;

import java.util.concurrent.CompletionStage;

/**
 * An action queued on an {@link AsyncDelegatePump}. Instances are created by the pump's
 * {@link AsyncDelegatePump#post(java.util.function.Supplier) post} and
 * {@link AsyncDelegatePump#send(java.util.function.Supplier) send} methods.
 */
public abstract class WorkUnit {

  WorkUnit() {}

  /**
   * Runs the action if it is still eligible to run.
   *
   * @return a stage which completes when the action has finished, or an already completed stage
   *         if the action was skipped
   */
  abstract CompletionStage<?> execute();
}
