/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Provides asynchronous analogues of manual-reset and auto-reset events. These primitives use
 * {@link java.util.concurrent.CompletionStage} to coordinate instead of blocking.
 */
package com.ibm.asyncevents.events;
