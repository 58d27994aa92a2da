/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Support classes shared by the events and pumps: pre-completed stages, a stack-safe
 * asynchronous loop, cooperative cancellation tokens, and deadline races.
 */
package com.ibm.asyncevents.util;
