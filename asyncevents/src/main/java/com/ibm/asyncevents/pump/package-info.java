/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: async-events
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Ordered, single-consumer pumps. Messages and actions may be posted concurrently from any number
 * of threads; they are processed one at a time, strictly in the order they were posted.
 */
package com.ibm.asyncevents.pump;
