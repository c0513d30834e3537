// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.twake.amqp.connector.impl;

import com.twake.amqp.connector.BackOffDelayPolicy;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Arms reconnection attempts according to a {@link BackOffDelayPolicy}.
 *
 * <p>Not thread-safe, callers use the lock of the connector.
 */
class ReconnectionScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectionScheduler.class);

  private final String name;
  private final ScheduledExecutorService scheduledExecutorService;
  private final BackOffDelayPolicy delayPolicy;
  private int attempt = 0;
  private ScheduledFuture<?> task;

  ReconnectionScheduler(
      String name,
      ScheduledExecutorService scheduledExecutorService,
      BackOffDelayPolicy delayPolicy) {
    this.name = name;
    this.scheduledExecutorService = scheduledExecutorService;
    this.delayPolicy = delayPolicy;
  }

  /**
   * Schedule the next attempt.
   *
   * @param attemptTask the attempt to run
   * @return false if the policy gave up, nothing is scheduled then
   * @throws java.util.concurrent.RejectedExecutionException if the scheduler is shut down
   */
  boolean scheduleNext(Runnable attemptTask) {
    Duration delay = this.delayPolicy.delay(this.attempt);
    if (BackOffDelayPolicy.TIMEOUT.equals(delay)) {
      LOGGER.debug("No more reconnection attempts for '{}' after {}", this.name, this.attempt);
      this.task = null;
      return false;
    }
    LOGGER.debug(
        "Scheduling reconnection attempt #{} of '{}' in {} ms",
        this.attempt + 1,
        this.name,
        delay.toMillis());
    this.task =
        this.scheduledExecutorService.schedule(
            Utils.namedRunnable(attemptTask, "reconnection-%s-%d", this.name, this.attempt + 1),
            delay.toMillis(),
            TimeUnit.MILLISECONDS);
    return true;
  }

  void attemptStarted() {
    this.task = null;
  }

  void attemptFailed() {
    this.attempt++;
  }

  void reset() {
    this.attempt = 0;
    this.task = null;
  }

  void cancel() {
    ScheduledFuture<?> pending = this.task;
    this.task = null;
    if (pending != null) {
      LOGGER.debug("Cancelling pending reconnection of '{}'", this.name);
      pending.cancel(false);
    }
  }

  boolean hasPendingTask() {
    return this.task != null;
  }

  int attempt() {
    return this.attempt;
  }
}
