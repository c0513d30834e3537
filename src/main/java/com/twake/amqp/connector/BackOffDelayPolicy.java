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
package com.twake.amqp.connector;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Contract to determine a delay between attempts of some task.
 *
 * <p>The task is typically the re-creation of a broker connection.
 */
public interface BackOffDelayPolicy {

  Duration TIMEOUT = Duration.ofMillis(Long.MAX_VALUE);

  /**
   * Returns the delay to use for a given attempt.
   *
   * <p>The policy can return the TIMEOUT constant to indicate that the task should stop being
   * retried.
   *
   * @param attempt number of the attempt, starting at 0
   * @return the delay, TIMEOUT if the task should stop being retried
   */
  Duration delay(int attempt);

  /**
   * Policy with a fixed delay.
   *
   * @param delay the fixed delay
   * @return fixed-delay policy
   */
  static BackOffDelayPolicy fixed(Duration delay) {
    return attempt -> delay;
  }

  /**
   * Policy with an exponential delay: <code>min(maxDelay, initialDelay * multiplier^attempt)
   * </code>.
   *
   * @param initialDelay delay for the first attempt
   * @param maxDelay upper bound of the delay
   * @param multiplier growth factor between two attempts, must be greater than or equal to 1
   * @return exponential policy
   */
  static BackOffDelayPolicy exponential(
      Duration initialDelay, Duration maxDelay, double multiplier) {
    return new ExponentialBackOffDelayPolicy(initialDelay, maxDelay, multiplier);
  }

  /**
   * Randomly increase the delays of this policy by up to <code>jitter</code> (relative).
   *
   * <p>A jitter of 0.1 returns delays in <code>[delay, delay * 1.1]</code>.
   *
   * @param jitter maximum relative increase, between 0 and 1
   * @return policy with jitter
   */
  default BackOffDelayPolicy withJitter(double jitter) {
    return withJitter(jitter, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Same as {@link #withJitter(double)} with a custom random source.
   *
   * @param jitter maximum relative increase, between 0 and 1
   * @param random source of random values in <code>[0, 1)</code>
   * @return policy with jitter
   */
  default BackOffDelayPolicy withJitter(double jitter, DoubleSupplier random) {
    if (jitter < 0 || jitter > 1) {
      throw new IllegalArgumentException("Jitter must be between 0 and 1: " + jitter);
    }
    if (jitter == 0) {
      return this;
    }
    return new JitterBackOffDelayPolicy(this, jitter, random);
  }

  /**
   * Stop retrying once <code>maxAttempts</code> attempts failed.
   *
   * @param maxAttempts maximum number of attempts, 0 means no limit
   * @return bounded policy
   */
  default BackOffDelayPolicy withMaxAttempts(int maxAttempts) {
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("Max attempts cannot be negative: " + maxAttempts);
    }
    if (maxAttempts == 0) {
      return this;
    }
    BackOffDelayPolicy delegate = this;
    return attempt -> attempt >= maxAttempts ? TIMEOUT : delegate.delay(attempt);
  }

  final class ExponentialBackOffDelayPolicy implements BackOffDelayPolicy {

    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double multiplier;

    private ExponentialBackOffDelayPolicy(
        Duration initialDelay, Duration maxDelay, double multiplier) {
      if (initialDelay.isNegative()) {
        throw new IllegalArgumentException("Initial delay cannot be negative");
      }
      if (maxDelay.compareTo(initialDelay) < 0) {
        throw new IllegalArgumentException("Max delay must be greater than initial delay");
      }
      if (multiplier < 1) {
        throw new IllegalArgumentException("Multiplier must be greater than or equal to 1");
      }
      this.initialDelayMs = initialDelay.toMillis();
      this.maxDelayMs = maxDelay.toMillis();
      this.multiplier = multiplier;
    }

    @Override
    public Duration delay(int attempt) {
      double delay = this.initialDelayMs * Math.pow(this.multiplier, Math.max(attempt, 0));
      return Duration.ofMillis((long) Math.min(this.maxDelayMs, delay));
    }

    @Override
    public String toString() {
      return "ExponentialBackOffDelayPolicy{"
          + "initialDelay="
          + initialDelayMs
          + " ms, maxDelay="
          + maxDelayMs
          + " ms, multiplier="
          + multiplier
          + '}';
    }
  }

  final class JitterBackOffDelayPolicy implements BackOffDelayPolicy {

    private final BackOffDelayPolicy delegate;
    private final double jitter;
    private final DoubleSupplier random;

    private JitterBackOffDelayPolicy(
        BackOffDelayPolicy delegate, double jitter, DoubleSupplier random) {
      this.delegate = delegate;
      this.jitter = jitter;
      this.random = random;
    }

    @Override
    public Duration delay(int attempt) {
      Duration delay = this.delegate.delay(attempt);
      if (TIMEOUT.equals(delay)) {
        return delay;
      }
      double factor = 1 + this.random.getAsDouble() * this.jitter;
      return Duration.ofMillis((long) (delay.toMillis() * factor));
    }

    @Override
    public String toString() {
      return "JitterBackOffDelayPolicy{" + "jitter=" + jitter + ", delegate=" + delegate + '}';
    }
  }
}
