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

/**
 * Settings of the automatic reconnection of a {@link Connector}.
 *
 * <p>The delay before the reconnection attempt <code>n</code> (starting at 0) is <code>
 * min(maxDelay, initialDelay * backOffMultiplier^n)</code>, increased randomly by up to <code>
 * jitter</code> (relative).
 *
 * <p>Instances are immutable, use {@link #builder()} to create them. Settings that are not set
 * keep their default value.
 *
 * @see Connector#withReconnection(ReconnectionPolicy)
 */
public final class ReconnectionPolicy {

  static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(1000);
  static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(30_000);
  static final double DEFAULT_BACK_OFF_MULTIPLIER = 2.0;
  static final double DEFAULT_JITTER = 0.1;

  private static final ReconnectionPolicy DEFAULT = builder().build();

  private final boolean enabled;
  private final Duration initialDelay;
  private final Duration maxDelay;
  private final int maxRetries;
  private final double backOffMultiplier;
  private final double jitter;

  private ReconnectionPolicy(Builder builder) {
    this.enabled = builder.enabled;
    this.initialDelay = builder.initialDelay;
    this.maxDelay = builder.maxDelay;
    this.maxRetries = builder.maxRetries;
    this.backOffMultiplier = builder.backOffMultiplier;
    this.jitter = builder.jitter;
  }

  /**
   * Policy with the default settings: enabled, 1 second initial delay, 30 seconds max delay,
   * unlimited retries, multiplier of 2, 10% jitter.
   *
   * @return default policy
   */
  public static ReconnectionPolicy defaultPolicy() {
    return DEFAULT;
  }

  /**
   * Policy that deactivates automatic reconnection.
   *
   * @return deactivated policy
   */
  public static ReconnectionPolicy disabled() {
    return builder().enabled(false).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean enabled() {
    return this.enabled;
  }

  public Duration initialDelay() {
    return this.initialDelay;
  }

  public Duration maxDelay() {
    return this.maxDelay;
  }

  /**
   * Maximum number of reconnection attempts, 0 means no limit.
   *
   * @return max number of attempts
   */
  public int maxRetries() {
    return this.maxRetries;
  }

  public double backOffMultiplier() {
    return this.backOffMultiplier;
  }

  public double jitter() {
    return this.jitter;
  }

  /**
   * The delay policy of this reconnection policy.
   *
   * <p>The returned policy returns {@link BackOffDelayPolicy#TIMEOUT} once {@link #maxRetries()}
   * attempts failed.
   *
   * @return the corresponding delay policy
   */
  public BackOffDelayPolicy backOffDelayPolicy() {
    return BackOffDelayPolicy.exponential(this.initialDelay, this.maxDelay, this.backOffMultiplier)
        .withJitter(this.jitter)
        .withMaxAttempts(this.maxRetries);
  }

  /**
   * Create a builder initialized with the settings of this policy.
   *
   * @return builder
   */
  public Builder toBuilder() {
    return new Builder()
        .enabled(this.enabled)
        .initialDelay(this.initialDelay)
        .maxDelay(this.maxDelay)
        .maxRetries(this.maxRetries)
        .backOffMultiplier(this.backOffMultiplier)
        .jitter(this.jitter);
  }

  @Override
  public String toString() {
    return "ReconnectionPolicy{"
        + "enabled="
        + enabled
        + ", initialDelay="
        + initialDelay
        + ", maxDelay="
        + maxDelay
        + ", maxRetries="
        + maxRetries
        + ", backOffMultiplier="
        + backOffMultiplier
        + ", jitter="
        + jitter
        + '}';
  }

  /** Builder for {@link ReconnectionPolicy}. */
  public static final class Builder {

    private boolean enabled = true;
    private Duration initialDelay = DEFAULT_INITIAL_DELAY;
    private Duration maxDelay = DEFAULT_MAX_DELAY;
    private int maxRetries = 0;
    private double backOffMultiplier = DEFAULT_BACK_OFF_MULTIPLIER;
    private double jitter = DEFAULT_JITTER;

    private Builder() {}

    /**
     * Whether to reconnect automatically after a connection failure.
     *
     * <p>Default is true.
     *
     * @param enabled activation flag
     * @return this builder
     */
    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Delay before the first reconnection attempt.
     *
     * <p>Default is 1 second.
     *
     * @param initialDelay initial delay
     * @return this builder
     */
    public Builder initialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
      return this;
    }

    /**
     * Upper bound of the delay between attempts.
     *
     * <p>Default is 30 seconds.
     *
     * @param maxDelay max delay
     * @return this builder
     */
    public Builder maxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
      return this;
    }

    /**
     * Number of reconnection attempts before giving up, 0 for no limit.
     *
     * <p>Default is 0.
     *
     * @param maxRetries max number of attempts
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Growth factor of the delay between two attempts.
     *
     * <p>Default is 2.
     *
     * @param backOffMultiplier multiplier, greater than or equal to 1
     * @return this builder
     */
    public Builder backOffMultiplier(double backOffMultiplier) {
      this.backOffMultiplier = backOffMultiplier;
      return this;
    }

    /**
     * Maximum random relative increase of each delay, 0 to deactivate.
     *
     * <p>Default is 0.1 (up to +10%).
     *
     * @param jitter jitter, between 0 and 1
     * @return this builder
     */
    public Builder jitter(double jitter) {
      this.jitter = jitter;
      return this;
    }

    public ReconnectionPolicy build() {
      if (this.initialDelay == null || this.initialDelay.isNegative()) {
        throw new IllegalArgumentException("Initial delay must be positive");
      }
      if (this.maxDelay == null || this.maxDelay.compareTo(this.initialDelay) < 0) {
        throw new IllegalArgumentException("Max delay must be greater than initial delay");
      }
      if (this.maxRetries < 0) {
        throw new IllegalArgumentException("Max retries cannot be negative");
      }
      if (this.backOffMultiplier < 1) {
        throw new IllegalArgumentException(
            "Back-off multiplier must be greater than or equal to 1");
      }
      if (this.jitter < 0 || this.jitter > 1) {
        throw new IllegalArgumentException("Jitter must be between 0 and 1");
      }
      return new ReconnectionPolicy(this);
    }
  }
}
