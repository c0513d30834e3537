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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declaration options of the queue.
 *
 * <p>The queue is durable by default.
 *
 * @see Connector#withQueue(String, QueueOptions)
 */
public final class QueueOptions {

  static final String DEAD_LETTER_EXCHANGE_ARGUMENT = "x-dead-letter-exchange";
  static final String DEAD_LETTER_ROUTING_KEY_ARGUMENT = "x-dead-letter-routing-key";

  private static final QueueOptions DEFAULT = builder().build();

  private final boolean durable;
  private final boolean exclusive;
  private final boolean autoDelete;
  private final Map<String, Object> arguments;

  private QueueOptions(Builder builder) {
    this.durable = builder.durable;
    this.exclusive = builder.exclusive;
    this.autoDelete = builder.autoDelete;
    this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
  }

  public static QueueOptions defaultOptions() {
    return DEFAULT;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean durable() {
    return this.durable;
  }

  public boolean exclusive() {
    return this.exclusive;
  }

  public boolean autoDelete() {
    return this.autoDelete;
  }

  /**
   * Queue arguments, including the dead-letter settings.
   *
   * @return the queue arguments
   */
  public Map<String, Object> arguments() {
    return this.arguments;
  }

  @Override
  public String toString() {
    return "QueueOptions{"
        + "durable="
        + durable
        + ", exclusive="
        + exclusive
        + ", autoDelete="
        + autoDelete
        + ", arguments="
        + arguments
        + '}';
  }

  /** Builder for {@link QueueOptions}. */
  public static final class Builder {

    private boolean durable = true;
    private boolean exclusive = false;
    private boolean autoDelete = false;
    private final Map<String, Object> arguments = new LinkedHashMap<>();

    private Builder() {}

    public Builder durable(boolean durable) {
      this.durable = durable;
      return this;
    }

    public Builder exclusive(boolean exclusive) {
      this.exclusive = exclusive;
      return this;
    }

    public Builder autoDelete(boolean autoDelete) {
      this.autoDelete = autoDelete;
      return this;
    }

    /**
     * Exchange rejected messages are re-published to.
     *
     * <p>Without a dead-letter exchange, messages rejected by the connector are dropped by the
     * broker.
     *
     * @param exchange dead-letter exchange
     * @return this builder
     */
    public Builder deadLetterExchange(String exchange) {
      return this.argument(DEAD_LETTER_EXCHANGE_ARGUMENT, exchange);
    }

    /**
     * Routing key to use when dead-lettering messages.
     *
     * @param routingKey dead-letter routing key
     * @return this builder
     */
    public Builder deadLetterRoutingKey(String routingKey) {
      return this.argument(DEAD_LETTER_ROUTING_KEY_ARGUMENT, routingKey);
    }

    public Builder argument(String key, Object value) {
      if (value == null) {
        this.arguments.remove(key);
      } else {
        this.arguments.put(key, value);
      }
      return this;
    }

    public QueueOptions build() {
      return new QueueOptions(this);
    }
  }
}
