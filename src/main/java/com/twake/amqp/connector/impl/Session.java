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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.twake.amqp.connector.metrics.MetricsCollector;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection, channel, and consumer tag of an established connector.
 *
 * <p>The connection is fixed for the lifetime of the session, the channel and the consumer tag
 * change when the channel is recovered. A released session never gets a channel again.
 *
 * <p>Messages are handed to the application only once the connector has activated the session.
 */
final class Session {

  private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);

  private final String owner;
  private final Connection connection;
  private final MetricsCollector metricsCollector;
  private final AtomicBoolean released = new AtomicBoolean(false);
  private volatile boolean active = false;
  private volatile Channel channel;
  private volatile String consumerTag;

  Session(String owner, Connection connection, MetricsCollector metricsCollector) {
    this.owner = owner;
    this.connection = connection;
    this.metricsCollector = metricsCollector;
  }

  Connection connection() {
    return this.connection;
  }

  Channel channel() {
    return this.channel;
  }

  String consumerTag() {
    return this.consumerTag;
  }

  boolean isReleased() {
    return this.released.get();
  }

  boolean isActive() {
    return this.active && !isReleased();
  }

  /** Called by the connector, under its lock, once the session is installed. */
  void activate() {
    if (!isReleased()) {
      this.active = true;
    }
  }

  /**
   * Make the channel the current one.
   *
   * <p>Must be called before the consumer is registered, so that deliveries on the new channel are
   * not dropped.
   */
  void channel(Channel channel) {
    if (!isReleased()) {
      this.channel = channel;
      this.consumerTag = null;
    }
  }

  void consumerStarted(Channel channel, String consumerTag) {
    if (!isReleased() && this.channel == channel) {
      this.consumerTag = consumerTag;
      this.metricsCollector.openConsumer();
    }
  }

  /**
   * Forget the channel if it is still the current one.
   *
   * @return true if the channel was the current one
   */
  boolean channelLost(Channel channel) {
    if (this.channel == channel && channel != null) {
      this.channel = null;
      if (this.consumerTag != null) {
        this.consumerTag = null;
        this.metricsCollector.closeConsumer();
      }
      return true;
    } else {
      return false;
    }
  }

  /**
   * Cancel the consumer, close the channel and the connection.
   *
   * <p>Failures are logged and ignored. Only the first call has an effect.
   */
  void release() {
    if (this.released.compareAndSet(false, true)) {
      this.active = false;
      Channel ch = this.channel;
      String tag = this.consumerTag;
      this.channel = null;
      this.consumerTag = null;
      BiConsumer<String, Utils.RunnableWithException> closing = Utils.safeClose(this.owner);
      if (ch != null) {
        if (tag != null) {
          this.metricsCollector.closeConsumer();
          if (ch.isOpen()) {
            closing.accept("consumer", () -> ch.basicCancel(tag));
          }
        }
        if (ch.isOpen()) {
          closing.accept("channel", ch::close);
        }
      }
      if (this.connection.isOpen()) {
        closing.accept("connection", this.connection::close);
      }
      this.metricsCollector.closeConnection();
      LOGGER.debug("Session of '{}' released", this.owner);
    }
  }

  @Override
  public String toString() {
    return "Session{"
        + "owner='"
        + owner
        + '\''
        + ", consumerTag='"
        + consumerTag
        + '\''
        + ", active="
        + active
        + ", released="
        + released
        + '}';
  }
}
