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

import static com.twake.amqp.connector.metrics.MetricsCollector.ConsumeDisposition.ACCEPTED;
import static com.twake.amqp.connector.metrics.MetricsCollector.ConsumeDisposition.DISCARDED;

import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;
import com.twake.amqp.connector.Connector;
import com.twake.amqp.connector.metrics.MetricsCollector;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridge between the broker client consumer callbacks of one channel and the application handler.
 *
 * <p>A message is acknowledged when the handler returns normally and rejected without requeuing
 * when it throws. Messages that arrive on a channel that is no longer the session channel are
 * left alone: the broker redelivers them once the channel is gone. Messages that arrive before the
 * connector activated the session are requeued.
 */
final class DeliveryAdapter implements DeliverCallback, CancelCallback {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeliveryAdapter.class);

  private final String owner;
  private final Session session;
  private final Channel channel;
  private final Connector.MessageHandler handler;
  private final MetricsCollector metricsCollector;

  DeliveryAdapter(
      String owner,
      Session session,
      Channel channel,
      Connector.MessageHandler handler,
      MetricsCollector metricsCollector) {
    this.owner = owner;
    this.session = session;
    this.channel = channel;
    this.handler = handler;
    this.metricsCollector = metricsCollector;
  }

  @Override
  public void handle(String consumerTag, Delivery message) {
    if (message == null) {
      LOGGER.debug("Null delivery on consumer {} of '{}', ignoring it", consumerTag, this.owner);
      return;
    }
    long deliveryTag = message.getEnvelope().getDeliveryTag();
    if (this.session.isReleased() || this.session.channel() != this.channel) {
      LOGGER.debug(
          "Dropping delivery {} of '{}', its channel is no longer active",
          deliveryTag,
          this.owner);
      return;
    }
    if (!this.session.isActive()) {
      LOGGER.debug(
          "Requeuing delivery {} of '{}', the session is not active yet", deliveryTag, this.owner);
      settle("requeue", deliveryTag, () -> this.channel.basicNack(deliveryTag, false, true));
      return;
    }
    this.metricsCollector.consume();
    Exception handlerException = null;
    try {
      this.handler.handle(message, this.channel);
    } catch (Exception e) {
      handlerException = e;
    }
    if (handlerException == null) {
      if (settle("ack", deliveryTag, () -> this.channel.basicAck(deliveryTag, false))) {
        this.metricsCollector.consumeDisposition(ACCEPTED);
      }
    } else {
      LOGGER.warn(
          "Message handler of '{}' failed on delivery {}, rejecting message",
          this.owner,
          deliveryTag,
          handlerException);
      if (settle("nack", deliveryTag, () -> this.channel.basicNack(deliveryTag, false, false))) {
        this.metricsCollector.consumeDisposition(DISCARDED);
      }
    }
  }

  @Override
  public void handle(String consumerTag) {
    LOGGER.info(
        "Consumer {} of '{}' has been cancelled by the broker, ignoring", consumerTag, this.owner);
  }

  private boolean settle(String operation, long deliveryTag, Settlement settlement) {
    try {
      settlement.settle();
      return true;
    } catch (IOException | ShutdownSignalException e) {
      LOGGER.warn(
          "Could not {} delivery {} of '{}': {}",
          operation,
          deliveryTag,
          this.owner,
          e.getMessage());
      return false;
    }
  }

  @FunctionalInterface
  private interface Settlement {

    void settle() throws IOException;
  }
}
