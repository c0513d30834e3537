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

import static com.twake.amqp.connector.impl.ExceptionUtils.convertConnectionFailure;
import static com.twake.amqp.connector.impl.ExceptionUtils.convertTopologyFailure;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.twake.amqp.connector.AmqpException;
import com.twake.amqp.connector.BrokerClient;
import com.twake.amqp.connector.ExchangeOptions;
import com.twake.amqp.connector.QueueOptions;
import com.twake.amqp.connector.metrics.MetricsCollector;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Opens the connection and the channel, declares the topology, and starts the consumer. */
class SessionEstablisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionEstablisher.class);

  private final String name;
  private final BrokerClient brokerClient;
  private final MetricsCollector metricsCollector;

  SessionEstablisher(String name, BrokerClient brokerClient, MetricsCollector metricsCollector) {
    this.name = name;
    this.brokerClient = brokerClient;
    this.metricsCollector = metricsCollector;
  }

  /**
   * Create a new session.
   *
   * <p>Resources opened before a failure are closed before the exception is thrown.
   *
   * @param configuration connector settings
   * @return the established session, the consumer is started
   */
  Session establish(ConnectorConfiguration configuration) {
    Utils.StopWatch stopWatch = new Utils.StopWatch();
    String target = UriUtils.mask(configuration.uri());
    LOGGER.debug("Connecting '{}' to {}...", this.name, target);
    Connection connection;
    try {
      connection = this.brokerClient.connect(configuration.uri(), this.name);
    } catch (IOException | TimeoutException | RuntimeException e) {
      throw convertConnectionFailure(e, "Error while connecting '%s' to %s", this.name, target);
    }
    if (connection == null) {
      throw new AmqpException.AmqpConnectionException(
          "Broker client returned no connection for " + target, null);
    }
    this.metricsCollector.openConnection();
    Session session = new Session(this.name, connection, this.metricsCollector);
    try {
      consume(session, configuration);
    } catch (AmqpException e) {
      LOGGER.debug("Session establishment of '{}' failed: {}", this.name, e.getMessage());
      session.release();
      throw e;
    }
    LOGGER.debug("Session of '{}' established in {}", this.name, stopWatch.stop());
    return session;
  }

  /**
   * Open a new channel on the connection of the session and start consuming again.
   *
   * <p>The connection is never re-opened. The new channel is closed if a step fails.
   *
   * @param session the session to update
   * @param configuration connector settings
   */
  void establishChannelOnly(Session session, ConnectorConfiguration configuration) {
    if (!session.connection().isOpen()) {
      throw new AmqpException.AmqpConnectionException(
          "Connection of '" + this.name + "' is closed, cannot recover channel", null);
    }
    LOGGER.debug("Recovering channel of '{}'...", this.name);
    consume(session, configuration);
    LOGGER.debug("Channel of '{}' recovered", this.name);
  }

  private void consume(Session session, ConnectorConfiguration configuration) {
    Channel channel;
    try {
      channel = session.connection().createChannel();
    } catch (IOException | RuntimeException e) {
      throw convertConnectionFailure(e, "Error while opening channel for '%s'", this.name);
    }
    if (channel == null) {
      throw new AmqpException.AmqpConnectionException(
          "No channel available on connection of '" + this.name + "'", null);
    }
    try {
      declare(channel, configuration);
      session.channel(channel);
      DeliveryAdapter adapter =
          new DeliveryAdapter(
              this.name, session, channel, configuration.handler(), this.metricsCollector);
      String consumerTag;
      try {
        consumerTag = channel.basicConsume(configuration.queue(), false, adapter, adapter);
      } catch (IOException | RuntimeException e) {
        throw convertTopologyFailure(
            e, "Error while consuming queue '%s'", configuration.queue());
      }
      session.consumerStarted(channel, consumerTag);
      LOGGER.debug(
          "Consumer {} of '{}' started on queue '{}'",
          consumerTag,
          this.name,
          configuration.queue());
    } catch (AmqpException e) {
      session.channelLost(channel);
      if (channel.isOpen()) {
        Utils.safeClose(this.name).accept("channel", channel::close);
      }
      throw e;
    }
  }

  private static void declare(Channel channel, ConnectorConfiguration configuration) {
    ExchangeOptions exchangeOptions = configuration.exchangeOptions();
    try {
      channel.exchangeDeclare(
          configuration.exchange(),
          BuiltinExchangeType.TOPIC.getType(),
          exchangeOptions.durable(),
          exchangeOptions.autoDelete(),
          exchangeOptions.internal(),
          exchangeOptions.arguments());
    } catch (IOException | RuntimeException e) {
      throw convertTopologyFailure(
          e, "Error while declaring exchange '%s'", configuration.exchange());
    }
    QueueOptions queueOptions = configuration.queueOptions();
    try {
      channel.queueDeclare(
          configuration.queue(),
          queueOptions.durable(),
          queueOptions.exclusive(),
          queueOptions.autoDelete(),
          queueOptions.arguments());
    } catch (IOException | RuntimeException e) {
      throw convertTopologyFailure(e, "Error while declaring queue '%s'", configuration.queue());
    }
    try {
      channel.queueBind(
          configuration.queue(), configuration.exchange(), configuration.routingKey());
    } catch (IOException | RuntimeException e) {
      throw convertTopologyFailure(
          e,
          "Error while binding queue '%s' to exchange '%s' with key '%s'",
          configuration.queue(),
          configuration.exchange(),
          configuration.routingKey());
    }
  }
}
