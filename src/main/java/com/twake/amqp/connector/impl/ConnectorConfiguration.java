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

import com.twake.amqp.connector.AmqpException;
import com.twake.amqp.connector.ConnectionConfig;
import com.twake.amqp.connector.Connector;
import com.twake.amqp.connector.ExchangeOptions;
import com.twake.amqp.connector.QueueOptions;
import com.twake.amqp.connector.ReconnectionPolicy;
import java.net.URI;

/**
 * Validated snapshot of the connector settings, taken at each {@link Connector#build()}.
 *
 * <p>Reconnection attempts use the snapshot of the build that started them, later calls to the
 * <code>with*</code> methods apply only to the next build.
 */
final class ConnectorConfiguration {

  static final String DEFAULT_ROUTING_KEY = "#";

  private final URI uri;
  private final String exchange;
  private final ExchangeOptions exchangeOptions;
  private final String queue;
  private final QueueOptions queueOptions;
  private final String routingKey;
  private final Connector.MessageHandler handler;
  private final ReconnectionPolicy reconnectionPolicy;

  private ConnectorConfiguration(Builder builder, URI uri) {
    this.uri = uri;
    this.exchange = builder.exchange;
    this.exchangeOptions =
        builder.exchangeOptions == null
            ? ExchangeOptions.defaultOptions()
            : builder.exchangeOptions;
    this.queue = builder.queue;
    this.queueOptions =
        builder.queueOptions == null ? QueueOptions.defaultOptions() : builder.queueOptions;
    this.routingKey =
        Utils.isBlank(builder.routingKey) ? DEFAULT_ROUTING_KEY : builder.routingKey;
    this.handler = builder.handler;
    this.reconnectionPolicy =
        builder.reconnectionPolicy == null
            ? ReconnectionPolicy.defaultPolicy()
            : builder.reconnectionPolicy;
  }

  static Builder builder() {
    return new Builder();
  }

  URI uri() {
    return this.uri;
  }

  String exchange() {
    return this.exchange;
  }

  ExchangeOptions exchangeOptions() {
    return this.exchangeOptions;
  }

  String queue() {
    return this.queue;
  }

  QueueOptions queueOptions() {
    return this.queueOptions;
  }

  String routingKey() {
    return this.routingKey;
  }

  Connector.MessageHandler handler() {
    return this.handler;
  }

  ReconnectionPolicy reconnectionPolicy() {
    return this.reconnectionPolicy;
  }

  @Override
  public String toString() {
    return "ConnectorConfiguration{"
        + "uri="
        + UriUtils.mask(uri)
        + ", exchange='"
        + exchange
        + '\''
        + ", queue='"
        + queue
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + '}';
  }

  /** Mutable settings of a connector, turned into a snapshot with {@link #build()}. */
  static final class Builder {

    private String uri;
    private ConnectionConfig connectionConfig;
    private String exchange;
    private ExchangeOptions exchangeOptions;
    private String queue;
    private QueueOptions queueOptions;
    private String routingKey;
    private Connector.MessageHandler handler;
    private ReconnectionPolicy reconnectionPolicy;

    private Builder() {}

    Builder uri(String uri) {
      this.uri = uri;
      this.connectionConfig = null;
      return this;
    }

    Builder connectionConfig(ConnectionConfig connectionConfig) {
      this.connectionConfig = connectionConfig;
      this.uri = null;
      return this;
    }

    Builder exchange(String exchange, ExchangeOptions options) {
      this.exchange = exchange;
      this.exchangeOptions = options;
      return this;
    }

    Builder queue(String queue, QueueOptions options, String routingKey) {
      this.queue = queue;
      this.queueOptions = options;
      this.routingKey = routingKey;
      return this;
    }

    Builder handler(Connector.MessageHandler handler) {
      this.handler = handler;
      return this;
    }

    Builder reconnectionPolicy(ReconnectionPolicy reconnectionPolicy) {
      this.reconnectionPolicy = reconnectionPolicy;
      return this;
    }

    /**
     * Validate the settings and create the snapshot.
     *
     * <p>Checks the exchange, the queue, the handler, and the broker URI, in this order.
     *
     * @return the snapshot
     * @throws AmqpException.AmqpConfigurationException if a setting is missing or invalid
     */
    ConnectorConfiguration build() {
      if (Utils.isBlank(this.exchange)) {
        throw new AmqpException.ExchangeNotSpecifiedException();
      }
      if (Utils.isBlank(this.queue)) {
        throw new AmqpException.QueueNotSpecifiedException();
      }
      if (this.handler == null) {
        throw new AmqpException.HandlerNotProvidedException();
      }
      URI target =
          this.connectionConfig == null
              ? UriUtils.toUri(this.uri)
              : UriUtils.toUri(this.connectionConfig);
      return new ConnectorConfiguration(this, target);
    }
  }
}
