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

import com.twake.amqp.connector.BrokerClient;
import com.twake.amqp.connector.Connector;
import com.twake.amqp.connector.metrics.MetricsCollector;
import com.twake.amqp.connector.metrics.NoOpMetricsCollector;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import javax.net.ssl.SSLContext;

/** Builder to create a {@link Connector} instance with non-default runtime settings. */
public class AmqpConnectorBuilder {

  private String name;
  private BrokerClient brokerClient;
  private SSLContext sslContext;
  private ScheduledExecutorService scheduledExecutorService;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private final List<Connector.StateListener> listeners = new ArrayList<>();

  public AmqpConnectorBuilder() {}

  /**
   * Name of the connector.
   *
   * <p>Used in log messages and as the client-provided name of the broker connections. A name is
   * generated by default.
   *
   * @param name connector name
   * @return this builder instance
   */
  public AmqpConnectorBuilder name(String name) {
    this.name = name;
    return this;
  }

  /**
   * Set the client to open broker connections.
   *
   * <p>The default is {@link ConnectionFactoryBrokerClient}.
   *
   * @param brokerClient the broker client
   * @return this builder instance
   */
  public AmqpConnectorBuilder brokerClient(BrokerClient brokerClient) {
    this.brokerClient = brokerClient;
    return this;
  }

  /**
   * Set the {@link SSLContext} of <code>amqps</code> connections.
   *
   * <p>The JVM default context is used if none is set. Ignored if a {@link
   * #brokerClient(BrokerClient)} is set.
   *
   * @param sslContext the TLS context
   * @return this builder instance
   */
  public AmqpConnectorBuilder sslContext(SSLContext sslContext) {
    this.sslContext = sslContext;
    return this;
  }

  /**
   * Set scheduled executor service used for internal tasks (reconnection, channel recovery).
   *
   * <p>The connector creates and owns a single-threaded scheduler by default. It is the
   * developer's responsibility to shut down a scheduler set with this method.
   *
   * @param scheduledExecutorService the scheduled executor service
   * @return this builder instance
   */
  public AmqpConnectorBuilder scheduledExecutorService(
      ScheduledExecutorService scheduledExecutorService) {
    this.scheduledExecutorService = scheduledExecutorService;
    return this;
  }

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector the metrics collector
   * @return this builder instance
   * @see com.twake.amqp.connector.metrics.MicrometerMetricsCollector
   */
  public AmqpConnectorBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector = metricsCollector;
    return this;
  }

  /**
   * Register listeners of state changes.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  public AmqpConnectorBuilder listeners(Connector.StateListener... listeners) {
    this.listeners.addAll(Arrays.asList(listeners));
    return this;
  }

  /**
   * Create the connector instance.
   *
   * <p>The connector is not connected, configure it and call {@link Connector#build()}.
   *
   * @return the connector
   */
  public Connector connector() {
    return new AmqpConnector(this);
  }

  String name() {
    return this.name;
  }

  BrokerClient brokerClient() {
    return this.brokerClient;
  }

  SSLContext sslContext() {
    return this.sslContext;
  }

  ScheduledExecutorService scheduledExecutorService() {
    return this.scheduledExecutorService;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  List<Connector.StateListener> listeners() {
    return this.listeners;
  }
}
