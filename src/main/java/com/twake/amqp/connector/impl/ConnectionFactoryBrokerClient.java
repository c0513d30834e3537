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

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.twake.amqp.connector.AmqpException;
import com.twake.amqp.connector.BrokerClient;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLContext;

/**
 * {@link BrokerClient} based on the RabbitMQ Java client {@link ConnectionFactory}.
 *
 * <p>The automatic recovery of the client library is disabled, the connector handles recovery
 * itself.
 *
 * <p>An <code>amqps</code> URI uses the provided {@link SSLContext}, or the JVM default one, with
 * hostname verification. The broker certificate is always verified.
 */
public class ConnectionFactoryBrokerClient implements BrokerClient {

  private static final String TLS_SCHEME = "amqps";

  private final SSLContext sslContext;

  /** Client using the JVM default {@link SSLContext} for TLS connections. */
  public ConnectionFactoryBrokerClient() {
    this(null);
  }

  /**
   * Client using the given {@link SSLContext} for TLS connections.
   *
   * @param sslContext the context, <code>null</code> for the JVM default one
   */
  public ConnectionFactoryBrokerClient(SSLContext sslContext) {
    this.sslContext = sslContext;
  }

  @Override
  public Connection connect(URI uri, String connectionName) throws IOException, TimeoutException {
    ConnectionFactory factory = new ConnectionFactory();
    try {
      if (TLS_SCHEME.equalsIgnoreCase(uri.getScheme())) {
        factory.useSslProtocol(this.sslContext());
        factory.enableHostnameVerification();
        // setUri installs a trust-all context for amqps URIs
        factory.setUri(plainUri(uri));
        if (uri.getPort() == -1) {
          factory.setPort(ConnectionFactory.DEFAULT_AMQP_OVER_SSL_PORT);
        }
      } else {
        factory.setUri(uri);
      }
    } catch (URISyntaxException | NoSuchAlgorithmException | KeyManagementException e) {
      throw new AmqpException.AmqpConfigurationException(
          "Invalid broker URI " + UriUtils.mask(uri), e);
    }
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    configure(factory);
    return factory.newConnection(connectionName);
  }

  /**
   * Hook to customize the factory before the connection is opened.
   *
   * @param factory the factory, with the URI already set
   */
  protected void configure(ConnectionFactory factory) {}

  SSLContext sslContext() throws NoSuchAlgorithmException {
    return this.sslContext == null ? SSLContext.getDefault() : this.sslContext;
  }

  private static URI plainUri(URI uri) throws URISyntaxException {
    String tlsUri = uri.toString();
    return new URI("amqp" + tlsUri.substring(uri.getScheme().length()));
  }
}
