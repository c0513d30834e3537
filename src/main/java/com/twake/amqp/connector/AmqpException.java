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

/**
 * Base exception of the connector.
 *
 * <p>Subclasses tell configuration problems (never retried) apart from connection and topology
 * problems (retried by the recovery process when they happen outside of {@link
 * Connector#build()}).
 */
public class AmqpException extends RuntimeException {

  public AmqpException(Throwable cause) {
    super(cause);
  }

  public AmqpException(String format, Object... args) {
    super(String.format(format, args));
  }

  public AmqpException(String message, Throwable cause) {
    super(message, cause);
  }

  /** The connector configuration is incomplete or invalid. */
  public static class AmqpConfigurationException extends AmqpException {

    public AmqpConfigurationException(String format, Object... args) {
      super(format, args);
    }

    public AmqpConfigurationException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** No exchange has been set before {@link Connector#build()}. */
  public static class ExchangeNotSpecifiedException extends AmqpConfigurationException {

    public ExchangeNotSpecifiedException() {
      super("Exchange not specified");
    }
  }

  /** No queue has been set before {@link Connector#build()}. */
  public static class QueueNotSpecifiedException extends AmqpConfigurationException {

    public QueueNotSpecifiedException() {
      super("Queue not specified");
    }
  }

  /** No message handler has been set before {@link Connector#build()}. */
  public static class HandlerNotProvidedException extends AmqpConfigurationException {

    public HandlerNotProvidedException() {
      super("Message handler not provided");
    }
  }

  /** The connection to the broker could not be opened or has been lost. */
  public static class AmqpConnectionException extends AmqpException {

    public AmqpConnectionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The broker refused the credentials or the TLS handshake failed. */
  public static class AmqpSecurityException extends AmqpConnectionException {

    public AmqpSecurityException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The broker rejected the declaration of the topology or the registration of the consumer. */
  public static class AmqpTopologyException extends AmqpException {

    public AmqpTopologyException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The connector has been closed while an operation was in progress. */
  public static class AmqpResourceClosedException extends AmqpException {

    public AmqpResourceClosedException(String format, Object... args) {
      super(format, args);
    }
  }
}
