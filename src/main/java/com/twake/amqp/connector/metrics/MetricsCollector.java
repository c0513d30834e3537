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
package com.twake.amqp.connector.metrics;

/** Interface to collect execution data of the connector. */
public interface MetricsCollector {

  /** Called when a connection to the broker is opened. */
  void openConnection();

  /** Called when a connection to the broker is closed or lost. */
  void closeConnection();

  /** Called when the connector starts consuming the queue on a new channel. */
  void openConsumer();

  /** Called when the connector stops consuming the queue on a channel. */
  void closeConsumer();

  /** Called when a message is dispatched to the message handler. */
  void consume();

  /**
   * Called when a message is settled by the connector.
   *
   * @param disposition disposition (outcome)
   */
  void consumeDisposition(ConsumeDisposition disposition);

  /** Called before each reconnection attempt. */
  void reconnectionAttempt();

  /** The client-to-broker dispositions. */
  enum ConsumeDisposition {
    /** The message handler succeeded, the message has been acknowledged. */
    ACCEPTED,
    /** The message handler failed, the message has been rejected without requeuing. */
    DISCARDED
  }
}
