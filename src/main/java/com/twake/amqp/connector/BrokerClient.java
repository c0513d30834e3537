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

import com.rabbitmq.client.Connection;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.TimeoutException;

/**
 * Contract to open connections to the broker.
 *
 * <p>The connector uses it for the initial connection and for every reconnection attempt. The
 * returned connection must not recover on its own, recovery is the connector's job.
 */
@FunctionalInterface
public interface BrokerClient {

  /**
   * Open a connection.
   *
   * @param uri the broker URI (<code>amqp</code> or <code>amqps</code> scheme)
   * @param connectionName client-provided name of the connection, can be null
   * @return the open connection
   * @throws IOException if the connection cannot be opened
   * @throws TimeoutException if the connection cannot be opened in time
   */
  Connection connect(URI uri, String connectionName) throws IOException, TimeoutException;
}
