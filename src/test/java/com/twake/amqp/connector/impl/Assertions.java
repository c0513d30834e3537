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

import static org.assertj.core.api.Assertions.fail;

import com.twake.amqp.connector.Connector;
import com.twake.amqp.connector.ConnectorState;
import java.time.Duration;
import org.assertj.core.api.AbstractObjectAssert;

final class Assertions {

  private Assertions() {}

  static SyncAssert assertThat(TestUtils.Sync sync) {
    return new SyncAssert(sync);
  }

  static ConnectorAssert assertThat(Connector connector) {
    return new ConnectorAssert(connector);
  }

  static class SyncAssert extends AbstractObjectAssert<SyncAssert, TestUtils.Sync> {

    private SyncAssert(TestUtils.Sync sync) {
      super(sync, SyncAssert.class);
    }

    SyncAssert completes() {
      return this.completes(TestUtils.DEFAULT_CONDITION_TIMEOUT);
    }

    SyncAssert completes(Duration timeout) {
      boolean completed = actual.await(timeout);
      if (!completed) {
        fail("Sync '%s' timed out after %d ms", this.actual.toString(), timeout.toMillis());
      }
      return this;
    }

    SyncAssert hasNotCompleted() {
      if (actual.hasCompleted()) {
        fail("Sync '%s' should not have completed", this.actual.toString());
      }
      return this;
    }
  }

  static class ConnectorAssert extends AbstractObjectAssert<ConnectorAssert, Connector> {

    private ConnectorAssert(Connector connector) {
      super(connector, ConnectorAssert.class);
    }

    ConnectorAssert isConnected() {
      return this.hasState(ConnectorState.CONNECTED);
    }

    ConnectorAssert isReconnecting() {
      return this.hasState(ConnectorState.RECONNECTING);
    }

    ConnectorAssert isDisconnected() {
      return this.hasState(ConnectorState.DISCONNECTED);
    }

    ConnectorAssert hasState(ConnectorState expected) {
      isNotNull();
      if (actual.state() != expected) {
        fail("Connector should be %s but is %s", expected, actual.state());
      }
      return this;
    }

    ConnectorAssert becomes(ConnectorState expected) {
      isNotNull();
      TestUtils.waitAtMost(
          () -> actual.state() == expected,
          () -> "connector should be " + expected + " but is " + actual.state());
      return this;
    }

    ConnectorAssert hasNoChannel() {
      isNotNull();
      if (actual.channel() != null) {
        fail("Connector should have no channel");
      }
      return this;
    }
  }
}
