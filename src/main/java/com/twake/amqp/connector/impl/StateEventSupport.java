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

import com.twake.amqp.connector.Connector;
import com.twake.amqp.connector.ConnectorState;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queue of the state changes of a connector.
 *
 * <p>Changes are recorded while the connector lock is held and handed to the listeners once it is
 * released, so a listener can call {@link Connector#build()} or {@link Connector#close()}. One
 * thread at a time dispatches, in the order of the changes. A change recorded during a dispatch,
 * by a listener or by another thread, is dispatched by the thread already dispatching.
 */
final class StateEventSupport {

  private static final Logger LOGGER = LoggerFactory.getLogger(StateEventSupport.class);

  private final Connector connector;
  private final List<Connector.StateListener> listeners;
  private final Queue<StateChange> pendingChanges = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean dispatching = new AtomicBoolean(false);

  StateEventSupport(Connector connector, List<Connector.StateListener> listeners) {
    this.connector = connector;
    this.listeners = List.copyOf(listeners);
  }

  // called with the connector lock
  void stateChanged(
      ConnectorState previousState, ConnectorState currentState, Throwable failureCause) {
    if (!this.listeners.isEmpty()) {
      this.pendingChanges.add(
          new StateChange(this.connector, previousState, currentState, failureCause));
    }
  }

  // called without the connector lock
  void dispatchPendingChanges() {
    while (!this.pendingChanges.isEmpty() && this.dispatching.compareAndSet(false, true)) {
      try {
        StateChange change;
        while ((change = this.pendingChanges.poll()) != null) {
          notifyListeners(change);
        }
      } finally {
        this.dispatching.set(false);
      }
    }
  }

  private void notifyListeners(StateChange change) {
    for (Connector.StateListener listener : this.listeners) {
      try {
        listener.handle(change);
      } catch (Exception e) {
        LOGGER.warn("Error in state listener of {} on {}", this.connector, change, e);
      }
    }
  }

  private static final class StateChange implements Connector.Context {

    private final Connector connector;
    private final ConnectorState previousState;
    private final ConnectorState currentState;
    private final Throwable failureCause;

    private StateChange(
        Connector connector,
        ConnectorState previousState,
        ConnectorState currentState,
        Throwable failureCause) {
      this.connector = connector;
      this.previousState = previousState;
      this.currentState = currentState;
      this.failureCause = failureCause;
    }

    @Override
    public Connector connector() {
      return this.connector;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public ConnectorState previousState() {
      return this.previousState;
    }

    @Override
    public ConnectorState currentState() {
      return this.currentState;
    }

    @Override
    public String toString() {
      String change = previousState + " -> " + currentState;
      return failureCause == null ? change : change + " (" + failureCause + ")";
    }
  }
}
