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

import static com.twake.amqp.connector.ConnectorState.CONNECTED;
import static com.twake.amqp.connector.ConnectorState.DISCONNECTED;
import static com.twake.amqp.connector.ConnectorState.RECONNECTING;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import com.twake.amqp.connector.AmqpException;
import com.twake.amqp.connector.BrokerClient;
import com.twake.amqp.connector.ConnectionConfig;
import com.twake.amqp.connector.Connector;
import com.twake.amqp.connector.ConnectorState;
import com.twake.amqp.connector.ExchangeOptions;
import com.twake.amqp.connector.QueueOptions;
import com.twake.amqp.connector.ReconnectionPolicy;
import com.twake.amqp.connector.metrics.MetricsCollector;
import com.twake.amqp.connector.metrics.NoOpMetricsCollector;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link Connector} implementation.
 *
 * <p>State, session, and scheduling fields are guarded by one lock, which is never held during
 * broker I/O. Every {@link #build()} and {@link #close()} starts a new generation: asynchronous
 * work (reconnection attempts, channel recoveries, failure callbacks) captures the generation it
 * was started in and has no effect once it changed. State listeners are called after the lock
 * is released.
 *
 * @see AmqpConnectorBuilder
 */
public final class AmqpConnector implements Connector {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConnector.class);

  private final String name;
  private final SessionEstablisher establisher;
  private final MetricsCollector metricsCollector;
  private final ScheduledExecutorService providedScheduledExecutorService;
  private final StateEventSupport stateEventSupport;
  private final Lock instanceLock = new ReentrantLock();
  private final ConnectorConfiguration.Builder settings = ConnectorConfiguration.builder();

  // guarded by instanceLock
  private ConnectorConfiguration configuration;
  private ReconnectionScheduler reconnectionScheduler;
  private ScheduledExecutorService scheduledExecutorService;
  private long generation = 0;
  private boolean closing = false;

  private volatile ConnectorState state = DISCONNECTED;
  private volatile Session session;

  /** Connector with default runtime settings. */
  public AmqpConnector() {
    this(new AmqpConnectorBuilder());
  }

  AmqpConnector(AmqpConnectorBuilder builder) {
    this.name = Utils.isBlank(builder.name()) ? Utils.generateName() : builder.name();
    BrokerClient brokerClient =
        builder.brokerClient() == null
            ? new ConnectionFactoryBrokerClient(builder.sslContext())
            : builder.brokerClient();
    MetricsCollector metricsCollector =
        builder.metricsCollector() == null
            ? NoOpMetricsCollector.INSTANCE
            : builder.metricsCollector();
    this.establisher = new SessionEstablisher(this.name, brokerClient, metricsCollector);
    this.providedScheduledExecutorService = builder.scheduledExecutorService();
    this.stateEventSupport = new StateEventSupport(this, builder.listeners());
    this.metricsCollector = metricsCollector;
  }

  @Override
  public Connector withUrl(String uri) {
    return configure(() -> this.settings.uri(uri));
  }

  @Override
  public Connector withConfig(ConnectionConfig config) {
    return configure(() -> this.settings.connectionConfig(config));
  }

  @Override
  public Connector withExchange(String name) {
    return this.withExchange(name, ExchangeOptions.defaultOptions());
  }

  @Override
  public Connector withExchange(String name, ExchangeOptions options) {
    return configure(() -> this.settings.exchange(name, options));
  }

  @Override
  public Connector withQueue(String name) {
    return this.withQueue(name, QueueOptions.defaultOptions());
  }

  @Override
  public Connector withQueue(String name, QueueOptions options) {
    return this.withQueue(name, options, ConnectorConfiguration.DEFAULT_ROUTING_KEY);
  }

  @Override
  public Connector withQueue(String name, QueueOptions options, String routingKey) {
    return configure(() -> this.settings.queue(name, options, routingKey));
  }

  @Override
  public Connector onMessage(MessageHandler handler) {
    return configure(() -> this.settings.handler(handler));
  }

  @Override
  public Connector withReconnection(ReconnectionPolicy policy) {
    return configure(() -> this.settings.reconnectionPolicy(policy));
  }

  private Connector configure(Runnable setting) {
    this.instanceLock.lock();
    try {
      setting.run();
    } finally {
      this.unlock();
    }
    return this;
  }

  @Override
  public void build() {
    ConnectorConfiguration buildConfiguration;
    long buildGeneration;
    Session previousSession;
    this.instanceLock.lock();
    try {
      // validation first, a configuration error changes nothing
      buildConfiguration = this.settings.build();
      if (this.reconnectionScheduler != null) {
        this.reconnectionScheduler.cancel();
      }
      buildGeneration = ++this.generation;
      this.closing = false;
      previousSession = this.session;
      this.session = null;
      this.configuration = buildConfiguration;
      this.reconnectionScheduler =
          new ReconnectionScheduler(
              this.name,
              this.scheduledExecutorService(),
              buildConfiguration.reconnectionPolicy().backOffDelayPolicy());
      this.state(DISCONNECTED, null);
    } finally {
      this.unlock();
    }
    if (previousSession != null) {
      LOGGER.debug("Releasing previous session of '{}' before building", this.name);
      previousSession.release();
    }
    LOGGER.debug("Building connector '{}' with {}", this.name, buildConfiguration);
    Session newSession = this.establisher.establish(buildConfiguration);
    if (this.install(newSession, buildGeneration)) {
      LOGGER.debug("Connector '{}' connected", this.name);
    } else {
      LOGGER.debug("Connector '{}' closed or rebuilt during build, releasing session", this.name);
      newSession.release();
      throw new AmqpException.AmqpResourceClosedException(
          "Connector '%s' has been closed during build", this.name);
    }
  }

  @Override
  public void close() {
    Session sessionToRelease;
    ScheduledExecutorService executorToShutdown = null;
    this.instanceLock.lock();
    try {
      if (this.closing && this.session == null && this.scheduledExecutorService == null) {
        return;
      }
      LOGGER.debug("Closing connector '{}'", this.name);
      this.closing = true;
      this.generation++;
      if (this.reconnectionScheduler != null) {
        this.reconnectionScheduler.cancel();
      }
      sessionToRelease = this.session;
      this.session = null;
      if (this.providedScheduledExecutorService == null && this.scheduledExecutorService != null) {
        executorToShutdown = this.scheduledExecutorService;
      }
      this.scheduledExecutorService = null;
      this.state(DISCONNECTED, null);
    } finally {
      this.unlock();
    }
    if (sessionToRelease != null) {
      sessionToRelease.release();
    }
    if (executorToShutdown != null) {
      executorToShutdown.shutdownNow();
    }
    LOGGER.debug("Connector '{}' closed", this.name);
  }

  @Override
  public ConnectorState state() {
    return this.state;
  }

  @Override
  public boolean isConnected() {
    return this.state == CONNECTED;
  }

  @Override
  public Channel channel() {
    Session current = this.session;
    return current == null ? null : current.channel();
  }

  int reconnectionAttempt() {
    this.instanceLock.lock();
    try {
      return this.reconnectionScheduler == null ? 0 : this.reconnectionScheduler.attempt();
    } finally {
      this.unlock();
    }
  }

  private boolean install(Session newSession, long sessionGeneration) {
    this.instanceLock.lock();
    try {
      if (this.isStale(sessionGeneration)) {
        return false;
      }
      this.session = newSession;
      newSession.activate();
      this.reconnectionScheduler.reset();
      this.state(CONNECTED, null);
    } finally {
      this.unlock();
    }
    // registered outside the lock, a listener added to a closed resource is called at once
    newSession
        .connection()
        .addShutdownListener(
            cause -> this.connectionFailed(newSession, sessionGeneration, cause, "connection"));
    this.watchChannel(newSession, newSession.channel(), sessionGeneration);
    return true;
  }

  private void watchChannel(Session watchedSession, Channel channel, long sessionGeneration) {
    if (channel != null) {
      channel.addShutdownListener(
          cause -> this.channelFailed(watchedSession, channel, sessionGeneration, cause));
    }
  }

  private void connectionFailed(
      Session failedSession, long sessionGeneration, Throwable cause, String origin) {
    this.instanceLock.lock();
    try {
      if (this.isStale(sessionGeneration) || this.session != failedSession) {
        LOGGER.debug(
            "Ignoring {} failure of '{}', session no longer active", origin, this.name);
        return;
      }
      LOGGER.info(
          "Connection of '{}' lost ({}), {}",
          this.name,
          ExceptionUtils.exceptionMessage(cause instanceof Exception ? (Exception) cause : null),
          this.configuration.reconnectionPolicy().enabled()
              ? "reconnecting"
              : "reconnection is disabled");
      this.session = null;
      if (this.configuration.reconnectionPolicy().enabled()) {
        this.scheduleReconnection(sessionGeneration, cause);
      } else {
        this.state(DISCONNECTED, cause);
      }
    } finally {
      this.unlock();
    }
    failedSession.release();
  }

  private void channelFailed(
      Session failedSession,
      Channel channel,
      long sessionGeneration,
      ShutdownSignalException cause) {
    if (cause.isHardError()) {
      // handled by the connection listener
      return;
    }
    this.instanceLock.lock();
    try {
      if (this.isStale(sessionGeneration)
          || this.session != failedSession
          || !failedSession.channelLost(channel)) {
        LOGGER.debug("Ignoring channel closing of '{}', channel no longer active", this.name);
        return;
      }
      LOGGER.info("Channel of '{}' closed ({}), recovering it", this.name, cause.getMessage());
      try {
        this.scheduledExecutorService.execute(
            Utils.namedRunnable(
                () -> this.recoverChannel(failedSession, sessionGeneration),
                "channel-recovery-%s",
                this.name));
      } catch (RejectedExecutionException e) {
        LOGGER.debug("Channel recovery of '{}' rejected, scheduler is shut down", this.name);
      }
    } finally {
      this.unlock();
    }
  }

  private void recoverChannel(Session recoveringSession, long sessionGeneration) {
    ConnectorConfiguration recoveryConfiguration;
    this.instanceLock.lock();
    try {
      if (this.isStale(sessionGeneration) || this.session != recoveringSession) {
        LOGGER.debug("Channel recovery of '{}' cancelled", this.name);
        return;
      }
      recoveryConfiguration = this.configuration;
    } finally {
      this.unlock();
    }
    try {
      this.establisher.establishChannelOnly(recoveringSession, recoveryConfiguration);
    } catch (AmqpException e) {
      LOGGER.warn(
          "Channel recovery of '{}' failed, recovering connection: {}", this.name, e.getMessage());
      this.connectionFailed(recoveringSession, sessionGeneration, e, "channel recovery");
      return;
    }
    boolean active;
    this.instanceLock.lock();
    try {
      active = !this.isStale(sessionGeneration) && this.session == recoveringSession;
    } finally {
      this.unlock();
    }
    if (active) {
      LOGGER.info("Channel of '{}' recovered", this.name);
      this.watchChannel(recoveringSession, recoveringSession.channel(), sessionGeneration);
    } else {
      LOGGER.debug("Connector '{}' closed during channel recovery", this.name);
      recoveringSession.release();
    }
  }

  // must be called with the lock
  private void scheduleReconnection(long sessionGeneration, Throwable cause) {
    boolean scheduled;
    try {
      scheduled =
          this.reconnectionScheduler.scheduleNext(() -> this.reconnect(sessionGeneration));
    } catch (RejectedExecutionException e) {
      LOGGER.debug("Reconnection of '{}' rejected, scheduler is shut down", this.name);
      scheduled = false;
    }
    if (scheduled) {
      this.state(RECONNECTING, cause);
    } else {
      LOGGER.warn(
          "Giving up reconnecting '{}' after {} attempt(s)",
          this.name,
          this.reconnectionScheduler.attempt());
      this.state(DISCONNECTED, cause);
    }
  }

  private void reconnect(long sessionGeneration) {
    ConnectorConfiguration reconnectionConfiguration;
    int attempt;
    this.instanceLock.lock();
    try {
      if (this.isStale(sessionGeneration)) {
        LOGGER.debug("Reconnection of '{}' cancelled", this.name);
        return;
      }
      this.reconnectionScheduler.attemptStarted();
      reconnectionConfiguration = this.configuration;
      attempt = this.reconnectionScheduler.attempt() + 1;
    } finally {
      this.unlock();
    }
    this.metricsCollector.reconnectionAttempt();
    LOGGER.info(
        "Reconnection attempt #{} of '{}' to {}",
        attempt,
        this.name,
        UriUtils.mask(reconnectionConfiguration.uri()));
    Session newSession;
    try {
      newSession = this.establisher.establish(reconnectionConfiguration);
    } catch (AmqpException e) {
      LOGGER.info(
          "Reconnection attempt #{} of '{}' failed: {}", attempt, this.name, e.getMessage());
      this.instanceLock.lock();
      try {
        if (this.isStale(sessionGeneration)) {
          return;
        }
        this.reconnectionScheduler.attemptFailed();
        this.scheduleReconnection(sessionGeneration, e);
      } finally {
        this.unlock();
      }
      return;
    }
    if (this.install(newSession, sessionGeneration)) {
      LOGGER.info("Connector '{}' reconnected after {} attempt(s)", this.name, attempt);
    } else {
      LOGGER.debug("Connector '{}' closed during reconnection, releasing session", this.name);
      newSession.release();
    }
  }

  private boolean isStale(long sessionGeneration) {
    return this.closing || sessionGeneration != this.generation;
  }

  // must be called with the lock
  private ScheduledExecutorService scheduledExecutorService() {
    if (this.scheduledExecutorService == null) {
      this.scheduledExecutorService =
          this.providedScheduledExecutorService == null
              ? Executors.newSingleThreadScheduledExecutor(
                  Utils.threadFactory("amqp-connector-" + this.name + "-"))
              : this.providedScheduledExecutorService;
    }
    return this.scheduledExecutorService;
  }

  // must be called with the lock
  private void state(ConnectorState newState, Throwable failureCause) {
    ConnectorState previousState = this.state;
    if (previousState != newState) {
      this.state = newState;
      LOGGER.debug("Connector '{}': {} -> {}", this.name, previousState, newState);
      this.stateEventSupport.stateChanged(previousState, newState, failureCause);
    }
  }

  // listeners are called once the lock is released
  private void unlock() {
    this.instanceLock.unlock();
    this.stateEventSupport.dispatchPendingChanges();
  }

  @Override
  public String toString() {
    return "AmqpConnector{" + "name='" + name + '\'' + ", state=" + state + '}';
  }
}
