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
 * Structured description of the broker to connect to.
 *
 * <p>The connector renders it as an <code>amqp://</code> (or <code>amqps://</code> when TLS is
 * enabled) URI, with percent-encoded credentials and virtual host.
 *
 * @see Connector#withConfig(ConnectionConfig)
 */
public final class ConnectionConfig {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5672;
  public static final int DEFAULT_TLS_PORT = 5671;
  public static final String DEFAULT_VIRTUAL_HOST = "/";

  private final String host;
  private final int port;
  private final String username;
  private final String password;
  private final String virtualHost;
  private final boolean tls;

  private ConnectionConfig(Builder builder) {
    this.host = builder.host;
    this.port = builder.port;
    this.username = builder.username;
    this.password = builder.password;
    this.virtualHost = builder.virtualHost;
    this.tls = builder.tls;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String host() {
    return this.host;
  }

  /**
   * The port, {@link #DEFAULT_TLS_PORT} or {@link #DEFAULT_PORT} if it has not been set.
   *
   * @return broker port
   */
  public int port() {
    if (this.port > 0) {
      return this.port;
    } else {
      return this.tls ? DEFAULT_TLS_PORT : DEFAULT_PORT;
    }
  }

  public String username() {
    return this.username;
  }

  public String password() {
    return this.password;
  }

  public String virtualHost() {
    return this.virtualHost;
  }

  public boolean tls() {
    return this.tls;
  }

  @Override
  public String toString() {
    return "ConnectionConfig{"
        + "host='"
        + host
        + '\''
        + ", port="
        + port()
        + ", username='"
        + username
        + '\''
        + ", virtualHost='"
        + virtualHost
        + '\''
        + ", tls="
        + tls
        + '}';
  }

  /** Builder for {@link ConnectionConfig}. */
  public static final class Builder {

    private String host = DEFAULT_HOST;
    private int port = -1;
    private String username;
    private String password;
    private String virtualHost = DEFAULT_VIRTUAL_HOST;
    private boolean tls = false;

    private Builder() {}

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder virtualHost(String virtualHost) {
      this.virtualHost = virtualHost;
      return this;
    }

    /**
     * Use TLS (<code>amqps</code> scheme).
     *
     * @param tls TLS flag
     * @return this builder
     */
    public Builder tls(boolean tls) {
      this.tls = tls;
      return this;
    }

    public ConnectionConfig build() {
      if (this.host == null || this.host.isBlank()) {
        throw new IllegalArgumentException("Host cannot be empty");
      }
      if (this.port == 0 || this.port > 65535) {
        throw new IllegalArgumentException("Invalid port: " + this.port);
      }
      return new ConnectionConfig(this);
    }
  }
}
