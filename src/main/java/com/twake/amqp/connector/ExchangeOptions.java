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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declaration options of the exchange.
 *
 * <p>The exchange is always a <code>topic</code> exchange. It is durable by default.
 *
 * @see Connector#withExchange(String, ExchangeOptions)
 */
public final class ExchangeOptions {

  private static final ExchangeOptions DEFAULT = builder().build();

  private final boolean durable;
  private final boolean autoDelete;
  private final boolean internal;
  private final Map<String, Object> arguments;

  private ExchangeOptions(Builder builder) {
    this.durable = builder.durable;
    this.autoDelete = builder.autoDelete;
    this.internal = builder.internal;
    this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
  }

  public static ExchangeOptions defaultOptions() {
    return DEFAULT;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean durable() {
    return this.durable;
  }

  public boolean autoDelete() {
    return this.autoDelete;
  }

  public boolean internal() {
    return this.internal;
  }

  public Map<String, Object> arguments() {
    return this.arguments;
  }

  @Override
  public String toString() {
    return "ExchangeOptions{"
        + "durable="
        + durable
        + ", autoDelete="
        + autoDelete
        + ", internal="
        + internal
        + ", arguments="
        + arguments
        + '}';
  }

  /** Builder for {@link ExchangeOptions}. */
  public static final class Builder {

    private boolean durable = true;
    private boolean autoDelete = false;
    private boolean internal = false;
    private final Map<String, Object> arguments = new LinkedHashMap<>();

    private Builder() {}

    public Builder durable(boolean durable) {
      this.durable = durable;
      return this;
    }

    public Builder autoDelete(boolean autoDelete) {
      this.autoDelete = autoDelete;
      return this;
    }

    public Builder internal(boolean internal) {
      this.internal = internal;
      return this;
    }

    public Builder argument(String key, Object value) {
      if (value == null) {
        this.arguments.remove(key);
      } else {
        this.arguments.put(key, value);
      }
      return this;
    }

    public ExchangeOptions build() {
      return new ExchangeOptions(this);
    }
  }
}
