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

import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;
import com.twake.amqp.connector.AmqpException;
import javax.net.ssl.SSLException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  /** Conversion for failures while opening a connection or a channel. */
  static AmqpException convertConnectionFailure(Exception e, String format, Object... args) {
    if (e instanceof AmqpException) {
      return (AmqpException) e;
    }
    String message = message(e, format, args);
    if (isSecurityFailure(e)) {
      return new AmqpException.AmqpSecurityException(message, e);
    } else {
      return new AmqpException.AmqpConnectionException(message, e);
    }
  }

  /** Conversion for failures while declaring the topology or subscribing to the queue. */
  static AmqpException convertTopologyFailure(Exception e, String format, Object... args) {
    if (e instanceof AmqpException) {
      return (AmqpException) e;
    }
    String message = message(e, format, args);
    ShutdownSignalException signal = shutdownSignal(e);
    if (signal != null && signal.isHardError()) {
      // the whole connection went down, not only the channel
      return new AmqpException.AmqpConnectionException(message, e);
    } else {
      return new AmqpException.AmqpTopologyException(message, e);
    }
  }

  static ShutdownSignalException shutdownSignal(Throwable e) {
    if (e instanceof ShutdownSignalException) {
      return (ShutdownSignalException) e;
    } else if (e != null && e.getCause() instanceof ShutdownSignalException) {
      return (ShutdownSignalException) e.getCause();
    } else {
      return null;
    }
  }

  private static boolean isSecurityFailure(Exception e) {
    return e instanceof PossibleAuthenticationFailureException
        || e instanceof SSLException
        || e.getCause() instanceof SSLException;
  }

  private static String message(Exception e, String format, Object... args) {
    String description = String.format(format, args);
    return description + " (reason: " + exceptionMessage(e) + ")";
  }

  static String exceptionMessage(Exception e) {
    if (e == null) {
      return "unknown";
    } else if (e.getMessage() == null) {
      return e.getClass().getSimpleName();
    } else {
      return e.getMessage() + " [" + e.getClass().getSimpleName() + "]";
    }
  }
}
