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

import com.twake.amqp.connector.AmqpException;
import com.twake.amqp.connector.ConnectionConfig;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;

abstract class UriUtils {

  // based on Apache HttpComponents PercentCodec

  private UriUtils() {}

  static final String DEFAULT_URI = "amqp://localhost";

  static final BitSet UNRESERVED = new BitSet(256);
  private static final int RADIX = 16;

  static {
    for (int i = 'a'; i <= 'z'; i++) {
      UNRESERVED.set(i);
    }
    for (int i = 'A'; i <= 'Z'; i++) {
      UNRESERVED.set(i);
    }
    // numeric characters
    for (int i = '0'; i <= '9'; i++) {
      UNRESERVED.set(i);
    }
    UNRESERVED.set('-');
    UNRESERVED.set('.');
    UNRESERVED.set('_');
    UNRESERVED.set('~');
  }

  static URI toUri(ConnectionConfig config) {
    StringBuilder builder = new StringBuilder(config.tls() ? "amqps://" : "amqp://");
    if (!Utils.isBlank(config.username())) {
      builder.append(encodeNonUnreserved(config.username()));
      if (config.password() != null) {
        builder.append(':').append(encodeNonUnreserved(config.password()));
      }
      builder.append('@');
    }
    String host = config.host();
    if (host != null && host.indexOf(':') >= 0 && !host.startsWith("[")) {
      // IPv6 literal
      host = "[" + host + "]";
    }
    builder.append(host).append(':').append(config.port());
    if (config.virtualHost() != null) {
      builder.append('/').append(encodeNonUnreserved(config.virtualHost()));
    }
    return toUri(builder.toString());
  }

  static URI toUri(String uriString) {
    if (Utils.isBlank(uriString)) {
      uriString = DEFAULT_URI;
    }
    try {
      URI uri = new URI(uriString);
      if (!"amqp".equalsIgnoreCase(uri.getScheme()) && !"amqps".equalsIgnoreCase(uri.getScheme())) {
        throw new AmqpException.AmqpConfigurationException(
            "Wrong scheme in AMQP URI: %s. Should be amqp or amqps", uri.getScheme());
      }
      return uri;
    } catch (URISyntaxException e) {
      throw new AmqpException.AmqpConfigurationException("Invalid URI", e);
    }
  }

  static String encodeNonUnreserved(String value) {
    return encode(value, UNRESERVED);
  }

  private static String encode(String value, BitSet safeCharacters) {
    if (value == null) {
      return null;
    }
    StringBuilder buf = new StringBuilder();
    final CharBuffer cb = CharBuffer.wrap(value);
    final ByteBuffer bb = StandardCharsets.UTF_8.encode(cb);
    while (bb.hasRemaining()) {
      final int b = bb.get() & 0xff;
      if (safeCharacters.get(b)) {
        buf.append((char) b);
      } else {
        buf.append("%");
        final char hex1 = Character.toUpperCase(Character.forDigit((b >> 4) & 0xF, RADIX));
        final char hex2 = Character.toUpperCase(Character.forDigit(b & 0xF, RADIX));
        buf.append(hex1);
        buf.append(hex2);
      }
    }
    return buf.toString();
  }

  static String mask(URI uri) {
    if (uri.getRawUserInfo() == null) {
      return uri.toString();
    }
    String userInfo = uri.getRawUserInfo();
    int colon = userInfo.indexOf(':');
    String masked = colon == -1 ? userInfo : userInfo.substring(0, colon) + ":****";
    return uri.toString().replace(userInfo, masked);
  }
}
