// Copyright (c) 2026 Broadcom. All Rights Reserved.
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
package com.rabbitmq.client.supervisor.impl;

import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;

abstract class UriUtils {

  // based on Apache HttpComponents PercentCodec

  static final String SCHEME_PLAIN = "amqp";
  static final String SCHEME_TLS = "amqps";
  private static final String MASK = "****";

  private UriUtils() {}

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

  /**
   * Broker URI in the <code>amqp(s)://user:password@host:port/vhost</code> form.
   *
   * <p>Username, password, and virtual host are percent-encoded, so the default virtual host
   * <code>/</code> becomes <code>%2F</code>. There is no user information when both username and
   * password are null.
   */
  static URI brokerUri(
      boolean tls, String username, String password, String host, int port, String virtualHost) {
    StringBuilder builder = new StringBuilder(tls ? SCHEME_TLS : SCHEME_PLAIN).append("://");
    if (username != null || password != null) {
      builder
          .append(encodeNonUnreserved(username == null ? "" : username))
          .append(':')
          .append(encodeNonUnreserved(password == null ? "" : password))
          .append('@');
    }
    if (host.indexOf(':') >= 0 && !host.startsWith("[")) {
      // IPv6 literal
      builder.append('[').append(host).append(']');
    } else {
      builder.append(host);
    }
    builder.append(':').append(port).append('/');
    if (virtualHost != null) {
      builder.append(encodeNonUnreserved(virtualHost));
    }
    return URI.create(builder.toString());
  }

  /** The URI as a string, with the password replaced by a mask. */
  static String mask(URI uri) {
    String userInfo = uri.getRawUserInfo();
    if (userInfo == null || userInfo.indexOf(':') < 0) {
      return uri.toString();
    }
    String value = uri.toString();
    int userInfoStart = value.indexOf("://") + 3;
    return value.substring(0, userInfoStart)
        + userInfo.substring(0, userInfo.indexOf(':') + 1)
        + MASK
        + value.substring(userInfoStart + userInfo.length());
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
}
