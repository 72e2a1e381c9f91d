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

import com.rabbitmq.client.supervisor.SupervisorException;
import com.rabbitmq.client.supervisor.transport.TlsConfiguration;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.net.ssl.SSLContext;

abstract class TlsUtils {

  /** Allowed protocols, by order of preference. TLS 1.2 is the minimum. */
  static final String[] PROTOCOLS = new String[] {"TLSv1.3", "TLSv1.2"};

  private TlsUtils() {}

  /**
   * TLS settings with the JVM default trust store, hostname verification, and only the allowed
   * protocols the JVM supports.
   */
  static TlsConfiguration defaultTlsConfiguration() {
    SSLContext context = sslContext();
    List<String> protocols =
        enabledProtocols(context.getSupportedSSLParameters().getProtocols());
    return new TlsConfiguration(context, protocols, true);
  }

  static SSLContext sslContext() {
    SSLContext context = null;
    for (String protocol : PROTOCOLS) {
      try {
        context = SSLContext.getInstance(protocol);
        break;
      } catch (NoSuchAlgorithmException ignored) {
        // OK, trying the next protocol
      }
    }
    if (context == null) {
      throw new SupervisorException.SupervisorConfigurationException(
          "None of the mandatory TLS protocols supported: %s.", String.join(", ", PROTOCOLS));
    }
    try {
      context.init(null, null, null);
    } catch (KeyManagementException e) {
      throw new SupervisorException(e);
    }
    return context;
  }

  /** The allowed protocols among the supported ones, in the preference order. */
  static List<String> enabledProtocols(String[] supportedProtocols) {
    List<String> supported = Arrays.asList(supportedProtocols);
    List<String> enabled = new ArrayList<>(PROTOCOLS.length);
    for (String protocol : PROTOCOLS) {
      if (supported.contains(protocol)) {
        enabled.add(protocol);
      }
    }
    if (enabled.isEmpty()) {
      throw new SupervisorException.SupervisorConfigurationException(
          "None of the mandatory TLS protocols supported: %s.", String.join(", ", PROTOCOLS));
    }
    return enabled;
  }
}
