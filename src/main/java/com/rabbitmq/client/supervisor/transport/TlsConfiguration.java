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
package com.rabbitmq.client.supervisor.transport;

import java.util.Arrays;
import java.util.List;
import javax.net.ssl.SSLContext;

/** TLS settings for {@link Transport#dial}. */
public final class TlsConfiguration {

  private final SSLContext sslContext;
  private final List<String> protocols;
  private final boolean hostnameVerification;

  public TlsConfiguration(
      SSLContext sslContext, List<String> protocols, boolean hostnameVerification) {
    if (protocols == null || protocols.isEmpty()) {
      throw new IllegalArgumentException("At least one TLS protocol must be enabled");
    }
    this.sslContext = sslContext;
    this.protocols = List.copyOf(protocols);
    this.hostnameVerification = hostnameVerification;
  }

  public SSLContext sslContext() {
    return this.sslContext;
  }

  /**
   * Protocols allowed on the connection, e.g. <code>TLSv1.3</code>, <code>TLSv1.2</code>.
   *
   * @return enabled protocols
   */
  public List<String> protocols() {
    return this.protocols;
  }

  public String[] protocolsArray() {
    return this.protocols.toArray(new String[0]);
  }

  public boolean hostnameVerification() {
    return this.hostnameVerification;
  }

  @Override
  public String toString() {
    return "TlsConfiguration{"
        + "protocols="
        + Arrays.toString(protocolsArray())
        + ", hostnameVerification="
        + hostnameVerification
        + '}';
  }
}
