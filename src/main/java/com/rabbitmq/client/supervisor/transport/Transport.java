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

import java.io.IOException;
import java.net.URI;

/**
 * Broker transport the supervisor relies on.
 *
 * <p>Implementations do not recover connections or channels on their own: recovery is done by the
 * supervisor.
 *
 * @see com.rabbitmq.client.supervisor.impl.AmqpClientTransport
 */
@FunctionalInterface
public interface Transport {

  /**
   * Open a connection to the broker.
   *
   * @param uri broker URI, with credentials and virtual host
   * @param tls TLS settings, null for a plain TCP connection
   * @param connectionName client-provided name of the connection
   * @return the connection
   * @throws IOException if the connection cannot be established
   */
  TransportConnection dial(URI uri, TlsConfiguration tls, String connectionName)
      throws IOException;
}
