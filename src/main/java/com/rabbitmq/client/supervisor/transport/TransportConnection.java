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

/** Network-level session to the broker. */
public interface TransportConnection extends AutoCloseable {

  /**
   * Open a channel on this connection.
   *
   * @return the channel
   * @throws IOException if the channel cannot be opened
   */
  TransportChannel openChannel() throws IOException;

  /**
   * Whether the connection is closed.
   *
   * @return true if closed
   */
  boolean isClosed();

  /**
   * Close the connection and its channels.
   *
   * @throws IOException if closing fails
   */
  @Override
  void close() throws IOException;

  /**
   * Register a listener called once when the connection closes.
   *
   * <p>The listener is called immediately if the connection is already closed.
   *
   * @param listener the listener
   */
  void addCloseListener(CloseListener listener);
}
