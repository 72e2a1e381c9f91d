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

/** Logical session multiplexed over a {@link TransportConnection}. */
public interface TransportChannel extends AutoCloseable {

  /**
   * Declare a queue, without arguments.
   *
   * @param name queue name
   * @param durable whether the queue survives a broker restart
   * @param autoDelete whether the queue is deleted when its last consumer goes away
   * @param exclusive whether the queue is restricted to the connection
   * @param noWait whether to skip waiting for the broker response
   * @throws IOException if the declaration fails
   */
  void declareQueue(
      String name, boolean durable, boolean autoDelete, boolean exclusive, boolean noWait)
      throws IOException;

  /**
   * Publish a message.
   *
   * @param exchange exchange, empty for the default exchange
   * @param routingKey routing key
   * @param mandatory mandatory flag
   * @param immediate immediate flag
   * @param message the message
   * @throws IOException if the publish fails
   */
  void publish(
      String exchange,
      String routingKey,
      boolean mandatory,
      boolean immediate,
      OutboundMessage message)
      throws IOException;

  /**
   * Close the channel.
   *
   * @throws IOException if closing fails
   */
  @Override
  void close() throws IOException;

  /**
   * Register a listener called once when the channel closes.
   *
   * <p>The listener is called immediately if the channel is already closed.
   *
   * @param listener the listener
   */
  void addCloseListener(CloseListener listener);
}
