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
package com.rabbitmq.client.supervisor.metrics;

/** Interface to collect execution data of the supervisor. */
public interface MetricsCollector {

  /** Called when the supervisor opens a transport connection. */
  void openConnection();

  /** Called when the supervisor releases a transport connection. */
  void closeConnection();

  /** Called when the supervisor opens a channel and declares the queue on it. */
  void openChannel();

  /** Called when the supervisor releases a channel. */
  void closeChannel();

  /** Called when a message is handed to the transport. */
  void publish();

  /** Called when the transport rejects a publish, or there is no usable connection. */
  void publishFailure();

  /**
   * Called when the supervisor reacted to an unexpected close.
   *
   * @param resource the resource that closed
   */
  void recovery(Resource resource);

  /** Called when the supervisor gave up recovering its connection. */
  void recoveryAbandoned();

  /** Resources the supervisor recovers. */
  enum Resource {
    /** The transport connection. */
    CONNECTION,
    /** The channel the queue is declared on. */
    CHANNEL
  }
}
