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
package com.rabbitmq.client.supervisor;

import java.time.Duration;

/**
 * Signal the application must observe to detect a total loss of connectivity.
 *
 * <p>{@link Event#RECOVERY_FAILED} is posted each time the supervisor gives up recovering its
 * connection. The supervisor is then closed and must be rebuilt.
 *
 * <p>{@link Event#SHUTDOWN} is sticky: once the signal is shut down, every wait returns it
 * immediately.
 */
public interface UnexpectedCloseSignal {

  /** Signal events. */
  enum Event {
    /** Connection recovery was abandoned. */
    RECOVERY_FAILED,
    /** The supervisor shut down. */
    SHUTDOWN
  }

  /**
   * Wait for the next event.
   *
   * @return the event
   * @throws InterruptedException if interrupted while waiting
   */
  Event take() throws InterruptedException;

  /**
   * Wait for the next event, up to the given timeout.
   *
   * @param timeout maximum time to wait
   * @return the event, null if none occurred before the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  Event poll(Duration timeout) throws InterruptedException;

  /**
   * Whether the signal has been shut down.
   *
   * @return true if shut down
   */
  boolean isShutdown();
}
