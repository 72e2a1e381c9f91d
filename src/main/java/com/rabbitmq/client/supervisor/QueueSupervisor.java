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

/**
 * Resilient publisher for a single durable queue.
 *
 * <p>The supervisor owns one transport connection and one channel. It recovers them when the
 * broker or the network closes them, and reports on {@link #unexpectedClose()} when it cannot.
 *
 * <p>Instances are thread-safe.
 *
 * @see QueueSupervisorBuilder
 */
public interface QueueSupervisor extends AutoCloseable {

  /**
   * Connect to the broker, open a channel, and declare the queue.
   *
   * <p>The connection is retried up to the configured number of attempts. The call either succeeds
   * or throws; it never leaves a half-open supervisor behind. A failed call can be retried.
   *
   * <p>A call made while the connection is being recovered waits for the recovery to end.
   *
   * @throws SupervisorException.SupervisorConnectionException if no connection could be
   *     established
   * @throws SupervisorException.SupervisorChannelException if the channel could not be opened or
   *     the queue could not be declared
   * @throws SupervisorException.SupervisorInvalidStateException if the supervisor is already
   *     connected
   * @throws SupervisorException.SupervisorClosedException if the supervisor is closed
   */
  void connect();

  /**
   * Serialize the message to JSON and publish it to the queue.
   *
   * @param message the payload
   * @throws SupervisorException.SupervisorSerializationException if the payload cannot be
   *     serialized, nothing is published then
   * @throws SupervisorException.SupervisorInvalidStateException if there is no usable connection
   *     or channel
   * @throws SupervisorException.SupervisorPublishException if the transport failed
   */
  void publish(Object message);

  /**
   * Publish an already serialized JSON body to the queue.
   *
   * @param jsonBody the body
   * @see #publish(Object)
   */
  void publish(byte[] jsonBody);

  /**
   * The signal posted when the supervisor gives up.
   *
   * @return the signal
   */
  UnexpectedCloseSignal unexpectedClose();

  /**
   * Current state of the supervisor.
   *
   * @return the state
   */
  State state();

  /**
   * Close the channel, then the connection.
   *
   * <p>Idempotent. Both resources are closed even if closing the first fails, the first error is
   * then thrown.
   */
  @Override
  void close();

  /** Close and only log errors. */
  void closeQuietly();

  /** Supervisor state. */
  enum State {
    /** Built, not connected yet, or a connection attempt is in progress. */
    OPENING,
    /** Connected, the channel is usable. */
    OPEN,
    /** The connection was lost, the supervisor is reconnecting. */
    RECOVERING,
    /** The supervisor is closing. */
    CLOSING,
    /** The supervisor is closed, it must be rebuilt to be used again. */
    CLOSED
  }

  /**
   * Application listener for state changes.
   *
   * @see QueueSupervisorBuilder#listeners(StateListener...)
   */
  @FunctionalInterface
  interface StateListener {

    /**
     * Handle state change.
     *
     * @param context state change context
     */
    void handle(Context context);
  }

  /** Context of a state change. */
  interface Context {

    /**
     * The supervisor instance.
     *
     * @return supervisor
     */
    QueueSupervisor supervisor();

    /**
     * The failure cause, can be null.
     *
     * @return failure cause, null if no cause for failure
     */
    Throwable failureCause();

    /**
     * The previous state.
     *
     * @return previous state
     */
    State previousState();

    /**
     * The current (new) state.
     *
     * @return current state
     */
    State currentState();
  }
}
