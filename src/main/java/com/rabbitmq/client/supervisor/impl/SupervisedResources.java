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

import com.rabbitmq.client.supervisor.transport.TransportChannel;
import com.rabbitmq.client.supervisor.transport.TransportConnection;
import java.io.IOException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * The connection and channel of a supervisor, guarded by a single lock.
 *
 * <p>Each installation increments the generation of the resource kind, so close notifications of
 * a superseded connection or channel can be told apart. A channel is never present without its
 * connection: detaching the connection detaches the channel in the same critical section.
 */
final class SupervisedResources {

  static final long NO_GENERATION = -1;

  private final Lock lock = new ReentrantLock();
  private TransportConnection connection;
  private TransportChannel channel;
  private long connectionGeneration = 0;
  private long channelGeneration = 0;

  /**
   * Install a new connection, unless the owner is closing.
   *
   * @return the generation of the connection, {@link #NO_GENERATION} if it was not installed
   */
  long installConnection(TransportConnection newConnection, BooleanSupplier closing) {
    this.lock.lock();
    try {
      if (closing.getAsBoolean() || this.connection != null) {
        return NO_GENERATION;
      }
      this.connection = newConnection;
      this.channel = null;
      return ++this.connectionGeneration;
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Install a channel opened on the given connection generation.
   *
   * @return the generation of the channel, {@link #NO_GENERATION} if the connection changed in the
   *     meantime or a channel is already installed
   */
  long installChannel(long onConnectionGeneration, TransportChannel newChannel) {
    this.lock.lock();
    try {
      if (this.connection == null
          || this.connectionGeneration != onConnectionGeneration
          || this.channel != null) {
        return NO_GENERATION;
      }
      this.channel = newChannel;
      return ++this.channelGeneration;
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Detach the connection, and its channel, if the connection is still the given generation.
   *
   * @return the detached resources, null if the generation is stale
   */
  Snapshot detachConnection(long generation) {
    this.lock.lock();
    try {
      if (this.connection == null || this.connectionGeneration != generation) {
        return null;
      }
      return this.detach();
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Detach the channel if it is still the given generation.
   *
   * @return the detached channel, null if the generation is stale
   */
  TransportChannel detachChannel(long generation) {
    this.lock.lock();
    try {
      if (this.channel == null || this.channelGeneration != generation) {
        return null;
      }
      TransportChannel detached = this.channel;
      this.channel = null;
      return detached;
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Detach whatever is installed.
   *
   * @return the detached resources, possibly empty
   */
  Snapshot detachAll() {
    this.lock.lock();
    try {
      return this.detach();
    } finally {
      this.lock.unlock();
    }
  }

  Snapshot snapshot() {
    this.lock.lock();
    try {
      return new Snapshot(
          this.connection, this.channel, this.connectionGeneration, this.channelGeneration);
    } finally {
      this.lock.unlock();
    }
  }

  /** Run the call with the current resources, holding the lock for the whole call. */
  <T> T callUnderLock(LockedCall<T> call) throws IOException {
    this.lock.lock();
    try {
      return call.call(this.connection, this.channel);
    } finally {
      this.lock.unlock();
    }
  }

  // must be called under the lock
  private Snapshot detach() {
    Snapshot detached =
        new Snapshot(
            this.connection, this.channel, this.connectionGeneration, this.channelGeneration);
    this.channel = null;
    this.connection = null;
    return detached;
  }

  @FunctionalInterface
  interface LockedCall<T> {

    T call(TransportConnection connection, TransportChannel channel) throws IOException;
  }

  static final class Snapshot {

    private final TransportConnection connection;
    private final TransportChannel channel;
    private final long connectionGeneration;
    private final long channelGeneration;

    private Snapshot(
        TransportConnection connection,
        TransportChannel channel,
        long connectionGeneration,
        long channelGeneration) {
      this.connection = connection;
      this.channel = channel;
      this.connectionGeneration = connectionGeneration;
      this.channelGeneration = channelGeneration;
    }

    TransportConnection connection() {
      return this.connection;
    }

    TransportChannel channel() {
      return this.channel;
    }

    long connectionGeneration() {
      return this.connectionGeneration;
    }

    long channelGeneration() {
      return this.channelGeneration;
    }

    boolean isEmpty() {
      return this.connection == null && this.channel == null;
    }
  }
}
