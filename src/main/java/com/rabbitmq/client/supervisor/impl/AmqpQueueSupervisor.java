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

import static com.rabbitmq.client.supervisor.QueueSupervisor.State.CLOSED;
import static com.rabbitmq.client.supervisor.QueueSupervisor.State.CLOSING;
import static com.rabbitmq.client.supervisor.QueueSupervisor.State.OPEN;
import static com.rabbitmq.client.supervisor.QueueSupervisor.State.RECOVERING;
import static com.rabbitmq.client.supervisor.impl.ExceptionUtils.channelFailure;
import static com.rabbitmq.client.supervisor.impl.ExceptionUtils.exceptionMessage;
import static com.rabbitmq.client.supervisor.impl.SupervisedResources.NO_GENERATION;

import com.rabbitmq.client.supervisor.MessageCodec;
import com.rabbitmq.client.supervisor.SupervisorException;
import com.rabbitmq.client.supervisor.UnexpectedCloseSignal;
import com.rabbitmq.client.supervisor.metrics.MetricsCollector;
import com.rabbitmq.client.supervisor.transport.CloseNotification;
import com.rabbitmq.client.supervisor.transport.OutboundMessage;
import com.rabbitmq.client.supervisor.transport.TlsConfiguration;
import com.rabbitmq.client.supervisor.transport.Transport;
import com.rabbitmq.client.supervisor.transport.TransportChannel;
import com.rabbitmq.client.supervisor.transport.TransportConnection;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpQueueSupervisor extends SupervisorBase {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpQueueSupervisor.class);

  static final String HEADER_INSTANCE_ID = "WharfInstanceId";
  static final String HEADER_TIMESTAMP = "Timestamp";
  static final String CONTENT_TYPE = "application/json";
  static final String DEFAULT_EXCHANGE = "";

  private final String name;
  private final URI uri;
  private final String maskedUri;
  private final TlsConfiguration tls;
  private final String queue;
  private final String instanceId;
  private final Transport transport;
  private final MessageCodec messageCodec;
  private final MetricsCollector metricsCollector;
  private final Clock clock;
  private final ExecutorService executorService;
  private final boolean internalExecutor;
  private final ConnectionRetry connectionRetry;
  private final SupervisedResources resources = new SupervisedResources();
  private final DefaultUnexpectedCloseSignal unexpectedClose = new DefaultUnexpectedCloseSignal();
  private final AtomicBoolean closing = new AtomicBoolean(false);
  // connect() and connection recovery never dial concurrently
  private final Lock connectionLock = new ReentrantLock();

  AmqpQueueSupervisor(AmqpQueueSupervisorBuilder builder) {
    super(builder.listeners());
    this.name = builder.name();
    this.uri = builder.uri();
    this.maskedUri = UriUtils.mask(this.uri);
    this.tls = builder.tlsConfiguration();
    this.queue = builder.queue();
    this.instanceId = builder.instanceId();
    this.transport = builder.transport();
    this.messageCodec = builder.messageCodec();
    this.metricsCollector = builder.metricsCollector();
    this.clock = builder.clock();
    if (builder.executorService() == null) {
      this.executorService = Utils.executorService("queue-supervisor-%s-", this.name);
      this.internalExecutor = true;
    } else {
      this.executorService = builder.executorService();
      this.internalExecutor = false;
    }
    this.connectionRetry =
        new ConnectionRetry(
            builder.maxConnectAttempts(),
            builder.backOffDelayPolicy(),
            builder.sleeper(),
            this.closing::get);
    LOGGER.debug("Supervisor '{}' created for queue '{}' on {}", this.name, this.queue, maskedUri);
  }

  @Override
  public void connect() {
    if (this.closing.get()) {
      throw new SupervisorException.SupervisorClosedException("Supervisor is closed");
    }
    this.checkNotClosed();
    this.connectionLock.lock();
    try {
      this.doConnect();
    } finally {
      this.connectionLock.unlock();
    }
  }

  private void doConnect() {
    if (this.closing.get()) {
      throw new SupervisorException.SupervisorClosedException("Supervisor is closed");
    }
    this.checkNotClosed();
    if (this.resources.snapshot().connection() != null) {
      throw new SupervisorException.SupervisorInvalidStateException(
          "Supervisor '%s' is already connected", this.name);
    }
    LOGGER.debug("Connecting supervisor '{}' to {}", this.name, this.maskedUri);
    long connectionGeneration = this.acquireConnection();
    try {
      this.acquireChannel(connectionGeneration);
    } catch (SupervisorException.SupervisorChannelException e) {
      if (e.connectionReleased()) {
        throw e;
      } else {
        Exception cleanupError = this.releaseConnection(connectionGeneration);
        Exception error = e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
        throw channelFailure("Failed to open a channel", error, cleanupError, true);
      }
    }
    if (this.closing.get() || !this.state(OPEN)) {
      throw new SupervisorException.SupervisorClosedException(
          "Supervisor closed while connecting");
    }
    LOGGER.info("Supervisor '{}' connected to {}", this.name, this.maskedUri);
  }

  @Override
  public void publish(Object message) {
    byte[] body;
    try {
      body = this.messageCodec.encode(message);
    } catch (Exception e) {
      throw new SupervisorException.SupervisorSerializationException(
          "Failed to serialize message: " + exceptionMessage(e), e);
    }
    this.publish(body);
  }

  @Override
  public void publish(byte[] jsonBody) {
    Map<String, Object> headers = new LinkedHashMap<>(2);
    headers.put(HEADER_INSTANCE_ID, this.instanceId);
    headers.put(HEADER_TIMESTAMP, Date.from(this.clock.instant()));
    OutboundMessage message = new OutboundMessage(headers, CONTENT_TYPE, jsonBody);
    try {
      this.resources.callUnderLock(
          (connection, channel) -> {
            if (connection == null) {
              throw new SupervisorException.SupervisorInvalidStateException(
                  "Failed to publish a message, connection is missing");
            } else if (connection.isClosed()) {
              throw new SupervisorException.SupervisorInvalidStateException(
                  "Failed to publish a message, connection is closed");
            } else if (channel == null) {
              throw new SupervisorException.SupervisorInvalidStateException(
                  "Failed to publish a message, channel is missing");
            }
            channel.publish(DEFAULT_EXCHANGE, this.queue, false, false, message);
            return null;
          });
    } catch (SupervisorException.SupervisorInvalidStateException e) {
      this.metricsCollector.publishFailure();
      throw e;
    } catch (IOException | RuntimeException e) {
      LOGGER.warn(
          "Failed to publish a message to queue '{}' (supervisor '{}'): {}",
          this.queue,
          this.name,
          exceptionMessage(e));
      this.metricsCollector.publishFailure();
      throw new SupervisorException.SupervisorPublishException(
          "Failed to publish a message: " + exceptionMessage(e), e);
    }
    this.metricsCollector.publish();
  }

  @Override
  public UnexpectedCloseSignal unexpectedClose() {
    return this.unexpectedClose;
  }

  @Override
  public void close() {
    if (!this.closing.compareAndSet(false, true)) {
      return;
    }
    LOGGER.debug("Closing supervisor '{}'", this.name);
    this.state(CLOSING);
    SupervisedResources.Snapshot detached = this.resources.detachAll();
    this.detached(detached);
    Exception channelError = null;
    Exception connectionError = null;
    if (detached.channel() != null) {
      try {
        detached.channel().close();
      } catch (Exception e) {
        channelError = e;
      }
    }
    TransportConnection connection = detached.connection();
    if (connection != null && !connection.isClosed()) {
      try {
        connection.close();
      } catch (Exception e) {
        connectionError = e;
      }
    }
    if (this.internalExecutor) {
      this.executorService.shutdownNow();
    }
    this.unexpectedClose.shutdown();
    this.state(CLOSED);
    LOGGER.debug("Supervisor '{}' closed", this.name);
    Exception first = channelError == null ? connectionError : channelError;
    if (first != null) {
      SupervisorException exception =
          ExceptionUtils.convert(
              first, "Error while closing supervisor '%s': %s", this.name, exceptionMessage(first));
      if (channelError != null && connectionError != null) {
        exception.addSuppressed(connectionError);
      }
      throw exception;
    }
  }

  @Override
  public void closeQuietly() {
    try {
      this.close();
    } catch (Exception e) {
      LOGGER.warn("Error while closing supervisor '{}': {}", this.name, exceptionMessage(e));
    }
  }

  private long acquireConnection() {
    return this.connectionRetry.call(
        () -> {
          TransportConnection connection = this.transport.dial(this.uri, this.tls, this.name);
          this.metricsCollector.openConnection();
          long generation = this.resources.installConnection(connection, this.closing::get);
          if (generation == NO_GENERATION) {
            this.metricsCollector.closeConnection();
            Utils.maybeClose(
                connection,
                e ->
                    LOGGER.debug(
                        "Error while closing discarded connection: {}", exceptionMessage(e)));
            if (this.closing.get()) {
              throw new SupervisorException.SupervisorClosedException(
                  "Supervisor closed while connecting");
            } else {
              throw new SupervisorException.SupervisorInvalidStateException(
                  "Supervisor '%s' is already connected", this.name);
            }
          }
          connection.addCloseListener(
              notification ->
                  this.onClose(
                      ResourceKind.CONNECTION,
                      generation,
                      () -> this.connectionClosed(generation, notification)));
          LOGGER.debug("Connection #{} of supervisor '{}' installed", generation, this.name);
          return generation;
        },
        "connection to %s",
        this.maskedUri);
  }

  private void acquireChannel(long connectionGeneration) {
    SupervisedResources.Snapshot snapshot = this.resources.snapshot();
    TransportConnection connection = snapshot.connection();
    if (connection == null) {
      throw new SupervisorException.SupervisorChannelException("missing connection");
    } else if (snapshot.connectionGeneration() != connectionGeneration) {
      throw new SupervisorException.SupervisorChannelException(
          "Connection changed before the channel could be opened");
    }
    TransportChannel channel;
    try {
      channel = connection.openChannel();
    } catch (IOException | RuntimeException e) {
      throw channelFailure("Failed to open a channel", e, null, false);
    }
    try {
      channel.declareQueue(this.queue, true, false, false, false);
    } catch (IOException | RuntimeException e) {
      LOGGER.warn(
          "Failed to declare queue '{}' (supervisor '{}'), releasing connection: {}",
          this.queue,
          this.name,
          exceptionMessage(e));
      Exception cleanupError = this.releaseConnection(connectionGeneration);
      throw channelFailure("Failed to declare a queue", e, cleanupError, true);
    }
    this.metricsCollector.openChannel();
    long channelGeneration = this.resources.installChannel(connectionGeneration, channel);
    if (channelGeneration == NO_GENERATION) {
      this.metricsCollector.closeChannel();
      Utils.maybeClose(
          channel,
          e -> LOGGER.debug("Error while closing discarded channel: {}", exceptionMessage(e)));
      throw new SupervisorException.SupervisorChannelException(
          "Connection changed while opening the channel");
    }
    channel.addCloseListener(
        notification ->
            this.onClose(
                ResourceKind.CHANNEL,
                channelGeneration,
                () -> this.channelClosed(channelGeneration, connectionGeneration, notification)));
    LOGGER.debug(
        "Channel #{} of supervisor '{}' installed, queue '{}' declared",
        channelGeneration,
        this.name,
        this.queue);
  }

  /**
   * Detach the connection if it is still the given generation and close it.
   *
   * @return the error of the close operation, null if none
   */
  private Exception releaseConnection(long generation) {
    SupervisedResources.Snapshot detached = this.resources.detachConnection(generation);
    if (detached == null) {
      return null;
    }
    this.detached(detached);
    Utils.maybeClose(
        detached.channel(),
        e -> LOGGER.debug("Error while closing released channel: {}", exceptionMessage(e)));
    TransportConnection connection = detached.connection();
    if (connection.isClosed()) {
      return null;
    }
    try {
      connection.close();
      return null;
    } catch (Exception e) {
      LOGGER.warn(
          "Error while releasing connection of supervisor '{}': {}",
          this.name,
          exceptionMessage(e));
      return e;
    }
  }

  private void detached(SupervisedResources.Snapshot detached) {
    if (detached.channel() != null) {
      this.metricsCollector.closeChannel();
    }
    if (detached.connection() != null) {
      this.metricsCollector.closeConnection();
    }
  }

  private void onClose(ResourceKind kind, long generation, Runnable handler) {
    Runnable task =
        Utils.namedRunnable(
            handler, "%s-close-watcher-%s-%d", kind.label(), this.name, generation);
    try {
      this.executorService.submit(task);
    } catch (RejectedExecutionException e) {
      LOGGER.debug(
          "Could not handle {} closure of supervisor '{}', executor rejected the task",
          kind.label(),
          this.name);
    }
  }

  private void connectionClosed(long generation, CloseNotification notification) {
    this.connectionLock.lock();
    try {
      this.recoverConnection(generation, notification);
    } finally {
      this.connectionLock.unlock();
    }
  }

  private void recoverConnection(long generation, CloseNotification notification) {
    SupervisedResources.Snapshot detached = this.resources.detachConnection(generation);
    if (detached == null) {
      LOGGER.debug(
          "Ignoring closure of stale connection #{} of supervisor '{}'", generation, this.name);
      return;
    }
    this.detached(detached);
    if (notification.deliberate()) {
      LOGGER.debug(
          "Connection #{} of supervisor '{}' closed by the application", generation, this.name);
      this.unexpectedClose.shutdown();
      this.state(CLOSED);
      return;
    }
    LOGGER.info(
        "Connection of supervisor '{}' closed unexpectedly ({}), trying to reconnect",
        this.name,
        notification.reason());
    this.metricsCollector.recovery(ResourceKind.CONNECTION.metricsResource());
    this.state(RECOVERING, notification.cause());
    long newGeneration;
    try {
      newGeneration = this.acquireConnection();
    } catch (SupervisorException.SupervisorClosedException e) {
      LOGGER.debug("Supervisor '{}' closed during connection recovery", this.name);
      return;
    } catch (RuntimeException e) {
      this.recoveryFailed(ResourceKind.CONNECTION, e);
      return;
    }
    try {
      this.acquireChannel(newGeneration);
    } catch (RuntimeException e) {
      if (!(e instanceof SupervisorException.SupervisorChannelException
          && ((SupervisorException.SupervisorChannelException) e).connectionReleased())) {
        this.releaseConnection(newGeneration);
      }
      this.recoveryFailed(ResourceKind.CONNECTION, e);
      return;
    }
    if (!this.closing.get() && this.state(OPEN)) {
      LOGGER.info("Supervisor '{}' reconnected to {}", this.name, this.maskedUri);
    }
  }

  private void channelClosed(
      long generation, long connectionGeneration, CloseNotification notification) {
    TransportChannel detached = this.resources.detachChannel(generation);
    if (detached == null) {
      LOGGER.debug(
          "Ignoring closure of stale channel #{} of supervisor '{}'", generation, this.name);
      return;
    }
    this.metricsCollector.closeChannel();
    if (notification.deliberate()) {
      LOGGER.debug("Channel #{} of supervisor '{}' closed by the application", generation, name);
      return;
    }
    LOGGER.info(
        "Channel of supervisor '{}' closed unexpectedly ({}), opening a new one",
        this.name,
        notification.reason());
    this.metricsCollector.recovery(ResourceKind.CHANNEL.metricsResource());
    try {
      this.acquireChannel(connectionGeneration);
      LOGGER.info("Supervisor '{}' re-opened its channel", this.name);
    } catch (SupervisorException.SupervisorChannelException e) {
      this.recoveryFailed(
          e.connectionReleased() ? ResourceKind.CONNECTION : ResourceKind.CHANNEL, e);
    } catch (RuntimeException e) {
      this.recoveryFailed(ResourceKind.CHANNEL, e);
    }
  }

  private void recoveryFailed(ResourceKind kind, Exception cause) {
    if (this.closing.get()) {
      LOGGER.debug(
          "Supervisor '{}' closed during {} recovery: {}",
          this.name,
          kind.label(),
          exceptionMessage(cause));
    } else if (kind.escalates()) {
      LOGGER.warn(
          "Supervisor '{}' gave up recovering its {}: {}",
          this.name,
          kind.label(),
          exceptionMessage(cause));
      this.metricsCollector.recoveryAbandoned();
      this.unexpectedClose.post(UnexpectedCloseSignal.Event.RECOVERY_FAILED);
      this.state(CLOSED, cause);
    } else {
      LOGGER.warn(
          "Supervisor '{}' could not recover its {}: {}",
          this.name,
          kind.label(),
          exceptionMessage(cause));
    }
  }

  SupervisedResources.Snapshot resources() {
    return this.resources.snapshot();
  }

  @Override
  public String toString() {
    return "AmqpQueueSupervisor{name='" + this.name + "', queue='" + this.queue + "'}";
  }
}
