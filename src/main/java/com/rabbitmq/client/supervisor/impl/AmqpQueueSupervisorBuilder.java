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

import com.rabbitmq.client.supervisor.BackOffDelayPolicy;
import com.rabbitmq.client.supervisor.MessageCodec;
import com.rabbitmq.client.supervisor.QueueSupervisor;
import com.rabbitmq.client.supervisor.QueueSupervisorBuilder;
import com.rabbitmq.client.supervisor.SupervisorException;
import com.rabbitmq.client.supervisor.metrics.MetricsCollector;
import com.rabbitmq.client.supervisor.metrics.NoOpMetricsCollector;
import com.rabbitmq.client.supervisor.transport.TlsConfiguration;
import com.rabbitmq.client.supervisor.transport.Transport;
import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Builder to create a {@link QueueSupervisor} instance.
 *
 * <pre>{@code
 * QueueSupervisor supervisor = new AmqpQueueSupervisorBuilder()
 *     .host("broker.example.com")
 *     .username("app")
 *     .password("secret")
 *     .queue("events")
 *     .build();
 * supervisor.connect();
 * }</pre>
 */
public class AmqpQueueSupervisorBuilder implements QueueSupervisorBuilder {

  static final String DEFAULT_HOST = "localhost";
  static final int DEFAULT_PORT = 5672;
  static final int DEFAULT_TLS_PORT = 5671;
  static final String DEFAULT_VIRTUAL_HOST = "/";
  static final int DEFAULT_MAX_CONNECT_ATTEMPTS = 5;
  static final String DEFAULT_INSTANCE_ID_VARIABLE = "WHARF_INSTANCE";

  private String host = DEFAULT_HOST;
  private int port = -1;
  private String username;
  private String password;
  private String virtualHost = DEFAULT_VIRTUAL_HOST;
  private String queue;
  private boolean disableTls = false;
  private int maxConnectAttempts = DEFAULT_MAX_CONNECT_ATTEMPTS;
  private BackOffDelayPolicy backOffDelayPolicy =
      BackOffDelayPolicy.fixed(BackOffDelayPolicy.DEFAULT_DELAY);
  private String instanceIdVariable = DEFAULT_INSTANCE_ID_VARIABLE;
  private Function<String, String> environment = System::getenv;
  private String name;
  private MessageCodec messageCodec = new GsonMessageCodec();
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private Clock clock = Clock.systemUTC();
  private ExecutorService executorService;
  private Transport transport;
  private final List<QueueSupervisor.StateListener> listeners = new ArrayList<>();
  private ConnectionRetry.Sleeper sleeper = ConnectionRetry.THREAD_SLEEPER;
  private String instanceId;

  public AmqpQueueSupervisorBuilder() {}

  @Override
  public AmqpQueueSupervisorBuilder host(String host) {
    this.host = host;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder port(int port) {
    this.port = port;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder username(String username) {
    this.username = username;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder password(String password) {
    this.password = password;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder virtualHost(String virtualHost) {
    this.virtualHost = virtualHost;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder queue(String queue) {
    this.queue = queue;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder disableTls(boolean disableTls) {
    this.disableTls = disableTls;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder maxConnectAttempts(int maxConnectAttempts) {
    this.maxConnectAttempts = maxConnectAttempts;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder backOffDelayPolicy(BackOffDelayPolicy backOffDelayPolicy) {
    this.backOffDelayPolicy = backOffDelayPolicy;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder instanceIdVariable(String variable) {
    this.instanceIdVariable = variable;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder environment(Function<String, String> environment) {
    this.environment = environment;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder name(String name) {
    this.name = name;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder messageCodec(MessageCodec codec) {
    this.messageCodec = codec;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector = metricsCollector;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder clock(Clock clock) {
    this.clock = clock;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder executorService(ExecutorService executorService) {
    this.executorService = executorService;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder transport(Transport transport) {
    this.transport = transport;
    return this;
  }

  @Override
  public AmqpQueueSupervisorBuilder listeners(QueueSupervisor.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(Arrays.asList(listeners));
    }
    return this;
  }

  AmqpQueueSupervisorBuilder sleeper(ConnectionRetry.Sleeper sleeper) {
    this.sleeper = sleeper;
    return this;
  }

  @Override
  public QueueSupervisor build() {
    this.validate();
    String value = this.environment.apply(this.instanceIdVariable);
    if (value == null) {
      throw new SupervisorException.SupervisorConfigurationException(
          "Environment variable %s is not set", this.instanceIdVariable);
    }
    this.instanceId = value;
    return new AmqpQueueSupervisor(this);
  }

  private void validate() {
    if (this.queue == null) {
      throw new SupervisorException.SupervisorConfigurationException("Queue name must be set");
    }
    if (this.host == null || this.host.isBlank()) {
      throw new SupervisorException.SupervisorConfigurationException("Host must be set");
    }
    int effectivePort = this.effectivePort();
    if (effectivePort < 1 || effectivePort > 65535) {
      throw new SupervisorException.SupervisorConfigurationException(
          "Port must be between 1 and 65535, got %d", effectivePort);
    }
    if (this.maxConnectAttempts < 0) {
      throw new SupervisorException.SupervisorConfigurationException(
          "Max connect attempts must be positive or zero, got %d", this.maxConnectAttempts);
    }
    if (this.backOffDelayPolicy == null) {
      throw new SupervisorException.SupervisorConfigurationException(
          "Back-off delay policy must be set");
    }
    if (this.instanceIdVariable == null || this.environment == null) {
      throw new SupervisorException.SupervisorConfigurationException(
          "Instance identifier variable and environment must be set");
    }
    if (this.messageCodec == null || this.metricsCollector == null || this.clock == null) {
      throw new SupervisorException.SupervisorConfigurationException(
          "Message codec, metrics collector, and clock must be set");
    }
  }

  private int effectivePort() {
    if (this.port == -1) {
      return this.disableTls ? DEFAULT_PORT : DEFAULT_TLS_PORT;
    } else {
      return this.port;
    }
  }

  URI uri() {
    return UriUtils.brokerUri(
        !this.disableTls,
        this.username,
        this.password,
        this.host,
        this.effectivePort(),
        this.virtualHost);
  }

  TlsConfiguration tlsConfiguration() {
    return this.disableTls ? null : TlsUtils.defaultTlsConfiguration();
  }

  String queue() {
    return this.queue;
  }

  String instanceId() {
    return this.instanceId;
  }

  String name() {
    return this.name == null ? this.queue : this.name;
  }

  int maxConnectAttempts() {
    return this.maxConnectAttempts;
  }

  BackOffDelayPolicy backOffDelayPolicy() {
    return this.backOffDelayPolicy;
  }

  ConnectionRetry.Sleeper sleeper() {
    return this.sleeper;
  }

  MessageCodec messageCodec() {
    return this.messageCodec;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  Clock clock() {
    return this.clock;
  }

  ExecutorService executorService() {
    return this.executorService;
  }

  Transport transport() {
    return this.transport == null ? new AmqpClientTransport() : this.transport;
  }

  List<QueueSupervisor.StateListener> listeners() {
    return new ArrayList<>(this.listeners);
  }
}
