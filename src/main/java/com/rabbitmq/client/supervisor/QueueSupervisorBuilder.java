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

import com.rabbitmq.client.supervisor.metrics.MetricsCollector;
import com.rabbitmq.client.supervisor.transport.Transport;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/** Builder for {@link QueueSupervisor} instances. */
public interface QueueSupervisorBuilder {

  /**
   * Broker host.
   *
   * <p>Default is <code>localhost</code>.
   *
   * @param host host
   * @return this builder instance
   */
  QueueSupervisorBuilder host(String host);

  /**
   * Broker port.
   *
   * <p>Default is 5671 with TLS and 5672 without TLS.
   *
   * @param port port
   * @return this builder instance
   */
  QueueSupervisorBuilder port(int port);

  /**
   * Username to authenticate with.
   *
   * @param username username
   * @return this builder instance
   */
  QueueSupervisorBuilder username(String username);

  /**
   * Password to authenticate with.
   *
   * @param password password
   * @return this builder instance
   */
  QueueSupervisorBuilder password(String password);

  /**
   * Virtual host to connect to.
   *
   * <p>Default is <code>/</code>.
   *
   * @param virtualHost virtual host
   * @return this builder instance
   */
  QueueSupervisorBuilder virtualHost(String virtualHost);

  /**
   * The durable queue to declare and publish to. Required.
   *
   * @param queue queue name
   * @return this builder instance
   */
  QueueSupervisorBuilder queue(String queue);

  /**
   * Disable TLS.
   *
   * <p>TLS (1.2 or more) is used by default.
   *
   * @param disableTls true to connect without TLS
   * @return this builder instance
   */
  QueueSupervisorBuilder disableTls(boolean disableTls);

  /**
   * Maximum number of connection attempts, for the initial connection and for each recovery.
   *
   * <p>Default is 5. 0 means no connection is ever attempted.
   *
   * @param maxConnectAttempts maximum number of attempts
   * @return this builder instance
   */
  QueueSupervisorBuilder maxConnectAttempts(int maxConnectAttempts);

  /**
   * Delay policy between connection attempts.
   *
   * <p>Default is a fixed delay of 3 seconds.
   *
   * @param backOffDelayPolicy delay policy
   * @return this builder instance
   */
  QueueSupervisorBuilder backOffDelayPolicy(BackOffDelayPolicy backOffDelayPolicy);

  /**
   * Name of the environment variable holding the identifier of the process instance.
   *
   * <p>Default is <code>WHARF_INSTANCE</code>. The variable must be set, an empty value is
   * accepted.
   *
   * @param variable environment variable name
   * @return this builder instance
   */
  QueueSupervisorBuilder instanceIdVariable(String variable);

  /**
   * Lookup function for environment variables.
   *
   * <p>Default is {@link System#getenv(String)}.
   *
   * @param environment lookup function, returns null for undefined variables
   * @return this builder instance
   */
  QueueSupervisorBuilder environment(Function<String, String> environment);

  /**
   * Name of the supervisor, used in thread names, logs, and as the client-provided connection
   * name.
   *
   * @param name name
   * @return this builder instance
   */
  QueueSupervisorBuilder name(String name);

  /**
   * Codec to serialize messages.
   *
   * <p>Default uses Gson.
   *
   * @param codec codec
   * @return this builder instance
   */
  QueueSupervisorBuilder messageCodec(MessageCodec codec);

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector the metrics collector
   * @return this builder instance
   * @see com.rabbitmq.client.supervisor.metrics.MicrometerMetricsCollector
   */
  QueueSupervisorBuilder metricsCollector(MetricsCollector metricsCollector);

  /**
   * Clock for the publish timestamp header.
   *
   * @param clock clock
   * @return this builder instance
   */
  QueueSupervisorBuilder clock(Clock clock);

  /**
   * Executor service for close watchers and recovery.
   *
   * <p>The supervisor creates its own by default and shuts it down when it is closed. An external
   * executor service is not shut down by the supervisor.
   *
   * @param executorService executor service
   * @return this builder instance
   */
  QueueSupervisorBuilder executorService(ExecutorService executorService);

  /**
   * Transport to use.
   *
   * <p>Default uses the RabbitMQ Java client (AMQP 0-9-1).
   *
   * @param transport transport
   * @return this builder instance
   */
  QueueSupervisorBuilder transport(Transport transport);

  /**
   * Add {@link QueueSupervisor.StateListener}s to the supervisor.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  QueueSupervisorBuilder listeners(QueueSupervisor.StateListener... listeners);

  /**
   * Validate the configuration and create the supervisor.
   *
   * <p>No network activity happens here, see {@link QueueSupervisor#connect()}.
   *
   * @return the supervisor
   * @throws SupervisorException.SupervisorConfigurationException if the configuration is invalid
   *     or the instance identifier variable is not set
   */
  QueueSupervisor build();
}
