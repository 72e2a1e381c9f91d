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

import static com.rabbitmq.client.supervisor.impl.Assertions.assertThat;
import static com.rabbitmq.client.supervisor.impl.TestUtils.INSTANCE_ID;
import static com.rabbitmq.client.supervisor.impl.TestUtils.QUEUE;
import static com.rabbitmq.client.supervisor.impl.TestUtils.supervisorBuilder;
import static com.rabbitmq.client.supervisor.impl.TestUtils.sync;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.gson.Gson;
import com.rabbitmq.client.supervisor.BackOffDelayPolicy;
import com.rabbitmq.client.supervisor.QueueSupervisor;
import com.rabbitmq.client.supervisor.SupervisorException;
import com.rabbitmq.client.supervisor.UnexpectedCloseSignal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class AmqpQueueSupervisorTest {

  FakeTransport transport;
  QueueSupervisor supervisor;

  @BeforeEach
  void init() {
    this.transport = new FakeTransport();
  }

  @AfterEach
  void tearDown() {
    if (this.supervisor != null) {
      this.supervisor.closeQuietly();
    }
  }

  @Test
  void connectShouldOpenChannelAndDeclareDurableQueue() {
    supervisor = supervisorBuilder(transport).build();
    assertThat(supervisor).hasState(QueueSupervisor.State.OPENING).hasNoConnection();
    supervisor.connect();
    assertThat(supervisor).isOpen().hasConnection().hasChannel();
    assertThat(transport.dialCount).hasValue(1);
    assertThat(transport.lastChannel().declaredQueues).containsExactly(QUEUE);
    // durable, not auto-delete, not exclusive, wait for the broker
    assertThat(transport.lastChannel().declareFlags).containsExactly(true, false, false, false);
    assertThat(transport.lastConnectionName).isEqualTo(QUEUE);
  }

  @Test
  void connectShouldUseTlsByDefault() {
    supervisor = supervisorBuilder(transport).build();
    supervisor.connect();
    assertThat(transport.lastUri.getScheme()).isEqualTo("amqps");
    assertThat(transport.lastUri.getHost()).isEqualTo("broker.internal");
    assertThat(transport.lastUri.getPort()).isEqualTo(5671);
    assertThat(transport.lastUri.getRawUserInfo()).isEqualTo("wharf:s3cret");
    assertThat(transport.lastUri.getRawPath()).isEqualTo("/%2F");
    assertThat(transport.lastTls).isNotNull();
    assertThat(transport.lastTls.hostnameVerification()).isTrue();
    assertThat(transport.lastTls.protocols()).isNotEmpty().isSubsetOf("TLSv1.3", "TLSv1.2");
  }

  @Test
  void connectWithoutTlsShouldUsePlainScheme() {
    supervisor = supervisorBuilder(transport).disableTls(true).virtualHost("wharf").build();
    supervisor.connect();
    assertThat(transport.lastUri.getScheme()).isEqualTo("amqp");
    assertThat(transport.lastUri.getPort()).isEqualTo(5672);
    assertThat(transport.lastUri.getRawPath()).isEqualTo("/wharf");
    assertThat(transport.lastTls).isNull();
  }

  @Test
  void connectShouldRetryFailedDials() {
    List<Duration> delays = new CopyOnWriteArrayList<>();
    transport.dialFailures.set(2);
    supervisor =
        supervisorBuilder(transport)
            .backOffDelayPolicy(BackOffDelayPolicy.fixed(Duration.ofSeconds(3)))
            .sleeper(delays::add)
            .build();
    supervisor.connect();
    assertThat(supervisor).isOpen();
    assertThat(transport.dialCount).hasValue(3);
    assertThat(delays).containsExactly(Duration.ofSeconds(3), Duration.ofSeconds(3));
  }

  @Test
  void connectShouldFailAfterMaxAttempts() {
    List<Duration> delays = new CopyOnWriteArrayList<>();
    transport.failAllDials = true;
    supervisor =
        supervisorBuilder(transport)
            .maxConnectAttempts(4)
            .backOffDelayPolicy(BackOffDelayPolicy.fixed(Duration.ofSeconds(3)))
            .sleeper(delays::add)
            .build();
    assertThatThrownBy(() -> supervisor.connect())
        .isInstanceOf(SupervisorException.SupervisorConnectionException.class)
        .hasMessageContaining("4 attempt(s)");
    assertThat(transport.dialCount).hasValue(4);
    // no delay after the last attempt
    assertThat(delays).hasSize(3);
    assertThat(supervisor).hasState(QueueSupervisor.State.OPENING).hasNoConnection();
  }

  @Test
  void connectWithZeroAttemptsShouldNeverDial() {
    supervisor = supervisorBuilder(transport).maxConnectAttempts(0).build();
    assertThatThrownBy(() -> supervisor.connect())
        .isInstanceOf(SupervisorException.SupervisorConnectionException.class);
    assertThat(transport.dialCount).hasValue(0);
  }

  @Test
  void failedConnectCanBeRetried() {
    transport.failAllDials = true;
    supervisor = supervisorBuilder(transport).build();
    assertThatThrownBy(() -> supervisor.connect())
        .isInstanceOf(SupervisorException.SupervisorConnectionException.class);
    transport.failAllDials = false;
    supervisor.connect();
    assertThat(supervisor).isOpen().hasConnection().hasChannel();
  }

  @Test
  void connectShouldCloseConnectionWhenChannelCannotBeOpened() {
    transport.openChannelFailures.set(1);
    supervisor = supervisorBuilder(transport).build();
    assertThatThrownBy(() -> supervisor.connect())
        .isInstanceOf(SupervisorException.SupervisorChannelException.class)
        .hasMessageContaining("Failed to open a channel")
        .hasMessageContaining("Channel limit reached");
    assertThat(transport.lastConnection().closed).isTrue();
    assertThat(supervisor).hasState(QueueSupervisor.State.OPENING).hasNoConnection();

    supervisor.connect();
    assertThat(supervisor).isOpen().hasChannel();
    assertThat(transport.dialCount).hasValue(2);
  }

  @Test
  void connectShouldCloseConnectionWhenQueueCannotBeDeclared() {
    transport.declareFailures.set(1);
    supervisor = supervisorBuilder(transport).build();
    assertThatThrownBy(() -> supervisor.connect())
        .isInstanceOf(SupervisorException.SupervisorChannelException.class)
        .hasMessageContaining("Failed to declare a queue")
        .hasMessageContaining("PRECONDITION_FAILED");
    assertThat(transport.lastConnection().closed).isTrue();
    assertThat(supervisor).hasNoConnection().hasNoChannel();
  }

  @Test
  void connectShouldReportBothErrorsWhenConnectionCloseFailsAfterDeclareFailure() {
    transport.declareFailures.set(1);
    transport.failConnectionClose = true;
    supervisor = supervisorBuilder(transport).build();
    assertThatThrownBy(() -> supervisor.connect())
        .isInstanceOf(SupervisorException.SupervisorChannelException.class)
        .hasMessageContaining("Failed to declare a queue")
        .hasMessageContaining("close connection")
        .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
    transport.failConnectionClose = false;
  }

  @Test
  void connectShouldBeRejectedWhenAlreadyConnected() {
    supervisor = supervisorBuilder(transport).build();
    supervisor.connect();
    assertThatThrownBy(() -> supervisor.connect())
        .isInstanceOf(SupervisorException.SupervisorInvalidStateException.class)
        .hasMessageContaining("already connected");
    assertThat(transport.dialCount).hasValue(1);
  }

  @Test
  void connectAfterCloseShouldBeRejected() {
    supervisor = supervisorBuilder(transport).build();
    supervisor.close();
    assertThatThrownBy(() -> supervisor.connect())
        .isInstanceOf(SupervisorException.SupervisorClosedException.class);
    assertThat(transport.dialCount).hasValue(0);
  }

  @Test
  void closeDuringConnectionAttemptsShouldStopTheAttempts() throws Exception {
    transport.failAllDials = true;
    TestUtils.Sync sleeping = sync();
    CountDownLatch wakeUp = new CountDownLatch(1);
    supervisor =
        supervisorBuilder(transport)
            .maxConnectAttempts(10)
            .backOffDelayPolicy(BackOffDelayPolicy.fixed(Duration.ofSeconds(1)))
            .sleeper(
                delay -> {
                  sleeping.down();
                  wakeUp.await(10, TimeUnit.SECONDS);
                })
            .build();
    ExecutorService executorService = Executors.newSingleThreadExecutor();
    try {
      Future<?> connect = executorService.submit(() -> supervisor.connect());
      assertThat(sleeping).completes();
      supervisor.close();
      wakeUp.countDown();
      assertThatThrownBy(() -> connect.get(10, TimeUnit.SECONDS))
          .isInstanceOf(ExecutionException.class)
          .hasCauseInstanceOf(SupervisorException.SupervisorClosedException.class);
      assertThat(transport.dialCount).hasValue(1);
      assertThat(supervisor).isClosed().hasNoConnection();
    } finally {
      executorService.shutdownNow();
    }
  }

  @Test
  void publishShouldSendJsonWithInstanceIdAndTimestampHeaders() {
    Instant now = Instant.parse("2026-03-01T10:15:30Z");
    supervisor =
        supervisorBuilder(transport).clock(Clock.fixed(now, ZoneOffset.UTC)).build();
    supervisor.connect();
    DeploymentEvent event = new DeploymentEvent("checkout", 12, "deployed");
    supervisor.publish(event);

    List<FakeTransport.Published> published = transport.lastChannel().published;
    assertThat(published).hasSize(1);
    FakeTransport.Published message = published.get(0);
    assertThat(message.exchange).isEmpty();
    assertThat(message.routingKey).isEqualTo(QUEUE);
    assertThat(message.mandatory).isFalse();
    assertThat(message.immediate).isFalse();
    assertThat(message.message.contentType()).isEqualTo("application/json");
    assertThat(message.message.headers())
        .containsOnlyKeys("WharfInstanceId", "Timestamp")
        .containsEntry("WharfInstanceId", INSTANCE_ID)
        .containsEntry("Timestamp", Date.from(now));
    assertThat(new String(message.message.body(), StandardCharsets.UTF_8))
        .isEqualTo(new Gson().toJson(event))
        .contains("\"service\":\"checkout\"");
  }

  @Test
  void publishRawBodyShouldBeSentAsIs() {
    supervisor = supervisorBuilder(transport).build();
    supervisor.connect();
    byte[] body = "{\"status\":\"ok\"}".getBytes(StandardCharsets.UTF_8);
    supervisor.publish(body);
    assertThat(transport.lastChannel().published.get(0).message.body()).isEqualTo(body);
  }

  @Test
  void publishWithoutConnectionShouldFailWithoutPublishing() {
    supervisor = supervisorBuilder(transport).build();
    assertThatThrownBy(() -> supervisor.publish(Map.of("status", "ok")))
        .isInstanceOf(SupervisorException.SupervisorInvalidStateException.class)
        .hasMessageContaining("connection is missing");
    assertThat(transport.dialCount).hasValue(0);
  }

  @Test
  void publishOnClosedConnectionShouldFailWithoutPublishing() {
    supervisor = supervisorBuilder(transport).build();
    supervisor.connect();
    // closed, but the closure has not been handled yet
    transport.lastConnection().closed = true;
    assertThatThrownBy(() -> supervisor.publish(Map.of("status", "ok")))
        .isInstanceOf(SupervisorException.SupervisorInvalidStateException.class)
        .hasMessageContaining("connection is closed");
    assertThat(transport.lastChannel().published).isEmpty();
  }

  @Test
  void publishShouldFailWhenPayloadCannotBeSerialized() {
    supervisor = supervisorBuilder(transport).build();
    supervisor.connect();
    assertThatThrownBy(() -> supervisor.publish(Map.of("ratio", Double.NaN)))
        .isInstanceOf(SupervisorException.SupervisorSerializationException.class)
        .hasCauseInstanceOf(IllegalArgumentException.class);
    assertThat(transport.lastChannel().published).isEmpty();
  }

  @Test
  void publishShouldUseConfiguredCodec() {
    supervisor =
        supervisorBuilder(transport)
            .messageCodec(payload -> ("\"" + payload + "\"").getBytes(StandardCharsets.UTF_8))
            .build();
    supervisor.connect();
    supervisor.publish("deployed");
    assertThat(transport.lastChannel().published.get(0).message.body())
        .isEqualTo("\"deployed\"".getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void publishShouldReportTransportErrors() {
    supervisor = supervisorBuilder(transport).build();
    supervisor.connect();
    transport.failPublish = true;
    assertThatThrownBy(() -> supervisor.publish(Map.of("status", "ok")))
        .isInstanceOf(SupervisorException.SupervisorPublishException.class)
        .hasMessageContaining("Broken pipe");
    transport.failPublish = false;
    supervisor.publish(Map.of("status", "ok"));
    assertThat(transport.lastChannel().published).hasSize(1);
  }

  @Test
  void closeShouldCloseChannelThenConnection() throws Exception {
    supervisor = supervisorBuilder(transport).build();
    supervisor.connect();
    supervisor.close();
    assertThat(transport.events)
        .containsSubsequence("connection opened 1", "close channel 1.1", "close connection 1");
    assertThat(supervisor).isClosed().hasNoConnection().hasNoChannel();
    assertThat(supervisor.unexpectedClose().isShutdown()).isTrue();
    assertThat(supervisor.unexpectedClose().poll(Duration.ofSeconds(1)))
        .isEqualTo(UnexpectedCloseSignal.Event.SHUTDOWN);
  }

  @Test
  void closeShouldBeIdempotent() {
    supervisor = supervisorBuilder(transport).build();
    supervisor.connect();
    supervisor.close();
    supervisor.close();
    assertThat(transport.events.stream().filter(e -> e.startsWith("close"))).hasSize(2);
  }

  @Test
  void closeWithoutConnectionShouldSucceed() {
    supervisor = supervisorBuilder(transport).build();
    supervisor.close();
    assertThat(supervisor).isClosed();
    assertThat(transport.events).isEmpty();
  }

  @Test
  void closeShouldCloseConnectionEvenIfChannelCloseFails() {
    supervisor = supervisorBuilder(transport).build();
    supervisor.connect();
    transport.failChannelClose = true;
    transport.failConnectionClose = true;
    assertThatThrownBy(() -> supervisor.close())
        .isInstanceOf(SupervisorException.class)
        .hasMessageContaining("Error while closing channel")
        .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
    assertThat(transport.events).containsSubsequence("close channel 1.1", "close connection 1");
    assertThat(supervisor).isClosed();
    transport.failChannelClose = false;
    transport.failConnectionClose = false;
  }

  @Test
  void closeQuietlyShouldNotThrow() {
    supervisor = supervisorBuilder(transport).build();
    supervisor.connect();
    transport.failConnectionClose = true;
    supervisor.closeQuietly();
    assertThat(supervisor).isClosed();
    assertThat(transport.lastConnection().closed).isTrue();
    transport.failConnectionClose = false;
  }

  @Test
  void publishAfterCloseShouldFail() {
    supervisor = supervisorBuilder(transport).build();
    supervisor.connect();
    supervisor.close();
    assertThatThrownBy(() -> supervisor.publish(Map.of("status", "ok")))
        .isInstanceOf(SupervisorException.SupervisorInvalidStateException.class);
  }

  @Test
  void buildShouldFailWhenInstanceIdVariableIsNotSet() {
    assertThatThrownBy(() -> supervisorBuilder(transport).environment(name -> null).build())
        .isInstanceOf(SupervisorException.SupervisorConfigurationException.class)
        .hasMessage("Environment variable WHARF_INSTANCE is not set");
    assertThat(transport.dialCount).hasValue(0);
  }

  @Test
  void emptyInstanceIdShouldBeAccepted() {
    supervisor = supervisorBuilder(transport).environment(name -> "").build();
    supervisor.connect();
    supervisor.publish(Map.of("status", "ok"));
    assertThat(transport.lastChannel().published.get(0).message.headers())
        .containsEntry("WharfInstanceId", "");
  }

  @Test
  void instanceIdVariableCanBeChanged() {
    Map<String, String> environment = Map.of("APP_INSTANCE", "app-7");
    supervisor =
        supervisorBuilder(transport)
            .instanceIdVariable("APP_INSTANCE")
            .environment(environment::get)
            .build();
    supervisor.connect();
    supervisor.publish(Map.of("status", "ok"));
    assertThat(transport.lastChannel().published.get(0).message.headers())
        .containsEntry("WharfInstanceId", "app-7");
  }

  @Test
  void stateListenersShouldBeCalledOnTransitions() {
    List<QueueSupervisor.State> states = new CopyOnWriteArrayList<>();
    supervisor =
        supervisorBuilder(transport)
            .listeners(
                context -> states.add(context.currentState()),
                context -> {
                  throw new IllegalStateException("listener error");
                })
            .build();
    supervisor.connect();
    supervisor.close();
    assertThat(states)
        .containsExactly(
            QueueSupervisor.State.OPENING,
            QueueSupervisor.State.OPEN,
            QueueSupervisor.State.CLOSING,
            QueueSupervisor.State.CLOSED);
  }

  static class DeploymentEvent {

    private final String service;
    private final int version;
    private final String status;

    DeploymentEvent(String service, int version, String status) {
      this.service = service;
      this.version = version;
      this.status = status;
    }
  }
}
