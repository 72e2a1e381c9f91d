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

import static com.rabbitmq.client.supervisor.impl.SupervisedResources.NO_GENERATION;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.rabbitmq.client.supervisor.transport.TransportChannel;
import com.rabbitmq.client.supervisor.transport.TransportConnection;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

public class SupervisedResourcesTest {

  SupervisedResources resources = new SupervisedResources();
  TransportConnection connection = mock(TransportConnection.class);
  TransportChannel channel = mock(TransportChannel.class);

  @Test
  void installShouldIncrementGenerations() {
    long connectionGeneration = resources.installConnection(connection, () -> false);
    assertThat(connectionGeneration).isEqualTo(1);
    assertThat(resources.installChannel(connectionGeneration, channel)).isEqualTo(1);

    SupervisedResources.Snapshot detached = resources.detachConnection(connectionGeneration);
    assertThat(detached.connection()).isSameAs(connection);
    assertThat(detached.channel()).isSameAs(channel);

    long nextGeneration = resources.installConnection(connection, () -> false);
    assertThat(nextGeneration).isEqualTo(2);
    assertThat(resources.installChannel(nextGeneration, channel)).isEqualTo(2);
  }

  @Test
  void installConnectionShouldBeRejectedWhenClosingOrAlreadyInstalled() {
    assertThat(resources.installConnection(connection, () -> true)).isEqualTo(NO_GENERATION);
    assertThat(resources.snapshot().connection()).isNull();
    assertThat(resources.installConnection(connection, () -> false)).isEqualTo(1);
    assertThat(resources.installConnection(mock(TransportConnection.class), () -> false))
        .isEqualTo(NO_GENERATION);
    assertThat(resources.snapshot().connection()).isSameAs(connection);
  }

  @Test
  void installChannelShouldBeRejectedOnStaleConnectionGeneration() {
    assertThat(resources.installChannel(1, channel)).isEqualTo(NO_GENERATION);
    long first = resources.installConnection(connection, () -> false);
    resources.detachConnection(first);
    long second = resources.installConnection(connection, () -> false);
    assertThat(resources.installChannel(first, channel)).isEqualTo(NO_GENERATION);
    assertThat(resources.snapshot().channel()).isNull();
    assertThat(resources.installChannel(second, channel)).isPositive();
    assertThat(resources.installChannel(second, mock(TransportChannel.class)))
        .isEqualTo(NO_GENERATION);
  }

  @Test
  void detachShouldIgnoreStaleGenerations() {
    long connectionGeneration = resources.installConnection(connection, () -> false);
    long channelGeneration = resources.installChannel(connectionGeneration, channel);
    assertThat(resources.detachChannel(channelGeneration + 1)).isNull();
    assertThat(resources.detachConnection(connectionGeneration + 1)).isNull();
    assertThat(resources.snapshot().channel()).isSameAs(channel);

    assertThat(resources.detachChannel(channelGeneration)).isSameAs(channel);
    assertThat(resources.detachChannel(channelGeneration)).isNull();
    assertThat(resources.snapshot().connection()).isSameAs(connection);

    assertThat(resources.detachConnection(connectionGeneration)).isNotNull();
    assertThat(resources.detachConnection(connectionGeneration)).isNull();
  }

  @Test
  void detachAllShouldReturnEmptySnapshotWhenNothingInstalled() {
    assertThat(resources.detachAll().isEmpty()).isTrue();
    long generation = resources.installConnection(connection, () -> false);
    resources.installChannel(generation, channel);
    SupervisedResources.Snapshot detached = resources.detachAll();
    assertThat(detached.connection()).isSameAs(connection);
    assertThat(detached.channel()).isSameAs(channel);
    assertThat(resources.snapshot().isEmpty()).isTrue();
  }

  @Test
  void channelShouldNeverBeVisibleWithoutConnection() throws Exception {
    int threads = 4;
    ExecutorService executor = Executors.newFixedThreadPool(threads + 1);
    AtomicBoolean running = new AtomicBoolean(true);
    AtomicInteger violations = new AtomicInteger(0);
    AtomicInteger checks = new AtomicInteger(0);
    try {
      for (int i = 0; i < threads; i++) {
        executor.submit(
            () -> {
              while (running.get()) {
                long generation = resources.installConnection(connection, () -> false);
                if (generation != NO_GENERATION) {
                  resources.installChannel(generation, channel);
                  resources.detachConnection(generation);
                } else {
                  resources.detachAll();
                }
              }
            });
      }
      executor.submit(
          () -> {
            while (running.get()) {
              resources.callUnderLock(
                  (c, ch) -> {
                    if (ch != null && c == null) {
                      violations.incrementAndGet();
                    }
                    return null;
                  });
              SupervisedResources.Snapshot snapshot = resources.snapshot();
              if (snapshot.channel() != null && snapshot.connection() == null) {
                violations.incrementAndGet();
              }
              checks.incrementAndGet();
            }
            return null;
          });
      TestUtils.waitAtMost(() -> checks.get() > 10_000);
    } finally {
      running.set(false);
      executor.shutdown();
      assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    }
    assertThat(violations).hasValue(0);
  }
}
