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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsCollector} implementation using <a href="https://micrometer.io/">Micrometer</a>.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final AtomicLong connections;
  private final AtomicLong channels;
  private final Counter publish, publishFailures;
  private final Counter connectionRecoveries, channelRecoveries, abandonedRecoveries;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "rabbitmq.supervisor");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.connections = registry.gauge(prefix + ".connections", tags, new AtomicLong(0));
    this.channels = registry.gauge(prefix + ".channels", tags, new AtomicLong(0));
    this.publish = registry.counter(prefix + ".published", tags);
    this.publishFailures = registry.counter(prefix + ".publish_failures", tags);
    this.connectionRecoveries = registry.counter(prefix + ".connection_recoveries", tags);
    this.channelRecoveries = registry.counter(prefix + ".channel_recoveries", tags);
    this.abandonedRecoveries = registry.counter(prefix + ".abandoned_recoveries", tags);
  }

  @Override
  public void openConnection() {
    this.connections.incrementAndGet();
  }

  @Override
  public void closeConnection() {
    this.connections.decrementAndGet();
  }

  @Override
  public void openChannel() {
    this.channels.incrementAndGet();
  }

  @Override
  public void closeChannel() {
    this.channels.decrementAndGet();
  }

  @Override
  public void publish() {
    this.publish.increment();
  }

  @Override
  public void publishFailure() {
    this.publishFailures.increment();
  }

  @Override
  public void recovery(Resource resource) {
    switch (resource) {
      case CONNECTION:
        this.connectionRecoveries.increment();
        break;
      case CHANNEL:
        this.channelRecoveries.increment();
        break;
      default:
        break;
    }
  }

  @Override
  public void recoveryAbandoned() {
    this.abandonedRecoveries.increment();
  }
}
