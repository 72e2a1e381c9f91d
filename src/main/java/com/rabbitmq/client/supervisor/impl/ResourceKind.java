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

import com.rabbitmq.client.supervisor.metrics.MetricsCollector;
import java.util.Locale;

/** Supervised resource kinds, with what a failed recovery of each leads to. */
enum ResourceKind {
  /** A lost connection that cannot be re-established is reported on the close signal. */
  CONNECTION(true, MetricsCollector.Resource.CONNECTION),
  /** A lost channel that cannot be re-opened is only logged. */
  CHANNEL(false, MetricsCollector.Resource.CHANNEL);

  private final boolean escalates;
  private final MetricsCollector.Resource metricsResource;

  ResourceKind(boolean escalates, MetricsCollector.Resource metricsResource) {
    this.escalates = escalates;
    this.metricsResource = metricsResource;
  }

  boolean escalates() {
    return this.escalates;
  }

  MetricsCollector.Resource metricsResource() {
    return this.metricsResource;
  }

  String label() {
    return this.name().toLowerCase(Locale.ENGLISH);
  }
}
