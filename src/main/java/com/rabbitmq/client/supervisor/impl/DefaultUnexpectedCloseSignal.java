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

import com.rabbitmq.client.supervisor.UnexpectedCloseSignal;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

final class DefaultUnexpectedCloseSignal implements UnexpectedCloseSignal {

  private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();
  private volatile boolean shutdown = false;

  /** Post an event, ignored once the signal is shut down. */
  synchronized void post(Event event) {
    if (event == Event.SHUTDOWN) {
      this.shutdown();
    } else if (!this.shutdown) {
      this.events.offer(event);
    }
  }

  synchronized void shutdown() {
    if (!this.shutdown) {
      this.shutdown = true;
      this.events.offer(Event.SHUTDOWN);
    }
  }

  @Override
  public Event take() throws InterruptedException {
    return this.sticky(this.events.take());
  }

  @Override
  public Event poll(Duration timeout) throws InterruptedException {
    return this.sticky(this.events.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
  }

  @Override
  public boolean isShutdown() {
    return this.shutdown;
  }

  // the shutdown event stays available to every subsequent wait
  private Event sticky(Event event) {
    if (event == Event.SHUTDOWN) {
      this.events.offer(Event.SHUTDOWN);
    }
    return event;
  }
}
