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

import java.time.Duration;

/**
 * Contract to determine the delay between two connection attempts.
 *
 * <p>The number of attempts is bounded by the supervisor settings, not by the policy.
 */
@FunctionalInterface
public interface BackOffDelayPolicy {

  /** Delay used when no policy is set. */
  Duration DEFAULT_DELAY = Duration.ofSeconds(3);

  /**
   * Returns the delay to wait after a given failed attempt.
   *
   * @param failedAttempt number of the attempt that just failed, starting at 1
   * @return the delay
   */
  Duration delay(int failedAttempt);

  /**
   * Policy with a fixed delay.
   *
   * @param delay the fixed delay
   * @return fixed-delay policy
   */
  static BackOffDelayPolicy fixed(Duration delay) {
    return new FixedBackOffDelayPolicy(delay);
  }

  /**
   * Policy with no delay at all, useful for tests.
   *
   * @return no-delay policy
   */
  static BackOffDelayPolicy none() {
    return fixed(Duration.ZERO);
  }

  final class FixedBackOffDelayPolicy implements BackOffDelayPolicy {

    private final Duration delay;

    private FixedBackOffDelayPolicy(Duration delay) {
      if (delay == null || delay.isNegative()) {
        throw new IllegalArgumentException("Delay must be positive or zero");
      }
      this.delay = delay;
    }

    @Override
    public Duration delay(int failedAttempt) {
      return this.delay;
    }

    @Override
    public String toString() {
      return "FixedBackOffDelayPolicy{delay=" + delay + '}';
    }
  }
}
