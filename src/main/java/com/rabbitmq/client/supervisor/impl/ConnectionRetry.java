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

import static com.rabbitmq.client.supervisor.impl.ExceptionUtils.exceptionMessage;
import static java.lang.String.format;

import com.rabbitmq.client.supervisor.BackOffDelayPolicy;
import com.rabbitmq.client.supervisor.SupervisorException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Bounded retry loop to establish a transport connection. */
final class ConnectionRetry {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionRetry.class);

  static final Sleeper THREAD_SLEEPER = delay -> Thread.sleep(delay.toMillis());

  private final int maxAttempts;
  private final BackOffDelayPolicy delayPolicy;
  private final Sleeper sleeper;
  private final BooleanSupplier cancelled;
  private final Predicate<Exception> retryCondition;

  ConnectionRetry(
      int maxAttempts, BackOffDelayPolicy delayPolicy, Sleeper sleeper, BooleanSupplier cancelled) {
    this(maxAttempts, delayPolicy, sleeper, cancelled, ExceptionUtils::isRetryable);
  }

  ConnectionRetry(
      int maxAttempts,
      BackOffDelayPolicy delayPolicy,
      Sleeper sleeper,
      BooleanSupplier cancelled,
      Predicate<Exception> retryCondition) {
    this.maxAttempts = maxAttempts;
    this.delayPolicy = delayPolicy;
    this.sleeper = sleeper;
    this.cancelled = cancelled;
    this.retryCondition = retryCondition;
  }

  /**
   * Call the operation until it succeeds, the attempts are exhausted, or the loop is cancelled.
   *
   * @throws SupervisorException.SupervisorConnectionException if all the attempts failed
   * @throws SupervisorException.SupervisorClosedException if the loop was cancelled
   */
  <T> T call(Callable<T> operation, String format, Object... args) {
    String description = format(format, args);
    int attempt = 0;
    Exception lastException = null;
    Utils.StopWatch stopWatch = new Utils.StopWatch();
    boolean keepTrying = this.maxAttempts > 0;
    while (keepTrying) {
      if (this.cancelled.getAsBoolean()) {
        LOGGER.debug("Operation '{}' cancelled after {} attempt(s)", description, attempt);
        throw new SupervisorException.SupervisorClosedException(
            format("Operation '%s' cancelled, supervisor is closed", description), lastException);
      }
      if (Thread.currentThread().isInterrupted()) {
        lastException = new InterruptedException("Interrupted before attempt #" + (attempt + 1));
        break;
      }
      try {
        attempt++;
        LOGGER.debug("Starting attempt #{} for operation '{}'", attempt, description);
        T result = operation.call();
        LOGGER.debug(
            "Operation '{}' completed in {} ms after {} attempt(s)",
            description,
            stopWatch.stop().toMillis(),
            attempt);
        return result;
      } catch (Exception e) {
        lastException = e;
        if (this.retryCondition.test(e)) {
          LOGGER.warn(
              "Attempt #{}/{} for operation '{}' failed: {}",
              attempt,
              this.maxAttempts,
              description,
              exceptionMessage(e));
          if (attempt >= this.maxAttempts) {
            keepTrying = false;
          } else {
            Duration delay = this.delayPolicy.delay(attempt);
            if (!delay.isZero()) {
              try {
                this.sleeper.sleep(delay);
              } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                lastException = ex;
                keepTrying = false;
              }
            }
          }
        } else {
          keepTrying = false;
        }
      }
    }
    if (lastException instanceof SupervisorException.SupervisorInvalidStateException) {
      throw (SupervisorException.SupervisorInvalidStateException) lastException;
    } else if (this.cancelled.getAsBoolean()) {
      throw new SupervisorException.SupervisorClosedException(
          format("Operation '%s' cancelled, supervisor is closed", description), lastException);
    }
    String message =
        this.maxAttempts == 0
            ? "Failed to connect to RabbitMQ: no connection attempt allowed"
            : format(
                "Failed to connect to RabbitMQ: %s (%d attempt(s))",
                exceptionMessage(lastException), attempt);
    LOGGER.debug(message);
    throw new SupervisorException.SupervisorConnectionException(message, lastException);
  }

  /** Waits between two attempts. */
  @FunctionalInterface
  interface Sleeper {

    void sleep(Duration delay) throws InterruptedException;
  }
}
