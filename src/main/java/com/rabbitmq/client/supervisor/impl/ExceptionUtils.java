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

import com.rabbitmq.client.supervisor.SupervisorException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static SupervisorException convert(Exception e, String format, Object... args) {
    if (e instanceof SupervisorException) {
      return (SupervisorException) e;
    }
    return new SupervisorException(String.format(format, args), e);
  }

  /**
   * Error of a channel operation, with the error of the connection release that followed, if any.
   */
  static SupervisorException.SupervisorChannelException channelFailure(
      String operation, Exception error, Exception cleanupError, boolean connectionReleased) {
    SupervisorException.SupervisorChannelException result;
    if (cleanupError == null) {
      result =
          new SupervisorException.SupervisorChannelException(
              String.format("%s: %s", operation, exceptionMessage(error)),
              error,
              connectionReleased);
    } else {
      result =
          new SupervisorException.SupervisorChannelException(
              String.format(
                  "%s: %s and close connection: %s",
                  operation, exceptionMessage(error), exceptionMessage(cleanupError)),
              error,
              connectionReleased);
      result.addSuppressed(cleanupError);
    }
    return result;
  }

  /**
   * Every dial failure is retried, unless the supervisor state forbids it or the thread was
   * interrupted.
   */
  static boolean isRetryable(Exception e) {
    return !(e instanceof SupervisorException.SupervisorInvalidStateException
        || e instanceof InterruptedException);
  }

  static String exceptionMessage(Throwable e) {
    if (e == null) {
      return "unknown";
    } else if (e.getMessage() == null) {
      return e.getClass().getSimpleName();
    } else {
      return e.getMessage() + " [" + e.getClass().getSimpleName() + "]";
    }
  }
}
