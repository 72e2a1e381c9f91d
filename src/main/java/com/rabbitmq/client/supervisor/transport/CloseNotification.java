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
package com.rabbitmq.client.supervisor.transport;

/** Details of a connection or channel closure. */
public final class CloseNotification {

  private final boolean deliberate;
  private final String reason;
  private final Throwable cause;

  private CloseNotification(boolean deliberate, String reason, Throwable cause) {
    this.deliberate = deliberate;
    this.reason = reason;
    this.cause = cause;
  }

  /**
   * Closure initiated by the client.
   *
   * @param reason reason, can be null
   * @return the notification
   */
  public static CloseNotification deliberate(String reason) {
    return new CloseNotification(true, reason, null);
  }

  /**
   * Closure initiated by the broker or caused by the network.
   *
   * @param reason reason, can be null
   * @param cause cause, can be null
   * @return the notification
   */
  public static CloseNotification unexpected(String reason, Throwable cause) {
    return new CloseNotification(false, reason, cause);
  }

  public boolean deliberate() {
    return this.deliberate;
  }

  public String reason() {
    return this.reason;
  }

  public Throwable cause() {
    return this.cause;
  }

  @Override
  public String toString() {
    return "CloseNotification{"
        + "deliberate="
        + deliberate
        + ", reason='"
        + reason
        + '\''
        + ", cause="
        + cause
        + '}';
  }
}
