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

/**
 * Base exception of the queue supervisor.
 *
 * <p>Transport errors (usually {@link java.io.IOException}s) are wrapped in one of the subclasses
 * depending on the operation that failed.
 */
public class SupervisorException extends RuntimeException {

  public SupervisorException(Throwable cause) {
    super(cause);
  }

  public SupervisorException(String message) {
    super(message);
  }

  public SupervisorException(String format, Object... args) {
    super(args.length == 0 ? format : String.format(format, args));
  }

  public SupervisorException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Invalid settings or missing environment value, detected before any network activity. */
  public static class SupervisorConfigurationException extends SupervisorException {

    public SupervisorConfigurationException(String format, Object... args) {
      super(format, args);
    }
  }

  /** The transport connection could not be established within the configured attempts. */
  public static class SupervisorConnectionException extends SupervisorException {

    public SupervisorConnectionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A channel could not be opened or the queue could not be declared on it. */
  public static class SupervisorChannelException extends SupervisorException {

    private final boolean connectionReleased;

    public SupervisorChannelException(String message) {
      this(message, null, false);
    }

    public SupervisorChannelException(String message, Throwable cause) {
      this(message, cause, false);
    }

    public SupervisorChannelException(
        String message, Throwable cause, boolean connectionReleased) {
      super(message, cause);
      this.connectionReleased = connectionReleased;
    }

    /**
     * Whether the connection the channel depended on had to be released after the failure.
     *
     * @return true if the connection was released
     */
    public boolean connectionReleased() {
      return this.connectionReleased;
    }
  }

  /** The supervisor is not in a state that allows the operation. */
  public static class SupervisorInvalidStateException extends SupervisorException {

    public SupervisorInvalidStateException(String format, Object... args) {
      super(format, args);
    }

    public SupervisorInvalidStateException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The supervisor has been closed. */
  public static class SupervisorClosedException extends SupervisorInvalidStateException {

    public SupervisorClosedException(String message) {
      super(message);
    }

    public SupervisorClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class SupervisorPublishException extends SupervisorException {

    public SupervisorPublishException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class SupervisorSerializationException extends SupervisorException {

    public SupervisorSerializationException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
