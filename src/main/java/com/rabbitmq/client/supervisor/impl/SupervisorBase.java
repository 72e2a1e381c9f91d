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

import static com.rabbitmq.client.supervisor.QueueSupervisor.State.CLOSED;
import static com.rabbitmq.client.supervisor.QueueSupervisor.State.CLOSING;
import static com.rabbitmq.client.supervisor.QueueSupervisor.State.OPENING;

import com.rabbitmq.client.supervisor.QueueSupervisor;
import com.rabbitmq.client.supervisor.SupervisorException;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of a supervisor and notification of its listeners.
 *
 * <p>Transitions follow the supervisor lifecycle: OPENING and RECOVERING lead to OPEN, OPENING and
 * OPEN lead to RECOVERING, CLOSING leads only to CLOSED, and CLOSED is terminal. A transition the
 * lifecycle does not allow is ignored, so a late recovery step cannot reopen a closed supervisor.
 */
abstract class SupervisorBase implements QueueSupervisor {

  private static final Logger LOGGER = LoggerFactory.getLogger(SupervisorBase.class);

  private final AtomicReference<State> state = new AtomicReference<>(OPENING);
  private final List<StateListener> listeners;
  private volatile Throwable closeReason;

  SupervisorBase(List<StateListener> listeners) {
    this.listeners = List.copyOf(listeners);
    this.notifyListeners(null, OPENING, null);
  }

  static boolean transitionAllowed(State from, State to) {
    switch (to) {
      case OPEN:
        return from == OPENING || from == State.RECOVERING;
      case RECOVERING:
        return from == OPENING || from == State.OPEN;
      case CLOSING:
        return from != CLOSED;
      case CLOSED:
        return true;
      default:
        return false;
    }
  }

  void checkNotClosed() {
    State current = this.state.get();
    if (current == CLOSING || current == CLOSED) {
      Throwable reason = this.closeReason;
      if (reason == null) {
        throw new SupervisorException.SupervisorClosedException("Supervisor is closed");
      } else {
        throw new SupervisorException.SupervisorClosedException(
            "Supervisor is closed: " + ExceptionUtils.exceptionMessage(reason), reason);
      }
    }
  }

  @Override
  public State state() {
    return this.state.get();
  }

  boolean state(State target) {
    return this.state(target, null);
  }

  /**
   * Move to the target state if the lifecycle allows it.
   *
   * @return true if the supervisor is in the target state after the call
   */
  boolean state(State target, Throwable failureCause) {
    State previous;
    do {
      previous = this.state.get();
      if (previous == target) {
        return true;
      } else if (!transitionAllowed(previous, target)) {
        LOGGER.debug("Ignoring transition of supervisor {} from {} to {}", this, previous, target);
        return false;
      }
    } while (!this.state.compareAndSet(previous, target));
    if (target == CLOSED && this.closeReason == null) {
      this.closeReason = failureCause;
    }
    this.notifyListeners(previous, target, failureCause);
    return true;
  }

  private void notifyListeners(State previous, State current, Throwable failureCause) {
    LOGGER.debug("Supervisor {}: {} -> {}", this, previous, current);
    if (this.listeners.isEmpty()) {
      return;
    }
    Context context = new StateChange(this, failureCause, previous, current);
    for (StateListener listener : this.listeners) {
      try {
        listener.handle(context);
      } catch (Exception e) {
        LOGGER.warn(
            "State listener of supervisor {} failed on {} -> {}: {}",
            this,
            previous,
            current,
            ExceptionUtils.exceptionMessage(e));
      }
    }
  }

  private static final class StateChange implements Context {

    private final QueueSupervisor supervisor;
    private final Throwable failureCause;
    private final State previousState;
    private final State currentState;

    private StateChange(
        QueueSupervisor supervisor,
        Throwable failureCause,
        State previousState,
        State currentState) {
      this.supervisor = supervisor;
      this.failureCause = failureCause;
      this.previousState = previousState;
      this.currentState = currentState;
    }

    @Override
    public QueueSupervisor supervisor() {
      return this.supervisor;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public State previousState() {
      return this.previousState;
    }

    @Override
    public State currentState() {
      return this.currentState;
    }
  }
}
