/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.eventsourcing.core;

import java.util.List;

/**
 * The pure semantics of one aggregate type.
 *
 * <ul>
 *   <li>{@link #decide(DomainCommand, Object)} turns a command and the current state into new
 *       events, or throws a domain exception when a business precondition does not hold.
 *   <li>{@link #evolve(Object, DomainEvent)} applies one event to a state and must never fail for
 *       any event that {@code decide} could have produced.
 *   <li>{@link #initialState()} is the state of an aggregate which has no events yet.
 * </ul>
 *
 * <p>Implementations must not read clocks, generate random values or perform I/O: everything
 * impure travels in the command or its {@link CommandContext}.
 *
 * @param <COMMAND> the command type this decider accepts
 * @param <STATE> the aggregate state type
 * @param <EVENT> the event type this decider produces and consumes
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public interface Decider<
  COMMAND extends DomainCommand,
  STATE,
  EVENT extends DomainEvent
> {
// @formatter:on
  /**
   * @return the state of an aggregate that does not exist yet
   */
  STATE initialState();

  /**
   * @param command to decide upon
   * @param state current state of the aggregate
   * @return new events, empty when the command changes nothing
   */
  List<EVENT> decide(COMMAND command, STATE state);

  /**
   * @param state before the event
   * @param event to apply
   * @return state after the event
   */
  STATE evolve(STATE state, EVENT event);

  /**
   * Left fold of {@link #evolve(Object, DomainEvent)} over events, in order.
   *
   * @param state to start from
   * @param events to apply
   * @return resulting state
   */
  default STATE fold(STATE state, Iterable<? extends EVENT> events) {
    STATE current = state;

    for (EVENT event : events) {
      current = evolve(current, event);
    }

    return current;
  }

  /**
   * @param events full history of an aggregate
   * @return the state rebuilt from {@link #initialState()}
   */
  default STATE reconstruct(Iterable<? extends EVENT> events) {
    return fold(initialState(), events);
  }
}
