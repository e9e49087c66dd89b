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

package io.github.suppierk.eventsourcing.projection;

import io.github.suppierk.eventsourcing.core.DomainEvent;

/**
 * Pure read-model semantics: a fold of events into a queryable state.
 *
 * <p>{@link #evolve(Object, DomainEvent)} must be non-blocking and must accept any event of the
 * view's aggregate type, including ones it does not care about.
 *
 * @param <STATE> the read model
 * @param <EVENT> the events it is built from
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public interface View<STATE, EVENT extends DomainEvent> {
  STATE initialState();

  STATE evolve(STATE state, EVENT event);

  default STATE fold(STATE state, Iterable<? extends EVENT> events) {
    STATE current = state;

    for (EVENT event : events) {
      current = evolve(current, event);
    }

    return current;
  }
}
