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

package io.github.suppierk.eventsourcing.event;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.eventsourcing.core.DomainEvent;
import io.github.suppierk.eventsourcing.error.SchemaException;

/**
 * Maps the domain events of one aggregate type to and from their stored form.
 *
 * <p>Decoding only ever sees payloads at the current version, since the repository upcasts
 * everything it loads.
 *
 * @param <EVENT> the domain event type
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public interface EventCodec<EVENT extends DomainEvent> {
  /**
   * @return tag of the aggregate type these events belong to
   */
  String aggregateType();

  /**
   * @param event to name
   * @return the stored name of the event variant
   */
  String eventType(EVENT event);

  /**
   * @param eventType stored name of an event variant
   * @return version new payloads of that variant are written at
   */
  int currentVersion(String eventType);

  /**
   * @param event to serialize
   * @return payload at {@link #currentVersion(String)}
   */
  ObjectNode encode(EVENT event);

  /**
   * @param eventType stored name of the event variant
   * @param payload at the current version
   * @return decoded event
   * @throws SchemaException if the type is unknown or the payload does not fit it
   */
  EVENT decode(String eventType, ObjectNode payload);

  /**
   * @param event to check
   * @return {@code true} if no event may follow this one on the same aggregate
   */
  default boolean isFinal(EVENT event) {
    return false;
  }

  /**
   * @param event as loaded from the repository
   * @return decoded event
   */
  default EVENT decode(StoredEvent event) {
    return decode(event.eventType(), event.payload());
  }
}
