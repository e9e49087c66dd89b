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
import java.time.Instant;
import java.util.UUID;

/**
 * An event as persisted by the repository, with both of its sequence numbers assigned.
 *
 * <p>{@code aggregateSequence} is 1-based and gap-free within one aggregate, {@code
 * globalSequence} is strictly increasing across the whole store and is the resumption point of
 * every stream.
 */
public record StoredEvent(
    long globalSequence,
    long aggregateSequence,
    UUID eventId,
    String aggregateType,
    String aggregateId,
    String eventType,
    int eventVersion,
    ObjectNode payload,
    EventMetadata metadata,
    Instant createdAt,
    boolean isFinal) {

  /**
   * @param event which was appended
   * @param globalSequence assigned by the store
   * @param aggregateSequence assigned by the store
   * @return stored counterpart of the new event
   */
  public static StoredEvent of(NewEvent event, long globalSequence, long aggregateSequence) {
    return new StoredEvent(
        globalSequence,
        aggregateSequence,
        event.eventId(),
        event.aggregateType(),
        event.aggregateId(),
        event.eventType(),
        event.eventVersion(),
        event.payload(),
        event.metadata(),
        event.createdAt(),
        event.isFinal());
  }

  /**
   * @param version the payload now conforms to
   * @param upcastedPayload transformed payload
   * @return an in-memory copy of this event with the payload replaced
   */
  public StoredEvent withPayload(int version, ObjectNode upcastedPayload) {
    return new StoredEvent(
        globalSequence,
        aggregateSequence,
        eventId,
        aggregateType,
        aggregateId,
        eventType,
        version,
        upcastedPayload,
        metadata,
        createdAt,
        isFinal);
  }
}
