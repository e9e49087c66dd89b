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
 * A serialized event which has been decided but not yet appended.
 *
 * @param aggregateType tag of the aggregate type, e.g. {@code Todo}
 * @param aggregateId identifier of the aggregate within its type
 * @param eventId globally unique id of the event
 * @param eventType name of the event variant
 * @param eventVersion schema version of the payload, starting at 1
 * @param payload serialized event body
 * @param metadata tracing information
 * @param createdAt time supplied by the command context
 * @param isFinal whether no further events may follow on this aggregate
 */
public record NewEvent(
    String aggregateType,
    String aggregateId,
    UUID eventId,
    String eventType,
    int eventVersion,
    ObjectNode payload,
    EventMetadata metadata,
    Instant createdAt,
    boolean isFinal) {
  public NewEvent {
    requireText(aggregateType, "Aggregate type");
    requireText(aggregateId, "Aggregate id");
    requireText(eventType, "Event type");

    if (eventId == null) {
      throw new IllegalArgumentException("Event id cannot be null");
    }

    if (eventVersion < 1) {
      throw new IllegalArgumentException("Event version must be positive");
    }

    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null");
    }

    if (metadata == null) {
      throw new IllegalArgumentException("Metadata cannot be null");
    }

    if (createdAt == null) {
      throw new IllegalArgumentException("Creation time cannot be null");
    }
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("%s cannot be blank".formatted(name));
    }

    if (value.indexOf('/') >= 0) {
      throw new IllegalArgumentException("%s cannot contain '/'".formatted(name));
    }
  }
}
