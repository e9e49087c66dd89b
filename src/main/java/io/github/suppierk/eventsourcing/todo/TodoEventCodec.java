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

package io.github.suppierk.eventsourcing.todo;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.eventsourcing.error.SchemaException;
import io.github.suppierk.eventsourcing.event.EventCodec;
import io.github.suppierk.eventsourcing.event.Jsons;
import io.github.suppierk.eventsourcing.upcast.UpcasterChain;
import java.util.Map;

/** Stored form of {@link TodoEvent}s, JSON payloads with snake_case fields. */
public final class TodoEventCodec implements EventCodec<TodoEvent> {
  public static final String AGGREGATE_TYPE = "Todo";

  public static final String CREATED = "Created";
  public static final String TEXT_UPDATED = "TextUpdated";
  public static final String COMPLETED = "Completed";
  public static final String UNCOMPLETED = "Uncompleted";
  public static final String DELETED = "Deleted";

  private static final Map<String, Class<? extends TodoEvent>> TYPES =
      Map.of(
          CREATED, TodoEvent.Created.class,
          TEXT_UPDATED, TodoEvent.TextUpdated.class,
          COMPLETED, TodoEvent.Completed.class,
          UNCOMPLETED, TodoEvent.Uncompleted.class,
          DELETED, TodoEvent.Deleted.class);

  // Version 2 of Created renamed "title" to "text"
  private static final Map<String, Integer> CURRENT_VERSIONS =
      Map.of(CREATED, 2, TEXT_UPDATED, 1, COMPLETED, 1, UNCOMPLETED, 1, DELETED, 1);

  /**
   * Declares the current version of every todo event and registers the upcasters bridging older
   * stored versions.
   *
   * @param builder to register with
   * @return the same builder
   */
  public static UpcasterChain.Builder registerUpcasters(UpcasterChain.Builder builder) {
    CURRENT_VERSIONS.forEach(
        (eventType, version) -> builder.currentVersion(AGGREGATE_TYPE, eventType, version));
    return builder.register(new TodoCreatedV1Upcaster());
  }

  @Override
  public String aggregateType() {
    return AGGREGATE_TYPE;
  }

  @Override
  public String eventType(TodoEvent event) {
    if (event instanceof TodoEvent.Created) {
      return CREATED;
    }

    if (event instanceof TodoEvent.TextUpdated) {
      return TEXT_UPDATED;
    }

    if (event instanceof TodoEvent.Completed) {
      return COMPLETED;
    }

    if (event instanceof TodoEvent.Uncompleted) {
      return UNCOMPLETED;
    }

    return DELETED;
  }

  @Override
  public int currentVersion(String eventType) {
    final Integer version = CURRENT_VERSIONS.get(eventType);

    if (version == null) {
      throw new SchemaException(eventType, 0, "Unknown todo event %s".formatted(eventType));
    }

    return version;
  }

  @Override
  public ObjectNode encode(TodoEvent event) {
    return Jsons.toObject(event);
  }

  @Override
  public TodoEvent decode(String eventType, ObjectNode payload) {
    final Class<? extends TodoEvent> type = TYPES.get(eventType);

    if (type == null) {
      throw new SchemaException(eventType, 0, "Unknown todo event %s".formatted(eventType));
    }

    try {
      return Jsons.fromObject(payload, type);
    } catch (IllegalArgumentException e) {
      throw new SchemaException(
          eventType,
          currentVersion(eventType),
          "Payload of %s does not match v%d".formatted(eventType, currentVersion(eventType)),
          e);
    }
  }

  @Override
  public boolean isFinal(TodoEvent event) {
    return event instanceof TodoEvent.Deleted;
  }
}
