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

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.suppierk.eventsourcing.core.DomainEvent;
import java.time.Instant;

/** Every fact recorded about a todo. {@link Deleted} is final. */
public sealed interface TodoEvent extends DomainEvent
    permits TodoEvent.Created,
        TodoEvent.TextUpdated,
        TodoEvent.Completed,
        TodoEvent.Uncompleted,
        TodoEvent.Deleted {
  String id();

  @Override
  default String aggregateId() {
    return id();
  }

  private static void require(Object value, String name) {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(name));
    }
  }

  record Created(
      @JsonProperty("id") String id,
      @JsonProperty("text") String text,
      @JsonProperty("created_at") Instant createdAt)
      implements TodoEvent {
    public Created {
      require(id, "Id");
      require(text, "Text");
      require(createdAt, "Creation time");
    }
  }

  record TextUpdated(
      @JsonProperty("id") String id,
      @JsonProperty("text") String text,
      @JsonProperty("updated_at") Instant updatedAt)
      implements TodoEvent {
    public TextUpdated {
      require(id, "Id");
      require(text, "Text");
      require(updatedAt, "Update time");
    }
  }

  record Completed(
      @JsonProperty("id") String id, @JsonProperty("completed_at") Instant completedAt)
      implements TodoEvent {
    public Completed {
      require(id, "Id");
      require(completedAt, "Completion time");
    }
  }

  record Uncompleted(
      @JsonProperty("id") String id, @JsonProperty("uncompleted_at") Instant uncompletedAt)
      implements TodoEvent {
    public Uncompleted {
      require(id, "Id");
      require(uncompletedAt, "Reopening time");
    }
  }

  record Deleted(@JsonProperty("id") String id, @JsonProperty("deleted_at") Instant deletedAt)
      implements TodoEvent {
    public Deleted {
      require(id, "Id");
      require(deletedAt, "Deletion time");
    }
  }
}
