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

import io.github.suppierk.eventsourcing.core.DomainCommand;
import io.github.suppierk.eventsourcing.error.ValidationException;
import java.time.Instant;

/** Every intent a client can express about a todo. */
public sealed interface TodoCommand extends DomainCommand
    permits TodoCommand.Create,
        TodoCommand.UpdateText,
        TodoCommand.Complete,
        TodoCommand.Uncomplete,
        TodoCommand.Delete {
  String id();

  @Override
  default String aggregateId() {
    return id();
  }

  private static void validate(String id, Instant at) {
    if (id == null || id.isBlank() || id.contains("/")) {
      throw new ValidationException("id", "Todo id must be a non-blank key segment");
    }

    if (at == null) {
      throw new ValidationException("timestamp", "Command timestamp cannot be null");
    }
  }

  private static void validate(TodoText text) {
    if (text == null) {
      throw new ValidationException(TodoText.FIELD, "Todo text cannot be empty");
    }
  }

  record Create(String id, TodoText text, Instant createdAt) implements TodoCommand {
    public Create {
      validate(id, createdAt);
      validate(text);
    }
  }

  record UpdateText(String id, TodoText text, Instant updatedAt) implements TodoCommand {
    public UpdateText {
      validate(id, updatedAt);
      validate(text);
    }
  }

  record Complete(String id, Instant completedAt) implements TodoCommand {
    public Complete {
      validate(id, completedAt);
    }
  }

  record Uncomplete(String id, Instant uncompletedAt) implements TodoCommand {
    public Uncomplete {
      validate(id, uncompletedAt);
    }
  }

  record Delete(String id, Instant deletedAt) implements TodoCommand {
    public Delete {
      validate(id, deletedAt);
    }
  }
}
