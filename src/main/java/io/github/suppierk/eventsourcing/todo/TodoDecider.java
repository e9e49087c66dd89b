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

import io.github.suppierk.eventsourcing.core.Decider;
import java.util.List;

/**
 * Semantics of the todo aggregate.
 *
 * <p>Rejected preconditions always throw {@link TodoException}, no failure events are recorded.
 * Commands which would not change anything are idempotent and yield no events: completing a
 * completed todo, reopening an active one, deleting a deleted one.
 */
public final class TodoDecider implements Decider<TodoCommand, TodoState, TodoEvent> {
  @Override
  public TodoState initialState() {
    return TodoState.notCreated();
  }

  @Override
  public List<TodoEvent> decide(TodoCommand command, TodoState state) {
    if (command instanceof TodoCommand.Create create) {
      if (state.exists()) {
        throw new TodoException(TodoException.Kind.ALREADY_EXISTS, create.id());
      }

      return List.of(
          new TodoEvent.Created(create.id(), create.text().value(), create.createdAt()));
    }

    if (command instanceof TodoCommand.UpdateText update) {
      if (!state.exists() || state.isDeleted()) {
        throw new TodoException(TodoException.Kind.NOT_FOUND, update.id());
      }

      return List.of(
          new TodoEvent.TextUpdated(update.id(), update.text().value(), update.updatedAt()));
    }

    if (command instanceof TodoCommand.Complete complete) {
      if (state.isCompleted()) {
        return List.of();
      }

      if (!state.isActive()) {
        throw new TodoException(TodoException.Kind.CANNOT_COMPLETE, complete.id());
      }

      return List.of(new TodoEvent.Completed(complete.id(), complete.completedAt()));
    }

    if (command instanceof TodoCommand.Uncomplete uncomplete) {
      if (state.isActive()) {
        return List.of();
      }

      if (!state.isCompleted()) {
        throw new TodoException(TodoException.Kind.CANNOT_UNCOMPLETE, uncomplete.id());
      }

      return List.of(new TodoEvent.Uncompleted(uncomplete.id(), uncomplete.uncompletedAt()));
    }

    final TodoCommand.Delete delete = (TodoCommand.Delete) command;

    if (state.isDeleted()) {
      return List.of();
    }

    if (!state.exists()) {
      throw new TodoException(TodoException.Kind.CANNOT_DELETE, delete.id());
    }

    return List.of(new TodoEvent.Deleted(delete.id(), delete.deletedAt()));
  }

  @Override
  public TodoState evolve(TodoState state, TodoEvent event) {
    if (event instanceof TodoEvent.Created created) {
      return new TodoState(
          TodoStatus.ACTIVE, created.id(), created.text(), created.createdAt(), null, null);
    }

    // Anything but creation leaves a todo which does not exist untouched
    if (!state.exists()) {
      return state;
    }

    if (event instanceof TodoEvent.TextUpdated updated) {
      return state.withText(updated.text());
    }

    if (event instanceof TodoEvent.Completed completed) {
      return state.completedAt(completed.completedAt());
    }

    if (event instanceof TodoEvent.Uncompleted) {
      return state.reopened();
    }

    return state.deletedAt(((TodoEvent.Deleted) event).deletedAt());
  }
}
