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

import java.time.Instant;

/**
 * Aggregate state of one todo, rebuilt from its events for every command.
 *
 * @param status lifecycle position
 * @param id of the todo, {@code null} before creation
 * @param text current text, {@code null} before creation
 * @param createdAt creation time, {@code null} before creation
 * @param completedAt completion time while completed
 * @param deletedAt deletion time once deleted
 */
public record TodoState(
    TodoStatus status,
    String id,
    String text,
    Instant createdAt,
    Instant completedAt,
    Instant deletedAt) {
  private static final TodoState NOT_CREATED =
      new TodoState(TodoStatus.NOT_CREATED, null, null, null, null, null);

  public static TodoState notCreated() {
    return NOT_CREATED;
  }

  public boolean exists() {
    return status != TodoStatus.NOT_CREATED;
  }

  public boolean isActive() {
    return status == TodoStatus.ACTIVE;
  }

  public boolean isCompleted() {
    return status == TodoStatus.COMPLETED;
  }

  public boolean isDeleted() {
    return status == TodoStatus.DELETED;
  }

  TodoState withText(String newText) {
    return new TodoState(status, id, newText, createdAt, completedAt, deletedAt);
  }

  TodoState completedAt(Instant at) {
    return new TodoState(TodoStatus.COMPLETED, id, text, createdAt, at, deletedAt);
  }

  TodoState reopened() {
    return new TodoState(TodoStatus.ACTIVE, id, text, createdAt, null, deletedAt);
  }

  TodoState deletedAt(Instant at) {
    return new TodoState(TodoStatus.DELETED, id, text, createdAt, completedAt, at);
  }
}
