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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TodoListViewTest {
  static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  final TodoListView view = new TodoListView();

  @Test
  void list_must_keep_creation_order_and_counts() {
    final var state =
        view.fold(
            view.initialState(),
            List.of(
                new TodoEvent.Created("a", "First", NOW),
                new TodoEvent.Created("b", "Second", NOW),
                new TodoEvent.Created("c", "Third", NOW),
                new TodoEvent.Completed("b", NOW),
                new TodoEvent.TextUpdated("c", "Third, edited", NOW)));

    assertEquals(
        List.of(
            new TodoItemView("a", "First", false),
            new TodoItemView("b", "Second", true),
            new TodoItemView("c", "Third, edited", false)),
        state.todos());
    assertEquals(3, state.count());
    assertEquals(1, state.completedCount());
    assertEquals(2, state.activeCount());
  }

  @Test
  void deleted_todo_must_disappear() {
    final var state =
        view.fold(
            view.initialState(),
            List.of(new TodoEvent.Created("a", "First", NOW), new TodoEvent.Deleted("a", NOW)));

    assertEquals(Optional.empty(), state.find("a"));
    assertEquals(0, state.count());
  }

  @Test
  void reopened_todo_must_be_active_again() {
    final var state =
        view.fold(
            view.initialState(),
            List.of(
                new TodoEvent.Created("a", "First", NOW),
                new TodoEvent.Completed("a", NOW),
                new TodoEvent.Uncompleted("a", NOW)));

    assertEquals(Optional.of(new TodoItemView("a", "First", false)), state.find("a"));
  }

  @Test
  void events_about_unknown_todos_must_be_ignored() {
    final var state =
        view.fold(
            view.initialState(),
            List.of(
                new TodoEvent.Completed("ghost", NOW),
                new TodoEvent.TextUpdated("ghost", "Boo", NOW),
                new TodoEvent.Deleted("ghost", NOW)));

    assertTrue(state.todos().isEmpty());
  }
}
