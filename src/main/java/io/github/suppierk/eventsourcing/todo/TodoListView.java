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

import io.github.suppierk.eventsourcing.projection.View;

/** Projects todo events into the list shown to users. Events about unknown todos are ignored. */
public final class TodoListView implements View<TodoListState, TodoEvent> {
  @Override
  public TodoListState initialState() {
    return TodoListState.empty();
  }

  @Override
  public TodoListState evolve(TodoListState state, TodoEvent event) {
    if (event instanceof TodoEvent.Created created) {
      return state.add(new TodoItemView(created.id(), created.text(), false));
    }

    if (event instanceof TodoEvent.TextUpdated updated) {
      return state.update(
          updated.id(), todo -> new TodoItemView(todo.id(), updated.text(), todo.completed()));
    }

    if (event instanceof TodoEvent.Completed completed) {
      return state.update(completed.id(), todo -> new TodoItemView(todo.id(), todo.text(), true));
    }

    if (event instanceof TodoEvent.Uncompleted uncompleted) {
      return state.update(
          uncompleted.id(), todo -> new TodoItemView(todo.id(), todo.text(), false));
    }

    return state.remove(event.id());
  }
}
