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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Read model of every live todo, in creation order.
 *
 * @param todos rows of the list
 */
public record TodoListState(List<TodoItemView> todos) {
  private static final TodoListState EMPTY = new TodoListState(List.of());

  public TodoListState {
    todos = List.copyOf(todos);
  }

  public static TodoListState empty() {
    return EMPTY;
  }

  public int count() {
    return todos.size();
  }

  public int completedCount() {
    return (int) todos.stream().filter(TodoItemView::completed).count();
  }

  public int activeCount() {
    return count() - completedCount();
  }

  public Optional<TodoItemView> find(String id) {
    return todos.stream().filter(todo -> todo.id().equals(id)).findFirst();
  }

  TodoListState add(TodoItemView item) {
    if (find(item.id()).isPresent()) {
      return this;
    }

    final List<TodoItemView> next = new ArrayList<>(todos);
    next.add(item);
    return new TodoListState(next);
  }

  TodoListState update(String id, UnaryOperator<TodoItemView> change) {
    final List<TodoItemView> next = new ArrayList<>(todos.size());
    boolean found = false;

    for (TodoItemView todo : todos) {
      if (todo.id().equals(id)) {
        next.add(change.apply(todo));
        found = true;
      } else {
        next.add(todo);
      }
    }

    return found ? new TodoListState(next) : this;
  }

  TodoListState remove(String id) {
    final List<TodoItemView> next = new ArrayList<>(todos);
    return next.removeIf(todo -> todo.id().equals(id)) ? new TodoListState(next) : this;
  }
}
