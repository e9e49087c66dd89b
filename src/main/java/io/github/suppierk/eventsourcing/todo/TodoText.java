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

import io.github.suppierk.eventsourcing.error.ValidationException;

/**
 * Text of a todo: trimmed, between 1 and {@value #MAX_LENGTH} characters.
 *
 * @param value validated text
 */
public record TodoText(String value) {
  public static final int MAX_LENGTH = 500;

  static final String FIELD = "text";

  public TodoText {
    if (value == null) {
      throw new ValidationException(FIELD, "Todo text cannot be empty");
    }

    value = value.strip();

    if (value.isEmpty()) {
      throw new ValidationException(FIELD, "Todo text cannot be empty");
    }

    final int length = value.codePointCount(0, value.length());

    if (length > MAX_LENGTH) {
      throw new ValidationException(
          FIELD,
          "Todo text is %d characters long, at most %d allowed".formatted(length, MAX_LENGTH));
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
