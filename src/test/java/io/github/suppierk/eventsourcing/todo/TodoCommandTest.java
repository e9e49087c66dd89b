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
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.eventsourcing.error.ValidationException;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TodoCommandTest {
  static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @Test
  void aggregate_id_must_be_the_todo_id() {
    assertEquals("a", new TodoCommand.Complete("a", NOW).aggregateId());
  }

  @Test
  void when_id_is_not_a_key_segment_validation_exception_is_thrown() {
    assertEquals(
        "id",
        assertThrows(ValidationException.class, () -> new TodoCommand.Delete(" ", NOW)).getField());
    assertThrows(ValidationException.class, () -> new TodoCommand.Delete(null, NOW));
    assertThrows(ValidationException.class, () -> new TodoCommand.Delete("a/b", NOW));
  }

  @Test
  void when_timestamp_is_missing_validation_exception_is_thrown() {
    assertEquals(
        "timestamp",
        assertThrows(ValidationException.class, () -> new TodoCommand.Uncomplete("a", null))
            .getField());
  }

  @Test
  void when_text_is_missing_validation_exception_is_thrown() {
    assertEquals(
        "text",
        assertThrows(ValidationException.class, () -> new TodoCommand.Create("a", null, NOW))
            .getField());
  }
}
