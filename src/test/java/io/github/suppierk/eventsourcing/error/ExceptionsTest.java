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

package io.github.suppierk.eventsourcing.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.SQLException;
import java.util.OptionalLong;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExceptionsTest {
  @Test
  void every_exception_must_get_its_own_error_id() {
    final var first = new ValidationException("text", "empty");
    final var second = new ValidationException("text", "empty");

    assertNotEquals(first.getErrorId(), second.getErrorId());
  }

  @Test
  void client_errors_must_be_distinguished_from_server_errors() {
    assertTrue(ErrorCode.VALIDATION_FAILED.isClientError());
    assertTrue(ErrorCode.CONFLICT.isClientError());
    assertFalse(ErrorCode.DATABASE_ERROR.isClientError());
    assertFalse(ErrorCode.SERVICE_UNAVAILABLE.isClientError());
  }

  @Nested
  class StatusCodes {
    @Test
    void validation_must_have_bad_request_status_code() {
      final var exception = new ValidationException("text", "empty");

      assertEquals(400, exception.getStatusCode());
      assertEquals(ErrorCode.VALIDATION_FAILED, exception.getErrorCode());
      assertEquals("text", exception.getField());
    }

    @Test
    void domain_must_keep_the_status_code_of_its_error_code() {
      final var exception = new DomainException(ErrorCode.NOT_FOUND, "not_found", "missing");

      assertEquals(404, exception.getStatusCode());
      assertEquals("not_found", exception.getReason());
    }

    @Test
    void conflict_must_have_conflict_status_code() {
      final var exception = new ConcurrencyConflictException("Todo", "a", 3, 4);

      assertEquals(409, exception.getStatusCode());
      assertEquals(3, exception.getExpectedVersion());
      assertEquals(OptionalLong.of(4), exception.getActualVersion());
    }

    @Test
    void conflict_from_constraint_must_not_know_the_actual_version() {
      final var cause = new SQLException("duplicate", "23505");
      final var exception = new ConcurrencyConflictException("Todo", "a", 3, cause);

      assertEquals(OptionalLong.empty(), exception.getActualVersion());
      assertSame(cause, exception.getCause());
    }

    @Test
    void transient_infrastructure_must_have_service_unavailable_status_code() {
      final var exception = new InfrastructureException("read", null, true);

      assertTrue(exception.isTransient());
      assertEquals(503, exception.getStatusCode());
    }

    @Test
    void permanent_infrastructure_must_have_internal_error_status_code() {
      final var exception = new InfrastructureException("write", null, false);

      assertFalse(exception.isTransient());
      assertEquals(500, exception.getStatusCode());
      assertEquals(ErrorCode.DATABASE_ERROR, exception.getErrorCode());
    }

    @Test
    void schema_must_have_internal_error_status_code() {
      final var exception = new SchemaException("Created", 7, "too new");

      assertEquals(500, exception.getStatusCode());
      assertEquals("Created", exception.getEventType());
      assertEquals(7, exception.getEventVersion());
    }

    @Test
    void event_bus_must_have_service_unavailable_status_code() {
      assertEquals(503, new EventBusException("closed").getStatusCode());
    }
  }
}
