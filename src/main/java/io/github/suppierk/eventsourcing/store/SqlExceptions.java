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

package io.github.suppierk.eventsourcing.store;

import io.github.suppierk.eventsourcing.error.InfrastructureException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import org.jooq.exception.DataAccessException;

/** Classifies database failures by SQL state. */
final class SqlExceptions {
  private static final String INTEGRITY_VIOLATION_CLASS = "23";
  private static final String CONNECTION_EXCEPTION_CLASS = "08";
  private static final String TRANSACTION_ROLLBACK_CLASS = "40";

  // H2 lock timeout
  private static final String LOCK_TIMEOUT = "HYT00";

  private SqlExceptions() {
    // Utility class
  }

  static boolean isIntegrityViolation(DataAccessException e) {
    final String state = e.sqlState();
    return state != null && state.startsWith(INTEGRITY_VIOLATION_CLASS);
  }

  static boolean isTransient(DataAccessException e) {
    if (e.getCause(SQLTransientException.class) != null
        || e.getCause(SQLRecoverableException.class) != null) {
      return true;
    }

    final String state = e.sqlState();

    if (state == null) {
      return false;
    }

    return state.startsWith(CONNECTION_EXCEPTION_CLASS)
        || state.startsWith(TRANSACTION_ROLLBACK_CLASS)
        || state.equals(LOCK_TIMEOUT);
  }

  static InfrastructureException translate(String operation, DataAccessException e) {
    final boolean transientFailure = isTransient(e);
    return new InfrastructureException(
        "%s failed (SQL state %s)".formatted(operation, e.sqlState()), e, transientFailure);
  }
}
