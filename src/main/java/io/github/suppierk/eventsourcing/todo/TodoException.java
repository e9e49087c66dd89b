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

import io.github.suppierk.eventsourcing.error.DomainException;
import io.github.suppierk.eventsourcing.error.ErrorCode;
import java.io.Serial;

/** A todo command which is not allowed in the todo's current state. */
public class TodoException extends DomainException {
  @Serial private static final long serialVersionUID = -2360186092542574219L;

  /** Every rule a todo command can break. */
  public enum Kind {
    ALREADY_EXISTS(ErrorCode.CONFLICT, "already_exists", "Todo already exists"),
    NOT_FOUND(ErrorCode.NOT_FOUND, "not_found", "Todo not found"),
    CANNOT_COMPLETE(ErrorCode.CONFLICT, "cannot_complete", "Todo cannot be completed"),
    CANNOT_UNCOMPLETE(ErrorCode.CONFLICT, "cannot_uncomplete", "Todo cannot be reopened"),
    CANNOT_DELETE(ErrorCode.CONFLICT, "cannot_delete", "Todo cannot be deleted");

    private final ErrorCode errorCode;
    private final String reason;
    private final String message;

    Kind(ErrorCode errorCode, String reason, String message) {
      this.errorCode = errorCode;
      this.reason = reason;
      this.message = message;
    }

    public ErrorCode getErrorCode() {
      return errorCode;
    }

    public String getReason() {
      return reason;
    }
  }

  private final Kind kind;

  public TodoException(Kind kind, String todoId) {
    super(kind.errorCode, kind.reason, "%s: %s".formatted(kind.message, todoId));
    this.kind = kind;
  }

  public final Kind getKind() {
    return kind;
  }
}
