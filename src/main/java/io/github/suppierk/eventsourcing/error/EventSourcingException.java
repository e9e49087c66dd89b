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

import java.io.Serial;
import java.util.UUID;

/**
 * Base of every exception thrown by the library.
 *
 * <p>Each instance carries an {@link ErrorCode} and a unique error id. The id is meant to be
 * logged on the server and returned to the caller, so that a user-facing failure can be matched
 * with its server-side log line.
 */
public abstract class EventSourcingException extends RuntimeException {
  @Serial private static final long serialVersionUID = -3511946432790377364L;

  private final ErrorCode errorCode;
  private final UUID errorId;

  /**
   * Constructs a new exception with the specified error code and detail message.
   *
   * @param errorCode classifying this failure
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  protected EventSourcingException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode == null ? ErrorCode.INTERNAL_ERROR : errorCode;
    this.errorId = UUID.randomUUID();
  }

  /**
   * Constructs a new exception with the specified error code, detail message and cause.
   *
   * <p>Note that the detail message associated with {@code cause} is <i>not</i> automatically
   * incorporated in this exception's detail message.
   *
   * @param errorCode classifying this failure
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   *     (A {@code null} value is permitted, and indicates that the cause is nonexistent or
   *     unknown.)
   */
  protected EventSourcingException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode == null ? ErrorCode.INTERNAL_ERROR : errorCode;
    this.errorId = UUID.randomUUID();
  }

  /**
   * @return the classification of this failure
   */
  public final ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * @return unique id of this particular failure, for log correlation
   */
  public final UUID getErrorId() {
    return errorId;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   */
  public final int getStatusCode() {
    return errorCode.getStatusCode();
  }
}
