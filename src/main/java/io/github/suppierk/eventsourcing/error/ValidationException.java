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

/**
 * Thrown when input is malformed. Always raised before any decision is taken, never retried.
 *
 * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/400">400 Bad Request</a>
 */
public class ValidationException extends EventSourcingException {
  @Serial private static final long serialVersionUID = 2209183757036528149L;

  private final String field;

  /**
   * @param field which failed validation
   * @param message describing what is wrong with the field
   */
  public ValidationException(String field, String message) {
    super(ErrorCode.VALIDATION_FAILED, message);
    this.field = field;
  }

  /**
   * @param field which failed validation
   * @param message describing what is wrong with the field
   * @param cause of the failure, typically a parsing error
   */
  public ValidationException(String field, String message, Throwable cause) {
    super(ErrorCode.VALIDATION_FAILED, message, cause);
    this.field = field;
  }

  /**
   * @return name of the offending field
   */
  public final String getField() {
    return field;
  }
}
