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
 * Thrown when an I/O dependency such as the database fails.
 *
 * <p>Transient failures (lost connections, lock timeouts, serialization failures) may be retried
 * by idempotent reads. Writes are never retried on this exception, since the caller cannot know
 * whether the transaction committed.
 */
public class InfrastructureException extends EventSourcingException {
  @Serial private static final long serialVersionUID = 8731565420177411907L;

  private final boolean transientFailure;

  /**
   * @param message describing the failed operation
   * @param cause reported by the dependency
   * @param transientFailure whether repeating the same operation may succeed
   */
  public InfrastructureException(String message, Throwable cause, boolean transientFailure) {
    super(
        transientFailure ? ErrorCode.SERVICE_UNAVAILABLE : ErrorCode.DATABASE_ERROR,
        message,
        cause);
    this.transientFailure = transientFailure;
  }

  /**
   * @return {@code true} if repeating the same idempotent operation may succeed
   */
  public final boolean isTransient() {
    return transientFailure;
  }
}
