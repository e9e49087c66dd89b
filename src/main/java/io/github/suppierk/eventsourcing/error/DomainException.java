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
 * Thrown by a decider when a command violates a business precondition for the current state.
 *
 * <p>The {@code reason} is a stable snake_case identifier of the violated rule, suitable for
 * clients to branch on.
 */
public class DomainException extends EventSourcingException {
  @Serial private static final long serialVersionUID = -6166380186453716035L;

  private final String reason;

  public DomainException(ErrorCode errorCode, String reason, String message) {
    super(errorCode, message);
    this.reason = reason;
  }

  public final String getReason() {
    return reason;
  }
}
