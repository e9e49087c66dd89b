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

package io.github.suppierk.eventsourcing.sse;

import io.github.suppierk.eventsourcing.error.ValidationException;
import java.util.OptionalLong;

/** Parser of the client cursor sent in the {@code Last-Event-ID} header. */
public final class LastEventId {
  public static final String HEADER = "Last-Event-ID";

  private LastEventId() {
    // Utility class
  }

  /**
   * @param header raw header value, may be {@code null}
   * @return the cursor, empty when the header is absent or blank
   * @throws ValidationException if the value is not a non-negative integer
   */
  public static OptionalLong parse(String header) {
    if (header == null || header.isBlank()) {
      return OptionalLong.empty();
    }

    final long cursor;

    try {
      cursor = Long.parseLong(header.trim());
    } catch (NumberFormatException e) {
      throw new ValidationException(HEADER, "%s must be an integer".formatted(HEADER), e);
    }

    if (cursor < 0) {
      throw new ValidationException(HEADER, "%s cannot be negative".formatted(HEADER));
    }

    return OptionalLong.of(cursor);
  }
}
