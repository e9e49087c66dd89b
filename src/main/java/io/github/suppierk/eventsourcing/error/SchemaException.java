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
 * Thrown when a stored event cannot be brought to the shape the current code expects.
 *
 * <p>This is fatal for the affected event type: loading aborts and nothing is retried. Treat it as
 * an operational alarm, it means a deployment is missing an upcaster or rolled back past a schema
 * change.
 */
public class SchemaException extends EventSourcingException {
  @Serial private static final long serialVersionUID = -1305021939108736390L;

  private final String eventType;
  private final int eventVersion;

  public SchemaException(String eventType, int eventVersion, String message) {
    super(ErrorCode.INTERNAL_ERROR, message);
    this.eventType = eventType;
    this.eventVersion = eventVersion;
  }

  public SchemaException(String eventType, int eventVersion, String message, Throwable cause) {
    super(ErrorCode.INTERNAL_ERROR, message, cause);
    this.eventType = eventType;
    this.eventVersion = eventVersion;
  }

  public final String getEventType() {
    return eventType;
  }

  public final int getEventVersion() {
    return eventVersion;
  }
}
