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

package io.github.suppierk.eventsourcing.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.suppierk.eventsourcing.core.CommandContext;
import java.util.UUID;

/**
 * Tracing information stored next to every event.
 *
 * @param correlationId shared by everything caused by one user-level interaction
 * @param causationId id of the command which produced the event, if known
 * @param actor who issued the command, if known
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventMetadata(
    @JsonProperty("correlation_id") UUID correlationId,
    @JsonProperty("causation_id") UUID causationId,
    @JsonProperty("actor") String actor) {
  public EventMetadata {
    if (correlationId == null) {
      throw new IllegalArgumentException("Correlation id cannot be null");
    }
  }

  /**
   * @param context of the command producing the event
   * @return metadata linking the event back to the command
   */
  public static EventMetadata from(CommandContext context) {
    return new EventMetadata(context.correlationId(), context.commandId(), context.actor());
  }

  /**
   * @param correlationId to record
   * @return metadata with no causation and no actor
   */
  public static EventMetadata correlatedWith(UUID correlationId) {
    return new EventMetadata(correlationId, null, null);
  }
}
