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

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.eventsourcing.event.Jsons;
import io.github.suppierk.eventsourcing.event.StoredEvent;

/** Turns a stored event into the data of an {@link SseFrame.Event}. */
@FunctionalInterface
public interface SseEventRenderer {
  String render(StoredEvent event);

  /**
   * @return renderer producing the JSON envelope of the event
   */
  static SseEventRenderer json() {
    return event -> {
      final ObjectNode envelope = Jsons.object();
      envelope.put("global_sequence", event.globalSequence());
      envelope.put("aggregate_type", event.aggregateType());
      envelope.put("aggregate_id", event.aggregateId());
      envelope.put("aggregate_sequence", event.aggregateSequence());
      envelope.put("event_type", event.eventType());
      envelope.put("event_version", event.eventVersion());
      envelope.set("payload", event.payload());
      envelope.set("metadata", Jsons.mapper().valueToTree(event.metadata()));
      envelope.put("created_at", event.createdAt().toString());
      return Jsons.toJson(envelope);
    };
  }
}
