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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.eventsourcing.error.SchemaException;
import io.github.suppierk.eventsourcing.upcast.Upcaster;

/** {@code Created} v1 stored the text as {@code title}. */
final class TodoCreatedV1Upcaster implements Upcaster {
  @Override
  public String aggregateType() {
    return TodoEventCodec.AGGREGATE_TYPE;
  }

  @Override
  public String eventType() {
    return TodoEventCodec.CREATED;
  }

  @Override
  public int fromVersion() {
    return 1;
  }

  @Override
  public ObjectNode upcast(ObjectNode payload) {
    final JsonNode title = payload.remove("title");

    if (title == null || !title.isTextual()) {
      throw new SchemaException(eventType(), fromVersion(), "Created v1 has no textual title");
    }

    payload.set("text", title);
    return payload;
  }
}
