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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Shared Jackson setup for event payloads, metadata and stream envelopes. */
public final class Jsons {
  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .addModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .build();

  private Jsons() {
    // Utility class
  }

  /**
   * @return the shared mapper, which must not be reconfigured
   */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * @return a new empty JSON object
   */
  public static ObjectNode object() {
    return MAPPER.createObjectNode();
  }

  /**
   * @param value to serialize
   * @return compact JSON text
   * @throws IllegalArgumentException if the value cannot be serialized
   */
  public static String toJson(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "%s cannot be serialized".formatted(value.getClass().getSimpleName()), e);
    }
  }

  /**
   * @param json text holding a JSON object
   * @return parsed object
   * @throws IllegalArgumentException if the text is not a JSON object
   */
  public static ObjectNode toObject(String json) {
    final JsonNode node;

    try {
      node = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed JSON", e);
    }

    if (node instanceof ObjectNode objectNode) {
      return objectNode;
    }

    throw new IllegalArgumentException("Expected JSON object");
  }

  /**
   * @param value to convert
   * @return the value as a JSON object tree
   * @throws IllegalArgumentException if the value does not map to a JSON object
   */
  public static ObjectNode toObject(Object value) {
    final JsonNode node = MAPPER.valueToTree(value);

    if (node instanceof ObjectNode objectNode) {
      return objectNode;
    }

    throw new IllegalArgumentException(
        "%s does not map to a JSON object".formatted(value.getClass().getSimpleName()));
  }

  /**
   * @param payload to convert
   * @param type to convert into
   * @param <T> target type
   * @return converted value
   * @throws IllegalArgumentException if the payload does not fit the type
   */
  public static <T> T fromObject(ObjectNode payload, Class<T> type) {
    try {
      return MAPPER.treeToValue(payload, type);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Payload does not fit %s".formatted(type.getSimpleName()), e);
    }
  }
}
