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

package io.github.suppierk.eventsourcing.bus;

import io.github.suppierk.eventsourcing.event.StoredEvent;
import java.util.List;
import java.util.Objects;

/**
 * Hierarchical address of bus publications and subscriptions.
 *
 * <p>Concrete keys have the shape {@code {namespace}/{aggregate_type}/{aggregate_id}/{sequence}}.
 * Patterns may contain two wildcards, each occupying a whole segment:
 *
 * <ul>
 *   <li>{@code *} matches exactly one segment;
 *   <li>{@code **} matches zero or more segments.
 * </ul>
 */
public final class KeyExpression {
  public static final String SEPARATOR = "/";
  public static final String SINGLE_WILDCARD = "*";
  public static final String MULTI_WILDCARD = "**";

  private final String expression;
  private final List<String> segments;

  private KeyExpression(String expression, List<String> segments) {
    this.expression = expression;
    this.segments = segments;
  }

  /**
   * @param expression to parse
   * @return parsed expression
   * @throws IllegalArgumentException if the expression is blank, has empty segments or uses a
   *     wildcard as part of a segment
   */
  public static KeyExpression parse(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new IllegalArgumentException("Key expression cannot be blank");
    }

    final String[] parts = expression.split(SEPARATOR, -1);

    for (String part : parts) {
      if (part.isEmpty()) {
        throw new IllegalArgumentException(
            "Key expression '%s' has an empty segment".formatted(expression));
      }

      if (part.contains(SINGLE_WILDCARD)
          && !part.equals(SINGLE_WILDCARD)
          && !part.equals(MULTI_WILDCARD)) {
        throw new IllegalArgumentException(
            "Wildcards must span a whole segment in '%s'".formatted(expression));
      }
    }

    return new KeyExpression(expression, List.of(parts));
  }

  /**
   * @param namespace root segment
   * @return pattern matching every event of the namespace
   */
  public static KeyExpression allEvents(String namespace) {
    return parse(String.join(SEPARATOR, namespace, MULTI_WILDCARD));
  }

  /**
   * @param namespace root segment
   * @param aggregateType to scope to
   * @return pattern matching every event of one aggregate type
   */
  public static KeyExpression aggregateTypePattern(String namespace, String aggregateType) {
    return parse(String.join(SEPARATOR, namespace, aggregateType, MULTI_WILDCARD));
  }

  /**
   * @param namespace root segment
   * @param aggregateType of the aggregate
   * @param aggregateId of the aggregate
   * @return pattern matching every event of one aggregate
   */
  public static KeyExpression aggregateInstancePattern(
      String namespace, String aggregateType, String aggregateId) {
    return parse(String.join(SEPARATOR, namespace, aggregateType, aggregateId, SINGLE_WILDCARD));
  }

  /**
   * @param namespace root segment
   * @param event to address
   * @return concrete key of the event
   */
  public static String eventKey(String namespace, StoredEvent event) {
    return String.join(
        SEPARATOR,
        namespace,
        event.aggregateType(),
        event.aggregateId(),
        Long.toString(event.aggregateSequence()));
  }

  /**
   * @param key concrete key
   * @return {@code true} if this pattern covers the key
   */
  public boolean matches(String key) {
    if (key == null || key.isEmpty()) {
      return false;
    }

    return matches(0, key.split(SEPARATOR, -1), 0);
  }

  private boolean matches(int segmentIndex, String[] key, int keyIndex) {
    if (segmentIndex == segments.size()) {
      return keyIndex == key.length;
    }

    final String segment = segments.get(segmentIndex);

    if (segment.equals(MULTI_WILDCARD)) {
      for (int next = keyIndex; next <= key.length; next++) {
        if (matches(segmentIndex + 1, key, next)) {
          return true;
        }
      }

      return false;
    }

    if (keyIndex == key.length) {
      return false;
    }

    return (segment.equals(SINGLE_WILDCARD) || segment.equals(key[keyIndex]))
        && matches(segmentIndex + 1, key, keyIndex + 1);
  }

  /**
   * @param namespace root segment
   * @param event to check
   * @return {@code true} if this pattern covers the event's key
   */
  public boolean matches(String namespace, StoredEvent event) {
    return matches(eventKey(namespace, event));
  }

  /**
   * @return {@code true} if any segment is a wildcard
   */
  public boolean isPattern() {
    return segments.stream().anyMatch(KeyExpression::isWildcard);
  }

  private static boolean isWildcard(String segment) {
    return segment.equals(SINGLE_WILDCARD) || segment.equals(MULTI_WILDCARD);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    return expression.equals(((KeyExpression) o).expression);
  }

  @Override
  public int hashCode() {
    return Objects.hash(expression);
  }

  @Override
  public String toString() {
    return expression;
  }
}
