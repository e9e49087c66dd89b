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

package io.github.suppierk.eventsourcing.upcast;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.eventsourcing.core.Suspicious;
import io.github.suppierk.eventsourcing.error.SchemaException;
import io.github.suppierk.eventsourcing.event.StoredEvent;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered collection of {@link Upcaster}s, keyed by aggregate type, event type and source version.
 *
 * <p>Event type names are only unique within an aggregate type, so two aggregates may both store
 * a {@code Created} event and evolve them independently.
 *
 * <p>An event whose kind has no registered current version passes through unchanged, and so does
 * an event already at its current version. Any other event is walked step by step up to the
 * current version, failing with {@link SchemaException} when a step is missing.
 */
public final class UpcasterChain extends Suspicious {
  private static final Logger logger = LoggerFactory.getLogger(UpcasterChain.class);

  private static final UpcasterChain EMPTY = new UpcasterChain(Map.of(), Map.of());

  private final Map<EventKind, Map<Integer, Upcaster>> steps;
  private final Map<EventKind, Integer> currentVersions;

  private UpcasterChain(
      Map<EventKind, Map<Integer, Upcaster>> steps, Map<EventKind, Integer> currentVersions) {
    this.steps = steps;
    this.currentVersions = currentVersions;
  }

  /**
   * @return a chain which leaves every event unchanged
   */
  public static UpcasterChain empty() {
    return EMPTY;
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @param aggregateType owning the event variant
   * @param eventType stored name of an event variant
   * @return the version events of that kind are brought to, empty when the kind is unknown
   */
  public OptionalInt currentVersion(String aggregateType, String eventType) {
    final Integer version = currentVersions.get(new EventKind(aggregateType, eventType));
    return version == null ? OptionalInt.empty() : OptionalInt.of(version);
  }

  /**
   * @param aggregateType owning the event variant
   * @param eventType stored name of an event variant
   * @param version of a stored payload
   * @return {@code true} if a payload of that version can be brought to the current version
   */
  public boolean canUpcast(String aggregateType, String eventType, int version) {
    final EventKind kind = new EventKind(aggregateType, eventType);
    final Integer current = currentVersions.get(kind);

    if (current == null) {
      return true;
    }

    if (version < 1 || version > current) {
      return false;
    }

    final Map<Integer, Upcaster> kindSteps = steps.getOrDefault(kind, Map.of());

    for (int v = version; v < current; v++) {
      if (!kindSteps.containsKey(v)) {
        return false;
      }
    }

    return true;
  }

  /**
   * @param event as read from storage
   * @return the same event if no transformation is needed, otherwise an upcasted copy
   * @throws SchemaException if the stored version cannot be bridged
   */
  public StoredEvent upcast(StoredEvent event) {
    final StoredEvent nonNullEvent = throwIllegalArgumentIfNull(event, "Stored event");
    final Integer current =
        currentVersions.get(new EventKind(nonNullEvent.aggregateType(), nonNullEvent.eventType()));

    if (current == null || current == nonNullEvent.eventVersion()) {
      return nonNullEvent;
    }

    final ObjectNode upcasted =
        upcast(
            nonNullEvent.aggregateType(),
            nonNullEvent.eventType(),
            nonNullEvent.eventVersion(),
            nonNullEvent.payload());

    logger.debug(
        "Upcasted {}.{} #{} from v{} to v{}",
        nonNullEvent.aggregateType(),
        nonNullEvent.eventType(),
        nonNullEvent.globalSequence(),
        nonNullEvent.eventVersion(),
        current);

    return nonNullEvent.withPayload(current, upcasted);
  }

  /**
   * @param aggregateType owning the event variant
   * @param eventType stored name of the event variant
   * @param version of the payload
   * @param payload which is left untouched
   * @return a payload at the current version
   * @throws SchemaException if the stored version cannot be bridged
   */
  public ObjectNode upcast(
      String aggregateType, String eventType, int version, ObjectNode payload) {
    final EventKind kind =
        new EventKind(
            throwIllegalArgumentIfNull(aggregateType, "Aggregate type"),
            throwIllegalArgumentIfNull(eventType, "Event type"));
    throwIllegalArgumentIfNull(payload, "Payload");

    final Integer current = currentVersions.get(kind);

    if (current == null || current == version) {
      return payload;
    }

    if (version > current) {
      throw new SchemaException(
          eventType,
          version,
          "Stored %s v%d is newer than the supported v%d".formatted(kind, version, current));
    }

    final Map<Integer, Upcaster> kindSteps = steps.getOrDefault(kind, Map.of());
    ObjectNode result = payload.deepCopy();

    for (int v = version; v < current; v++) {
      final Upcaster step = kindSteps.get(v);

      if (step == null) {
        throw new SchemaException(
            eventType,
            version,
            "No upcaster for %s from v%d to v%d".formatted(kind, v, current));
      }

      result = step.upcast(result);

      if (result == null) {
        throw new SchemaException(
            eventType, version, "Upcaster for %s v%d produced no payload".formatted(kind, v));
      }
    }

    return result;
  }

  private record EventKind(String aggregateType, String eventType) {
    @Override
    public String toString() {
      return aggregateType + "." + eventType;
    }
  }

  /** Collects upcasters and current versions before freezing them into a chain. */
  public static final class Builder {
    private final Map<EventKind, Map<Integer, Upcaster>> steps = new HashMap<>();
    private final Map<EventKind, Integer> currentVersions = new HashMap<>();

    private Builder() {}

    /**
     * Registers a single step. The current version of its event kind is raised to the step's
     * target version if needed.
     *
     * @param upcaster to register
     * @return this builder
     * @throws IllegalArgumentException if the upcaster is {@code null}, does not name its types or
     *     does not advance the version by exactly one
     * @throws IllegalStateException if a step from the same version is already registered
     */
    public Builder register(Upcaster upcaster) {
      if (upcaster == null) {
        throw new IllegalArgumentException("Upcaster cannot be null");
      }

      final EventKind kind = kindOf(upcaster.aggregateType(), upcaster.eventType());

      if (upcaster.fromVersion() < 1 || upcaster.toVersion() != upcaster.fromVersion() + 1) {
        throw new IllegalArgumentException(
            "Upcaster for %s must step from a positive version to the next one".formatted(kind));
      }

      final Map<Integer, Upcaster> kindSteps =
          steps.computeIfAbsent(kind, ignored -> new HashMap<>());

      if (kindSteps.putIfAbsent(upcaster.fromVersion(), upcaster) != null) {
        throw new IllegalStateException(
            "Upcaster for %s v%d is already registered".formatted(kind, upcaster.fromVersion()));
      }

      currentVersions.merge(kind, upcaster.toVersion(), Math::max);
      return this;
    }

    /**
     * Declares the version the code currently expects for an event kind, even when no upcaster
     * exists for it yet.
     *
     * @param aggregateType owning the event variant
     * @param eventType stored name of the event variant
     * @param version current version, at least 1
     * @return this builder
     */
    public Builder currentVersion(String aggregateType, String eventType, int version) {
      final EventKind kind = kindOf(aggregateType, eventType);

      if (version < 1) {
        throw new IllegalArgumentException("Event version must be positive");
      }

      currentVersions.merge(kind, version, Math::max);
      return this;
    }

    /**
     * @return an immutable chain
     */
    public UpcasterChain build() {
      final Map<EventKind, Map<Integer, Upcaster>> frozenSteps = new HashMap<>();
      steps.forEach((kind, kindSteps) -> frozenSteps.put(kind, Map.copyOf(kindSteps)));
      return new UpcasterChain(
          Collections.unmodifiableMap(frozenSteps), Map.copyOf(currentVersions));
    }

    private static EventKind kindOf(String aggregateType, String eventType) {
      if (aggregateType == null) {
        throw new IllegalArgumentException("Aggregate type cannot be null");
      }

      if (eventType == null) {
        throw new IllegalArgumentException("Event type cannot be null");
      }

      return new EventKind(aggregateType, eventType);
    }
  }
}
