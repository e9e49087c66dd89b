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

package io.github.suppierk.eventsourcing.store;

import static io.github.suppierk.eventsourcing.store.EventsTable.AGGREGATE_ID;
import static io.github.suppierk.eventsourcing.store.EventsTable.AGGREGATE_SEQUENCE;
import static io.github.suppierk.eventsourcing.store.EventsTable.AGGREGATE_TYPE;
import static io.github.suppierk.eventsourcing.store.EventsTable.ALL_COLUMNS;
import static io.github.suppierk.eventsourcing.store.EventsTable.CREATED_AT;
import static io.github.suppierk.eventsourcing.store.EventsTable.EVENTS;
import static io.github.suppierk.eventsourcing.store.EventsTable.EVENT_ID;
import static io.github.suppierk.eventsourcing.store.EventsTable.EVENT_TYPE;
import static io.github.suppierk.eventsourcing.store.EventsTable.EVENT_VERSION;
import static io.github.suppierk.eventsourcing.store.EventsTable.GLOBAL_SEQUENCE;
import static io.github.suppierk.eventsourcing.store.EventsTable.IS_FINAL;
import static io.github.suppierk.eventsourcing.store.EventsTable.METADATA;
import static io.github.suppierk.eventsourcing.store.EventsTable.PAYLOAD;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.eventsourcing.core.Suspicious;
import io.github.suppierk.eventsourcing.error.ConcurrencyConflictException;
import io.github.suppierk.eventsourcing.error.DomainException;
import io.github.suppierk.eventsourcing.error.ErrorCode;
import io.github.suppierk.eventsourcing.error.SchemaException;
import io.github.suppierk.eventsourcing.event.EventMetadata;
import io.github.suppierk.eventsourcing.event.Jsons;
import io.github.suppierk.eventsourcing.event.NewEvent;
import io.github.suppierk.eventsourcing.event.StoredEvent;
import io.github.suppierk.eventsourcing.upcast.UpcasterChain;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.function.Supplier;
import org.jooq.Condition;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventRepository} on top of jOOQ and any JDBC database which can run {@code
 * db/events.sql}.
 *
 * <p>Appends run in a single transaction on the read-write {@link DSLContext}: the current
 * aggregate version is compared with the expected one, then rows are inserted with consecutive
 * aggregate sequences. The unique constraint on {@code (aggregate_type, aggregate_id,
 * aggregate_sequence)} settles races the version check cannot see.
 *
 * <p>Reads go to the read-only {@link DSLContext}, are retried on transient failures and are
 * upcasted before being returned.
 */
public final class JooqEventRepository extends Suspicious implements EventRepository {
  private static final Logger logger = LoggerFactory.getLogger(JooqEventRepository.class);

  static final String STREAM_FINALIZED = "stream_finalized";

  private final DSLContext readWriteDsl;
  private final DSLContext readOnlyDsl;
  private final UpcasterChain upcasters;
  private final ReadRetryPolicy readRetryPolicy;

  /**
   * @param readWriteDsl for appends and retention
   * @param readOnlyDsl for loads and queries
   * @param upcasters applied to every loaded event
   * @param readRetryPolicy applied to every read
   */
  public JooqEventRepository(
      DSLContext readWriteDsl,
      DSLContext readOnlyDsl,
      UpcasterChain upcasters,
      ReadRetryPolicy readRetryPolicy) {
    this.readWriteDsl = throwIllegalArgumentIfNull(readWriteDsl, "Read-write DSL");
    this.readOnlyDsl = throwIllegalArgumentIfNull(readOnlyDsl, "Read-only DSL");
    this.upcasters = throwIllegalArgumentIfNull(upcasters, "Upcaster chain");
    this.readRetryPolicy = throwIllegalArgumentIfNull(readRetryPolicy, "Read retry policy");
  }

  /**
   * @param dsl for both reads and writes
   * @param upcasters applied to every loaded event
   */
  public JooqEventRepository(DSLContext dsl, UpcasterChain upcasters) {
    this(dsl, dsl, upcasters, ReadRetryPolicy.none());
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> append(List<NewEvent> events, long expectedVersion) {
    final List<NewEvent> nonNullEvents = throwIllegalArgumentIfNull(events, "Events");

    if (expectedVersion < 0) {
      throw new IllegalArgumentException("Expected version cannot be negative");
    }

    if (nonNullEvents.isEmpty()) {
      return List.of();
    }

    final NewEvent head = throwIllegalArgumentIfNull(nonNullEvents.get(0), "Event");
    final String aggregateType = head.aggregateType();
    final String aggregateId = head.aggregateId();

    for (int i = 0; i < nonNullEvents.size(); i++) {
      final NewEvent event = throwIllegalArgumentIfNull(nonNullEvents.get(i), "Event");

      if (!event.aggregateType().equals(aggregateType)
          || !event.aggregateId().equals(aggregateId)) {
        throw new IllegalArgumentException("All events of one append must target one aggregate");
      }

      if (event.isFinal() && i != nonNullEvents.size() - 1) {
        throw new IllegalArgumentException("Only the last event of an append can be final");
      }
    }

    final List<StoredEvent> stored;

    try {
      stored =
          readWriteDsl.transactionResult(
              (Configuration trx) ->
                  appendInTransaction(trx.dsl(), nonNullEvents, expectedVersion));
    } catch (DataAccessException e) {
      if (SqlExceptions.isIntegrityViolation(e)) {
        logger.debug(
            "Append to {}/{} at version {} lost a race",
            aggregateType,
            aggregateId,
            expectedVersion);
        throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedVersion, e);
      }

      throw SqlExceptions.translate("Append to %s/%s".formatted(aggregateType, aggregateId), e);
    }

    logger.debug(
        "Appended {} event(s) to {}/{}, global sequences {}..{}",
        stored.size(),
        aggregateType,
        aggregateId,
        stored.get(0).globalSequence(),
        stored.get(stored.size() - 1).globalSequence());

    return stored;
  }

  private List<StoredEvent> appendInTransaction(
      DSLContext dsl, List<NewEvent> events, long expectedVersion) {
    final NewEvent head = events.get(0);
    final Condition aggregate = aggregateCondition(head.aggregateType(), head.aggregateId());

    final boolean finalized =
        dsl.fetchExists(dsl.selectOne().from(EVENTS).where(aggregate.and(IS_FINAL.isTrue())));

    if (finalized) {
      throw new DomainException(
          ErrorCode.CONFLICT,
          STREAM_FINALIZED,
          "Aggregate %s/%s is finalized".formatted(head.aggregateType(), head.aggregateId()));
    }

    final Long currentMax =
        dsl.select(DSL.max(AGGREGATE_SEQUENCE))
            .from(EVENTS)
            .where(aggregate)
            .fetchOne(0, Long.class);
    final long currentVersion = currentMax == null ? 0L : currentMax;

    if (currentVersion != expectedVersion) {
      throw new ConcurrencyConflictException(
          head.aggregateType(), head.aggregateId(), expectedVersion, currentVersion);
    }

    final List<NewEvent> normalized = new ArrayList<>(events.size());
    final List<UUID> eventIds = new ArrayList<>(events.size());
    long sequence = expectedVersion;

    for (NewEvent event : events) {
      final NewEvent truncated = truncateCreatedAt(event);
      sequence++;

      dsl.insertInto(EVENTS)
          .set(EVENT_ID, truncated.eventId())
          .set(AGGREGATE_TYPE, truncated.aggregateType())
          .set(AGGREGATE_ID, truncated.aggregateId())
          .set(AGGREGATE_SEQUENCE, sequence)
          .set(EVENT_TYPE, truncated.eventType())
          .set(EVENT_VERSION, truncated.eventVersion())
          .set(PAYLOAD, Jsons.toJson(truncated.payload()))
          .set(METADATA, Jsons.toJson(truncated.metadata()))
          .set(IS_FINAL, truncated.isFinal())
          .set(CREATED_AT, OffsetDateTime.ofInstant(truncated.createdAt(), ZoneOffset.UTC))
          .execute();

      normalized.add(truncated);
      eventIds.add(truncated.eventId());
    }

    final Map<UUID, Long> globalSequences =
        dsl.select(EVENT_ID, GLOBAL_SEQUENCE)
            .from(EVENTS)
            .where(EVENT_ID.in(eventIds))
            .fetchMap(EVENT_ID, GLOBAL_SEQUENCE);

    final List<StoredEvent> stored = new ArrayList<>(normalized.size());
    long aggregateSequence = expectedVersion;

    for (NewEvent event : normalized) {
      final Long globalSequence =
          throwIllegalStateIfNull(globalSequences.get(event.eventId()), "Global sequence");
      stored.add(StoredEvent.of(event, globalSequence, ++aggregateSequence));
    }

    return List.copyOf(stored);
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> load(String aggregateType, String aggregateId) {
    throwIllegalArgumentIfNull(aggregateType, "Aggregate type");
    throwIllegalArgumentIfNull(aggregateId, "Aggregate id");

    final String operation = "Load of %s/%s".formatted(aggregateType, aggregateId);
    final List<Record> rows =
        read(
            operation,
            () ->
                readOnlyDsl
                    .select(ALL_COLUMNS)
                    .from(EVENTS)
                    .where(aggregateCondition(aggregateType, aggregateId))
                    .orderBy(AGGREGATE_SEQUENCE.asc())
                    .fetch());

    return toStoredEvents(rows);
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> querySinceGlobalSequence(long globalSequence) {
    final String operation = "Query since global sequence %d".formatted(globalSequence);
    final List<Record> rows =
        read(
            operation,
            () ->
                readOnlyDsl
                    .select(ALL_COLUMNS)
                    .from(EVENTS)
                    .where(GLOBAL_SEQUENCE.gt(globalSequence))
                    .orderBy(GLOBAL_SEQUENCE.asc())
                    .fetch());

    return toStoredEvents(rows);
  }

  /** {@inheritDoc} */
  @Override
  public OptionalLong earliestGlobalSequence() {
    final Long earliest =
        read(
            "Earliest global sequence",
            () ->
                readOnlyDsl.select(DSL.min(GLOBAL_SEQUENCE)).from(EVENTS).fetchOne(0, Long.class));
    return earliest == null ? OptionalLong.empty() : OptionalLong.of(earliest);
  }

  /** {@inheritDoc} */
  @Override
  public OptionalLong latestGlobalSequence() {
    final Long latest =
        read(
            "Latest global sequence",
            () ->
                readOnlyDsl.select(DSL.max(GLOBAL_SEQUENCE)).from(EVENTS).fetchOne(0, Long.class));
    return latest == null ? OptionalLong.empty() : OptionalLong.of(latest);
  }

  /** {@inheritDoc} */
  @Override
  public int compactBefore(long globalSequence) {
    try {
      final int removed =
          readWriteDsl.deleteFrom(EVENTS).where(GLOBAL_SEQUENCE.lt(globalSequence)).execute();
      logger.info("Compacted {} event(s) below global sequence {}", removed, globalSequence);
      return removed;
    } catch (DataAccessException e) {
      throw SqlExceptions.translate("Compaction before %d".formatted(globalSequence), e);
    }
  }

  private <T> T read(String operation, Supplier<T> query) {
    return readRetryPolicy.execute(
        operation,
        () -> {
          try {
            return query.get();
          } catch (DataAccessException e) {
            throw SqlExceptions.translate(operation, e);
          }
        });
  }

  private List<StoredEvent> toStoredEvents(List<Record> rows) {
    final List<StoredEvent> events = new ArrayList<>(rows.size());

    for (Record row : rows) {
      events.add(upcasters.upcast(toStoredEvent(row)));
    }

    return List.copyOf(events);
  }

  private StoredEvent toStoredEvent(Record row) {
    final long globalSequence = row.get(GLOBAL_SEQUENCE);
    final String eventType = row.get(EVENT_TYPE);
    final int eventVersion = row.get(EVENT_VERSION);

    final ObjectNode payload;
    final EventMetadata metadata;

    try {
      payload = Jsons.toObject(row.get(PAYLOAD));
      metadata = Jsons.fromObject(Jsons.toObject(row.get(METADATA)), EventMetadata.class);
    } catch (IllegalArgumentException e) {
      throw new SchemaException(
          eventType,
          eventVersion,
          "Event #%d (%s v%d) cannot be decoded".formatted(globalSequence, eventType, eventVersion),
          e);
    }

    return new StoredEvent(
        globalSequence,
        row.get(AGGREGATE_SEQUENCE),
        row.get(EVENT_ID),
        row.get(AGGREGATE_TYPE),
        row.get(AGGREGATE_ID),
        eventType,
        eventVersion,
        payload,
        metadata,
        row.get(CREATED_AT).toInstant(),
        Boolean.TRUE.equals(row.get(IS_FINAL)));
  }

  private static Condition aggregateCondition(String aggregateType, String aggregateId) {
    return AGGREGATE_TYPE.eq(aggregateType).and(AGGREGATE_ID.eq(aggregateId));
  }

  private static NewEvent truncateCreatedAt(NewEvent event) {
    final Instant truncated = event.createdAt().truncatedTo(ChronoUnit.MICROS);

    if (truncated.equals(event.createdAt())) {
      return event;
    }

    return new NewEvent(
        event.aggregateType(),
        event.aggregateId(),
        event.eventId(),
        event.eventType(),
        event.eventVersion(),
        event.payload(),
        event.metadata(),
        truncated,
        event.isFinal());
  }
}
