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

import io.github.suppierk.eventsourcing.error.ConcurrencyConflictException;
import io.github.suppierk.eventsourcing.error.DomainException;
import io.github.suppierk.eventsourcing.error.InfrastructureException;
import io.github.suppierk.eventsourcing.error.SchemaException;
import io.github.suppierk.eventsourcing.event.NewEvent;
import io.github.suppierk.eventsourcing.event.StoredEvent;
import java.util.List;
import java.util.OptionalLong;

/**
 * Append-only, transactional store of events.
 *
 * <p>Every event receives two numbers on append:
 *
 * <ul>
 *   <li>an aggregate sequence, 1-based and gap-free within its aggregate, which doubles as the
 *       optimistic lock;
 *   <li>a global sequence, strictly increasing across the store, which orders every stream.
 * </ul>
 *
 * <p>Everything returned by the read operations has already passed through the upcaster chain.
 */
public interface EventRepository {
  /**
   * Appends events to one aggregate atomically.
   *
   * @param events to append, all targeting the same aggregate, may be empty
   * @param expectedVersion aggregate sequence of the last event the caller has seen, {@code 0} for
   *     a new aggregate
   * @return appended events in order, with sequences assigned
   * @throws ConcurrencyConflictException if the aggregate is not at {@code expectedVersion}
   * @throws DomainException if the aggregate was finalized by an earlier event
   * @throws IllegalArgumentException if events target more than one aggregate
   * @throws InfrastructureException if the store fails, the caller cannot assume non-commit
   */
  List<StoredEvent> append(List<NewEvent> events, long expectedVersion);

  /**
   * @param aggregateType tag of the aggregate type
   * @param aggregateId identifier of the aggregate
   * @return every event of the aggregate in sequence order, empty if it was never created
   * @throws SchemaException if a stored event cannot be upcasted
   */
  List<StoredEvent> load(String aggregateType, String aggregateId);

  /**
   * @param globalSequence exclusive lower bound, {@code 0} for everything
   * @return every event with a greater global sequence, in global order
   * @throws SchemaException if a stored event cannot be upcasted
   */
  List<StoredEvent> querySinceGlobalSequence(long globalSequence);

  /**
   * @return global sequence of the oldest retained event, empty for an empty store
   */
  OptionalLong earliestGlobalSequence();

  /**
   * @return global sequence of the newest event, empty for an empty store
   */
  OptionalLong latestGlobalSequence();

  /**
   * Retention: removes every event below the given global sequence. Clients holding a cursor
   * below the new earliest sequence will be asked to resynchronize.
   *
   * @param globalSequence exclusive upper bound of removed events
   * @return number of removed events
   */
  int compactBefore(long globalSequence);
}
