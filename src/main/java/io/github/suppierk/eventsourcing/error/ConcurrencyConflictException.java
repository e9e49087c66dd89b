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
import java.util.OptionalLong;

/**
 * Thrown when an append loses the optimistic lock: the aggregate version moved between the time
 * it was read and the time the new events were written.
 *
 * <p>The command itself was valid. Callers are expected to reload the aggregate, decide again and
 * re-append, up to a bounded number of attempts.
 *
 * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
 */
public class ConcurrencyConflictException extends EventSourcingException {
  @Serial private static final long serialVersionUID = 4517340934981260114L;

  private static final long UNKNOWN_VERSION = -1L;

  private final String aggregateType;
  private final String aggregateId;
  private final long expectedVersion;
  private final long actualVersion;

  /**
   * Conflict detected by comparing versions before writing.
   *
   * @param aggregateType of the contended aggregate
   * @param aggregateId of the contended aggregate
   * @param expectedVersion the writer assumed
   * @param actualVersion found in the store
   */
  public ConcurrencyConflictException(
      String aggregateType, String aggregateId, long expectedVersion, long actualVersion) {
    super(
        ErrorCode.CONFLICT,
        "Aggregate %s/%s is at version %d, expected %d"
            .formatted(aggregateType, aggregateId, actualVersion, expectedVersion));
    this.aggregateType = aggregateType;
    this.aggregateId = aggregateId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  /**
   * Conflict detected by the store's uniqueness constraint, when a racing writer committed first.
   *
   * @param aggregateType of the contended aggregate
   * @param aggregateId of the contended aggregate
   * @param expectedVersion the writer assumed
   * @param cause reported by the store
   */
  public ConcurrencyConflictException(
      String aggregateType, String aggregateId, long expectedVersion, Throwable cause) {
    super(
        ErrorCode.CONFLICT,
        "Aggregate %s/%s moved past version %d concurrently"
            .formatted(aggregateType, aggregateId, expectedVersion),
        cause);
    this.aggregateType = aggregateType;
    this.aggregateId = aggregateId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = UNKNOWN_VERSION;
  }

  public final String getAggregateType() {
    return aggregateType;
  }

  public final String getAggregateId() {
    return aggregateId;
  }

  public final long getExpectedVersion() {
    return expectedVersion;
  }

  /**
   * @return version found in the store, empty when the conflict came from a constraint violation
   */
  public final OptionalLong getActualVersion() {
    return actualVersion == UNKNOWN_VERSION
        ? OptionalLong.empty()
        : OptionalLong.of(actualVersion);
  }
}
