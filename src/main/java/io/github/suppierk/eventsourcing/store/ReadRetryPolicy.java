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

import io.github.suppierk.eventsourcing.config.EventSourcingConfig;
import io.github.suppierk.eventsourcing.error.InfrastructureException;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Retries idempotent reads on transient {@link InfrastructureException}s with capped exponential
 * backoff. Never use it around writes.
 *
 * <p>Waits between attempts are scheduled by Reactor while the calling thread blocks, so reads
 * must not be retried on a non-blocking scheduler thread.
 */
public final class ReadRetryPolicy {
  private static final Logger logger = LoggerFactory.getLogger(ReadRetryPolicy.class);

  private static final ReadRetryPolicy NONE =
      new ReadRetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(1));

  private final int maxAttempts;
  private final Duration initialBackoff;
  private final Duration maxBackoff;

  /**
   * @param maxAttempts total attempts including the first one
   * @param initialBackoff wait before the second attempt
   * @param maxBackoff upper bound of any single wait
   */
  public ReadRetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("Attempts must be positive");
    }

    if (initialBackoff == null || initialBackoff.isNegative()) {
      throw new IllegalArgumentException("Initial backoff must not be negative");
    }

    if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("Max backoff must not be below initial backoff");
    }

    this.maxAttempts = maxAttempts;
    this.initialBackoff = initialBackoff;
    this.maxBackoff = maxBackoff;
  }

  /**
   * @return a policy which never retries
   */
  public static ReadRetryPolicy none() {
    return NONE;
  }

  /**
   * @param config holding the read retry settings
   * @return matching policy
   */
  public static ReadRetryPolicy from(EventSourcingConfig config) {
    return new ReadRetryPolicy(
        config.getReadRetryAttempts(),
        config.getReadRetryBackoff(),
        config.getReadRetryMaxBackoff());
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * @param operation name used in log lines
   * @param read idempotent operation
   * @param <T> result type
   * @return result of the first successful attempt
   * @throws InfrastructureException from the last attempt, or immediately if not transient
   */
  public <T> T execute(String operation, Supplier<T> read) {
    if (maxAttempts == 1) {
      return read.get();
    }

    return Mono.fromSupplier(read)
        .retryWhen(
            Retry.backoff(maxAttempts - 1L, initialBackoff)
                .maxBackoff(maxBackoff)
                .jitter(0d)
                .filter(ReadRetryPolicy::isTransient)
                .doBeforeRetry(
                    signal ->
                        logger.warn(
                            "{} failed on attempt {}/{}, retrying",
                            operation,
                            signal.totalRetries() + 1,
                            maxAttempts,
                            signal.failure()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
        .block();
  }

  private static boolean isTransient(Throwable failure) {
    return failure instanceof InfrastructureException infrastructure
        && infrastructure.isTransient();
  }
}
