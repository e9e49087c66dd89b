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
import reactor.core.publisher.Flux;

/**
 * Consumer-side handle of a bus subscription.
 *
 * <p>Events are buffered from the moment the subscription is created, even before anyone
 * subscribes to {@link #events()}. Closing the handle unregisters it from the bus and completes
 * the stream.
 */
public interface EventSubscription extends AutoCloseable {
  /**
   * @return pattern this subscription was created with
   */
  KeyExpression pattern();

  /**
   * @return matching events in publication order, may be subscribed to only once
   */
  Flux<StoredEvent> events();

  /**
   * @return {@code true} once closed by the consumer or by the bus
   */
  boolean isClosed();

  /** Unregisters this subscription, idempotent. */
  @Override
  void close();
}
