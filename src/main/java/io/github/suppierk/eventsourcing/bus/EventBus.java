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

import io.github.suppierk.eventsourcing.error.EventBusException;
import io.github.suppierk.eventsourcing.event.StoredEvent;
import reactor.core.publisher.Flux;

/**
 * Post-commit fan-out of stored events to subscribers addressed by {@link KeyExpression}s.
 *
 * <p>Publishing happens only after an append committed and is fire-and-forget: a failed
 * publication never undoes the append, since subscribers can always catch up from the
 * repository.
 */
public interface EventBus extends AutoCloseable {
  /**
   * @param event which has been committed
   * @throws EventBusException if the bus cannot accept the event
   */
  void publish(StoredEvent event);

  /**
   * @param pattern selecting the events to receive
   * @return a handle which starts buffering immediately
   * @throws EventBusException if the bus cannot register the subscription
   */
  EventSubscription subscribe(KeyExpression pattern);

  /**
   * @param namespace root segment consumers build their patterns with
   * @return {@code false} if keys published by this bus can never start with that namespace
   */
  default boolean publishesTo(String namespace) {
    return true;
  }

  /** Completes every open subscription and rejects further use. */
  @Override
  void close();

  /**
   * @return a bus which drops every publication and never delivers anything
   */
  static EventBus noop() {
    return NoOp.INSTANCE;
  }

  /** Bus for deployments where only the repository is used. */
  final class NoOp implements EventBus {
    private static final NoOp INSTANCE = new NoOp();

    private NoOp() {}

    @Override
    public void publish(StoredEvent event) {
      // Nothing listens
    }

    @Override
    public EventSubscription subscribe(KeyExpression pattern) {
      return new EventSubscription() {
        private volatile boolean closed;

        @Override
        public KeyExpression pattern() {
          return pattern;
        }

        @Override
        public Flux<StoredEvent> events() {
          return Flux.never();
        }

        @Override
        public boolean isClosed() {
          return closed;
        }

        @Override
        public void close() {
          closed = true;
        }
      };
    }

    @Override
    public void close() {
      // Nothing to release
    }
  }
}
