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

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.eventsourcing.error.EventBusException;
import io.github.suppierk.eventsourcing.event.StoredEvent;
import io.github.suppierk.eventsourcing.testing.TestEvents;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class InProcessEventBusTest {
  static final String NAMESPACE = "events";

  final InProcessEventBus bus = new InProcessEventBus(NAMESPACE);

  @AfterEach
  void tearDown() {
    bus.close();
  }

  @Test
  void when_namespace_is_not_a_segment_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new InProcessEventBus(null));
    assertThrows(IllegalArgumentException.class, () -> new InProcessEventBus(" "));
    assertThrows(IllegalArgumentException.class, () -> new InProcessEventBus("a/b"));
  }

  @Test
  void events_published_before_consumer_attaches_must_be_buffered_in_order() {
    final var subscription = bus.subscribe(KeyExpression.allEvents(NAMESPACE));
    final StoredEvent first = TestEvents.stored(1, "Todo", "a", 1);
    final StoredEvent second = TestEvents.stored(2, "Todo", "b", 1);

    bus.publish(first);
    bus.publish(second);

    StepVerifier.create(subscription.events())
        .expectNext(first, second)
        .then(subscription::close)
        .verifyComplete();
  }

  @Test
  void only_matching_subscribers_must_receive_event() {
    final var todos = bus.subscribe(KeyExpression.aggregateTypePattern(NAMESPACE, "Todo"));
    final var notes = bus.subscribe(KeyExpression.aggregateTypePattern(NAMESPACE, "Note"));
    final StoredEvent note = TestEvents.stored(1, "Note", "n", 1);
    final StoredEvent todo = TestEvents.stored(2, "Todo", "a", 1);

    bus.publish(note);
    bus.publish(todo);
    todos.close();
    notes.close();

    StepVerifier.create(todos.events()).expectNext(todo).verifyComplete();
    StepVerifier.create(notes.events()).expectNext(note).verifyComplete();
  }

  @Test
  void closing_subscription_must_unregister_it() {
    final var subscription = bus.subscribe(KeyExpression.allEvents(NAMESPACE));
    assertEquals(1, bus.getSubscriberCount());

    subscription.close();

    assertTrue(subscription.isClosed());
    assertEquals(0, bus.getSubscriberCount());
    assertDoesNotThrow(() -> bus.publish(TestEvents.stored(1, "Todo", "a", 1)));
  }

  @Test
  void cancelling_consumer_must_unregister_subscription() {
    final var subscription = bus.subscribe(KeyExpression.allEvents(NAMESPACE));

    StepVerifier.create(subscription.events())
        .expectSubscription()
        .expectNoEvent(Duration.ofMillis(10))
        .thenCancel()
        .verify();

    assertTrue(subscription.isClosed());
    assertEquals(0, bus.getSubscriberCount());
  }

  @Test
  void closed_bus_must_complete_subscribers_and_reject_publications() {
    final var subscription = bus.subscribe(KeyExpression.allEvents(NAMESPACE));
    final var event = TestEvents.stored(1, "Todo", "a", 1);
    final var pattern = KeyExpression.allEvents(NAMESPACE);

    bus.close();

    StepVerifier.create(subscription.events()).verifyComplete();
    assertThrows(EventBusException.class, () -> bus.publish(event));
    assertThrows(EventBusException.class, () -> bus.subscribe(pattern));
  }

  @Test
  void noop_bus_must_never_deliver() {
    final var subscription = EventBus.noop().subscribe(KeyExpression.allEvents(NAMESPACE));

    EventBus.noop().publish(TestEvents.stored(1, "Todo", "a", 1));

    StepVerifier.create(subscription.events())
        .expectSubscription()
        .expectNoEvent(Duration.ofMillis(20))
        .thenCancel()
        .verify();
    subscription.close();
    assertTrue(subscription.isClosed());
  }
}
