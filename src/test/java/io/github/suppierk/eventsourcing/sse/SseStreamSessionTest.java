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

package io.github.suppierk.eventsourcing.sse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.eventsourcing.bus.InProcessEventBus;
import io.github.suppierk.eventsourcing.bus.KeyExpression;
import io.github.suppierk.eventsourcing.event.Jsons;
import io.github.suppierk.eventsourcing.event.StoredEvent;
import io.github.suppierk.eventsourcing.store.EventRepository;
import io.github.suppierk.eventsourcing.store.JooqEventRepository;
import io.github.suppierk.eventsourcing.testing.ForwardingEventRepository;
import io.github.suppierk.eventsourcing.testing.TestDatabase;
import io.github.suppierk.eventsourcing.testing.TestEvents;
import io.github.suppierk.eventsourcing.upcast.UpcasterChain;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class SseStreamSessionTest {
  static final String NAMESPACE = "events";
  static final String TYPE = "Todo";
  static final Duration TIMEOUT = Duration.ofSeconds(5);
  static final Duration QUIET = Duration.ofMillis(200);

  static final SseSessionConfig CONFIG =
      new SseSessionConfig(
          NAMESPACE, Duration.ofHours(1), CursorPolicy.FROM_BEGINNING, SseEventRenderer.json());

  final AtomicInteger ids = new AtomicInteger();

  EventRepository repository;
  InProcessEventBus bus;

  @BeforeEach
  void setUp() {
    repository = new JooqEventRepository(TestDatabase.create(), UpcasterChain.empty());
    bus = new InProcessEventBus(NAMESPACE);
  }

  @AfterEach
  void tearDown() {
    bus.close();
  }

  /** Appends a creation of a fresh aggregate without publishing it. */
  StoredEvent commit() {
    return commit(TYPE);
  }

  StoredEvent commit(String aggregateType) {
    final String id = "t" + ids.incrementAndGet();
    return repository.append(List.of(TestEvents.newEvent(aggregateType, id, "Created")), 0).get(0);
  }

  StoredEvent commitAndPublish() {
    final StoredEvent event = commit();
    bus.publish(event);
    return event;
  }

  SseStreamSession session(OptionalLong cursor) {
    return session(KeyExpression.allEvents(NAMESPACE), cursor, CONFIG);
  }

  SseStreamSession session(KeyExpression pattern, OptionalLong cursor, SseSessionConfig config) {
    return new SseStreamSession(repository, bus, config, pattern, cursor);
  }

  static boolean isEvent(SseFrame frame, long id) {
    return frame instanceof SseFrame.Event event && event.id() == id;
  }

  @Nested
  class Replay {
    @Test
    void fresh_connection_must_receive_committed_event_with_its_global_sequence() {
      final StoredEvent created = commitAndPublish();
      final var session = session(OptionalLong.empty());

      StepVerifier.create(session.frames())
          .assertNext(
              frame -> {
                final var event = (SseFrame.Event) frame;
                assertEquals(created.globalSequence(), event.id());
                assertEquals("Created", event.event());
                assertEquals(
                    created.globalSequence(),
                    Jsons.toObject(event.data()).get("global_sequence").asLong());
              })
          .thenCancel()
          .verify(TIMEOUT);
    }

    @Test
    void reconnecting_client_must_receive_exactly_the_missed_events_then_live_ones() {
      final long n = commit().globalSequence();
      commit();
      commit();
      final var session = session(OptionalLong.of(n));

      StepVerifier.create(session.frames())
          .expectNextMatches(frame -> isEvent(frame, n + 1))
          .expectNextMatches(frame -> isEvent(frame, n + 2))
          .then(SseStreamSessionTest.this::commitAndPublish)
          .expectNextMatches(frame -> isEvent(frame, n + 3))
          .thenCancel()
          .verify(TIMEOUT);

      assertEquals(n + 3, session.lastSentSequence());
    }

    @Test
    void cursor_at_latest_must_replay_nothing() {
      final long n = commit().globalSequence();
      final var session = session(OptionalLong.of(n));

      StepVerifier.create(session.frames())
          .expectSubscription()
          .expectNoEvent(QUIET)
          .thenCancel()
          .verify(TIMEOUT);
    }

    @Test
    void from_now_policy_must_skip_history_without_cursor() {
      commit();
      commit();
      final var session =
          session(
              KeyExpression.allEvents(NAMESPACE),
              OptionalLong.empty(),
              CONFIG.withCursorPolicy(CursorPolicy.FROM_NOW));

      StepVerifier.create(session.frames())
          .expectSubscription()
          .expectNoEvent(QUIET)
          .then(SseStreamSessionTest.this::commitAndPublish)
          .expectNextMatches(frame -> isEvent(frame, 3))
          .thenCancel()
          .verify(TIMEOUT);
    }

    @Test
    void scoped_session_must_receive_only_matching_events() {
      commit("Note");
      final long todo = commit(TYPE).globalSequence();
      final var session =
          session(
              KeyExpression.aggregateTypePattern(NAMESPACE, TYPE), OptionalLong.empty(), CONFIG);

      StepVerifier.create(session.frames())
          .expectNextMatches(frame -> isEvent(frame, todo))
          .then(() -> bus.publish(commit("Note")))
          .expectNoEvent(QUIET)
          .thenCancel()
          .verify(TIMEOUT);
    }
  }

  @Nested
  class Resync {
    @Test
    void cursor_below_retained_history_must_get_resync_instead_of_partial_replay() {
      for (int i = 0; i < 5; i++) {
        commit();
      }

      repository.compactBefore(4);
      final var session = session(OptionalLong.of(1));

      StepVerifier.create(session.frames())
          .expectNext(new SseFrame.Resync(4, 5))
          .expectComplete()
          .verify(TIMEOUT);

      assertEquals(SseStreamSession.State.CLOSED, session.state());
    }

    @Test
    void cursor_just_before_earliest_must_replay_normally() {
      for (int i = 0; i < 5; i++) {
        commit();
      }

      repository.compactBefore(4);

      StepVerifier.create(session(OptionalLong.of(3)).frames())
          .expectNextMatches(frame -> isEvent(frame, 4))
          .expectNextMatches(frame -> isEvent(frame, 5))
          .thenCancel()
          .verify(TIMEOUT);
    }
  }

  @Nested
  class Live {
    @Test
    void event_committed_while_history_is_read_must_not_be_lost() {
      commit();
      final AtomicBoolean raced = new AtomicBoolean(false);
      final EventRepository racing =
          new ForwardingEventRepository(repository) {
            @Override
            public List<StoredEvent> querySinceGlobalSequence(long globalSequence) {
              final var history = delegate.querySinceGlobalSequence(globalSequence);

              if (raced.compareAndSet(false, true)) {
                commitAndPublish();
              }

              return history;
            }
          };
      final var session =
          new SseStreamSession(
              racing, bus, CONFIG, KeyExpression.allEvents(NAMESPACE), OptionalLong.empty());

      StepVerifier.create(session.frames())
          .expectNextMatches(frame -> isEvent(frame, 1))
          .expectNextMatches(frame -> isEvent(frame, 2))
          .expectNoEvent(QUIET)
          .thenCancel()
          .verify(TIMEOUT);
    }

    @Test
    void event_both_replayed_and_published_must_be_sent_once() {
      final StoredEvent first = commit();
      final var session = session(OptionalLong.empty());

      StepVerifier.create(session.frames())
          .expectNextMatches(frame -> isEvent(frame, 1))
          .then(() -> bus.publish(first))
          .then(SseStreamSessionTest.this::commitAndPublish)
          .expectNextMatches(frame -> isEvent(frame, 2))
          .expectNoEvent(QUIET)
          .thenCancel()
          .verify(TIMEOUT);
    }

    @Test
    void session_must_fill_gaps_from_the_store() {
      commit();
      final var session = session(OptionalLong.empty());

      StepVerifier.create(session.frames())
          .expectNextMatches(frame -> isEvent(frame, 1))
          .then(
              () -> {
                commit();
                commitAndPublish();
              })
          .expectNextMatches(frame -> isEvent(frame, 2))
          .expectNextMatches(frame -> isEvent(frame, 3))
          .thenCancel()
          .verify(TIMEOUT);
    }

    @Test
    void scoped_session_must_send_event_published_after_a_later_one_in_global_order() {
      final var session =
          session(
              KeyExpression.aggregateTypePattern(NAMESPACE, TYPE), OptionalLong.empty(), CONFIG);

      StepVerifier.create(session.frames())
          .expectSubscription()
          .then(
              () -> {
                final StoredEvent first = commit();
                commit("Note");
                commitAndPublish();
                bus.publish(first);
              })
          .expectNextMatches(frame -> isEvent(frame, 1))
          .expectNextMatches(frame -> isEvent(frame, 3))
          .expectNoEvent(QUIET)
          .thenCancel()
          .verify(TIMEOUT);

      assertEquals(3, session.lastSentSequence());
    }

    @Test
    void idle_stream_must_send_keep_alives() {
      final var config =
          new SseSessionConfig(
              NAMESPACE,
              Duration.ofMillis(50),
              CursorPolicy.FROM_BEGINNING,
              SseEventRenderer.json());
      final var session = session(KeyExpression.allEvents(NAMESPACE), OptionalLong.empty(), config);

      StepVerifier.create(session.frames())
          .expectNext(SseFrame.keepAlive())
          .expectNext(SseFrame.keepAlive())
          .then(SseStreamSessionTest.this::commitAndPublish)
          .thenConsumeWhile(frame -> frame instanceof SseFrame.KeepAlive)
          .expectNextMatches(frame -> isEvent(frame, 1))
          .thenCancel()
          .verify(TIMEOUT);

      assertEquals(1, session.lastSentSequence());
    }
  }

  @Nested
  class Lifecycle {
    @Test
    void disconnect_must_release_bus_subscription() {
      final var session = session(OptionalLong.empty());
      assertEquals(SseStreamSession.State.CONNECTING, session.state());

      StepVerifier.create(session.frames())
          .expectSubscription()
          .then(() -> assertEquals(1, bus.getSubscriberCount()))
          .thenCancel()
          .verify(TIMEOUT);

      assertEquals(SseStreamSession.State.CLOSED, session.state());
      assertEquals(0, bus.getSubscriberCount());
    }

    @Test
    void session_must_not_be_opened_twice() {
      final var session = session(OptionalLong.empty());

      StepVerifier.create(session.frames()).expectSubscription().thenCancel().verify(TIMEOUT);

      StepVerifier.create(session.frames())
          .expectError(IllegalStateException.class)
          .verify(TIMEOUT);
    }

    @Test
    void when_history_cannot_be_read_stream_must_fail_and_release_subscription() {
      final EventRepository failing =
          new ForwardingEventRepository(repository) {
            @Override
            public List<StoredEvent> querySinceGlobalSequence(long globalSequence) {
              throw new IllegalStateException("boom");
            }
          };
      final var session =
          new SseStreamSession(
              failing, bus, CONFIG, KeyExpression.allEvents(NAMESPACE), OptionalLong.empty());

      StepVerifier.create(session.frames())
          .expectError(IllegalStateException.class)
          .verify(TIMEOUT);

      assertEquals(0, bus.getSubscriberCount());
      assertEquals(SseStreamSession.State.CLOSED, session.state());
    }

    @Test
    void when_argument_is_null_illegal_argument_exception_is_thrown() {
      final var pattern = KeyExpression.allEvents(NAMESPACE);
      final var cursor = OptionalLong.empty();

      assertThrows(
          IllegalArgumentException.class,
          () -> new SseStreamSession(null, bus, CONFIG, pattern, cursor));
      assertThrows(
          IllegalArgumentException.class,
          () -> new SseStreamSession(repository, bus, CONFIG, null, cursor));
      assertThrows(
          IllegalArgumentException.class,
          () -> new SseStreamSession(repository, bus, CONFIG, pattern, null));
    }
  }
}
