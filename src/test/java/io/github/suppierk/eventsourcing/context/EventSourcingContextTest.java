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

package io.github.suppierk.eventsourcing.context;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.eventsourcing.bus.EventBus;
import io.github.suppierk.eventsourcing.bus.InProcessEventBus;
import io.github.suppierk.eventsourcing.bus.KeyExpression;
import io.github.suppierk.eventsourcing.config.EventSourcingConfig;
import io.github.suppierk.eventsourcing.core.CommandContext;
import io.github.suppierk.eventsourcing.core.DomainCommand;
import io.github.suppierk.eventsourcing.error.ValidationException;
import io.github.suppierk.eventsourcing.event.StoredEvent;
import io.github.suppierk.eventsourcing.projection.ProjectionStatus;
import io.github.suppierk.eventsourcing.sse.SseFrame;
import io.github.suppierk.eventsourcing.store.JooqEventRepository;
import io.github.suppierk.eventsourcing.store.ReadRetryPolicy;
import io.github.suppierk.eventsourcing.testing.TestDatabase;
import io.github.suppierk.eventsourcing.todo.TodoCommand;
import io.github.suppierk.eventsourcing.todo.TodoDecider;
import io.github.suppierk.eventsourcing.todo.TodoEventCodec;
import io.github.suppierk.eventsourcing.todo.TodoListView;
import io.github.suppierk.eventsourcing.todo.TodoText;
import io.github.suppierk.eventsourcing.upcast.UpcasterChain;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import org.jooq.DSLContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class EventSourcingContextTest {
  static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  final TodoEventCodec codec = new TodoEventCodec();

  EventSourcingConfig config;
  InProcessEventBus bus;
  EventSourcingContext context;

  @BeforeEach
  void setUp() {
    config = EventSourcingConfig.load("eventsourcing-test.properties");
    final DSLContext dsl = TestDatabase.create();
    final var repository =
        new JooqEventRepository(
            dsl,
            dsl,
            TodoEventCodec.registerUpcasters(UpcasterChain.builder()).build(),
            ReadRetryPolicy.from(config));
    bus = new InProcessEventBus(config.getNamespace());
    context = new EventSourcingContext(config, repository, bus);
  }

  @AfterEach
  void tearDown() {
    context.close();
  }

  void registerTodos() {
    context.register(TodoCommand.class, new TodoDecider(), codec);
  }

  void assertNoLocksHeld() {
    assertFalse(context.isAnyReadLockHeld());
    assertFalse(context.isAnyWriteLockHeld());
  }

  @Test
  void when_any_argument_is_null_illegal_argument_exception_is_thrown() {
    final var repository = context.getRepository();

    assertThrows(
        IllegalArgumentException.class, () -> new EventSourcingContext(null, repository, bus));
    assertThrows(
        IllegalArgumentException.class, () -> new EventSourcingContext(config, null, bus));
    assertThrows(
        IllegalArgumentException.class,
        () -> new EventSourcingContext(config, repository, null));
  }

  @Test
  void when_bus_publishes_to_another_namespace_illegal_argument_exception_is_thrown() {
    final var repository = context.getRepository();

    try (var otherBus = new InProcessEventBus("other")) {
      assertThrows(
          IllegalArgumentException.class,
          () -> new EventSourcingContext(config, repository, otherBus));
    }

    try (var detached = new EventSourcingContext(config, repository, EventBus.noop())) {
      assertEquals(repository, detached.getRepository());
    }
  }

  @Nested
  class Registration {
    @Test
    void registered_command_class_must_be_supported() {
      registerTodos();

      assertEquals(Set.of(TodoCommand.class), context.getSupportedCommandClasses());
      assertNoLocksHeld();
    }

    @Test
    void when_handler_is_registered_twice_illegal_state_exception_is_thrown() {
      registerTodos();
      final var decider = new TodoDecider();

      assertThrows(
          IllegalStateException.class, () -> context.register(TodoCommand.class, decider, codec));
      assertNoLocksHeld();
    }

    @Test
    void when_handler_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> context.addCommandHandler(null));
      assertNoLocksHeld();
    }

    @Test
    void supported_command_classes_must_not_be_modifiable() {
      registerTodos();
      final var classes = context.getSupportedCommandClasses();

      assertThrows(UnsupportedOperationException.class, () -> classes.add(String.class));
    }
  }

  @Nested
  class Handling {
    @Test
    void command_must_be_routed_through_its_sealed_interface() {
      registerTodos();

      final var stored =
          context.handle(
              new TodoCommand.Create("a", new TodoText("Buy milk"), NOW), CommandContext.create());

      assertEquals(1, stored.size());
      assertEquals(TodoEventCodec.CREATED, stored.get(0).eventType());
      assertNoLocksHeld();
    }

    @Test
    void when_command_has_no_handler_unsupported_operation_exception_is_thrown() {
      final DomainCommand unknown = () -> "a";
      final var commandContext = CommandContext.create();

      assertThrows(
          UnsupportedOperationException.class, () -> context.handle(unknown, commandContext));
      assertNoLocksHeld();
    }

    @Test
    void replaying_everything_must_rebuild_same_state_as_loading() {
      registerTodos();
      final var ctx = CommandContext.create();
      context.handle(new TodoCommand.Create("a", new TodoText("First"), NOW), ctx);
      context.handle(new TodoCommand.Create("b", new TodoText("Second"), NOW), ctx);
      context.handle(new TodoCommand.Complete("a", NOW), ctx);
      context.handle(new TodoCommand.UpdateText("b", new TodoText("Second, edited"), NOW), ctx);
      context.handle(new TodoCommand.Delete("b", NOW), ctx);

      final var decider = new TodoDecider();
      final var all = context.getRepository().querySinceGlobalSequence(0);

      for (String id : new String[] {"a", "b"}) {
        final var fromQuery =
            all.stream()
                .filter(event -> event.aggregateId().equals(id))
                .map(codec::decode)
                .toList();
        final var fromLoad =
            context.getRepository().load(TodoEventCodec.AGGREGATE_TYPE, id).stream()
                .map(codec::decode)
                .toList();

        assertEquals(decider.reconstruct(fromLoad), decider.reconstruct(fromQuery));
      }
    }
  }

  @Nested
  class Reading {
    @Test
    void materialized_view_must_follow_handled_commands() {
      registerTodos();
      context.handle(
          new TodoCommand.Create("a", new TodoText("First"), NOW), CommandContext.create());

      final var view = context.materializedView(new TodoListView(), codec);
      context.handle(
          new TodoCommand.Create("b", new TodoText("Second"), NOW), CommandContext.create());

      assertEquals(ProjectionStatus.READY, view.status());
      assertEquals(2, view.state().count());
      assertNoLocksHeld();
    }

    @Test
    void closing_context_must_release_views_and_bus() {
      final var view = context.materializedView(new TodoListView(), codec);

      context.close();

      assertEquals(ProjectionStatus.EMPTY, view.status());
      assertEquals(0, bus.getSubscriberCount());
      assertDoesNotThrow(context::close);
    }

    @Test
    void stream_must_resume_after_last_event_id_header() {
      registerTodos();
      final var ctx = CommandContext.create();
      final StoredEvent first =
          context.handle(new TodoCommand.Create("a", new TodoText("First"), NOW), ctx).get(0);
      context.handle(new TodoCommand.Create("b", new TodoText("Second"), NOW), ctx);

      final var session =
          context.openStream(context.allEvents(), Long.toString(first.globalSequence()));

      StepVerifier.create(session.frames())
          .expectNextMatches(
              frame ->
                  frame instanceof SseFrame.Event event
                      && event.id() == first.globalSequence() + 1)
          .thenCancel()
          .verify(Duration.ofSeconds(5));
    }

    @Test
    void stream_without_cursor_must_follow_configured_policy() {
      registerTodos();
      context.handle(
          new TodoCommand.Create("a", new TodoText("First"), NOW), CommandContext.create());

      final var session = context.openStream(context.allEvents(), (String) null);

      StepVerifier.create(session.frames())
          .expectSubscription()
          .expectNoEvent(Duration.ofMillis(200))
          .then(
              () ->
                  context.handle(
                      new TodoCommand.Create("b", new TodoText("Second"), NOW),
                      CommandContext.create()))
          .expectNextMatches(frame -> frame instanceof SseFrame.Event event && event.id() == 2)
          .thenCancel()
          .verify(Duration.ofSeconds(5));
    }

    @Test
    void when_last_event_id_is_malformed_validation_exception_is_thrown() {
      final KeyExpression pattern = context.allEvents();

      assertThrows(ValidationException.class, () -> context.openStream(pattern, "yesterday"));
    }

    @Test
    void sse_settings_must_come_from_config() {
      assertEquals("todos", context.getSseConfig().namespace());
      assertEquals(Duration.ofSeconds(5), context.getSseConfig().keepAliveInterval());
      assertEquals("todos/**", context.allEvents().toString());
    }
  }
}
