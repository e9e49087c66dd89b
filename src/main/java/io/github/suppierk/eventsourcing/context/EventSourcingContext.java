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

import io.github.suppierk.eventsourcing.bus.EventBus;
import io.github.suppierk.eventsourcing.bus.KeyExpression;
import io.github.suppierk.eventsourcing.command.AggregateLocks;
import io.github.suppierk.eventsourcing.command.CommandHandler;
import io.github.suppierk.eventsourcing.config.EventSourcingConfig;
import io.github.suppierk.eventsourcing.core.CommandContext;
import io.github.suppierk.eventsourcing.core.Decider;
import io.github.suppierk.eventsourcing.core.DomainCommand;
import io.github.suppierk.eventsourcing.core.DomainEvent;
import io.github.suppierk.eventsourcing.core.Suspicious;
import io.github.suppierk.eventsourcing.event.EventCodec;
import io.github.suppierk.eventsourcing.event.StoredEvent;
import io.github.suppierk.eventsourcing.projection.MaterializedView;
import io.github.suppierk.eventsourcing.projection.View;
import io.github.suppierk.eventsourcing.sse.LastEventId;
import io.github.suppierk.eventsourcing.sse.SseSessionConfig;
import io.github.suppierk.eventsourcing.sse.SseStreamSession;
import io.github.suppierk.eventsourcing.store.EventRepository;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composition root of the event sourcing runtime, created once at startup and closed on shutdown.
 *
 * <p>Owns the command handler registry and every {@link MaterializedView} it created, and shares
 * one {@link EventRepository} and one {@link EventBus} between them and the streams it opens.
 *
 * <p>Registration and dispatch are guarded by a read-write lock, so handlers can be added while
 * commands are being served.
 */
public class EventSourcingContext extends Suspicious implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(EventSourcingContext.class);

  private final EventSourcingConfig config;
  private final EventRepository repository;
  private final EventBus bus;
  private final AggregateLocks locks;
  private final SseSessionConfig sseConfig;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<Class<?>, CommandHandler<?, ?, ?>> commandHandlers = new HashMap<>();
  private final List<MaterializedView<?, ?>> views = new ArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * @param config runtime settings
   * @param repository shared by every handler, view and stream
   * @param bus shared by every handler, view and stream, closed together with this context
   * @throws IllegalArgumentException if any argument is {@code null} or the bus publishes to
   *     another namespace than the configured one
   */
  public EventSourcingContext(
      EventSourcingConfig config, EventRepository repository, EventBus bus) {
    this.config = throwIllegalArgumentIfNull(config, "Config");
    this.repository = throwIllegalArgumentIfNull(repository, "Event repository");
    this.bus = throwIllegalArgumentIfNull(bus, "Event bus");

    if (!bus.publishesTo(config.getNamespace())) {
      throw new IllegalArgumentException(
          "Event bus does not publish to namespace %s".formatted(config.getNamespace()));
    }

    this.locks = new AggregateLocks(config.getLockStripes());
    this.sseConfig = SseSessionConfig.from(config);

    logger.info("Event sourcing context started with {}", config);
  }

  public final EventRepository getRepository() {
    return repository;
  }

  public final EventBus getBus() {
    return bus;
  }

  public final SseSessionConfig getSseConfig() {
    return sseConfig;
  }

  /**
   * Creates a handler sharing this context's repository, bus and locks, and registers it.
   *
   * @param commandClass handled, may be a sealed interface covering a whole command family
   * @param decider of the aggregate type
   * @param codec of the aggregate type
   * @param <C> the command type
   * @param <S> the aggregate state type
   * @param <E> the aggregate event type
   * @return registered handler
   * @throws IllegalStateException if the command class already has a handler
   */
  public final <C extends DomainCommand, S, E extends DomainEvent> CommandHandler<C, S, E> register(
      Class<C> commandClass, Decider<? super C, S, E> decider, EventCodec<E> codec) {
    final CommandHandler<C, S, E> handler =
        new CommandHandler<>(
            commandClass,
            decider,
            codec,
            repository,
            bus,
            locks,
            config.getMaxCommandAttempts());
    addCommandHandler(handler);
    return handler;
  }

  /**
   * @param handler to register
   * @throws IllegalArgumentException if the handler is {@code null}
   * @throws IllegalStateException if the command class already has a handler
   */
  public final void addCommandHandler(CommandHandler<?, ?, ?> handler) {
    final CommandHandler<?, ?, ?> nonNullHandler =
        throwIllegalArgumentIfNull(handler, "Command handler");
    final Class<?> commandClass =
        throwIllegalStateIfNull(nonNullHandler.getCommandClass(), "Command class");

    lock.writeLock().lock();

    try {
      if (commandHandlers.containsKey(commandClass)) {
        throw new IllegalStateException(
            "Handler for %s is already registered".formatted(commandClass.getSimpleName()));
      }

      commandHandlers.put(commandClass, nonNullHandler);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * @return classes of every command this context can handle
   */
  public final Set<Class<?>> getSupportedCommandClasses() {
    lock.readLock().lock();

    try {
      return Collections.unmodifiableSet(new HashSet<>(commandHandlers.keySet()));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * @param command to run
   * @param context of the command
   * @return stored events, empty when the command changed nothing
   * @throws IllegalArgumentException if any argument is {@code null}
   * @throws UnsupportedOperationException if no handler accepts the command
   */
  public final List<StoredEvent> handle(DomainCommand command, CommandContext context) {
    final DomainCommand nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final CommandContext nonNullContext = throwIllegalArgumentIfNull(context, "Command context");
    final CommandHandler<?, ?, ?> handler =
        throwUnsupportedOperationIfNull(
            findHandler(nonNullCommand.getClass()),
            "Handler for %s".formatted(nonNullCommand.getClass().getSimpleName()));

    return dispatch(handler, nonNullCommand, nonNullContext);
  }

  private static <C extends DomainCommand> List<StoredEvent> dispatch(
      CommandHandler<C, ?, ?> handler, DomainCommand command, CommandContext context) {
    return handler.handle(handler.getCommandClass().cast(command), context);
  }

  private CommandHandler<?, ?, ?> findHandler(Class<?> commandClass) {
    lock.readLock().lock();

    try {
      final CommandHandler<?, ?, ?> exact = commandHandlers.get(commandClass);

      if (exact != null) {
        return exact;
      }

      for (Map.Entry<Class<?>, CommandHandler<?, ?, ?>> entry : commandHandlers.entrySet()) {
        if (entry.getKey().isAssignableFrom(commandClass)) {
          return entry.getValue();
        }
      }

      return null;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Creates a view, rebuilds it and keeps it live until this context is closed.
   *
   * @param view pure semantics
   * @param codec of the aggregate type the view is built from
   * @param <S> the read model
   * @param <E> the events it is built from
   * @return a ready view
   */
  public final <S, E extends DomainEvent> MaterializedView<S, E> materializedView(
      View<S, E> view, EventCodec<E> codec) {
    final MaterializedView<S, E> materializedView =
        new MaterializedView<>(config.getNamespace(), view, codec, repository, bus);
    materializedView.rebuild();

    lock.writeLock().lock();

    try {
      views.add(materializedView);
    } finally {
      lock.writeLock().unlock();
    }

    return materializedView;
  }

  /**
   * @param pattern selecting the streamed events
   * @param lastEventId raw client cursor header, may be {@code null}
   * @return a new, not yet opened session
   */
  public final SseStreamSession openStream(KeyExpression pattern, String lastEventId) {
    return openStream(pattern, LastEventId.parse(lastEventId));
  }

  /**
   * @param pattern selecting the streamed events
   * @param cursor of the client
   * @return a new, not yet opened session
   */
  public final SseStreamSession openStream(KeyExpression pattern, OptionalLong cursor) {
    return new SseStreamSession(repository, bus, sseConfig, pattern, cursor);
  }

  /**
   * @return pattern covering every event of this context's namespace
   */
  public final KeyExpression allEvents() {
    return KeyExpression.allEvents(config.getNamespace());
  }

  /** Closes every view created by this context, then the bus. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }

    lock.writeLock().lock();

    try {
      for (MaterializedView<?, ?> view : views) {
        view.close();
      }

      views.clear();
    } finally {
      lock.writeLock().unlock();
    }

    bus.close();
    logger.info("Event sourcing context closed");
  }

  final boolean isAnyReadLockHeld() {
    return lock.getReadLockCount() > 0;
  }

  final boolean isAnyWriteLockHeld() {
    return lock.isWriteLocked();
  }
}
