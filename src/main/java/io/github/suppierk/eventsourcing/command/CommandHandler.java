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

package io.github.suppierk.eventsourcing.command;

import io.github.suppierk.eventsourcing.bus.EventBus;
import io.github.suppierk.eventsourcing.core.CommandContext;
import io.github.suppierk.eventsourcing.core.Decider;
import io.github.suppierk.eventsourcing.core.DomainCommand;
import io.github.suppierk.eventsourcing.core.DomainEvent;
import io.github.suppierk.eventsourcing.core.Suspicious;
import io.github.suppierk.eventsourcing.error.ConcurrencyConflictException;
import io.github.suppierk.eventsourcing.error.DomainException;
import io.github.suppierk.eventsourcing.error.EventBusException;
import io.github.suppierk.eventsourcing.event.EventCodec;
import io.github.suppierk.eventsourcing.event.EventMetadata;
import io.github.suppierk.eventsourcing.event.NewEvent;
import io.github.suppierk.eventsourcing.event.StoredEvent;
import io.github.suppierk.eventsourcing.store.EventRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs commands of one type against one aggregate type:
 *
 * <ul>
 *   <li>load the aggregate's events and fold them into its state;
 *   <li>let the {@link Decider} turn the command into new events;
 *   <li>append the events at the loaded version;
 *   <li>publish the stored events to the bus, fire-and-forget.
 * </ul>
 *
 * <p>A {@link ConcurrencyConflictException} restarts the whole sequence from the load, at most
 * {@code maxAttempts} times in total, then reaches the caller. Every other exception reaches the
 * caller immediately.
 *
 * @param <COMMAND> the command type
 * @param <STATE> the aggregate state type
 * @param <EVENT> the aggregate event type
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public class CommandHandler<
  COMMAND extends DomainCommand,
  STATE,
  EVENT extends DomainEvent
> extends Suspicious {
// @formatter:on
  private static final Logger logger = LoggerFactory.getLogger(CommandHandler.class);

  private final Class<COMMAND> commandClass;
  private final Decider<? super COMMAND, STATE, EVENT> decider;
  private final EventCodec<EVENT> codec;
  private final EventRepository repository;
  private final EventBus bus;
  private final AggregateLocks locks;
  private final int maxAttempts;

  /**
   * @param commandClass handled by this handler
   * @param decider of the aggregate type
   * @param codec of the aggregate type
   * @param repository to load from and append to
   * @param bus to publish stored events to
   * @param locks serializing append and publish per aggregate
   * @param maxAttempts total attempts when appends conflict, at least 1
   */
  public CommandHandler(
      Class<COMMAND> commandClass,
      Decider<? super COMMAND, STATE, EVENT> decider,
      EventCodec<EVENT> codec,
      EventRepository repository,
      EventBus bus,
      AggregateLocks locks,
      int maxAttempts) {
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
    this.decider = throwIllegalArgumentIfNull(decider, "Decider");
    this.codec = throwIllegalArgumentIfNull(codec, "Event codec");
    this.repository = throwIllegalArgumentIfNull(repository, "Event repository");
    this.bus = throwIllegalArgumentIfNull(bus, "Event bus");
    this.locks = throwIllegalArgumentIfNull(locks, "Aggregate locks");

    if (maxAttempts < 1) {
      throw new IllegalArgumentException("Attempts must be positive");
    }

    this.maxAttempts = maxAttempts;
  }

  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  public final String getAggregateType() {
    return codec.aggregateType();
  }

  /**
   * @param command to run
   * @param context of the command
   * @return stored events, empty when the command changed nothing
   * @throws ConcurrencyConflictException if every attempt lost the race
   * @throws DomainException if the command is not allowed in the current state
   */
  public final List<StoredEvent> handle(COMMAND command, CommandContext context) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final CommandContext nonNullContext = throwIllegalArgumentIfNull(context, "Command context");
    throwIllegalStateIfNull(nonNullCommand.aggregateId(), "Command's aggregate id");

    for (int attempt = 1; ; attempt++) {
      try {
        return attempt(nonNullCommand, nonNullContext);
      } catch (ConcurrencyConflictException e) {
        if (attempt >= maxAttempts) {
          logger.warn(
              "{} on {}/{} gave up after {} conflicting attempt(s)",
              commandClass.getSimpleName(),
              codec.aggregateType(),
              nonNullCommand.aggregateId(),
              attempt);
          throw e;
        }

        logger.debug(
            "{} on {}/{} conflicted on attempt {}/{}, reloading",
            commandClass.getSimpleName(),
            codec.aggregateType(),
            nonNullCommand.aggregateId(),
            attempt,
            maxAttempts);
      }
    }
  }

  /**
   * Cold-start read: folds the aggregate's full history.
   *
   * @param aggregateId of the aggregate
   * @return current state, {@link Decider#initialState()} if the aggregate does not exist
   */
  public final STATE loadState(String aggregateId) {
    throwIllegalArgumentIfNull(aggregateId, "Aggregate id");
    return decider.reconstruct(decode(repository.load(codec.aggregateType(), aggregateId)));
  }

  private List<StoredEvent> attempt(COMMAND command, CommandContext context) {
    final String aggregateType = codec.aggregateType();
    final String aggregateId = command.aggregateId();

    final List<StoredEvent> history = repository.load(aggregateType, aggregateId);
    final STATE state = decider.reconstruct(decode(history));
    final List<EVENT> decided =
        throwIllegalStateIfNull(decider.decide(command, state), "Decided events");

    if (decided.isEmpty()) {
      logger.debug(
          "{} on {}/{} changed nothing",
          commandClass.getSimpleName(),
          aggregateType,
          aggregateId);
      return List.of();
    }

    final long expectedVersion =
        history.isEmpty() ? 0L : history.get(history.size() - 1).aggregateSequence();
    final List<NewEvent> newEvents = encode(aggregateId, decided, context);

    final Lock lock = locks.forAggregate(aggregateType, aggregateId);
    lock.lock();

    try {
      final List<StoredEvent> stored = repository.append(newEvents, expectedVersion);
      publish(stored);
      return stored;
    } finally {
      lock.unlock();
    }
  }

  private List<EVENT> decode(List<StoredEvent> history) {
    final List<EVENT> events = new ArrayList<>(history.size());

    for (StoredEvent event : history) {
      events.add(codec.decode(event));
    }

    return events;
  }

  private List<NewEvent> encode(String aggregateId, List<EVENT> decided, CommandContext context) {
    final EventMetadata metadata = EventMetadata.from(context);
    final List<NewEvent> newEvents = new ArrayList<>(decided.size());

    for (EVENT event : decided) {
      final EVENT nonNullEvent = throwIllegalStateIfNull(event, "Decided event");

      if (!aggregateId.equals(nonNullEvent.aggregateId())) {
        throw new IllegalStateException(
            "Decided event targets %s instead of %s"
                .formatted(nonNullEvent.aggregateId(), aggregateId));
      }

      final String eventType = codec.eventType(nonNullEvent);
      newEvents.add(
          new NewEvent(
              codec.aggregateType(),
              aggregateId,
              context.nextId(),
              eventType,
              codec.currentVersion(eventType),
              codec.encode(nonNullEvent),
              metadata,
              context.timestamp(),
              codec.isFinal(nonNullEvent)));
    }

    return newEvents;
  }

  private void publish(List<StoredEvent> stored) {
    for (StoredEvent event : stored) {
      try {
        bus.publish(event);
      } catch (EventBusException e) {
        logger.warn(
            "Event #{} ({}) committed but not published, subscribers will catch up from the store",
            event.globalSequence(),
            event.eventType(),
            e);
      }
    }
  }
}
