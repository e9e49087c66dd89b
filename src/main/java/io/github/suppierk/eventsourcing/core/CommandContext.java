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

package io.github.suppierk.eventsourcing.core;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Everything impure a command needs, resolved by the caller before the command is handled.
 *
 * <p>Deciders never read a clock or generate identifiers themselves: the timestamp and the id
 * generator are taken from here, so that replaying a command with the same context yields the
 * same events.
 *
 * @param commandId unique id of this command invocation, recorded as causation of its events
 * @param correlationId shared by every command and event of one user-level interaction
 * @param timestamp of the command, used as the creation time of its events
 * @param actor performing the command, {@code null} when anonymous
 * @param idGenerator supplying event ids
 */
public record CommandContext(
    UUID commandId,
    UUID correlationId,
    Instant timestamp,
    String actor,
    Supplier<UUID> idGenerator) {
  public CommandContext {
    if (commandId == null) {
      throw new IllegalArgumentException("Command id cannot be null");
    }

    if (correlationId == null) {
      throw new IllegalArgumentException("Correlation id cannot be null");
    }

    if (timestamp == null) {
      throw new IllegalArgumentException("Timestamp cannot be null");
    }

    if (idGenerator == null) {
      throw new IllegalArgumentException("Id generator cannot be null");
    }
  }

  /**
   * @return a context for an anonymous command issued now, starting a new correlation
   */
  public static CommandContext create() {
    return create(Clock.systemUTC());
  }

  /**
   * @param clock to take the timestamp from
   * @return a context for an anonymous command, starting a new correlation
   */
  public static CommandContext create(Clock clock) {
    return new CommandContext(
        UUID.randomUUID(), UUID.randomUUID(), clock.instant(), null, UUID::randomUUID);
  }

  /**
   * @param actor performing the command
   * @return a copy of this context attributed to the given actor
   */
  public CommandContext withActor(String actor) {
    return new CommandContext(commandId, correlationId, timestamp, actor, idGenerator);
  }

  /**
   * @param correlationId to continue
   * @return a copy of this context joining an existing correlation
   */
  public CommandContext withCorrelationId(UUID correlationId) {
    return new CommandContext(commandId, correlationId, timestamp, actor, idGenerator);
  }

  /**
   * @return next identifier from the generator
   * @throws IllegalStateException if the generator produced {@code null}
   */
  public UUID nextId() {
    final UUID id = idGenerator.get();

    if (id == null) {
      throw new IllegalStateException("Generated id cannot be null");
    }

    return id;
  }
}
