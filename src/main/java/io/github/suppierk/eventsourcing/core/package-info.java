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

/**
 * Defines the write-side contract of the codebase.
 *
 * <p>Here is how the pieces relate to each other, using a single todo item as the aggregate:
 *
 * <ul>
 *   <li>A client sends a {@link io.github.suppierk.eventsourcing.core.DomainCommand} such as
 *       {@code Complete}, together with a {@link
 *       io.github.suppierk.eventsourcing.core.CommandContext} describing who sent it and when.
 *   <li>The {@link io.github.suppierk.eventsourcing.core.Decider} folds the stored history of the
 *       todo into its current state and decides which {@link
 *       io.github.suppierk.eventsourcing.core.DomainEvent}s the command produces:
 *       <ul>
 *         <li>{@code Completed} when the todo was active.
 *         <li>Nothing when the todo was already completed.
 *         <li>A {@link io.github.suppierk.eventsourcing.error.DomainException} when the todo was
 *             deleted.
 *       </ul>
 *   <li>Produced events are appended to the event store at the version the decision was based on
 *       and only then published on the event bus, where views and streams pick them up.
 * </ul>
 *
 * <p>Deciders never perform I/O and never read clocks or generate identifiers on their own, so
 * the same history and command always lead to the same decision.
 */
package io.github.suppierk.eventsourcing.core;
