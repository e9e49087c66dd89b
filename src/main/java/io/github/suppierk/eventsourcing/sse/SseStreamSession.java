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

import io.github.suppierk.eventsourcing.bus.EventBus;
import io.github.suppierk.eventsourcing.bus.EventSubscription;
import io.github.suppierk.eventsourcing.bus.KeyExpression;
import io.github.suppierk.eventsourcing.core.Suspicious;
import io.github.suppierk.eventsourcing.event.StoredEvent;
import io.github.suppierk.eventsourcing.store.EventRepository;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * One client connection streaming events: history first, then live, behind a single ordered
 * output.
 *
 * <p>The protocol of {@link #frames()}:
 *
 * <ol>
 *   <li>subscribe to the bus, so live events start buffering;
 *   <li>resolve the client cursor, answering with a single {@link SseFrame.Resync} if the cursor
 *       is older than the retained history;
 *   <li>replay everything after the cursor from the repository;
 *   <li>drain the live buffer, skipping every event at or below the last sent global sequence;
 *   <li>send a {@link SseFrame.KeepAlive} whenever nothing was sent for the keep-alive interval.
 * </ol>
 *
 * <p>Live events may be published out of global order when different aggregates commit
 * concurrently. Whenever a live event skips past the highest global sequence seen so far, the
 * skipped range is read back from the repository and its matching events are sent first, so
 * frames always leave in global order and a late publication is recognized as already sent.
 *
 * <p>Cancelling the returned stream closes the bus subscription. Nothing else is kept: the client
 * resumes by reconnecting with the id of the last frame it received.
 */
public final class SseStreamSession extends Suspicious {
  private static final Logger logger = LoggerFactory.getLogger(SseStreamSession.class);

  /** Lifecycle of a session. */
  public enum State {
    CONNECTING,
    SUBSCRIBED,
    REPLAYING,
    LIVE,
    CLOSED
  }

  private final EventRepository repository;
  private final EventBus bus;
  private final SseSessionConfig config;
  private final KeyExpression pattern;
  private final OptionalLong cursor;

  private final AtomicReference<State> state = new AtomicReference<>(State.CONNECTING);
  private final AtomicLong lastSent = new AtomicLong();
  private final AtomicLong lastSeen = new AtomicLong();
  private final AtomicBoolean opened = new AtomicBoolean(false);

  /**
   * @param repository to replay history from
   * @param bus to receive live events from
   * @param config of the endpoint
   * @param pattern selecting the streamed events
   * @param cursor global sequence of the last event the client has, empty if it has none
   */
  public SseStreamSession(
      EventRepository repository,
      EventBus bus,
      SseSessionConfig config,
      KeyExpression pattern,
      OptionalLong cursor) {
    this.repository = throwIllegalArgumentIfNull(repository, "Event repository");
    this.bus = throwIllegalArgumentIfNull(bus, "Event bus");
    this.config = throwIllegalArgumentIfNull(config, "Session config");
    this.pattern = throwIllegalArgumentIfNull(pattern, "Key expression");
    this.cursor = throwIllegalArgumentIfNull(cursor, "Cursor");
  }

  /**
   * @return the stream of this session, which may be subscribed to only once
   */
  public Flux<SseFrame> frames() {
    return Flux.defer(
        () -> {
          if (!opened.compareAndSet(false, true)) {
            return Flux.error(new IllegalStateException("Session was already opened"));
          }

          final EventSubscription subscription = bus.subscribe(pattern);
          state.set(State.SUBSCRIBED);

          final Flux<SseFrame> body;

          try {
            body = replayThenLive(subscription);
          } catch (RuntimeException e) {
            subscription.close();
            state.set(State.CLOSED);
            return Flux.error(e);
          }

          return withKeepAlive(body)
              .doFinally(
                  signal -> {
                    subscription.close();
                    state.set(State.CLOSED);
                    logger.debug(
                        "Stream {} closed on {} after #{}", pattern, signal, lastSent.get());
                  });
        });
  }

  /**
   * @return current lifecycle state
   */
  public State state() {
    return state.get();
  }

  /**
   * @return global sequence of the last event sent, or the starting cursor
   */
  public long lastSentSequence() {
    return lastSent.get();
  }

  private Flux<SseFrame> replayThenLive(EventSubscription subscription) {
    final long start;

    if (cursor.isPresent()) {
      final long clientCursor = cursor.getAsLong();
      final OptionalLong earliest = repository.earliestGlobalSequence();

      if (earliest.isPresent() && clientCursor + 1 < earliest.getAsLong()) {
        final long latest = repository.latestGlobalSequence().orElse(earliest.getAsLong());
        logger.info(
            "Cursor {} on {} predates retained history #{}..#{}, requesting resync",
            clientCursor,
            pattern,
            earliest.getAsLong(),
            latest);
        return Flux.just(new SseFrame.Resync(earliest.getAsLong(), latest));
      }

      start = clientCursor;
    } else if (config.cursorPolicy() == CursorPolicy.FROM_NOW) {
      start = repository.latestGlobalSequence().orElse(0L);
    } else {
      start = 0L;
    }

    lastSent.set(start);
    state.set(State.REPLAYING);

    final List<StoredEvent> history = repository.querySinceGlobalSequence(start);
    logger.debug("Replaying {} event(s) after #{} on {}", history.size(), start, pattern);
    lastSeen.set(history.isEmpty() ? start : history.get(history.size() - 1).globalSequence());

    final Flux<SseFrame> replay =
        Flux.fromIterable(history).filter(this::inScope).concatMap(this::emitIfNew);

    final Flux<SseFrame> live =
        Flux.defer(
            () -> {
              state.set(State.LIVE);
              return subscription
                  .events()
                  .publishOn(Schedulers.boundedElastic())
                  .concatMap(this::onLiveEvent);
            });

    return replay.concatWith(live);
  }

  private Flux<SseFrame> onLiveEvent(StoredEvent event) {
    final long sequence = event.globalSequence();
    final long seen = lastSeen.get();

    if (sequence <= seen) {
      return Flux.empty();
    }

    lastSeen.set(sequence);

    if (sequence > seen + 1) {
      final List<StoredEvent> missing = repository.querySinceGlobalSequence(seen);
      logger.debug("Filling #{}..#{} on {} from the repository", seen + 1, sequence - 1, pattern);

      return Flux.fromIterable(missing)
          .filter(candidate -> candidate.globalSequence() < sequence && inScope(candidate))
          .concatWith(Flux.just(event))
          .concatMap(this::emitIfNew);
    }

    return emitIfNew(event);
  }

  private Flux<SseFrame> emitIfNew(StoredEvent event) {
    final long sequence = event.globalSequence();

    if (sequence <= lastSent.get()) {
      return Flux.empty();
    }

    lastSent.set(sequence);
    return Flux.just(
        new SseFrame.Event(sequence, event.eventType(), config.renderer().render(event)));
  }

  private boolean inScope(StoredEvent event) {
    return pattern.matches(config.namespace(), event);
  }

  private Flux<SseFrame> withKeepAlive(Flux<SseFrame> frames) {
    return frames.publish(
        shared -> {
          final Mono<Boolean> finished =
              shared.then(Mono.just(Boolean.TRUE)).onErrorReturn(Boolean.TRUE);

          final Flux<SseFrame> keepAlives =
              shared
                  .map(frame -> Boolean.TRUE)
                  .onErrorResume(e -> Flux.empty())
                  .startWith(Boolean.TRUE)
                  .switchMap(
                      activity ->
                          Flux.interval(config.keepAliveInterval(), config.keepAliveInterval())
                              .map(tick -> (SseFrame) SseFrame.keepAlive()))
                  .takeUntilOther(finished);

          return Flux.merge(shared, keepAlives);
        });
  }
}
