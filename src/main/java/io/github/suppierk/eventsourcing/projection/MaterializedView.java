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

package io.github.suppierk.eventsourcing.projection;

import io.github.suppierk.eventsourcing.bus.EventBus;
import io.github.suppierk.eventsourcing.bus.EventSubscription;
import io.github.suppierk.eventsourcing.bus.KeyExpression;
import io.github.suppierk.eventsourcing.core.DomainEvent;
import io.github.suppierk.eventsourcing.core.Suspicious;
import io.github.suppierk.eventsourcing.event.EventCodec;
import io.github.suppierk.eventsourcing.event.StoredEvent;
import io.github.suppierk.eventsourcing.store.EventRepository;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

/**
 * A {@link View} kept in memory, rebuilt from the repository and updated from the bus.
 *
 * <p>{@link #rebuild()} subscribes to the bus before it queries history, so every event committed
 * while history is being folded is either part of the history or waiting in the subscription
 * buffer. Buffered events already covered by the history are skipped by global sequence.
 *
 * <p>Aggregates committing concurrently may publish out of global order. A live event skipping
 * past the last applied global sequence makes the view read the skipped range back from the
 * repository first, so the fold always follows global order and late publications are skipped.
 *
 * <p>Live events are applied by a single subscriber, one at a time. Readers never block: they get
 * whichever {@link ViewSnapshot} was published last.
 *
 * @param <STATE> the read model
 * @param <EVENT> the events it is built from
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public final class MaterializedView<STATE, EVENT extends DomainEvent> extends Suspicious
    implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(MaterializedView.class);

  private final View<STATE, EVENT> view;
  private final EventCodec<EVENT> codec;
  private final EventRepository repository;
  private final EventBus bus;
  private final KeyExpression pattern;

  private final AtomicReference<ProjectionStatus> status =
      new AtomicReference<>(ProjectionStatus.EMPTY);
  private final AtomicReference<ViewSnapshot<STATE>> snapshot = new AtomicReference<>();

  private EventSubscription subscription;
  private Disposable live;

  /**
   * @param namespace of the bus keys
   * @param view pure semantics
   * @param codec of the aggregate type the view is built from
   * @param repository to load history from
   * @param bus to receive live events from
   */
  public MaterializedView(
      String namespace,
      View<STATE, EVENT> view,
      EventCodec<EVENT> codec,
      EventRepository repository,
      EventBus bus) {
    throwIllegalArgumentIfNull(namespace, "Namespace");
    this.view = throwIllegalArgumentIfNull(view, "View");
    this.codec = throwIllegalArgumentIfNull(codec, "Event codec");
    this.repository = throwIllegalArgumentIfNull(repository, "Event repository");
    this.bus = throwIllegalArgumentIfNull(bus, "Event bus");
    this.pattern = KeyExpression.aggregateTypePattern(namespace, codec.aggregateType());
  }

  /**
   * Drops whatever is loaded and folds the full history again.
   *
   * @throws RuntimeException from the repository or the codec, leaving the view {@link
   *     ProjectionStatus#EMPTY}
   */
  public synchronized void rebuild() {
    detach();
    status.set(ProjectionStatus.INITIALIZING);
    snapshot.set(null);

    final EventSubscription newSubscription = bus.subscribe(pattern);

    try {
      final List<StoredEvent> history = repository.querySinceGlobalSequence(0L);
      STATE state = view.initialState();
      long last = 0L;
      int folded = 0;

      for (StoredEvent event : history) {
        if (event.aggregateType().equals(codec.aggregateType())) {
          state = view.evolve(state, codec.decode(event));
          folded++;
        }

        last = event.globalSequence();
      }

      snapshot.set(new ViewSnapshot<>(state, last));
      subscription = newSubscription;
      live = newSubscription.events().subscribe(this::apply, this::onLiveFailure);

      if (status.compareAndSet(ProjectionStatus.INITIALIZING, ProjectionStatus.READY)) {
        logger.info(
            "View over {} rebuilt from {} event(s) up to #{}",
            codec.aggregateType(),
            folded,
            last);
      }
    } catch (RuntimeException e) {
      newSubscription.close();
      subscription = null;
      snapshot.set(null);
      status.set(ProjectionStatus.EMPTY);
      throw e;
    }
  }

  private void apply(StoredEvent event) {
    final ViewSnapshot<STATE> current = snapshot.get();
    final long sequence = event.globalSequence();

    if (current == null || sequence <= current.lastGlobalSequence()) {
      return;
    }

    STATE next = current.state();

    if (sequence > current.lastGlobalSequence() + 1) {
      final List<StoredEvent> skipped =
          repository.querySinceGlobalSequence(current.lastGlobalSequence());

      for (StoredEvent missing : skipped) {
        if (missing.globalSequence() < sequence
            && missing.aggregateType().equals(codec.aggregateType())) {
          next = view.evolve(next, codec.decode(missing));
        }
      }
    }

    next = view.evolve(next, codec.decode(event));
    snapshot.set(new ViewSnapshot<>(next, sequence));
  }

  private void onLiveFailure(Throwable failure) {
    logger.error(
        "View over {} stopped applying live events and needs a rebuild",
        codec.aggregateType(),
        failure);
    status.set(ProjectionStatus.EMPTY);
    snapshot.set(null);
  }

  /**
   * @return current lifecycle status
   */
  public ProjectionStatus status() {
    return status.get();
  }

  /**
   * @return latest authoritative snapshot
   * @throws IllegalStateException unless the view is {@link ProjectionStatus#READY}
   */
  public ViewSnapshot<STATE> snapshot() {
    final ViewSnapshot<STATE> current = snapshot.get();

    if (status.get() != ProjectionStatus.READY || current == null) {
      throw new IllegalStateException(
          "View over %s is %s".formatted(codec.aggregateType(), status.get()));
    }

    return current;
  }

  /**
   * @return latest authoritative state
   * @throws IllegalStateException unless the view is {@link ProjectionStatus#READY}
   */
  public STATE state() {
    return snapshot().state();
  }

  /** Stops live updates and returns the view to {@link ProjectionStatus#EMPTY}. */
  @Override
  public synchronized void close() {
    detach();
    snapshot.set(null);
    status.set(ProjectionStatus.EMPTY);
  }

  private void detach() {
    if (live != null) {
      live.dispose();
      live = null;
    }

    if (subscription != null) {
      subscription.close();
      subscription = null;
    }
  }
}
