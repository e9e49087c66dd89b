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

import io.github.suppierk.eventsourcing.core.Suspicious;
import io.github.suppierk.eventsourcing.error.EventBusException;
import io.github.suppierk.eventsourcing.event.StoredEvent;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * {@link EventBus} delivering to subscribers of the same JVM.
 *
 * <p>Each subscription owns an unbounded unicast sink, so events published after {@link
 * #subscribe(KeyExpression)} returns are kept until the consumer attaches. Emissions into one
 * sink are serialized, so every subscriber observes events in the order {@link
 * #publish(StoredEvent)} was called.
 */
public final class InProcessEventBus extends Suspicious implements EventBus {
  private static final Logger logger = LoggerFactory.getLogger(InProcessEventBus.class);

  private final String namespace;
  private final Set<Registration> registrations = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * @param namespace root segment of every published key
   */
  public InProcessEventBus(String namespace) {
    this.namespace = throwIllegalArgumentIfNull(namespace, "Namespace");

    if (namespace.isBlank() || namespace.contains(KeyExpression.SEPARATOR)) {
      throw new IllegalArgumentException("Namespace must be a single non-blank segment");
    }
  }

  public String getNamespace() {
    return namespace;
  }

  @Override
  public boolean publishesTo(String namespace) {
    return this.namespace.equals(namespace);
  }

  /**
   * @return number of open subscriptions
   */
  public int getSubscriberCount() {
    return registrations.size();
  }

  /** {@inheritDoc} */
  @Override
  public void publish(StoredEvent event) {
    final StoredEvent nonNullEvent = throwIllegalArgumentIfNull(event, "Event");

    if (closed.get()) {
      throw new EventBusException("Event bus is closed");
    }

    final String key = KeyExpression.eventKey(namespace, nonNullEvent);
    int delivered = 0;

    for (Registration registration : registrations) {
      if (registration.pattern.matches(key) && registration.offer(nonNullEvent)) {
        delivered++;
      }
    }

    logger.trace("Published {} #{} to {} subscriber(s)", key, event.globalSequence(), delivered);
  }

  /** {@inheritDoc} */
  @Override
  public EventSubscription subscribe(KeyExpression pattern) {
    final KeyExpression nonNullPattern = throwIllegalArgumentIfNull(pattern, "Key expression");

    if (closed.get()) {
      throw new EventBusException("Event bus is closed");
    }

    final Registration registration = new Registration(nonNullPattern);
    registrations.add(registration);
    logger.debug("Subscribed to {}", nonNullPattern);

    return registration;
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      for (Registration registration : registrations) {
        registration.close();
      }

      logger.debug("Event bus for namespace {} closed", namespace);
    }
  }

  /** One subscriber's buffer. */
  private final class Registration implements EventSubscription {
    private final KeyExpression pattern;
    private final Sinks.Many<StoredEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicBoolean registrationClosed = new AtomicBoolean(false);

    private Registration(KeyExpression pattern) {
      this.pattern = pattern;
    }

    private synchronized boolean offer(StoredEvent event) {
      if (registrationClosed.get()) {
        return false;
      }

      final Sinks.EmitResult result = sink.tryEmitNext(event);

      if (result.isFailure()) {
        logger.warn(
            "Dropping subscription {} after failed delivery of #{}: {}",
            pattern,
            event.globalSequence(),
            result);
        close();
        return false;
      }

      return true;
    }

    @Override
    public KeyExpression pattern() {
      return pattern;
    }

    @Override
    public Flux<StoredEvent> events() {
      return sink.asFlux().doOnCancel(this::close);
    }

    @Override
    public boolean isClosed() {
      return registrationClosed.get();
    }

    @Override
    public void close() {
      if (registrationClosed.compareAndSet(false, true)) {
        registrations.remove(this);

        synchronized (this) {
          sink.tryEmitComplete();
        }

        logger.debug("Unsubscribed from {}", pattern);
      }
    }
  }
}
