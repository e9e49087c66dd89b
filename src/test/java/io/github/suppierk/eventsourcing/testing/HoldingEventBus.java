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

package io.github.suppierk.eventsourcing.testing;

import io.github.suppierk.eventsourcing.bus.EventBus;
import io.github.suppierk.eventsourcing.bus.EventSubscription;
import io.github.suppierk.eventsourcing.bus.KeyExpression;
import io.github.suppierk.eventsourcing.event.StoredEvent;
import java.util.ArrayList;
import java.util.List;

/** Holds back publications of one aggregate until released, reordering them behind others. */
public class HoldingEventBus implements EventBus {
  private final EventBus delegate;
  private final String heldAggregateId;
  private final List<StoredEvent> held = new ArrayList<>();

  public HoldingEventBus(EventBus delegate, String heldAggregateId) {
    this.delegate = delegate;
    this.heldAggregateId = heldAggregateId;
  }

  @Override
  public synchronized void publish(StoredEvent event) {
    if (event.aggregateId().equals(heldAggregateId)) {
      held.add(event);
      return;
    }

    delegate.publish(event);
  }

  public synchronized void release() {
    held.forEach(delegate::publish);
    held.clear();
  }

  @Override
  public EventSubscription subscribe(KeyExpression pattern) {
    return delegate.subscribe(pattern);
  }

  @Override
  public void close() {
    delegate.close();
  }
}
