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

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of locks shared by aggregates through hashing.
 *
 * <p>Held only around append and publish, so that the events of one aggregate reach the bus in
 * sequence order. Unrelated aggregates mapped to different stripes proceed in parallel.
 */
public final class AggregateLocks {
  private final Lock[] stripes;

  /**
   * @param stripeCount number of locks, at least 1
   */
  public AggregateLocks(int stripeCount) {
    if (stripeCount < 1) {
      throw new IllegalArgumentException("Stripe count must be positive");
    }

    this.stripes = new Lock[stripeCount];

    for (int i = 0; i < stripeCount; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  /**
   * @param aggregateType of the aggregate
   * @param aggregateId of the aggregate
   * @return the lock guarding the aggregate, always the same one for the same aggregate
   */
  public Lock forAggregate(String aggregateType, String aggregateId) {
    return stripes[stripeIndex(aggregateType, aggregateId)];
  }

  int stripeIndex(String aggregateType, String aggregateId) {
    final int hash = 31 * aggregateType.hashCode() + aggregateId.hashCode();
    return Math.floorMod(hash, stripes.length);
  }

  public int getStripeCount() {
    return stripes.length;
  }
}
