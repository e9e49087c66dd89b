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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class AggregateLocksTest {
  @Test
  void when_stripe_count_is_not_positive_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new AggregateLocks(0));
  }

  @Test
  void same_aggregate_must_always_get_same_lock() {
    final var locks = new AggregateLocks(16);

    assertSame(locks.forAggregate("Todo", "a"), locks.forAggregate("Todo", "a"));
    assertEquals(16, locks.getStripeCount());
  }

  @Test
  void stripe_index_must_stay_in_range() {
    final var locks = new AggregateLocks(7);

    for (int i = 0; i < 1000; i++) {
      final int index = locks.stripeIndex("Todo", "id-" + i);
      assertTrue(index >= 0 && index < 7, () -> "Index out of range: " + index);
    }
  }

  @Test
  void single_stripe_must_serialize_everything() {
    final var locks = new AggregateLocks(1);

    assertSame(locks.forAggregate("Todo", "a"), locks.forAggregate("Note", "b"));
  }
}
