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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.eventsourcing.event.Jsons;
import io.github.suppierk.eventsourcing.testing.TestEvents;
import org.junit.jupiter.api.Test;

class SseFrameTest {
  @Test
  void event_frame_must_carry_id_name_and_data() {
    assertEquals(
        "id: 7\nevent: Created\ndata: {\"a\":1}\n\n",
        new SseFrame.Event(7, "Created", "{\"a\":1}").toWireFormat());
  }

  @Test
  void multiline_data_must_be_split_into_data_lines() {
    assertEquals(
        "id: 1\ndata: first\ndata: second\n\n",
        new SseFrame.Event(1, null, "first\nsecond").toWireFormat());
  }

  @Test
  void when_data_is_null_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new SseFrame.Event(1, "x", null));
  }

  @Test
  void keep_alive_must_be_a_comment() {
    assertEquals(": keepalive\n\n", SseFrame.keepAlive().toWireFormat());
  }

  @Test
  void resync_must_point_at_latest_and_describe_retained_range() {
    final String wire = new SseFrame.Resync(10, 25).toWireFormat();
    final String[] lines = wire.split("\n");

    assertEquals("id: 25", lines[0]);
    assertEquals("event: resync", lines[1]);

    final var data = Jsons.toObject(lines[2].substring("data: ".length()));
    assertEquals("cursor_expired", data.get("reason").asText());
    assertEquals(10, data.get("earliest_global_sequence").asLong());
    assertEquals(25, data.get("latest_global_sequence").asLong());
  }

  @Test
  void json_renderer_must_wrap_event_in_envelope() {
    final var event = TestEvents.stored(12, "Todo", "a", 3);

    final var envelope = Jsons.toObject(SseEventRenderer.json().render(event));

    assertEquals(12, envelope.get("global_sequence").asLong());
    assertEquals("Todo", envelope.get("aggregate_type").asText());
    assertEquals("a", envelope.get("aggregate_id").asText());
    assertEquals(3, envelope.get("aggregate_sequence").asLong());
    assertEquals("Happened", envelope.get("event_type").asText());
    assertEquals(1, envelope.get("event_version").asInt());
    assertEquals(event.payload(), envelope.get("payload"));
    assertEquals(
        TestEvents.CORRELATION_ID.toString(),
        envelope.get("metadata").get("correlation_id").asText());
    assertEquals("2024-05-01T10:15:30Z", envelope.get("created_at").asText());
  }
}
