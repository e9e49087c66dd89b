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

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.eventsourcing.event.Jsons;

/** One unit written to an event stream. */
public sealed interface SseFrame permits SseFrame.Event, SseFrame.KeepAlive, SseFrame.Resync {
  String KEEP_ALIVE_COMMENT = "keepalive";
  String RESYNC_EVENT = "resync";

  /**
   * @return the frame encoded as {@code text/event-stream}, terminated by a blank line
   */
  String toWireFormat();

  static KeepAlive keepAlive() {
    return KeepAlive.INSTANCE;
  }

  private static void appendData(StringBuilder out, String data) {
    for (String line : data.split("\r\n|\r|\n", -1)) {
      out.append("data: ").append(line).append('\n');
    }
  }

  /**
   * A delivered event.
   *
   * @param id global sequence of the event, which the client echoes back as its cursor
   * @param event name of the event variant
   * @param data rendered event
   */
  record Event(long id, String event, String data) implements SseFrame {
    public Event {
      if (data == null) {
        throw new IllegalArgumentException("Data cannot be null");
      }
    }

    @Override
    public String toWireFormat() {
      final StringBuilder out = new StringBuilder();
      out.append("id: ").append(id).append('\n');

      if (event != null && !event.isBlank()) {
        out.append("event: ").append(event).append('\n');
      }

      appendData(out, data);
      return out.append('\n').toString();
    }
  }

  /**
   * A comment frame keeping idle connections open.
   *
   * @param comment text after the colon
   */
  record KeepAlive(String comment) implements SseFrame {
    private static final KeepAlive INSTANCE = new KeepAlive(KEEP_ALIVE_COMMENT);

    @Override
    public String toWireFormat() {
      return ": " + comment + "\n\n";
    }
  }

  /**
   * Tells the client its cursor points below retained history, so it must reload its state and
   * reconnect from {@code latestGlobalSequence}.
   *
   * @param earliestGlobalSequence oldest event still retained
   * @param latestGlobalSequence newest event, sent as the frame id
   */
  record Resync(long earliestGlobalSequence, long latestGlobalSequence) implements SseFrame {
    @Override
    public String toWireFormat() {
      final ObjectNode data = Jsons.object();
      data.put("reason", "cursor_expired");
      data.put("earliest_global_sequence", earliestGlobalSequence);
      data.put("latest_global_sequence", latestGlobalSequence);

      final StringBuilder out = new StringBuilder();
      out.append("id: ").append(latestGlobalSequence).append('\n');
      out.append("event: ").append(RESYNC_EVENT).append('\n');
      appendData(out, Jsons.toJson(data));
      return out.append('\n').toString();
    }
  }
}
