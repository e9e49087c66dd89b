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

import io.github.suppierk.eventsourcing.config.EventSourcingConfig;
import java.time.Duration;

/**
 * Settings shared by the streams of one endpoint.
 *
 * @param namespace of the bus keys
 * @param keepAliveInterval of idleness after which a comment frame is sent
 * @param cursorPolicy applied when the client sends no cursor
 * @param renderer of event frames
 */
public record SseSessionConfig(
    String namespace,
    Duration keepAliveInterval,
    CursorPolicy cursorPolicy,
    SseEventRenderer renderer) {
  public SseSessionConfig {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("Namespace cannot be blank");
    }

    if (keepAliveInterval == null || keepAliveInterval.isNegative() || keepAliveInterval.isZero()) {
      throw new IllegalArgumentException("Keep-alive interval must be positive");
    }

    if (cursorPolicy == null) {
      throw new IllegalArgumentException("Cursor policy cannot be null");
    }

    if (renderer == null) {
      throw new IllegalArgumentException("Renderer cannot be null");
    }
  }

  /**
   * @param config runtime configuration
   * @return session settings with the JSON renderer
   */
  public static SseSessionConfig from(EventSourcingConfig config) {
    return new SseSessionConfig(
        config.getNamespace(),
        config.getKeepAliveInterval(),
        config.getCursorPolicy(),
        SseEventRenderer.json());
  }

  /**
   * @param cursorPolicy to use instead
   * @return a copy with another cursor policy
   */
  public SseSessionConfig withCursorPolicy(CursorPolicy cursorPolicy) {
    return new SseSessionConfig(namespace, keepAliveInterval, cursorPolicy, renderer);
  }
}
