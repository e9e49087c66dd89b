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

package io.github.suppierk.eventsourcing.upcast;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A pure, single-step transform of one event kind's payload from {@link #fromVersion()} to the
 * next version.
 *
 * <p>Upcasters run only when events are loaded. Stored payloads are never rewritten.
 */
public interface Upcaster {
  /**
   * @return aggregate type owning the event variant
   */
  String aggregateType();

  /**
   * @return stored name of the event variant this upcaster handles
   */
  String eventType();

  /**
   * @return version of the payloads this upcaster accepts
   */
  int fromVersion();

  /**
   * @return version of the payloads this upcaster produces
   */
  default int toVersion() {
    return fromVersion() + 1;
  }

  /**
   * @param payload at {@link #fromVersion()}, owned by the caller and safe to modify
   * @return payload at {@link #toVersion()}
   */
  ObjectNode upcast(ObjectNode payload);
}
