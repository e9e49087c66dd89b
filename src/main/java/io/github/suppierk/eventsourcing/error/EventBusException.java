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

package io.github.suppierk.eventsourcing.error;

import java.io.Serial;

/** Thrown when the event bus cannot accept a publication or a subscription. */
public class EventBusException extends EventSourcingException {
  @Serial private static final long serialVersionUID = 5526493400810278563L;

  public EventBusException(String message) {
    super(ErrorCode.SERVICE_UNAVAILABLE, message);
  }

  public EventBusException(String message, Throwable cause) {
    super(ErrorCode.SERVICE_UNAVAILABLE, message, cause);
  }
}
