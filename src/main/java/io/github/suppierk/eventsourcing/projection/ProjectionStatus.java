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

/** Lifecycle of a {@link MaterializedView}. */
public enum ProjectionStatus {
  /** Nothing loaded, reads are refused. */
  EMPTY,

  /** History is being folded, reads are refused. */
  INITIALIZING,

  /** History folded and live updates flowing, reads are authoritative. */
  READY
}
