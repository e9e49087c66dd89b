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

/**
 * Machine-readable classification of every failure the library surfaces, paired with the HTTP
 * status a web layer should map it to.
 */
public enum ErrorCode {
  VALIDATION_FAILED(400),
  NOT_FOUND(404),
  CONFLICT(409),
  INTERNAL_ERROR(500),
  DATABASE_ERROR(500),
  SERVICE_UNAVAILABLE(503);

  private final int statusCode;

  ErrorCode(int statusCode) {
    this.statusCode = statusCode;
  }

  /**
   * @return the most appropriate HTTP status code for this error code
   */
  public int getStatusCode() {
    return statusCode;
  }

  /**
   * @return {@code true} for codes a caller caused, {@code false} for server-side failures
   */
  public boolean isClientError() {
    return statusCode >= 400 && statusCode < 500;
  }
}
