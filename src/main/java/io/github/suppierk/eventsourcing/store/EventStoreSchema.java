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

package io.github.suppierk.eventsourcing.store;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Creates the event store tables from the bundled DDL script. Safe to run repeatedly. */
public final class EventStoreSchema {
  private static final Logger logger = LoggerFactory.getLogger(EventStoreSchema.class);

  public static final String RESOURCE = "db/events.sql";

  private EventStoreSchema() {
    // Utility class
  }

  /**
   * @param dsl with DDL permissions
   */
  public static void create(DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSL cannot be null");
    }

    final List<String> statements = statements();

    for (String statement : statements) {
      dsl.execute(statement);
    }

    logger.info("Event store schema ready ({} statements)", statements.size());
  }

  static List<String> statements() {
    final String script;

    final ClassLoader classLoader = EventStoreSchema.class.getClassLoader();

    try (InputStream input = classLoader.getResourceAsStream(RESOURCE)) {
      if (input == null) {
        throw new IllegalStateException("%s is missing from the classpath".formatted(RESOURCE));
      }

      script = new String(input.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read %s".formatted(RESOURCE), e);
    }

    final StringBuilder withoutComments = new StringBuilder();

    for (String line : script.split("\n")) {
      if (!line.strip().startsWith("--")) {
        withoutComments.append(line).append('\n');
      }
    }

    final List<String> statements = new ArrayList<>();

    for (String statement : withoutComments.toString().split(";")) {
      if (!statement.isBlank()) {
        statements.add(statement.strip());
      }
    }

    return statements;
  }
}
