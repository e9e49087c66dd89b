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

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.SelectField;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/** jOOQ references to the {@code events} table declared in {@code db/events.sql}. */
final class EventsTable {
  static final Table<Record> EVENTS = DSL.table(DSL.unquotedName("events"));

  static final Field<Long> GLOBAL_SEQUENCE =
      DSL.field(DSL.unquotedName("global_sequence"), SQLDataType.BIGINT);
  static final Field<UUID> EVENT_ID = DSL.field(DSL.unquotedName("event_id"), SQLDataType.UUID);
  static final Field<String> AGGREGATE_TYPE =
      DSL.field(DSL.unquotedName("aggregate_type"), SQLDataType.VARCHAR);
  static final Field<String> AGGREGATE_ID =
      DSL.field(DSL.unquotedName("aggregate_id"), SQLDataType.VARCHAR);
  static final Field<Long> AGGREGATE_SEQUENCE =
      DSL.field(DSL.unquotedName("aggregate_sequence"), SQLDataType.BIGINT);
  static final Field<String> EVENT_TYPE =
      DSL.field(DSL.unquotedName("event_type"), SQLDataType.VARCHAR);
  static final Field<Integer> EVENT_VERSION =
      DSL.field(DSL.unquotedName("event_version"), SQLDataType.INTEGER);
  static final Field<String> PAYLOAD = DSL.field(DSL.unquotedName("payload"), SQLDataType.VARCHAR);
  static final Field<String> METADATA =
      DSL.field(DSL.unquotedName("metadata"), SQLDataType.VARCHAR);
  static final Field<Boolean> IS_FINAL =
      DSL.field(DSL.unquotedName("is_final"), SQLDataType.BOOLEAN);
  static final Field<OffsetDateTime> CREATED_AT =
      DSL.field(DSL.unquotedName("created_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);

  static final List<SelectField<?>> ALL_COLUMNS =
      List.of(
          GLOBAL_SEQUENCE,
          EVENT_ID,
          AGGREGATE_TYPE,
          AGGREGATE_ID,
          AGGREGATE_SEQUENCE,
          EVENT_TYPE,
          EVENT_VERSION,
          PAYLOAD,
          METADATA,
          IS_FINAL,
          CREATED_AT);

  private EventsTable() {
    // Constants holder
  }
}
