/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.pg.source;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.Base64;
import java.util.Locale;

/**
 * Converts PostgreSQL values to the JSON-friendly Java values carried by records, so the same
 * column reads the same from a table scan and from the log.
 */
final class PgValues {

  static final int OID_BOOL = 16;
  static final int OID_BYTEA = 17;
  static final int OID_INT8 = 20;
  static final int OID_INT2 = 21;
  static final int OID_INT4 = 23;
  static final int OID_OID = 26;
  static final int OID_JSON = 114;
  static final int OID_FLOAT4 = 700;
  static final int OID_FLOAT8 = 701;
  static final int OID_DATE = 1082;
  static final int OID_TIMESTAMP = 1114;
  static final int OID_TIMESTAMPTZ = 1184;
  static final int OID_NUMERIC = 1700;
  static final int OID_JSONB = 3802;

  private static final DateTimeFormatter PG_TIMESTAMP = new DateTimeFormatterBuilder()
    .append(DateTimeFormatter.ISO_LOCAL_DATE)
    .appendLiteral(' ')
    .append(DateTimeFormatter.ISO_LOCAL_TIME)
    .toFormatter(Locale.ROOT);

  private static final DateTimeFormatter PG_TIMESTAMPTZ = new DateTimeFormatterBuilder()
    .append(PG_TIMESTAMP)
    .appendOffset("+HH:mm", "+00")
    .toFormatter(Locale.ROOT);

  private PgValues() {
  }

  /**
   * Converts a value in PostgreSQL text output format, as sent by {@code pgoutput}.
   * Values that do not parse are kept as text.
   */
  static Object fromText(String raw, int typeOid) {
    if (raw == null) {
      return null;
    }
    try {
      switch (typeOid) {
        case OID_BOOL:
          return "t".equalsIgnoreCase(raw) || "true".equalsIgnoreCase(raw);
        case OID_INT2:
        case OID_INT4:
          return Integer.parseInt(raw);
        case OID_INT8:
        case OID_OID:
          return Long.parseLong(raw);
        case OID_FLOAT4:
        case OID_FLOAT8:
          return Double.parseDouble(raw);
        case OID_NUMERIC:
          return new BigDecimal(raw);
        case OID_JSON:
        case OID_JSONB:
          return parseJson(raw);
        case OID_BYTEA:
          return raw.startsWith("\\x") ? Base64.getEncoder().encodeToString(hex(raw.substring(2))) : raw;
        case OID_DATE:
          return LocalDate.parse(raw).toString();
        case OID_TIMESTAMP:
          return LocalDateTime.parse(raw, PG_TIMESTAMP).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        case OID_TIMESTAMPTZ:
          return OffsetDateTime.parse(raw, PG_TIMESTAMPTZ).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        default:
          return raw;
      }
    } catch (RuntimeException ignored) {
      return raw;
    }
  }

  /**
   * Reads column {@code index} of the current row.
   */
  static Object fromResultSet(ResultSet rs, int index, String typeName) throws SQLException {
    Object value = rs.getObject(index);
    if (value == null) {
      return null;
    }
    switch (typeName.toLowerCase(Locale.ROOT)) {
      case "bool":
      case "int2":
      case "int4":
      case "int8":
      case "oid":
      case "text":
      case "varchar":
      case "bpchar":
        return value;
      case "float4":
      case "float8":
        return ((Number) value).doubleValue();
      case "numeric":
        return rs.getBigDecimal(index);
      case "json":
      case "jsonb":
        return parseJson(rs.getString(index));
      case "bytea":
        return Base64.getEncoder().encodeToString(rs.getBytes(index));
      case "date":
        return rs.getObject(index, LocalDate.class).toString();
      case "timestamp":
        return rs.getObject(index, LocalDateTime.class).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
      case "timestamptz":
        return rs.getObject(index, OffsetDateTime.class).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
      default:
        return value instanceof Number || value instanceof Boolean || value instanceof String
          ? value
          : rs.getString(index);
    }
  }

  private static Object parseJson(String raw) {
    String trimmed = raw.trim();
    if (trimmed.startsWith("{")) {
      return new JsonObject(trimmed);
    }
    if (trimmed.startsWith("[")) {
      return new JsonArray(trimmed);
    }
    return raw;
  }

  private static byte[] hex(String digits) {
    byte[] out = new byte[digits.length() / 2];
    for (int i = 0; i < out.length; i++) {
      out[i] = (byte) Integer.parseInt(digits.substring(2 * i, 2 * i + 2), 16);
    }
    return out;
  }
}
