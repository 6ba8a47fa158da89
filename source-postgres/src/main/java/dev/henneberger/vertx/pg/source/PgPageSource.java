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

import dev.henneberger.vertx.source.core.ConfiguredStream;
import dev.henneberger.vertx.source.core.PageRequest;
import dev.henneberger.vertx.source.core.PageSource;
import dev.henneberger.vertx.source.core.ScannedRow;
import dev.henneberger.vertx.source.core.StreamDescriptor;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyset-paginated table scans over JDBC. Every page is a single statement, so a page sees one
 * consistent snapshot but consecutive pages may not.
 */
final class PgPageSource implements PageSource {

  private static final Logger LOG = LoggerFactory.getLogger(PgPageSource.class);
  static final String CTID = "ctid";

  private final PgConnections connections;

  PgPageSource(PgConnections connections) {
    this.connections = connections;
  }

  /**
   * The primary key columns in index order, or {@code ctid} for tables without one.
   */
  @Override
  public List<String> sortKey(ConfiguredStream stream) throws SQLException {
    StreamDescriptor table = stream.descriptor();
    List<String> columns = new ArrayList<>();
    try (Connection conn = connections.openStandard();
         PreparedStatement statement = conn.prepareStatement(
           "SELECT a.attname FROM pg_index i "
             + "JOIN pg_class c ON c.oid = i.indrelid "
             + "JOIN pg_namespace n ON n.oid = c.relnamespace "
             + "CROSS JOIN LATERAL unnest(i.indkey) WITH ORDINALITY AS k(attnum, ord) "
             + "JOIN pg_attribute a ON a.attrelid = c.oid AND a.attnum = k.attnum "
             + "WHERE i.indisprimary AND n.nspname = ? AND c.relname = ? "
             + "ORDER BY k.ord")) {
      statement.setString(1, schema(table));
      statement.setString(2, table.name());
      try (ResultSet rs = statement.executeQuery()) {
        while (rs.next()) {
          columns.add(rs.getString(1));
        }
      }
    }
    if (columns.isEmpty()) {
      LOG.warn("Table {} has no primary key; paginating by {}, which is not stable under concurrent updates",
        table, CTID);
      return List.of(CTID);
    }
    return columns;
  }

  @Override
  public List<ScannedRow> fetch(PageRequest request) throws SQLException {
    List<Object> params = new ArrayList<>();
    String sql = buildQuery(request, params);
    LOG.debug("Scanning {}: {}", request.stream().descriptor(), sql);

    List<ScannedRow> rows = new ArrayList<>();
    try (Connection conn = connections.openStandard();
         PreparedStatement statement = conn.prepareStatement(sql)) {
      for (int i = 0; i < params.size(); i++) {
        bind(statement, i + 1, params.get(i));
      }
      try (ResultSet rs = statement.executeQuery()) {
        ResultSetMetaData meta = rs.getMetaData();
        while (rs.next()) {
          Map<String, Object> data = new LinkedHashMap<>();
          JsonObject key = new JsonObject();
          for (int i = 1; i <= meta.getColumnCount(); i++) {
            String column = meta.getColumnLabel(i);
            Object value = PgValues.fromResultSet(rs, i, meta.getColumnTypeName(i));
            if (request.orderBy().contains(column)) {
              key.put(column, value);
            }
            if (!CTID.equals(column)) {
              data.put(column, value);
            }
          }
          rows.add(new ScannedRow(data, key));
        }
      }
    }
    return rows;
  }

  static String buildQuery(PageRequest request, List<Object> params) {
    StreamDescriptor table = request.stream().descriptor();
    StringBuilder sql = new StringBuilder("SELECT *");
    if (request.orderBy().contains(CTID)) {
      sql.append(", ").append(CTID);
    }
    sql.append(" FROM ").append(PgConnections.quoteTable(schema(table), table.name()));

    List<String> conditions = new ArrayList<>();
    String cursorField = request.cursorField();
    if (cursorField != null) {
      conditions.add(PgConnections.quoteIdentifier(cursorField) + " IS NOT NULL");
      if (request.cursorLowerBound() != null) {
        conditions.add(PgConnections.quoteIdentifier(cursorField) + " >= ?");
        params.add(request.cursorLowerBound());
      }
    }

    JsonObject after = request.after();
    if (after != null) {
      StringJoiner columns = new StringJoiner(", ", "(", ")");
      StringJoiner placeholders = new StringJoiner(", ", "(", ")");
      for (String column : request.orderBy()) {
        columns.add(column(column));
        placeholders.add("?");
        params.add(after.getValue(column));
      }
      conditions.add(columns + " > " + placeholders);
    }
    if (!conditions.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", conditions));
    }

    StringJoiner order = new StringJoiner(", ");
    for (String column : request.orderBy()) {
      order.add(column(column));
    }
    sql.append(" ORDER BY ").append(order).append(" LIMIT ").append(request.limit());
    return sql.toString();
  }

  private static String column(String name) {
    return CTID.equals(name) ? CTID : PgConnections.quoteIdentifier(name);
  }

  private static void bind(PreparedStatement statement, int index, Object value) throws SQLException {
    if (value == null) {
      statement.setObject(index, null);
    } else if (value instanceof Number || value instanceof Boolean) {
      statement.setObject(index, value);
    } else if (value instanceof JsonObject) {
      statement.setString(index, ((JsonObject) value).encode());
    } else if (value instanceof JsonArray) {
      statement.setString(index, ((JsonArray) value).encode());
    } else {
      statement.setString(index, String.valueOf(value));
    }
  }

  static String schema(StreamDescriptor table) {
    return table.namespace() == null ? PgConnections.DEFAULT_SCHEMA : table.namespace();
  }
}
