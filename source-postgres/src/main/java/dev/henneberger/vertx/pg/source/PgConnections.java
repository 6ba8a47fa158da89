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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import org.postgresql.PGProperty;

/**
 * Opens JDBC connections for scans and metadata queries and replication-protocol connections
 * for log streaming.
 */
final class PgConnections {

  static final String DEFAULT_SCHEMA = "public";

  private final PostgresSourceOptions options;

  PgConnections(PostgresSourceOptions options) {
    this.options = options;
  }

  Connection openStandard() throws SQLException {
    Properties props = connectionProperties();
    // Cursor and key values travel as text; let the server infer their type.
    PGProperty.STRING_TYPE.set(props, "unspecified");
    return DriverManager.getConnection(jdbcUrl(), props);
  }

  Connection openReplication() throws SQLException {
    Properties props = connectionProperties();
    PGProperty.REPLICATION.set(props, "database");
    PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "9.4");
    return DriverManager.getConnection(jdbcUrl(), props);
  }

  String jdbcUrl() {
    return "jdbc:postgresql://" + options.getHost() + ':' + options.getPort() + '/' + options.getDatabase();
  }

  private Properties connectionProperties() {
    Properties props = new Properties();
    PGProperty.USER.set(props, options.getUser());

    String password = resolvePassword();
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }

    if (Boolean.TRUE.equals(options.getSsl())) {
      props.setProperty("ssl", "true");
    }
    PGProperty.APPLICATION_NAME.set(props, "vertx-cdc-source");
    return props;
  }

  private String resolvePassword() {
    String password = options.getPassword();
    if (password == null || password.isBlank()) {
      String envName = options.getPasswordEnv();
      if (envName != null && !envName.isBlank()) {
        password = System.getenv(envName);
      }
    }
    return password;
  }

  static String quoteIdentifier(String identifier) {
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }

  static String quoteTable(String schema, String table) {
    return schema == null ? quoteIdentifier(table) : quoteIdentifier(schema) + '.' + quoteIdentifier(table);
  }
}
