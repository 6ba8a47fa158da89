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

import dev.henneberger.vertx.source.core.PreflightIssue;
import dev.henneberger.vertx.source.core.PreflightReport;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Server checks run before a sync or by {@code check()}. Missing slots and publications are only
 * reported when they will not be created automatically.
 */
final class PgPreflightChecks {

  static final long SLOT_LAG_WARNING_BYTES = 128L * 1024L * 1024L;

  private final PgConnections connections;
  private final PostgresSourceOptions options;

  PgPreflightChecks(PgConnections connections, PostgresSourceOptions options) {
    this.connections = connections;
    this.options = options;
  }

  PreflightReport run(boolean includeReplication) {
    List<PreflightIssue> issues = new ArrayList<>();
    try (Connection conn = connections.openStandard()) {
      if (includeReplication) {
        checkWalLevel(conn, issues);
        checkRolePrivileges(conn, issues);
        checkPositiveSetting(conn, "max_replication_slots", issues, "MAX_REPLICATION_SLOTS_INVALID");
        checkPositiveSetting(conn, "max_wal_senders", issues, "MAX_WAL_SENDERS_INVALID");
        checkExistingSlot(conn, issues);
        checkSlotLag(conn, issues);
        checkPublication(conn, issues);
      }
    } catch (Exception e) {
      issues.add(PreflightIssue.error(
        "CONNECTION_FAILED",
        "Could not connect to PostgreSQL: " + e.getMessage(),
        "Verify host, port, database, user, password, and SSL settings."
      ));
    }
    return new PreflightReport(issues);
  }

  private void checkWalLevel(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW wal_level");
         ResultSet rs = statement.executeQuery()) {
      if (!rs.next()) {
        issues.add(PreflightIssue.error(
          "WAL_LEVEL_UNKNOWN",
          "Could not read wal_level",
          "Set wal_level=logical and restart PostgreSQL."
        ));
        return;
      }
      String walLevel = rs.getString(1);
      if (!"logical".equalsIgnoreCase(walLevel)) {
        issues.add(PreflightIssue.error(
          "WAL_LEVEL_INVALID",
          "wal_level is '" + walLevel + "'",
          "Set wal_level=logical and restart PostgreSQL."
        ));
      }
    }
  }

  private void checkRolePrivileges(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT (rolreplication OR rolsuper) FROM pg_roles WHERE rolname = current_user");
         ResultSet rs = statement.executeQuery()) {
      if (rs.next() && !rs.getBoolean(1)) {
        issues.add(PreflightIssue.error(
          "ROLE_NOT_REPLICATION",
          "Current user does not have replication privileges",
          "Run ALTER ROLE " + options.getUser() + " WITH REPLICATION; or use a superuser role."
        ));
      }
    }
  }

  private void checkPositiveSetting(Connection conn,
                                    String setting,
                                    List<PreflightIssue> issues,
                                    String code) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW " + setting);
         ResultSet rs = statement.executeQuery()) {
      if (rs.next()) {
        long value = rs.getLong(1);
        if (value < 1) {
          issues.add(PreflightIssue.error(
            code,
            setting + " is set to " + value,
            "Set " + setting + " to at least 1 and restart PostgreSQL."
          ));
        }
      }
    }
  }

  private void checkExistingSlot(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT plugin, active FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, options.getSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          if (!options.isAutoCreateSlot()) {
            issues.add(PreflightIssue.error(
              "SLOT_MISSING",
              "Replication slot '" + options.getSlotName() + "' does not exist",
              "Create it with SELECT pg_create_logical_replication_slot('" + options.getSlotName()
                + "', 'pgoutput'); or enable autoCreateSlot."
            ));
          }
          return;
        }
        String slotPlugin = rs.getString(1);
        if (!options.getPlugin().equalsIgnoreCase(slotPlugin)) {
          issues.add(PreflightIssue.error(
            "SLOT_PLUGIN_MISMATCH",
            "Replication slot uses plugin '" + slotPlugin + "' but configured plugin is '" + options.getPlugin() + "'",
            "Use a slot created with the configured plugin, or configure the matching plugin name."
          ));
        }
        if (rs.getBoolean(2)) {
          issues.add(PreflightIssue.warning(
            "SLOT_ACTIVE",
            "Replication slot '" + options.getSlotName() + "' is in use by another connection",
            "Stop the other consumer before starting a sync on this slot."
          ));
        }
      }
    }
  }

  private void checkSlotLag(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT pg_wal_lsn_diff(pg_current_wal_lsn(), restart_lsn) "
        + "FROM pg_replication_slots WHERE slot_name = ? AND restart_lsn IS NOT NULL")) {
      statement.setString(1, options.getSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (rs.next()) {
          long lagBytes = rs.getLong(1);
          if (lagBytes > SLOT_LAG_WARNING_BYTES) {
            issues.add(PreflightIssue.warning(
              "SLOT_LAG_HIGH",
              "Replication slot lag is " + lagBytes + " bytes",
              "Run syncs more often; the server retains WAL until the slot is acknowledged."
            ));
          }
        }
      }
    }
  }

  private void checkPublication(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT 1 FROM pg_publication WHERE pubname = ?")) {
      statement.setString(1, options.getPublicationName());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next() && !options.isAutoCreatePublication()) {
          issues.add(PreflightIssue.error(
            "PUBLICATION_MISSING",
            "Publication '" + options.getPublicationName() + "' does not exist",
            "Run CREATE PUBLICATION " + options.getPublicationName()
              + " FOR TABLE <tables>; or enable autoCreatePublication."
          ));
        }
      }
    }
  }
}
