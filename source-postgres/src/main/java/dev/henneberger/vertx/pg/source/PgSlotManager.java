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

import dev.henneberger.vertx.source.core.ConfigException;
import dev.henneberger.vertx.source.core.LogPosition;
import dev.henneberger.vertx.source.core.PermissionDeniedException;
import dev.henneberger.vertx.source.core.Publication;
import dev.henneberger.vertx.source.core.ReplicationSlot;
import dev.henneberger.vertx.source.core.SlotBusyException;
import dev.henneberger.vertx.source.core.SlotHandle;
import dev.henneberger.vertx.source.core.StreamDescriptor;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates and provisions the replication slot, the publication and the replica identity of
 * CDC tables. Slots and publications are created when allowed but never dropped.
 */
public class PgSlotManager {

  private static final Logger LOG = LoggerFactory.getLogger(PgSlotManager.class);

  private final PgConnections connections;
  private final PostgresSourceOptions options;

  PgSlotManager(PgConnections connections, PostgresSourceOptions options) {
    this.connections = connections;
    this.options = options;
  }

  public Optional<ReplicationSlot> inspect(String slotName) throws SQLException {
    try (Connection conn = connections.openStandard();
         PreparedStatement statement = conn.prepareStatement(
           "SELECT slot_name, plugin, confirmed_flush_lsn::text, active, database, active_pid "
             + "FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, slotName);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        String database = rs.getString(5);
        if (database != null && !database.equals(options.getDatabase())) {
          throw new ConfigException(
            "Replication slot '" + slotName + "' belongs to database '" + database + "'",
            "Use a slot created in database '" + options.getDatabase() + "'.");
        }
        String confirmed = rs.getString(3);
        return Optional.of(new ReplicationSlot(
          rs.getString(1),
          rs.getString(2),
          confirmed == null ? null : LogPosition.parse(confirmed),
          rs.getBoolean(4)));
      }
    }
  }

  /**
   * Returns the slot, creating it when it is absent and auto-creation is enabled.
   *
   * @throws ConfigException if the slot uses another plugin, or is absent and may not be created
   */
  public ReplicationSlot verifyOrCreate(String slotName, String plugin) throws SQLException {
    Optional<ReplicationSlot> existing = inspect(slotName);
    if (existing.isPresent()) {
      ReplicationSlot slot = existing.get();
      if (!plugin.equalsIgnoreCase(slot.plugin())) {
        throw new ConfigException(
          "Replication slot '" + slotName + "' uses plugin '" + slot.plugin() + "' but '" + plugin + "' is configured",
          "Create a new slot with SELECT pg_create_logical_replication_slot('" + slotName + "', '" + plugin
            + "') after dropping the old one, or configure a slot that uses " + plugin + ".");
      }
      return slot;
    }
    if (!options.isAutoCreateSlot()) {
      throw new ConfigException(
        "Replication slot '" + slotName + "' does not exist",
        "Create it with SELECT pg_create_logical_replication_slot('" + slotName + "', '" + plugin
          + "') or enable autoCreateSlot.");
    }

    try (Connection conn = connections.openStandard();
         PreparedStatement statement = conn.prepareStatement("SELECT pg_create_logical_replication_slot(?, ?)")) {
      statement.setString(1, slotName);
      statement.setString(2, plugin);
      statement.execute();
      LOG.info("Created replication slot {} with plugin {}", slotName, plugin);
    } catch (SQLException createError) {
      if (!isAlreadyExists(createError)) {
        throw createError;
      }
      LOG.info("Replication slot {} was created concurrently", slotName);
    }
    return inspect(slotName).orElseThrow(() -> new ConfigException(
      "Replication slot '" + slotName + "' disappeared after creation",
      "Check whether another process drops replication slots."));
  }

  /**
   * Verifies that every table is published, creating the publication for exactly these tables
   * when it is absent and auto-creation is enabled.
   *
   * @throws ConfigException if the publication is missing or does not include a table
   */
  public Publication ensurePublicationCovers(String publicationName,
                                             Collection<StreamDescriptor> tables) throws SQLException {
    try (Connection conn = connections.openStandard()) {
      Optional<Boolean> allTables = publicationAllTables(conn, publicationName);
      if (allTables.isEmpty()) {
        if (!options.isAutoCreatePublication()) {
          throw new ConfigException(
            "Publication '" + publicationName + "' does not exist",
            "Run CREATE PUBLICATION " + publicationName + " FOR TABLE " + tableList(tables)
              + "; or enable autoCreatePublication.");
        }
        try (Statement statement = conn.createStatement()) {
          statement.execute("CREATE PUBLICATION " + PgConnections.quoteIdentifier(publicationName)
            + " FOR TABLE " + tableList(tables));
        }
        LOG.info("Created publication {} for {}", publicationName, tableList(tables));
        allTables = Optional.of(false);
      }

      Publication publication = new Publication(publicationName, allTables.get(),
        allTables.get() ? Set.of() : publishedTables(conn, publicationName));
      List<StreamDescriptor> missing = new ArrayList<>();
      for (StreamDescriptor table : tables) {
        if (!publication.covers(table)) {
          missing.add(table);
        }
      }
      if (!missing.isEmpty()) {
        throw new ConfigException(
          "Publication '" + publicationName + "' does not include " + missing,
          "Run ALTER PUBLICATION " + publicationName + " ADD TABLE " + tableList(missing) + ";");
      }
      return publication;
    }
  }

  /**
   * Makes sure updates and deletes of {@code table} can be decoded. A table with replica identity
   * NOTHING, or DEFAULT without a primary key, is switched to FULL when the role may alter it.
   *
   * @throws PermissionDeniedException if the identity is inadequate and cannot be changed
   */
  public void ensureReplicaIdentity(StreamDescriptor table) throws SQLException {
    String schema = table.namespace() == null ? PgConnections.DEFAULT_SCHEMA : table.namespace();
    try (Connection conn = connections.openStandard()) {
      char identity;
      boolean hasPrimaryKey;
      boolean canAlter;
      try (PreparedStatement statement = conn.prepareStatement(
        "SELECT c.relreplident, "
          + "EXISTS (SELECT 1 FROM pg_index i WHERE i.indrelid = c.oid AND i.indisprimary), "
          + "pg_has_role(c.relowner, 'USAGE') OR (SELECT rolsuper FROM pg_roles WHERE rolname = current_user) "
          + "FROM pg_class c JOIN pg_namespace n ON n.oid = c.relnamespace "
          + "WHERE n.nspname = ? AND c.relname = ?")) {
        statement.setString(1, schema);
        statement.setString(2, table.name());
        try (ResultSet rs = statement.executeQuery()) {
          if (!rs.next()) {
            throw new ConfigException("Table " + table + " does not exist",
              "Remove the stream from the catalog or create the table.");
          }
          identity = rs.getString(1).charAt(0);
          hasPrimaryKey = rs.getBoolean(2);
          canAlter = rs.getBoolean(3);
        }
      }

      boolean adequate = identity == 'f' || identity == 'i' || (identity == 'd' && hasPrimaryKey);
      LOG.info("REPLICA IDENTITY for '{}' is '{}'; {}", table, describeIdentity(identity),
        adequate ? "updates and deletes can be decoded" : "old row values would be missing");
      if (adequate) {
        return;
      }

      String alter = "ALTER TABLE " + PgConnections.quoteTable(schema, table.name()) + " REPLICA IDENTITY FULL";
      if (!options.isAutoSetReplicaIdentity() || !canAlter) {
        throw new PermissionDeniedException(
          "Table " + table + " has replica identity " + describeIdentity(identity)
            + (hasPrimaryKey ? "" : " and no primary key") + ", so updates and deletes cannot be captured",
          "Run " + alter + "; as the table owner, or add a primary key.");
      }
      try (Statement statement = conn.createStatement()) {
        statement.execute(alter);
      } catch (SQLException e) {
        throw new PermissionDeniedException("Could not set replica identity of " + table + ": " + e.getMessage(),
          "Run " + alter + "; as the table owner.", e);
      }
      LOG.info("Set REPLICA IDENTITY FULL on {}", table);
    }
  }

  /**
   * Claims the slot for this process.
   *
   * @throws SlotBusyException if another consumer is attached to the slot
   */
  public SlotHandle acquire(String slotName) throws SQLException {
    try (Connection conn = connections.openStandard();
         PreparedStatement statement = conn.prepareStatement(
           "SELECT active, active_pid FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, slotName);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          throw new ConfigException("Replication slot '" + slotName + "' does not exist",
            "Create the slot or enable autoCreateSlot.");
        }
        if (rs.getBoolean(1)) {
          throw new SlotBusyException(slotName, "backend pid " + rs.getInt(2));
        }
      }
    }
    ReplicationSlot slot = inspect(slotName).orElseThrow(() -> new ConfigException(
      "Replication slot '" + slotName + "' does not exist", "Create the slot or enable autoCreateSlot."));
    return new SlotHandle(slot);
  }

  public LogPosition currentPosition() throws SQLException {
    try (Connection conn = connections.openStandard();
         PreparedStatement statement = conn.prepareStatement("SELECT pg_current_wal_lsn()::text");
         ResultSet rs = statement.executeQuery()) {
      if (!rs.next()) {
        throw new SQLException("Could not read current WAL LSN");
      }
      return LogPosition.parse(rs.getString(1));
    }
  }

  private static Optional<Boolean> publicationAllTables(Connection conn, String publicationName) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT puballtables FROM pg_publication WHERE pubname = ?")) {
      statement.setString(1, publicationName);
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next() ? Optional.of(rs.getBoolean(1)) : Optional.empty();
      }
    }
  }

  private static Set<StreamDescriptor> publishedTables(Connection conn, String publicationName) throws SQLException {
    Set<StreamDescriptor> tables = new LinkedHashSet<>();
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT schemaname, tablename FROM pg_publication_tables WHERE pubname = ?")) {
      statement.setString(1, publicationName);
      try (ResultSet rs = statement.executeQuery()) {
        while (rs.next()) {
          tables.add(StreamDescriptor.of(rs.getString(1), rs.getString(2)));
        }
      }
    }
    return tables;
  }

  private static String tableList(Collection<StreamDescriptor> tables) {
    StringJoiner joiner = new StringJoiner(", ");
    for (StreamDescriptor table : tables) {
      joiner.add(PgConnections.quoteTable(table.namespace() == null ? PgConnections.DEFAULT_SCHEMA : table.namespace(), table.name()));
    }
    return joiner.toString();
  }

  private static String describeIdentity(char identity) {
    switch (identity) {
      case 'd':
        return "DEFAULT";
      case 'n':
        return "NOTHING";
      case 'f':
        return "FULL";
      case 'i':
        return "INDEX";
      default:
        return String.valueOf(identity);
    }
  }

  private static boolean isAlreadyExists(SQLException error) {
    String state = error.getSQLState();
    if ("42710".equals(state)) {
      return true;
    }
    String message = error.getMessage();
    return message != null && message.contains("already exists");
  }
}
