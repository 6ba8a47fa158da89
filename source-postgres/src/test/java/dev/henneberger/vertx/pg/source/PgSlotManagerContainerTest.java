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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.source.core.ConfigException;
import dev.henneberger.vertx.source.core.LogPosition;
import dev.henneberger.vertx.source.core.PermissionDeniedException;
import dev.henneberger.vertx.source.core.SlotBusyException;
import dev.henneberger.vertx.source.core.StreamDescriptor;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;

class PgSlotManagerContainerTest {

  private static final String DB_NAME = "testdb";
  private static final String DB_USER = "test";
  private static final String DB_PASSWORD = "test";
  private static final String READER_USER = "cdc_reader";
  private static final String READER_PASSWORD = "reader";
  private static final StreamDescriptor USERS = StreamDescriptor.of("public", "users");
  private static final StreamDescriptor ORDERS = StreamDescriptor.of("public", "orders");

  private static GenericContainer<?> postgres;

  @BeforeAll
  static void startPostgres() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    postgres = new GenericContainer<>("postgres:16")
      .withExposedPorts(5432)
      .withEnv("POSTGRES_DB", DB_NAME)
      .withEnv("POSTGRES_USER", DB_USER)
      .withEnv("POSTGRES_PASSWORD", DB_PASSWORD)
      .withStartupTimeout(Duration.ofMinutes(10))
      .withCommand("postgres",
        "-c", "wal_level=logical",
        "-c", "max_replication_slots=10",
        "-c", "max_wal_senders=10");
    postgres.start();
    execute(
      "CREATE TABLE users (id SERIAL PRIMARY KEY, name TEXT NOT NULL)",
      "CREATE TABLE orders (id INT NOT NULL, total NUMERIC)",
      "CREATE ROLE " + READER_USER + " LOGIN PASSWORD '" + READER_PASSWORD + "'",
      "GRANT SELECT ON users, orders TO " + READER_USER);
  }

  @AfterAll
  static void stopPostgres() {
    if (postgres != null) {
      postgres.stop();
    }
  }

  @Test
  void slotWithAnotherPluginIsRejected() throws Exception {
    execute("SELECT pg_create_logical_replication_slot('decoding_slot', 'test_decoding')");
    PgSlotManager manager = manager(options().setAutoCreateSlot(true));

    ConfigException error = assertThrows(ConfigException.class,
      () -> manager.verifyOrCreate("decoding_slot", "pgoutput"));

    assertTrue(error.getMessage().contains("test_decoding"), error.getMessage());
  }

  @Test
  void missingSlotIsRejectedWhenItMayNotBeCreated() throws Exception {
    PgSlotManager manager = manager(options().setAutoCreateSlot(false));

    assertThrows(ConfigException.class, () -> manager.verifyOrCreate("absent_slot", "pgoutput"));
    assertTrue(manager.inspect("absent_slot").isEmpty());
  }

  @Test
  void publicationWithoutTableIsRejected() throws Exception {
    execute("CREATE PUBLICATION users_only_pub FOR TABLE users");
    PgSlotManager manager = manager(options().setAutoCreatePublication(true));

    ConfigException error = assertThrows(ConfigException.class,
      () -> manager.ensurePublicationCovers("users_only_pub", List.of(USERS, ORDERS)));

    assertTrue(error.getMessage().contains("orders"), error.getMessage());
    assertEquals("users_only_pub", manager.ensurePublicationCovers("users_only_pub", List.of(USERS)).name());
  }

  @Test
  void replicaIdentityNothingNeedsTheTableOwner() throws Exception {
    execute("ALTER TABLE orders REPLICA IDENTITY NOTHING");
    PgSlotManager manager = manager(options()
      .setUser(READER_USER)
      .setPassword(READER_PASSWORD)
      .setAutoSetReplicaIdentity(true));

    assertThrows(PermissionDeniedException.class, () -> manager.ensureReplicaIdentity(ORDERS));
    assertEquals("n", replicaIdentity("orders"));
  }

  @Test
  void slotHeldByAnotherWalSenderIsBusy() throws Exception {
    execute(
      "CREATE PUBLICATION busy_pub FOR TABLE users",
      "SELECT pg_create_logical_replication_slot('busy_slot', 'pgoutput')");
    PostgresSourceOptions options = options();
    PgSlotManager manager = manager(options);

    try (PgReplicationConnection holder = PgReplicationConnection.open(
      new PgConnections(options), "busy_slot", "busy_pub", LogPosition.ZERO, 1_000L)) {
      waitForSlotActive("busy_slot");

      assertThrows(SlotBusyException.class, () -> manager.acquire("busy_slot"));
    }
  }

  private static PgSlotManager manager(PostgresSourceOptions options) {
    return new PgSlotManager(new PgConnections(options), options);
  }

  private static PostgresSourceOptions options() {
    return new PostgresSourceOptions()
      .setHost(postgres.getHost())
      .setPort(postgres.getFirstMappedPort())
      .setDatabase(DB_NAME)
      .setUser(DB_USER)
      .setPassword(DB_PASSWORD);
  }

  private static String replicaIdentity(String table) throws Exception {
    try (Connection conn = DriverManager.getConnection(jdbcUrl(), DB_USER, DB_PASSWORD);
         PreparedStatement statement = conn.prepareStatement("SELECT relreplident FROM pg_class WHERE relname = ?")) {
      statement.setString(1, table);
      try (ResultSet rs = statement.executeQuery()) {
        rs.next();
        return rs.getString(1);
      }
    }
  }

  private static void waitForSlotActive(String slotName) throws Exception {
    long deadline = System.currentTimeMillis() + 30_000L;
    while (System.currentTimeMillis() < deadline) {
      try (Connection conn = DriverManager.getConnection(jdbcUrl(), DB_USER, DB_PASSWORD);
           PreparedStatement statement = conn.prepareStatement(
             "SELECT active FROM pg_replication_slots WHERE slot_name = ?")) {
        statement.setString(1, slotName);
        try (ResultSet rs = statement.executeQuery()) {
          if (rs.next() && rs.getBoolean(1)) {
            return;
          }
        }
      }
      Thread.sleep(100L);
    }
    throw new AssertionError("Replication slot " + slotName + " never became active");
  }

  private static void execute(String... sql) throws Exception {
    try (Connection conn = DriverManager.getConnection(jdbcUrl(), DB_USER, DB_PASSWORD);
         Statement statement = conn.createStatement()) {
      for (String s : sql) {
        statement.execute(s);
      }
    }
  }

  private static String jdbcUrl() {
    return "jdbc:postgresql://" + postgres.getHost() + ":" + postgres.getFirstMappedPort() + "/" + DB_NAME;
  }
}
