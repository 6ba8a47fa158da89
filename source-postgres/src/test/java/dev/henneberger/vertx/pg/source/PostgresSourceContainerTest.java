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
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.source.core.ChangeRecord;
import dev.henneberger.vertx.source.core.ConfiguredCatalog;
import dev.henneberger.vertx.source.core.ConfiguredStream;
import dev.henneberger.vertx.source.core.LogPosition;
import dev.henneberger.vertx.source.core.LogReaderState;
import dev.henneberger.vertx.source.core.PreflightReport;
import dev.henneberger.vertx.source.core.SourceMessage;
import dev.henneberger.vertx.source.core.SourceMessageIterator;
import dev.henneberger.vertx.source.core.StreamDescriptor;
import dev.henneberger.vertx.source.core.SyncState;
import io.vertx.core.Vertx;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;

class PostgresSourceContainerTest {

  private static final String SLOT_NAME = "vertx_source_slot";
  private static final String PUBLICATION_NAME = "vertx_source_pub";
  private static final String DB_NAME = "testdb";
  private static final String DB_USER = "test";
  private static final String DB_PASSWORD = "test";
  private static final StreamDescriptor USERS = StreamDescriptor.of("public", "users");

  @Test
  void fullRefreshReadsEveryRowAcrossPages() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    GenericContainer<?> postgres = createPostgresContainer();
    try {
      postgres.start();
      execute(postgres,
        "CREATE TABLE users (id SERIAL PRIMARY KEY, name TEXT NOT NULL)",
        "INSERT INTO users(name) SELECT 'user-' || g FROM generate_series(1, 25) g");

      Vertx vertx = Vertx.vertx();
      try {
        PostgresSourceOptions options = baseOptions(postgres);
        options.getSyncOptions().setSnapshotPageSize(10);
        PostgresSource source = new PostgresSource(vertx, options);

        List<SourceMessage> records = new ArrayList<>();
        try (SourceMessageIterator messages = source.read(ConfiguredCatalog.of(ConfiguredStream.fullRefresh(USERS)), null)) {
          while (messages.hasNext()) {
            SourceMessage message = messages.next();
            if (message.isRecord()) {
              records.add(message);
            }
          }
        }

        assertEquals(25, records.size());
        for (int i = 0; i < records.size(); i++) {
          assertEquals(i + 1, ((Number) records.get(i).data().get("id")).intValue());
        }
      } finally {
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  @Test
  void snapshotsThenStreamsChangesOnResume() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    GenericContainer<?> postgres = createPostgresContainer();
    try {
      postgres.start();
      execute(postgres,
        "CREATE TABLE users (id SERIAL PRIMARY KEY, name TEXT NOT NULL)",
        "INSERT INTO users(name) VALUES ('alice'), ('bob')");

      Vertx vertx = Vertx.vertx();
      try {
        PostgresSourceOptions options = baseOptions(postgres)
          .setSlotName(SLOT_NAME)
          .setPublicationName(PUBLICATION_NAME)
          .setAutoCreateSlot(true)
          .setAutoCreatePublication(true)
          .setPreflightEnabled(true);
        options.getSyncOptions().setCdcIdleTimeout(Duration.ofSeconds(10));
        PostgresSource source = new PostgresSource(vertx, options);
        SourceLogging.attachDefaultLogging(source, LoggerFactory.getLogger(PostgresSourceContainerTest.class), "users-cdc");
        CompletableFuture<LogPosition> streaming = new CompletableFuture<>();
        source.onLogReaderStateChange(change -> {
          if (change.state() == LogReaderState.STREAMING) {
            streaming.complete(change.position());
          }
        });
        ConfiguredCatalog catalog = ConfiguredCatalog.of(ConfiguredStream.cdc(USERS));

        List<SourceMessage> snapshot = new ArrayList<>();
        SyncState afterSnapshot = readAll(source, catalog, null, snapshot);

        assertEquals(2, snapshot.size());
        assertNotNull(afterSnapshot);
        assertTrue(afterSnapshot.stream(USERS).logPosition() != null);

        waitForSlotInactive(postgres, SLOT_NAME);
        execute(postgres,
          "INSERT INTO users(name) VALUES ('carol')",
          "UPDATE users SET name = 'alice2' WHERE id = 1",
          "DELETE FROM users WHERE id = 2");

        List<SourceMessage> changes = new ArrayList<>();
        SyncState afterStream = readAll(source, catalog, afterSnapshot.toJson().encode(), changes);

        assertNotNull(streaming.get(10, TimeUnit.SECONDS));
        assertEquals(3, changes.size());
        assertEquals(ChangeRecord.Operation.INSERT, changes.get(0).change().operation());
        assertEquals("carol", changes.get(0).data().get("name"));
        assertEquals(ChangeRecord.Operation.UPDATE, changes.get(1).change().operation());
        assertEquals("alice2", changes.get(1).data().get("name"));
        assertEquals(ChangeRecord.Operation.DELETE, changes.get(2).change().operation());
        assertEquals(2, ((Number) changes.get(2).change().before().get("id")).intValue());
        assertTrue(afterStream.stream(USERS).logPosition().isAfter(afterSnapshot.stream(USERS).logPosition()));

        PreflightReport report = source.check().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        assertTrue(report.isOk(), () -> "Unexpected preflight failures: " + report);
      } finally {
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  private static SyncState readAll(PostgresSource source,
                                   ConfiguredCatalog catalog,
                                   String state,
                                   List<SourceMessage> records) {
    SyncState last = null;
    try (SourceMessageIterator messages = source.read(catalog, state)) {
      while (messages.hasNext()) {
        SourceMessage message = messages.next();
        if (message.isRecord()) {
          records.add(message);
        } else if (message.isState()) {
          last = message.state();
        }
      }
    }
    return last;
  }

  private static void waitForSlotInactive(GenericContainer<?> postgres, String slotName) throws Exception {
    long deadline = System.currentTimeMillis() + 30_000L;
    while (System.currentTimeMillis() < deadline) {
      try (Connection conn = DriverManager.getConnection(jdbcUrl(postgres), DB_USER, DB_PASSWORD);
           PreparedStatement statement = conn.prepareStatement(
             "SELECT active FROM pg_replication_slots WHERE slot_name = ?")) {
        statement.setString(1, slotName);
        try (ResultSet rs = statement.executeQuery()) {
          if (rs.next() && !rs.getBoolean(1)) {
            return;
          }
        }
      }
      Thread.sleep(100L);
    }
    throw new AssertionError("Replication slot " + slotName + " is still active");
  }

  private static PostgresSourceOptions baseOptions(GenericContainer<?> postgres) {
    return new PostgresSourceOptions()
      .setHost(postgres.getHost())
      .setPort(postgres.getFirstMappedPort())
      .setDatabase(DB_NAME)
      .setUser(DB_USER)
      .setPassword(DB_PASSWORD);
  }

  private static void execute(GenericContainer<?> postgres, String... sql) throws Exception {
    try (Connection conn = DriverManager.getConnection(jdbcUrl(postgres), DB_USER, DB_PASSWORD);
         Statement statement = conn.createStatement()) {
      for (String s : sql) {
        statement.execute(s);
      }
    }
  }

  private static String jdbcUrl(GenericContainer<?> postgres) {
    return "jdbc:postgresql://" + postgres.getHost() + ":" + postgres.getFirstMappedPort() + "/" + DB_NAME;
  }

  private static GenericContainer<?> createPostgresContainer() {
    return new GenericContainer<>("postgres:16")
      .withExposedPorts(5432)
      .withEnv("POSTGRES_DB", DB_NAME)
      .withEnv("POSTGRES_USER", DB_USER)
      .withEnv("POSTGRES_PASSWORD", DB_PASSWORD)
      .withStartupTimeout(Duration.ofMinutes(10))
      .withCommand("postgres",
        "-c", "wal_level=logical",
        "-c", "max_replication_slots=10",
        "-c", "max_wal_senders=10");
  }
}
