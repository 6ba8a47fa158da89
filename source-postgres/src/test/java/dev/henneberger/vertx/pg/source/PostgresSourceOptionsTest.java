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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.source.core.InMemoryStateStore;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class PostgresSourceOptionsTest {

  @Test
  void readsFromJsonAndSerializesToJson() {
    JsonObject json = new JsonObject()
      .put("host", "db.internal")
      .put("port", 15432)
      .put("database", "app")
      .put("user", "service")
      .put("passwordEnv", "PG_PASSWORD")
      .put("ssl", true)
      .put("slotName", "app_slot")
      .put("publicationName", "app_pub")
      .put("autoCreatePublication", true)
      .put("preflightEnabled", true)
      .put("syncOptions", new JsonObject()
        .put("snapshotPageSize", 250)
        .put("heartbeatIntervalMs", 5_000L)
        .put("backoffPolicy", new JsonObject().put("maxAttempts", 3L)));

    PostgresSourceOptions options = new PostgresSourceOptions(json);

    assertEquals("db.internal", options.getHost());
    assertEquals(15432, options.getPort());
    assertEquals("app", options.getDatabase());
    assertEquals("PG_PASSWORD", options.getPasswordEnv());
    assertTrue(options.getSsl());
    assertEquals("app_slot", options.getSlotName());
    assertEquals("app_pub", options.getPublicationName());
    assertEquals("pgoutput", options.getPlugin());
    assertTrue(options.isAutoCreatePublication());
    assertTrue(options.isAutoCreateSlot());
    assertEquals(250, options.getSyncOptions().getSnapshotPageSize());
    assertEquals(Duration.ofSeconds(5), options.getSyncOptions().getHeartbeatInterval());
    assertEquals(3L, options.getSyncOptions().getBackoffPolicy().getMaxAttempts());

    JsonObject out = options.toJson();
    assertEquals("db.internal", out.getString("host"));
    assertEquals("app_pub", out.getString("publicationName"));
    assertEquals(250, out.getJsonObject("syncOptions").getInteger("snapshotPageSize"));
  }

  @Test
  void mergeKeepsStateStore() {
    InMemoryStateStore store = new InMemoryStateStore();
    PostgresSourceOptions base = new PostgresSourceOptions()
      .setDatabase("app")
      .setUser("service")
      .setStateStore(store);

    PostgresSourceOptions merged = base.merge(new JsonObject().put("host", "replica").put("port", 6543));

    assertEquals("replica", merged.getHost());
    assertEquals(6543, merged.getPort());
    assertEquals("app", merged.getDatabase());
    assertSame(store, merged.getStateStore());
  }

  @Test
  void copyDoesNotShareSyncOptions() {
    PostgresSourceOptions original = new PostgresSourceOptions().setDatabase("app").setUser("service");

    PostgresSourceOptions copy = new PostgresSourceOptions(original);
    copy.getSyncOptions().setSnapshotPageSize(7);

    assertEquals(10_000, original.getSyncOptions().getSnapshotPageSize());
  }

  @Test
  void stateKeyDefaultsToSlotThenDatabase() {
    PostgresSourceOptions options = new PostgresSourceOptions().setDatabase("app").setUser("service");
    assertEquals("app", options.resolvedStateKey());
    assertFalse(options.hasReplication());

    options.setSlotName("app_slot");
    assertEquals("app_slot", options.resolvedStateKey());
    assertTrue(options.hasReplication());

    options.setStateKey("nightly");
    assertEquals("nightly", options.resolvedStateKey());
  }

  @Test
  void validateRejectsIncompleteConfiguration() {
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresSourceOptions().setUser("service").validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresSourceOptions().setDatabase("app").setUser("service").setPort(70_000).validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresSourceOptions().setDatabase("app").setUser("service").setPlugin("wal2json").validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresSourceOptions().setDatabase("app").setUser("service")
        .setSlotName("app_slot").validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresSourceOptions().setDatabase("app").setUser("service")
        .setSlotName("app-slot").setPublicationName("app_pub").validate());
  }

  @Test
  void validateAcceptsReplicationConfiguration() {
    new PostgresSourceOptions()
      .setDatabase("app")
      .setUser("service")
      .setSlotName("app_slot")
      .setPublicationName("app_pub")
      .validate();
  }
}
