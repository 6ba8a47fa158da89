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
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.source.core.ConfiguredStream;
import dev.henneberger.vertx.source.core.PageRequest;
import dev.henneberger.vertx.source.core.StreamDescriptor;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PgPageSourceTest {

  private static final ConfiguredStream USERS = ConfiguredStream.fullRefresh(StreamDescriptor.of("app", "users"));

  @Test
  void firstPageHasNoKeysetCondition() {
    List<Object> params = new ArrayList<>();

    String sql = PgPageSource.buildQuery(new PageRequest(USERS, List.of("id"), null, null, null, 500), params);

    assertEquals("SELECT * FROM \"app\".\"users\" ORDER BY \"id\" LIMIT 500", sql);
    assertTrue(params.isEmpty());
  }

  @Test
  void laterPagesSeekPastTheCompositeKey() {
    List<Object> params = new ArrayList<>();
    JsonObject after = new JsonObject().put("tenant", "acme").put("id", 41);

    String sql = PgPageSource.buildQuery(
      new PageRequest(USERS, List.of("tenant", "id"), after, null, null, 100), params);

    assertEquals("SELECT * FROM \"app\".\"users\" WHERE (\"tenant\", \"id\") > (?, ?) "
      + "ORDER BY \"tenant\", \"id\" LIMIT 100", sql);
    assertEquals(List.of("acme", 41), params);
  }

  @Test
  void incrementalScanSkipsNullCursorsAndAppliesInclusiveBound() {
    ConfiguredStream orders = ConfiguredStream.incremental(StreamDescriptor.of(null, "orders"), "updated_at");
    List<Object> params = new ArrayList<>();
    JsonObject after = new JsonObject().put("updated_at", "2024-01-02T00:00:00").put("id", 7);

    String sql = PgPageSource.buildQuery(new PageRequest(orders, List.of("updated_at", "id"), after,
      "updated_at", "2024-01-01T00:00:00", 10), params);

    assertEquals("SELECT * FROM \"public\".\"orders\" WHERE \"updated_at\" IS NOT NULL AND \"updated_at\" >= ? "
      + "AND (\"updated_at\", \"id\") > (?, ?) ORDER BY \"updated_at\", \"id\" LIMIT 10", sql);
    assertEquals(List.of("2024-01-01T00:00:00", "2024-01-02T00:00:00", 7), params);
  }

  @Test
  void tablesWithoutPrimaryKeyArePagedByCtid() {
    List<Object> params = new ArrayList<>();

    String sql = PgPageSource.buildQuery(
      new PageRequest(USERS, List.of(PgPageSource.CTID), new JsonObject().put("ctid", "(0,5)"), null, null, 2),
      params);

    assertEquals("SELECT *, ctid FROM \"app\".\"users\" WHERE (ctid) > (?) ORDER BY ctid LIMIT 2", sql);
    assertEquals(List.of("(0,5)"), params);
  }

  @Test
  void quotesIdentifiers() {
    List<Object> params = new ArrayList<>();
    ConfiguredStream odd = ConfiguredStream.fullRefresh(StreamDescriptor.of("public", "we\"ird"));

    String sql = PgPageSource.buildQuery(new PageRequest(odd, List.of("Id"), null, null, null, 1), params);

    assertEquals("SELECT * FROM \"public\".\"we\"\"ird\" ORDER BY \"Id\" LIMIT 1", sql);
  }
}
