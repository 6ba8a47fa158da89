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

import dev.henneberger.vertx.source.core.ConfiguredCatalog;
import dev.henneberger.vertx.source.core.ConfiguredStream;
import dev.henneberger.vertx.source.core.StreamDescriptor;
import org.junit.jupiter.api.Test;

class PostgresSourceTest {

  @Test
  void unqualifiedStreamsAreReadFromPublicSchema() {
    ConfiguredCatalog catalog = ConfiguredCatalog.of(
      ConfiguredStream.cdc(StreamDescriptor.of(null, "users")),
      ConfiguredStream.fullRefresh(StreamDescriptor.of("billing", "invoices")));

    ConfiguredCatalog qualified = PostgresSource.qualify(catalog);

    assertEquals(StreamDescriptor.of("public", "users"), qualified.streams().get(0).descriptor());
    assertEquals(StreamDescriptor.of("billing", "invoices"), qualified.streams().get(1).descriptor());
  }
}
