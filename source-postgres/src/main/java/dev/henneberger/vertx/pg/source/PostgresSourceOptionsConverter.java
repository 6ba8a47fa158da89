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

import dev.henneberger.vertx.source.core.SyncOptions;
import io.vertx.core.json.JsonObject;

final class PostgresSourceOptionsConverter {

  private PostgresSourceOptionsConverter() {
  }

  static void fromJson(JsonObject json, PostgresSourceOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("host")) {
      options.setHost(json.getString("host"));
    }
    if (json.containsKey("port")) {
      options.setPort(json.getInteger("port"));
    }
    if (json.containsKey("database")) {
      options.setDatabase(json.getString("database"));
    }
    if (json.containsKey("user")) {
      options.setUser(json.getString("user"));
    }
    if (json.containsKey("password")) {
      options.setPassword(json.getString("password"));
    }
    if (json.containsKey("passwordEnv")) {
      options.setPasswordEnv(json.getString("passwordEnv"));
    }
    if (json.containsKey("ssl")) {
      options.setSsl(json.getBoolean("ssl"));
    }
    if (json.containsKey("slotName")) {
      options.setSlotName(json.getString("slotName"));
    }
    if (json.containsKey("publicationName")) {
      options.setPublicationName(json.getString("publicationName"));
    }
    if (json.containsKey("plugin")) {
      options.setPlugin(json.getString("plugin"));
    }
    if (json.containsKey("autoCreateSlot")) {
      options.setAutoCreateSlot(json.getBoolean("autoCreateSlot"));
    }
    if (json.containsKey("autoCreatePublication")) {
      options.setAutoCreatePublication(json.getBoolean("autoCreatePublication"));
    }
    if (json.containsKey("autoSetReplicaIdentity")) {
      options.setAutoSetReplicaIdentity(json.getBoolean("autoSetReplicaIdentity"));
    }
    if (json.containsKey("preflightEnabled")) {
      options.setPreflightEnabled(json.getBoolean("preflightEnabled"));
    }
    if (json.containsKey("stateKey")) {
      options.setStateKey(json.getString("stateKey"));
    }

    JsonObject syncJson = json.getJsonObject("syncOptions");
    if (syncJson != null) {
      options.setSyncOptions(new SyncOptions(syncJson));
    }
  }

  static void toJson(PostgresSourceOptions options, JsonObject json) {
    json.put("host", options.getHost());
    json.put("port", options.getPort());
    json.put("database", options.getDatabase());
    json.put("user", options.getUser());
    json.put("password", options.getPassword());
    json.put("passwordEnv", options.getPasswordEnv());
    json.put("ssl", options.getSsl());
    json.put("slotName", options.getSlotName());
    json.put("publicationName", options.getPublicationName());
    json.put("plugin", options.getPlugin());
    json.put("autoCreateSlot", options.isAutoCreateSlot());
    json.put("autoCreatePublication", options.isAutoCreatePublication());
    json.put("autoSetReplicaIdentity", options.isAutoSetReplicaIdentity());
    json.put("preflightEnabled", options.isPreflightEnabled());
    json.put("stateKey", options.getStateKey());
    json.put("syncOptions", options.getSyncOptions().toJson());
  }
}
