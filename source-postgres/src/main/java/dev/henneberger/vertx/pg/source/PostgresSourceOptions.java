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

import dev.henneberger.vertx.source.core.NoopStateStore;
import dev.henneberger.vertx.source.core.OptionValidation;
import dev.henneberger.vertx.source.core.StateStore;
import dev.henneberger.vertx.source.core.SyncOptions;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * Connection, replication slot and publication configuration of a PostgreSQL source.
 */
@DataObject
public class PostgresSourceOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_PLUGIN = "pgoutput";

  private String host;
  private int port;
  private String database;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String slotName;
  private String publicationName;
  private String plugin;
  private boolean autoCreateSlot;
  private boolean autoCreatePublication;
  private boolean autoSetReplicaIdentity;
  private boolean preflightEnabled;
  private String stateKey;
  private SyncOptions syncOptions;
  private StateStore stateStore;

  public PostgresSourceOptions() {
    init();
  }

  public PostgresSourceOptions(JsonObject json) {
    init();
    PostgresSourceOptionsConverter.fromJson(json, this);
  }

  public PostgresSourceOptions(PostgresSourceOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.slotName = other.slotName;
    this.publicationName = other.publicationName;
    this.plugin = other.plugin;
    this.autoCreateSlot = other.autoCreateSlot;
    this.autoCreatePublication = other.autoCreatePublication;
    this.autoSetReplicaIdentity = other.autoSetReplicaIdentity;
    this.preflightEnabled = other.preflightEnabled;
    this.stateKey = other.stateKey;
    this.syncOptions = new SyncOptions(other.syncOptions);
    this.stateStore = other.stateStore;
  }

  public String getHost() {
    return host;
  }

  public PostgresSourceOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public PostgresSourceOptions setPort(Integer port) {
    this.port = port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public PostgresSourceOptions setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public PostgresSourceOptions setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public PostgresSourceOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getPasswordEnv() {
    return passwordEnv;
  }

  /**
   * Name of an environment variable holding the password, used when no password is set.
   */
  public PostgresSourceOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public PostgresSourceOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  public String getSlotName() {
    return slotName;
  }

  public PostgresSourceOptions setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  public String getPublicationName() {
    return publicationName;
  }

  public PostgresSourceOptions setPublicationName(String publicationName) {
    this.publicationName = publicationName;
    return this;
  }

  public String getPlugin() {
    return plugin;
  }

  public PostgresSourceOptions setPlugin(String plugin) {
    this.plugin = plugin;
    return this;
  }

  public boolean isAutoCreateSlot() {
    return autoCreateSlot;
  }

  public PostgresSourceOptions setAutoCreateSlot(boolean autoCreateSlot) {
    this.autoCreateSlot = autoCreateSlot;
    return this;
  }

  public boolean isAutoCreatePublication() {
    return autoCreatePublication;
  }

  /**
   * Creates a missing publication for exactly the selected CDC tables. An existing publication is
   * never altered.
   */
  public PostgresSourceOptions setAutoCreatePublication(boolean autoCreatePublication) {
    this.autoCreatePublication = autoCreatePublication;
    return this;
  }

  public boolean isAutoSetReplicaIdentity() {
    return autoSetReplicaIdentity;
  }

  /**
   * Allows {@code ALTER TABLE ... REPLICA IDENTITY FULL} on CDC tables whose identity cannot
   * describe updates and deletes, when the role owns the table.
   */
  public PostgresSourceOptions setAutoSetReplicaIdentity(boolean autoSetReplicaIdentity) {
    this.autoSetReplicaIdentity = autoSetReplicaIdentity;
    return this;
  }

  public boolean isPreflightEnabled() {
    return preflightEnabled;
  }

  public PostgresSourceOptions setPreflightEnabled(boolean preflightEnabled) {
    this.preflightEnabled = preflightEnabled;
    return this;
  }

  public String getStateKey() {
    return stateKey;
  }

  /**
   * Key the sync state is stored under; defaults to the slot name, or the database name when no
   * slot is configured.
   */
  public PostgresSourceOptions setStateKey(String stateKey) {
    this.stateKey = stateKey;
    return this;
  }

  public SyncOptions getSyncOptions() {
    return syncOptions;
  }

  @GenIgnore
  public PostgresSourceOptions setSyncOptions(SyncOptions syncOptions) {
    this.syncOptions = Objects.requireNonNull(syncOptions, "syncOptions");
    return this;
  }

  @GenIgnore
  public StateStore getStateStore() {
    return stateStore;
  }

  @GenIgnore
  public PostgresSourceOptions setStateStore(StateStore stateStore) {
    this.stateStore = Objects.requireNonNull(stateStore, "stateStore");
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresSourceOptionsConverter.toJson(this, json);
    return json;
  }

  public PostgresSourceOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    PostgresSourceOptions merged = new PostgresSourceOptions(json);
    merged.setStateStore(stateStore);
    return merged;
  }

  String resolvedStateKey() {
    if (stateKey != null && !stateKey.isBlank()) {
      return stateKey;
    }
    return slotName != null && !slotName.isBlank() ? slotName : database;
  }

  boolean hasReplication() {
    return slotName != null && !slotName.isBlank();
  }

  void validate() {
    OptionValidation.require("host", host);
    OptionValidation.requirePort(port);
    OptionValidation.require("database", database);
    OptionValidation.require("user", user);
    OptionValidation.require("plugin", plugin);
    if (!DEFAULT_PLUGIN.equalsIgnoreCase(plugin)) {
      throw new IllegalArgumentException("plugin must be " + DEFAULT_PLUGIN + ", was " + plugin);
    }
    if (hasReplication()) {
      OptionValidation.requireSimpleIdentifier("slotName", slotName);
      OptionValidation.requireSimpleIdentifier("publicationName", publicationName);
    }
    Objects.requireNonNull(syncOptions, "syncOptions").validate();
    Objects.requireNonNull(stateStore, "stateStore");
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = false;
    plugin = DEFAULT_PLUGIN;
    autoCreateSlot = true;
    autoCreatePublication = false;
    autoSetReplicaIdentity = true;
    preflightEnabled = false;
    syncOptions = new SyncOptions();
    stateStore = new NoopStateStore();
  }
}
