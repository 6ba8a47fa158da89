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

import dev.henneberger.vertx.source.core.FileStateStore;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Source settings read from the environment ({@code PGHOST}, {@code PGPORT}, ...).
 */
public final class SourceAppConfig {

  private final String pgHost;
  private final int pgPort;
  private final String pgDatabase;
  private final String pgUser;
  private final String pgPasswordEnv;
  private final boolean ssl;
  private final String slotName;
  private final String publicationName;
  private final String stateFile;

  private SourceAppConfig(String pgHost,
                          int pgPort,
                          String pgDatabase,
                          String pgUser,
                          String pgPasswordEnv,
                          boolean ssl,
                          String slotName,
                          String publicationName,
                          String stateFile) {
    this.pgHost = pgHost;
    this.pgPort = pgPort;
    this.pgDatabase = pgDatabase;
    this.pgUser = pgUser;
    this.pgPasswordEnv = pgPasswordEnv;
    this.ssl = ssl;
    this.slotName = slotName;
    this.publicationName = publicationName;
    this.stateFile = stateFile;
  }

  public static SourceAppConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static SourceAppConfig fromMap(Map<String, String> env) {
    Objects.requireNonNull(env, "env");

    String host = envOrDefault(env, "PGHOST", PostgresSourceOptions.DEFAULT_HOST);
    int port = intEnvOrDefault(env, "PGPORT", PostgresSourceOptions.DEFAULT_PORT);
    String database = envOrDefault(env, "PGDATABASE", "postgres");
    String user = envOrDefault(env, "PGUSER", "postgres");
    String passwordEnv = envOrDefault(env, "PG_PASSWORD_ENV", "PGPASSWORD");
    boolean ssl = boolEnvOrDefault(env, "PGSSL", false);
    String slotName = envOrDefault(env, "SOURCE_SLOT", null);
    String publicationName = envOrDefault(env, "SOURCE_PUBLICATION", null);
    String stateFile = envOrDefault(env, "SOURCE_STATE_FILE", null);

    return new SourceAppConfig(host, port, database, user, passwordEnv, ssl, slotName, publicationName, stateFile);
  }

  public String pgHost() {
    return pgHost;
  }

  public int pgPort() {
    return pgPort;
  }

  public String pgDatabase() {
    return pgDatabase;
  }

  public String pgUser() {
    return pgUser;
  }

  public String pgPasswordEnv() {
    return pgPasswordEnv;
  }

  public boolean ssl() {
    return ssl;
  }

  public String slotName() {
    return slotName;
  }

  public String publicationName() {
    return publicationName;
  }

  public String stateFile() {
    return stateFile;
  }

  public PostgresSourceOptions toSourceOptions() {
    PostgresSourceOptions options = new PostgresSourceOptions()
      .setHost(pgHost)
      .setPort(pgPort)
      .setDatabase(pgDatabase)
      .setUser(pgUser)
      .setPasswordEnv(pgPasswordEnv)
      .setSsl(ssl)
      .setSlotName(slotName)
      .setPublicationName(publicationName);
    if (stateFile != null) {
      options.setStateStore(new FileStateStore(Path.of(stateFile)));
    }
    return options;
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static int intEnvOrDefault(Map<String, String> env, String key, int defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static boolean boolEnvOrDefault(Map<String, String> env, String key, boolean defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
  }
}
