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

import dev.henneberger.vertx.source.core.ConfiguredCatalog;
import dev.henneberger.vertx.source.core.LogReaderStateChange;
import dev.henneberger.vertx.source.core.MessageConsumer;
import dev.henneberger.vertx.source.core.PreflightReport;
import dev.henneberger.vertx.source.core.PreflightReports;
import dev.henneberger.vertx.source.core.Registration;
import dev.henneberger.vertx.source.core.SourceMessageIterator;
import dev.henneberger.vertx.source.core.StateManager;
import dev.henneberger.vertx.source.core.SyncOrchestrator;
import dev.henneberger.vertx.source.core.SyncRunner;
import dev.henneberger.vertx.source.core.SyncState;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PostgreSQL source: full-refresh and incremental table scans plus CDC streams read from a
 * logical replication slot.
 *
 * <p>{@link #read(ConfiguredCatalog, String)} returns a blocking iterator for callers that drive
 * the sync themselves; {@link #run(ConfiguredCatalog, String, MessageConsumer)} drives it on a
 * worker thread and hands messages to a consumer on the Vert.x context.
 */
public class PostgresSource {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresSource.class);

  private final Vertx vertx;
  private final PostgresSourceOptions options;
  private final PgConnections connections;
  private final List<Handler<LogReaderStateChange>> stateHandlers = new CopyOnWriteArrayList<>();

  public PostgresSource(Vertx vertx, PostgresSourceOptions options) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = new PostgresSourceOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.connections = new PgConnections(this.options);
  }

  /**
   * Checks connectivity and, when a slot is configured, the replication prerequisites.
   */
  public Future<PreflightReport> check() {
    return vertx.executeBlocking(this::runPreflightChecks);
  }

  /**
   * Starts a sync from the state held by the configured state store.
   */
  public SourceMessageIterator read(ConfiguredCatalog catalog) {
    preflightIfEnabled();
    return orchestrator(catalog).read();
  }

  /**
   * Starts a sync from a serialized state; {@code null} starts a first sync.
   */
  public SourceMessageIterator read(ConfiguredCatalog catalog, String state) {
    preflightIfEnabled();
    return orchestrator(catalog).read(state);
  }

  /**
   * Runs a sync to completion, waiting for each message's future before producing the next.
   *
   * @return the last STATE delivered to {@code consumer}
   */
  public Future<SyncState> run(ConfiguredCatalog catalog, String state, MessageConsumer consumer) {
    SourceMessageIterator messages;
    try {
      messages = state == null ? read(catalog) : read(catalog, state);
    } catch (RuntimeException e) {
      return Future.failedFuture(e);
    }
    return new SyncRunner(vertx, options.resolvedStateKey()).run(messages, consumer);
  }

  public Registration onLogReaderStateChange(Handler<LogReaderStateChange> handler) {
    Objects.requireNonNull(handler, "handler");
    stateHandlers.add(handler);
    return () -> stateHandlers.remove(handler);
  }

  PreflightReport runPreflightChecks() {
    return new PgPreflightChecks(connections, options).run(options.hasReplication());
  }

  private void preflightIfEnabled() {
    if (!options.isPreflightEnabled()) {
      return;
    }
    PreflightReport report = runPreflightChecks();
    if (!report.isOk()) {
      LOG.error("Preflight failed: {}", PreflightReports.describeFailure(report));
    } else if (!report.issues().isEmpty()) {
      LOG.warn("Preflight warnings: {}", PreflightReports.describeWarnings(report));
    }
    report.throwIfFailed();
  }

  /**
   * Unqualified streams live in the {@code public} schema, the name pgoutput reports for them.
   */
  static ConfiguredCatalog qualify(ConfiguredCatalog catalog) {
    return Objects.requireNonNull(catalog, "catalog").withDefaultNamespace(PgConnections.DEFAULT_SCHEMA);
  }

  private SyncOrchestrator orchestrator(ConfiguredCatalog requested) {
    ConfiguredCatalog catalog = qualify(requested);
    PgLogSource logSource = null;
    if (options.hasReplication()) {
      PgSlotManager slotManager = new PgSlotManager(connections, options);
      long statusInterval = options.getSyncOptions().getHeartbeatInterval().toMillis();
      logSource = new PgLogSource(options, slotManager,
        PgReplicationConnection.factory(connections, statusInterval), vertx);
      for (Handler<LogReaderStateChange> handler : stateHandlers) {
        logSource.addStateHandler(handler);
      }
    }
    StateManager stateManager = new StateManager(options.getStateStore(), options.resolvedStateKey());
    return new SyncOrchestrator(catalog, stateManager, new PgPageSource(connections), logSource,
      options.getSyncOptions());
  }
}
