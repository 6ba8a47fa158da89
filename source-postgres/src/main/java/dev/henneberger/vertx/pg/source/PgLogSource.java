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

import dev.henneberger.vertx.source.core.ConfiguredStream;
import dev.henneberger.vertx.source.core.LogPosition;
import dev.henneberger.vertx.source.core.LogReader;
import dev.henneberger.vertx.source.core.LogReaderStateChange;
import dev.henneberger.vertx.source.core.LogSession;
import dev.henneberger.vertx.source.core.LogSource;
import dev.henneberger.vertx.source.core.SlotHandle;
import dev.henneberger.vertx.source.core.StreamDescriptor;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LogSource} over one replication slot and publication. Acquiring validates the slot,
 * the publication and the replica identity of every CDC table before claiming the slot.
 */
final class PgLogSource implements LogSource {

  private static final Logger LOG = LoggerFactory.getLogger(PgLogSource.class);

  private final PostgresSourceOptions options;
  private final PgSlotManager slotManager;
  private final ReplicationConnection.Factory connectionFactory;
  private final Vertx vertx;
  private final List<Handler<LogReaderStateChange>> stateHandlers = new CopyOnWriteArrayList<>();

  PgLogSource(PostgresSourceOptions options,
              PgSlotManager slotManager,
              ReplicationConnection.Factory connectionFactory,
              Vertx vertx) {
    this.options = options;
    this.slotManager = slotManager;
    this.connectionFactory = connectionFactory;
    this.vertx = vertx;
  }

  void addStateHandler(Handler<LogReaderStateChange> handler) {
    stateHandlers.add(handler);
  }

  @Override
  public LogSession acquire(List<ConfiguredStream> streams) throws Exception {
    String slotName = options.getSlotName();
    slotManager.verifyOrCreate(slotName, options.getPlugin());

    List<StreamDescriptor> tables = new ArrayList<>();
    for (ConfiguredStream stream : streams) {
      tables.add(stream.descriptor());
    }
    slotManager.ensurePublicationCovers(options.getPublicationName(), tables);
    for (StreamDescriptor table : tables) {
      slotManager.ensureReplicaIdentity(table);
    }

    SlotHandle handle = slotManager.acquire(slotName);
    LOG.info("Acquired replication slot {} (confirmed flush {}) for {} table(s)",
      slotName, handle.slot().confirmedFlushPosition(), tables.size());
    return new Session(handle);
  }

  private final class Session implements LogSession {
    private final SlotHandle handle;
    private PgLogReader reader;

    private Session(SlotHandle handle) {
      this.handle = handle;
    }

    @Override
    public LogPosition currentPosition() throws Exception {
      return slotManager.currentPosition();
    }

    @Override
    public synchronized LogReader openReader(LogPosition start) {
      if (reader != null) {
        throw new IllegalStateException("A log reader is already open on slot " + handle.slotName());
      }
      PgLogReader created = new PgLogReader(connectionFactory, handle, options.getPublicationName(), start,
        options.getSyncOptions(), Clock.systemUTC(), vertx);
      for (Handler<LogReaderStateChange> handler : stateHandlers) {
        created.onStateChange(handler);
      }
      reader = created.start();
      return reader;
    }

    @Override
    public synchronized void close() {
      if (reader != null) {
        reader.close();
      }
      handle.close();
    }
  }
}
