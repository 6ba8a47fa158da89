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

import dev.henneberger.vertx.source.core.BackoffPolicy;
import dev.henneberger.vertx.source.core.CommittedTransaction;
import dev.henneberger.vertx.source.core.ConfigException;
import dev.henneberger.vertx.source.core.LogPosition;
import dev.henneberger.vertx.source.core.LogReader;
import dev.henneberger.vertx.source.core.LogReaderState;
import dev.henneberger.vertx.source.core.LogReaderStateChange;
import dev.henneberger.vertx.source.core.PermissionDeniedException;
import dev.henneberger.vertx.source.core.Registration;
import dev.henneberger.vertx.source.core.SlotBusyException;
import dev.henneberger.vertx.source.core.SlotHandle;
import dev.henneberger.vertx.source.core.SourceException;
import dev.henneberger.vertx.source.core.SyncOptions;
import dev.henneberger.vertx.source.core.TransientNetworkException;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import java.nio.ByteBuffer;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LogReader} for a PostgreSQL replication slot.
 *
 * <p>Frames are only read inside {@link #poll(Duration)}. Transient connection failures are
 * retried with the configured {@link BackoffPolicy}; a reconnect discards the partially received
 * transaction and resumes from the last acknowledged position, so transactions returned but not
 * yet acknowledged may be returned again.
 */
public class PgLogReader implements LogReader {

  private static final Logger LOG = LoggerFactory.getLogger(PgLogReader.class);
  private static final long IDLE_SLEEP_MILLIS = 10L;

  private final ReplicationConnection.Factory connectionFactory;
  private final SlotHandle slot;
  private final String publicationName;
  private final LogPosition startPosition;
  private final BackoffPolicy backoffPolicy;
  private final Duration heartbeatInterval;
  private final Duration heartbeatTimeout;
  private final Clock clock;
  private final Vertx vertx;
  private final List<Handler<LogReaderStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final PgOutputDecoder decoder = new PgOutputDecoder();

  private volatile LogReaderState state = LogReaderState.DISCONNECTED;
  private volatile LogPosition acknowledged;
  private ReplicationConnection connection;
  private LogPosition caughtUp;
  private LogPosition lastSeenPosition;
  private long lastActivityMillis;
  private long lastStatusMillis;
  private long attempt;

  PgLogReader(ReplicationConnection.Factory connectionFactory,
              SlotHandle slot,
              String publicationName,
              LogPosition startPosition,
              SyncOptions options,
              Clock clock,
              Vertx vertx) {
    this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    this.slot = Objects.requireNonNull(slot, "slot");
    this.publicationName = Objects.requireNonNull(publicationName, "publicationName");
    this.startPosition = Objects.requireNonNull(startPosition, "startPosition");
    this.backoffPolicy = options.getBackoffPolicy();
    this.heartbeatInterval = options.getHeartbeatInterval();
    this.heartbeatTimeout = options.getHeartbeatTimeout();
    this.clock = clock == null ? Clock.systemUTC() : clock;
    this.vertx = vertx;
  }

  /**
   * Claims the slot and opens the first connection, retrying transient failures.
   *
   * @throws SlotBusyException if the slot is claimed or attached elsewhere
   */
  public synchronized PgLogReader start() {
    slot.claim(this);
    LogPosition confirmed = slot.slot().confirmedFlushPosition();
    if (confirmed != null && startPosition.compareTo(confirmed) < 0) {
      LOG.warn("Requested start {} of slot {} is behind its confirmed flush position {}; "
        + "the server resumes from {}", startPosition, slot.slotName(), confirmed, confirmed);
    }
    connectWithRetry(null);
    return this;
  }

  @Override
  public LogReaderState state() {
    return state;
  }

  @Override
  public synchronized Optional<CommittedTransaction> poll(Duration timeout) throws Exception {
    if (state == LogReaderState.CLOSED) {
      throw new IllegalStateException("Log reader for slot " + slot.slotName() + " is closed");
    }
    long deadline = clock.millis() + Math.max(0L, timeout.toMillis());
    while (true) {
      if (connection == null) {
        connectWithRetry(null);
      }
      try {
        Optional<CommittedTransaction> txn = readOnce();
        if (txn.isPresent()) {
          return txn;
        }
      } catch (SQLException | TransientNetworkException e) {
        connectWithRetry(e);
        continue;
      }

      long remaining = deadline - clock.millis();
      if (remaining <= 0) {
        return Optional.empty();
      }
      sleep(Math.min(IDLE_SLEEP_MILLIS, remaining));
    }
  }

  @Override
  public synchronized Optional<LogPosition> caughtUpPosition() {
    return Optional.ofNullable(caughtUp);
  }

  @Override
  public synchronized void acknowledge(LogPosition position) {
    Objects.requireNonNull(position, "position");
    if (acknowledged != null && !position.isAfter(acknowledged)) {
      return;
    }
    acknowledged = position;
    if (connection == null) {
      return;
    }
    try {
      connection.sendStatus(position);
      lastStatusMillis = clock.millis();
      LOG.debug("Acknowledged {} on slot {}", position, slot.slotName());
    } catch (SQLException e) {
      // The position is resent after the reconnect.
      LOG.warn("Could not acknowledge {} on slot {}; reconnecting", position, slot.slotName(), e);
      dropConnection();
    }
  }

  @Override
  public LogPosition acknowledgedPosition() {
    return acknowledged;
  }

  @Override
  public Registration onStateChange(Handler<LogReaderStateChange> handler) {
    Objects.requireNonNull(handler, "handler");
    stateHandlers.add(handler);
    return () -> stateHandlers.remove(handler);
  }

  @Override
  public synchronized void close() {
    if (state == LogReaderState.CLOSED) {
      return;
    }
    dropConnection();
    transition(LogReaderState.CLOSED, acknowledged, null);
  }

  private Optional<CommittedTransaction> readOnce() throws SQLException {
    long now = clock.millis();
    ByteBuffer buffer = connection.readPending();
    if (buffer != null) {
      lastActivityMillis = now;
      Optional<CommittedTransaction> txn = decoder.decode(buffer);
      if (txn.isPresent()) {
        attempt = 0;
        caughtUp = LogPosition.max(caughtUp, txn.get().commitPosition());
      }
      return txn;
    }

    LogPosition received = connection.lastReceivedPosition();
    if (lastSeenPosition == null || received.isAfter(lastSeenPosition)) {
      lastSeenPosition = received;
      lastActivityMillis = now;
      if (!decoder.inTransaction() && received.isAfter(LogPosition.ZERO)) {
        caughtUp = LogPosition.max(caughtUp, received);
      }
    }

    if (now - lastStatusMillis >= heartbeatInterval.toMillis()) {
      // The update asks the server for a keepalive reply and fails once the stream is gone.
      connection.sendStatus(acknowledged);
      lastStatusMillis = now;
      lastActivityMillis = now;
    }
    if (now - lastActivityMillis >= heartbeatTimeout.toMillis()) {
      throw new TransientNetworkException("No data received on slot " + slot.slotName() + " for "
        + heartbeatTimeout.toMillis() + "ms", null);
    }
    return Optional.empty();
  }

  private void connectWithRetry(Exception failure) {
    Exception error = failure;
    while (true) {
      if (error != null) {
        SourceException classified = classify(error);
        dropConnection();
        attempt++;
        if (!backoffPolicy.shouldRetry(classified, attempt)) {
          LOG.error("Log reader for slot {} failed after {} attempt(s)", slot.slotName(), attempt, classified);
          transition(LogReaderState.DISCONNECTED, resumePosition(), classified);
          throw classified;
        }
        transition(LogReaderState.RECONNECTING, resumePosition(), classified);
        long delay = backoffPolicy.computeDelayMillis(attempt);
        LOG.warn("Log reader for slot {} lost its connection; retrying in {}ms (attempt {})",
          slot.slotName(), delay, attempt, classified);
        sleep(delay);
      }

      if (!slot.isOwnedBy(this)) {
        throw new IllegalStateException("Slot " + slot.slotName() + " is not claimed by this reader");
      }
      LogPosition from = resumePosition();
      transition(LogReaderState.CONNECTING, from, null);
      try {
        connection = connectionFactory.open(slot.slotName(), publicationName, from);
      } catch (Exception e) {
        error = e;
        continue;
      }
      long now = clock.millis();
      lastActivityMillis = now;
      lastStatusMillis = now;
      lastSeenPosition = null;
      LOG.info("Streaming slot {} from {}", slot.slotName(), from);
      transition(LogReaderState.STREAMING, from, null);
      attempt = 0;
      return;
    }
  }

  private LogPosition resumePosition() {
    return LogPosition.max(acknowledged, startPosition);
  }

  private void dropConnection() {
    decoder.discardTransaction();
    ReplicationConnection current = connection;
    connection = null;
    if (current != null) {
      current.close();
    }
  }

  private SourceException classify(Exception error) {
    if (error instanceof SourceException) {
      return (SourceException) error;
    }
    if (error instanceof SQLException) {
      String sqlState = ((SQLException) error).getSQLState();
      if ("55006".equals(sqlState)) {
        return new SlotBusyException(slot.slotName(), "another walsender");
      }
      if (sqlState != null && sqlState.startsWith("28")) {
        return new ConfigException("Authentication failed for replication connection: " + error.getMessage(),
          "Check user, password and pg_hba.conf replication entries.");
      }
      if ("42501".equals(sqlState)) {
        return new PermissionDeniedException("Role may not use replication: " + error.getMessage(),
          "Grant the REPLICATION attribute to the role.", error);
      }
      if ("42704".equals(sqlState)) {
        return new ConfigException("Replication slot " + slot.slotName() + " does not exist",
          "Create the slot or enable autoCreateSlot.");
      }
    }
    return new TransientNetworkException("Replication connection for slot " + slot.slotName()
      + " failed: " + error.getMessage(), error);
  }

  private void transition(LogReaderState next, LogPosition position, Throwable cause) {
    LogReaderState previous = this.state;
    if (previous == next && cause == null) {
      return;
    }
    this.state = next;
    LogReaderStateChange change = new LogReaderStateChange(previous, next, position, cause, attempt);
    for (Handler<LogReaderStateChange> handler : stateHandlers) {
      if (vertx != null) {
        vertx.runOnContext(v -> handler.handle(change));
      } else {
        handler.handle(change);
      }
    }
  }

  private static void sleep(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientNetworkException("Interrupted while waiting for the log", e);
    }
  }
}
