package dev.henneberger.vertx.source.core;

import io.vertx.core.Handler;
import java.time.Duration;
import java.util.Optional;

/**
 * Pull-based reader of committed transactions from a replication log.
 *
 * <p>Nothing is read from the server until {@link #poll(Duration)} is called, so a slow consumer
 * holds the connection back instead of buffering. Positions are only confirmed to the server
 * through {@link #acknowledge(LogPosition)}.
 */
public interface LogReader extends AutoCloseable {

  LogReaderState state();

  /**
   * Returns the next committed transaction, or empty if none completed within {@code timeout}.
   * Reconnects transparently on transient failures.
   */
  Optional<CommittedTransaction> poll(Duration timeout) throws Exception;

  /**
   * Position through which every committed transaction has been returned by {@link #poll},
   * including positions reported by server keepalives between transactions.
   */
  Optional<LogPosition> caughtUpPosition();

  /**
   * Confirms {@code position} to the server. Callers must only pass positions whose checkpoint
   * has been flushed.
   */
  void acknowledge(LogPosition position) throws Exception;

  LogPosition acknowledgedPosition();

  Registration onStateChange(Handler<LogReaderStateChange> handler);

  @Override
  void close();
}
