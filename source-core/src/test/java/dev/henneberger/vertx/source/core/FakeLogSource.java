package dev.henneberger.vertx.source.core;

import io.vertx.core.Handler;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted replication log. {@link LogSession#currentPosition()} walks through the configured
 * positions and then keeps returning the last one.
 */
final class FakeLogSource implements LogSource {

  private final List<CommittedTransaction> log = new ArrayList<>();
  private final Deque<LogPosition> positions = new ArrayDeque<>();
  final List<LogPosition> acknowledged = new CopyOnWriteArrayList<>();
  final List<LogPosition> readerStarts = new ArrayList<>();
  RuntimeException acquireFailure;
  boolean sessionClosed;

  FakeLogSource positions(String... values) {
    for (String value : values) {
      positions.add(LogPosition.parse(value));
    }
    return this;
  }

  FakeLogSource commit(String position, ChangeRecord.Operation operation, StreamDescriptor stream,
                       Map<String, Object> row) {
    LogPosition commit = LogPosition.parse(position);
    Map<String, Object> before = operation == ChangeRecord.Operation.INSERT ? null : row;
    Map<String, Object> after = operation == ChangeRecord.Operation.DELETE ? null : row;
    ChangeRecord change = new ChangeRecord(stream, operation, before, after, commit, Instant.EPOCH);
    log.add(new CommittedTransaction(log.size() + 1, commit, Instant.EPOCH, List.of(change)));
    return this;
  }

  @Override
  public LogSession acquire(List<ConfiguredStream> streams) {
    if (acquireFailure != null) {
      throw acquireFailure;
    }
    return new Session();
  }

  private LogPosition head() {
    return positions.size() > 1 ? positions.poll() : positions.peek();
  }

  private final class Session implements LogSession {

    @Override
    public LogPosition currentPosition() {
      return head();
    }

    @Override
    public LogReader openReader(LogPosition start) {
      readerStarts.add(start);
      return new Reader(start);
    }

    @Override
    public void close() {
      sessionClosed = true;
    }
  }

  private final class Reader implements LogReader {
    private final Deque<CommittedTransaction> pending = new ArrayDeque<>();
    private LogPosition caughtUp;
    private LogPosition ack;
    private LogReaderState state = LogReaderState.STREAMING;

    private Reader(LogPosition start) {
      for (CommittedTransaction txn : log) {
        if (txn.commitPosition().isAfter(start)) {
          pending.add(txn);
        }
      }
    }

    @Override
    public LogReaderState state() {
      return state;
    }

    @Override
    public Optional<CommittedTransaction> poll(Duration timeout) {
      CommittedTransaction txn = pending.poll();
      if (txn == null) {
        caughtUp = LogPosition.max(caughtUp, positions.peek());
        return Optional.empty();
      }
      caughtUp = LogPosition.max(caughtUp, txn.commitPosition());
      return Optional.of(txn);
    }

    @Override
    public Optional<LogPosition> caughtUpPosition() {
      return Optional.ofNullable(caughtUp);
    }

    @Override
    public void acknowledge(LogPosition position) {
      ack = position;
      acknowledged.add(position);
    }

    @Override
    public LogPosition acknowledgedPosition() {
      return ack;
    }

    @Override
    public Registration onStateChange(Handler<LogReaderStateChange> handler) {
      return () -> {
      };
    }

    @Override
    public void close() {
      state = LogReaderState.CLOSED;
    }
  }
}
