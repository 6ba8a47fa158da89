package dev.henneberger.vertx.source.core;

import java.time.Clock;

/**
 * Decides when enough records or time have passed since the last flush.
 */
final class CheckpointTrigger {

  private final long recordInterval;
  private final long intervalMillis;
  private final Clock clock;
  private long records;
  private long lastCheckpointAt;

  CheckpointTrigger(SyncOptions options, Clock clock) {
    this.recordInterval = options.getCheckpointRecordInterval();
    this.intervalMillis = options.getCheckpointInterval().toMillis();
    this.clock = clock;
    this.lastCheckpointAt = clock.millis();
  }

  synchronized void recorded(long count) {
    records += count;
  }

  synchronized boolean due() {
    return records >= recordInterval || clock.millis() - lastCheckpointAt >= intervalMillis;
  }

  synchronized void reset() {
    records = 0;
    lastCheckpointAt = clock.millis();
  }
}
