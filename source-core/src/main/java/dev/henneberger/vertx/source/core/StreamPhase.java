package dev.henneberger.vertx.source.core;

/**
 * Progress of one stream within a sync. {@link #CHECKPOINTED} follows a flush while streaming and
 * returns to {@link #STREAMING} with the next record.
 */
public enum StreamPhase {
  NOT_STARTED,
  SNAPSHOTTING,
  STREAMING,
  CHECKPOINTED,
  DONE
}
