package dev.henneberger.vertx.source.core;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one stream page by page. Each {@link #step} emits one page, records the page's resume
 * point with the {@link StateManager} and, when a checkpoint is due or the scan is complete,
 * flushes and emits a STATE message.
 */
final class ScanTask {

  private static final Logger LOG = LoggerFactory.getLogger(ScanTask.class);

  private final ConfiguredStream stream;
  private final StateManager stateManager;
  private final PageSource pageSource;
  private final int pageSize;
  private final CheckpointTrigger trigger;
  private final Object checkpointLock;
  private final Clock clock;
  private final Map<StreamDescriptor, StreamPhase> phases;
  private final LogPosition snapshotPosition;

  private SnapshotReader reader;
  private long records;
  private boolean done;

  ScanTask(ConfiguredStream stream,
           StateManager stateManager,
           PageSource pageSource,
           int pageSize,
           CheckpointTrigger trigger,
           Object checkpointLock,
           Clock clock,
           Map<StreamDescriptor, StreamPhase> phases,
           LogPosition snapshotPosition) {
    this.stream = stream;
    this.stateManager = stateManager;
    this.pageSource = pageSource;
    this.pageSize = pageSize;
    this.trigger = trigger;
    this.checkpointLock = checkpointLock;
    this.clock = clock;
    this.phases = phases;
    this.snapshotPosition = snapshotPosition;
    if (stream.syncMode() == SyncMode.CDC && snapshotPosition == null) {
      throw new IllegalArgumentException("CDC scan of " + stream.descriptor() + " needs a snapshot position");
    }
  }

  ConfiguredStream stream() {
    return stream;
  }

  boolean isDone() {
    return done;
  }

  long records() {
    return records;
  }

  /**
   * Emits the next page.
   *
   * @return {@code true} once the scan is complete
   */
  boolean step(Consumer<SourceMessage> out) throws Exception {
    if (done) {
      return true;
    }
    StreamDescriptor descriptor = stream.descriptor();
    if (reader == null) {
      reader = new SnapshotReader(pageSource, stream, prepareState(), pageSize);
      phases.put(descriptor, StreamPhase.SNAPSHOTTING);
      LOG.info("Syncing stream {} in {} mode", descriptor, stream.syncMode().jsonName());
    }

    Optional<SnapshotPage> next = reader.nextPage();
    if (next.isEmpty()) {
      return finish(out);
    }
    SnapshotPage page = next.get();
    for (ScannedRow row : page.rows()) {
      out.accept(SourceMessage.record(descriptor, row.data(), orderingKey(row), clock.millis()));
    }
    records += page.rows().size();
    trigger.recorded(page.rows().size());

    recordProgress(page);
    if (page.isLast()) {
      return finish(out);
    }
    synchronized (checkpointLock) {
      if (trigger.due()) {
        emitState(out);
      }
    }
    return false;
  }

  private CursorState prepareState() {
    StreamDescriptor descriptor = stream.descriptor();
    CursorState prior = stateManager.get(descriptor);
    switch (stream.syncMode()) {
      case FULL_REFRESH:
        if (!prior.snapshotInProgress()) {
          stateManager.reset(descriptor);
        }
        break;
      case INCREMENTAL:
        if (prior.cursorField() != null && !prior.cursorField().equals(stream.cursorField())) {
          LOG.warn("Cursor of stream {} changed from {} to {}; reading it from the start",
            descriptor, prior.cursorField(), stream.cursorField());
          stateManager.reset(descriptor);
        }
        break;
      case CDC:
        if (!prior.snapshotInProgress()) {
          stateManager.checkpoint(descriptor, prior.withSnapshotProgress(snapshotPosition, null));
        }
        break;
      default:
        throw new IllegalStateException("unknown sync mode " + stream.syncMode());
    }
    return stateManager.get(descriptor);
  }

  private void recordProgress(SnapshotPage page) {
    StreamDescriptor descriptor = stream.descriptor();
    CursorState current = stateManager.get(descriptor);
    switch (stream.syncMode()) {
      case INCREMENTAL:
        if (page.highWaterMark() != null) {
          stateManager.checkpoint(descriptor, current.withCursorValue(stream.cursorField(), page.highWaterMark()));
        }
        break;
      case FULL_REFRESH:
        if (page.isLast()) {
          stateManager.reset(descriptor);
        } else if (page.lastKey() != null) {
          stateManager.checkpoint(descriptor, current.withSnapshotProgress(null, page.lastKey()));
        }
        break;
      case CDC: {
        CursorState progressed = page.lastKey() == null
          ? current
          : current.withSnapshotProgress(snapshotPosition, page.lastKey());
        stateManager.checkpoint(descriptor, page.isLast() ? progressed.withSnapshotCompleted() : progressed);
        break;
      }
      default:
        throw new IllegalStateException("unknown sync mode " + stream.syncMode());
    }
  }

  private boolean finish(Consumer<SourceMessage> out) {
    done = true;
    StreamDescriptor descriptor = stream.descriptor();
    LOG.info("Read {} records from {} stream", records, descriptor);
    out.accept(SourceMessage.log(SourceMessage.Level.INFO,
      "Read " + records + " records from " + descriptor.qualifiedName() + " stream"));
    phases.put(descriptor, stream.syncMode() == SyncMode.CDC ? StreamPhase.STREAMING : StreamPhase.DONE);
    synchronized (checkpointLock) {
      emitState(out);
    }
    return true;
  }

  private void emitState(Consumer<SourceMessage> out) {
    SyncState flushed = stateManager.flush();
    trigger.reset();
    out.accept(SourceMessage.state(flushed));
  }

  private Object orderingKey(ScannedRow row) {
    switch (stream.syncMode()) {
      case INCREMENTAL:
        return row.value(stream.cursorField());
      case CDC:
        return snapshotPosition.asString();
      default:
        return row.key();
    }
  }
}
