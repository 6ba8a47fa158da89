package dev.henneberger.vertx.source.core;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one sync of a configured catalog.
 *
 * <p>Full-refresh and incremental streams are scanned first, in parallel when
 * {@link SyncOptions#getMaxConcurrentStreams()} allows. CDC streams without a log position are
 * then snapshotted one after the other, each recording the log position visible when its scan
 * started. Finally all CDC streams are served by one log reader until it has caught up with the
 * log position observed when streaming began, has been idle for the configured time, or has
 * streamed for the maximum duration.
 *
 * <p>A log position is confirmed to the server only after the STATE message carrying it has been
 * flushed and the consumer has moved past it.
 */
public final class SyncOrchestrator {

  private static final Logger LOG = LoggerFactory.getLogger(SyncOrchestrator.class);

  private final ConfiguredCatalog catalog;
  private final StateManager stateManager;
  private final PageSource pageSource;
  private final LogSource logSource;
  private final SyncOptions options;
  private final Clock clock;
  private final Map<StreamDescriptor, StreamPhase> phases = new ConcurrentHashMap<>();

  public SyncOrchestrator(ConfiguredCatalog catalog,
                          StateManager stateManager,
                          PageSource pageSource,
                          LogSource logSource,
                          SyncOptions options) {
    this(catalog, stateManager, pageSource, logSource, options, Clock.systemUTC());
  }

  public SyncOrchestrator(ConfiguredCatalog catalog,
                          StateManager stateManager,
                          PageSource pageSource,
                          LogSource logSource,
                          SyncOptions options,
                          Clock clock) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.stateManager = Objects.requireNonNull(stateManager, "stateManager");
    this.pageSource = Objects.requireNonNull(pageSource, "pageSource");
    this.logSource = logSource;
    this.options = new SyncOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.clock = Objects.requireNonNull(clock, "clock");
    for (ConfiguredStream stream : catalog.streams()) {
      phases.put(stream.descriptor(), StreamPhase.NOT_STARTED);
    }
  }

  /**
   * Starts a sync from the state held by the state manager's store.
   */
  public SourceMessageIterator read() {
    List<SourceMessage> preamble = new ArrayList<>();
    loadState(() -> stateManager.loadFromStore(), preamble);
    return start(preamble);
  }

  /**
   * Starts a sync from a serialized state; {@code null} or blank is a first sync.
   */
  public SourceMessageIterator read(String persistedState) {
    List<SourceMessage> preamble = new ArrayList<>();
    loadState(() -> stateManager.load(persistedState), preamble);
    return start(preamble);
  }

  public StreamPhase phase(StreamDescriptor stream) {
    return phases.getOrDefault(stream, StreamPhase.NOT_STARTED);
  }

  public Map<StreamDescriptor, StreamPhase> phases() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(phases));
  }

  private void loadState(StateLoader loader, List<SourceMessage> preamble) {
    try {
      loader.load();
    } catch (StateCorruptException e) {
      if (options.isFailOnCorruptState()) {
        throw e;
      }
      LOG.warn("Persisted state is unreadable, starting from empty state", e);
      stateManager.load((String) null);
      preamble.add(SourceMessage.log(SourceMessage.Level.WARN,
        "Persisted state is unreadable; all streams start as a first sync"));
    } catch (SourceException e) {
      throw e;
    } catch (Exception e) {
      throw new SourceException("Failed to load sync state: " + e.getMessage(),
        "Check the state store is readable.", e);
    }
  }

  private SourceMessageIterator start(List<SourceMessage> preamble) {
    List<ConfiguredStream> logStreams = catalog.streams(SyncMode.CDC);
    LogSession session = null;
    if (!logStreams.isEmpty()) {
      if (logSource == null) {
        throw new ConfigException("CDC streams are selected but no log source is configured",
          "Configure replication settings or select another sync mode.");
      }
      try {
        session = logSource.acquire(logStreams);
      } catch (SourceException e) {
        throw e;
      } catch (Exception e) {
        throw new SourceException("Failed to prepare log replication: " + e.getMessage(),
          "Check the replication slot and publication configuration.", e);
      }
    }
    return new SourceMessageIterator(new SyncRun(preamble, logStreams, session));
  }

  @FunctionalInterface
  private interface StateLoader {
    void load() throws Exception;
  }

  private enum Stage {
    START,
    SCANS,
    LOG_SNAPSHOTS,
    STREAMING_START,
    STREAMING,
    FINISH,
    DONE
  }

  private final class SyncRun implements MessageProducer {

    private final List<SourceMessage> preamble;
    private final List<ConfiguredStream> logStreams;
    private final Map<StreamDescriptor, ConfiguredStream> logStreamsByName = new LinkedHashMap<>();
    private final LogSession session;
    private final CheckpointTrigger trigger;
    private final Object checkpointLock = new Object();
    private final List<ScanTask> scans = new ArrayList<>();
    private final List<ConfiguredStream> pendingSnapshots = new ArrayList<>();
    private final Map<StreamDescriptor, LogPosition> streamingFrom = new LinkedHashMap<>();
    private final Map<StreamDescriptor, Long> logRecords = new LinkedHashMap<>();

    private Stage stage = Stage.START;
    private int scanIndex;
    private ParallelScan parallel;
    private ScanTask logSnapshot;
    private LogReader reader;
    private LogPosition target;
    private LogPosition lastCommit;
    private LogPosition finalPosition;
    private long streamingStartedAt;
    private long lastActivityAt;
    private long skippedStale;
    private long skippedUnselected;
    private long totalRecords;

    private SyncRun(List<SourceMessage> preamble, List<ConfiguredStream> logStreams, LogSession session) {
      this.preamble = preamble;
      this.logStreams = logStreams;
      this.session = session;
      this.trigger = new CheckpointTrigger(options, clock);
      for (ConfiguredStream stream : logStreams) {
        logStreamsByName.put(stream.descriptor(), stream);
      }
    }

    @Override
    public boolean produce(Consumer<SourceMessage> out) throws Exception {
      switch (stage) {
        case START:
          begin(out);
          return true;
        case SCANS:
          scanStep(out);
          return true;
        case LOG_SNAPSHOTS:
          logSnapshotStep(out);
          return true;
        case STREAMING_START:
          startStreaming(out);
          return true;
        case STREAMING:
          streamStep(out);
          return true;
        case FINISH:
          finish(out);
          return true;
        case DONE:
        default:
          return false;
      }
    }

    private void begin(Consumer<SourceMessage> out) {
      preamble.forEach(out);
      out.accept(SourceMessage.log(SourceMessage.Level.INFO,
        "Starting sync of " + catalog.streams().size() + " stream(s)"));
      for (ConfiguredStream stream : catalog.streams()) {
        if (stream.syncMode().usesLog()) {
          CursorState state = stateManager.get(stream.descriptor());
          if (state.logPosition() == null || state.snapshotInProgress()) {
            pendingSnapshots.add(stream);
          } else {
            phases.put(stream.descriptor(), StreamPhase.STREAMING);
          }
        } else {
          scans.add(new ScanTask(stream, stateManager, pageSource, options.getSnapshotPageSize(), trigger,
            checkpointLock, clock, phases, null));
        }
      }
      if (options.getMaxConcurrentStreams() > 1 && scans.size() > 1) {
        parallel = new ParallelScan(scans, options.getMaxConcurrentStreams(), options.getQueueCapacity());
        parallel.start();
      }
      stage = Stage.SCANS;
    }

    private void scanStep(Consumer<SourceMessage> out) throws Exception {
      if (parallel != null) {
        SourceMessage message = parallel.take();
        if (message == null) {
          parallel.close();
          countScanned();
          stage = Stage.LOG_SNAPSHOTS;
        } else {
          out.accept(message);
        }
        return;
      }
      if (scanIndex >= scans.size()) {
        countScanned();
        stage = Stage.LOG_SNAPSHOTS;
        return;
      }
      if (scans.get(scanIndex).step(out)) {
        scanIndex++;
      }
    }

    private void countScanned() {
      for (ScanTask scan : scans) {
        totalRecords += scan.records();
      }
    }

    private void logSnapshotStep(Consumer<SourceMessage> out) throws Exception {
      if (logSnapshot == null) {
        if (pendingSnapshots.isEmpty()) {
          stage = Stage.STREAMING_START;
          return;
        }
        ConfiguredStream stream = pendingSnapshots.remove(0);
        CursorState prior = stateManager.get(stream.descriptor());
        LogPosition position = prior.snapshotInProgress() && prior.snapshotPosition() != null
          ? prior.snapshotPosition()
          : session.currentPosition();
        LOG.info("Snapshotting CDC stream {}; log streaming resumes from {}", stream.descriptor(), position);
        logSnapshot = new ScanTask(stream, stateManager, pageSource, options.getSnapshotPageSize(), trigger,
          checkpointLock, clock, phases, position);
      }
      if (logSnapshot.step(out)) {
        totalRecords += logSnapshot.records();
        logSnapshot = null;
      }
    }

    private void startStreaming(Consumer<SourceMessage> out) throws Exception {
      if (logStreams.isEmpty()) {
        stage = Stage.FINISH;
        return;
      }
      LogPosition start = null;
      for (ConfiguredStream stream : logStreams) {
        LogPosition position = stateManager.get(stream.descriptor()).logPosition();
        streamingFrom.put(stream.descriptor(), position);
        start = start == null || position.compareTo(start) < 0 ? position : start;
      }
      target = session.currentPosition();
      if (!target.isAfter(start)) {
        LOG.info("Log is already read up to {}; nothing to stream", target);
        stage = Stage.FINISH;
        return;
      }
      LOG.info("Streaming {} CDC stream(s) from {} up to {}", logStreams.size(), start, target);
      out.accept(SourceMessage.log(SourceMessage.Level.INFO,
        "Streaming changes from " + start + " up to " + target));
      reader = session.openReader(start);
      streamingStartedAt = clock.millis();
      lastActivityAt = streamingStartedAt;
      stage = Stage.STREAMING;
    }

    private void streamStep(Consumer<SourceMessage> out) throws Exception {
      long now = clock.millis();
      long maxDuration = options.getMaxStreamingDuration().toMillis();
      if (maxDuration > 0 && now - streamingStartedAt >= maxDuration) {
        LOG.info("Stopping log streaming after {} ms", maxDuration);
        endStreaming();
        return;
      }
      long idle = options.getCdcIdleTimeout().toMillis();
      if (idle > 0 && now - lastActivityAt >= idle) {
        LOG.info("No changes for {} ms; stopping log streaming", idle);
        endStreaming();
        return;
      }

      Optional<CommittedTransaction> txn = reader.poll(options.getPollInterval());
      boolean caughtUp;
      if (txn.isPresent()) {
        lastActivityAt = clock.millis();
        emitTransaction(txn.get(), out);
        lastCommit = txn.get().commitPosition();
        caughtUp = lastCommit.compareTo(target) >= 0;
      } else {
        Optional<LogPosition> position = reader.caughtUpPosition();
        caughtUp = position.isPresent() && position.get().compareTo(target) >= 0;
      }

      if (caughtUp) {
        LOG.info("Log streaming caught up with {}", target);
        endStreaming();
        return;
      }
      synchronized (checkpointLock) {
        if (lastCommit != null && trigger.due()) {
          checkpointLog(lastCommit, out);
        }
      }
    }

    private void emitTransaction(CommittedTransaction txn, Consumer<SourceMessage> out) {
      int emitted = 0;
      for (ChangeRecord change : txn.changes()) {
        StreamDescriptor descriptor = change.stream();
        if (!logStreamsByName.containsKey(descriptor)) {
          skippedUnselected++;
          continue;
        }
        LogPosition from = streamingFrom.get(descriptor);
        if (from != null && !change.commitPosition().isAfter(from)) {
          skippedStale++;
          continue;
        }
        out.accept(SourceMessage.change(change, clock.millis()));
        logRecords.merge(descriptor, 1L, Long::sum);
        phases.put(descriptor, StreamPhase.STREAMING);
        emitted++;
      }
      trigger.recorded(emitted);
    }

    private void endStreaming() {
      Optional<LogPosition> caughtUpTo = reader.caughtUpPosition();
      finalPosition = LogPosition.max(lastCommit, caughtUpTo.orElse(null));
      stage = Stage.FINISH;
    }

    /**
     * Moves every CDC stream and the slot position to {@code position}, flushes and emits STATE.
     */
    private void checkpointLog(LogPosition position, Consumer<SourceMessage> out) {
      advanceLogState(position);
      SyncState flushed = stateManager.flush();
      trigger.reset();
      for (ConfiguredStream stream : logStreams) {
        phases.computeIfPresent(stream.descriptor(),
          (d, phase) -> phase == StreamPhase.STREAMING ? StreamPhase.CHECKPOINTED : phase);
      }
      out.accept(SourceMessage.state(flushed));
    }

    private void advanceLogState(LogPosition position) {
      for (ConfiguredStream stream : logStreams) {
        CursorState current = stateManager.get(stream.descriptor());
        if (current.logPosition() == null || position.isAfter(current.logPosition())) {
          stateManager.checkpoint(stream.descriptor(), current.withLogPosition(position));
        }
      }
      Optional<LogPosition> confirmed = stateManager.current().confirmedLogPosition();
      if (confirmed.isEmpty() || position.isAfter(confirmed.get())) {
        stateManager.checkpointLog(position);
      }
    }

    private void finish(Consumer<SourceMessage> out) {
      for (ConfiguredStream stream : logStreams) {
        long count = logRecords.getOrDefault(stream.descriptor(), 0L);
        totalRecords += count;
        LOG.info("Read {} change records from {} stream", count, stream.descriptor());
        out.accept(SourceMessage.log(SourceMessage.Level.INFO,
          "Read " + count + " change records from " + stream.descriptor().qualifiedName() + " stream"));
        phases.put(stream.descriptor(), StreamPhase.DONE);
      }
      if (skippedStale > 0 || skippedUnselected > 0) {
        LOG.info("Skipped {} change(s) already covered by a snapshot and {} change(s) of unselected tables",
          skippedStale, skippedUnselected);
      }
      out.accept(SourceMessage.log(SourceMessage.Level.INFO,
        "Finished sync; emitted " + totalRecords + " record(s)"));
      synchronized (checkpointLock) {
        if (finalPosition != null) {
          advanceLogState(finalPosition);
        }
        SyncState flushed = stateManager.flush();
        trigger.reset();
        out.accept(SourceMessage.state(flushed));
      }
      stage = Stage.DONE;
    }

    @Override
    public void stateConsumed(SyncState state) throws Exception {
      Optional<LogPosition> position = state.confirmedLogPosition();
      if (reader == null || position.isEmpty()) {
        return;
      }
      LogPosition acknowledged = reader.acknowledgedPosition();
      if (acknowledged == null || position.get().isAfter(acknowledged)) {
        reader.acknowledge(position.get());
      }
    }

    @Override
    public void close() {
      if (parallel != null) {
        parallel.close();
      }
      if (reader != null) {
        reader.close();
      }
      if (session != null) {
        session.close();
      }
    }
  }
}
