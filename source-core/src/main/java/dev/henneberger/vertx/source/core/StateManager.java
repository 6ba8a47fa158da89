package dev.henneberger.vertx.source.core;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the {@link SyncState} of a sync.
 *
 * <p>Positions only move forward: a checkpoint lower than the stored position is rejected and
 * logged as a regression. {@link #flush()} is the only point at which state is claimed durable;
 * nothing may be acknowledged upstream before it returns.
 */
public final class StateManager {

  private static final Logger LOG = LoggerFactory.getLogger(StateManager.class);

  private final StateStore store;
  private final String storeKey;
  private SyncState state = SyncState.empty();
  private long regressions;

  public StateManager(StateStore store, String storeKey) {
    this.store = Objects.requireNonNull(store, "store");
    OptionValidation.require("storeKey", storeKey);
    this.storeKey = storeKey;
  }

  public StateManager() {
    this(new NoopStateStore(), "default");
  }

  /**
   * Loads a serialized state. {@code null} or blank input is a first sync.
   *
   * @throws StateCorruptException if the blob is not a JSON object of the expected shape
   */
  public synchronized SyncState load(String persisted) {
    if (persisted == null || persisted.isBlank()) {
      state = SyncState.empty();
      return state;
    }
    JsonObject json;
    try {
      json = new JsonObject(persisted);
    } catch (DecodeException | ClassCastException e) {
      throw new StateCorruptException("Persisted state is not a JSON object", e);
    }
    return load(json);
  }

  public synchronized SyncState load(JsonObject persisted) {
    if (persisted == null || persisted.isEmpty()) {
      state = SyncState.empty();
      return state;
    }

    JsonObject streamsJson;
    try {
      streamsJson = persisted.getJsonObject("streams", new JsonObject());
    } catch (ClassCastException e) {
      throw new StateCorruptException("Persisted state has no readable 'streams' object", e);
    }

    Map<StreamDescriptor, CursorState> streams = new LinkedHashMap<>();
    for (String name : streamsJson.fieldNames()) {
      try {
        streams.put(StreamDescriptor.parse(name), CursorState.fromJson(streamsJson.getJsonObject(name)));
      } catch (RuntimeException e) {
        LOG.warn("Ignoring unreadable state of stream {}; it will sync as if for the first time", name, e);
      }
    }

    LogPosition confirmed = null;
    try {
      JsonObject log = persisted.getJsonObject("log");
      String position = log == null ? null : log.getString("confirmedPosition");
      confirmed = position == null ? null : LogPosition.parse(position);
    } catch (RuntimeException e) {
      LOG.warn("Ignoring unreadable confirmed log position in persisted state", e);
    }

    state = new SyncState(streams, confirmed);
    LOG.info("Loaded state for {} stream(s), confirmed log position {}",
      streams.size(), confirmed == null ? "none" : confirmed);
    return state;
  }

  /**
   * Loads whatever the configured store holds under this manager's key.
   */
  public synchronized SyncState loadFromStore() throws Exception {
    Optional<String> persisted = store.load(storeKey);
    return load(persisted.orElse(null));
  }

  public synchronized SyncState current() {
    return state;
  }

  public synchronized CursorState get(StreamDescriptor stream) {
    return state.stream(stream);
  }

  /**
   * Records a new position for {@code stream}.
   *
   * @return {@code false} if the position is lower than the stored one and was rejected
   */
  public synchronized boolean checkpoint(StreamDescriptor stream, CursorState next) {
    Objects.requireNonNull(stream, "stream");
    Objects.requireNonNull(next, "next");
    CursorState current = state.stream(stream);
    if (next.comparePosition(current) < 0) {
      regressions++;
      LOG.warn("Rejected position regression for stream {}: stored {} but checkpoint asked for {}",
        stream, current, next);
      return false;
    }
    state = state.with(stream, next);
    return true;
  }

  /**
   * Records the slot position that is about to be confirmed to the server.
   */
  public synchronized boolean checkpointLog(LogPosition position) {
    Objects.requireNonNull(position, "position");
    Optional<LogPosition> current = state.confirmedLogPosition();
    if (current.isPresent() && position.compareTo(current.get()) < 0) {
      regressions++;
      LOG.warn("Rejected log position regression: stored {} but checkpoint asked for {}", current.get(), position);
      return false;
    }
    state = state.withConfirmedLogPosition(position);
    return true;
  }

  /**
   * Clears the position of a stream so it is read from the beginning.
   */
  public synchronized void reset(StreamDescriptor stream) {
    if (!state.stream(stream).isEmpty()) {
      LOG.info("Resetting state of stream {}", stream);
    }
    state = state.with(stream, CursorState.empty());
  }

  /**
   * Persists the current state through the configured store and returns what was written.
   */
  public synchronized SyncState flush() {
    SyncState snapshot = state;
    try {
      store.save(storeKey, snapshot.toJson().encode());
    } catch (Exception e) {
      throw new SourceException("Failed to persist sync state", "Check the state store is writable.", e);
    }
    LOG.debug("Flushed state {}", snapshot);
    return snapshot;
  }

  public synchronized long regressions() {
    return regressions;
  }
}
