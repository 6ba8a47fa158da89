package dev.henneberger.vertx.source.core;

import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-stream positions plus the slot's last confirmed log position: the unit of recoverability.
 *
 * <p>Instances are immutable; the {@link StateManager} swaps in new ones as checkpoints occur.
 */
public final class SyncState {

  private static final SyncState EMPTY = new SyncState(Map.of(), null);

  private final Map<StreamDescriptor, CursorState> streams;
  private final LogPosition confirmedLogPosition;

  public SyncState(Map<StreamDescriptor, CursorState> streams, LogPosition confirmedLogPosition) {
    this.streams = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(streams, "streams")));
    this.confirmedLogPosition = confirmedLogPosition;
  }

  public static SyncState empty() {
    return EMPTY;
  }

  public CursorState stream(StreamDescriptor descriptor) {
    return streams.getOrDefault(descriptor, CursorState.empty());
  }

  public Map<StreamDescriptor, CursorState> streams() {
    return streams;
  }

  public Optional<LogPosition> confirmedLogPosition() {
    return Optional.ofNullable(confirmedLogPosition);
  }

  public SyncState with(StreamDescriptor descriptor, CursorState state) {
    Map<StreamDescriptor, CursorState> next = new TreeMap<>(streams);
    if (state == null || state.isEmpty()) {
      next.remove(descriptor);
    } else {
      next.put(descriptor, state);
    }
    return new SyncState(next, confirmedLogPosition);
  }

  public SyncState withConfirmedLogPosition(LogPosition position) {
    return new SyncState(streams, position);
  }

  public JsonObject toJson() {
    JsonObject streamsJson = new JsonObject();
    streams.forEach((descriptor, state) -> streamsJson.put(descriptor.qualifiedName(), state.toJson()));
    JsonObject json = new JsonObject().put("streams", streamsJson);
    if (confirmedLogPosition != null) {
      json.put("log", new JsonObject().put("confirmedPosition", confirmedLogPosition.asString()));
    }
    return json;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SyncState && toJson().equals(((SyncState) o).toJson());
  }

  @Override
  public int hashCode() {
    return toJson().hashCode();
  }

  @Override
  public String toString() {
    return toJson().encode();
  }
}
