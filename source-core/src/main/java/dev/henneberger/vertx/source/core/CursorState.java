package dev.henneberger.vertx.source.core;

import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * Resume position of one stream.
 *
 * <p>Incremental streams track the largest cursor value confirmed emitted; CDC streams track a
 * log position. Either kind may also carry the progress of an unfinished table scan (the last
 * completed sort key) and, for CDC, the log position recorded when that scan started.
 */
public final class CursorState {

  private static final CursorState EMPTY = new CursorState(null, null, null, null, null, false);

  private final String cursorField;
  private final Object cursorValue;
  private final LogPosition logPosition;
  private final LogPosition snapshotPosition;
  private final JsonObject snapshotKey;
  private final boolean snapshotCompleted;

  private CursorState(String cursorField,
                      Object cursorValue,
                      LogPosition logPosition,
                      LogPosition snapshotPosition,
                      JsonObject snapshotKey,
                      boolean snapshotCompleted) {
    this.cursorField = cursorField;
    this.cursorValue = cursorValue;
    this.logPosition = logPosition;
    this.snapshotPosition = snapshotPosition;
    this.snapshotKey = snapshotKey == null ? null : snapshotKey.copy();
    this.snapshotCompleted = snapshotCompleted;
  }

  public static CursorState empty() {
    return EMPTY;
  }

  public static CursorState cursor(String cursorField, Object cursorValue) {
    return new CursorState(cursorField, cursorValue, null, null, null, false);
  }

  public static CursorState log(LogPosition position) {
    return new CursorState(null, null, Objects.requireNonNull(position, "position"), null, null, true);
  }

  public static CursorState fromJson(JsonObject json) {
    Objects.requireNonNull(json, "json");
    String logPosition = json.getString("logPosition");
    String snapshotPosition = json.getString("snapshotPosition");
    return new CursorState(
      json.getString("cursorField"),
      json.getValue("cursor"),
      logPosition == null ? null : LogPosition.parse(logPosition),
      snapshotPosition == null ? null : LogPosition.parse(snapshotPosition),
      json.getJsonObject("snapshotKey"),
      json.getBoolean("snapshotCompleted", false));
  }

  public CursorState withCursorValue(String field, Object value) {
    return new CursorState(field, value, logPosition, snapshotPosition, snapshotKey, snapshotCompleted);
  }

  public CursorState withLogPosition(LogPosition position) {
    return new CursorState(cursorField, cursorValue, position, snapshotPosition, snapshotKey, snapshotCompleted);
  }

  /**
   * Records that a scan started at {@code position} and has completed the rows up to {@code key}.
   */
  public CursorState withSnapshotProgress(LogPosition position, JsonObject key) {
    return new CursorState(cursorField, cursorValue, logPosition, position, key, false);
  }

  /**
   * Marks the scan complete. For CDC streams the scan's start position becomes the log position.
   */
  public CursorState withSnapshotCompleted() {
    LogPosition resume = logPosition == null ? snapshotPosition : logPosition;
    return new CursorState(cursorField, cursorValue, resume, null, null, true);
  }

  public String cursorField() {
    return cursorField;
  }

  public Object cursorValue() {
    return cursorValue;
  }

  public LogPosition logPosition() {
    return logPosition;
  }

  public LogPosition snapshotPosition() {
    return snapshotPosition;
  }

  public JsonObject snapshotKey() {
    return snapshotKey == null ? null : snapshotKey.copy();
  }

  public boolean snapshotCompleted() {
    return snapshotCompleted;
  }

  public boolean snapshotInProgress() {
    return !snapshotCompleted && (snapshotPosition != null || snapshotKey != null);
  }

  public boolean isEmpty() {
    return cursorValue == null && logPosition == null && snapshotPosition == null && snapshotKey == null;
  }

  /**
   * Compares the monotonic position of this state (log position, else cursor value) with another.
   */
  public int comparePosition(CursorState other) {
    if (logPosition != null || other.logPosition != null) {
      if (logPosition == null) {
        return -1;
      }
      if (other.logPosition == null) {
        return 1;
      }
      return logPosition.compareTo(other.logPosition);
    }
    return CursorValues.compare(cursorValue, other.cursorValue);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    if (cursorField != null) {
      json.put("cursorField", cursorField);
    }
    if (cursorValue != null) {
      json.put("cursor", cursorValue);
    }
    if (logPosition != null) {
      json.put("logPosition", logPosition.asString());
    }
    if (snapshotPosition != null) {
      json.put("snapshotPosition", snapshotPosition.asString());
    }
    if (snapshotKey != null) {
      json.put("snapshotKey", snapshotKey.copy());
    }
    if (snapshotCompleted) {
      json.put("snapshotCompleted", true);
    }
    return json;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CursorState)) {
      return false;
    }
    return toJson().equals(((CursorState) o).toJson());
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
