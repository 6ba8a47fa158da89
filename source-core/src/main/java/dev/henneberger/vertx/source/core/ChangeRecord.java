package dev.henneberger.vertx.source.core;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A committed row change decoded from the transaction log.
 */
public final class ChangeRecord {

  /**
   * The row operation type.
   */
  public enum Operation {
    INSERT,
    UPDATE,
    DELETE
  }

  private final StreamDescriptor stream;
  private final Operation operation;
  private final Map<String, Object> before;
  private final Map<String, Object> after;
  private final LogPosition commitPosition;
  private final Instant commitTimestamp;

  public ChangeRecord(StreamDescriptor stream,
                      Operation operation,
                      Map<String, Object> before,
                      Map<String, Object> after,
                      LogPosition commitPosition,
                      Instant commitTimestamp) {
    this.stream = Objects.requireNonNull(stream, "stream");
    this.operation = Objects.requireNonNull(operation, "operation");
    this.commitPosition = Objects.requireNonNull(commitPosition, "commitPosition");
    this.commitTimestamp = commitTimestamp;
    if (operation == Operation.INSERT && before != null) {
      throw new IllegalArgumentException("insert must not carry a before-image");
    }
    if (operation == Operation.DELETE && after != null) {
      throw new IllegalArgumentException("delete must not carry an after-image");
    }
    if (operation != Operation.DELETE && after == null) {
      throw new IllegalArgumentException(operation + " requires an after-image");
    }
    this.before = unmodifiableCopy(before);
    this.after = unmodifiableCopy(after);
  }

  public StreamDescriptor stream() {
    return stream;
  }

  public Operation operation() {
    return operation;
  }

  /**
   * The old row image, or {@code null} when the log carried none (always for inserts).
   */
  public Map<String, Object> before() {
    return before;
  }

  /**
   * The new row image, {@code null} for deletes.
   */
  public Map<String, Object> after() {
    return after;
  }

  public LogPosition commitPosition() {
    return commitPosition;
  }

  public Instant commitTimestamp() {
    return commitTimestamp;
  }

  /**
   * The row to emit: the after-image, or for deletes whatever the before-image identifies.
   */
  public Map<String, Object> row() {
    if (after != null) {
      return after;
    }
    return before == null ? Map.of() : before;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("operation", operation.name().toLowerCase(Locale.ROOT))
      .put("commitPosition", commitPosition.asString());
    if (commitTimestamp != null) {
      json.put("committedAt", commitTimestamp);
    }
    if (before != null) {
      json.put("before", new JsonObject(new LinkedHashMap<>(before)));
    }
    if (after != null) {
      json.put("after", new JsonObject(new LinkedHashMap<>(after)));
    }
    return json;
  }

  @Override
  public String toString() {
    return "ChangeRecord{" +
      "stream=" + stream +
      ", operation=" + operation +
      ", before=" + before +
      ", after=" + after +
      ", commitPosition=" + commitPosition +
      ", commitTimestamp=" + commitTimestamp +
      '}';
  }

  private static Map<String, Object> unmodifiableCopy(Map<String, Object> data) {
    if (data == null) {
      return null;
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}
