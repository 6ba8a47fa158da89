package dev.henneberger.vertx.source.core;

import io.vertx.core.json.JsonObject;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One element of the output sequence of a sync.
 *
 * <p>A {@link Type#STATE} message certifies that every {@link Type#RECORD} emitted before it can
 * be treated as durable downstream.
 */
public final class SourceMessage {

  public enum Type {
    RECORD,
    STATE,
    LOG
  }

  public enum Level {
    DEBUG,
    INFO,
    WARN,
    ERROR
  }

  private final Type type;
  private final StreamDescriptor stream;
  private final Map<String, Object> data;
  private final Object orderingKey;
  private final ChangeRecord change;
  private final long emittedAt;
  private final SyncState state;
  private final Level level;
  private final String message;

  private SourceMessage(Type type,
                        StreamDescriptor stream,
                        Map<String, Object> data,
                        Object orderingKey,
                        ChangeRecord change,
                        long emittedAt,
                        SyncState state,
                        Level level,
                        String message) {
    this.type = type;
    this.stream = stream;
    this.data = data;
    this.orderingKey = orderingKey;
    this.change = change;
    this.emittedAt = emittedAt;
    this.state = state;
    this.level = level;
    this.message = message;
  }

  public static SourceMessage record(StreamDescriptor stream,
                                     Map<String, Object> data,
                                     Object orderingKey,
                                     long emittedAt) {
    Objects.requireNonNull(stream, "stream");
    Objects.requireNonNull(data, "data");
    return new SourceMessage(Type.RECORD, stream, new LinkedHashMap<>(data), orderingKey, null, emittedAt,
      null, null, null);
  }

  public static SourceMessage change(ChangeRecord change, long emittedAt) {
    Objects.requireNonNull(change, "change");
    return new SourceMessage(Type.RECORD, change.stream(), new LinkedHashMap<>(change.row()),
      change.commitPosition().asString(), change, emittedAt, null, null, null);
  }

  public static SourceMessage state(SyncState state) {
    return new SourceMessage(Type.STATE, null, null, null, null, 0L,
      Objects.requireNonNull(state, "state"), null, null);
  }

  public static SourceMessage log(Level level, String message) {
    return new SourceMessage(Type.LOG, null, null, null, null, 0L, null,
      Objects.requireNonNull(level, "level"), Objects.requireNonNull(message, "message"));
  }

  public Type type() {
    return type;
  }

  public boolean isRecord() {
    return type == Type.RECORD;
  }

  public boolean isState() {
    return type == Type.STATE;
  }

  public StreamDescriptor stream() {
    return stream;
  }

  public Map<String, Object> data() {
    return data;
  }

  /**
   * Source-defined ordering key: cursor value, scan sort key or log position.
   */
  public Object orderingKey() {
    return orderingKey;
  }

  /**
   * The decoded change behind a log-derived record, {@code null} for scanned rows.
   */
  public ChangeRecord change() {
    return change;
  }

  public long emittedAt() {
    return emittedAt;
  }

  public SyncState state() {
    return state;
  }

  public Level level() {
    return level;
  }

  public String message() {
    return message;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("type", type.name());
    switch (type) {
      case RECORD: {
        JsonObject record = new JsonObject()
          .put("namespace", stream.namespace())
          .put("stream", stream.name())
          .put("data", new JsonObject(new LinkedHashMap<>(data)))
          .put("emittedAt", emittedAt);
        if (orderingKey != null) {
          record.put("orderingKey", orderingKey);
        }
        if (change != null) {
          record.put("change", change.toJson());
        }
        json.put("record", record);
        break;
      }
      case STATE:
        json.put("state", new JsonObject().put("data", state.toJson()));
        break;
      case LOG:
        json.put("log", new JsonObject()
          .put("level", level.name().toLowerCase(Locale.ROOT))
          .put("message", message));
        break;
      default:
        throw new IllegalStateException("unknown message type " + type);
    }
    return json;
  }

  @Override
  public String toString() {
    return toJson().encode();
  }
}
