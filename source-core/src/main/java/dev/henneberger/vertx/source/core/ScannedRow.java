package dev.henneberger.vertx.source.core;

import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A row read by a table scan: the data to emit and its values for the scan's sort columns.
 */
public final class ScannedRow {

  private final Map<String, Object> data;
  private final JsonObject key;

  public ScannedRow(Map<String, Object> data, JsonObject key) {
    this.data = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(data, "data")));
    this.key = Objects.requireNonNull(key, "key").copy();
  }

  public Map<String, Object> data() {
    return data;
  }

  public JsonObject key() {
    return key.copy();
  }

  public Object value(String column) {
    return key.containsKey(column) ? key.getValue(column) : data.get(column);
  }
}
