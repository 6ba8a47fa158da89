package dev.henneberger.vertx.source.core;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A stream selected for a sync, with the mode it is read in.
 */
public final class ConfiguredStream {

  private final StreamDescriptor descriptor;
  private final SyncMode syncMode;
  private final String cursorField;
  private final List<String> primaryKey;
  private final Object cursorStart;

  public ConfiguredStream(StreamDescriptor descriptor,
                          SyncMode syncMode,
                          String cursorField,
                          List<String> primaryKey) {
    this(descriptor, syncMode, cursorField, primaryKey, null);
  }

  public ConfiguredStream(StreamDescriptor descriptor,
                          SyncMode syncMode,
                          String cursorField,
                          List<String> primaryKey,
                          Object cursorStart) {
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    this.syncMode = Objects.requireNonNull(syncMode, "syncMode");
    this.cursorField = cursorField == null || cursorField.isBlank() ? null : cursorField;
    this.primaryKey = primaryKey == null ? List.of() : List.copyOf(primaryKey);
    this.cursorStart = cursorStart;
    if (syncMode == SyncMode.INCREMENTAL && this.cursorField == null) {
      throw new ConfigException(
        "Incremental stream " + descriptor + " has no cursor field",
        "Configure a cursor field for the stream or select full_refresh.");
    }
  }

  public static ConfiguredStream fullRefresh(StreamDescriptor descriptor) {
    return new ConfiguredStream(descriptor, SyncMode.FULL_REFRESH, null, null);
  }

  public static ConfiguredStream incremental(StreamDescriptor descriptor, String cursorField) {
    return new ConfiguredStream(descriptor, SyncMode.INCREMENTAL, cursorField, null);
  }

  public static ConfiguredStream cdc(StreamDescriptor descriptor) {
    return new ConfiguredStream(descriptor, SyncMode.CDC, null, null);
  }

  public static ConfiguredStream fromJson(JsonObject json) {
    Objects.requireNonNull(json, "json");
    StreamDescriptor descriptor = new StreamDescriptor(json.getString("namespace"), json.getString("name"));
    List<String> primaryKey = new ArrayList<>();
    JsonArray keyJson = json.getJsonArray("primaryKey");
    if (keyJson != null) {
      for (int i = 0; i < keyJson.size(); i++) {
        primaryKey.add(keyJson.getString(i));
      }
    }
    return new ConfiguredStream(
      descriptor,
      SyncMode.parse(json.getString("syncMode", SyncMode.FULL_REFRESH.jsonName())),
      json.getString("cursorField"),
      primaryKey,
      json.getValue("cursorStart"));
  }

  public ConfiguredStream withPrimaryKey(List<String> primaryKey) {
    return new ConfiguredStream(descriptor, syncMode, cursorField, primaryKey, cursorStart);
  }

  /**
   * Inclusive lower bound of an incremental stream's first sync, e.g. a start date.
   */
  public ConfiguredStream withCursorStart(Object cursorStart) {
    return new ConfiguredStream(descriptor, syncMode, cursorField, primaryKey, cursorStart);
  }

  /**
   * Places a stream configured without a namespace into {@code namespace}; qualified streams are
   * returned unchanged.
   */
  public ConfiguredStream withDefaultNamespace(String namespace) {
    if (descriptor.namespace() != null) {
      return this;
    }
    return new ConfiguredStream(StreamDescriptor.of(namespace, descriptor.name()), syncMode, cursorField,
      primaryKey, cursorStart);
  }

  public StreamDescriptor descriptor() {
    return descriptor;
  }

  public SyncMode syncMode() {
    return syncMode;
  }

  public String cursorField() {
    return cursorField;
  }

  public List<String> primaryKey() {
    return Collections.unmodifiableList(primaryKey);
  }

  public Object cursorStart() {
    return cursorStart;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("namespace", descriptor.namespace())
      .put("name", descriptor.name())
      .put("syncMode", syncMode.jsonName());
    if (cursorField != null) {
      json.put("cursorField", cursorField);
    }
    if (!primaryKey.isEmpty()) {
      json.put("primaryKey", new JsonArray(new ArrayList<>(primaryKey)));
    }
    if (cursorStart != null) {
      json.put("cursorStart", cursorStart);
    }
    return json;
  }

  @Override
  public String toString() {
    return descriptor + "(" + syncMode.jsonName() + ")";
  }
}
