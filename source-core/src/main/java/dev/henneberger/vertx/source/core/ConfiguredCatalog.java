package dev.henneberger.vertx.source.core;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The resolved catalog of a sync: every selected stream with its mode, in configured order.
 */
public final class ConfiguredCatalog {

  private final List<ConfiguredStream> streams;

  public ConfiguredCatalog(List<ConfiguredStream> streams) {
    Objects.requireNonNull(streams, "streams");
    Set<StreamDescriptor> seen = new LinkedHashSet<>();
    for (ConfiguredStream stream : streams) {
      if (!seen.add(stream.descriptor())) {
        throw new ConfigException(
          "Stream " + stream.descriptor() + " is configured more than once",
          "Select each stream exactly once with a single sync mode.");
      }
    }
    this.streams = List.copyOf(streams);
  }

  public static ConfiguredCatalog of(ConfiguredStream... streams) {
    return new ConfiguredCatalog(List.of(streams));
  }

  /**
   * The same catalog with every unqualified stream placed into {@code namespace}, so that streams
   * match the fully qualified names a database log reports.
   */
  public ConfiguredCatalog withDefaultNamespace(String namespace) {
    List<ConfiguredStream> qualified = new ArrayList<>(streams.size());
    for (ConfiguredStream stream : streams) {
      qualified.add(stream.withDefaultNamespace(namespace));
    }
    return new ConfiguredCatalog(qualified);
  }

  public static ConfiguredCatalog fromJson(JsonObject json) {
    Objects.requireNonNull(json, "json");
    JsonArray array = json.getJsonArray("streams", new JsonArray());
    List<ConfiguredStream> streams = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      streams.add(ConfiguredStream.fromJson(array.getJsonObject(i)));
    }
    return new ConfiguredCatalog(streams);
  }

  public List<ConfiguredStream> streams() {
    return streams;
  }

  public List<ConfiguredStream> streams(SyncMode mode) {
    return streams.stream().filter(s -> s.syncMode() == mode).collect(Collectors.toList());
  }

  public boolean hasLogStreams() {
    return streams.stream().anyMatch(s -> s.syncMode().usesLog());
  }

  public JsonObject toJson() {
    JsonArray array = new JsonArray();
    streams.forEach(s -> array.add(s.toJson()));
    return new JsonObject().put("streams", array);
  }
}
