package dev.henneberger.vertx.source.core;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryStateStore implements StateStore {
  private final Map<String, String> storage = new ConcurrentHashMap<>();

  @Override
  public Optional<String> load(String key) {
    return Optional.ofNullable(storage.get(key));
  }

  @Override
  public void save(String key, String state) {
    storage.put(key, state);
  }
}
