package dev.henneberger.vertx.source.core;

import java.util.Optional;

/**
 * Durable storage for serialized {@link SyncState} blobs, keyed by connector name.
 */
public interface StateStore {
  Optional<String> load(String key) throws Exception;
  void save(String key, String state) throws Exception;
}
