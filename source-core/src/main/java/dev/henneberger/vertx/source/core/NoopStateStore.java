package dev.henneberger.vertx.source.core;

import java.util.Optional;

/**
 * Keeps nothing; durability is left to the consumer of STATE messages.
 */
public final class NoopStateStore implements StateStore {

  @Override
  public Optional<String> load(String key) {
    return Optional.empty();
  }

  @Override
  public void save(String key, String state) {
  }
}
