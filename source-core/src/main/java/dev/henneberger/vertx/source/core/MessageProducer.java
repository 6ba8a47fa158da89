package dev.henneberger.vertx.source.core;

import java.util.function.Consumer;

interface MessageProducer extends AutoCloseable {

  /**
   * Adds the next messages to {@code out}; a STATE message is always the last one added.
   *
   * @return {@code false} once the sync has nothing more to produce
   */
  boolean produce(Consumer<SourceMessage> out) throws Exception;

  /**
   * Called once the consumer has moved past a STATE message.
   */
  void stateConsumed(SyncState state) throws Exception;

  @Override
  void close();
}
