package dev.henneberger.vertx.source.core;

import io.vertx.core.Future;

@FunctionalInterface
public interface MessageConsumer {
  /**
   * Handles one message. The next message is not delivered before the returned future completes.
   */
  Future<Void> handle(SourceMessage message);
}
