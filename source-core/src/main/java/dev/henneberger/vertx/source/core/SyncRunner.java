package dev.henneberger.vertx.source.core;

import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains a {@link SourceMessageIterator} on a dedicated worker thread and hands each message to a
 * {@link MessageConsumer} on the Vert.x context. The next message is only pulled once the future
 * returned for the previous one has completed, so a slow consumer holds the source back.
 */
public final class SyncRunner {

  private static final Logger LOG = LoggerFactory.getLogger(SyncRunner.class);

  private final Vertx vertx;
  private final String name;

  public SyncRunner(Vertx vertx, String name) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.name = name == null || name.isBlank() ? "sync" : name;
  }

  /**
   * Runs the sync to completion.
   *
   * @return the last STATE delivered to the consumer, or {@code null} if there was none
   */
  public Future<SyncState> run(SourceMessageIterator messages, MessageConsumer consumer) {
    Objects.requireNonNull(messages, "messages");
    Objects.requireNonNull(consumer, "consumer");
    Context context = vertx.getOrCreateContext();
    Promise<SyncState> promise = Promise.promise();

    Thread worker = new Thread(() -> drain(messages, consumer, context, promise), "source-" + name);
    worker.setDaemon(true);
    worker.start();
    return promise.future();
  }

  private void drain(SourceMessageIterator messages,
                     MessageConsumer consumer,
                     Context context,
                     Promise<SyncState> promise) {
    SyncState lastState = null;
    long delivered = 0;
    try (messages) {
      while (messages.hasNext()) {
        SourceMessage message = messages.next();
        deliverAndAwait(message, consumer, context);
        delivered++;
        if (message.isState()) {
          lastState = message.state();
        }
      }
      LOG.info("Sync {} delivered {} message(s)", name, delivered);
      promise.tryComplete(lastState);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      promise.tryFail(e);
    } catch (Throwable e) {
      LOG.error("Sync {} failed after {} message(s)", name, delivered, e);
      promise.tryFail(e);
    }
  }

  private static void deliverAndAwait(SourceMessage message,
                                      MessageConsumer consumer,
                                      Context context) throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    AtomicReference<Throwable> failure = new AtomicReference<>();
    context.runOnContext(v -> {
      try {
        Future<Void> result = consumer.handle(message);
        if (result == null) {
          result = Future.succeededFuture();
        }
        result.onComplete(ar -> {
          if (ar.failed()) {
            failure.compareAndSet(null, ar.cause());
          }
          latch.countDown();
        });
      } catch (Throwable err) {
        failure.compareAndSet(null, err);
        latch.countDown();
      }
    });
    latch.await();
    Throwable err = failure.get();
    if (err != null) {
      if (err instanceof Exception) {
        throw (Exception) err;
      }
      throw new RuntimeException(err);
    }
  }
}
