package dev.henneberger.vertx.source.core;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs independent scans on a bounded pool of worker threads. Workers block on a bounded queue,
 * so a slow consumer holds them back.
 */
final class ParallelScan implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ParallelScan.class);
  private static final long POLL_MILLIS = 100;

  private final List<ScanTask> tasks;
  private final int workers;
  private final BlockingQueue<SourceMessage> queue;
  private final AtomicInteger remaining;
  private final AtomicReference<Throwable> failure = new AtomicReference<>();
  private final AtomicInteger threadIds = new AtomicInteger();
  private ExecutorService executor;

  ParallelScan(List<ScanTask> tasks, int workers, int queueCapacity) {
    this.tasks = List.copyOf(tasks);
    this.workers = Math.max(1, Math.min(workers, tasks.size()));
    this.queue = new ArrayBlockingQueue<>(queueCapacity);
    this.remaining = new AtomicInteger(tasks.size());
  }

  void start() {
    executor = Executors.newFixedThreadPool(workers, runnable -> {
      Thread thread = new Thread(runnable, "source-scan-" + threadIds.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
    LOG.info("Reading {} stream(s) with {} worker(s)", tasks.size(), workers);
    for (ScanTask task : tasks) {
      executor.submit(() -> run(task));
    }
  }

  /**
   * Next message from any worker; {@code null} once every scan has completed.
   */
  SourceMessage take() throws Exception {
    while (true) {
      Throwable error = failure.get();
      if (error != null) {
        if (error instanceof Exception) {
          throw (Exception) error;
        }
        throw new IllegalStateException(error);
      }
      SourceMessage message = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
      if (message != null) {
        return message;
      }
      if (remaining.get() == 0 && queue.isEmpty()) {
        return null;
      }
    }
  }

  private void run(ScanTask task) {
    try {
      while (!task.step(this::put)) {
        if (Thread.currentThread().isInterrupted()) {
          return;
        }
      }
    } catch (CancellationException e) {
      LOG.debug("Scan of {} cancelled", task.stream().descriptor());
    } catch (Throwable e) {
      LOG.error("Scan of {} failed", task.stream().descriptor(), e);
      failure.compareAndSet(null, e);
    } finally {
      remaining.decrementAndGet();
    }
  }

  private void put(SourceMessage message) {
    try {
      queue.put(message);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("scan interrupted");
    }
  }

  @Override
  public void close() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }
}
