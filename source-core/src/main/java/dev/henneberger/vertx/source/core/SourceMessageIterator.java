package dev.henneberger.vertx.source.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazy, ordered output of one sync.
 *
 * <p>Messages are produced only as they are pulled. Moving past a STATE message (calling
 * {@link #hasNext()} or {@link #next()} again) tells the source that the consumer holds it, which
 * is what allows the source to confirm that position upstream. Closing early never confirms
 * anything beyond the last consumed STATE. A sync is resumed by starting a new read with the last
 * consumed STATE.
 */
public final class SourceMessageIterator implements Iterator<SourceMessage>, AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(SourceMessageIterator.class);

  private final MessageProducer producer;
  private final Deque<SourceMessage> buffer = new ArrayDeque<>();
  private SyncState handedOut;
  private boolean exhausted;
  private boolean closed;

  SourceMessageIterator(MessageProducer producer) {
    this.producer = producer;
  }

  @Override
  public boolean hasNext() {
    if (closed) {
      return false;
    }
    try {
      releaseHandedOutState();
      while (buffer.isEmpty() && !exhausted) {
        if (!producer.produce(buffer::add)) {
          exhausted = true;
        }
      }
    } catch (SourceException e) {
      fail(e);
      throw e;
    } catch (Exception e) {
      fail(e);
      throw new SourceException("Sync failed: " + e.getMessage(),
        "Check that the source database is reachable and retry the sync from the last STATE.", e);
    }
    if (buffer.isEmpty()) {
      close();
      return false;
    }
    return true;
  }

  @Override
  public SourceMessage next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    SourceMessage message = buffer.poll();
    if (message.isState()) {
      handedOut = message.state();
    }
    return message;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    buffer.clear();
    producer.close();
  }

  private void releaseHandedOutState() throws Exception {
    SyncState state = handedOut;
    if (state != null) {
      handedOut = null;
      producer.stateConsumed(state);
    }
  }

  private void fail(Exception e) {
    LOG.error("Sync failed", e);
    close();
  }
}
