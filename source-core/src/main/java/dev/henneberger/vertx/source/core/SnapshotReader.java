package dev.henneberger.vertx.source.core;

import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered, resumable scan of one table.
 *
 * <p>Full-refresh and CDC streams are ordered by the table's sort key and resume after the last
 * completed key. Incremental streams are ordered by cursor then sort key; the first page uses the
 * stored cursor as an inclusive lower bound and rows equal to it are not emitted again. Without a
 * stored cursor the stream's configured start value is the bound, and rows equal to it are read.
 *
 * <p>A page ending in cursor value {@code v} may be followed by more rows with {@code v}, so the
 * high-water-mark of a full page is the largest value below its last one. Only the final page
 * releases the largest value seen.
 */
public final class SnapshotReader {

  private static final Logger LOG = LoggerFactory.getLogger(SnapshotReader.class);

  private final PageSource source;
  private final ConfiguredStream stream;
  private final int pageSize;
  private final Object storedCursor;
  private final boolean includeStored;

  private List<String> orderBy;
  private JsonObject after;
  private Object maxSeen;
  private boolean done;
  private long rowsRead;

  public SnapshotReader(PageSource source, ConfiguredStream stream, CursorState prior, int pageSize) {
    this.source = Objects.requireNonNull(source, "source");
    this.stream = Objects.requireNonNull(stream, "stream");
    Objects.requireNonNull(prior, "prior");
    OptionValidation.requireMin("pageSize", pageSize, 1);
    this.pageSize = pageSize;
    if (isIncremental()) {
      this.includeStored = prior.cursorValue() == null && stream.cursorStart() != null;
      this.storedCursor = includeStored ? stream.cursorStart() : prior.cursorValue();
      this.after = null;
    } else {
      this.includeStored = false;
      this.storedCursor = null;
      this.after = prior.snapshotCompleted() ? null : prior.snapshotKey();
    }
  }

  public boolean isDone() {
    return done;
  }

  public long rowsRead() {
    return rowsRead;
  }

  /**
   * Reads the next page, or returns empty once the scan is complete.
   */
  public Optional<SnapshotPage> nextPage() throws Exception {
    if (done) {
      return Optional.empty();
    }
    if (orderBy == null) {
      orderBy = resolveOrder();
      if (after != null) {
        LOG.info("Resuming scan of {} after key {}", stream.descriptor(), after.encode());
      }
    }

    PageRequest request = new PageRequest(
      stream,
      orderBy,
      after,
      stream.cursorField(),
      isIncremental() && after == null ? storedCursor : null,
      pageSize);
    List<ScannedRow> fetched = source.fetch(request);
    rowsRead += fetched.size();
    boolean last = fetched.size() < pageSize;

    List<ScannedRow> emit = new ArrayList<>(fetched.size());
    for (ScannedRow row : fetched) {
      if (!isIncremental() || storedCursor == null || includeStored
        || CursorValues.compare(row.value(stream.cursorField()), storedCursor) > 0) {
        emit.add(row);
      }
    }

    JsonObject lastKey = fetched.isEmpty() ? null : fetched.get(fetched.size() - 1).key();
    Object highWaterMark = isIncremental() ? highWaterMark(fetched, last) : null;
    if (lastKey != null) {
      after = lastKey;
    }
    done = last;
    return Optional.of(new SnapshotPage(emit, lastKey, highWaterMark, last));
  }

  private Object highWaterMark(List<ScannedRow> fetched, boolean last) {
    String field = stream.cursorField();
    Object candidate;
    if (last) {
      candidate = fetched.isEmpty() ? maxSeen : CursorValues.max(maxSeen, fetched.get(fetched.size() - 1).value(field));
    } else {
      Object boundary = fetched.get(fetched.size() - 1).value(field);
      candidate = CursorValues.compare(maxSeen, boundary) < 0 ? maxSeen : null;
      for (ScannedRow row : fetched) {
        Object value = row.value(field);
        if (CursorValues.compare(value, boundary) < 0) {
          candidate = CursorValues.max(candidate, value);
        }
      }
    }
    if (!fetched.isEmpty()) {
      maxSeen = CursorValues.max(maxSeen, fetched.get(fetched.size() - 1).value(field));
    }
    if (candidate == null || (storedCursor != null && !includeStored
      && CursorValues.compare(candidate, storedCursor) <= 0)) {
      return null;
    }
    return candidate;
  }

  private List<String> resolveOrder() throws Exception {
    List<String> key = stream.primaryKey().isEmpty() ? source.sortKey(stream) : stream.primaryKey();
    if (!isIncremental()) {
      if (key.isEmpty()) {
        throw new ConfigException(
          "Stream " + stream.descriptor() + " has no sort key to paginate by",
          "Add a primary key to the table or configure one for the stream.");
      }
      return key;
    }
    List<String> order = new ArrayList<>();
    order.add(stream.cursorField());
    for (String column : key) {
      if (!column.equals(stream.cursorField())) {
        order.add(column);
      }
    }
    return order;
  }

  private boolean isIncremental() {
    return stream.syncMode() == SyncMode.INCREMENTAL;
  }
}
