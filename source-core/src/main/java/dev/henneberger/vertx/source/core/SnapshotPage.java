package dev.henneberger.vertx.source.core;

import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Rows of one scan page together with the resume information that becomes safe to checkpoint
 * once all of them have been emitted.
 */
public final class SnapshotPage {

  private final List<ScannedRow> rows;
  private final JsonObject lastKey;
  private final Object highWaterMark;
  private final boolean last;

  SnapshotPage(List<ScannedRow> rows, JsonObject lastKey, Object highWaterMark, boolean last) {
    this.rows = List.copyOf(rows);
    this.lastKey = lastKey;
    this.highWaterMark = highWaterMark;
    this.last = last;
  }

  /**
   * Rows to emit, in scan order.
   */
  public List<ScannedRow> rows() {
    return rows;
  }

  /**
   * Sort key of the last row read, {@code null} if the page read nothing.
   */
  public JsonObject lastKey() {
    return lastKey == null ? null : lastKey.copy();
  }

  /**
   * Largest cursor value whose rows have all been read, or {@code null} if the cursor cannot
   * advance after this page.
   */
  public Object highWaterMark() {
    return highWaterMark;
  }

  public boolean isLast() {
    return last;
  }
}
