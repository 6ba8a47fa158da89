package dev.henneberger.vertx.source.core;

import java.util.List;

/**
 * Database access behind the {@link SnapshotReader}.
 */
public interface PageSource {

  /**
   * Columns that give the rows of {@code stream} a stable total order (primary key or equivalent).
   */
  List<String> sortKey(ConfiguredStream stream) throws Exception;

  /**
   * Reads at most {@code request.limit()} rows in the requested order. Rows whose cursor column
   * is {@code null} are not returned when a cursor field is set.
   */
  List<ScannedRow> fetch(PageRequest request) throws Exception;
}
