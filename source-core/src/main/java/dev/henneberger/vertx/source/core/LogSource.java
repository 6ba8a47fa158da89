package dev.henneberger.vertx.source.core;

import java.util.List;

public interface LogSource {

  /**
   * Validates that the log can serve {@code streams} and claims it. Fails with a
   * {@link SourceException} before any record of the sync is produced.
   */
  LogSession acquire(List<ConfiguredStream> streams) throws Exception;
}
