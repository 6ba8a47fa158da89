package dev.henneberger.vertx.source.core;

/**
 * Exclusive use of a replication log for the duration of one sync.
 */
public interface LogSession extends AutoCloseable {

  /**
   * Current end of the server log; changes committed after it are not yet visible to a scan
   * that starts now.
   */
  LogPosition currentPosition() throws Exception;

  /**
   * Opens the single reader of this session, starting at {@code start}.
   */
  LogReader openReader(LogPosition start) throws Exception;

  @Override
  void close();
}
