package dev.henneberger.vertx.source.core;

/**
 * Connection drop or timeout. Retried with backoff until the retry bound is reached.
 */
public class TransientNetworkException extends SourceException {

  public TransientNetworkException(String message, Throwable cause) {
    super(message, "Check network connectivity to the database and its availability.", cause);
  }

  @Override
  public boolean isTransient() {
    return true;
  }
}
