package dev.henneberger.vertx.source.core;

/**
 * The persisted state could not be parsed.
 */
public class StateCorruptException extends SourceException {

  public StateCorruptException(String message, Throwable cause) {
    super(message, "Reset the stored state of this connection to run a fresh sync.", cause);
  }
}
