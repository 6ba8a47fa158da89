package dev.henneberger.vertx.source.core;

/**
 * A transaction-log frame could not be decoded. Fatal for the log connection.
 */
public class LogDecodeException extends SourceException {

  public LogDecodeException(String message) {
    super(message, "The log stream contains data this decoder cannot interpret; "
      + "check the output plugin and protocol version of the slot.");
  }

  public LogDecodeException(String message, Throwable cause) {
    super(message, "The log stream contains data this decoder cannot interpret; "
      + "check the output plugin and protocol version of the slot.", cause);
  }
}
