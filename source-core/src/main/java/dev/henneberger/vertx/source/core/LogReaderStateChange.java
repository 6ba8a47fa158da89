package dev.henneberger.vertx.source.core;

public final class LogReaderStateChange {
  private final LogReaderState previousState;
  private final LogReaderState state;
  private final LogPosition position;
  private final Throwable cause;
  private final long attempt;

  public LogReaderStateChange(LogReaderState previousState,
                              LogReaderState state,
                              LogPosition position,
                              Throwable cause,
                              long attempt) {
    this.previousState = previousState;
    this.state = state;
    this.position = position;
    this.cause = cause;
    this.attempt = attempt;
  }

  public LogReaderState previousState() {
    return previousState;
  }

  public LogReaderState state() {
    return state;
  }

  /**
   * Position the reader (re)connects from, or the last acknowledged position on close.
   */
  public LogPosition position() {
    return position;
  }

  public Throwable cause() {
    return cause;
  }

  public long attempt() {
    return attempt;
  }

  @Override
  public String toString() {
    return previousState + " -> " + state + (position == null ? "" : " at " + position)
      + (attempt > 0 ? " (attempt " + attempt + ")" : "");
  }
}
