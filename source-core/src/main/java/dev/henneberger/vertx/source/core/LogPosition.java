package dev.henneberger.vertx.source.core;

import java.util.Locale;
import java.util.Objects;

/**
 * An unsigned 64-bit offset into the transaction log, written as {@code X/Y} (upper and lower
 * 32 bits in hex), the way PostgreSQL prints an LSN.
 */
public final class LogPosition implements Comparable<LogPosition> {

  public static final LogPosition ZERO = new LogPosition(0L);

  private final long value;

  private LogPosition(long value) {
    this.value = value;
  }

  public static LogPosition of(long value) {
    return value == 0L ? ZERO : new LogPosition(value);
  }

  /**
   * Parses either the {@code X/Y} form or a plain decimal offset.
   */
  public static LogPosition parse(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim();
    int slash = trimmed.indexOf('/');
    try {
      if (slash < 0) {
        return of(Long.parseUnsignedLong(trimmed));
      }
      long high = Long.parseLong(trimmed.substring(0, slash), 16);
      long low = Long.parseLong(trimmed.substring(slash + 1), 16);
      if (high > 0xFFFFFFFFL || low > 0xFFFFFFFFL) {
        throw new IllegalArgumentException("log position out of range: " + text);
      }
      return of((high << 32) | low);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid log position: " + text, e);
    }
  }

  public static LogPosition max(LogPosition a, LogPosition b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return a.compareTo(b) >= 0 ? a : b;
  }

  public long value() {
    return value;
  }

  public boolean isAfter(LogPosition other) {
    return compareTo(other) > 0;
  }

  public boolean isAtOrBefore(LogPosition other) {
    return compareTo(other) <= 0;
  }

  public String asString() {
    return Long.toHexString(value >>> 32).toUpperCase(Locale.ROOT)
      + '/' + Long.toHexString(value & 0xFFFFFFFFL).toUpperCase(Locale.ROOT);
  }

  @Override
  public int compareTo(LogPosition other) {
    return Long.compareUnsigned(value, other.value);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof LogPosition && ((LogPosition) o).value == value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return asString();
  }
}
