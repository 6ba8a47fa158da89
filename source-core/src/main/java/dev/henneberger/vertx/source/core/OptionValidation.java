package dev.henneberger.vertx.source.core;

import java.time.Duration;

public final class OptionValidation {

  private OptionValidation() {
  }

  public static void require(String fieldName, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
  }

  public static void requirePort(int port) {
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be between 1 and 65535");
    }
  }

  public static void requireMin(String fieldName, long value, long minInclusive) {
    if (value < minInclusive) {
      throw new IllegalArgumentException(fieldName + " must be >= " + minInclusive);
    }
  }

  public static void requirePositive(String fieldName, Duration value) {
    if (value == null || value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(fieldName + " must be > 0");
    }
  }

  public static void requireNotNegative(String fieldName, Duration value) {
    if (value == null || value.isNegative()) {
      throw new IllegalArgumentException(fieldName + " must be >= 0");
    }
  }

  /**
   * Accepts identifiers made of letters, digits and underscores, as slot and publication names are.
   */
  public static void requireSimpleIdentifier(String fieldName, String value) {
    require(fieldName, value);
    if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
      throw new IllegalArgumentException(fieldName + " must contain only letters, digits and underscores");
    }
  }
}
