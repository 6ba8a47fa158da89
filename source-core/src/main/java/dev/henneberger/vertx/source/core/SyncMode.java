package dev.henneberger.vertx.source.core;

import java.util.Locale;

public enum SyncMode {
  FULL_REFRESH,
  INCREMENTAL,
  CDC;

  public static SyncMode parse(String value) {
    OptionValidation.require("syncMode", value);
    return SyncMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }

  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean usesLog() {
    return this == CDC;
  }
}
