package dev.henneberger.vertx.source.core;

import java.util.Objects;

public final class ReplicationSlot {

  private final String name;
  private final String plugin;
  private final LogPosition confirmedFlushPosition;
  private final boolean active;

  public ReplicationSlot(String name, String plugin, LogPosition confirmedFlushPosition, boolean active) {
    this.name = Objects.requireNonNull(name, "name");
    this.plugin = plugin;
    this.confirmedFlushPosition = confirmedFlushPosition;
    this.active = active;
  }

  public String name() {
    return name;
  }

  public String plugin() {
    return plugin;
  }

  /**
   * Position the server has been told is durable downstream, {@code null} for a slot that has
   * never been confirmed.
   */
  public LogPosition confirmedFlushPosition() {
    return confirmedFlushPosition;
  }

  public boolean active() {
    return active;
  }

  @Override
  public String toString() {
    return "ReplicationSlot{name=" + name + ", plugin=" + plugin + ", confirmedFlushPosition="
      + confirmedFlushPosition + ", active=" + active + '}';
  }
}
