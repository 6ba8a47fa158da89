package dev.henneberger.vertx.source.core;

/**
 * The replication slot already has an active consumer. The source never preempts it.
 */
public class SlotBusyException extends SourceException {

  private final String slotName;

  public SlotBusyException(String slotName, String holder) {
    super("Replication slot '" + slotName + "' is already in use"
        + (holder == null ? "" : " by " + holder),
      "Stop the other consumer of the slot or configure a different slot name.");
    this.slotName = slotName;
  }

  public String slotName() {
    return slotName;
  }
}
