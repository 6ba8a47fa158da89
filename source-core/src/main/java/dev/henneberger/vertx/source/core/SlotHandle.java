package dev.henneberger.vertx.source.core;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Claim on a replication slot. Ownership passes to exactly one reader; a second claim fails
 * instead of taking the slot over.
 */
public final class SlotHandle implements AutoCloseable {

  private final ReplicationSlot slot;
  private final AtomicReference<Object> owner = new AtomicReference<>();
  private final AtomicBoolean released = new AtomicBoolean(false);

  public SlotHandle(ReplicationSlot slot) {
    this.slot = Objects.requireNonNull(slot, "slot");
  }

  public ReplicationSlot slot() {
    return slot;
  }

  public String slotName() {
    return slot.name();
  }

  public void claim(Object newOwner) {
    Objects.requireNonNull(newOwner, "newOwner");
    if (released.get()) {
      throw new IllegalStateException("Slot handle for " + slot.name() + " has been released");
    }
    if (!owner.compareAndSet(null, newOwner) && owner.get() != newOwner) {
      throw new SlotBusyException(slot.name(), String.valueOf(owner.get()));
    }
  }

  public boolean isOwnedBy(Object candidate) {
    return !released.get() && owner.get() == candidate;
  }

  public boolean isReleased() {
    return released.get();
  }

  /**
   * Gives up the claim. The server-side slot itself is never dropped.
   */
  @Override
  public void close() {
    released.set(true);
    owner.set(null);
  }
}
