package dev.henneberger.vertx.source.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Row changes of one committed transaction, in their original order.
 */
public final class CommittedTransaction {

  private final long xid;
  private final LogPosition commitPosition;
  private final Instant commitTimestamp;
  private final List<ChangeRecord> changes;

  public CommittedTransaction(long xid, LogPosition commitPosition, Instant commitTimestamp, List<ChangeRecord> changes) {
    this.xid = xid;
    this.commitPosition = Objects.requireNonNull(commitPosition, "commitPosition");
    this.commitTimestamp = commitTimestamp;
    this.changes = List.copyOf(changes);
  }

  public long xid() {
    return xid;
  }

  public LogPosition commitPosition() {
    return commitPosition;
  }

  public Instant commitTimestamp() {
    return commitTimestamp;
  }

  public List<ChangeRecord> changes() {
    return changes;
  }

  @Override
  public String toString() {
    return "CommittedTransaction{xid=" + xid + ", commitPosition=" + commitPosition
      + ", changes=" + changes.size() + '}';
  }
}
