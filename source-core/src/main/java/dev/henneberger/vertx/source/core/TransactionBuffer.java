package dev.henneberger.vertx.source.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Collects the row changes of the transaction currently being decoded. Changes only become
 * {@link ChangeRecord}s at commit, when the commit position and timestamp are known.
 */
public final class TransactionBuffer {

  private final List<PendingChange> pending = new ArrayList<>();
  private boolean open;
  private long xid;
  private LogPosition lastCommitPosition;

  public void begin(long xid) {
    if (open) {
      throw new LogDecodeException("Begin of transaction " + xid + " while transaction " + this.xid + " is still open");
    }
    this.open = true;
    this.xid = xid;
    pending.clear();
  }

  public void add(StreamDescriptor stream,
                  ChangeRecord.Operation operation,
                  Map<String, Object> before,
                  Map<String, Object> after) {
    if (!open) {
      throw new LogDecodeException(operation + " on " + stream + " outside of a transaction");
    }
    pending.add(new PendingChange(stream, operation, before, after));
  }

  public CommittedTransaction commit(LogPosition commitPosition, Instant commitTimestamp) {
    if (!open) {
      throw new LogDecodeException("Commit at " + commitPosition + " without a matching begin");
    }
    List<ChangeRecord> records = new ArrayList<>(pending.size());
    for (PendingChange change : pending) {
      records.add(new ChangeRecord(change.stream, change.operation, change.before, change.after,
        commitPosition, commitTimestamp));
    }
    CommittedTransaction txn = new CommittedTransaction(xid, commitPosition, commitTimestamp, records);
    open = false;
    pending.clear();
    lastCommitPosition = commitPosition;
    return txn;
  }

  /**
   * Drops a partially received transaction, e.g. when the connection is lost mid-transaction.
   */
  public void discard() {
    open = false;
    pending.clear();
  }

  public boolean inTransaction() {
    return open;
  }

  public int size() {
    return pending.size();
  }

  public LogPosition lastCommitPosition() {
    return lastCommitPosition;
  }

  private static final class PendingChange {
    private final StreamDescriptor stream;
    private final ChangeRecord.Operation operation;
    private final Map<String, Object> before;
    private final Map<String, Object> after;

    private PendingChange(StreamDescriptor stream,
                          ChangeRecord.Operation operation,
                          Map<String, Object> before,
                          Map<String, Object> after) {
      this.stream = stream;
      this.operation = operation;
      this.before = before;
      this.after = after;
    }
  }
}
