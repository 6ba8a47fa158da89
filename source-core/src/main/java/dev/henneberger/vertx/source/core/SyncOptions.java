package dev.henneberger.vertx.source.core;

import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Objects;

/**
 * Engine settings for one sync, handed to the {@link SyncOrchestrator} at construction.
 */
public class SyncOptions {

  public static final int DEFAULT_CHECKPOINT_RECORD_INTERVAL = 10_000;
  public static final Duration DEFAULT_CHECKPOINT_INTERVAL = Duration.ofMinutes(1);
  public static final int DEFAULT_SNAPSHOT_PAGE_SIZE = 10_000;
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(50);
  public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(10);
  public static final Duration DEFAULT_HEARTBEAT_TIMEOUT = Duration.ofMinutes(2);
  public static final Duration DEFAULT_CDC_IDLE_TIMEOUT = Duration.ofSeconds(30);

  private int checkpointRecordInterval;
  private Duration checkpointInterval;
  private int snapshotPageSize;
  private int maxConcurrentStreams;
  private int queueCapacity;
  private Duration pollInterval;
  private Duration heartbeatInterval;
  private Duration heartbeatTimeout;
  private Duration cdcIdleTimeout;
  private Duration maxStreamingDuration;
  private BackoffPolicy backoffPolicy;
  private boolean failOnCorruptState;

  public SyncOptions() {
    init();
  }

  public SyncOptions(JsonObject json) {
    init();
    if (json == null) {
      return;
    }
    checkpointRecordInterval = json.getInteger("checkpointRecordInterval", checkpointRecordInterval);
    checkpointInterval = millis(json, "checkpointIntervalMs", checkpointInterval);
    snapshotPageSize = json.getInteger("snapshotPageSize", snapshotPageSize);
    maxConcurrentStreams = json.getInteger("maxConcurrentStreams", maxConcurrentStreams);
    queueCapacity = json.getInteger("queueCapacity", queueCapacity);
    pollInterval = millis(json, "pollIntervalMs", pollInterval);
    heartbeatInterval = millis(json, "heartbeatIntervalMs", heartbeatInterval);
    heartbeatTimeout = millis(json, "heartbeatTimeoutMs", heartbeatTimeout);
    cdcIdleTimeout = millis(json, "cdcIdleTimeoutMs", cdcIdleTimeout);
    maxStreamingDuration = millis(json, "maxStreamingDurationMs", maxStreamingDuration);
    failOnCorruptState = json.getBoolean("failOnCorruptState", failOnCorruptState);
    JsonObject backoff = json.getJsonObject("backoffPolicy");
    if (backoff != null) {
      backoffPolicy = new BackoffPolicy(backoff);
    }
  }

  public SyncOptions(SyncOptions other) {
    this.checkpointRecordInterval = other.checkpointRecordInterval;
    this.checkpointInterval = other.checkpointInterval;
    this.snapshotPageSize = other.snapshotPageSize;
    this.maxConcurrentStreams = other.maxConcurrentStreams;
    this.queueCapacity = other.queueCapacity;
    this.pollInterval = other.pollInterval;
    this.heartbeatInterval = other.heartbeatInterval;
    this.heartbeatTimeout = other.heartbeatTimeout;
    this.cdcIdleTimeout = other.cdcIdleTimeout;
    this.maxStreamingDuration = other.maxStreamingDuration;
    this.backoffPolicy = other.backoffPolicy.copy();
    this.failOnCorruptState = other.failOnCorruptState;
  }

  public int getCheckpointRecordInterval() {
    return checkpointRecordInterval;
  }

  /**
   * Number of records after which a checkpoint is taken. Together with the checkpoint interval
   * this bounds how much is redelivered after a crash.
   */
  public SyncOptions setCheckpointRecordInterval(int checkpointRecordInterval) {
    this.checkpointRecordInterval = checkpointRecordInterval;
    return this;
  }

  public Duration getCheckpointInterval() {
    return checkpointInterval;
  }

  public SyncOptions setCheckpointInterval(Duration checkpointInterval) {
    this.checkpointInterval = Objects.requireNonNull(checkpointInterval, "checkpointInterval");
    return this;
  }

  public int getSnapshotPageSize() {
    return snapshotPageSize;
  }

  public SyncOptions setSnapshotPageSize(int snapshotPageSize) {
    this.snapshotPageSize = snapshotPageSize;
    return this;
  }

  public int getMaxConcurrentStreams() {
    return maxConcurrentStreams;
  }

  /**
   * Upper bound on full-refresh and incremental streams read at the same time. CDC streams always
   * share one sequential log consumer.
   */
  public SyncOptions setMaxConcurrentStreams(int maxConcurrentStreams) {
    this.maxConcurrentStreams = maxConcurrentStreams;
    return this;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public SyncOptions setQueueCapacity(int queueCapacity) {
    this.queueCapacity = queueCapacity;
    return this;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public SyncOptions setPollInterval(Duration pollInterval) {
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    return this;
  }

  public Duration getHeartbeatInterval() {
    return heartbeatInterval;
  }

  public SyncOptions setHeartbeatInterval(Duration heartbeatInterval) {
    this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
    return this;
  }

  public Duration getHeartbeatTimeout() {
    return heartbeatTimeout;
  }

  public SyncOptions setHeartbeatTimeout(Duration heartbeatTimeout) {
    this.heartbeatTimeout = Objects.requireNonNull(heartbeatTimeout, "heartbeatTimeout");
    return this;
  }

  public Duration getCdcIdleTimeout() {
    return cdcIdleTimeout;
  }

  /**
   * How long log streaming waits without a new transaction before the sync ends. Zero keeps
   * streaming until caught up or until the maximum streaming duration.
   */
  public SyncOptions setCdcIdleTimeout(Duration cdcIdleTimeout) {
    this.cdcIdleTimeout = Objects.requireNonNull(cdcIdleTimeout, "cdcIdleTimeout");
    return this;
  }

  public Duration getMaxStreamingDuration() {
    return maxStreamingDuration;
  }

  /**
   * Hard limit on log streaming per sync. Zero means unlimited.
   */
  public SyncOptions setMaxStreamingDuration(Duration maxStreamingDuration) {
    this.maxStreamingDuration = Objects.requireNonNull(maxStreamingDuration, "maxStreamingDuration");
    return this;
  }

  public BackoffPolicy getBackoffPolicy() {
    return backoffPolicy;
  }

  public SyncOptions setBackoffPolicy(BackoffPolicy backoffPolicy) {
    this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy");
    return this;
  }

  public boolean isFailOnCorruptState() {
    return failOnCorruptState;
  }

  /**
   * When set, an unreadable state blob aborts the sync instead of starting from empty state.
   */
  public SyncOptions setFailOnCorruptState(boolean failOnCorruptState) {
    this.failOnCorruptState = failOnCorruptState;
    return this;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("checkpointRecordInterval", checkpointRecordInterval)
      .put("checkpointIntervalMs", checkpointInterval.toMillis())
      .put("snapshotPageSize", snapshotPageSize)
      .put("maxConcurrentStreams", maxConcurrentStreams)
      .put("queueCapacity", queueCapacity)
      .put("pollIntervalMs", pollInterval.toMillis())
      .put("heartbeatIntervalMs", heartbeatInterval.toMillis())
      .put("heartbeatTimeoutMs", heartbeatTimeout.toMillis())
      .put("cdcIdleTimeoutMs", cdcIdleTimeout.toMillis())
      .put("maxStreamingDurationMs", maxStreamingDuration.toMillis())
      .put("failOnCorruptState", failOnCorruptState)
      .put("backoffPolicy", backoffPolicy.toJson());
  }

  public void validate() {
    OptionValidation.requireMin("checkpointRecordInterval", checkpointRecordInterval, 1);
    OptionValidation.requirePositive("checkpointInterval", checkpointInterval);
    OptionValidation.requireMin("snapshotPageSize", snapshotPageSize, 1);
    OptionValidation.requireMin("maxConcurrentStreams", maxConcurrentStreams, 1);
    OptionValidation.requireMin("queueCapacity", queueCapacity, 1);
    OptionValidation.requirePositive("pollInterval", pollInterval);
    OptionValidation.requirePositive("heartbeatInterval", heartbeatInterval);
    OptionValidation.requirePositive("heartbeatTimeout", heartbeatTimeout);
    if (heartbeatTimeout.compareTo(heartbeatInterval) <= 0) {
      throw new IllegalArgumentException("heartbeatTimeout must be greater than heartbeatInterval");
    }
    OptionValidation.requireNotNegative("cdcIdleTimeout", cdcIdleTimeout);
    OptionValidation.requireNotNegative("maxStreamingDuration", maxStreamingDuration);
    Objects.requireNonNull(backoffPolicy, "backoffPolicy").validate();
  }

  private static Duration millis(JsonObject json, String key, Duration fallback) {
    Long value = json.getLong(key);
    return value == null ? fallback : Duration.ofMillis(value);
  }

  private void init() {
    checkpointRecordInterval = DEFAULT_CHECKPOINT_RECORD_INTERVAL;
    checkpointInterval = DEFAULT_CHECKPOINT_INTERVAL;
    snapshotPageSize = DEFAULT_SNAPSHOT_PAGE_SIZE;
    maxConcurrentStreams = 1;
    queueCapacity = 1_000;
    pollInterval = DEFAULT_POLL_INTERVAL;
    heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
    heartbeatTimeout = DEFAULT_HEARTBEAT_TIMEOUT;
    cdcIdleTimeout = DEFAULT_CDC_IDLE_TIMEOUT;
    maxStreamingDuration = Duration.ZERO;
    backoffPolicy = new BackoffPolicy();
    failOnCorruptState = false;
  }
}
