package dev.henneberger.vertx.source.core;

import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Exponential backoff for reconnecting the log connection. Only transient failures are retried,
 * and only up to {@link #getMaxAttempts()} consecutive attempts.
 */
public final class BackoffPolicy {
  public static final long DEFAULT_MAX_ATTEMPTS = 8;

  private Duration initialDelay = Duration.ofSeconds(1);
  private Duration maxDelay = Duration.ofSeconds(30);
  private double multiplier = 2.0d;
  private double jitter = 0.2d;
  private long maxAttempts = DEFAULT_MAX_ATTEMPTS;
  private Predicate<Throwable> retryOn = BackoffPolicy::isTransient;

  public BackoffPolicy() {
  }

  public BackoffPolicy(JsonObject json) {
    this();
    if (json != null) {
      setInitialDelay(Duration.ofMillis(json.getLong("initialDelayMs", initialDelay.toMillis())));
      setMaxDelay(Duration.ofMillis(json.getLong("maxDelayMs", maxDelay.toMillis())));
      setMultiplier(json.getDouble("multiplier", multiplier));
      setJitter(json.getDouble("jitter", jitter));
      setMaxAttempts(json.getLong("maxAttempts", maxAttempts));
    }
  }

  public static BackoffPolicy noRetry() {
    return new BackoffPolicy().setMaxAttempts(0);
  }

  public BackoffPolicy copy() {
    BackoffPolicy copy = new BackoffPolicy();
    copy.initialDelay = initialDelay;
    copy.maxDelay = maxDelay;
    copy.multiplier = multiplier;
    copy.jitter = jitter;
    copy.maxAttempts = maxAttempts;
    copy.retryOn = retryOn;
    return copy;
  }

  public BackoffPolicy setInitialDelay(Duration initialDelay) {
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
    return this;
  }

  public BackoffPolicy setMaxDelay(Duration maxDelay) {
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    return this;
  }

  public BackoffPolicy setMultiplier(double multiplier) {
    this.multiplier = multiplier;
    return this;
  }

  public BackoffPolicy setJitter(double jitter) {
    if (jitter < 0.0d || jitter > 1.0d) {
      throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
    }
    this.jitter = jitter;
    return this;
  }

  public BackoffPolicy setMaxAttempts(long maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public BackoffPolicy setRetryOn(Predicate<Throwable> retryOn) {
    this.retryOn = Objects.requireNonNull(retryOn, "retryOn");
    return this;
  }

  public Duration getInitialDelay() {
    return initialDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public double getJitter() {
    return jitter;
  }

  public long getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * @param attempt the number of consecutive failed attempts so far, starting at 1
   */
  public boolean shouldRetry(Throwable error, long attempt) {
    return retryOn.test(error) && attempt <= maxAttempts;
  }

  public long computeDelayMillis(long attempt) {
    double base = initialDelay.toMillis() * Math.pow(Math.max(1.0d, multiplier), Math.max(0, attempt - 1));
    long capped = Math.min((long) Math.min(base, Long.MAX_VALUE), maxDelay.toMillis());
    if (jitter == 0.0d || capped == 0L) {
      return capped;
    }
    long delta = (long) (capped * jitter);
    long min = Math.max(0L, capped - delta);
    long max = capped + delta;
    return ThreadLocalRandom.current().nextLong(min, max + 1);
  }

  public void validate() {
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0");
    }
    if (maxDelay.isNegative()) {
      throw new IllegalArgumentException("maxDelay must be >= 0");
    }
    if (maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= initialDelay");
    }
    if (multiplier < 1.0d) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    OptionValidation.requireMin("maxAttempts", maxAttempts, 0);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("initialDelayMs", initialDelay.toMillis())
      .put("maxDelayMs", maxDelay.toMillis())
      .put("multiplier", multiplier)
      .put("jitter", jitter)
      .put("maxAttempts", maxAttempts);
  }

  private static boolean isTransient(Throwable error) {
    return error instanceof SourceException && ((SourceException) error).isTransient();
  }
}
