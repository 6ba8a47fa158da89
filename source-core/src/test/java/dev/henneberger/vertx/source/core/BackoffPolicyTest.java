package dev.henneberger.vertx.source.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

  @Test
  void retriesOnlyTransientFailuresUpToLimit() {
    BackoffPolicy policy = new BackoffPolicy().setMaxAttempts(2);
    TransientNetworkException transientError = new TransientNetworkException("reset", null);

    assertTrue(policy.shouldRetry(transientError, 1));
    assertTrue(policy.shouldRetry(transientError, 2));
    assertFalse(policy.shouldRetry(transientError, 3));
    assertFalse(policy.shouldRetry(new SlotBusyException("s", null), 1));
    assertFalse(policy.shouldRetry(new RuntimeException("boom"), 1));
  }

  @Test
  void delayGrowsAndIsCapped() {
    BackoffPolicy policy = new BackoffPolicy()
      .setInitialDelay(Duration.ofMillis(100))
      .setMaxDelay(Duration.ofMillis(350))
      .setJitter(0.0d);

    assertEquals(100, policy.computeDelayMillis(1));
    assertEquals(200, policy.computeDelayMillis(2));
    assertEquals(350, policy.computeDelayMillis(3));
  }

  @Test
  void readsJson() {
    BackoffPolicy policy = new BackoffPolicy(new BackoffPolicy().setMaxAttempts(3).setJitter(0.5d).toJson());

    assertEquals(3, policy.getMaxAttempts());
    assertEquals(0.5d, policy.getJitter());
    assertFalse(BackoffPolicy.noRetry().shouldRetry(new TransientNetworkException("x", null), 1));
  }
}
