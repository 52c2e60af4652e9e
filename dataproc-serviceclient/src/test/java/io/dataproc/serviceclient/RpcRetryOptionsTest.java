package io.dataproc.serviceclient;

import static org.junit.Assert.*;

import io.grpc.Status;
import java.time.Duration;
import org.junit.Test;

public class RpcRetryOptionsTest {

  @Test
  public void testDefaults() {
    RpcRetryOptions options = RpcRetryOptions.getDefaultInstance();
    assertEquals(RpcRetryOptions.DEFAULT_INITIAL_RETRY_DELAY, options.getInitialRetryDelay());
    assertEquals(RpcRetryOptions.DEFAULT_MAX_RETRY_DELAY, options.getMaxRetryDelay());
    assertEquals(RpcRetryOptions.DEFAULT_TOTAL_TIMEOUT, options.getTotalTimeout());
    assertEquals(0, options.getMaxAttempts());
    assertTrue(options.isJittered());
    assertTrue(options.isRetryable(Status.Code.UNAVAILABLE));
    assertTrue(options.isRetryable(Status.Code.DEADLINE_EXCEEDED));
    assertFalse(options.isRetryable(Status.Code.NOT_FOUND));
    assertFalse(options.isRetryable(Status.Code.INVALID_ARGUMENT));
  }

  @Test
  public void testCopyIsEqual() {
    RpcRetryOptions options =
        RpcRetryOptions.newBuilder()
            .setInitialRetryDelay(Duration.ofMillis(50))
            .setMaxAttempts(4)
            .setRetryableCodes(Status.Code.UNAVAILABLE, Status.Code.INTERNAL)
            .build();
    RpcRetryOptions copy = RpcRetryOptions.newBuilder(options).build();
    assertEquals(options, copy);
    assertEquals(options.hashCode(), copy.hashCode());
    assertTrue(copy.isRetryable(Status.Code.INTERNAL));
    assertFalse(copy.isRetryable(Status.Code.DEADLINE_EXCEEDED));
  }

  @Test
  public void testNoRetriesMakesSingleAttempt() {
    assertEquals(1, RpcRetryOptions.noRetries().getMaxAttempts());
  }

  @Test(expected = IllegalStateException.class)
  public void testMaxDelayBelowInitialIsRejected() {
    RpcRetryOptions.newBuilder()
        .setInitialRetryDelay(Duration.ofSeconds(2))
        .setMaxRetryDelay(Duration.ofSeconds(1))
        .build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMultiplierBelowOneIsRejected() {
    RpcRetryOptions.newBuilder().setRetryDelayMultiplier(0.5);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroTotalTimeoutIsRejected() {
    RpcRetryOptions.newBuilder().setTotalTimeout(Duration.ZERO);
  }
}
