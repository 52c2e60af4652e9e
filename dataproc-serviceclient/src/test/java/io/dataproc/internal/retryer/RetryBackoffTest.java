package io.dataproc.internal.retryer;

import static org.junit.Assert.*;

import io.dataproc.serviceclient.RpcRetryOptions;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.Test;

public class RetryBackoffTest {

  private static RpcRetryOptions.Builder unjittered() {
    return RpcRetryOptions.newBuilder()
        .setJittered(false)
        .setInitialRetryDelay(Duration.ofMillis(100))
        .setRetryDelayMultiplier(2.0)
        .setMaxRetryDelay(Duration.ofMillis(500))
        .setTotalTimeout(Duration.ofMinutes(1));
  }

  @Test
  public void testDelayGrowsUpToMaximum() {
    RetryBackoff backoff = new RetryBackoff(unjittered().build(), 0);
    long[] delays = new long[5];
    for (int i = 0; i < delays.length; i++) {
      backoff.startAttempt();
      delays[i] = backoff.nextDelayMillis(0);
    }
    assertArrayEquals(new long[] {100, 200, 400, 500, 500}, delays);
  }

  @Test
  public void testJitterStaysWithinDelay() {
    RpcRetryOptions options = unjittered().setJittered(true).build();
    for (int i = 0; i < 100; i++) {
      RetryBackoff backoff = new RetryBackoff(options, 0);
      backoff.startAttempt();
      long delay = backoff.nextDelayMillis(0);
      assertTrue(String.valueOf(delay), delay >= 0 && delay <= 100);
    }
  }

  @Test
  public void testAttemptLimit() {
    RetryBackoff backoff = new RetryBackoff(unjittered().setMaxAttempts(2).build(), 0);
    backoff.startAttempt();
    assertEquals(100, backoff.nextDelayMillis(0));
    backoff.startAttempt();
    assertEquals(-1, backoff.nextDelayMillis(0));
    assertEquals(2, backoff.getAttempts());
  }

  @Test
  public void testTotalTimeoutLeavesNoRoomForDelay() {
    RetryBackoff backoff =
        new RetryBackoff(unjittered().setTotalTimeout(Duration.ofSeconds(1)).build(), 0);
    backoff.startAttempt();
    assertEquals(100, backoff.nextDelayMillis(TimeUnit.MILLISECONDS.toNanos(850)));
    backoff.startAttempt();
    // 950ms elapsed plus a 200ms delay is past the 1s budget
    assertEquals(-1, backoff.nextDelayMillis(TimeUnit.MILLISECONDS.toNanos(950)));
  }
}
