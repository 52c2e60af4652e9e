package io.dataproc.internal.retryer;

import io.dataproc.serviceclient.RpcRetryOptions;
import java.util.concurrent.ThreadLocalRandom;
import javax.annotation.concurrent.NotThreadSafe;

/** Delay schedule of one retried call. */
@NotThreadSafe
final class RetryBackoff {
  private final RpcRetryOptions options;
  private final long startNanos;
  private long delayMillis;
  private int attempts;

  RetryBackoff(RpcRetryOptions options, long startNanos) {
    this.options = options;
    this.startNanos = startNanos;
    this.delayMillis = options.getInitialRetryDelay().toMillis();
  }

  /** Records the start of an attempt. */
  int startAttempt() {
    return ++attempts;
  }

  int getAttempts() {
    return attempts;
  }

  /**
   * @return milliseconds to wait before the next attempt, or -1 if the attempt limit or the total
   *     timeout leave no room for one
   */
  long nextDelayMillis(long nowNanos) {
    int maxAttempts = options.getMaxAttempts();
    if (maxAttempts > 0 && attempts >= maxAttempts) {
      return -1;
    }
    long delay =
        options.isJittered() ? ThreadLocalRandom.current().nextLong(delayMillis + 1) : delayMillis;
    long elapsedMillis = (nowNanos - startNanos) / 1_000_000;
    if (elapsedMillis + delay >= options.getTotalTimeout().toMillis()) {
      return -1;
    }
    delayMillis =
        Math.min(
            (long) (delayMillis * options.getRetryDelayMultiplier()),
            options.getMaxRetryDelay().toMillis());
    return delay;
  }
}
