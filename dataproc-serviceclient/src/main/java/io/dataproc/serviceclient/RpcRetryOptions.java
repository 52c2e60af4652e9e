package io.dataproc.serviceclient;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import io.grpc.Status;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nonnull;

/**
 * Retry policy of unary Dataproc calls. Every client call goes through it, each page fetch of a
 * list call included, and so does {@link ServiceStubs#connect(Duration)}.
 *
 * <p>Only failures whose status code is one of {@link #getRetryableCodes()} are retried. The delay
 * before retry {@code n} is {@code min(initialRetryDelay * retryDelayMultiplier^(n-1),
 * maxRetryDelay)}, drawn uniformly from {@code [0, delay]} when jitter is on. Retrying stops after
 * {@link #getMaxAttempts()} attempts or once the next attempt would start after {@link
 * #getTotalTimeout()}, whichever comes first.
 */
public final class RpcRetryOptions {

  public static final Duration DEFAULT_INITIAL_RETRY_DELAY = Duration.ofMillis(100);
  public static final double DEFAULT_RETRY_DELAY_MULTIPLIER = 1.3;
  public static final Duration DEFAULT_MAX_RETRY_DELAY = Duration.ofSeconds(10);
  public static final Duration DEFAULT_TOTAL_TIMEOUT = Duration.ofMinutes(1);

  /** Codes that are safe to retry for the read and idempotent write calls of Dataproc. */
  public static final Set<Status.Code> DEFAULT_RETRYABLE_CODES =
      Sets.immutableEnumSet(Status.Code.UNAVAILABLE, Status.Code.DEADLINE_EXCEEDED);

  private static final RpcRetryOptions DEFAULT_INSTANCE = newBuilder().build();

  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(RpcRetryOptions options) {
    return new Builder(options);
  }

  public static RpcRetryOptions getDefaultInstance() {
    return DEFAULT_INSTANCE;
  }

  /** A single attempt, for callers that handle failures themselves. */
  public static RpcRetryOptions noRetries() {
    return newBuilder().setMaxAttempts(1).build();
  }

  public static final class Builder {
    private Duration initialRetryDelay = DEFAULT_INITIAL_RETRY_DELAY;
    private double retryDelayMultiplier = DEFAULT_RETRY_DELAY_MULTIPLIER;
    private Duration maxRetryDelay = DEFAULT_MAX_RETRY_DELAY;
    private Duration totalTimeout = DEFAULT_TOTAL_TIMEOUT;
    private int maxAttempts;
    private boolean jittered = true;
    private Set<Status.Code> retryableCodes = DEFAULT_RETRYABLE_CODES;

    private Builder() {}

    private Builder(RpcRetryOptions options) {
      this.initialRetryDelay = options.initialRetryDelay;
      this.retryDelayMultiplier = options.retryDelayMultiplier;
      this.maxRetryDelay = options.maxRetryDelay;
      this.totalTimeout = options.totalTimeout;
      this.maxAttempts = options.maxAttempts;
      this.jittered = options.jittered;
      this.retryableCodes = options.retryableCodes;
    }

    public Builder setInitialRetryDelay(Duration initialRetryDelay) {
      this.initialRetryDelay = positive(initialRetryDelay, "initialRetryDelay");
      return this;
    }

    /** Growth factor of the delay between consecutive retries, at least 1.0. */
    public Builder setRetryDelayMultiplier(double retryDelayMultiplier) {
      Preconditions.checkArgument(
          Double.isFinite(retryDelayMultiplier) && retryDelayMultiplier >= 1.0,
          "retryDelayMultiplier must be finite and >= 1.0: %s",
          retryDelayMultiplier);
      this.retryDelayMultiplier = retryDelayMultiplier;
      return this;
    }

    public Builder setMaxRetryDelay(Duration maxRetryDelay) {
      this.maxRetryDelay = positive(maxRetryDelay, "maxRetryDelay");
      return this;
    }

    /** Time budget of the whole call, retries and delays included. */
    public Builder setTotalTimeout(Duration totalTimeout) {
      this.totalTimeout = positive(totalTimeout, "totalTimeout");
      return this;
    }

    /** Attempts including the first one. 0, the default, leaves the bound to the total timeout. */
    public Builder setMaxAttempts(int maxAttempts) {
      Preconditions.checkArgument(maxAttempts >= 0, "maxAttempts must be >= 0: %s", maxAttempts);
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder setJittered(boolean jittered) {
      this.jittered = jittered;
      return this;
    }

    /** Replaces {@link #DEFAULT_RETRYABLE_CODES}. An empty set disables retries. */
    public Builder setRetryableCodes(Status.Code... retryableCodes) {
      this.retryableCodes = ImmutableSet.copyOf(retryableCodes);
      return this;
    }

    /** @throws IllegalStateException if the initial delay is longer than the maximum delay */
    public RpcRetryOptions build() {
      Preconditions.checkState(
          initialRetryDelay.compareTo(maxRetryDelay) <= 0,
          "initialRetryDelay(%s) is longer than maxRetryDelay(%s)",
          initialRetryDelay,
          maxRetryDelay);
      return new RpcRetryOptions(this);
    }

    private static Duration positive(Duration value, String name) {
      Preconditions.checkArgument(
          value != null && !value.isNegative() && !value.isZero(),
          "%s must be positive: %s",
          name,
          value);
      return value;
    }
  }

  private final Duration initialRetryDelay;
  private final double retryDelayMultiplier;
  private final Duration maxRetryDelay;
  private final Duration totalTimeout;
  private final int maxAttempts;
  private final boolean jittered;
  private final @Nonnull Set<Status.Code> retryableCodes;

  private RpcRetryOptions(Builder builder) {
    this.initialRetryDelay = builder.initialRetryDelay;
    this.retryDelayMultiplier = builder.retryDelayMultiplier;
    this.maxRetryDelay = builder.maxRetryDelay;
    this.totalTimeout = builder.totalTimeout;
    this.maxAttempts = builder.maxAttempts;
    this.jittered = builder.jittered;
    this.retryableCodes = builder.retryableCodes;
  }

  public Duration getInitialRetryDelay() {
    return initialRetryDelay;
  }

  public double getRetryDelayMultiplier() {
    return retryDelayMultiplier;
  }

  public Duration getMaxRetryDelay() {
    return maxRetryDelay;
  }

  public Duration getTotalTimeout() {
    return totalTimeout;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public boolean isJittered() {
    return jittered;
  }

  @Nonnull
  public Set<Status.Code> getRetryableCodes() {
    return retryableCodes;
  }

  public boolean isRetryable(Status.Code code) {
    return retryableCodes.contains(code);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RpcRetryOptions)) return false;
    RpcRetryOptions that = (RpcRetryOptions) o;
    return Double.compare(that.retryDelayMultiplier, retryDelayMultiplier) == 0
        && maxAttempts == that.maxAttempts
        && jittered == that.jittered
        && initialRetryDelay.equals(that.initialRetryDelay)
        && maxRetryDelay.equals(that.maxRetryDelay)
        && totalTimeout.equals(that.totalTimeout)
        && retryableCodes.equals(that.retryableCodes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        initialRetryDelay,
        retryDelayMultiplier,
        maxRetryDelay,
        totalTimeout,
        maxAttempts,
        jittered,
        retryableCodes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("initialRetryDelay", initialRetryDelay)
        .add("retryDelayMultiplier", retryDelayMultiplier)
        .add("maxRetryDelay", maxRetryDelay)
        .add("totalTimeout", totalTimeout)
        .add("maxAttempts", maxAttempts)
        .add("jittered", jittered)
        .add("retryableCodes", retryableCodes)
        .toString();
  }
}
