package io.dataproc.client;

import com.google.common.base.MoreObjects;
import io.dataproc.serviceclient.RpcRetryOptions;
import java.lang.management.ManagementFactory;
import java.util.Objects;
import javax.annotation.Nullable;

/** Options shared by the Dataproc service clients. */
public final class DataprocClientOptions {

  private static final DataprocClientOptions DEFAULT_INSTANCE =
      newBuilder().validateAndBuildWithDefaults();

  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(DataprocClientOptions options) {
    return new Builder(options);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static DataprocClientOptions getDefaultInstance() {
    return DEFAULT_INSTANCE;
  }

  public static final class Builder {
    private String quotaProjectId;
    private RpcRetryOptions rpcRetryOptions;
    private String identity;

    private Builder() {}

    private Builder(DataprocClientOptions options) {
      if (options == null) {
        return;
      }
      this.quotaProjectId = options.quotaProjectId;
      this.rpcRetryOptions = options.rpcRetryOptions;
      this.identity = options.identity;
    }

    /**
     * Project billed for the quota of the calls, sent as {@code x-goog-user-project}. Not sent if
     * unset.
     */
    public Builder setQuotaProjectId(String quotaProjectId) {
      this.quotaProjectId = quotaProjectId;
      return this;
    }

    /**
     * Retry policy of every call, each page fetch of a list call included. Defaults to the retry
     * options of the service stubs.
     */
    public Builder setRpcRetryOptions(RpcRetryOptions rpcRetryOptions) {
      this.rpcRetryOptions = rpcRetryOptions;
      return this;
    }

    /** Name of this client in logs. Defaults to the JVM name, usually {@code pid@host}. */
    public Builder setIdentity(String identity) {
      this.identity = identity;
      return this;
    }

    public DataprocClientOptions build() {
      return new DataprocClientOptions(quotaProjectId, rpcRetryOptions, identity);
    }

    public DataprocClientOptions validateAndBuildWithDefaults() {
      if (quotaProjectId != null && quotaProjectId.isEmpty()) {
        throw new IllegalArgumentException("quotaProjectId can't be empty");
      }
      return new DataprocClientOptions(
          quotaProjectId,
          rpcRetryOptions,
          identity == null ? ManagementFactory.getRuntimeMXBean().getName() : identity);
    }
  }

  private final @Nullable String quotaProjectId;
  private final @Nullable RpcRetryOptions rpcRetryOptions;
  private final String identity;

  private DataprocClientOptions(
      @Nullable String quotaProjectId,
      @Nullable RpcRetryOptions rpcRetryOptions,
      String identity) {
    this.quotaProjectId = quotaProjectId;
    this.rpcRetryOptions = rpcRetryOptions;
    this.identity = identity;
  }

  @Nullable
  public String getQuotaProjectId() {
    return quotaProjectId;
  }

  /** @return null if the retry options of the service stubs apply */
  @Nullable
  public RpcRetryOptions getRpcRetryOptions() {
    return rpcRetryOptions;
  }

  public String getIdentity() {
    return identity;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("quotaProjectId", quotaProjectId)
        .add("rpcRetryOptions", rpcRetryOptions)
        .add("identity", identity)
        .toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    DataprocClientOptions that = (DataprocClientOptions) o;
    return Objects.equals(quotaProjectId, that.quotaProjectId)
        && Objects.equals(rpcRetryOptions, that.rpcRetryOptions)
        && Objects.equals(identity, that.identity);
  }

  @Override
  public int hashCode() {
    return Objects.hash(quotaProjectId, rpcRetryOptions, identity);
  }
}
