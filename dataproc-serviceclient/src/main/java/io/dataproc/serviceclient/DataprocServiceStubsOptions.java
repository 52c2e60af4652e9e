package io.dataproc.serviceclient;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.uber.m3.tally.NoopScope;
import com.uber.m3.tally.Scope;
import io.dataproc.authorization.ApiKeyGrpcMetadataProvider;
import io.dataproc.authorization.BearerTokenGrpcMetadataProvider;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.netty.shaded.io.netty.handler.ssl.SslContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.net.ssl.SSLException;

/**
 * Transport options of the Dataproc service stubs.
 *
 * <p>The stubs either run on a caller supplied {@link #getChannel() channel} or build their own
 * for {@link #getTarget()}. When neither is given, the target is resolved from {@link
 * #getApiEndpoint()} and the {@code GOOGLE_API_USE_MTLS_ENDPOINT} and {@code
 * GOOGLE_API_USE_CLIENT_CERTIFICATE} environment variables, see {@link EndpointResolver}.
 */
public final class DataprocServiceStubsOptions {

  /** Deadline of a single attempt unless the caller sets a shorter one. */
  public static final Duration DEFAULT_RPC_TIMEOUT = Duration.ofSeconds(10);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(DataprocServiceStubsOptions options) {
    return new Builder(options);
  }

  /** Resolved from the current process environment on every call. */
  public static DataprocServiceStubsOptions getDefaultInstance() {
    return newBuilder().validateAndBuildWithDefaults();
  }

  private final @Nullable ManagedChannel channel;
  private final @Nullable String target;
  private final @Nullable String authority;
  private final boolean enableHttps;
  private final @Nullable SslContext sslContext;
  private final Duration rpcTimeout;
  private final Metadata headers;
  private final List<GrpcMetadataProvider> grpcMetadataProviders;
  private final Scope metricsScope;
  private final RpcRetryOptions rpcRetryOptions;
  private final @Nullable String apiEndpoint;
  private final @Nullable ClientCertificateSource clientCertificateSource;
  private final boolean clientCertificateInUse;

  private DataprocServiceStubsOptions(Builder builder, boolean clientCertificateInUse) {
    this.channel = builder.channel;
    this.target = builder.target;
    this.authority = builder.authority;
    this.enableHttps = builder.enableHttps;
    this.sslContext = builder.sslContext;
    this.rpcTimeout = builder.rpcTimeout;
    this.headers = builder.headers;
    this.grpcMetadataProviders = ImmutableList.copyOf(builder.grpcMetadataProviders);
    this.metricsScope = builder.metricsScope;
    this.rpcRetryOptions = builder.rpcRetryOptions;
    this.apiEndpoint = builder.apiEndpoint;
    this.clientCertificateSource = builder.clientCertificateSource;
    this.clientCertificateInUse = clientCertificateInUse;
  }

  /** @return externally created channel, null if the stubs create their own */
  @Nullable
  public ManagedChannel getChannel() {
    return channel;
  }

  @Nullable
  public String getTarget() {
    return target;
  }

  /** @return authority used for TLS host verification in place of the target host, if any */
  @Nullable
  public String getAuthority() {
    return authority;
  }

  public boolean getEnableHttps() {
    return enableHttps;
  }

  @Nullable
  public SslContext getSslContext() {
    return sslContext;
  }

  public Duration getRpcTimeout() {
    return rpcTimeout;
  }

  public Metadata getHeaders() {
    return headers;
  }

  public List<GrpcMetadataProvider> getGrpcMetadataProviders() {
    return grpcMetadataProviders;
  }

  @Nonnull
  public Scope getMetricsScope() {
    return metricsScope;
  }

  public RpcRetryOptions getRpcRetryOptions() {
    return rpcRetryOptions;
  }

  @Nullable
  public String getApiEndpoint() {
    return apiEndpoint;
  }

  @Nullable
  public ClientCertificateSource getClientCertificateSource() {
    return clientCertificateSource;
  }

  /** @return true if the channel presents a client certificate from the certificate source */
  public boolean isClientCertificateInUse() {
    return clientCertificateInUse;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("target", target)
        .add("authority", authority)
        .add("apiEndpoint", apiEndpoint)
        .add("channel", channel)
        .add("enableHttps", enableHttps)
        .add("clientCertificateInUse", clientCertificateInUse)
        .add("rpcTimeout", rpcTimeout)
        .add("rpcRetryOptions", rpcRetryOptions)
        .toString();
  }

  public static final class Builder {
    private ManagedChannel channel;
    private String target;
    private String authority;
    private boolean enableHttps;
    private Boolean enableHttpsExplicitly;
    private SslContext sslContext;
    private Duration rpcTimeout = DEFAULT_RPC_TIMEOUT;
    private Metadata headers;
    private List<GrpcMetadataProvider> grpcMetadataProviders = new ArrayList<>();
    private boolean credentialsSet;
    private Scope metricsScope;
    private RpcRetryOptions rpcRetryOptions;
    private String apiEndpoint;
    private ClientCertificateSource clientCertificateSource;
    private Map<String, String> environment;

    private Builder() {}

    private Builder(DataprocServiceStubsOptions options) {
      this.channel = options.channel;
      // a target resolved from the endpoint is resolved again on build
      this.target = options.apiEndpoint == null ? options.target : null;
      this.authority = options.authority;
      this.enableHttps = options.enableHttps;
      this.enableHttpsExplicitly = options.enableHttps;
      this.sslContext = options.clientCertificateInUse ? null : options.sslContext;
      this.rpcTimeout = options.rpcTimeout;
      this.headers = options.headers;
      this.grpcMetadataProviders = new ArrayList<>(options.grpcMetadataProviders);
      this.metricsScope = options.metricsScope;
      this.rpcRetryOptions = options.rpcRetryOptions;
      this.apiEndpoint = options.apiEndpoint;
      this.clientCertificateSource = options.clientCertificateSource;
    }

    /**
     * Sets a fully configured channel. The stubs never shut down a channel passed here. Mutually
     * exclusive with target, apiEndpoint, authority, sslContext and enableHttps.
     */
    public Builder setChannel(ManagedChannel channel) {
      this.channel = channel;
      return this;
    }

    /** A host:port pair or a gRPC name resolver URI. Mutually exclusive with the api endpoint. */
    public Builder setTarget(String target) {
      this.target = target;
      return this;
    }

    /**
     * Overrides the authority of the channel, which TLS verifies the server certificate against.
     * Needed when the target is an IP address or a proxy.
     */
    public Builder setAuthority(String authority) {
      this.authority = authority;
      return this;
    }

    /**
     * Overrides the endpoint host, with or without a port. Takes precedence over the mTLS endpoint
     * selection. Mutually exclusive with {@link #setTarget(String)}.
     */
    public Builder setApiEndpoint(String apiEndpoint) {
      this.apiEndpoint = apiEndpoint;
      return this;
    }

    public Builder setEnableHttps(boolean enableHttps) {
      this.enableHttps = enableHttps;
      this.enableHttpsExplicitly = enableHttps;
      return this;
    }

    public Builder setSslContext(SslContext sslContext) {
      this.sslContext = sslContext;
      return this;
    }

    public Builder setClientCertificateSource(ClientCertificateSource clientCertificateSource) {
      this.clientCertificateSource = clientCertificateSource;
      return this;
    }

    /** Environment used for endpoint resolution. Defaults to {@link System#getenv()}. */
    public Builder setEnvironment(Map<String, String> environment) {
      this.environment = environment == null ? null : ImmutableMap.copyOf(environment);
      return this;
    }

    /** Deadline of a single attempt. Defaults to 10 seconds. */
    public Builder setRpcTimeout(Duration rpcTimeout) {
      this.rpcTimeout = Objects.requireNonNull(rpcTimeout, "rpcTimeout");
      return this;
    }

    /** Static headers attached to every call. */
    public Builder setHeaders(Metadata headers) {
      this.headers = headers;
      return this;
    }

    public Builder addGrpcMetadataProvider(GrpcMetadataProvider grpcMetadataProvider) {
      this.grpcMetadataProviders.add(
          Objects.requireNonNull(grpcMetadataProvider, "grpcMetadataProvider"));
      return this;
    }

    /** Sends {@code x-goog-api-key} with every call. Enables TLS unless explicitly disabled. */
    public Builder addApiKey(Supplier<String> apiKeySupplier) {
      this.credentialsSet = true;
      return addGrpcMetadataProvider(new ApiKeyGrpcMetadataProvider(apiKeySupplier));
    }

    /**
     * Sends {@code authorization: Bearer <token>} with every call. The supplier is asked on every
     * call, so a refreshed token is picked up. Enables TLS unless explicitly disabled.
     */
    public Builder addAuthorizationToken(Supplier<String> tokenSupplier) {
      this.credentialsSet = true;
      return addGrpcMetadataProvider(new BearerTokenGrpcMetadataProvider(tokenSupplier));
    }

    /** Scope the per-call metrics are reported to. Defaults to a no-op scope. */
    public Builder setMetricsScope(Scope metricsScope) {
      this.metricsScope = metricsScope;
      return this;
    }

    /** Retry policy used by {@link ServiceStubs#connect(Duration)} and by the clients. */
    public Builder setRpcRetryOptions(RpcRetryOptions rpcRetryOptions) {
      this.rpcRetryOptions = rpcRetryOptions;
      return this;
    }

    /** Builds without endpoint resolution or defaults, for tests and copies. */
    public DataprocServiceStubsOptions build() {
      return new DataprocServiceStubsOptions(this, false);
    }

    /**
     * @throws IllegalStateException if conflicting transport options are set
     * @throws IllegalArgumentException if {@code GOOGLE_API_USE_CLIENT_CERTIFICATE} is invalid
     * @throws MutualTlsException if {@code GOOGLE_API_USE_MTLS_ENDPOINT} is invalid or the client
     *     certificate can't be loaded
     */
    public DataprocServiceStubsOptions validateAndBuildWithDefaults() {
      if (apiEndpoint != null && target != null) {
        throw new IllegalStateException(
            "Only one of the 'apiEndpoint' or 'target' options can be set at a time");
      }
      boolean clientCertificateInUse = false;
      if (channel != null) {
        checkNotWithChannel(target != null, "target");
        checkNotWithChannel(apiEndpoint != null, "apiEndpoint");
        checkNotWithChannel(authority != null, "authority");
        checkNotWithChannel(sslContext != null, "sslContext");
        checkNotWithChannel(enableHttps, "enableHttps");
      } else {
        EndpointResolver resolver =
            new EndpointResolver(environment != null ? environment : System.getenv());
        clientCertificateInUse =
            clientCertificateSource != null && resolver.useClientCertificate();
        if (target == null) {
          target = resolver.resolveTarget(apiEndpoint, clientCertificateInUse);
        }
        if (clientCertificateInUse && sslContext == null) {
          sslContext = loadClientCertificate();
        }
        if (enableHttpsExplicitly == null
            && (credentialsSet
                || sslContext != null
                || EndpointResolver.isGoogleApisTarget(target))) {
          enableHttps = true;
        }
      }
      if (headers == null) {
        headers = new Metadata();
      }
      if (metricsScope == null) {
        metricsScope = new NoopScope();
      }
      if (rpcRetryOptions == null) {
        rpcRetryOptions = RpcRetryOptions.getDefaultInstance();
      }
      return new DataprocServiceStubsOptions(this, clientCertificateInUse);
    }

    private void checkNotWithChannel(boolean set, String option) {
      if (set) {
        throw new IllegalStateException(
            "Only one of the '" + option + "' or 'channel' options can be set at a time");
      }
    }

    private SslContext loadClientCertificate() {
      try {
        return clientCertificateSource.createSslContext();
      } catch (SSLException e) {
        throw new MutualTlsException("Unable to load the client certificate", e);
      }
    }
  }
}
