package io.dataproc.envconfig;

import static io.dataproc.conf.EnvironmentVariableNames.*;

import com.google.common.collect.Iterables;
import io.dataproc.client.DataprocClientOptions;
import io.dataproc.serviceclient.DataprocServiceStubsOptions;
import io.dataproc.serviceclient.SimpleSslContextBuilder;
import io.grpc.Metadata;
import io.grpc.netty.shaded.io.netty.handler.ssl.SslContext;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Connection settings of one profile, with environment overrides applied by {@link #load}. */
public final class ClientConfigProfile {
  private static final Logger log = LoggerFactory.getLogger(ClientConfigProfile.class);

  static final String DEFAULT_PROFILE = "default";

  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(ClientConfigProfile profile) {
    return new Builder(profile);
  }

  public static ClientConfigProfile getDefaultInstance() {
    return new Builder().build();
  }

  public static ClientConfigProfile load() throws IOException {
    return load(LoadClientConfigProfileOptions.newBuilder().build());
  }

  /**
   * Picks a profile from the configuration file and applies the {@code DATAPROC_*} environment
   * overrides on top of it.
   *
   * @throws IOException if the file can't be read or parsed
   * @throws IllegalArgumentException if a profile was requested but isn't in the file, or both
   *     file and environment are disabled
   */
  public static ClientConfigProfile load(LoadClientConfigProfileOptions options)
      throws IOException {
    if (options.isDisableFile() && options.isDisableEnv()) {
      throw new IllegalArgumentException("Can't disable both the config file and the environment");
    }
    Map<String, String> env =
        options.getEnvOverrides() != null ? options.getEnvOverrides() : System.getenv();
    ClientConfigProfile profile = getDefaultInstance();
    if (!options.isDisableFile()) {
      ClientConfig config =
          ClientConfig.load(
              LoadClientConfigOptions.newBuilder()
                  .setConfigFilePath(options.getConfigFilePath())
                  .setConfigFileData(options.getConfigFileData())
                  .setStrictConfigFile(options.isConfigFileStrict())
                  .setEnvOverrides(options.getEnvOverrides())
                  .build());
      String name = options.getConfigFileProfile();
      if (name == null || name.isEmpty()) {
        name = env.get(DATAPROC_PROFILE);
      }
      boolean explicit = name != null && !name.isEmpty();
      if (!explicit) {
        name = DEFAULT_PROFILE;
      }
      ClientConfigProfile fromFile = config.getProfiles().get(name);
      if (fromFile != null) {
        profile = fromFile;
      } else if (explicit) {
        throw new IllegalArgumentException("Unable to find profile " + name + " in config data");
      }
      log.debug("Using client config profile {}", name);
    }
    if (!options.isDisableEnv()) {
      profile = profile.withEnvOverrides(env);
    }
    return profile;
  }

  private final @Nullable String address;
  private final @Nullable String projectId;
  private final @Nullable String region;
  private final @Nullable String apiKey;
  private final @Nullable String quotaProject;
  private final @Nullable Metadata metadata;
  private final @Nullable ClientConfigTLS tls;

  private ClientConfigProfile(Builder builder) {
    this.address = builder.address;
    this.projectId = builder.projectId;
    this.region = builder.region;
    this.apiKey = builder.apiKey;
    this.quotaProject = builder.quotaProject;
    this.metadata = builder.metadata;
    this.tls = builder.tls;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /**
   * Stubs options for this profile. An api key implies TLS unless the profile disables it
   * explicitly. Without an address the endpoint is resolved as for {@link
   * DataprocServiceStubsOptions#getDefaultInstance()}.
   *
   * @throws UncheckedIOException if TLS material can't be read
   * @throws IllegalArgumentException if only one of client certificate and key is set
   */
  public DataprocServiceStubsOptions toServiceStubsOptions() {
    DataprocServiceStubsOptions.Builder builder = DataprocServiceStubsOptions.newBuilder();
    if (!isNullOrEmpty(address)) {
      builder.setTarget(address);
    }
    if (!isNullOrEmpty(apiKey)) {
      builder.addApiKey(() -> apiKey);
    }
    if (metadata != null) {
      Metadata headers = new Metadata();
      headers.merge(metadata);
      builder.setHeaders(headers);
    }
    if (tls != null && tls.isEnabled()) {
      builder.setSslContext(buildSslContext(tls)).setEnableHttps(true);
      if (!isNullOrEmpty(tls.getServerName())) {
        builder.setAuthority(tls.getServerName());
      }
    } else if (tls != null) {
      builder.setEnableHttps(false);
    } else if (!isNullOrEmpty(apiKey)) {
      builder.setEnableHttps(true);
    }
    return builder.validateAndBuildWithDefaults();
  }

  /** Client options carrying the quota project of this profile. */
  public DataprocClientOptions toClientOptions() {
    DataprocClientOptions.Builder builder = DataprocClientOptions.newBuilder();
    if (!isNullOrEmpty(quotaProject)) {
      builder.setQuotaProjectId(quotaProject);
    }
    return builder.validateAndBuildWithDefaults();
  }

  private static SslContext buildSslContext(ClientConfigTLS tls) {
    try (InputStream cert = open(tls.getClientCertPath(), tls.getClientCertData());
        InputStream key = open(tls.getClientKeyPath(), tls.getClientKeyData());
        InputStream ca = open(tls.getServerCACertPath(), tls.getServerCACertData())) {
      if ((cert == null) != (key == null)) {
        throw new IllegalArgumentException(
            "A client certificate and a client key must be set together");
      }
      SimpleSslContextBuilder ssl =
          cert != null
              ? SimpleSslContextBuilder.forPKCS8(cert, key)
              : SimpleSslContextBuilder.noKeyOrCertChain();
      if (ca != null) {
        ssl.setTrustedCertificates(ca);
      } else if (Boolean.TRUE.equals(tls.isDisableHostVerification())) {
        ssl.setUseInsecureTrustManager(true);
      }
      return ssl.build();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to create SSL context", e);
    }
  }

  @Nullable
  private static InputStream open(@Nullable String path, @Nullable byte[] data)
      throws IOException {
    if (!isNullOrEmpty(path)) {
      return Files.newInputStream(Paths.get(path));
    }
    if (data != null && data.length > 0) {
      return new ByteArrayInputStream(data);
    }
    return null;
  }

  /** Set but empty variables clear string settings, except for the TLS flags. */
  ClientConfigProfile withEnvOverrides(Map<String, String> env) {
    Builder builder = toBuilder();
    if (env.containsKey(DATAPROC_ADDRESS)) {
      builder.setAddress(env.get(DATAPROC_ADDRESS));
    }
    if (env.containsKey(DATAPROC_PROJECT_ID)) {
      builder.setProjectId(env.get(DATAPROC_PROJECT_ID));
    }
    if (env.containsKey(DATAPROC_REGION)) {
      builder.setRegion(env.get(DATAPROC_REGION));
    }
    if (env.containsKey(DATAPROC_API_KEY)) {
      builder.setApiKey(env.get(DATAPROC_API_KEY));
    }
    if (env.containsKey(DATAPROC_QUOTA_PROJECT)) {
      builder.setQuotaProject(env.get(DATAPROC_QUOTA_PROJECT));
    }

    ClientConfigTLS.Builder tlsBuilder = null;
    String tlsEnabled = nonEmpty(env, DATAPROC_TLS);
    if (tlsEnabled != null) {
      tlsBuilder = tlsBuilder();
      tlsBuilder.setDisabled(!Boolean.parseBoolean(tlsEnabled));
    }
    String certPath = nonEmpty(env, DATAPROC_TLS_CLIENT_CERT_PATH);
    if (certPath != null) {
      tlsBuilder = tlsBuilder != null ? tlsBuilder : tlsBuilder();
      tlsBuilder.setClientCertPath(certPath);
    }
    String certData = nonEmpty(env, DATAPROC_TLS_CLIENT_CERT_DATA);
    if (certData != null) {
      tlsBuilder = tlsBuilder != null ? tlsBuilder : tlsBuilder();
      tlsBuilder.setClientCertData(certData.getBytes(StandardCharsets.UTF_8));
    }
    String keyPath = nonEmpty(env, DATAPROC_TLS_CLIENT_KEY_PATH);
    if (keyPath != null) {
      tlsBuilder = tlsBuilder != null ? tlsBuilder : tlsBuilder();
      tlsBuilder.setClientKeyPath(keyPath);
    }
    String keyData = nonEmpty(env, DATAPROC_TLS_CLIENT_KEY_DATA);
    if (keyData != null) {
      tlsBuilder = tlsBuilder != null ? tlsBuilder : tlsBuilder();
      tlsBuilder.setClientKeyData(keyData.getBytes(StandardCharsets.UTF_8));
    }
    String caPath = nonEmpty(env, DATAPROC_TLS_SERVER_CA_CERT_PATH);
    if (caPath != null) {
      tlsBuilder = tlsBuilder != null ? tlsBuilder : tlsBuilder();
      tlsBuilder.setServerCACertPath(caPath);
    }
    String caData = nonEmpty(env, DATAPROC_TLS_SERVER_CA_CERT_DATA);
    if (caData != null) {
      tlsBuilder = tlsBuilder != null ? tlsBuilder : tlsBuilder();
      tlsBuilder.setServerCACertData(caData.getBytes(StandardCharsets.UTF_8));
    }
    if (env.containsKey(DATAPROC_TLS_SERVER_NAME)) {
      tlsBuilder = tlsBuilder != null ? tlsBuilder : tlsBuilder();
      tlsBuilder.setServerName(env.get(DATAPROC_TLS_SERVER_NAME));
    }
    String disableHostVerification = nonEmpty(env, DATAPROC_TLS_DISABLE_HOST_VERIFICATION);
    if (disableHostVerification != null) {
      tlsBuilder = tlsBuilder != null ? tlsBuilder : tlsBuilder();
      tlsBuilder.setDisableHostVerification(Boolean.parseBoolean(disableHostVerification));
    }
    if (tlsBuilder != null) {
      builder.setTls(tlsBuilder.build());
    }

    Metadata merged = null;
    for (Map.Entry<String, String> entry : env.entrySet()) {
      if (!entry.getKey().startsWith(DATAPROC_GRPC_META_PREFIX)) {
        continue;
      }
      if (merged == null) {
        merged = new Metadata();
        if (metadata != null) {
          merged.merge(metadata);
        }
      }
      String name =
          ClientConfigToml.normalizeGrpcMetaKey(
              entry.getKey().substring(DATAPROC_GRPC_META_PREFIX.length()));
      Metadata.Key<String> key = Metadata.Key.of(name, Metadata.ASCII_STRING_MARSHALLER);
      merged.removeAll(key);
      // an empty value removes the header
      if (!entry.getValue().isEmpty()) {
        merged.put(key, entry.getValue());
      }
    }
    if (merged != null) {
      builder.setMetadata(merged);
    }
    return builder.build();
  }

  private ClientConfigTLS.Builder tlsBuilder() {
    return tls != null ? tls.toBuilder() : ClientConfigTLS.newBuilder();
  }

  @Nullable
  private static String nonEmpty(Map<String, String> env, String name) {
    String value = env.get(name);
    return isNullOrEmpty(value) ? null : value;
  }

  private static boolean isNullOrEmpty(@Nullable String s) {
    return s == null || s.isEmpty();
  }

  @Nullable
  public String getAddress() {
    return address;
  }

  /** Project to pass in requests, profiles don't add it to calls by themselves. */
  @Nullable
  public String getProjectId() {
    return projectId;
  }

  @Nullable
  public String getRegion() {
    return region;
  }

  @Nullable
  public String getApiKey() {
    return apiKey;
  }

  @Nullable
  public String getQuotaProject() {
    return quotaProject;
  }

  @Nullable
  public Metadata getMetadata() {
    return metadata;
  }

  @Nullable
  public ClientConfigTLS getTls() {
    return tls;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ClientConfigProfile that = (ClientConfigProfile) o;
    return Objects.equals(address, that.address)
        && Objects.equals(projectId, that.projectId)
        && Objects.equals(region, that.region)
        && Objects.equals(apiKey, that.apiKey)
        && Objects.equals(quotaProject, that.quotaProject)
        && Objects.equals(tls, that.tls)
        && metadataEquals(metadata, that.metadata);
  }

  private static boolean metadataEquals(@Nullable Metadata a, @Nullable Metadata b) {
    if (a == null || b == null) {
      return a == b;
    }
    if (!a.keys().equals(b.keys())) {
      return false;
    }
    for (String name : a.keys()) {
      Metadata.Key<String> key = Metadata.Key.of(name, Metadata.ASCII_STRING_MARSHALLER);
      if (!Iterables.elementsEqual(a.getAll(key), b.getAll(key))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        address,
        projectId,
        region,
        apiKey,
        quotaProject,
        tls,
        metadata == null ? null : metadata.keys());
  }

  @Override
  public String toString() {
    return "ClientConfigProfile{"
        + "address='"
        + address
        + '\''
        + ", projectId='"
        + projectId
        + '\''
        + ", region='"
        + region
        + '\''
        + ", apiKey="
        + (apiKey == null ? "null" : "<redacted>")
        + ", quotaProject='"
        + quotaProject
        + '\''
        + ", metadata="
        + metadata
        + ", tls="
        + tls
        + '}';
  }

  public static final class Builder {
    private String address;
    private String projectId;
    private String region;
    private String apiKey;
    private String quotaProject;
    private Metadata metadata;
    private ClientConfigTLS tls;

    private Builder() {}

    private Builder(ClientConfigProfile profile) {
      this.address = profile.address;
      this.projectId = profile.projectId;
      this.region = profile.region;
      this.apiKey = profile.apiKey;
      this.quotaProject = profile.quotaProject;
      this.metadata = profile.metadata;
      this.tls = profile.tls;
    }

    /** {@code host:port} of the service. */
    public Builder setAddress(String address) {
      this.address = address;
      return this;
    }

    public Builder setProjectId(String projectId) {
      this.projectId = projectId;
      return this;
    }

    public Builder setRegion(String region) {
      this.region = region;
      return this;
    }

    public Builder setApiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder setQuotaProject(String quotaProject) {
      this.quotaProject = quotaProject;
      return this;
    }

    /** Headers sent with every call. */
    public Builder setMetadata(Metadata metadata) {
      this.metadata = metadata;
      return this;
    }

    public Builder setTls(ClientConfigTLS tls) {
      this.tls = tls;
      return this;
    }

    public ClientConfigProfile build() {
      return new ClientConfigProfile(this);
    }
  }
}
