package io.dataproc.envconfig;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.grpc.Metadata;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.Nullable;

/** Jackson bindings of the TOML file, converted to and from the public profile types. */
final class ClientConfigToml {
  private ClientConfigToml() {}

  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  static class TomlClientConfig {
    @JsonProperty("profile")
    public Map<String, TomlClientConfigProfile> profiles;

    protected TomlClientConfig() {}

    TomlClientConfig(Map<String, TomlClientConfigProfile> profiles) {
      this.profiles = profiles;
    }
  }

  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  static class TomlClientConfigProfile {
    @JsonProperty("address")
    public String address;

    @JsonProperty("project_id")
    public String projectId;

    @JsonProperty("region")
    public String region;

    @JsonProperty("api_key")
    public String apiKey;

    @JsonProperty("quota_project")
    public String quotaProject;

    @JsonProperty("tls")
    public TomlClientConfigTLS tls;

    @JsonProperty("grpc_meta")
    public Map<String, String> grpcMeta;

    protected TomlClientConfigProfile() {}
  }

  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  static class TomlClientConfigTLS {
    @JsonProperty("disabled")
    public Boolean disabled;

    @JsonProperty("client_cert_path")
    public String clientCertPath;

    @JsonProperty("client_cert_data")
    public String clientCertData;

    @JsonProperty("client_key_path")
    public String clientKeyPath;

    @JsonProperty("client_key_data")
    public String clientKeyData;

    @JsonProperty("server_ca_cert_path")
    public String serverCACertPath;

    @JsonProperty("server_ca_cert_data")
    public String serverCACertData;

    @JsonProperty("server_name")
    public String serverName;

    @JsonProperty("disable_host_verification")
    public Boolean disableHostVerification;

    protected TomlClientConfigTLS() {}
  }

  /** {@code X_Request_Reason} becomes {@code x-request-reason}. */
  static String normalizeGrpcMetaKey(String key) {
    return key.toLowerCase(Locale.ROOT).replace('_', '-');
  }

  static Map<String, ClientConfigProfile> toClientProfiles(TomlClientConfig config) {
    Map<String, ClientConfigProfile> profiles = new TreeMap<>();
    if (config.profiles == null) {
      return profiles;
    }
    for (Map.Entry<String, TomlClientConfigProfile> entry : config.profiles.entrySet()) {
      TomlClientConfigProfile toml = entry.getValue();
      Metadata metadata = null;
      if (toml.grpcMeta != null && !toml.grpcMeta.isEmpty()) {
        metadata = new Metadata();
        for (Map.Entry<String, String> meta : toml.grpcMeta.entrySet()) {
          metadata.put(
              Metadata.Key.of(normalizeGrpcMetaKey(meta.getKey()), Metadata.ASCII_STRING_MARSHALLER),
              meta.getValue());
        }
      }
      profiles.put(
          entry.getKey(),
          ClientConfigProfile.newBuilder()
              .setAddress(toml.address)
              .setProjectId(toml.projectId)
              .setRegion(toml.region)
              .setApiKey(toml.apiKey)
              .setQuotaProject(toml.quotaProject)
              .setTls(toClientConfigTLS(toml.tls))
              .setMetadata(metadata)
              .build());
    }
    return profiles;
  }

  @Nullable
  private static ClientConfigTLS toClientConfigTLS(@Nullable TomlClientConfigTLS toml) {
    if (toml == null) {
      return null;
    }
    return ClientConfigTLS.newBuilder()
        .setDisabled(toml.disabled)
        .setClientCertPath(toml.clientCertPath)
        .setClientCertData(bytes(toml.clientCertData))
        .setClientKeyPath(toml.clientKeyPath)
        .setClientKeyData(bytes(toml.clientKeyData))
        .setServerCACertPath(toml.serverCACertPath)
        .setServerCACertData(bytes(toml.serverCACertData))
        .setServerName(toml.serverName)
        .setDisableHostVerification(toml.disableHostVerification)
        .build();
  }

  static TomlClientConfig fromClientProfiles(Map<String, ClientConfigProfile> profiles) {
    Map<String, TomlClientConfigProfile> tomlProfiles = new TreeMap<>();
    for (Map.Entry<String, ClientConfigProfile> entry : profiles.entrySet()) {
      ClientConfigProfile profile = entry.getValue();
      TomlClientConfigProfile toml = new TomlClientConfigProfile();
      toml.address = profile.getAddress();
      toml.projectId = profile.getProjectId();
      toml.region = profile.getRegion();
      toml.apiKey = profile.getApiKey();
      toml.quotaProject = profile.getQuotaProject();
      toml.tls = fromClientConfigTLS(profile.getTls());
      if (profile.getMetadata() != null) {
        toml.grpcMeta = new TreeMap<>();
        for (String key : profile.getMetadata().keys()) {
          Iterable<String> values =
              profile.getMetadata().getAll(Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER));
          if (values != null) {
            toml.grpcMeta.put(key, String.join(",", values));
          }
        }
      }
      tomlProfiles.put(entry.getKey(), toml);
    }
    return new TomlClientConfig(tomlProfiles);
  }

  @Nullable
  private static TomlClientConfigTLS fromClientConfigTLS(@Nullable ClientConfigTLS tls) {
    if (tls == null) {
      return null;
    }
    TomlClientConfigTLS toml = new TomlClientConfigTLS();
    toml.disabled = tls.isDisabled();
    toml.clientCertPath = tls.getClientCertPath();
    toml.clientCertData = string(tls.getClientCertData());
    toml.clientKeyPath = tls.getClientKeyPath();
    toml.clientKeyData = string(tls.getClientKeyData());
    toml.serverCACertPath = tls.getServerCACertPath();
    toml.serverCACertData = string(tls.getServerCACertData());
    toml.serverName = tls.getServerName();
    toml.disableHostVerification = tls.isDisableHostVerification();
    return toml;
  }

  @Nullable
  private static byte[] bytes(@Nullable String s) {
    return s != null ? s.getBytes(StandardCharsets.UTF_8) : null;
  }

  @Nullable
  private static String string(@Nullable byte[] b) {
    return b != null ? new String(b, StandardCharsets.UTF_8) : null;
  }
}
