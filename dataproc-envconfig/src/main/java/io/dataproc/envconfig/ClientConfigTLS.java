package io.dataproc.envconfig;

import java.util.Arrays;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * TLS settings of a profile. Each piece of key material comes either from a path or from inline
 * PEM data, the path wins if both are set.
 */
public final class ClientConfigTLS {
  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(ClientConfigTLS config) {
    return new Builder(config);
  }

  public static ClientConfigTLS getDefaultInstance() {
    return new Builder().build();
  }

  private final @Nullable Boolean disabled;
  private final @Nullable String clientCertPath;
  private final @Nullable byte[] clientCertData;
  private final @Nullable String clientKeyPath;
  private final @Nullable byte[] clientKeyData;
  private final @Nullable String serverCACertPath;
  private final @Nullable byte[] serverCACertData;
  private final @Nullable String serverName;
  private final @Nullable Boolean disableHostVerification;

  private ClientConfigTLS(Builder builder) {
    this.disabled = builder.disabled;
    this.clientCertPath = builder.clientCertPath;
    this.clientCertData = builder.clientCertData;
    this.clientKeyPath = builder.clientKeyPath;
    this.clientKeyData = builder.clientKeyData;
    this.serverCACertPath = builder.serverCACertPath;
    this.serverCACertData = builder.serverCACertData;
    this.serverName = builder.serverName;
    this.disableHostVerification = builder.disableHostVerification;
  }

  /** @return null if unset, TLS is then enabled by the presence of a TLS section */
  @Nullable
  public Boolean isDisabled() {
    return disabled;
  }

  /** True unless explicitly disabled. */
  public boolean isEnabled() {
    return !Boolean.TRUE.equals(disabled);
  }

  @Nullable
  public String getClientCertPath() {
    return clientCertPath;
  }

  @Nullable
  public byte[] getClientCertData() {
    return clientCertData;
  }

  @Nullable
  public String getClientKeyPath() {
    return clientKeyPath;
  }

  @Nullable
  public byte[] getClientKeyData() {
    return clientKeyData;
  }

  @Nullable
  public String getServerCACertPath() {
    return serverCACertPath;
  }

  @Nullable
  public byte[] getServerCACertData() {
    return serverCACertData;
  }

  @Nullable
  public String getServerName() {
    return serverName;
  }

  @Nullable
  public Boolean isDisableHostVerification() {
    return disableHostVerification;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ClientConfigTLS that = (ClientConfigTLS) o;
    return Objects.equals(disabled, that.disabled)
        && Objects.equals(clientCertPath, that.clientCertPath)
        && Arrays.equals(clientCertData, that.clientCertData)
        && Objects.equals(clientKeyPath, that.clientKeyPath)
        && Arrays.equals(clientKeyData, that.clientKeyData)
        && Objects.equals(serverCACertPath, that.serverCACertPath)
        && Arrays.equals(serverCACertData, that.serverCACertData)
        && Objects.equals(serverName, that.serverName)
        && Objects.equals(disableHostVerification, that.disableHostVerification);
  }

  @Override
  public int hashCode() {
    int result =
        Objects.hash(
            disabled,
            clientCertPath,
            clientKeyPath,
            serverCACertPath,
            serverName,
            disableHostVerification);
    result = 31 * result + Arrays.hashCode(clientCertData);
    result = 31 * result + Arrays.hashCode(clientKeyData);
    return 31 * result + Arrays.hashCode(serverCACertData);
  }

  // key material is left out
  @Override
  public String toString() {
    return "ClientConfigTLS{"
        + "disabled="
        + disabled
        + ", clientCertPath='"
        + clientCertPath
        + '\''
        + ", clientKeyPath='"
        + clientKeyPath
        + '\''
        + ", serverCACertPath='"
        + serverCACertPath
        + '\''
        + ", serverName='"
        + serverName
        + '\''
        + ", disableHostVerification="
        + disableHostVerification
        + '}';
  }

  public static final class Builder {
    private Boolean disabled;
    private String clientCertPath;
    private byte[] clientCertData;
    private String clientKeyPath;
    private byte[] clientKeyData;
    private String serverCACertPath;
    private byte[] serverCACertData;
    private String serverName;
    private Boolean disableHostVerification;

    private Builder() {}

    private Builder(ClientConfigTLS config) {
      this.disabled = config.disabled;
      this.clientCertPath = config.clientCertPath;
      this.clientCertData = config.clientCertData;
      this.clientKeyPath = config.clientKeyPath;
      this.clientKeyData = config.clientKeyData;
      this.serverCACertPath = config.serverCACertPath;
      this.serverCACertData = config.serverCACertData;
      this.serverName = config.serverName;
      this.disableHostVerification = config.disableHostVerification;
    }

    public Builder setDisabled(Boolean disabled) {
      this.disabled = disabled;
      return this;
    }

    /** PEM client certificate chain file. */
    public Builder setClientCertPath(String clientCertPath) {
      this.clientCertPath = clientCertPath;
      return this;
    }

    public Builder setClientCertData(byte[] clientCertData) {
      this.clientCertData = clientCertData;
      return this;
    }

    /** PKCS#8 PEM client key file. */
    public Builder setClientKeyPath(String clientKeyPath) {
      this.clientKeyPath = clientKeyPath;
      return this;
    }

    public Builder setClientKeyData(byte[] clientKeyData) {
      this.clientKeyData = clientKeyData;
      return this;
    }

    /** Replaces the JVM trust store for verifying the server. */
    public Builder setServerCACertPath(String serverCACertPath) {
      this.serverCACertPath = serverCACertPath;
      return this;
    }

    public Builder setServerCACertData(byte[] serverCACertData) {
      this.serverCACertData = serverCACertData;
      return this;
    }

    /** Authority to verify the server certificate against, the target host if unset. */
    public Builder setServerName(String serverName) {
      this.serverName = serverName;
      return this;
    }

    /** Accept any server certificate. Ignored if a server CA certificate is set. */
    public Builder setDisableHostVerification(Boolean disableHostVerification) {
      this.disableHostVerification = disableHostVerification;
      return this;
    }

    public ClientConfigTLS build() {
      return new ClientConfigTLS(this);
    }
  }
}
