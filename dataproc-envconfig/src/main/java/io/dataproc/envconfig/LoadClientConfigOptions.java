package io.dataproc.envconfig;

import java.util.Map;
import javax.annotation.Nullable;

/** Options of {@link ClientConfig#load(LoadClientConfigOptions)}. */
public final class LoadClientConfigOptions {
  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(LoadClientConfigOptions options) {
    return new Builder(options);
  }

  public static LoadClientConfigOptions getDefaultInstance() {
    return new Builder().build();
  }

  private final @Nullable String configFilePath;
  private final @Nullable byte[] configFileData;
  private final boolean strictConfigFile;
  private final @Nullable Map<String, String> envOverrides;

  private LoadClientConfigOptions(Builder builder) {
    this.configFilePath = builder.configFilePath;
    this.configFileData = builder.configFileData;
    this.strictConfigFile = builder.strictConfigFile;
    this.envOverrides = builder.envOverrides;
  }

  @Nullable
  public String getConfigFilePath() {
    return configFilePath;
  }

  @Nullable
  public byte[] getConfigFileData() {
    return configFileData;
  }

  public boolean isStrictConfigFile() {
    return strictConfigFile;
  }

  /** @return null if the process environment applies */
  @Nullable
  public Map<String, String> getEnvOverrides() {
    return envOverrides;
  }

  public static final class Builder {
    private String configFilePath;
    private byte[] configFileData;
    private boolean strictConfigFile;
    private Map<String, String> envOverrides;

    private Builder() {}

    private Builder(LoadClientConfigOptions options) {
      this.configFilePath = options.configFilePath;
      this.configFileData = options.configFileData;
      this.strictConfigFile = options.strictConfigFile;
      this.envOverrides = options.envOverrides;
    }

    /**
     * TOML file to read. Defaults to {@code DATAPROC_CONFIG_FILE}, then to {@code
     * ~/.config/dataproc/dataproc.toml}. Can't be combined with {@link #setConfigFileData}.
     */
    public Builder setConfigFilePath(String configFilePath) {
      this.configFilePath = configFilePath;
      return this;
    }

    /** TOML content to parse instead of reading a file. */
    public Builder setConfigFileData(byte[] configFileData) {
      this.configFileData = configFileData;
      return this;
    }

    /** Fail on unknown keys. Off by default. */
    public Builder setStrictConfigFile(boolean strictConfigFile) {
      this.strictConfigFile = strictConfigFile;
      return this;
    }

    /** Environment to use instead of the process environment. */
    public Builder setEnvOverrides(Map<String, String> envOverrides) {
      this.envOverrides = envOverrides;
      return this;
    }

    public LoadClientConfigOptions build() {
      return new LoadClientConfigOptions(this);
    }
  }
}
