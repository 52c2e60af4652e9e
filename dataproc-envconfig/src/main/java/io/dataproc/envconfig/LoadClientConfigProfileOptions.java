package io.dataproc.envconfig;

import java.util.Map;
import javax.annotation.Nullable;

/** Options of {@link ClientConfigProfile#load(LoadClientConfigProfileOptions)}. */
public final class LoadClientConfigProfileOptions {
  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(LoadClientConfigProfileOptions options) {
    return new Builder(options);
  }

  private final @Nullable String configFileProfile;
  private final @Nullable String configFilePath;
  private final @Nullable byte[] configFileData;
  private final boolean configFileStrict;
  private final boolean disableFile;
  private final boolean disableEnv;
  private final @Nullable Map<String, String> envOverrides;

  private LoadClientConfigProfileOptions(Builder builder) {
    this.configFileProfile = builder.configFileProfile;
    this.configFilePath = builder.configFilePath;
    this.configFileData = builder.configFileData;
    this.configFileStrict = builder.configFileStrict;
    this.disableFile = builder.disableFile;
    this.disableEnv = builder.disableEnv;
    this.envOverrides = builder.envOverrides;
  }

  @Nullable
  public String getConfigFileProfile() {
    return configFileProfile;
  }

  @Nullable
  public String getConfigFilePath() {
    return configFilePath;
  }

  @Nullable
  public byte[] getConfigFileData() {
    return configFileData;
  }

  public boolean isConfigFileStrict() {
    return configFileStrict;
  }

  public boolean isDisableFile() {
    return disableFile;
  }

  public boolean isDisableEnv() {
    return disableEnv;
  }

  @Nullable
  public Map<String, String> getEnvOverrides() {
    return envOverrides;
  }

  public static final class Builder {
    private String configFileProfile;
    private String configFilePath;
    private byte[] configFileData;
    private boolean configFileStrict;
    private boolean disableFile;
    private boolean disableEnv;
    private Map<String, String> envOverrides;

    private Builder() {}

    private Builder(LoadClientConfigProfileOptions options) {
      this.configFileProfile = options.configFileProfile;
      this.configFilePath = options.configFilePath;
      this.configFileData = options.configFileData;
      this.configFileStrict = options.configFileStrict;
      this.disableFile = options.disableFile;
      this.disableEnv = options.disableEnv;
      this.envOverrides = options.envOverrides;
    }

    /**
     * Profile to pick from the file. Defaults to {@code DATAPROC_PROFILE}, then to {@code
     * default}. Loading fails if a profile named here or in the environment is missing.
     */
    public Builder setConfigFileProfile(String configFileProfile) {
      this.configFileProfile = configFileProfile;
      return this;
    }

    /** See {@link LoadClientConfigOptions.Builder#setConfigFilePath}. */
    public Builder setConfigFilePath(String configFilePath) {
      this.configFilePath = configFilePath;
      return this;
    }

    public Builder setConfigFileData(byte[] configFileData) {
      this.configFileData = configFileData;
      return this;
    }

    public Builder setConfigFileStrict(boolean configFileStrict) {
      this.configFileStrict = configFileStrict;
      return this;
    }

    /** Skip the file and build the profile from the environment only. */
    public Builder setDisableFile(boolean disableFile) {
      this.disableFile = disableFile;
      return this;
    }

    /**
     * Don't apply {@code DATAPROC_*} overrides. {@code DATAPROC_CONFIG_FILE} and {@code
     * DATAPROC_PROFILE} are still read. Can't be combined with {@link #setDisableFile}.
     */
    public Builder setDisableEnv(boolean disableEnv) {
      this.disableEnv = disableEnv;
      return this;
    }

    public Builder setEnvOverrides(Map<String, String> envOverrides) {
      this.envOverrides = envOverrides;
      return this;
    }

    public LoadClientConfigProfileOptions build() {
      return new LoadClientConfigProfileOptions(this);
    }
  }
}
