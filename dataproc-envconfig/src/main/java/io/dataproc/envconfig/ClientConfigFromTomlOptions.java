package io.dataproc.envconfig;

/** Options of {@link ClientConfig#fromToml(byte[], ClientConfigFromTomlOptions)}. */
public final class ClientConfigFromTomlOptions {
  public static Builder newBuilder() {
    return new Builder();
  }

  public static ClientConfigFromTomlOptions getDefaultInstance() {
    return new Builder().build();
  }

  private final boolean strictConfigFile;

  private ClientConfigFromTomlOptions(boolean strictConfigFile) {
    this.strictConfigFile = strictConfigFile;
  }

  public boolean isStrictConfigFile() {
    return strictConfigFile;
  }

  public static final class Builder {
    private boolean strictConfigFile;

    private Builder() {}

    /** Fail on unknown keys. Off by default. */
    public Builder setStrictConfigFile(boolean strictConfigFile) {
      this.strictConfigFile = strictConfigFile;
      return this;
    }

    public ClientConfigFromTomlOptions build() {
      return new ClientConfigFromTomlOptions(strictConfigFile);
    }
  }
}
