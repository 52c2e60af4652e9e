package io.dataproc.envconfig;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import io.dataproc.conf.EnvironmentVariableNames;
import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All profiles of a client configuration file:
 *
 * <pre>
 * [profile.default]
 * address = "dataproc.googleapis.com:443"
 * project_id = "my-project"
 * region = "us-central1"
 *
 * [profile.default.grpc_meta]
 * x-request-reason = "audit"
 * </pre>
 */
public final class ClientConfig {
  private static final Logger log = LoggerFactory.getLogger(ClientConfig.class);

  private static final TomlMapper MAPPER = new TomlMapper();

  private final Map<String, ClientConfigProfile> profiles;

  public ClientConfig(Map<String, ClientConfigProfile> profiles) {
    this.profiles = Collections.unmodifiableMap(profiles);
  }

  /** {@code $HOME/.config/dataproc/dataproc.toml} */
  static String getDefaultConfigFilePath() {
    String home = System.getProperty("user.home");
    if (home == null || home.isEmpty()) {
      throw new IllegalStateException("Unable to determine the user home directory");
    }
    return Paths.get(home, ".config", "dataproc", "dataproc.toml").toString();
  }

  /** Loads the profiles with default options. */
  public static ClientConfig load() throws IOException {
    return load(LoadClientConfigOptions.getDefaultInstance());
  }

  /**
   * Loads all profiles as written in the file. Environment overrides are not applied, use {@link
   * ClientConfigProfile#load} for a single profile with overrides.
   *
   * @throws IOException if the file can't be read or parsed
   * @throws IllegalArgumentException if both file data and a file path are set
   */
  public static ClientConfig load(LoadClientConfigOptions options) throws IOException {
    ObjectReader reader = reader(options.isStrictConfigFile());
    byte[] data = options.getConfigFileData();
    if (data != null && data.length > 0) {
      if (options.getConfigFilePath() != null && !options.getConfigFilePath().isEmpty()) {
        throw new IllegalArgumentException(
            "Only one of the 'configFileData' or 'configFilePath' options can be set");
      }
      return new ClientConfig(ClientConfigToml.toClientProfiles(reader.readValue(data)));
    }
    String file = options.getConfigFilePath();
    if (file == null || file.isEmpty()) {
      Map<String, String> env =
          options.getEnvOverrides() != null ? options.getEnvOverrides() : System.getenv();
      // empty counts as unset
      file = env.get(EnvironmentVariableNames.DATAPROC_CONFIG_FILE);
    }
    if (file == null || file.isEmpty()) {
      file = getDefaultConfigFilePath();
    }
    log.debug("Loading client config from {}", file);
    return new ClientConfig(ClientConfigToml.toClientProfiles(reader.readValue(new File(file))));
  }

  /** Parses TOML content. */
  public static ClientConfig fromToml(byte[] toml) throws IOException {
    return fromToml(toml, ClientConfigFromTomlOptions.getDefaultInstance());
  }

  public static ClientConfig fromToml(byte[] toml, ClientConfigFromTomlOptions options)
      throws IOException {
    return new ClientConfig(
        ClientConfigToml.toClientProfiles(
            reader(options.isStrictConfigFile()).readValue(toml)));
  }

  /** Serializes the profiles in the format read by {@link #fromToml}. */
  public byte[] toTomlAsBytes() throws IOException {
    return MAPPER.writeValueAsBytes(ClientConfigToml.fromClientProfiles(profiles));
  }

  private static ObjectReader reader(boolean strict) {
    ObjectReader reader = MAPPER.readerFor(ClientConfigToml.TomlClientConfig.class);
    return strict
        ? reader.with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        : reader.without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /** Profiles by name, never null. */
  public Map<String, ClientConfigProfile> getProfiles() {
    return profiles;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return profiles.equals(((ClientConfig) o).profiles);
  }

  @Override
  public int hashCode() {
    return profiles.hashCode();
  }

  @Override
  public String toString() {
    return "ClientConfig{profiles=" + profiles + '}';
  }
}
