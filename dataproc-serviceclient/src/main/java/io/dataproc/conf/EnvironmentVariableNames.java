package io.dataproc.conf;

public final class EnvironmentVariableNames {
  /**
   * Selects the endpoint: {@code never} uses the regular endpoint, {@code always} the mTLS one and
   * {@code auto} (the default) the mTLS one only if a client certificate is in use.
   */
  public static final String GOOGLE_API_USE_MTLS_ENDPOINT = "GOOGLE_API_USE_MTLS_ENDPOINT";

  /** {@code true} or {@code false}. Enables presenting a client certificate. */
  public static final String GOOGLE_API_USE_CLIENT_CERTIFICATE = "GOOGLE_API_USE_CLIENT_CERTIFICATE";

  /** Path of the TOML client configuration file. */
  public static final String DATAPROC_CONFIG_FILE = "DATAPROC_CONFIG_FILE";

  /** Name of the profile to load from the client configuration file. */
  public static final String DATAPROC_PROFILE = "DATAPROC_PROFILE";

  public static final String DATAPROC_ADDRESS = "DATAPROC_ADDRESS";
  public static final String DATAPROC_PROJECT_ID = "DATAPROC_PROJECT_ID";
  public static final String DATAPROC_REGION = "DATAPROC_REGION";
  public static final String DATAPROC_API_KEY = "DATAPROC_API_KEY";
  public static final String DATAPROC_QUOTA_PROJECT = "DATAPROC_QUOTA_PROJECT";

  public static final String DATAPROC_TLS = "DATAPROC_TLS";
  public static final String DATAPROC_TLS_CLIENT_CERT_PATH = "DATAPROC_TLS_CLIENT_CERT_PATH";
  public static final String DATAPROC_TLS_CLIENT_CERT_DATA = "DATAPROC_TLS_CLIENT_CERT_DATA";
  public static final String DATAPROC_TLS_CLIENT_KEY_PATH = "DATAPROC_TLS_CLIENT_KEY_PATH";
  public static final String DATAPROC_TLS_CLIENT_KEY_DATA = "DATAPROC_TLS_CLIENT_KEY_DATA";
  public static final String DATAPROC_TLS_SERVER_CA_CERT_PATH = "DATAPROC_TLS_SERVER_CA_CERT_PATH";
  public static final String DATAPROC_TLS_SERVER_CA_CERT_DATA = "DATAPROC_TLS_SERVER_CA_CERT_DATA";
  public static final String DATAPROC_TLS_SERVER_NAME = "DATAPROC_TLS_SERVER_NAME";
  public static final String DATAPROC_TLS_DISABLE_HOST_VERIFICATION =
      "DATAPROC_TLS_DISABLE_HOST_VERIFICATION";

  /** Prefix of per-header overrides, {@code DATAPROC_GRPC_META_X_FOO=bar} sets {@code x-foo}. */
  public static final String DATAPROC_GRPC_META_PREFIX = "DATAPROC_GRPC_META_";

  private EnvironmentVariableNames() {}
}
