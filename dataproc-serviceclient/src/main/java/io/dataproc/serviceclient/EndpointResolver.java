package io.dataproc.serviceclient;

import static io.dataproc.conf.EnvironmentVariableNames.GOOGLE_API_USE_CLIENT_CERTIFICATE;
import static io.dataproc.conf.EnvironmentVariableNames.GOOGLE_API_USE_MTLS_ENDPOINT;

import com.google.common.base.Strings;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/** Picks the Dataproc endpoint from explicit settings and the mTLS environment variables. */
public final class EndpointResolver {

  public static final String DEFAULT_ENDPOINT = "dataproc.googleapis.com";
  public static final String DEFAULT_MTLS_ENDPOINT = "dataproc.mtls.googleapis.com";
  public static final int DEFAULT_PORT = 443;

  private static final Pattern GOOGLEAPIS_HOST =
      Pattern.compile(
          "^(?<name>[^.]+)(?<mtls>\\.mtls)?(?<sandbox>\\.sandbox)?(?<googledomain>\\.googleapis\\.com)?$");

  public enum MtlsEndpointMode {
    NEVER,
    AUTO,
    ALWAYS
  }

  private final Map<String, String> environment;

  public EndpointResolver(Map<String, String> environment) {
    this.environment = Objects.requireNonNull(environment, "environment");
  }

  public static EndpointResolver fromSystemEnvironment() {
    return new EndpointResolver(System.getenv());
  }

  /**
   * Rewrites a googleapis.com host into its mTLS variant. Hosts that are already mTLS or outside
   * googleapis.com are returned unchanged.
   */
  @Nullable
  public static String toMtlsEndpoint(@Nullable String endpoint) {
    if (Strings.isNullOrEmpty(endpoint)) {
      return endpoint;
    }
    Matcher m = GOOGLEAPIS_HOST.matcher(endpoint);
    if (!m.matches() || m.group("mtls") != null || m.group("googledomain") == null) {
      return endpoint;
    }
    if (m.group("sandbox") != null) {
      return endpoint.replace("sandbox.googleapis.com", "mtls.sandbox.googleapis.com");
    }
    return endpoint.replace(".googleapis.com", ".mtls.googleapis.com");
  }

  /** @throws IllegalArgumentException if the variable is neither {@code true} nor {@code false} */
  public boolean useClientCertificate() {
    String value = environment.get(GOOGLE_API_USE_CLIENT_CERTIFICATE);
    if (Strings.isNullOrEmpty(value)) {
      return false;
    }
    switch (value.toLowerCase(Locale.ROOT)) {
      case "true":
        return true;
      case "false":
        return false;
      default:
        throw new IllegalArgumentException(
            "Environment variable "
                + GOOGLE_API_USE_CLIENT_CERTIFICATE
                + " must be either `true` or `false`, got: "
                + value);
    }
  }

  /** @throws MutualTlsException if the variable is not one of never, auto or always */
  public MtlsEndpointMode mtlsEndpointMode() {
    String value = environment.get(GOOGLE_API_USE_MTLS_ENDPOINT);
    if (Strings.isNullOrEmpty(value)) {
      return MtlsEndpointMode.AUTO;
    }
    switch (value.toLowerCase(Locale.ROOT)) {
      case "never":
        return MtlsEndpointMode.NEVER;
      case "auto":
        return MtlsEndpointMode.AUTO;
      case "always":
        return MtlsEndpointMode.ALWAYS;
      default:
        throw new MutualTlsException(
            "Unsupported "
                + GOOGLE_API_USE_MTLS_ENDPOINT
                + " value: "
                + value
                + ". Accepted values: never, auto, always");
    }
  }

  /**
   * @param explicitEndpoint endpoint set by the user, always wins when present
   * @param hasClientCertificate whether a client certificate will be presented
   * @return host:port target
   */
  public String resolveTarget(@Nullable String explicitEndpoint, boolean hasClientCertificate) {
    String host;
    if (!Strings.isNullOrEmpty(explicitEndpoint)) {
      host = explicitEndpoint;
    } else {
      switch (mtlsEndpointMode()) {
        case ALWAYS:
          host = DEFAULT_MTLS_ENDPOINT;
          break;
        case AUTO:
          host = hasClientCertificate ? DEFAULT_MTLS_ENDPOINT : DEFAULT_ENDPOINT;
          break;
        default:
          host = DEFAULT_ENDPOINT;
      }
    }
    return withDefaultPort(host);
  }

  static String withDefaultPort(String host) {
    // a colon after the closing bracket of an IPv6 literal is a port separator
    int colon = host.lastIndexOf(':');
    if (colon >= 0 && colon > host.lastIndexOf(']')) {
      return host;
    }
    return host + ":" + DEFAULT_PORT;
  }

  static boolean isGoogleApisTarget(String target) {
    String host = target;
    int colon = host.lastIndexOf(':');
    if (colon > 0) {
      host = host.substring(0, colon);
    }
    return host.endsWith(".googleapis.com");
  }
}
