package io.dataproc.internal.client;

import com.google.common.base.Joiner;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import io.grpc.Metadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Headers of a single client call, shared by every page fetch of a list call. */
public final class CallMetadata {

  /** Routing parameters the frontend uses to pick the regional backend. */
  public static final Metadata.Key<String> REQUEST_PARAMS_HEADER_KEY =
      Metadata.Key.of("x-goog-request-params", Metadata.ASCII_STRING_MARSHALLER);

  public static final Metadata.Key<String> USER_PROJECT_HEADER_KEY =
      Metadata.Key.of("x-goog-user-project", Metadata.ASCII_STRING_MARSHALLER);

  private static final Escaper ESCAPER = UrlEscapers.urlFormParameterEscaper();

  private CallMetadata() {}

  /**
   * @param quotaProjectId sent as {@code x-goog-user-project} if not null
   * @param routingParams routing fields of the request in wire order, empty values are skipped
   */
  public static Metadata of(@Nullable String quotaProjectId, Map<String, String> routingParams) {
    Metadata metadata = new Metadata();
    String requestParams = requestParams(routingParams);
    if (!requestParams.isEmpty()) {
      metadata.put(REQUEST_PARAMS_HEADER_KEY, requestParams);
    }
    if (quotaProjectId != null) {
      metadata.put(USER_PROJECT_HEADER_KEY, quotaProjectId);
    }
    return metadata;
  }

  static String requestParams(Map<String, String> routingParams) {
    List<String> pairs = new ArrayList<>(routingParams.size());
    for (Map.Entry<String, String> param : routingParams.entrySet()) {
      if (param.getValue() == null || param.getValue().isEmpty()) {
        continue;
      }
      pairs.add(ESCAPER.escape(param.getKey()) + "=" + ESCAPER.escape(param.getValue()));
    }
    return Joiner.on('&').join(pairs);
  }
}
