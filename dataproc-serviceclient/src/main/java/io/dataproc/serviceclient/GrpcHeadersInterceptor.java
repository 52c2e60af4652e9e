package io.dataproc.serviceclient;

import com.google.common.collect.ImmutableList;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall.SimpleForwardingClientCall;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import java.util.List;

/**
 * Adds the client identification headers, the configured static headers and the headers of every
 * {@link GrpcMetadataProvider} to each outgoing call. Providers are asked on every call.
 */
final class GrpcHeadersInterceptor implements ClientInterceptor {

  static final Metadata.Key<String> CLIENT_NAME_HEADER_KEY =
      Metadata.Key.of("client-name", Metadata.ASCII_STRING_MARSHALLER);
  static final Metadata.Key<String> CLIENT_VERSION_HEADER_KEY =
      Metadata.Key.of("client-version", Metadata.ASCII_STRING_MARSHALLER);

  static final String CLIENT_NAME = "dataproc-java";

  private final Metadata fixedHeaders;
  private final List<GrpcMetadataProvider> providers;

  GrpcHeadersInterceptor(Metadata staticHeaders, List<GrpcMetadataProvider> providers) {
    this.fixedHeaders = new Metadata();
    this.fixedHeaders.merge(staticHeaders);
    this.fixedHeaders.put(CLIENT_NAME_HEADER_KEY, CLIENT_NAME);
    this.fixedHeaders.put(CLIENT_VERSION_HEADER_KEY, Version.LIBRARY_VERSION);
    this.providers = ImmutableList.copyOf(providers);
  }

  @Override
  public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
      MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
    return new SimpleForwardingClientCall<ReqT, RespT>(next.newCall(method, callOptions)) {
      @Override
      public void start(Listener<RespT> responseListener, Metadata headers) {
        headers.merge(fixedHeaders);
        for (GrpcMetadataProvider provider : providers) {
          Metadata provided = provider.getMetadata();
          if (provided != null) {
            headers.merge(provided);
          }
        }
        super.start(responseListener, headers);
      }
    };
  }
}
