package io.dataproc.authorization;

import io.dataproc.serviceclient.GrpcMetadataProvider;
import io.grpc.Metadata;
import java.util.Objects;
import java.util.function.Supplier;

/** Attaches an API key as the {@code x-goog-api-key} header. */
public class ApiKeyGrpcMetadataProvider implements GrpcMetadataProvider {
  public static final Metadata.Key<String> API_KEY_HEADER_KEY =
      Metadata.Key.of("x-goog-api-key", Metadata.ASCII_STRING_MARSHALLER);

  private final Supplier<String> apiKeySupplier;

  public ApiKeyGrpcMetadataProvider(Supplier<String> apiKeySupplier) {
    this.apiKeySupplier = Objects.requireNonNull(apiKeySupplier, "apiKeySupplier");
  }

  @Override
  public Metadata getMetadata() {
    Metadata metadata = new Metadata();
    metadata.put(API_KEY_HEADER_KEY, apiKeySupplier.get());
    return metadata;
  }
}
