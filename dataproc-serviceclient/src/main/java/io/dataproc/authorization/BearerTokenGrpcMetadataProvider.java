package io.dataproc.authorization;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.dataproc.serviceclient.GrpcMetadataProvider;
import io.grpc.Metadata;
import java.util.function.Supplier;

/** Attaches an OAuth access token as {@code authorization: Bearer <token>}. */
public final class BearerTokenGrpcMetadataProvider implements GrpcMetadataProvider {
  public static final Metadata.Key<String> AUTHORIZATION_HEADER_KEY =
      Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);

  private final Supplier<String> tokenSupplier;

  /** @param tokenSupplier returns the bare token, without the {@code Bearer} scheme */
  public BearerTokenGrpcMetadataProvider(Supplier<String> tokenSupplier) {
    this.tokenSupplier = Preconditions.checkNotNull(tokenSupplier, "tokenSupplier");
  }

  /** @throws IllegalStateException if the supplier returns no token */
  @Override
  public Metadata getMetadata() {
    String token = tokenSupplier.get();
    Preconditions.checkState(!Strings.isNullOrEmpty(token), "token supplier returned no token");
    Metadata metadata = new Metadata();
    metadata.put(AUTHORIZATION_HEADER_KEY, "Bearer " + token);
    return metadata;
  }
}
