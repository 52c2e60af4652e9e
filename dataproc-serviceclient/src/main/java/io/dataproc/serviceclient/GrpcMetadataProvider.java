package io.dataproc.serviceclient;

import io.grpc.Metadata;

/**
 * Supplies gRPC headers to attach to every request. Called once per call, implementations have to
 * be thread-safe.
 */
@FunctionalInterface
public interface GrpcMetadataProvider {
  Metadata getMetadata();
}
