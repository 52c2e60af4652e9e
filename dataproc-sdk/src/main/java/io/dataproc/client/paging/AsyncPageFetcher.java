package io.dataproc.client.paging;

import io.grpc.Metadata;
import java.util.concurrent.CompletableFuture;

/** Asynchronous counterpart of {@link PageFetcher}. Failures are reported through the future. */
@FunctionalInterface
public interface AsyncPageFetcher<ReqT, RespT> {
  CompletableFuture<RespT> fetch(ReqT request, Metadata metadata);
}
