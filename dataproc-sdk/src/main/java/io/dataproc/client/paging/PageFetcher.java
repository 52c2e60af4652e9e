package io.dataproc.client.paging;

import io.grpc.Metadata;

/**
 * Issues one list call.
 *
 * @param <ReqT> list request
 * @param <RespT> list response, one page
 */
@FunctionalInterface
public interface PageFetcher<ReqT, RespT> {
  /**
   * @param request request carrying the page token of the page to fetch
   * @param metadata headers to attach to the call
   * @throws io.grpc.StatusRuntimeException if the call fails
   */
  RespT fetch(ReqT request, Metadata metadata);
}
