package io.dataproc.client.paging;

import io.dataproc.api.v1.Cluster;
import io.dataproc.api.v1.ListClustersRequest;
import io.dataproc.api.v1.ListClustersResponse;
import io.grpc.Metadata;
import java.util.List;

/**
 * Pages through {@code ListClusters} results. Iterating yields {@link Cluster} items across all
 * pages, {@link #pages()} yields the raw responses.
 */
public final class ListClustersPager
    extends Pager<ListClustersRequest, ListClustersResponse, Cluster> {

  public ListClustersPager(
      PageFetcher<ListClustersRequest, ListClustersResponse> fetcher,
      ListClustersRequest request,
      ListClustersResponse response,
      Metadata metadata) {
    super(fetcher, request, response, metadata);
  }

  @Override
  protected ListClustersRequest withPageToken(ListClustersRequest request, String pageToken) {
    return request.toBuilder().setPageToken(pageToken).build();
  }

  @Override
  protected String nextPageToken(ListClustersResponse response) {
    return response.getNextPageToken();
  }

  @Override
  protected List<Cluster> toElements(ListClustersResponse response) {
    return response.getClustersList();
  }
}
