package io.dataproc.client.paging;

import io.dataproc.api.v1.Cluster;
import io.dataproc.api.v1.ListClustersRequest;
import io.dataproc.api.v1.ListClustersResponse;
import io.grpc.Metadata;
import java.util.List;

/** Asynchronous {@link ListClustersPager}. */
public final class ListClustersAsyncPager
    extends AsyncPager<ListClustersRequest, ListClustersResponse, Cluster> {

  public ListClustersAsyncPager(
      AsyncPageFetcher<ListClustersRequest, ListClustersResponse> fetcher,
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
