package io.dataproc.client.paging;

import io.dataproc.api.v1.Job;
import io.dataproc.api.v1.ListJobsRequest;
import io.dataproc.api.v1.ListJobsResponse;
import io.grpc.Metadata;
import java.util.List;

/** Pages through {@code ListJobs} results. */
public final class ListJobsPager extends Pager<ListJobsRequest, ListJobsResponse, Job> {

  public ListJobsPager(
      PageFetcher<ListJobsRequest, ListJobsResponse> fetcher,
      ListJobsRequest request,
      ListJobsResponse response,
      Metadata metadata) {
    super(fetcher, request, response, metadata);
  }

  @Override
  protected ListJobsRequest withPageToken(ListJobsRequest request, String pageToken) {
    return request.toBuilder().setPageToken(pageToken).build();
  }

  @Override
  protected String nextPageToken(ListJobsResponse response) {
    return response.getNextPageToken();
  }

  @Override
  protected List<Job> toElements(ListJobsResponse response) {
    return response.getJobsList();
  }

  /** Locations that could not be reached while listing the current page. */
  public List<String> getUnreachableList() {
    return getCurrentPage().getUnreachableList();
  }
}
