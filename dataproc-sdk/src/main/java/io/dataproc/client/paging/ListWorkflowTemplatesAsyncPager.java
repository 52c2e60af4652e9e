package io.dataproc.client.paging;

import io.dataproc.api.v1.ListWorkflowTemplatesRequest;
import io.dataproc.api.v1.ListWorkflowTemplatesResponse;
import io.dataproc.api.v1.WorkflowTemplate;
import io.grpc.Metadata;
import java.util.List;

public final class ListWorkflowTemplatesAsyncPager
    extends AsyncPager<ListWorkflowTemplatesRequest, ListWorkflowTemplatesResponse, WorkflowTemplate> {

  public ListWorkflowTemplatesAsyncPager(
      AsyncPageFetcher<ListWorkflowTemplatesRequest, ListWorkflowTemplatesResponse> fetcher,
      ListWorkflowTemplatesRequest request,
      ListWorkflowTemplatesResponse response,
      Metadata metadata) {
    super(fetcher, request, response, metadata);
  }

  @Override
  protected ListWorkflowTemplatesRequest withPageToken(ListWorkflowTemplatesRequest request, String pageToken) {
    return request.toBuilder().setPageToken(pageToken).build();
  }

  @Override
  protected String nextPageToken(ListWorkflowTemplatesResponse response) {
    return response.getNextPageToken();
  }

  @Override
  protected List<WorkflowTemplate> toElements(ListWorkflowTemplatesResponse response) {
    return response.getTemplatesList();
  }

  /** Locations that could not be reached while listing the current page. */
  public List<String> getUnreachableList() {
    return getCurrentPage().getUnreachableList();
  }
}
