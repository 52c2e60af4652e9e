package io.dataproc.client;

import com.google.common.collect.ImmutableMap;
import io.dataproc.api.v1.DeleteWorkflowTemplateRequest;
import io.dataproc.api.v1.GetWorkflowTemplateRequest;
import io.dataproc.api.v1.ListWorkflowTemplatesRequest;
import io.dataproc.api.v1.ListWorkflowTemplatesResponse;
import io.dataproc.api.v1.WorkflowTemplate;
import io.dataproc.client.paging.AsyncPageFetcher;
import io.dataproc.client.paging.ListWorkflowTemplatesAsyncPager;
import io.dataproc.client.paging.ListWorkflowTemplatesPager;
import io.dataproc.client.paging.PageFetcher;
import io.dataproc.internal.client.CallMetadata;
import io.dataproc.internal.client.ServiceCalls;
import io.dataproc.serviceclient.WorkflowTemplateServiceStubs;
import io.grpc.Metadata;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class WorkflowTemplateServiceClientImpl implements WorkflowTemplateServiceClient {
  private static final Logger log =
      LoggerFactory.getLogger(WorkflowTemplateServiceClientImpl.class);

  private final WorkflowTemplateServiceStubs stubs;
  private final DataprocClientOptions options;
  private final ServiceCalls calls;

  WorkflowTemplateServiceClientImpl(
      WorkflowTemplateServiceStubs stubs, DataprocClientOptions options) {
    this.stubs = Objects.requireNonNull(stubs, "stubs");
    this.options =
        DataprocClientOptions.newBuilder(Objects.requireNonNull(options, "options"))
            .validateAndBuildWithDefaults();
    this.calls = new ServiceCalls(ClientRetryOptions.resolve(this.options, stubs));
    log.debug("Created WorkflowTemplateServiceClient, identity={}", this.options.getIdentity());
  }

  @Override
  public WorkflowTemplateServiceStubs getServiceStubs() {
    return stubs;
  }

  @Override
  public DataprocClientOptions getOptions() {
    return options;
  }

  @Override
  public WorkflowTemplate getWorkflowTemplate(GetWorkflowTemplateRequest request) {
    Metadata metadata = metadata("name", request.getName());
    return calls.call(stubs.blockingStub(), metadata, s -> s.getWorkflowTemplate(request));
  }

  @Override
  public WorkflowTemplate getWorkflowTemplate(String name) {
    return getWorkflowTemplate(GetWorkflowTemplateRequest.newBuilder().setName(name).build());
  }

  @Override
  public ListWorkflowTemplatesPager listWorkflowTemplates(ListWorkflowTemplatesRequest request) {
    Metadata metadata = metadata("parent", request.getParent());
    PageFetcher<ListWorkflowTemplatesRequest, ListWorkflowTemplatesResponse> fetcher =
        (r, md) -> calls.call(stubs.blockingStub(), md, s -> s.listWorkflowTemplates(r));
    ListWorkflowTemplatesResponse first = fetcher.fetch(request, metadata);
    return new ListWorkflowTemplatesPager(fetcher, request, first, metadata);
  }

  @Override
  public ListWorkflowTemplatesPager listWorkflowTemplates(String parent) {
    return listWorkflowTemplates(
        ListWorkflowTemplatesRequest.newBuilder().setParent(parent).build());
  }

  @Override
  public void deleteWorkflowTemplate(DeleteWorkflowTemplateRequest request) {
    Metadata metadata = metadata("name", request.getName());
    calls.call(stubs.blockingStub(), metadata, s -> s.deleteWorkflowTemplate(request));
  }

  @Override
  public void deleteWorkflowTemplate(String name) {
    deleteWorkflowTemplate(DeleteWorkflowTemplateRequest.newBuilder().setName(name).build());
  }

  @Override
  public CompletableFuture<WorkflowTemplate> getWorkflowTemplateAsync(
      GetWorkflowTemplateRequest request) {
    Metadata metadata = metadata("name", request.getName());
    return calls.callAsync(stubs.futureStub(), metadata, s -> s.getWorkflowTemplate(request));
  }

  @Override
  public CompletableFuture<ListWorkflowTemplatesAsyncPager> listWorkflowTemplatesAsync(
      ListWorkflowTemplatesRequest request) {
    Metadata metadata = metadata("parent", request.getParent());
    AsyncPageFetcher<ListWorkflowTemplatesRequest, ListWorkflowTemplatesResponse> fetcher =
        (r, md) -> calls.callAsync(stubs.futureStub(), md, s -> s.listWorkflowTemplates(r));
    return ServiceCalls.thenApplyCancellable(
        fetcher.fetch(request, metadata),
        first -> new ListWorkflowTemplatesAsyncPager(fetcher, request, first, metadata));
  }

  @Override
  public CompletableFuture<Void> deleteWorkflowTemplateAsync(
      DeleteWorkflowTemplateRequest request) {
    Metadata metadata = metadata("name", request.getName());
    return ServiceCalls.thenApplyCancellable(
        calls.callAsync(stubs.futureStub(), metadata, s -> s.deleteWorkflowTemplate(request)),
        empty -> null);
  }

  private Metadata metadata(String field, String value) {
    return CallMetadata.of(options.getQuotaProjectId(), ImmutableMap.of(field, value));
  }

  @Override
  public String toString() {
    return "WorkflowTemplateServiceClient{" + stubs.getOptions().getTarget() + "}";
  }
}
