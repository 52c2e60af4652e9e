package io.dataproc.client;

import com.google.common.collect.ImmutableMap;
import io.dataproc.api.v1.CancelJobRequest;
import io.dataproc.api.v1.DeleteJobRequest;
import io.dataproc.api.v1.GetJobRequest;
import io.dataproc.api.v1.Job;
import io.dataproc.api.v1.ListJobsRequest;
import io.dataproc.api.v1.ListJobsResponse;
import io.dataproc.client.paging.AsyncPageFetcher;
import io.dataproc.client.paging.ListJobsAsyncPager;
import io.dataproc.client.paging.ListJobsPager;
import io.dataproc.client.paging.PageFetcher;
import io.dataproc.internal.client.CallMetadata;
import io.dataproc.internal.client.ServiceCalls;
import io.dataproc.serviceclient.JobControllerStubs;
import io.grpc.Metadata;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class JobControllerClientImpl implements JobControllerClient {
  private static final Logger log = LoggerFactory.getLogger(JobControllerClientImpl.class);

  private final JobControllerStubs stubs;
  private final DataprocClientOptions options;
  private final ServiceCalls calls;

  JobControllerClientImpl(JobControllerStubs stubs, DataprocClientOptions options) {
    this.stubs = Objects.requireNonNull(stubs, "stubs");
    this.options =
        DataprocClientOptions.newBuilder(Objects.requireNonNull(options, "options"))
            .validateAndBuildWithDefaults();
    this.calls = new ServiceCalls(ClientRetryOptions.resolve(this.options, stubs));
    log.debug("Created JobControllerClient, identity={}", this.options.getIdentity());
  }

  @Override
  public JobControllerStubs getServiceStubs() {
    return stubs;
  }

  @Override
  public DataprocClientOptions getOptions() {
    return options;
  }

  @Override
  public Job getJob(GetJobRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    return calls.call(stubs.blockingStub(), metadata, s -> s.getJob(request));
  }

  @Override
  public Job getJob(String projectId, String region, String jobId) {
    return getJob(
        GetJobRequest.newBuilder()
            .setProjectId(projectId)
            .setRegion(region)
            .setJobId(jobId)
            .build());
  }

  @Override
  public ListJobsPager listJobs(ListJobsRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    PageFetcher<ListJobsRequest, ListJobsResponse> fetcher =
        (r, md) -> calls.call(stubs.blockingStub(), md, s -> s.listJobs(r));
    ListJobsResponse first = fetcher.fetch(request, metadata);
    return new ListJobsPager(fetcher, request, first, metadata);
  }

  @Override
  public ListJobsPager listJobs(String projectId, String region) {
    return listJobs(ListJobsRequest.newBuilder().setProjectId(projectId).setRegion(region).build());
  }

  @Override
  public ListJobsPager listJobs(String projectId, String region, String filter) {
    return listJobs(
        ListJobsRequest.newBuilder()
            .setProjectId(projectId)
            .setRegion(region)
            .setFilter(filter)
            .build());
  }

  @Override
  public Job cancelJob(CancelJobRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    return calls.call(stubs.blockingStub(), metadata, s -> s.cancelJob(request));
  }

  @Override
  public Job cancelJob(String projectId, String region, String jobId) {
    return cancelJob(
        CancelJobRequest.newBuilder()
            .setProjectId(projectId)
            .setRegion(region)
            .setJobId(jobId)
            .build());
  }

  @Override
  public void deleteJob(DeleteJobRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    calls.call(stubs.blockingStub(), metadata, s -> s.deleteJob(request));
  }

  @Override
  public void deleteJob(String projectId, String region, String jobId) {
    deleteJob(
        DeleteJobRequest.newBuilder()
            .setProjectId(projectId)
            .setRegion(region)
            .setJobId(jobId)
            .build());
  }

  @Override
  public CompletableFuture<Job> getJobAsync(GetJobRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    return calls.callAsync(stubs.futureStub(), metadata, s -> s.getJob(request));
  }

  @Override
  public CompletableFuture<ListJobsAsyncPager> listJobsAsync(ListJobsRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    AsyncPageFetcher<ListJobsRequest, ListJobsResponse> fetcher =
        (r, md) -> calls.callAsync(stubs.futureStub(), md, s -> s.listJobs(r));
    return ServiceCalls.thenApplyCancellable(
        fetcher.fetch(request, metadata),
        first -> new ListJobsAsyncPager(fetcher, request, first, metadata));
  }

  @Override
  public CompletableFuture<Job> cancelJobAsync(CancelJobRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    return calls.callAsync(stubs.futureStub(), metadata, s -> s.cancelJob(request));
  }

  @Override
  public CompletableFuture<Void> deleteJobAsync(DeleteJobRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    return ServiceCalls.thenApplyCancellable(
        calls.callAsync(stubs.futureStub(), metadata, s -> s.deleteJob(request)), empty -> null);
  }

  private Metadata metadata(String projectId, String region) {
    return CallMetadata.of(
        options.getQuotaProjectId(), ImmutableMap.of("project_id", projectId, "region", region));
  }

  @Override
  public String toString() {
    return "JobControllerClient{" + stubs.getOptions().getTarget() + "}";
  }
}
