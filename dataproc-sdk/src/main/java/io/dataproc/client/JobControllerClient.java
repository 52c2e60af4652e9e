package io.dataproc.client;

import io.dataproc.api.v1.CancelJobRequest;
import io.dataproc.api.v1.DeleteJobRequest;
import io.dataproc.api.v1.GetJobRequest;
import io.dataproc.api.v1.Job;
import io.dataproc.api.v1.ListJobsRequest;
import io.dataproc.client.paging.ListJobsAsyncPager;
import io.dataproc.client.paging.ListJobsPager;
import io.dataproc.serviceclient.JobControllerStubs;
import java.util.concurrent.CompletableFuture;

/**
 * Client of the {@code JobController} service. Calls are retried according to the client's retry
 * options, list calls once per page.
 */
public interface JobControllerClient {

  static JobControllerClient newInstance(JobControllerStubs stubs) {
    return newInstance(stubs, DataprocClientOptions.getDefaultInstance());
  }

  static JobControllerClient newInstance(JobControllerStubs stubs, DataprocClientOptions options) {
    return new JobControllerClientImpl(stubs, options);
  }

  JobControllerStubs getServiceStubs();

  DataprocClientOptions getOptions();

  Job getJob(GetJobRequest request);

  Job getJob(String projectId, String region, String jobId);

  /**
   * Fetches the first page and returns a pager that fetches the rest on demand.
   *
   * @throws io.grpc.StatusRuntimeException if the first page can't be fetched
   */
  ListJobsPager listJobs(ListJobsRequest request);

  ListJobsPager listJobs(String projectId, String region);

  ListJobsPager listJobs(String projectId, String region, String filter);

  /** @return the job, usually still running, as cancellation is asynchronous */
  Job cancelJob(CancelJobRequest request);

  Job cancelJob(String projectId, String region, String jobId);

  /** Fails with {@code FAILED_PRECONDITION} if the job is still active. */
  void deleteJob(DeleteJobRequest request);

  void deleteJob(String projectId, String region, String jobId);

  CompletableFuture<Job> getJobAsync(GetJobRequest request);

  CompletableFuture<ListJobsAsyncPager> listJobsAsync(ListJobsRequest request);

  CompletableFuture<Job> cancelJobAsync(CancelJobRequest request);

  CompletableFuture<Void> deleteJobAsync(DeleteJobRequest request);
}
