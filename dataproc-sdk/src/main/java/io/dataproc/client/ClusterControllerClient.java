package io.dataproc.client;

import com.google.longrunning.Operation;
import com.google.protobuf.FieldMask;
import io.dataproc.api.v1.Cluster;
import io.dataproc.api.v1.CreateClusterRequest;
import io.dataproc.api.v1.DeleteClusterRequest;
import io.dataproc.api.v1.DiagnoseClusterRequest;
import io.dataproc.api.v1.GetClusterRequest;
import io.dataproc.api.v1.ListClustersRequest;
import io.dataproc.api.v1.UpdateClusterRequest;
import io.dataproc.client.paging.ListClustersAsyncPager;
import io.dataproc.client.paging.ListClustersPager;
import io.dataproc.serviceclient.ClusterControllerStubs;
import java.util.concurrent.CompletableFuture;

/**
 * Client of the {@code ClusterController} service.
 *
 * <p>Every call, each page fetch of a list call included, is retried according to the client's
 * {@link io.dataproc.serviceclient.RpcRetryOptions}. Failures surface as {@link
 * io.grpc.StatusRuntimeException}.
 *
 * <p>Create, update, delete and diagnose return the raw long-running {@link Operation} as the
 * service sent it. Waiting for it to finish is left to the caller.
 */
public interface ClusterControllerClient {

  static ClusterControllerClient newInstance(ClusterControllerStubs stubs) {
    return newInstance(stubs, DataprocClientOptions.getDefaultInstance());
  }

  static ClusterControllerClient newInstance(
      ClusterControllerStubs stubs, DataprocClientOptions options) {
    return new ClusterControllerClientImpl(stubs, options);
  }

  ClusterControllerStubs getServiceStubs();

  DataprocClientOptions getOptions();

  /**
   * Set {@code request_id} to make a retried create safe: the service then returns the operation
   * of the first request instead of failing with {@code ALREADY_EXISTS}.
   */
  Operation createCluster(CreateClusterRequest request);

  Operation createCluster(String projectId, String region, Cluster cluster);

  /**
   * @param updateMask paths relative to {@link Cluster} of the fields taken from {@code cluster}
   */
  Operation updateCluster(UpdateClusterRequest request);

  Operation updateCluster(
      String projectId, String region, String clusterName, Cluster cluster, FieldMask updateMask);

  Operation deleteCluster(DeleteClusterRequest request);

  Operation deleteCluster(String projectId, String region, String clusterName);

  /** The response of the finished operation carries the Cloud Storage URI of the diagnosis. */
  Operation diagnoseCluster(DiagnoseClusterRequest request);

  Operation diagnoseCluster(String projectId, String region, String clusterName);

  Cluster getCluster(GetClusterRequest request);

  Cluster getCluster(String projectId, String region, String clusterName);

  /**
   * Fetches the first page and returns a pager that fetches the rest on demand.
   *
   * @throws io.grpc.StatusRuntimeException if the first page can't be fetched
   */
  ListClustersPager listClusters(ListClustersRequest request);

  ListClustersPager listClusters(String projectId, String region);

  /**
   * @param filter cluster filter expression, for example {@code status.state = ACTIVE}
   */
  ListClustersPager listClusters(String projectId, String region, String filter);

  CompletableFuture<Operation> createClusterAsync(CreateClusterRequest request);

  CompletableFuture<Operation> updateClusterAsync(UpdateClusterRequest request);

  CompletableFuture<Operation> deleteClusterAsync(DeleteClusterRequest request);

  CompletableFuture<Operation> diagnoseClusterAsync(DiagnoseClusterRequest request);

  CompletableFuture<Cluster> getClusterAsync(GetClusterRequest request);

  /** The returned future completes with the pager once the first page is in. */
  CompletableFuture<ListClustersAsyncPager> listClustersAsync(ListClustersRequest request);
}
