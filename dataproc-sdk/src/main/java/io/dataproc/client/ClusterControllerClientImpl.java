package io.dataproc.client;

import com.google.common.collect.ImmutableMap;
import com.google.longrunning.Operation;
import com.google.protobuf.FieldMask;
import io.dataproc.api.v1.Cluster;
import io.dataproc.api.v1.CreateClusterRequest;
import io.dataproc.api.v1.DeleteClusterRequest;
import io.dataproc.api.v1.DiagnoseClusterRequest;
import io.dataproc.api.v1.GetClusterRequest;
import io.dataproc.api.v1.ListClustersRequest;
import io.dataproc.api.v1.ListClustersResponse;
import io.dataproc.api.v1.UpdateClusterRequest;
import io.dataproc.client.paging.AsyncPageFetcher;
import io.dataproc.client.paging.ListClustersAsyncPager;
import io.dataproc.client.paging.ListClustersPager;
import io.dataproc.client.paging.PageFetcher;
import io.dataproc.internal.client.CallMetadata;
import io.dataproc.internal.client.ServiceCalls;
import io.dataproc.serviceclient.ClusterControllerStubs;
import io.grpc.Metadata;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ClusterControllerClientImpl implements ClusterControllerClient {
  private static final Logger log = LoggerFactory.getLogger(ClusterControllerClientImpl.class);

  private final ClusterControllerStubs stubs;
  private final DataprocClientOptions options;
  private final ServiceCalls calls;

  ClusterControllerClientImpl(ClusterControllerStubs stubs, DataprocClientOptions options) {
    this.stubs = Objects.requireNonNull(stubs, "stubs");
    this.options =
        DataprocClientOptions.newBuilder(Objects.requireNonNull(options, "options"))
            .validateAndBuildWithDefaults();
    this.calls = new ServiceCalls(ClientRetryOptions.resolve(this.options, stubs));
    log.debug("Created ClusterControllerClient, identity={}", this.options.getIdentity());
  }

  @Override
  public ClusterControllerStubs getServiceStubs() {
    return stubs;
  }

  @Override
  public DataprocClientOptions getOptions() {
    return options;
  }

  @Override
  public Operation createCluster(CreateClusterRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    Operation operation =
        calls.call(stubs.blockingStub(), metadata, s -> s.createCluster(request));
    log.debug(
        "Creating cluster {}, operation {}",
        request.getCluster().getClusterName(),
        operation.getName());
    return operation;
  }

  @Override
  public Operation createCluster(String projectId, String region, Cluster cluster) {
    return createCluster(
        CreateClusterRequest.newBuilder()
            .setProjectId(projectId)
            .setRegion(region)
            .setCluster(cluster)
            .build());
  }

  @Override
  public Operation updateCluster(UpdateClusterRequest request) {
    Metadata metadata =
        metadata(request.getProjectId(), request.getRegion(), request.getClusterName());
    return calls.call(stubs.blockingStub(), metadata, s -> s.updateCluster(request));
  }

  @Override
  public Operation updateCluster(
      String projectId, String region, String clusterName, Cluster cluster, FieldMask updateMask) {
    return updateCluster(
        UpdateClusterRequest.newBuilder()
            .setProjectId(projectId)
            .setRegion(region)
            .setClusterName(clusterName)
            .setCluster(cluster)
            .setUpdateMask(updateMask)
            .build());
  }

  @Override
  public Operation deleteCluster(DeleteClusterRequest request) {
    Metadata metadata =
        metadata(request.getProjectId(), request.getRegion(), request.getClusterName());
    return calls.call(stubs.blockingStub(), metadata, s -> s.deleteCluster(request));
  }

  @Override
  public Operation deleteCluster(String projectId, String region, String clusterName) {
    return deleteCluster(
        DeleteClusterRequest.newBuilder()
            .setProjectId(projectId)
            .setRegion(region)
            .setClusterName(clusterName)
            .build());
  }

  @Override
  public Operation diagnoseCluster(DiagnoseClusterRequest request) {
    Metadata metadata =
        metadata(request.getProjectId(), request.getRegion(), request.getClusterName());
    return calls.call(stubs.blockingStub(), metadata, s -> s.diagnoseCluster(request));
  }

  @Override
  public Operation diagnoseCluster(String projectId, String region, String clusterName) {
    return diagnoseCluster(
        DiagnoseClusterRequest.newBuilder()
            .setProjectId(projectId)
            .setRegion(region)
            .setClusterName(clusterName)
            .build());
  }

  @Override
  public Cluster getCluster(GetClusterRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    return calls.call(stubs.blockingStub(), metadata, s -> s.getCluster(request));
  }

  @Override
  public Cluster getCluster(String projectId, String region, String clusterName) {
    return getCluster(
        GetClusterRequest.newBuilder()
            .setProjectId(projectId)
            .setRegion(region)
            .setClusterName(clusterName)
            .build());
  }

  @Override
  public ListClustersPager listClusters(ListClustersRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    PageFetcher<ListClustersRequest, ListClustersResponse> fetcher =
        (r, md) -> calls.call(stubs.blockingStub(), md, s -> s.listClusters(r));
    ListClustersResponse first = fetcher.fetch(request, metadata);
    return new ListClustersPager(fetcher, request, first, metadata);
  }

  @Override
  public ListClustersPager listClusters(String projectId, String region) {
    return listClusters(
        ListClustersRequest.newBuilder().setProjectId(projectId).setRegion(region).build());
  }

  @Override
  public ListClustersPager listClusters(String projectId, String region, String filter) {
    return listClusters(
        ListClustersRequest.newBuilder()
            .setProjectId(projectId)
            .setRegion(region)
            .setFilter(filter)
            .build());
  }

  @Override
  public CompletableFuture<Operation> createClusterAsync(CreateClusterRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    return calls.callAsync(stubs.futureStub(), metadata, s -> s.createCluster(request));
  }

  @Override
  public CompletableFuture<Operation> updateClusterAsync(UpdateClusterRequest request) {
    Metadata metadata =
        metadata(request.getProjectId(), request.getRegion(), request.getClusterName());
    return calls.callAsync(stubs.futureStub(), metadata, s -> s.updateCluster(request));
  }

  @Override
  public CompletableFuture<Operation> deleteClusterAsync(DeleteClusterRequest request) {
    Metadata metadata =
        metadata(request.getProjectId(), request.getRegion(), request.getClusterName());
    return calls.callAsync(stubs.futureStub(), metadata, s -> s.deleteCluster(request));
  }

  @Override
  public CompletableFuture<Operation> diagnoseClusterAsync(DiagnoseClusterRequest request) {
    Metadata metadata =
        metadata(request.getProjectId(), request.getRegion(), request.getClusterName());
    return calls.callAsync(stubs.futureStub(), metadata, s -> s.diagnoseCluster(request));
  }

  @Override
  public CompletableFuture<Cluster> getClusterAsync(GetClusterRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    return calls.callAsync(stubs.futureStub(), metadata, s -> s.getCluster(request));
  }

  @Override
  public CompletableFuture<ListClustersAsyncPager> listClustersAsync(
      ListClustersRequest request) {
    Metadata metadata = metadata(request.getProjectId(), request.getRegion());
    AsyncPageFetcher<ListClustersRequest, ListClustersResponse> fetcher =
        (r, md) -> calls.callAsync(stubs.futureStub(), md, s -> s.listClusters(r));
    return ServiceCalls.thenApplyCancellable(
        fetcher.fetch(request, metadata),
        first -> new ListClustersAsyncPager(fetcher, request, first, metadata));
  }

  private Metadata metadata(String projectId, String region) {
    return CallMetadata.of(
        options.getQuotaProjectId(), ImmutableMap.of("project_id", projectId, "region", region));
  }

  private Metadata metadata(String projectId, String region, String clusterName) {
    return CallMetadata.of(
        options.getQuotaProjectId(),
        ImmutableMap.of("project_id", projectId, "region", region, "cluster_name", clusterName));
  }

  @Override
  public String toString() {
    return "ClusterControllerClient{" + stubs.getOptions().getTarget() + "}";
  }
}
