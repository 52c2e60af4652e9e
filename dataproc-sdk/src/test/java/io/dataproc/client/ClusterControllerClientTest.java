package io.dataproc.client;

import static org.junit.Assert.*;

import com.google.common.collect.ImmutableList;
import com.google.longrunning.Operation;
import com.google.protobuf.FieldMask;
import com.google.protobuf.Message;
import io.dataproc.api.v1.Cluster;
import io.dataproc.api.v1.ClusterConfig;
import io.dataproc.api.v1.ClusterControllerGrpc;
import io.dataproc.api.v1.CreateClusterRequest;
import io.dataproc.api.v1.DeleteClusterRequest;
import io.dataproc.api.v1.DiagnoseClusterRequest;
import io.dataproc.api.v1.GetClusterRequest;
import io.dataproc.api.v1.InstanceGroupConfig;
import io.dataproc.api.v1.ListClustersRequest;
import io.dataproc.api.v1.ListClustersResponse;
import io.dataproc.api.v1.UpdateClusterRequest;
import io.dataproc.client.paging.ListClustersAsyncPager;
import io.dataproc.client.paging.ListClustersPager;
import io.dataproc.internal.client.CallMetadata;
import io.dataproc.serviceclient.ClusterControllerStubs;
import io.dataproc.serviceclient.DataprocServiceStubsOptions;
import io.dataproc.serviceclient.RpcRetryOptions;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.StreamObserver;
import io.grpc.testing.GrpcCleanupRule;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

public class ClusterControllerClientTest {

  @Rule public final GrpcCleanupRule grpcCleanup = new GrpcCleanupRule();

  private final List<Metadata> headers = new CopyOnWriteArrayList<>();
  private final List<String> pageTokens = new CopyOnWriteArrayList<>();
  private final AtomicInteger failuresToInject = new AtomicInteger();
  private final List<Message> mutations = new CopyOnWriteArrayList<>();
  private ClusterControllerStubs stubs;
  private ClusterControllerClient client;

  /**
   * Serves clusters c1 to c5 two per page, pages are keyed by their number. Mutations are recorded
   * and answered with a pending operation named after the call, clusters not starting with "c"
   * don't exist.
   */
  private class FakeClusterController extends ClusterControllerGrpc.ClusterControllerImplBase {
    @Override
    public void createCluster(
        CreateClusterRequest request, StreamObserver<Operation> responseObserver) {
      mutate(request, "create", request.getCluster().getClusterName(), responseObserver);
    }

    @Override
    public void updateCluster(
        UpdateClusterRequest request, StreamObserver<Operation> responseObserver) {
      mutate(request, "update", request.getClusterName(), responseObserver);
    }

    @Override
    public void deleteCluster(
        DeleteClusterRequest request, StreamObserver<Operation> responseObserver) {
      mutate(request, "delete", request.getClusterName(), responseObserver);
    }

    @Override
    public void diagnoseCluster(
        DiagnoseClusterRequest request, StreamObserver<Operation> responseObserver) {
      mutate(request, "diagnose", request.getClusterName(), responseObserver);
    }

    private void mutate(
        Message request,
        String verb,
        String clusterName,
        StreamObserver<Operation> responseObserver) {
      mutations.add(request);
      if (!verb.equals("create") && !clusterName.startsWith("c")) {
        responseObserver.onError(Status.NOT_FOUND.asRuntimeException());
        return;
      }
      responseObserver.onNext(
          Operation.newBuilder().setName("operations/" + verb + "-" + clusterName).build());
      responseObserver.onCompleted();
    }

    @Override
    public void getCluster(GetClusterRequest request, StreamObserver<Cluster> responseObserver) {
      if (!request.getClusterName().startsWith("c")) {
        responseObserver.onError(Status.NOT_FOUND.asRuntimeException());
        return;
      }
      responseObserver.onNext(
          Cluster.newBuilder()
              .setProjectId(request.getProjectId())
              .setClusterName(request.getClusterName())
              .build());
      responseObserver.onCompleted();
    }

    @Override
    public void listClusters(
        ListClustersRequest request, StreamObserver<ListClustersResponse> responseObserver) {
      pageTokens.add(request.getPageToken());
      if (!request.getPageToken().isEmpty() && failuresToInject.getAndDecrement() > 0) {
        responseObserver.onError(Status.UNAVAILABLE.asRuntimeException());
        return;
      }
      int page = request.getPageToken().isEmpty() ? 0 : Integer.parseInt(request.getPageToken());
      ListClustersResponse.Builder response = ListClustersResponse.newBuilder();
      for (int i = page * 2 + 1; i <= Math.min(page * 2 + 2, 5); i++) {
        response.addClusters(Cluster.newBuilder().setClusterName("c" + i));
      }
      if (page < 2) {
        response.setNextPageToken(String.valueOf(page + 1));
      }
      responseObserver.onNext(response.build());
      responseObserver.onCompleted();
    }
  }

  @Before
  public void setUp() throws Exception {
    ServerInterceptor recorder =
        new ServerInterceptor() {
          @Override
          public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
              ServerCall<ReqT, RespT> call,
              Metadata requestHeaders,
              ServerCallHandler<ReqT, RespT> next) {
            headers.add(requestHeaders);
            return next.startCall(call, requestHeaders);
          }
        };
    String serverName = InProcessServerBuilder.generateName();
    grpcCleanup.register(
        InProcessServerBuilder.forName(serverName)
            .directExecutor()
            .addService(ServerInterceptors.intercept(new FakeClusterController(), recorder))
            .build()
            .start());
    stubs =
        ClusterControllerStubs.newServiceStubs(
            DataprocServiceStubsOptions.newBuilder()
                .setChannel(
                    grpcCleanup.register(
                        InProcessChannelBuilder.forName(serverName).directExecutor().build()))
                .validateAndBuildWithDefaults());
    client =
        ClusterControllerClient.newInstance(
            stubs,
            DataprocClientOptions.newBuilder()
                .setQuotaProjectId("billing")
                .setRpcRetryOptions(
                    RpcRetryOptions.newBuilder()
                        .setInitialRetryDelay(Duration.ofMillis(10))
                        .setMaxAttempts(3)
                        .build())
                .validateAndBuildWithDefaults());
  }

  @After
  public void tearDown() {
    stubs.shutdownNow();
  }

  private static List<String> names(Iterable<Cluster> clusters) {
    return ImmutableList.copyOf(clusters).stream()
        .map(Cluster::getClusterName)
        .collect(Collectors.toList());
  }

  @Test
  public void testListClustersWalksAllPages() {
    ListClustersPager pager = client.listClusters("p", "us-central1");

    assertEquals(ImmutableList.of("c1", "c2", "c3", "c4", "c5"), names(pager));
    assertEquals(ImmutableList.of("", "1", "2"), pageTokens);
    assertEquals("", pager.getNextPageToken());
  }

  @Test
  public void testEveryPageCarriesRoutingAndQuotaHeaders() {
    names(client.listClusters("my project", "us-central1", "status.state = ACTIVE"));

    assertEquals(3, headers.size());
    for (Metadata h : headers) {
      assertEquals(
          "project_id=my+project&region=us-central1",
          h.get(CallMetadata.REQUEST_PARAMS_HEADER_KEY));
      assertEquals("billing", h.get(CallMetadata.USER_PROJECT_HEADER_KEY));
    }
  }

  @Test
  public void testPageFetchIsRetried() {
    failuresToInject.set(2);

    assertEquals(5, names(client.listClusters("p", "r")).size());
    assertEquals(ImmutableList.of("", "1", "1", "1", "2"), pageTokens);
  }

  @Test
  public void testPageFetchFailureSurfacesFromIteration() {
    failuresToInject.set(3);
    ListClustersPager pager = client.listClusters("p", "r");

    try {
      names(pager);
      fail("unreachable");
    } catch (StatusRuntimeException e) {
      assertEquals(Status.Code.UNAVAILABLE, e.getStatus().getCode());
    }
    assertEquals(2, pager.getCurrentPage().getClustersCount());
  }

  @Test
  public void testGetCluster() {
    assertEquals("p", client.getCluster("p", "r", "c7").getProjectId());
    try {
      client.getCluster("p", "r", "missing");
      fail("unreachable");
    } catch (StatusRuntimeException e) {
      assertEquals(Status.Code.NOT_FOUND, e.getStatus().getCode());
    }
  }

  @Test
  public void testListClustersAsync() throws Exception {
    ListClustersAsyncPager pager =
        client
            .listClustersAsync(
                ListClustersRequest.newBuilder().setProjectId("p").setRegion("r").build())
            .get();

    assertEquals(ImmutableList.of(""), pageTokens);
    assertEquals(5, pager.toList().get().size());
    assertEquals(ImmutableList.of("", "1", "2"), pageTokens);
  }

  @Test
  public void testGetClusterAsyncFailure() throws Exception {
    try {
      client
          .getClusterAsync(
              GetClusterRequest.newBuilder()
                  .setProjectId("p")
                  .setRegion("r")
                  .setClusterName("missing")
                  .build())
          .get();
      fail("unreachable");
    } catch (ExecutionException e) {
      assertTrue(e.getCause() instanceof StatusRuntimeException);
    }
  }

  @Test
  public void testCreateCluster() {
    Cluster cluster =
        Cluster.newBuilder()
            .setProjectId("p")
            .setClusterName("c9")
            .setConfig(
                ClusterConfig.newBuilder()
                    .setWorkerConfig(InstanceGroupConfig.newBuilder().setNumInstances(2)))
            .build();

    Operation operation = client.createCluster("p", "us-central1", cluster);

    assertEquals("operations/create-c9", operation.getName());
    assertFalse(operation.getDone());
    assertEquals(
        ImmutableList.of(
            CreateClusterRequest.newBuilder()
                .setProjectId("p")
                .setRegion("us-central1")
                .setCluster(cluster)
                .build()),
        mutations);
    assertEquals(
        "project_id=p&region=us-central1",
        headers.get(0).get(CallMetadata.REQUEST_PARAMS_HEADER_KEY));
  }

  @Test
  public void testUpdateCluster() {
    Cluster cluster =
        Cluster.newBuilder()
            .setConfig(
                ClusterConfig.newBuilder()
                    .setWorkerConfig(InstanceGroupConfig.newBuilder().setNumInstances(5)))
            .build();
    FieldMask mask = FieldMask.newBuilder().addPaths("config.worker_config.num_instances").build();

    Operation operation = client.updateCluster("p", "r", "c1", cluster, mask);

    assertEquals("operations/update-c1", operation.getName());
    UpdateClusterRequest sent = (UpdateClusterRequest) mutations.get(0);
    assertEquals("p", sent.getProjectId());
    assertEquals("r", sent.getRegion());
    assertEquals("c1", sent.getClusterName());
    assertEquals(cluster, sent.getCluster());
    assertEquals(mask, sent.getUpdateMask());
    assertEquals(
        "project_id=p&region=r&cluster_name=c1",
        headers.get(0).get(CallMetadata.REQUEST_PARAMS_HEADER_KEY));
  }

  @Test
  public void testDeleteCluster() {
    Operation operation = client.deleteCluster("p", "r", "c2");

    assertEquals("operations/delete-c2", operation.getName());
    assertEquals(
        ImmutableList.of(
            DeleteClusterRequest.newBuilder()
                .setProjectId("p")
                .setRegion("r")
                .setClusterName("c2")
                .build()),
        mutations);
  }

  @Test
  public void testDeleteMissingClusterIsNotRetried() {
    try {
      client.deleteCluster("p", "r", "missing");
      fail("unreachable");
    } catch (StatusRuntimeException e) {
      assertEquals(Status.Code.NOT_FOUND, e.getStatus().getCode());
    }
    assertEquals(1, mutations.size());
  }

  @Test
  public void testDiagnoseCluster() {
    Operation operation = client.diagnoseCluster("p", "r", "c3");

    assertEquals("operations/diagnose-c3", operation.getName());
    assertEquals(
        ImmutableList.of(
            DiagnoseClusterRequest.newBuilder()
                .setProjectId("p")
                .setRegion("r")
                .setClusterName("c3")
                .build()),
        mutations);
  }

  @Test
  public void testMutationsAsync() throws Exception {
    CreateClusterRequest create =
        CreateClusterRequest.newBuilder()
            .setProjectId("p")
            .setRegion("r")
            .setCluster(Cluster.newBuilder().setClusterName("c8"))
            .setRequestId("req-1")
            .build();
    assertEquals("operations/create-c8", client.createClusterAsync(create).get().getName());
    assertEquals(
        "operations/update-c1",
        client
            .updateClusterAsync(
                UpdateClusterRequest.newBuilder()
                    .setProjectId("p")
                    .setRegion("r")
                    .setClusterName("c1")
                    .build())
            .get()
            .getName());
    assertEquals(
        "operations/diagnose-c1",
        client
            .diagnoseClusterAsync(
                DiagnoseClusterRequest.newBuilder()
                    .setProjectId("p")
                    .setRegion("r")
                    .setClusterName("c1")
                    .build())
            .get()
            .getName());
    try {
      client
          .deleteClusterAsync(
              DeleteClusterRequest.newBuilder()
                  .setProjectId("p")
                  .setRegion("r")
                  .setClusterName("missing")
                  .build())
          .get();
      fail("unreachable");
    } catch (ExecutionException e) {
      assertEquals(
          Status.Code.NOT_FOUND, ((StatusRuntimeException) e.getCause()).getStatus().getCode());
    }
    assertEquals("req-1", ((CreateClusterRequest) mutations.get(0)).getRequestId());
    assertEquals(4, mutations.size());
  }
}
