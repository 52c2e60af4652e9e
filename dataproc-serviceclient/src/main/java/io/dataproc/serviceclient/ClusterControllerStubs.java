package io.dataproc.serviceclient;

import io.dataproc.api.v1.ClusterControllerGrpc;
import java.time.Duration;
import javax.annotation.Nullable;

/** Stubs of the {@code ClusterController} service. */
public interface ClusterControllerStubs
    extends ServiceStubs<
        ClusterControllerGrpc.ClusterControllerBlockingStub,
        ClusterControllerGrpc.ClusterControllerFutureStub> {
  String HEALTH_CHECK_SERVICE_NAME = "dataproc.v1.ClusterController";

  /** Stubs with options resolved from the process environment. */
  static ClusterControllerStubs newInstance() {
    return newServiceStubs(DataprocServiceStubsOptions.getDefaultInstance());
  }

  /** Creates stubs that connect lazily on the first call. */
  static ClusterControllerStubs newServiceStubs(DataprocServiceStubsOptions options) {
    return new ClusterControllerStubsImpl(options);
  }

  /**
   * Creates stubs and waits until the service is healthy.
   *
   * @param timeout how long to wait, the rpc timeout if null
   */
  static ClusterControllerStubs newConnectedServiceStubs(
      DataprocServiceStubsOptions options, @Nullable Duration timeout) {
    ClusterControllerStubs stubs = newServiceStubs(options);
    stubs.connect(timeout);
    return stubs;
  }
}
