package io.dataproc.serviceclient;

import io.dataproc.api.v1.ClusterControllerGrpc;

final class ClusterControllerStubsImpl
    extends ServiceStubsBase<
        ClusterControllerGrpc.ClusterControllerBlockingStub,
        ClusterControllerGrpc.ClusterControllerFutureStub>
    implements ClusterControllerStubs {

  ClusterControllerStubsImpl(DataprocServiceStubsOptions options) {
    super(
        options,
        HEALTH_CHECK_SERVICE_NAME,
        ClusterControllerGrpc::newBlockingStub,
        ClusterControllerGrpc::newFutureStub);
  }
}
