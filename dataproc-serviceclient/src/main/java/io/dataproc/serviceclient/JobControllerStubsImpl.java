package io.dataproc.serviceclient;

import io.dataproc.api.v1.JobControllerGrpc;

final class JobControllerStubsImpl
    extends ServiceStubsBase<
        JobControllerGrpc.JobControllerBlockingStub,
        JobControllerGrpc.JobControllerFutureStub>
    implements JobControllerStubs {

  JobControllerStubsImpl(DataprocServiceStubsOptions options) {
    super(
        options,
        HEALTH_CHECK_SERVICE_NAME,
        JobControllerGrpc::newBlockingStub,
        JobControllerGrpc::newFutureStub);
  }
}
