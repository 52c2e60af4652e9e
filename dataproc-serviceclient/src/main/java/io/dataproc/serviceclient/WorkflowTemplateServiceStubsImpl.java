package io.dataproc.serviceclient;

import io.dataproc.api.v1.WorkflowTemplateServiceGrpc;

final class WorkflowTemplateServiceStubsImpl
    extends ServiceStubsBase<
        WorkflowTemplateServiceGrpc.WorkflowTemplateServiceBlockingStub,
        WorkflowTemplateServiceGrpc.WorkflowTemplateServiceFutureStub>
    implements WorkflowTemplateServiceStubs {

  WorkflowTemplateServiceStubsImpl(DataprocServiceStubsOptions options) {
    super(
        options,
        HEALTH_CHECK_SERVICE_NAME,
        WorkflowTemplateServiceGrpc::newBlockingStub,
        WorkflowTemplateServiceGrpc::newFutureStub);
  }
}
