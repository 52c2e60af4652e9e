package io.dataproc.serviceclient;

import io.dataproc.api.v1.WorkflowTemplateServiceGrpc;
import java.time.Duration;
import javax.annotation.Nullable;

public interface WorkflowTemplateServiceStubs
    extends ServiceStubs<
        WorkflowTemplateServiceGrpc.WorkflowTemplateServiceBlockingStub,
        WorkflowTemplateServiceGrpc.WorkflowTemplateServiceFutureStub> {
  String HEALTH_CHECK_SERVICE_NAME = "dataproc.v1.WorkflowTemplateService";

  /** Stubs with options resolved from the process environment. */
  static WorkflowTemplateServiceStubs newInstance() {
    return newServiceStubs(DataprocServiceStubsOptions.getDefaultInstance());
  }

  /** Creates stubs that connect lazily on the first call. */
  static WorkflowTemplateServiceStubs newServiceStubs(DataprocServiceStubsOptions options) {
    return new WorkflowTemplateServiceStubsImpl(options);
  }

  /**
   * Creates stubs and waits until the service is healthy.
   *
   * @param timeout how long to wait, the rpc timeout if null
   */
  static WorkflowTemplateServiceStubs newConnectedServiceStubs(
      DataprocServiceStubsOptions options, @Nullable Duration timeout) {
    WorkflowTemplateServiceStubs stubs = newServiceStubs(options);
    stubs.connect(timeout);
    return stubs;
  }
}
