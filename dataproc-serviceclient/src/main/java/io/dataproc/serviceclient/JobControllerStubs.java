package io.dataproc.serviceclient;

import io.dataproc.api.v1.JobControllerGrpc;
import java.time.Duration;
import javax.annotation.Nullable;

/** Stubs of the {@code JobController} service, which submits and manages jobs on clusters. */
public interface JobControllerStubs
    extends ServiceStubs<
        JobControllerGrpc.JobControllerBlockingStub,
        JobControllerGrpc.JobControllerFutureStub> {
  String HEALTH_CHECK_SERVICE_NAME = "dataproc.v1.JobController";

  /** Stubs with options resolved from the process environment. */
  static JobControllerStubs newInstance() {
    return newServiceStubs(DataprocServiceStubsOptions.getDefaultInstance());
  }

  /** Creates stubs that connect lazily on the first call. */
  static JobControllerStubs newServiceStubs(DataprocServiceStubsOptions options) {
    return new JobControllerStubsImpl(options);
  }

  /**
   * Creates stubs and waits until the service is healthy.
   *
   * @param timeout how long to wait, the rpc timeout if null
   */
  static JobControllerStubs newConnectedServiceStubs(
      DataprocServiceStubsOptions options, @Nullable Duration timeout) {
    JobControllerStubs stubs = newServiceStubs(options);
    stubs.connect(timeout);
    return stubs;
  }
}
