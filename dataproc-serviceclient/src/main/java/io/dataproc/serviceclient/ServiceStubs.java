package io.dataproc.serviceclient;

import io.grpc.ManagedChannel;
import io.grpc.StatusRuntimeException;
import io.grpc.health.v1.HealthCheckResponse;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

/**
 * gRPC stubs of one Dataproc service together with the channel they run on.
 *
 * @param <B> blocking stub type
 * @param <F> future stub type
 */
public interface ServiceStubs<B, F> {
  B blockingStub();

  F futureStub();

  ManagedChannel getRawChannel();

  DataprocServiceStubsOptions getOptions();

  void shutdown();

  void shutdownNow();

  boolean isShutdown();

  boolean isTerminated();

  boolean awaitTermination(long timeout, TimeUnit unit);

  /**
   * Waits until the service reports itself healthy. Stubs connect lazily on the first call, this
   * method is only needed to fail fast.
   *
   * @param timeout how long to keep trying, the rpc timeout if null
   * @throws StatusRuntimeException if the service is not healthy after {@code timeout}
   */
  void connect(@Nullable Duration timeout);

  /**
   * Single standard gRPC health check of the service.
   *
   * @throws StatusRuntimeException if the health service can't be reached
   */
  HealthCheckResponse healthCheck();
}
