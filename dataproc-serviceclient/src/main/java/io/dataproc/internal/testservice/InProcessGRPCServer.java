package io.dataproc.internal.testservice;

import io.grpc.BindableService;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.protobuf.services.HealthStatusManager;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Fake Dataproc services on an in-memory transport, used by the stub and client tests. Every
 * registered service is reported SERVING by a standard health service, and {@link #getChannel()}
 * is connected to the server.
 */
public class InProcessGRPCServer {

  private final HealthStatusManager health = new HealthStatusManager();
  private final Server server;
  private final ManagedChannel channel;

  public InProcessGRPCServer(Collection<BindableService> services) {
    this(services, Collections.emptyList());
  }

  /**
   * @param services fakes, for example subclasses of {@code
   *     ClusterControllerGrpc.ClusterControllerImplBase}
   * @param interceptors wrap every service, the health service included
   */
  public InProcessGRPCServer(
      Collection<BindableService> services, List<ServerInterceptor> interceptors) {
    String name = InProcessServerBuilder.generateName();
    InProcessServerBuilder builder = InProcessServerBuilder.forName(name).directExecutor();
    for (BindableService service : services) {
      builder.addService(ServerInterceptors.intercept(service, interceptors));
      health.setStatus(
          service.bindService().getServiceDescriptor().getName(), ServingStatus.SERVING);
    }
    builder.addService(ServerInterceptors.intercept(health.getHealthService(), interceptors));
    try {
      this.server = builder.build().start();
    } catch (IOException e) {
      throw new UncheckedIOException("in-process server failed to start", e);
    }
    this.channel = InProcessChannelBuilder.forName(name).directExecutor().build();
  }

  /** Lets tests change the reported status of a service. */
  public HealthStatusManager getHealthStatusManager() {
    return health;
  }

  public Server getServer() {
    return server;
  }

  public ManagedChannel getChannel() {
    return channel;
  }

  public void shutdown() {
    channel.shutdown();
    server.shutdown();
  }

  public void shutdownNow() {
    channel.shutdownNow();
    server.shutdownNow();
  }

  /** @return false if the channel or the server did not terminate in time, or on interrupt */
  public boolean awaitTermination(long timeout, TimeUnit unit) {
    long deadlineNanos = System.nanoTime() + unit.toNanos(timeout);
    try {
      return channel.awaitTermination(timeout, unit)
          && server.awaitTermination(deadlineNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
