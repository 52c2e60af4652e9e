package io.dataproc.serviceclient;

import io.dataproc.internal.retryer.RpcRetryer;
import io.grpc.Channel;
import io.grpc.ClientInterceptor;
import io.grpc.ClientInterceptors;
import io.grpc.ConnectivityState;
import io.grpc.ManagedChannel;
import io.grpc.StatusRuntimeException;
import io.grpc.health.v1.HealthCheckRequest;
import io.grpc.health.v1.HealthCheckResponse;
import io.grpc.health.v1.HealthGrpc;
import io.grpc.netty.shaded.io.grpc.netty.NettyChannelBuilder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Channel of one stubs instance. Calls pass, from the stub to the wire, the deadline, headers,
 * metrics and, when TRACE logging is on, tracing interceptors.
 */
final class ChannelManager {
  private static final Logger log = LoggerFactory.getLogger(ChannelManager.class);

  // list pages of large clusters can exceed the 4MB gRPC default
  private static final int MAX_INBOUND_MESSAGE_SIZE = 128 * 1024 * 1024;
  private static final Duration KEEP_ALIVE_TIME = Duration.ofSeconds(30);
  private static final Duration KEEP_ALIVE_TIMEOUT = Duration.ofSeconds(15);

  private final DataprocServiceStubsOptions options;
  private final ManagedChannel rawChannel;
  // channels passed in by the caller stay open
  private final boolean ownsChannel;
  private final Channel interceptedChannel;
  private volatile boolean shutdownRequested;

  ChannelManager(DataprocServiceStubsOptions options) {
    this.options = options;
    this.ownsChannel = options.getChannel() == null;
    this.rawChannel = ownsChannel ? buildChannel(options) : options.getChannel();

    // ClientInterceptors.intercept runs the last interceptor of the list first
    List<ClientInterceptor> interceptors = new ArrayList<>();
    if (GrpcTracingInterceptor.isEnabled()) {
      interceptors.add(new GrpcTracingInterceptor());
    }
    interceptors.add(new GrpcMetricsInterceptor(options.getMetricsScope()));
    interceptors.add(
        new GrpcHeadersInterceptor(options.getHeaders(), options.getGrpcMetadataProviders()));
    interceptors.add(new GrpcDeadlineInterceptor(options.getRpcTimeout()));
    this.interceptedChannel = ClientInterceptors.intercept(rawChannel, interceptors);
  }

  private static ManagedChannel buildChannel(DataprocServiceStubsOptions options) {
    NettyChannelBuilder builder =
        NettyChannelBuilder.forTarget(options.getTarget())
            .defaultLoadBalancingPolicy("round_robin")
            .maxInboundMessageSize(MAX_INBOUND_MESSAGE_SIZE)
            .keepAliveTime(KEEP_ALIVE_TIME.toMillis(), TimeUnit.MILLISECONDS)
            .keepAliveTimeout(KEEP_ALIVE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)
            .keepAliveWithoutCalls(true);
    if (options.getSslContext() != null) {
      builder.sslContext(options.getSslContext());
    } else if (options.getEnableHttps()) {
      builder.useTransportSecurity();
    } else {
      builder.usePlaintext();
    }
    if (options.getAuthority() != null) {
      builder.overrideAuthority(options.getAuthority());
    }
    return builder.build();
  }

  ManagedChannel getRawChannel() {
    return rawChannel;
  }

  Channel getInterceptedChannel() {
    return interceptedChannel;
  }

  /**
   * Repeats the health check of {@code serviceName} under the stubs retry options until it
   * succeeds.
   *
   * @param timeout total time to keep trying, the rpc timeout if null
   * @throws StatusRuntimeException if the service is still not healthy after {@code timeout}
   * @throws IllegalStateException if the channel is already shut down
   */
  void connect(String serviceName, @Nullable Duration timeout) {
    ConnectivityState state = rawChannel.getState(false);
    if (state == ConnectivityState.READY) {
      return;
    }
    if (state == ConnectivityState.SHUTDOWN) {
      throw new IllegalStateException("Can't connect stubs in SHUTDOWN state");
    }
    RpcRetryOptions retryOptions =
        RpcRetryOptions.newBuilder(options.getRpcRetryOptions())
            .setTotalTimeout(timeout != null ? timeout : options.getRpcTimeout())
            .build();
    HealthCheckResponse response =
        new RpcRetryer(retryOptions).call("health check", () -> healthCheck(serviceName));
    log.debug("{} is {}", serviceName, response.getStatus());
  }

  /**
   * Standard gRPC health check, https://github.com/grpc/grpc/blob/master/doc/health-checking.md
   *
   * @throws StatusRuntimeException if the health service can't be reached or doesn't know {@code
   *     serviceName}
   */
  HealthCheckResponse healthCheck(String serviceName) {
    return HealthGrpc.newBlockingStub(interceptedChannel)
        .check(HealthCheckRequest.newBuilder().setService(serviceName).build());
  }

  void shutdown() {
    shutdownRequested = true;
    if (ownsChannel) {
      rawChannel.shutdown();
    }
  }

  void shutdownNow() {
    shutdownRequested = true;
    if (ownsChannel) {
      rawChannel.shutdownNow();
    }
  }

  boolean isShutdown() {
    return ownsChannel ? rawChannel.isShutdown() : shutdownRequested;
  }

  boolean isTerminated() {
    return ownsChannel ? rawChannel.isTerminated() : shutdownRequested;
  }

  boolean awaitTermination(long timeout, TimeUnit unit) {
    if (!ownsChannel) {
      return shutdownRequested;
    }
    try {
      return rawChannel.awaitTermination(timeout, unit);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
