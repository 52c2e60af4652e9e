package io.dataproc.serviceclient;

import io.grpc.Channel;
import io.grpc.ManagedChannel;
import io.grpc.health.v1.HealthCheckResponse;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stubs of one service sharing a {@link ChannelManager}. */
abstract class ServiceStubsBase<B, F> implements ServiceStubs<B, F> {
  private static final Logger log = LoggerFactory.getLogger(ServiceStubsBase.class);

  private final DataprocServiceStubsOptions options;
  private final String serviceName;
  private final ChannelManager channelManager;
  private final B blockingStub;
  private final F futureStub;

  ServiceStubsBase(
      DataprocServiceStubsOptions options,
      String serviceName,
      Function<Channel, B> newBlockingStub,
      Function<Channel, F> newFutureStub) {
    this.options = options;
    this.serviceName = serviceName;
    this.channelManager = new ChannelManager(options);
    this.blockingStub = newBlockingStub.apply(channelManager.getInterceptedChannel());
    this.futureStub = newFutureStub.apply(channelManager.getInterceptedChannel());
    log.info("{} stubs created, options: {}", serviceName, options);
  }

  @Override
  public B blockingStub() {
    return blockingStub;
  }

  @Override
  public F futureStub() {
    return futureStub;
  }

  @Override
  public ManagedChannel getRawChannel() {
    return channelManager.getRawChannel();
  }

  @Override
  public DataprocServiceStubsOptions getOptions() {
    return options;
  }

  @Override
  public void connect(@Nullable Duration timeout) {
    channelManager.connect(serviceName, timeout);
  }

  @Override
  public HealthCheckResponse healthCheck() {
    return channelManager.healthCheck(serviceName);
  }

  @Override
  public void shutdown() {
    log.info("{} stubs shutting down", serviceName);
    channelManager.shutdown();
  }

  @Override
  public void shutdownNow() {
    log.info("{} stubs shutting down now", serviceName);
    channelManager.shutdownNow();
  }

  @Override
  public boolean isShutdown() {
    return channelManager.isShutdown();
  }

  @Override
  public boolean isTerminated() {
    return channelManager.isTerminated();
  }

  @Override
  public boolean awaitTermination(long timeout, TimeUnit unit) {
    return channelManager.awaitTermination(timeout, unit);
  }
}
