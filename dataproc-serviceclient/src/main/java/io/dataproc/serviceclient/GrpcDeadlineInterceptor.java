package io.dataproc.serviceclient;

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.Deadline;
import io.grpc.MethodDescriptor;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** Bounds every attempt by the rpc timeout. An earlier deadline set by the caller is kept. */
final class GrpcDeadlineInterceptor implements ClientInterceptor {

  private final long rpcTimeoutNanos;

  GrpcDeadlineInterceptor(Duration rpcTimeout) {
    this.rpcTimeoutNanos = rpcTimeout.toNanos();
  }

  @Override
  public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
      MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
    Deadline attemptDeadline = Deadline.after(rpcTimeoutNanos, TimeUnit.NANOSECONDS);
    Deadline callerDeadline = callOptions.getDeadline();
    if (callerDeadline == null || attemptDeadline.isBefore(callerDeadline)) {
      callOptions = callOptions.withDeadline(attemptDeadline);
    }
    return next.newCall(method, callOptions);
  }
}
