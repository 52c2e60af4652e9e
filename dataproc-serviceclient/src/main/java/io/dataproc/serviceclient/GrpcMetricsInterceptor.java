package io.dataproc.serviceclient;

import com.google.common.collect.ImmutableMap;
import com.uber.m3.tally.Scope;
import com.uber.m3.tally.Stopwatch;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall.SimpleForwardingClientCall;
import io.grpc.ForwardingClientCallListener.SimpleForwardingClientCallListener;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Reports {@link DataprocMetrics} for every call attempt to a tally scope. */
final class GrpcMetricsInterceptor implements ClientInterceptor {

  private final Scope scope;
  // tagged sub scopes are cached by tally too, this only saves building the tag maps
  private final ConcurrentMap<String, Scope> methodScopes = new ConcurrentHashMap<>();

  GrpcMetricsInterceptor(Scope scope) {
    this.scope = scope;
  }

  @Override
  public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
      MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
    Scope methodScope =
        methodScopes.computeIfAbsent(
            method.getFullMethodName(),
            name ->
                scope.tagged(
                    ImmutableMap.of(
                        DataprocMetrics.SERVICE,
                        String.valueOf(method.getServiceName()),
                        DataprocMetrics.OPERATION,
                        String.valueOf(method.getBareMethodName()))));
    return new SimpleForwardingClientCall<ReqT, RespT>(next.newCall(method, callOptions)) {
      @Override
      public void start(Listener<RespT> listener, Metadata headers) {
        methodScope.counter(DataprocMetrics.REQUEST).inc(1);
        Stopwatch latency = methodScope.timer(DataprocMetrics.REQUEST_LATENCY).start();
        super.start(
            new SimpleForwardingClientCallListener<RespT>(listener) {
              @Override
              public void onClose(Status status, Metadata trailers) {
                latency.stop();
                if (!status.isOk()) {
                  methodScope
                      .tagged(
                          ImmutableMap.of(
                              DataprocMetrics.STATUS_CODE, status.getCode().name()))
                      .counter(DataprocMetrics.REQUEST_FAILURE)
                      .inc(1);
                }
                super.onClose(status, trailers);
              }
            },
            headers);
      }
    };
  }
}
