package io.dataproc.serviceclient;

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall.SimpleForwardingClientCall;
import io.grpc.ForwardingClientCallListener.SimpleForwardingClientCallListener;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every request message, response message and non OK status at TRACE. Messages are printed
 * in protobuf text format and may carry credentials, so keep this logger off in production.
 */
final class GrpcTracingInterceptor implements ClientInterceptor {

  private static final Logger log = LoggerFactory.getLogger(GrpcTracingInterceptor.class);

  static boolean isEnabled() {
    return log.isTraceEnabled();
  }

  @Override
  public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
      MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
    String rpc = method.getFullMethodName();
    return new SimpleForwardingClientCall<ReqT, RespT>(next.newCall(method, callOptions)) {
      @Override
      public void start(Listener<RespT> listener, Metadata headers) {
        super.start(new TracingListener<>(rpc, listener), headers);
      }

      @Override
      public void sendMessage(ReqT request) {
        log.trace("{} request: {}", rpc, request);
        super.sendMessage(request);
      }
    };
  }

  private static final class TracingListener<RespT>
      extends SimpleForwardingClientCallListener<RespT> {
    private final String rpc;

    TracingListener(String rpc, ClientCall.Listener<RespT> delegate) {
      super(delegate);
      this.rpc = rpc;
    }

    @Override
    public void onMessage(RespT response) {
      log.trace("{} response: {}", rpc, response);
      super.onMessage(response);
    }

    @Override
    public void onClose(Status status, Metadata trailers) {
      if (!status.isOk()) {
        log.trace("{} failed: {}", rpc, status);
      }
      super.onClose(status, trailers);
    }
  }
}
