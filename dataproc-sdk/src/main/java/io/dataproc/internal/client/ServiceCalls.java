package io.dataproc.internal.client;

import com.google.common.util.concurrent.ListenableFuture;
import io.dataproc.internal.common.GrpcFutures;
import io.dataproc.internal.retryer.RpcRetryer;
import io.dataproc.serviceclient.RpcRetryOptions;
import io.grpc.Metadata;
import io.grpc.stub.AbstractStub;
import io.grpc.stub.MetadataUtils;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/** Issues unary calls with per-call headers through the retryer. */
public final class ServiceCalls {

  private final RpcRetryer retryer;

  public ServiceCalls(RpcRetryOptions rpcRetryOptions) {
    this.retryer = new RpcRetryer(rpcRetryOptions);
  }

  /**
   * @throws io.grpc.StatusRuntimeException if the last attempt failed or the failure is not
   *     retryable
   */
  public <S extends AbstractStub<S>, R> R call(S stub, Metadata metadata, Function<S, R> call) {
    S withHeaders = stub.withInterceptors(MetadataUtils.newAttachHeadersInterceptor(metadata));
    return retryer.call(operationName(stub), () -> call.apply(withHeaders));
  }

  /** Cancelling the returned future cancels the attempt in flight. */
  public <S extends AbstractStub<S>, R> CompletableFuture<R> callAsync(
      S stub, Metadata metadata, Function<S, ListenableFuture<R>> call) {
    S withHeaders = stub.withInterceptors(MetadataUtils.newAttachHeadersInterceptor(metadata));
    return retryer.callAsync(
        operationName(stub), () -> GrpcFutures.toCompletableFuture(call.apply(withHeaders)));
  }

  /** Like {@link CompletableFuture#thenApply}, but cancelling the result cancels {@code source}. */
  public static <T, R> CompletableFuture<R> thenApplyCancellable(
      CompletableFuture<T> source, Function<? super T, ? extends R> fn) {
    CompletableFuture<R> result = source.thenApply(fn);
    result.whenComplete(
        (r, e) -> {
          if (result.isCancelled()) {
            source.cancel(true);
          }
        });
    return result;
  }

  private static String operationName(AbstractStub<?> stub) {
    return stub.getClass().getSimpleName();
  }
}
