package io.dataproc.internal.common;

import static org.junit.Assert.*;

import com.google.common.util.concurrent.SettableFuture;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.Test;

public class GrpcFuturesTest {

  @Test
  public void testCompletesWithValue() {
    SettableFuture<String> listenable = SettableFuture.create();
    CompletableFuture<String> future = GrpcFutures.toCompletableFuture(listenable);
    assertFalse(future.isDone());
    listenable.set("value");
    assertEquals("value", future.join());
  }

  @Test
  public void testCompletesWithFailure() {
    SettableFuture<String> listenable = SettableFuture.create();
    CompletableFuture<String> future = GrpcFutures.toCompletableFuture(listenable);
    StatusRuntimeException failure = new StatusRuntimeException(Status.UNAVAILABLE);
    listenable.setException(failure);
    try {
      future.join();
      fail("unreachable");
    } catch (CompletionException e) {
      assertSame(failure, e.getCause());
    }
  }

  @Test
  public void testCancelPropagatesToListenableFuture() {
    SettableFuture<String> listenable = SettableFuture.create();
    CompletableFuture<String> future = GrpcFutures.toCompletableFuture(listenable);
    assertTrue(future.cancel(true));
    assertTrue(listenable.isCancelled());
  }

  @Test
  public void testUnwrap() {
    IllegalStateException cause = new IllegalStateException();
    assertSame(
        cause,
        GrpcFutures.unwrap(new CompletionException(new ExecutionException(cause))));
    assertSame(cause, GrpcFutures.unwrap(cause));
  }
}
