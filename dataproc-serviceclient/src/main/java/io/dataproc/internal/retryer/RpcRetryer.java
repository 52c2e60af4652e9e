package io.dataproc.internal.retryer;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.dataproc.internal.common.GrpcFutures;
import io.dataproc.serviceclient.RpcRetryOptions;
import io.grpc.Context;
import io.grpc.Deadline;
import io.grpc.StatusRuntimeException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs unary calls under a {@link RpcRetryOptions} policy. A {@link StatusRuntimeException} with a
 * retryable code triggers another attempt, the last one is rethrown unchanged once the policy gives
 * up. Every other failure surfaces on first occurrence.
 *
 * <p>An expired deadline of the current gRPC {@link Context} also ends the retries.
 */
public final class RpcRetryer {
  private static final Logger log = LoggerFactory.getLogger(RpcRetryer.class);

  // only waits out the delays, attempts run on the thread completing the scheduled task
  private static final ScheduledExecutorService DEFAULT_SCHEDULER =
      Executors.newSingleThreadScheduledExecutor(
          new ThreadFactoryBuilder()
              .setDaemon(true)
              .setNameFormat("dataproc-retry-scheduler-%d")
              .build());

  private final RpcRetryOptions options;
  private final ScheduledExecutorService scheduler;

  public RpcRetryer(RpcRetryOptions options) {
    this(options, DEFAULT_SCHEDULER);
  }

  public RpcRetryer(RpcRetryOptions options, ScheduledExecutorService scheduler) {
    this.options = Preconditions.checkNotNull(options, "options");
    this.scheduler = Preconditions.checkNotNull(scheduler, "scheduler");
  }

  public RpcRetryOptions getOptions() {
    return options;
  }

  /**
   * @throws StatusRuntimeException of the last attempt
   * @throws CancellationException if the thread is interrupted while waiting for a retry
   */
  public <R> R call(String operation, Supplier<R> attempt) {
    RetryBackoff backoff = new RetryBackoff(options, System.nanoTime());
    while (true) {
      backoff.startAttempt();
      try {
        return attempt.get();
      } catch (StatusRuntimeException e) {
        long delay = delayBeforeRetry(operation, e, backoff, Context.current().getDeadline());
        if (delay < 0) {
          throw e;
        }
        try {
          Thread.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          CancellationException cancelled =
              new CancellationException("Interrupted while retrying " + operation);
          cancelled.initCause(e);
          throw cancelled;
        }
      }
    }
  }

  /**
   * Non blocking variant of {@link #call(String, Supplier)}. Cancelling the returned future cancels
   * the attempt in flight and stops further attempts.
   *
   * @param attempt starts one attempt, failures are expected through the returned future
   */
  public <R> CompletableFuture<R> callAsync(
      String operation, Supplier<CompletableFuture<R>> attempt) {
    AsyncCall<R> call = new AsyncCall<>(operation, attempt);
    call.start();
    return call.result;
  }

  /** @return the delay in milliseconds, -1 if {@code failure} is final */
  private long delayBeforeRetry(
      String operation,
      StatusRuntimeException failure,
      RetryBackoff backoff,
      @Nullable Deadline contextDeadline) {
    if (!options.isRetryable(failure.getStatus().getCode())) {
      return -1;
    }
    long delay = backoff.nextDelayMillis(System.nanoTime());
    if (delay < 0
        || (contextDeadline != null
            && contextDeadline.timeRemaining(TimeUnit.MILLISECONDS) <= delay)) {
      log.debug("{} failed after {} attempts, giving up", operation, backoff.getAttempts());
      return -1;
    }
    log.debug(
        "{} attempt {} failed with {}, retrying in {}ms",
        operation,
        backoff.getAttempts(),
        failure.getStatus().getCode(),
        delay);
    return delay;
  }

  private final class AsyncCall<R> {
    private final String operation;
    private final Supplier<CompletableFuture<R>> attempt;
    private final RetryBackoff backoff = new RetryBackoff(options, System.nanoTime());
    private final CompletableFuture<R> result = new CompletableFuture<>();
    private final Context context = Context.current();
    private volatile CompletableFuture<R> inFlight;

    AsyncCall(String operation, Supplier<CompletableFuture<R>> attempt) {
      this.operation = operation;
      this.attempt = attempt;
      result.whenComplete(
          (r, e) -> {
            CompletableFuture<R> pending = inFlight;
            if (result.isCancelled() && pending != null) {
              pending.cancel(true);
            }
          });
    }

    void start() {
      if (result.isDone()) {
        return;
      }
      backoff.startAttempt();
      CompletableFuture<R> current;
      try {
        current = Preconditions.checkNotNull(attempt.get(), "%s returned no future", operation);
      } catch (RuntimeException e) {
        onFailure(e);
        return;
      }
      inFlight = current;
      if (result.isCancelled()) {
        current.cancel(true);
        return;
      }
      current.whenComplete(
          (r, e) -> {
            if (e == null) {
              result.complete(r);
            } else {
              onFailure(GrpcFutures.unwrap(e));
            }
          });
    }

    private void onFailure(Throwable failure) {
      if (!(failure instanceof StatusRuntimeException)) {
        result.completeExceptionally(failure);
        return;
      }
      long delay =
          delayBeforeRetry(
              operation, (StatusRuntimeException) failure, backoff, context.getDeadline());
      if (delay < 0) {
        result.completeExceptionally(failure);
        return;
      }
      @SuppressWarnings("FutureReturnValueIgnored")
      Object unused = scheduler.schedule(context.wrap(this::start), delay, TimeUnit.MILLISECONDS);
    }
  }
}
