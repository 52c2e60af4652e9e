package io.dataproc.client.paging;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import io.dataproc.internal.common.GrpcFutures;
import io.grpc.Metadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import javax.annotation.concurrent.GuardedBy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non blocking variant of {@link Pager}. At most one page fetch is in flight at any time, pages
 * are fetched strictly in token order and only on demand.
 *
 * <p>Cancelling a future returned by this class while a fetch is pending cancels the underlying
 * call and leaves the pager failed, still holding the page it held before the fetch.
 *
 * <p>Intended for a single consumer. Callbacks run on the thread completing the fetch.
 */
public abstract class AsyncPager<ReqT, RespT, T> {
  private static final Logger log = LoggerFactory.getLogger(AsyncPager.class);

  private final AsyncPageFetcher<ReqT, RespT> fetcher;
  private final Metadata metadata;
  private final Object lock = new Object();

  @GuardedBy("lock")
  private ReqT request;

  private volatile RespT response;
  private volatile PagerState state = PagerState.HOLDING_PAGE;
  private volatile CompletableFuture<RespT> inFlight;

  protected AsyncPager(
      AsyncPageFetcher<ReqT, RespT> fetcher, ReqT request, RespT response, Metadata metadata) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.request = Objects.requireNonNull(request, "request");
    this.response = Objects.requireNonNull(response, "response");
    this.metadata = Pager.copyOf(Objects.requireNonNull(metadata, "metadata"));
  }

  protected abstract ReqT withPageToken(ReqT request, String pageToken);

  protected abstract String nextPageToken(RespT response);

  protected abstract List<T> toElements(RespT response);

  public RespT getCurrentPage() {
    return response;
  }

  public String getNextPageToken() {
    return Strings.nullToEmpty(nextPageToken(response));
  }

  public Metadata getMetadata() {
    return Pager.copyOf(metadata);
  }

  /** @return true if the current page has a next page token and no fetch failed */
  public boolean hasNextPage() {
    return state != PagerState.FAILED && !getNextPageToken().isEmpty();
  }

  /**
   * Starts fetching the page after the current one.
   *
   * @return the new current page. Fails with {@link IllegalStateException} if there is no next
   *     page, a fetch is already in flight or the pager failed before, and with the unwrapped
   *     fetcher failure otherwise.
   */
  public CompletableFuture<RespT> fetchNextPage() {
    ReqT nextRequest;
    String token;
    synchronized (lock) {
      if (state == PagerState.FAILED) {
        return failed(new IllegalStateException("Pager can't be used after a failed page fetch"));
      }
      if (state == PagerState.FETCHING) {
        return failed(new IllegalStateException("A page fetch is already in flight"));
      }
      token = getNextPageToken();
      if (token.isEmpty()) {
        return failed(new IllegalStateException("The current page is the last one"));
      }
      nextRequest = withPageToken(request, token);
      state = PagerState.FETCHING;
    }
    if (log.isDebugEnabled()) {
      log.debug("Fetching page of {}, pageToken={}", getClass().getSimpleName(), token);
    }

    CompletableFuture<RespT> call;
    try {
      call =
          Objects.requireNonNull(
              fetcher.fetch(nextRequest, Pager.copyOf(metadata)), "fetcher returned null future");
    } catch (RuntimeException e) {
      state = PagerState.FAILED;
      return failed(e);
    }

    CompletableFuture<RespT> result = new CompletableFuture<>();
    inFlight = result;
    result.whenComplete(
        (page, e) -> {
          if (result.isCancelled()) {
            synchronized (lock) {
              if (state == PagerState.FETCHING) {
                state = PagerState.FAILED;
              }
            }
            call.cancel(true);
          }
        });
    call.whenComplete(
        (page, e) -> {
          Throwable failure = e;
          if (failure == null && page == null) {
            failure = new NullPointerException("fetcher completed with null page");
          }
          synchronized (lock) {
            if (state != PagerState.FETCHING || result.isCancelled()) {
              // cancelled, possibly before the cancel callback ran
              state = PagerState.FAILED;
              return;
            }
            if (failure == null) {
              request = nextRequest;
              response = page;
              state = PagerState.HOLDING_PAGE;
            } else {
              state = PagerState.FAILED;
            }
          }
          if (failure == null) {
            result.complete(page);
          } else {
            result.completeExceptionally(GrpcFutures.unwrap(failure));
          }
        });
    return result;
  }

  /**
   * Passes the current page and every following page to {@code action}, fetching one page at a
   * time.
   *
   * @return completes after the last page was passed to {@code action}, or exceptionally with the
   *     first fetch or {@code action} failure. Cancelling it cancels the pending fetch.
   */
  public CompletableFuture<Void> forEachPage(Consumer<? super RespT> action) {
    if (state != PagerState.HOLDING_PAGE) {
      return failed(new IllegalStateException("Pager is " + state));
    }
    CompletableFuture<Void> done = new CompletableFuture<>();
    done.whenComplete(
        (r, e) -> {
          CompletableFuture<RespT> pending = inFlight;
          if (done.isCancelled() && pending != null) {
            pending.cancel(true);
          }
        });
    if (accept(action, response, done)) {
      drive(action, done);
    }
    return done;
  }

  /** Item variant of {@link #forEachPage(Consumer)}. */
  public CompletableFuture<Void> forEach(Consumer<? super T> action) {
    return forEachPage(page -> toElements(page).forEach(action));
  }

  /** Collects the items of the current and all following pages. */
  public CompletableFuture<List<T>> toList() {
    List<T> items = new ArrayList<>();
    CompletableFuture<Void> done = forEach(items::add);
    CompletableFuture<List<T>> result = done.thenApply(v -> items);
    result.whenComplete(
        (r, e) -> {
          if (result.isCancelled()) {
            done.cancel(true);
          }
        });
    return result;
  }

  // Loops while fetches complete synchronously, recursion only happens through callbacks.
  private void drive(Consumer<? super RespT> action, CompletableFuture<Void> done) {
    while (!done.isDone()) {
      if (!hasNextPage()) {
        done.complete(null);
        return;
      }
      CompletableFuture<RespT> next = fetchNextPage();
      if (!next.isDone()) {
        next.whenComplete(
            (page, e) -> {
              if (e != null) {
                done.completeExceptionally(GrpcFutures.unwrap(e));
              } else if (accept(action, page, done)) {
                drive(action, done);
              }
            });
        return;
      }
      RespT page;
      try {
        page = next.join();
      } catch (RuntimeException e) {
        done.completeExceptionally(GrpcFutures.unwrap(e));
        return;
      }
      if (!accept(action, page, done)) {
        return;
      }
    }
  }

  private static <P> boolean accept(
      Consumer<? super P> action, P page, CompletableFuture<Void> done) {
    try {
      action.accept(page);
      return true;
    } catch (RuntimeException e) {
      done.completeExceptionally(e);
      return false;
    }
  }

  private static <R> CompletableFuture<R> failed(Throwable e) {
    CompletableFuture<R> result = new CompletableFuture<>();
    result.completeExceptionally(e);
    return result;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("state", state)
        .add("currentPage", response)
        .toString();
  }
}
