package io.dataproc.client.paging;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.Iterators;
import io.grpc.Metadata;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazily walks the pages of a list call by feeding the next page token of each response into a
 * copy of the original request. It is created with the first page already fetched. Every further
 * page costs exactly one blocking call, made on the consuming thread when the iteration reaches
 * the end of the current page. Only the current page is retained.
 *
 * <p>Failures of the fetcher surface unmodified from {@code hasNext()} or {@code next()} of the
 * iterator that triggered the fetch. Pages and items delivered before stay valid. A failed pager
 * can't be iterated again.
 *
 * @param <ReqT> list request
 * @param <RespT> list response
 * @param <T> listed item
 */
@NotThreadSafe
public abstract class Pager<ReqT, RespT, T> implements Iterable<T> {
  private static final Logger log = LoggerFactory.getLogger(Pager.class);

  private final PageFetcher<ReqT, RespT> fetcher;
  private final Metadata metadata;
  private ReqT request;
  private RespT response;
  private PagerState state = PagerState.HOLDING_PAGE;

  /**
   * @param fetcher issues the call for the following pages
   * @param request request that produced {@code response}
   * @param response first page
   * @param metadata attached to every following call
   */
  protected Pager(
      PageFetcher<ReqT, RespT> fetcher, ReqT request, RespT response, Metadata metadata) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.request = Objects.requireNonNull(request, "request");
    this.response = Objects.requireNonNull(response, "response");
    this.metadata = copyOf(Objects.requireNonNull(metadata, "metadata"));
  }

  /** Copy of {@code request} with the page token replaced. */
  protected abstract ReqT withPageToken(ReqT request, String pageToken);

  protected abstract String nextPageToken(RespT response);

  protected abstract List<T> toElements(RespT response);

  /** The most recently fetched page. */
  public RespT getCurrentPage() {
    return response;
  }

  /** Token of the page after the current one, empty if the current page is the last. */
  public String getNextPageToken() {
    return Strings.nullToEmpty(nextPageToken(response));
  }

  public Metadata getMetadata() {
    return copyOf(metadata);
  }

  /**
   * Pages starting with the current one. Iterating past a page with a non empty next page token
   * fetches the following page.
   *
   * @throws IllegalStateException if a previous fetch failed
   */
  public Iterable<RespT> pages() {
    checkNotFailed();
    return PageIterator::new;
  }

  /**
   * Items of the current and all following pages, in page order.
   *
   * @throws IllegalStateException if a previous fetch failed
   */
  @Override
  public Iterator<T> iterator() {
    return Iterators.concat(
        Iterators.transform(pages().iterator(), page -> toElements(page).iterator()));
  }

  public Stream<T> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  private void checkNotFailed() {
    if (state == PagerState.FAILED) {
      throw new IllegalStateException("Pager can't be used after a failed page fetch");
    }
  }

  private void advance() {
    String token = nextPageToken(response);
    ReqT nextRequest = withPageToken(request, token);
    state = PagerState.FETCHING;
    if (log.isDebugEnabled()) {
      log.debug("Fetching page of {}, pageToken={}", getClass().getSimpleName(), token);
    }
    RespT nextResponse;
    try {
      nextResponse =
          Objects.requireNonNull(
              fetcher.fetch(nextRequest, copyOf(metadata)), "fetcher returned null page");
    } catch (RuntimeException | Error e) {
      state = PagerState.FAILED;
      throw e;
    }
    request = nextRequest;
    response = nextResponse;
    state = PagerState.HOLDING_PAGE;
  }

  static Metadata copyOf(Metadata metadata) {
    Metadata copy = new Metadata();
    copy.merge(metadata);
    return copy;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("state", state)
        .add("currentPage", response)
        .toString();
  }

  private final class PageIterator implements Iterator<RespT> {
    private boolean currentConsumed;

    @Override
    public boolean hasNext() {
      if (state == PagerState.FAILED) {
        return false;
      }
      if (!currentConsumed) {
        return true;
      }
      if (Strings.isNullOrEmpty(nextPageToken(response))) {
        return false;
      }
      advance();
      currentConsumed = false;
      return true;
    }

    @Override
    public RespT next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      currentConsumed = true;
      return response;
    }
  }
}
