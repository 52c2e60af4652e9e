package io.dataproc.client.paging;

import static io.dataproc.client.paging.PagerTest.page;
import static org.junit.Assert.*;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.dataproc.api.v1.Cluster;
import io.dataproc.api.v1.ListClustersRequest;
import io.dataproc.api.v1.ListClustersResponse;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;
import org.junit.Test;

public class AsyncPagerTest {
  private static final ListClustersRequest REQUEST =
      ListClustersRequest.newBuilder().setProjectId("p").setRegion("r").build();

  private static final Map<String, ListClustersResponse> PAGES =
      ImmutableMap.of(
          "abc", page("def"),
          "def", page("ghi", "c4"),
          "ghi", page("", "c5", "c6"));

  /** Completes each fetch when the test says so. */
  private static class ManualFetcher
      implements AsyncPageFetcher<ListClustersRequest, ListClustersResponse> {
    final List<String> tokens = new CopyOnWriteArrayList<>();
    final List<CompletableFuture<ListClustersResponse>> calls = new CopyOnWriteArrayList<>();

    @Override
    public CompletableFuture<ListClustersResponse> fetch(
        ListClustersRequest request, Metadata metadata) {
      tokens.add(request.getPageToken());
      CompletableFuture<ListClustersResponse> call = new CompletableFuture<>();
      calls.add(call);
      return call;
    }

    void completeLast() {
      String token = tokens.get(tokens.size() - 1);
      calls.get(calls.size() - 1).complete(PAGES.get(token));
    }
  }

  private static final AsyncPageFetcher<ListClustersRequest, ListClustersResponse>
      IMMEDIATE_FETCHER =
          (request, metadata) ->
              CompletableFuture.completedFuture(PAGES.get(request.getPageToken()));

  private static ListClustersAsyncPager pager(
      AsyncPageFetcher<ListClustersRequest, ListClustersResponse> fetcher) {
    return new ListClustersAsyncPager(
        fetcher, REQUEST, page("abc", "c1", "c2", "c3"), new Metadata());
  }

  private static List<String> names(List<Cluster> clusters) {
    return clusters.stream().map(Cluster::getClusterName).collect(Collectors.toList());
  }

  @Test
  public void testToListMatchesSyncPager() throws Exception {
    List<Cluster> clusters = pager(IMMEDIATE_FETCHER).toList().get();

    assertEquals(ImmutableList.of("c1", "c2", "c3", "c4", "c5", "c6"), names(clusters));
  }

  @Test
  public void testForEachPageVisitsEveryPage() throws Exception {
    List<String> tokens = new ArrayList<>();
    pager(IMMEDIATE_FETCHER).forEachPage(p -> tokens.add(p.getNextPageToken())).get();

    assertEquals(ImmutableList.of("abc", "def", "ghi", ""), tokens);
  }

  @Test
  public void testManyImmediatePagesDoNotGrowTheStack() throws Exception {
    int pageCount = 10_000;
    AsyncPageFetcher<ListClustersRequest, ListClustersResponse> fetcher =
        (request, metadata) -> {
          int n = Integer.parseInt(request.getPageToken());
          String next = n + 1 < pageCount ? String.valueOf(n + 1) : "";
          return CompletableFuture.completedFuture(page(next, "c" + n));
        };
    ListClustersAsyncPager pager =
        new ListClustersAsyncPager(fetcher, REQUEST, page("1", "c0"), new Metadata());

    assertEquals(pageCount, pager.toList().get().size());
  }

  @Test
  public void testFetchesOnePageAtATime() throws Exception {
    ManualFetcher fetcher = new ManualFetcher();
    ListClustersAsyncPager pager = pager(fetcher);
    CompletableFuture<List<Cluster>> all = pager.toList();

    assertEquals(ImmutableList.of("abc"), fetcher.tokens);
    fetcher.completeLast();
    assertEquals(ImmutableList.of("abc", "def"), fetcher.tokens);
    fetcher.completeLast();
    fetcher.completeLast();

    assertEquals(6, all.get().size());
    assertEquals(ImmutableList.of("abc", "def", "ghi"), fetcher.tokens);
    assertFalse(pager.hasNextPage());
  }

  @Test
  public void testConcurrentFetchIsRejected() {
    ManualFetcher fetcher = new ManualFetcher();
    ListClustersAsyncPager pager = pager(fetcher);
    CompletableFuture<ListClustersResponse> first = pager.fetchNextPage();

    CompletableFuture<ListClustersResponse> second = pager.fetchNextPage();

    assertFailsWith(IllegalStateException.class, second);
    assertEquals(1, fetcher.calls.size());
    fetcher.completeLast();
    assertEquals("def", first.join().getNextPageToken());
    assertSame(first.join(), pager.getCurrentPage());
  }

  @Test
  public void testFetchAfterLastPageIsRejected() {
    ListClustersAsyncPager pager =
        new ListClustersAsyncPager(IMMEDIATE_FETCHER, REQUEST, page("", "c1"), new Metadata());

    assertFalse(pager.hasNextPage());
    assertFailsWith(IllegalStateException.class, pager.fetchNextPage());
  }

  @Test
  public void testFailureSurfacesUnwrappedAndFailsPager() {
    StatusRuntimeException unavailable = new StatusRuntimeException(Status.UNAVAILABLE);
    AsyncPageFetcher<ListClustersRequest, ListClustersResponse> fetcher =
        (request, metadata) -> {
          CompletableFuture<ListClustersResponse> failed = new CompletableFuture<>();
          failed.completeExceptionally(unavailable);
          return failed;
        };
    ListClustersAsyncPager pager = pager(fetcher);
    List<Cluster> seen = new ArrayList<>();

    CompletableFuture<Void> done = pager.forEach(seen::add);

    try {
      done.get();
      fail("unreachable");
    } catch (ExecutionException e) {
      assertSame(unavailable, e.getCause());
    } catch (InterruptedException e) {
      throw new AssertionError(e);
    }
    assertEquals(3, seen.size());
    assertFalse(pager.hasNextPage());
    assertEquals("abc", pager.getNextPageToken());
    assertFailsWith(IllegalStateException.class, pager.fetchNextPage());
  }

  @Test
  public void testThirdFetchFailureAfterDeliveredPages() {
    StatusRuntimeException unavailable = new StatusRuntimeException(Status.UNAVAILABLE);
    List<String> tokens = new ArrayList<>();
    AsyncPageFetcher<ListClustersRequest, ListClustersResponse> fetcher =
        (request, metadata) -> {
          tokens.add(request.getPageToken());
          if (request.getPageToken().equals("ghi")) {
            CompletableFuture<ListClustersResponse> failed = new CompletableFuture<>();
            failed.completeExceptionally(unavailable);
            return failed;
          }
          return CompletableFuture.completedFuture(PAGES.get(request.getPageToken()));
        };
    ListClustersAsyncPager pager = pager(fetcher);
    List<Cluster> seen = new ArrayList<>();

    CompletableFuture<Void> done = pager.forEach(seen::add);

    try {
      done.join();
      fail("unreachable");
    } catch (RuntimeException e) {
      assertSame(unavailable, e.getCause());
    }
    assertEquals(ImmutableList.of("abc", "def", "ghi"), tokens);
    assertEquals(ImmutableList.of("c1", "c2", "c3", "c4"), names(seen));
    assertEquals("ghi", pager.getNextPageToken());
    assertFalse(pager.hasNextPage());
    assertFailsWith(IllegalStateException.class, pager.fetchNextPage());
  }

  @Test
  public void testCallCompletingDuringCancelDoesNotAdvancePager() {
    ManualFetcher fetcher = new ManualFetcher();
    ListClustersAsyncPager pager = pager(fetcher);
    ListClustersResponse before = pager.getCurrentPage();
    CompletableFuture<ListClustersResponse> next = pager.fetchNextPage();
    // Runs before the pager's own cancel callback.
    next.whenComplete((page, e) -> fetcher.completeLast());

    assertTrue(next.cancel(true));

    assertTrue(fetcher.calls.get(0).isDone());
    assertSame(before, pager.getCurrentPage());
    assertFalse(pager.hasNextPage());
    assertFailsWith(IllegalStateException.class, pager.fetchNextPage());
    assertEquals(1, fetcher.calls.size());
  }

  @Test
  public void testCancelFailsPagerAndKeepsCurrentPage() {
    ManualFetcher fetcher = new ManualFetcher();
    ListClustersAsyncPager pager = pager(fetcher);
    ListClustersResponse before = pager.getCurrentPage();
    CompletableFuture<List<Cluster>> all = pager.toList();

    assertTrue(all.cancel(true));

    assertTrue(fetcher.calls.get(0).isCancelled());
    assertSame(before, pager.getCurrentPage());
    assertFalse(pager.hasNextPage());
    assertFailsWith(IllegalStateException.class, pager.fetchNextPage());
  }

  @Test
  public void testConsumerFailureStopsIteration() {
    ManualFetcher fetcher = new ManualFetcher();
    RuntimeException boom = new RuntimeException("boom");

    CompletableFuture<Void> done =
        pager(fetcher)
            .forEach(
                c -> {
                  throw boom;
                });

    try {
      done.join();
      fail("unreachable");
    } catch (RuntimeException e) {
      assertSame(boom, e.getCause());
    }
    assertTrue(fetcher.calls.isEmpty());
  }

  private static void assertFailsWith(Class<? extends Throwable> type, CompletableFuture<?> f) {
    assertTrue(f.isCompletedExceptionally());
    try {
      f.join();
      fail("unreachable");
    } catch (CancellationException e) {
      fail("cancelled");
    } catch (RuntimeException e) {
      assertTrue(String.valueOf(e.getCause()), type.isInstance(e.getCause()));
    }
  }
}
