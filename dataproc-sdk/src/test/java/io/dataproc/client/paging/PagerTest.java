package io.dataproc.client.paging;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.dataproc.api.v1.Cluster;
import io.dataproc.api.v1.Job;
import io.dataproc.api.v1.ListClustersRequest;
import io.dataproc.api.v1.ListClustersResponse;
import io.dataproc.api.v1.ListJobsRequest;
import io.dataproc.api.v1.ListJobsResponse;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

public class PagerTest {
  private static final Metadata.Key<String> ROUTING_KEY =
      Metadata.Key.of("x-goog-request-params", Metadata.ASCII_STRING_MARSHALLER);

  private static final ListClustersRequest REQUEST =
      ListClustersRequest.newBuilder().setProjectId("p").setRegion("r").setPageSize(3).build();

  private PageFetcher<ListClustersRequest, ListClustersResponse> fetcher;
  private Metadata metadata;

  @SuppressWarnings("unchecked")
  @Before
  public void setUp() {
    fetcher = mock(PageFetcher.class);
    metadata = new Metadata();
    metadata.put(ROUTING_KEY, "project_id=p&region=r");
  }

  static ListClustersResponse page(String nextPageToken, String... names) {
    ListClustersResponse.Builder page =
        ListClustersResponse.newBuilder().setNextPageToken(nextPageToken);
    for (String name : names) {
      page.addClusters(Cluster.newBuilder().setClusterName(name));
    }
    return page.build();
  }

  private static ListClustersRequest withToken(String token) {
    return REQUEST.toBuilder().setPageToken(token).build();
  }

  private void stubPages() {
    when(fetcher.fetch(eq(withToken("abc")), any())).thenReturn(page("def"));
    when(fetcher.fetch(eq(withToken("def")), any())).thenReturn(page("ghi", "c4"));
    when(fetcher.fetch(eq(withToken("ghi")), any())).thenReturn(page("", "c5", "c6"));
  }

  @Test
  public void testIteratesItemsAcrossPages() {
    stubPages();
    ListClustersPager pager =
        new ListClustersPager(fetcher, REQUEST, page("abc", "c1", "c2", "c3"), metadata);

    List<String> names =
        pager.stream().map(Cluster::getClusterName).collect(Collectors.toList());

    assertEquals(ImmutableList.of("c1", "c2", "c3", "c4", "c5", "c6"), names);
    verify(fetcher, times(3)).fetch(any(), any());
    assertEquals("", pager.getNextPageToken());
    assertEquals(2, pager.getCurrentPage().getClustersCount());
  }

  @Test
  public void testPagesYieldEveryPageIncludingEmptyOnes() {
    stubPages();
    ListClustersPager pager =
        new ListClustersPager(fetcher, REQUEST, page("abc", "c1", "c2", "c3"), metadata);

    List<String> tokens = new ArrayList<>();
    for (ListClustersResponse page : pager.pages()) {
      tokens.add(page.getNextPageToken());
    }

    assertEquals(ImmutableList.of("abc", "def", "ghi", ""), tokens);
  }

  @Test
  public void testSinglePageMakesNoCalls() {
    ListClustersPager pager = new ListClustersPager(fetcher, REQUEST, page("", "c1"), metadata);

    assertEquals(1, Lists.newArrayList(pager).size());
    assertEquals(1, Lists.newArrayList(pager.pages()).size());
    verifyNoInteractions(fetcher);
  }

  @Test
  public void testFetchesLazily() {
    stubPages();
    ListClustersPager pager =
        new ListClustersPager(fetcher, REQUEST, page("abc", "c1", "c2", "c3"), metadata);
    Iterator<Cluster> items = pager.iterator();

    for (int i = 0; i < 3; i++) {
      items.next();
    }
    verifyNoInteractions(fetcher);

    // page "def" is empty, so reaching c4 takes two fetches
    assertEquals("c4", items.next().getClusterName());
    verify(fetcher, times(2)).fetch(any(), any());
  }

  @Test
  public void testSendsCallMetadataWithEveryFetch() {
    stubPages();
    ListClustersPager pager =
        new ListClustersPager(fetcher, REQUEST, page("abc", "c1"), metadata);
    pager.forEach(c -> {});

    ArgumentCaptor<Metadata> captor = ArgumentCaptor.forClass(Metadata.class);
    verify(fetcher, times(3)).fetch(any(), captor.capture());
    for (Metadata sent : captor.getAllValues()) {
      assertEquals("project_id=p&region=r", sent.get(ROUTING_KEY));
    }
    assertEquals("project_id=p&region=r", pager.getMetadata().get(ROUTING_KEY));
  }

  @Test
  public void testFetchFailurePropagatesAndFailsPager() {
    StatusRuntimeException unavailable = new StatusRuntimeException(Status.UNAVAILABLE);
    when(fetcher.fetch(eq(withToken("abc")), any())).thenReturn(page("def", "c2"));
    when(fetcher.fetch(eq(withToken("def")), any())).thenThrow(unavailable);
    ListClustersPager pager = new ListClustersPager(fetcher, REQUEST, page("abc", "c1"), metadata);

    List<String> seen = new ArrayList<>();
    try {
      for (Cluster cluster : pager) {
        seen.add(cluster.getClusterName());
      }
      fail("unreachable");
    } catch (StatusRuntimeException e) {
      assertSame(unavailable, e);
    }

    assertEquals(ImmutableList.of("c1", "c2"), seen);
    assertEquals("def", pager.getNextPageToken());
    try {
      pager.iterator();
      fail("unreachable");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains("failed"));
    }
  }

  @Test
  public void testNullPageIsRejected() {
    ListClustersPager pager = new ListClustersPager(fetcher, REQUEST, page("abc"), metadata);

    try {
      Lists.newArrayList(pager);
      fail("unreachable");
    } catch (NullPointerException e) {
      assertTrue(e.getMessage().contains("null page"));
    }
  }

  @Test
  public void testSecondIterationResumesAtCurrentPage() {
    stubPages();
    ListClustersPager pager =
        new ListClustersPager(fetcher, REQUEST, page("abc", "c1", "c2", "c3"), metadata);
    Lists.newArrayList(pager);

    List<String> again =
        pager.stream().map(Cluster::getClusterName).collect(Collectors.toList());

    assertEquals(ImmutableList.of("c5", "c6"), again);
    verify(fetcher, times(3)).fetch(any(), any());
  }

  @SuppressWarnings("unchecked")
  @Test
  public void testUnreachableOfCurrentPage() {
    PageFetcher<ListJobsRequest, ListJobsResponse> jobsFetcher = mock(PageFetcher.class);
    ListJobsRequest request = ListJobsRequest.newBuilder().setProjectId("p").build();
    when(jobsFetcher.fetch(any(), any()))
        .thenReturn(
            ListJobsResponse.newBuilder()
                .addJobs(Job.newBuilder().setJobUuid("j2"))
                .addUnreachable("us-east1")
                .build());
    ListJobsPager pager =
        new ListJobsPager(
            jobsFetcher,
            request,
            ListJobsResponse.newBuilder()
                .addJobs(Job.newBuilder().setJobUuid("j1"))
                .setNextPageToken("t")
                .build(),
            metadata);

    assertTrue(pager.getUnreachableList().isEmpty());
    assertEquals(2, Lists.newArrayList(pager).size());
    assertEquals(ImmutableList.of("us-east1"), pager.getUnreachableList());
  }
}
