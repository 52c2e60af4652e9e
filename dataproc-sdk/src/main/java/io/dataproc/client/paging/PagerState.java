package io.dataproc.client.paging;

enum PagerState {
  /** The pager holds a page, the page may or may not have a next page token. */
  HOLDING_PAGE,
  /** A fetch of the next page is in progress. */
  FETCHING,
  /** A fetch failed or was cancelled. Terminal. */
  FAILED
}
