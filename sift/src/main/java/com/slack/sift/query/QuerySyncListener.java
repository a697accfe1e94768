package com.slack.sift.query;

/** Receives the filters of every built query, e.g. to mirror them into a shareable url. */
public interface QuerySyncListener {
  QuerySyncListener NOOP = (parameters, request) -> {};

  void onQueryBuilt(SearchParameters parameters, QueryRequest request);
}
