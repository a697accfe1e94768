package com.slack.sift.transport;

/** What a search call is for. Error reporting and result handling differ per type. */
public enum SearchType {
  SEARCH("search"),
  HISTOGRAM("histogram"),
  PAGE_COUNT("pageCount");

  public final String wireName;

  SearchType(String wireName) {
    this.wireName = wireName;
  }
}
