package com.slack.sift.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** User input of one search: the query text, the selected streams, the window and the grid. */
public class SearchParameters {
  public final List<StreamSchema> streams;
  public final String query;
  public final boolean sqlMode;
  public final boolean quickMode;
  public final List<String> interestingFields;
  public final long startTime;
  public final long endTime;
  public final int rowsPerPage;
  public final int currentPage;
  public final boolean showHistogram;
  public final String timestampColumn;
  public final List<String> regions;
  public final List<String> clusters;
  // Streams lacking a field used by the filter, skipped by the multi-stream histogram.
  public final Set<String> missingFilterStreams;

  private SearchParameters(Builder builder) {
    this.streams = List.copyOf(builder.streams);
    this.query = builder.query;
    this.sqlMode = builder.sqlMode;
    this.quickMode = builder.quickMode;
    this.interestingFields = List.copyOf(builder.interestingFields);
    this.startTime = builder.startTime;
    this.endTime = builder.endTime;
    this.rowsPerPage = builder.rowsPerPage;
    this.currentPage = builder.currentPage;
    this.showHistogram = builder.showHistogram;
    this.timestampColumn = builder.timestampColumn;
    this.regions = List.copyOf(builder.regions);
    this.clusters = List.copyOf(builder.clusters);
    this.missingFilterStreams = Set.copyOf(builder.missingFilterStreams);
  }

  public boolean isMultiStream() {
    return streams.size() > 1;
  }

  public List<String> streamNames() {
    List<String> names = new ArrayList<>(streams.size());
    streams.forEach(s -> names.add(s.name()));
    return names;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .streams(streams)
        .query(query)
        .sqlMode(sqlMode)
        .quickMode(quickMode)
        .interestingFields(interestingFields)
        .timeRange(startTime, endTime)
        .rowsPerPage(rowsPerPage)
        .currentPage(currentPage)
        .showHistogram(showHistogram)
        .timestampColumn(timestampColumn)
        .regions(regions)
        .clusters(clusters)
        .missingFilterStreams(missingFilterStreams);
  }

  public static class Builder {
    private List<StreamSchema> streams = List.of();
    private String query = "";
    private boolean sqlMode;
    private boolean quickMode;
    private List<String> interestingFields = List.of();
    private long startTime;
    private long endTime;
    private int rowsPerPage = 50;
    private int currentPage = 1;
    private boolean showHistogram = true;
    private String timestampColumn = "_timestamp";
    private List<String> regions = List.of();
    private List<String> clusters = List.of();
    private Set<String> missingFilterStreams = Set.of();

    public Builder streams(List<StreamSchema> streams) {
      this.streams = streams;
      return this;
    }

    public Builder query(String query) {
      this.query = query == null ? "" : query;
      return this;
    }

    public Builder sqlMode(boolean sqlMode) {
      this.sqlMode = sqlMode;
      return this;
    }

    public Builder quickMode(boolean quickMode) {
      this.quickMode = quickMode;
      return this;
    }

    public Builder interestingFields(List<String> interestingFields) {
      this.interestingFields = interestingFields;
      return this;
    }

    public Builder timeRange(long startTime, long endTime) {
      this.startTime = startTime;
      this.endTime = endTime;
      return this;
    }

    public Builder rowsPerPage(int rowsPerPage) {
      this.rowsPerPage = rowsPerPage;
      return this;
    }

    public Builder currentPage(int currentPage) {
      this.currentPage = currentPage;
      return this;
    }

    public Builder showHistogram(boolean showHistogram) {
      this.showHistogram = showHistogram;
      return this;
    }

    public Builder timestampColumn(String timestampColumn) {
      this.timestampColumn = timestampColumn;
      return this;
    }

    public Builder regions(List<String> regions) {
      this.regions = regions;
      return this;
    }

    public Builder clusters(List<String> clusters) {
      this.clusters = clusters;
      return this;
    }

    public Builder missingFilterStreams(Set<String> missingFilterStreams) {
      this.missingFilterStreams = missingFilterStreams;
      return this;
    }

    public SearchParameters build() {
      return new SearchParameters(this);
    }
  }
}
