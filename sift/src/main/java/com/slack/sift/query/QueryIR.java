package com.slack.sift.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structured form of a SQL statement, produced by a {@link SqlParser} and turned back into text by
 * a {@link SqlRenderer}. Only the parts the orchestrator rewrites are modelled: projection, source
 * streams, filter, grouping, ordering and limit/offset, plus the flags that gate the histogram.
 */
public final class QueryIR {
  public final List<String> columns;
  public final List<String> streams;
  public final String where;
  public final List<String> groupBy;
  public final List<OrderBy> orderBy;
  public final Long limit;
  public final Long offset;
  public final boolean distinct;
  public final boolean hasWith;
  public final boolean hasJoin;
  public final boolean hasAggregation;

  public static class OrderBy {
    public final String field;
    public final boolean ascending;

    public OrderBy(String field, boolean ascending) {
      this.field = field;
      this.ascending = ascending;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof OrderBy)) return false;
      OrderBy orderBy = (OrderBy) o;
      return ascending == orderBy.ascending && field.equals(orderBy.field);
    }

    @Override
    public int hashCode() {
      return Objects.hash(field, ascending);
    }

    @Override
    public String toString() {
      return field + (ascending ? " ASC" : " DESC");
    }
  }

  private QueryIR(Builder builder) {
    this.columns = List.copyOf(builder.columns);
    this.streams = List.copyOf(builder.streams);
    this.where = builder.where;
    this.groupBy = List.copyOf(builder.groupBy);
    this.orderBy = List.copyOf(builder.orderBy);
    this.limit = builder.limit;
    this.offset = builder.offset;
    this.distinct = builder.distinct;
    this.hasWith = builder.hasWith;
    this.hasJoin = builder.hasJoin;
    this.hasAggregation = builder.hasAggregation;
  }

  public boolean isLimitQuery() {
    return limit != null;
  }

  /** Aggregation or grouping makes the result a table of rows instead of a list of hits. */
  public boolean isAggregation() {
    return hasAggregation || !groupBy.isEmpty();
  }

  public boolean isOrderedAscendingBy(String field) {
    return orderBy.stream().anyMatch(o -> o.field.equals(field) && o.ascending);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.columns = new ArrayList<>(columns);
    builder.streams = new ArrayList<>(streams);
    builder.where = where;
    builder.groupBy = new ArrayList<>(groupBy);
    builder.orderBy = new ArrayList<>(orderBy);
    builder.limit = limit;
    builder.offset = offset;
    builder.distinct = distinct;
    builder.hasWith = hasWith;
    builder.hasJoin = hasJoin;
    builder.hasAggregation = hasAggregation;
    return builder;
  }

  public static class Builder {
    private List<String> columns = new ArrayList<>();
    private List<String> streams = new ArrayList<>();
    private String where;
    private List<String> groupBy = new ArrayList<>();
    private List<OrderBy> orderBy = new ArrayList<>();
    private Long limit;
    private Long offset;
    private boolean distinct;
    private boolean hasWith;
    private boolean hasJoin;
    private boolean hasAggregation;

    public Builder columns(List<String> columns) {
      this.columns = new ArrayList<>(columns);
      return this;
    }

    public Builder streams(List<String> streams) {
      this.streams = new ArrayList<>(streams);
      return this;
    }

    public Builder where(String where) {
      this.where = where;
      return this;
    }

    public Builder groupBy(List<String> groupBy) {
      this.groupBy = new ArrayList<>(groupBy);
      return this;
    }

    public Builder orderBy(List<OrderBy> orderBy) {
      this.orderBy = new ArrayList<>(orderBy);
      return this;
    }

    public Builder limit(Long limit) {
      this.limit = limit;
      return this;
    }

    public Builder offset(Long offset) {
      this.offset = offset;
      return this;
    }

    public Builder distinct(boolean distinct) {
      this.distinct = distinct;
      return this;
    }

    public Builder hasWith(boolean hasWith) {
      this.hasWith = hasWith;
      return this;
    }

    public Builder hasJoin(boolean hasJoin) {
      this.hasJoin = hasJoin;
      return this;
    }

    public Builder hasAggregation(boolean hasAggregation) {
      this.hasAggregation = hasAggregation;
      return this;
    }

    public QueryIR build() {
      return new QueryIR(this);
    }
  }

  @Override
  public String toString() {
    return "QueryIR{"
        + "columns="
        + columns
        + ", streams="
        + streams
        + ", where='"
        + where
        + '\''
        + ", groupBy="
        + groupBy
        + ", orderBy="
        + orderBy
        + ", limit="
        + limit
        + ", offset="
        + offset
        + ", distinct="
        + distinct
        + ", hasWith="
        + hasWith
        + ", hasJoin="
        + hasJoin
        + ", hasAggregation="
        + hasAggregation
        + '}';
  }
}
