package com.slack.sift.query;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.slack.sift.util.JsonUtil;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * The search request of a single run. A run owns its request exclusively and mutates it between
 * fetches (window, from, size). Derived requests such as the histogram or page count query are
 * made through {@link #copy()}.
 *
 * <p>Nullable fields model optional wire keys: a null {@code from}, {@code quickMode}, {@code
 * trackTotalHits} or {@code actionId} is left out of the serialized query.
 */
public class QueryRequest {
  public static final int ALL_ROWS = -1;

  private List<String> sql;
  private long startTime;
  private long endTime;
  private Integer from = 0;
  private int size;
  private Boolean quickMode;
  private Boolean trackTotalHits;
  private boolean streamingOutput;
  private String streamingId;
  private String sqlMode = "full";
  private String actionId;
  private List<String> regions = List.of();
  private List<String> clusters = List.of();

  public QueryRequest(List<String> sql, long startTime, long endTime, int size) {
    this.sql = new ArrayList<>(sql);
    this.startTime = startTime;
    this.endTime = endTime;
    this.size = size;
  }

  public QueryRequest copy() {
    QueryRequest copy = new QueryRequest(sql, startTime, endTime, size);
    copy.from = from;
    copy.quickMode = quickMode;
    copy.trackTotalHits = trackTotalHits;
    copy.streamingOutput = streamingOutput;
    copy.streamingId = streamingId;
    copy.sqlMode = sqlMode;
    copy.actionId = actionId;
    copy.regions = regions;
    copy.clusters = clusters;
    return copy;
  }

  /** True when the request carries one SQL statement per stream. */
  public boolean isMultiSql() {
    return sql.size() > 1;
  }

  /**
   * Serializes the {@code query} object of a search request. When {@code base64} is set each SQL
   * string is base64 encoded; the caller marks the envelope with {@code encoding: base64}.
   */
  public ObjectNode toQueryNode(boolean base64) {
    ObjectNode query = JsonUtil.objectNode();
    if (isMultiSql()) {
      ArrayNode sqlArray = query.putArray("sql");
      sql.forEach(s -> sqlArray.add(encode(s, base64)));
    } else {
      query.put("sql", encode(sql.get(0), base64));
    }
    query.put("start_time", startTime);
    query.put("end_time", endTime);
    if (from != null) {
      query.put("from", from);
    }
    query.put("size", size);
    if (quickMode != null) {
      query.put("quick_mode", quickMode);
    }
    if (trackTotalHits != null) {
      query.put("track_total_hits", trackTotalHits);
    }
    if (streamingOutput) {
      query.put("streaming_output", true);
      if (streamingId != null) {
        query.put("streaming_id", streamingId);
      }
    }
    query.put("sql_mode", sqlMode);
    if (actionId != null) {
      query.put("action_id", actionId);
    }
    return query;
  }

  static String encode(String sql, boolean base64) {
    if (!base64) {
      return sql;
    }
    return Base64.getEncoder().encodeToString(sql.getBytes(UTF_8));
  }

  public List<String> getSql() {
    return sql;
  }

  public void setSql(List<String> sql) {
    this.sql = new ArrayList<>(sql);
  }

  public void setSql(String sql) {
    this.sql = new ArrayList<>(List.of(sql));
  }

  public long getStartTime() {
    return startTime;
  }

  public void setStartTime(long startTime) {
    this.startTime = startTime;
  }

  public long getEndTime() {
    return endTime;
  }

  public void setEndTime(long endTime) {
    this.endTime = endTime;
  }

  public Integer getFrom() {
    return from;
  }

  public void setFrom(Integer from) {
    this.from = from;
  }

  public int getSize() {
    return size;
  }

  public void setSize(int size) {
    this.size = size;
  }

  public Boolean getQuickMode() {
    return quickMode;
  }

  public void setQuickMode(Boolean quickMode) {
    this.quickMode = quickMode;
  }

  public Boolean getTrackTotalHits() {
    return trackTotalHits;
  }

  public void setTrackTotalHits(Boolean trackTotalHits) {
    this.trackTotalHits = trackTotalHits;
  }

  public boolean isStreamingOutput() {
    return streamingOutput;
  }

  public void setStreamingOutput(boolean streamingOutput) {
    this.streamingOutput = streamingOutput;
  }

  public String getStreamingId() {
    return streamingId;
  }

  public void setStreamingId(String streamingId) {
    this.streamingId = streamingId;
  }

  public String getSqlMode() {
    return sqlMode;
  }

  public void setSqlMode(String sqlMode) {
    this.sqlMode = sqlMode;
  }

  public String getActionId() {
    return actionId;
  }

  public void setActionId(String actionId) {
    this.actionId = actionId;
  }

  public List<String> getRegions() {
    return regions;
  }

  public void setRegions(List<String> regions) {
    this.regions = List.copyOf(regions);
  }

  public List<String> getClusters() {
    return clusters;
  }

  public void setClusters(List<String> clusters) {
    this.clusters = List.copyOf(clusters);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof QueryRequest)) return false;
    QueryRequest that = (QueryRequest) o;
    return startTime == that.startTime
        && endTime == that.endTime
        && size == that.size
        && streamingOutput == that.streamingOutput
        && sql.equals(that.sql)
        && Objects.equals(from, that.from)
        && Objects.equals(quickMode, that.quickMode)
        && Objects.equals(trackTotalHits, that.trackTotalHits)
        && Objects.equals(streamingId, that.streamingId)
        && Objects.equals(sqlMode, that.sqlMode)
        && Objects.equals(actionId, that.actionId)
        && regions.equals(that.regions)
        && clusters.equals(that.clusters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sql, startTime, endTime, from, size, streamingId);
  }

  @Override
  public String toString() {
    return "QueryRequest{"
        + "sql="
        + sql
        + ", startTime="
        + startTime
        + ", endTime="
        + endTime
        + ", from="
        + from
        + ", size="
        + size
        + ", trackTotalHits="
        + trackTotalHits
        + ", streamingOutput="
        + streamingOutput
        + ", streamingId='"
        + streamingId
        + '\''
        + '}';
  }
}
