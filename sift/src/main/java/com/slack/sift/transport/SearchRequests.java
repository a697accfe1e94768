package com.slack.sift.transport;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.slack.sift.query.QueryRequest;
import com.slack.sift.util.JsonUtil;
import java.util.List;

/** Request bodies shared by the http and websocket transports. */
public final class SearchRequests {
  public static final String BASE64_ENCODING = "base64";

  private SearchRequests() {}

  /** {@code {query: {...}, encoding?, regions?, clusters?}} */
  public static ObjectNode searchBody(QueryRequest request, boolean base64) {
    ObjectNode body = JsonUtil.objectNode();
    body.set("query", request.toQueryNode(base64));
    if (base64) {
      body.put("encoding", BASE64_ENCODING);
    }
    addLocations(body, request);
    return body;
  }

  /** {@code {sql, start_time, end_time, streaming_output: true, encoding?, regions?, clusters?}} */
  public static ObjectNode partitionBody(QueryRequest request, boolean base64) {
    ObjectNode query = request.toQueryNode(base64);
    ObjectNode body = JsonUtil.objectNode();
    body.set("sql", query.get("sql"));
    body.put("start_time", request.getStartTime());
    body.put("end_time", request.getEndTime());
    if (base64) {
      body.put("encoding", BASE64_ENCODING);
    }
    addLocations(body, request);
    body.put("streaming_output", true);
    return body;
  }

  private static void addLocations(ObjectNode body, QueryRequest request) {
    addArray(body, "regions", request.getRegions());
    addArray(body, "clusters", request.getClusters());
  }

  private static void addArray(ObjectNode body, String field, List<String> values) {
    if (!values.isEmpty()) {
      ArrayNode array = body.putArray(field);
      values.forEach(array::add);
    }
  }
}
