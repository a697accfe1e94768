package com.slack.sift.transport;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linecorp.armeria.client.WebClient;
import com.linecorp.armeria.common.AggregatedHttpResponse;
import com.linecorp.armeria.common.HttpData;
import com.linecorp.armeria.common.HttpMethod;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.common.QueryParams;
import com.linecorp.armeria.common.QueryParamsBuilder;
import com.linecorp.armeria.common.RequestHeaders;
import com.linecorp.armeria.common.RequestHeadersBuilder;
import com.slack.sift.util.JsonUtil;
import java.io.IOException;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link SearchApi} over an Armeria {@link WebClient}. */
public class ArmeriaSearchApi implements SearchApi {
  private static final Logger LOG = LoggerFactory.getLogger(ArmeriaSearchApi.class);

  public static final String TRACEPARENT_HEADER = "traceparent";

  private final WebClient webClient;

  public ArmeriaSearchApi(String baseUri, Duration requestTimeout) {
    this(WebClient.builder(baseUri).responseTimeout(requestTimeout).build());
  }

  public ArmeriaSearchApi(WebClient webClient) {
    this.webClient = webClient;
  }

  @Override
  public CompletableFuture<SearchResponse> search(
      String orgId, String streamType, ObjectNode body, String traceparent) {
    String path =
        "/api/"
            + orgId
            + "/_search?"
            + QueryParams.of("type", streamType, "search_type", "ui").toQueryString();
    return execute(
        HttpMethod.POST,
        path,
        body,
        traceparent,
        content -> JsonUtil.read(content, SearchResponse.class));
  }

  @Override
  public CompletableFuture<PartitionResponse> partition(
      String orgId, String streamType, ObjectNode body, String traceparent) {
    String path =
        "/api/"
            + orgId
            + "/_search_partition?"
            + QueryParams.of("type", streamType, "enable_align_histogram", "true").toQueryString();
    return execute(
        HttpMethod.POST,
        path,
        body,
        traceparent,
        content -> JsonUtil.read(content, PartitionResponse.class));
  }

  @Override
  public CompletableFuture<List<CancelResult>> deleteRunningQueries(
      String orgId, Collection<String> traceIds) {
    ArrayNode body = JsonUtil.arrayNode();
    traceIds.forEach(body::add);
    return execute(
        HttpMethod.DELETE,
        "/api/" + orgId + "/query_manager/cancel",
        body,
        null,
        content -> JsonUtil.read(content, new TypeReference<List<CancelResult>>() {}));
  }

  @Override
  public CompletableFuture<SearchResponse> searchAround(
      String orgId, String streamType, String stream, String key, int size, String sql) {
    QueryParamsBuilder params =
        QueryParams.builder()
            .add("key", key)
            .add("size", String.valueOf(size))
            .add("type", streamType);
    if (sql != null) {
      params.add("sql", sql);
    }
    String path = "/api/" + orgId + "/" + stream + "/_around?" + params.build().toQueryString();
    return execute(
        HttpMethod.GET, path, null, null, content -> JsonUtil.read(content, SearchResponse.class));
  }

  @FunctionalInterface
  private interface BodyReader<T> {
    T read(String content) throws IOException;
  }

  private <T> CompletableFuture<T> execute(
      HttpMethod method, String path, JsonNode body, String traceparent, BodyReader<T> reader) {
    RequestHeadersBuilder headers = RequestHeaders.builder(method, path);
    if (traceparent != null) {
      headers.add(TRACEPARENT_HEADER, traceparent);
    }

    CompletableFuture<AggregatedHttpResponse> response;
    if (body == null) {
      response = webClient.execute(headers.build()).aggregate();
    } else {
      headers.contentType(MediaType.JSON_UTF_8);
      try {
        response =
            webClient
                .execute(headers.build(), HttpData.ofUtf8(JsonUtil.writeAsString(body)))
                .aggregate();
      } catch (IOException e) {
        return CompletableFuture.failedFuture(e);
      }
    }
    return response.thenApply(readResponse(path, reader));
  }

  private static <T> Function<AggregatedHttpResponse, T> readResponse(
      String path, BodyReader<T> reader) {
    return response -> {
      String content = response.contentUtf8();
      if (!response.status().isSuccess()) {
        LOG.warn("Request to {} failed with status {}", path, response.status());
        throw toSearchException(response.status().code(), content);
      }
      try {
        return reader.read(content);
      } catch (IOException e) {
        throw new SearchException("Unable to parse response of " + path, null, e);
      }
    };
  }

  /**
   * Builds the exception for an error body: {@code {code, message, error, error_detail,
   * trace_id}}.
   */
  static SearchException toSearchException(int status, String content) {
    JsonNode error = null;
    try {
      error = content.isEmpty() ? null : JsonUtil.readTree(content);
    } catch (IOException e) {
      LOG.debug("Error body is not json: {}", content);
    }
    if (error == null || !error.isObject()) {
      return new SearchException(status, 0, content, null, null, null);
    }
    return new SearchException(
        status,
        error.path("code").asInt(0),
        textOrNull(error, "message"),
        textOrNull(error, "error"),
        textOrNull(error, "error_detail"),
        textOrNull(error, "trace_id"));
  }

  static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }
}
