package com.slack.sift.util;

import com.fasterxml.jackson.core.JsonParser.Feature;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.afterburner.AfterburnerModule;
import java.io.IOException;

/** Shared Jackson mapper for every request body, response body and websocket frame. */
public class JsonUtil {
  private static final JsonUtil ourInstance = new JsonUtil();
  private final ObjectMapper mapper;

  public static JsonUtil getInstance() {
    return ourInstance;
  }

  public static ObjectMapper mapper() {
    return ourInstance.mapper;
  }

  public static <T> String writeAsString(T obj) throws JsonProcessingException {
    return ourInstance.mapper.writeValueAsString(obj);
  }

  public static <T> T read(String s, Class<T> cls) throws IOException {
    return ourInstance.mapper.readValue(s, cls);
  }

  public static <T> T read(String s, TypeReference<T> valueTypeRef) throws JsonProcessingException {
    return ourInstance.mapper.readValue(s, valueTypeRef);
  }

  public static JsonNode readTree(String s) throws JsonProcessingException {
    return ourInstance.mapper.readTree(s);
  }

  public static <T> T convert(JsonNode node, Class<T> cls) throws JsonProcessingException {
    return ourInstance.mapper.treeToValue(node, cls);
  }

  public static ObjectNode objectNode() {
    return ourInstance.mapper.createObjectNode();
  }

  public static ArrayNode arrayNode() {
    return ourInstance.mapper.createArrayNode();
  }

  private JsonUtil() {
    mapper =
        JsonMapper.builder()
            .addModule(new AfterburnerModule())
            .addModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(Feature.ALLOW_UNQUOTED_CONTROL_CHARS, true)
            .build();
  }
}
