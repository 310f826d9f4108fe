package com.github.spud.sage.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.springframework.boot.json.AbstractJsonParser;
import org.springframework.boot.json.JsonParseException;

/**
 * Jackson 工具类，解析失败统一抛出 {@link JsonParseException}
 */
public class JsonUtils extends AbstractJsonParser {

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private static final JsonUtils INSTANCE = new JsonUtils();

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {
  };

  public static ObjectMapper objectMapper() {
    return objectMapper;
  }

  public static JsonNode readTree(String json) {
    return INSTANCE.tryParse(() -> objectMapper.readTree(json), Exception.class);
  }

  private static <T> T fromJson(String json, TypeReference<T> typeReference) {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json, typeReference), Exception.class);
  }

  public static Map<String, Object> toMap(JsonNode node) {
    return INSTANCE.tryParse(() -> objectMapper.convertValue(node, MAP_TYPE), Exception.class);
  }

  @Override
  public Map<String, Object> parseMap(String json) throws JsonParseException {
    return fromJson(json, MAP_TYPE);
  }

  @Override
  public List<Object> parseList(String json) throws JsonParseException {
    return fromJson(json, LIST_TYPE);
  }
}
