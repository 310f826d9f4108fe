package com.github.spud.sage.domain.fixfinder.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sage.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 最终分析载荷解析器 容错解析模型输出的 JSON
 * <p>
 * 去除 markdown 代码块，截取第一个 '{' 到最后一个 '}'；任何失败都返回空对象，从不抛出
 */
@Slf4j
@Component
public class FinalPayloadParser {

  private static final String FENCE = "```";

  public ObjectNode parse(String text) {
    if (text == null || text.isBlank()) {
      return empty();
    }
    String candidate = stripCodeFence(text);

    int start = candidate.indexOf('{');
    int end = candidate.lastIndexOf('}');
    if (start < 0 || end <= start) {
      log.debug("No JSON object found in final analysis text");
      return empty();
    }

    try {
      JsonNode node = JsonUtils.readTree(candidate.substring(start, end + 1));
      if (node instanceof ObjectNode objectNode) {
        return objectNode;
      }
      log.warn("Final analysis JSON is not an object: {}", node.getNodeType());
    } catch (RuntimeException e) {
      log.warn("Failed to parse final analysis as JSON: {}", e.getMessage());
    }
    return empty();
  }

  /**
   * Keeps the fenced lines, plus unfenced lines that open an object
   */
  static String stripCodeFence(String text) {
    if (!text.contains(FENCE)) {
      return text;
    }
    StringBuilder sb = new StringBuilder();
    boolean inBlock = false;
    for (String line : text.split("\n", -1)) {
      if (line.strip().startsWith(FENCE)) {
        inBlock = !inBlock;
        continue;
      }
      if (inBlock || line.strip().startsWith("{")) {
        sb.append(line).append('\n');
      }
    }
    return sb.toString();
  }

  private static ObjectNode empty() {
    return JsonUtils.objectMapper().createObjectNode();
  }
}
