package com.github.spud.sage.domain.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sage.domain.fixfinder.FixFinderContext;
import com.github.spud.sage.util.JsonUtils;
import java.util.Map;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 工具执行服务 统一捕获异常，失败写入工具结果文本，从不向循环抛出
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolExecutionService {

  private final ToolRegistry toolRegistry;

  /**
   * 执行工具调用
   */
  public ToolExecutionResult execute(String toolName, String arguments, FixFinderContext ctx) {
    long startTime = System.currentTimeMillis();
    JsonNode args = JsonUtils.objectMapper().createObjectNode();

    try {
      FixFinderTool tool = toolRegistry.getTool(toolName)
        .orElseThrow(() -> new ToolNotFoundException("Tool not found: " + toolName));

      if (StringUtils.hasText(arguments)) {
        args = JsonUtils.readTree(arguments);
      }

      log.debug("Executing tool: {} with args: {}", toolName, arguments);
      ToolOutcome outcome = tool.execute(args, ctx);

      long duration = System.currentTimeMillis() - startTime;
      log.debug("Tool {} completed in {}ms", toolName, duration);

      return ToolExecutionResult.builder()
        .toolName(toolName)
        .arguments(toArgumentMap(args))
        .outcome(outcome)
        .success(true)
        .durationMs(duration)
        .build();

    } catch (ToolNotFoundException e) {
      log.error("Tool not found: {}", toolName);
      return failure(toolName, args, e.getMessage(), startTime);

    } catch (Exception e) {
      log.error("Tool execution failed: {} - {}", toolName, e.getMessage(), e);
      return failure(toolName, args, toolName + " failed: " + e.getMessage(), startTime);
    }
  }

  private static ToolExecutionResult failure(String toolName, JsonNode args, String message,
    long startTime) {
    return ToolExecutionResult.builder()
      .toolName(toolName)
      .arguments(toArgumentMap(args))
      .outcome(ToolOutcome.of(message))
      .success(false)
      .error(message)
      .durationMs(System.currentTimeMillis() - startTime)
      .build();
  }

  private static Map<String, Object> toArgumentMap(JsonNode args) {
    if (args == null || !args.isObject()) {
      return Map.of();
    }
    try {
      return JsonUtils.toMap(args);
    } catch (RuntimeException e) {
      log.debug("Tool arguments not convertible to a map: {}", e.getMessage());
      return Map.of();
    }
  }

  /**
   * 工具执行结果
   */
  @Value
  @Builder
  public static class ToolExecutionResult {

    String toolName;
    Map<String, Object> arguments;
    ToolOutcome outcome;
    boolean success;
    String error;
    long durationMs;

    public String summary() {
      return outcome != null && outcome.getSummary() != null ? outcome.getSummary() : "";
    }
  }

  /**
   * 工具未找到异常
   */
  public static class ToolNotFoundException extends RuntimeException {

    public ToolNotFoundException(String message) {
      super(message);
    }
  }
}
