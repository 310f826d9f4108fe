package com.github.spud.sage.domain.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

/**
 * 工具注册中心 工具名 → 处理器的显式分发表
 */
@Slf4j
@Component
public class ToolRegistry {

  /**
   * 工具名 -> 处理器（保持注册顺序）
   */
  private final Map<String, FixFinderTool> tools = new LinkedHashMap<>();

  public ToolRegistry(List<FixFinderTool> tools) {
    tools.forEach(this::register);
  }

  private void register(FixFinderTool tool) {
    log.info("Registering tool: {}", tool.name());
    FixFinderTool previous = tools.putIfAbsent(tool.name(), tool);
    if (previous != null) {
      throw new IllegalStateException("Duplicate tool name: " + tool.name());
    }
  }

  public Optional<FixFinderTool> getTool(String toolName) {
    return Optional.ofNullable(tools.get(toolName));
  }

  /**
   * 获取"无操作"工具回调 模型只看到工具定义并输出 tool_calls，实际执行由 {@link ToolExecutionService} 完成
   */
  public List<ToolCallback> getNoOpCallbacks() {
    return tools.values().stream()
      .map(tool -> new NoOpToolCallback(tool.definition()))
      .collect(Collectors.toList());
  }

  /**
   * 无操作工具回调包装器
   */
  private static class NoOpToolCallback implements ToolCallback {

    private final ToolDefinition definition;

    NoOpToolCallback(ToolDefinition definition) {
      this.definition = definition;
    }

    @Override
    public ToolDefinition getToolDefinition() {
      return definition;
    }

    @Override
    public String call(String toolInput) {
      // 占位返回，不执行实际逻辑
      return "[PENDING_EXECUTION]";
    }
  }
}
