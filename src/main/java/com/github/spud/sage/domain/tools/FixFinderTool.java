package com.github.spud.sage.domain.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sage.domain.fixfinder.FixFinderContext;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * ReAct 循环可调度的工具
 */
public interface FixFinderTool {

  ToolDefinition definition();

  /**
   * May throw; failures are folded into the tool result by {@link ToolExecutionService}
   */
  ToolOutcome execute(JsonNode arguments, FixFinderContext ctx);

  default String name() {
    return definition().name();
  }
}
