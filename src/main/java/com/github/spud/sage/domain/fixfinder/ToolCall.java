package com.github.spud.sage.domain.fixfinder;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * 一次已执行的工具调用，resultSummary 已截断
 */
@Value
@Builder
public class ToolCall {

  String toolName;

  Map<String, Object> arguments;

  String resultSummary;

  boolean success;
}
